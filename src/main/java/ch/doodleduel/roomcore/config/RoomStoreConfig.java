package ch.doodleduel.roomcore.config;

import ch.doodleduel.roomcore.repository.ArtifactStore;
import ch.doodleduel.roomcore.repository.InMemoryArtifactStore;
import ch.doodleduel.roomcore.repository.InMemoryRoomStore;
import ch.doodleduel.roomcore.repository.RoomStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the stores and the clock.
 *
 * <p>With {@code doodleduel.store.type=memory} (the default) both stores live in process memory.
 * A client shell that talks to a remote store registers its own {@link RoomStore} and
 * {@link ArtifactStore} beans and sets the property to something else.
 */
@Slf4j
@Configuration
public class RoomStoreConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "doodleduel.store.type", havingValue = "memory", matchIfMissing = true)
    public RoomStore roomStore(ObjectMapper objectMapper) {
        log.info("Using in-memory room store");
        return new InMemoryRoomStore(objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "doodleduel.store.type", havingValue = "memory", matchIfMissing = true)
    public ArtifactStore artifactStore() {
        return new InMemoryArtifactStore();
    }
}
