package ch.doodleduel.roomcore.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * {@link IdentityProvider} backed by a configured installation id.
 *
 * <p>The client shell passes the id it got from anonymous sign-in via
 * {@code doodleduel.identity.player-id}. Without one, a random id is generated once per process.
 */
@Slf4j
@Component
public class InstallationIdentityProvider implements IdentityProvider {

    private final String playerId;

    public InstallationIdentityProvider(@Value("${doodleduel.identity.player-id:}") String configuredId) {
        if (configuredId == null || configuredId.isBlank()) {
            this.playerId = UUID.randomUUID().toString();
            log.info("No installation id configured, using generated id {}", playerId);
        } else {
            this.playerId = configuredId.trim();
        }
    }

    @Override
    public String currentPlayerId() {
        return playerId;
    }
}
