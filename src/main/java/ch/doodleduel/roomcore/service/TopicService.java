package ch.doodleduel.roomcore.service;

import ch.doodleduel.roomcore.repository.RoomStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * {@link TopicCatalog} reading the themed topic lists from the shared store.
 *
 * <p>Topics are cached in this instance and refreshed once the cache is older than
 * {@code doodleduel.topics.cache-ttl-hours}. When the store has no topics or cannot be reached,
 * the built-in list is used. The last handed out topic is remembered to avoid repeating it.
 */
@Slf4j
@Service
public class TopicService implements TopicCatalog {

    public static final String TOPICS_KEY = "topics";
    private static final int MAX_PICK_ATTEMPTS = 10;

    static final List<String> FALLBACK_TOPICS = List.of(
            "Cat", "Dog", "House", "Tree", "Sun", "Car", "Fish", "Flower",
            "Pizza", "Rocket", "Robot", "Dragon", "Castle", "Guitar", "Penguin", "Volcano",
            "Lighthouse", "Snowman", "Pirate ship", "Rainbow", "Cactus", "Astronaut",
            "Hot air balloon", "Octopus", "Treasure chest", "Campfire", "Windmill", "Unicorn"
    );

    private final RoomStore roomStore;
    private final Clock clock;
    private final Duration cacheTtl;

    private List<String> cachedTopics = FALLBACK_TOPICS;
    private Instant loadedAt;
    private String lastTopic = "";

    public TopicService(RoomStore roomStore,
                        Clock clock,
                        @Value("${doodleduel.topics.cache-ttl-hours:24}") long cacheTtlHours) {
        this.roomStore = roomStore;
        this.clock = clock;
        this.cacheTtl = Duration.ofHours(cacheTtlHours);
    }

    @Override
    public synchronized String nextTopic() {
        refreshIfStale();
        List<String> topics = cachedTopics;

        String topic;
        int attempts = 0;
        do {
            topic = topics.get(ThreadLocalRandom.current().nextInt(topics.size()));
            attempts++;
        } while (topic.equals(lastTopic) && topics.size() > 1 && attempts < MAX_PICK_ATTEMPTS);

        lastTopic = topic;
        return topic;
    }

    /**
     * Drops the cache so that the next call reloads from the store.
     */
    public synchronized void invalidate() {
        loadedAt = null;
    }

    // ----------------- helpers -----------------

    private void refreshIfStale() {
        Instant now = clock.instant();
        if (loadedAt != null && loadedAt.plus(cacheTtl).isAfter(now)) {
            return;
        }
        loadedAt = now;
        try {
            List<String> loaded = roomStore.readOnce(TOPICS_KEY)
                    .map(TopicService::flattenThemes)
                    .orElse(List.of());
            if (loaded.isEmpty()) {
                log.debug("No topics in store, keeping {} cached topics", cachedTopics.size());
                return;
            }
            cachedTopics = loaded;
            log.info("Loaded {} topics from store", loaded.size());
        } catch (RuntimeException e) {
            log.warn("Topic refresh failed, keeping {} cached topics: {}", cachedTopics.size(), e.getMessage());
        }
    }

    /**
     * Flattens {@code {themes: {key: {topics: [...]}}}} into one list.
     */
    private static List<String> flattenThemes(Map<String, Object> record) {
        List<String> topics = new ArrayList<>();
        if (!(record.get("themes") instanceof Map<?, ?> themes)) {
            return topics;
        }
        for (Object theme : themes.values()) {
            if (!(theme instanceof Map<?, ?> themeFields)) {
                continue;
            }
            Object rawTopics = themeFields.get("topics");
            // arrays may come back as index-keyed maps from the remote store
            Collection<?> values = rawTopics instanceof Map<?, ?> indexed ? indexed.values()
                    : rawTopics instanceof List<?> list ? list
                    : List.of();
            values.stream()
                    .filter(String.class::isInstance)
                    .map(String.class::cast)
                    .filter(t -> !t.isBlank())
                    .forEach(topics::add);
        }
        return topics;
    }
}
