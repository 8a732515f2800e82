package ch.doodleduel.roomcore.repository;

import ch.doodleduel.roomcore.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * {@link ArtifactStore} kept in process memory, for local play and tests.
 */
@Slf4j
public class InMemoryArtifactStore implements ArtifactStore {

    public static final int MAX_ARTIFACT_BYTES = 5 * 1024 * 1024;

    private final Map<String, byte[]> artifacts = new ConcurrentSkipListMap<>();

    @Override
    public String put(String path, byte[] content, String contentType) {
        if (content == null || content.length == 0 || content.length > MAX_ARTIFACT_BYTES) {
            throw new ValidationException("Artifact must contain between 1 and " + MAX_ARTIFACT_BYTES + " bytes");
        }
        if (contentType == null || !contentType.startsWith("image/")) {
            throw new ValidationException("Artifact must be an image, got " + contentType);
        }
        artifacts.put(path, content.clone());
        log.debug("Stored artifact {} ({} bytes)", path, content.length);
        return "memory://" + path;
    }

    @Override
    public List<String> list(String prefix) {
        return artifacts.keySet().stream()
                .filter(path -> path.startsWith(prefix))
                .toList();
    }

    @Override
    public void delete(String path) {
        artifacts.remove(path);
    }
}
