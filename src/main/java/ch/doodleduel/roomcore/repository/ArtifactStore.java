package ch.doodleduel.roomcore.repository;

import java.util.List;

/**
 * Blob storage holding the uploaded drawings.
 *
 * <p>Artifacts of a room live beneath {@code drawings/{roomCode}/}. Size and content-type limits
 * are enforced here, at the storage boundary, not by the room services.
 */
public interface ArtifactStore {

    String DRAWINGS_PREFIX = "drawings/";

    /**
     * Stores an artifact.
     *
     * @param path artifact path
     * @param content raw bytes
     * @param contentType MIME type, must be an image type
     * @return opaque reference that can be stored in a {@code DrawingRef}
     */
    String put(String path, byte[] content, String contentType);

    /**
     * Lists artifact paths starting with the given prefix.
     *
     * @param prefix path prefix
     * @return matching paths, possibly empty
     */
    List<String> list(String prefix);

    /**
     * Deletes an artifact. Deleting an absent artifact succeeds.
     *
     * @param path artifact path
     */
    void delete(String path);

    static String roomPrefix(String roomCode) {
        return DRAWINGS_PREFIX + roomCode + "/";
    }

    static String drawingPath(String roomCode, String playerId, int round) {
        return roomPrefix(roomCode) + playerId + "_round" + round + ".png";
    }

    /**
     * Extracts the room code of an artifact path.
     *
     * @param path artifact path
     * @return room code, or null if the path is not below {@link #DRAWINGS_PREFIX}
     */
    static String roomCodeOf(String path) {
        if (path == null || !path.startsWith(DRAWINGS_PREFIX)) {
            return null;
        }
        String rest = path.substring(DRAWINGS_PREFIX.length());
        int slash = rest.indexOf('/');
        return slash <= 0 ? null : rest.substring(0, slash);
    }
}
