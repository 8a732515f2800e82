package ch.doodleduel.roomcore.repository;

import ch.doodleduel.roomcore.domain.Room;
import ch.doodleduel.roomcore.domain.enums.RoomStatus;
import ch.doodleduel.roomcore.exception.RoomNotFoundException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Typed access to the {@code rooms/} subtree of the shared {@link RoomStore}.
 *
 * <p>Decodes records into {@link Room} snapshots and encodes patch values into the plain
 * map/scalar shape the store understands. Field names come from the domain classes, so the
 * record schema stays identical for every client version.
 */
@Slf4j
@Repository
public class RoomRepository {

    public static final String ROOMS = "rooms";

    private static final TypeReference<Map<String, Object>> RECORD_TYPE = new TypeReference<>() {
    };

    private final RoomStore roomStore;
    private final ObjectMapper objectMapper;

    public RoomRepository(RoomStore roomStore, ObjectMapper objectMapper) {
        this.roomStore = roomStore;
        this.objectMapper = objectMapper;
    }

    public Optional<Room> findByCode(String code) {
        return roomStore.readOnce(key(code)).map(this::toRoom);
    }

    public Room getByCode(String code) {
        return findByCode(code).orElseThrow(() -> new RoomNotFoundException(code));
    }

    public boolean exists(String code) {
        return roomStore.readOnce(key(code)).isPresent();
    }

    /**
     * Reads the creation time of every room without decoding the full records, so that a
     * malformed record can still be aged out.
     *
     * @return room code to {@code createdAt} (0 when missing or unreadable)
     */
    public Map<String, Long> findCreationTimes() {
        Map<String, Long> result = new LinkedHashMap<>();
        roomStore.readOnce(ROOMS).ifPresent(rooms -> rooms.forEach((code, record) -> {
            long createdAt = 0L;
            if (record instanceof Map<?, ?> fields && fields.get("createdAt") instanceof Number number) {
                createdAt = number.longValue();
            }
            result.put(code, createdAt);
        }));
        return result;
    }

    /**
     * Writes a new room record.
     *
     * @param room room to create
     * @throws RecordAlreadyExistsException if the code is already taken
     */
    public void create(Room room) {
        roomStore.create(key(room.getCode()), toRecord(room));
    }

    /**
     * Merges fields into a room. Values may be domain objects; they are encoded first.
     *
     * @param code room code
     * @param fields relative field paths to values
     * @throws RoomNotFoundException if the room no longer exists
     */
    public void patch(String code, Map<String, Object> fields) {
        Map<String, Object> encoded = new LinkedHashMap<>();
        fields.forEach((path, value) -> encoded.put(path, toStoreValue(value)));
        try {
            roomStore.patch(key(code), encoded);
        } catch (RecordNotFoundException e) {
            throw new RoomNotFoundException(code);
        }
    }

    public void delete(String code) {
        roomStore.delete(key(code));
    }

    /**
     * Subscribes to one room. The listener gets an empty optional once the room is deleted
     * and for records that cannot be decoded.
     *
     * @param code room code
     * @param listener receives a fresh snapshot per push
     * @return subscription handle
     */
    public RoomStore.Subscription subscribe(String code, Consumer<Optional<Room>> listener) {
        return roomStore.subscribe(key(code), value -> listener.accept(decodeQuietly(code, value)));
    }

    public Room toRoom(Map<String, Object> record) {
        return objectMapper.convertValue(record, Room.class);
    }

    public Map<String, Object> toRecord(Room room) {
        return objectMapper.convertValue(room, RECORD_TYPE);
    }

    // ----------------- helpers -----------------

    private Optional<Room> decodeQuietly(String code, Map<String, Object> value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(toRoom(value));
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring unreadable snapshot of room {}: {}", code, e.getMessage());
            return Optional.empty();
        }
    }

    private Object toStoreValue(Object value) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof RoomStatus status) {
            return status.getWireName();
        }
        return objectMapper.convertValue(value, RECORD_TYPE);
    }

    private static String key(String code) {
        return ROOMS + "/" + code;
    }
}
