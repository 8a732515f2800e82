package ch.doodleduel.roomcore.repository;

import ch.doodleduel.roomcore.exception.TransientStoreException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link RoomStore} kept in process memory.
 *
 * <p>Used for local play, development and tests. The data is one Jackson object tree; null
 * fields are never stored. Behaves like the remote store the clients share: snapshots are copies, notifications carry the full current value of the
 * subscribed key, and they are delivered one at a time in write order. A write issued from
 * inside a listener is queued behind the running notification instead of recursing, which
 * mirrors the single-threaded event loop every client runs.
 *
 * <p>{@link #setOnline(boolean)} simulates a lost connection: every operation then fails with
 * {@link TransientStoreException}.
 */
@Slf4j
public class InMemoryRoomStore implements RoomStore {

    private static final TypeReference<Map<String, Object>> RECORD_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final ObjectNode root;
    private final List<Registration> registrations = new CopyOnWriteArrayList<>();

    private final Deque<Runnable> pendingNotifications = new ArrayDeque<>();
    private boolean dispatching;

    private volatile boolean online = true;

    public InMemoryRoomStore() {
        this(new ObjectMapper());
    }

    public InMemoryRoomStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.root = objectMapper.createObjectNode();
    }

    public void setOnline(boolean online) {
        this.online = online;
        log.debug("In-memory store is now {}", online ? "online" : "offline");
    }

    @Override
    public void create(String key, Map<String, Object> record) {
        List<Runnable> notifications;
        synchronized (root) {
            ensureOnline();
            String[] path = split(key);
            if (!getNode(path).isMissingNode()) {
                throw new RecordAlreadyExistsException(key);
            }
            setNode(path, toNode(record));
            notifications = collectNotifications(path);
        }
        dispatch(notifications);
    }

    @Override
    public void patch(String key, Map<String, Object> partialFields) {
        List<Runnable> notifications;
        synchronized (root) {
            ensureOnline();
            String[] path = split(key);
            if (!getNode(path).isObject()) {
                throw new RecordNotFoundException(key);
            }
            for (Map.Entry<String, Object> field : partialFields.entrySet()) {
                String[] fieldPath = concat(path, split(field.getKey()));
                setNode(fieldPath, toNode(field.getValue()));
            }
            notifications = collectNotifications(path);
        }
        dispatch(notifications);
    }

    @Override
    public Subscription subscribe(String keyPrefix, SnapshotListener listener) {
        Registration registration = new Registration(split(keyPrefix), listener);
        Runnable initial;
        synchronized (root) {
            ensureOnline();
            registrations.add(registration);
            initial = registration.notification(snapshotOf(registration.path));
        }
        dispatch(List.of(initial));
        return () -> {
            registration.active = false;
            registrations.remove(registration);
        };
    }

    @Override
    public void delete(String key) {
        List<Runnable> notifications;
        synchronized (root) {
            ensureOnline();
            String[] path = split(key);
            if (getNode(path).isMissingNode()) {
                return;
            }
            setNode(path, null);
            notifications = collectNotifications(path);
        }
        dispatch(notifications);
    }

    @Override
    public Optional<Map<String, Object>> readOnce(String key) {
        synchronized (root) {
            ensureOnline();
            return Optional.ofNullable(snapshotOf(split(key)));
        }
    }

    // ----------------- helpers -----------------

    private void ensureOnline() {
        if (!online) {
            throw new TransientStoreException("Room store is offline");
        }
    }

    private List<Runnable> collectNotifications(String[] changedPath) {
        List<Runnable> notifications = new ArrayList<>();
        for (Registration registration : registrations) {
            if (overlaps(registration.path, changedPath)) {
                notifications.add(registration.notification(snapshotOf(registration.path)));
            }
        }
        return notifications;
    }

    private void dispatch(List<Runnable> notifications) {
        synchronized (pendingNotifications) {
            pendingNotifications.addAll(notifications);
            if (dispatching) {
                return;
            }
            dispatching = true;
        }
        while (true) {
            Runnable next;
            synchronized (pendingNotifications) {
                next = pendingNotifications.poll();
                if (next == null) {
                    dispatching = false;
                    return;
                }
            }
            try {
                next.run();
            } catch (RuntimeException e) {
                log.warn("Snapshot listener failed: {}", e.getMessage(), e);
            }
        }
    }

    private Map<String, Object> snapshotOf(String[] path) {
        JsonNode node = getNode(path);
        return node.isObject() ? objectMapper.convertValue(node, RECORD_TYPE) : null;
    }

    private JsonNode getNode(String[] path) {
        JsonNode current = root;
        for (String segment : path) {
            current = current.path(segment);
        }
        return current;
    }

    /**
     * Sets or, for a null value, removes the node at the path. Missing parents are created on set only.
     */
    private void setNode(String[] path, JsonNode value) {
        ObjectNode current = root;
        for (int i = 0; i < path.length - 1; i++) {
            if (current.get(path[i]) instanceof ObjectNode child) {
                current = child;
            } else if (value == null) {
                return;
            } else {
                current = current.putObject(path[i]);
            }
        }
        String leaf = path[path.length - 1];
        if (value == null) {
            current.remove(leaf);
        } else {
            current.set(leaf, value);
        }
    }

    private JsonNode toNode(Object value) {
        if (value == null) {
            return null;
        }
        JsonNode node = objectMapper.valueToTree(value);
        removeNullFields(node);
        return node;
    }

    private static void removeNullFields(JsonNode node) {
        if (node instanceof ObjectNode object) {
            object.properties().removeIf(field -> field.getValue().isNull());
        }
        node.forEach(InMemoryRoomStore::removeNullFields);
    }

    private static boolean overlaps(String[] a, String[] b) {
        int common = Math.min(a.length, b.length);
        for (int i = 0; i < common; i++) {
            if (!a[i].equals(b[i])) {
                return false;
            }
        }
        return true;
    }

    private static String[] split(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Store key must not be blank");
        }
        return Arrays.stream(key.split("/"))
                .filter(segment -> !segment.isEmpty())
                .toArray(String[]::new);
    }

    private static String[] concat(String[] a, String[] b) {
        String[] result = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, result, a.length, b.length);
        return result;
    }

    private static final class Registration {
        private final String[] path;
        private final SnapshotListener listener;
        private volatile boolean active = true;

        private Registration(String[] path, SnapshotListener listener) {
            this.path = path;
            this.listener = listener;
        }

        private Runnable notification(Map<String, Object> snapshot) {
            return () -> {
                if (active) {
                    listener.onSnapshot(snapshot);
                }
            };
        }
    }
}
