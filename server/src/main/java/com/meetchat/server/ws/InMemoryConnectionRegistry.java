package com.meetchat.server.ws;

import com.meetchat.server.model.ConnectedUser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Process-local registry: meeting to connection ids, connection id to user.
 *
 * <p>When a user who is already registered in a meeting joins again from a different connection
 * (a reconnect that raced the old socket's close), the registration moves to the new connection
 * silently. The caller still sees a no-op, so nothing is announced twice, but fan-out reaches the
 * live socket.</p>
 */
public class InMemoryConnectionRegistry implements ConnectionRegistry {
    private static final Logger log = LoggerFactory.getLogger(InMemoryConnectionRegistry.class);

    private final Map<String, Set<String>> rooms = new ConcurrentHashMap<>();
    private final Map<String, ConnectedUser> connections = new ConcurrentHashMap<>();

    @Override
    public Optional<ConnectedUser> join(String connectionId, String meetingId, String userId, String userName) {
        ConnectedUser existing = findByUser(meetingId, userId);
        if (existing != null) {
            if (!existing.connectionId().equals(connectionId)) {
                rebind(existing, connectionId);
            }
            return Optional.empty();
        }
        ConnectedUser user = new ConnectedUser(connectionId, userId, userName, meetingId);
        connections.put(connectionId, user);
        rooms.computeIfAbsent(meetingId, k -> new CopyOnWriteArraySet<>()).add(connectionId);
        return Optional.of(user);
    }

    @Override
    public Optional<ConnectedUser> leave(String connectionId) {
        ConnectedUser user = connections.remove(connectionId);
        if (user == null) return Optional.empty();
        removeFromRoom(user.meetingId(), connectionId);
        return Optional.of(user);
    }

    @Override
    public Optional<ConnectedUser> find(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    @Override
    public List<ConnectedUser> listConnections(String meetingId) {
        Set<String> ids = rooms.getOrDefault(meetingId, Set.of());
        List<ConnectedUser> out = new ArrayList<>(ids.size());
        for (String id : ids) {
            ConnectedUser u = connections.get(id);
            if (u != null) out.add(u);
        }
        return out;
    }

    @Override
    public boolean isConnected(String meetingId, String userId) {
        return findByUser(meetingId, userId) != null;
    }

    @Override
    public int meetingCount() {
        return rooms.size();
    }

    private ConnectedUser findByUser(String meetingId, String userId) {
        for (ConnectedUser u : listConnections(meetingId)) {
            if (Objects.equals(u.userId(), userId)) return u;
        }
        return null;
    }

    private void rebind(ConnectedUser existing, String connectionId) {
        connections.remove(existing.connectionId());
        removeFromRoom(existing.meetingId(), existing.connectionId());
        ConnectedUser moved = new ConnectedUser(connectionId, existing.userId(), existing.userName(), existing.meetingId());
        connections.put(connectionId, moved);
        rooms.computeIfAbsent(existing.meetingId(), k -> new CopyOnWriteArraySet<>()).add(connectionId);
        log.info("[REBIND] meeting={} user={} {} -> {}", existing.meetingId(), existing.userId(),
                existing.connectionId(), connectionId);
    }

    private void removeFromRoom(String meetingId, String connectionId) {
        Set<String> set = rooms.get(meetingId);
        if (set != null) {
            set.remove(connectionId);
            if (set.isEmpty()) rooms.remove(meetingId);
        }
    }
}
