package com.crypto.connector.common.exchange;

import com.crypto.connector.common.model.ExchangeException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class ConnectionRegistry {
    private final Map<String, StoredConnection> connections = new ConcurrentHashMap<>();

    public void save(StoredConnection connection) {
        connections.put(connection.id, connection);
    }

    public Optional<StoredConnection> find(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(connections.get(id));
    }

    public StoredConnection require(String id) {
        return find(id).orElseThrow(() -> new ExchangeException("Unknown connection: " + id));
    }

    public boolean remove(String id) {
        return id != null && connections.remove(id) != null;
    }

    public List<StoredConnection> list() {
        List<StoredConnection> all = new ArrayList<>(connections.values());
        all.sort(Comparator.comparing((StoredConnection c) -> c.createdAt).thenComparing(c -> c.id));
        return all;
    }
}
