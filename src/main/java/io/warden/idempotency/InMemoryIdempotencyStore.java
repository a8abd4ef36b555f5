package io.warden.idempotency;

import io.warden.model.IdempotencyRecord;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public final class InMemoryIdempotencyStore implements IdempotencyStore {
    private final ConcurrentMap<String, IdempotencyRecord> records = new ConcurrentHashMap<>();

    @Override
    public boolean contains(String key) {
        return key != null && records.containsKey(key);
    }

    @Override
    public Optional<IdempotencyRecord> get(String key) {
        return key == null ? Optional.empty() : Optional.ofNullable(records.get(key));
    }

    @Override
    public boolean put(String key, IdempotencyRecord record) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("idempotency key cannot be empty");
        }
        return records.putIfAbsent(key, record) == null;
    }

    public int size() {
        return records.size();
    }
}
