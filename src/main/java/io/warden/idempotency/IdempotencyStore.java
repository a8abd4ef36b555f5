package io.warden.idempotency;

import io.warden.model.IdempotencyRecord;

import java.util.Optional;

/**
 * Key to result cache that keeps a side-effecting task from running twice. Implementations are
 * shared across engines and must tolerate concurrent callers: when two callers race to insert the
 * same key exactly one wins, and both observe the key as present afterwards.
 */
public interface IdempotencyStore {
    boolean contains(String key);

    Optional<IdempotencyRecord> get(String key);

    /**
     * Inserts {@code record} under {@code key} unless the key is already present.
     *
     * @return true when this call stored the record
     */
    boolean put(String key, IdempotencyRecord record);
}
