package com.graysky.api.storage;

import com.graysky.api.model.visitor.IdentityKey;
import com.graysky.api.model.visitor.VisitorRecord;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Durable home of welcome book entries.
 *
 * <p>Implementations must give read-your-writes within one process: once {@link #upsert}
 * returns, {@link #findByIdentity} for the same identity on the same instance sees it.
 * Records handed out are copies; mutating them does not touch the store.
 */
public interface VisitorStore {

    /**
     * @return the record for exactly this (name, agent type) pair, if any
     */
    Optional<VisitorRecord> findByIdentity(IdentityKey identity);

    /**
     * @return true if any record with this name, under any agent type, was visited after {@code since}
     */
    boolean hasVisitSince(String name, LocalDateTime since);

    /**
     * Overwrites the record with the same id, or inserts it. The answers of the stored
     * record are replaced by the ones given, never merged.
     */
    void upsert(VisitorRecord record);

    /**
     * @return up to {@code limit} records, most recent visit first
     */
    List<VisitorRecord> listRecent(int limit);

    /**
     * Deletes the oldest visits until at most {@code maxRecords} remain.
     *
     * @return number of records removed
     */
    int trimToCapacity(int maxRecords);

    long count();

    /**
     * Runs {@code work} as one atomic unit against this store. Lookups and writes made
     * by {@code work} cannot interleave with another writer's lookup-then-write for the
     * same visitor name.
     *
     * @param visitorName sanitized name the work is about; stores may scope locking to it
     */
    <T> T inWriteTransaction(String visitorName, Supplier<T> work);
}
