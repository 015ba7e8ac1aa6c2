package com.outbound.routing.application.port.out;

import java.util.List;
import java.util.Optional;

import com.outbound.routing.domain.entity.EngagementSignal;
import com.outbound.routing.domain.valueobject.PlatformLevelCount;

/**
 * Secondary (outbound) port: per-lead aggregate persistence.
 * <p>
 * One aggregate per lead, unique by lead id and by email. Writes are
 * optimistic: the caller supplies the version it read and the store refuses
 * the write if another writer got there first.
 * </p>
 */
public interface SignalStore {

    Optional<EngagementSignal> findByLeadId(String leadId);

    /**
     * @param email normalized (lower-case) email
     */
    Optional<EngagementSignal> findByEmail(String email);

    /**
     * Writes the aggregate if its stored version still equals {@code expectedVersion}.
     * <p>
     * Version 0 means "not yet stored": the aggregate is inserted, and the write
     * fails if a row for the lead (or its email) already exists. On success the
     * stored version becomes {@code expectedVersion + 1}.
     * </p>
     *
     * @param signal          aggregate to store
     * @param expectedVersion version the caller read
     * @return false on a version conflict
     */
    boolean compareAndSet(EngagementSignal signal, long expectedVersion);

    /**
     * Keyset page ordered by lead id, used by the reconciliation sweep.
     *
     * @param afterLeadId exclusive cursor, null to start from the beginning
     * @param limit       page size
     */
    List<EngagementSignal> findPageAfter(String afterLeadId, int limit);

    List<PlatformLevelCount> countByPlatformAndLevel();

    long countAll();
}
