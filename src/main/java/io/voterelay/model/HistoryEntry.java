package io.voterelay.model;

public record HistoryEntry(
        long delegationId,
        SignerId delegator,
        SignerId delegate,
        long createdAt,
        Long endedAt,
        EndReason endedReason
) {
}
