package io.voterelay.storage;

import io.voterelay.model.DelegationEdge;
import io.voterelay.model.EndReason;
import io.voterelay.model.HistoryEntry;
import io.voterelay.model.SignerId;
import io.voterelay.model.UpstreamCounts;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * SQLite-backed store. Each call opens its own connection unless it runs
 * inside {@link #atomically(Supplier)}, where every statement shares one
 * transaction bound to the calling thread.
 */
public final class SqliteDelegationStore implements DelegationStore {
    private final Database database;
    private final String namespace;
    private final int historyCapacity;
    private final ThreadLocal<Connection> bound = new ThreadLocal<>();

    public SqliteDelegationStore(Database database, int historyCapacity) {
        if (historyCapacity < 1) {
            throw new IllegalArgumentException("historyCapacity must be positive, got " + historyCapacity);
        }
        this.database = database;
        this.namespace = database.namespace();
        this.historyCapacity = historyCapacity;
    }

    @Override
    public Optional<DelegationEdge> getActive(SignerId delegator) {
        String sql = "SELECT delegation_id,delegate,expiry,created_at FROM active_delegations WHERE namespace=? AND delegator=?";
        return withConnection("read active delegation", c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, namespace);
                ps.setString(2, delegator.value());
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) return Optional.empty();
                    long expiry = rs.getLong("expiry");
                    Long expiryOrNull = rs.wasNull() ? null : expiry;
                    return Optional.of(new DelegationEdge(
                            rs.getLong("delegation_id"),
                            delegator,
                            new SignerId(rs.getString("delegate")),
                            expiryOrNull,
                            rs.getLong("created_at"),
                            true
                    ));
                }
            }
        });
    }

    @Override
    public void putActive(SignerId delegator, DelegationEdge edge) {
        String sql = """
                INSERT INTO active_delegations(namespace,delegator,delegation_id,delegate,expiry,created_at)
                VALUES(?,?,?,?,?,?)
                ON CONFLICT(namespace,delegator) DO UPDATE SET
                    delegation_id=excluded.delegation_id,
                    delegate=excluded.delegate,
                    expiry=excluded.expiry,
                    created_at=excluded.created_at
                """;
        withConnection("write active delegation", c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, namespace);
                ps.setString(2, delegator.value());
                ps.setLong(3, edge.delegationId());
                ps.setString(4, edge.delegate().value());
                if (edge.expiry() == null) {
                    ps.setNull(5, Types.INTEGER);
                } else {
                    ps.setLong(5, edge.expiry());
                }
                ps.setLong(6, edge.createdAt());
                ps.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public void clearActive(SignerId delegator) {
        withConnection("clear active delegation", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "DELETE FROM active_delegations WHERE namespace=? AND delegator=?")) {
                ps.setString(1, namespace);
                ps.setString(2, delegator.value());
                ps.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public void appendHistory(SignerId delegator, HistoryEntry entry) {
        withConnection("append delegation history", c -> {
            try (PreparedStatement ins = c.prepareStatement(
                    "INSERT INTO delegation_history(namespace,delegator,delegation_id,delegate,created_at,ended_at,ended_reason) VALUES(?,?,?,?,?,?,?)");
                 PreparedStatement evict = c.prepareStatement("""
                         DELETE FROM delegation_history
                         WHERE namespace=? AND delegator=? AND seq NOT IN (
                             SELECT seq FROM delegation_history
                             WHERE namespace=? AND delegator=?
                             ORDER BY seq DESC LIMIT ?
                         )
                         """)) {
                ins.setString(1, namespace);
                ins.setString(2, delegator.value());
                ins.setLong(3, entry.delegationId());
                ins.setString(4, entry.delegate().value());
                ins.setLong(5, entry.createdAt());
                if (entry.endedAt() == null) {
                    ins.setNull(6, Types.INTEGER);
                } else {
                    ins.setLong(6, entry.endedAt());
                }
                ins.setString(7, entry.endedReason().name());
                ins.executeUpdate();

                evict.setString(1, namespace);
                evict.setString(2, delegator.value());
                evict.setString(3, namespace);
                evict.setString(4, delegator.value());
                evict.setInt(5, historyCapacity);
                evict.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public List<HistoryEntry> getHistory(SignerId delegator) {
        String sql = "SELECT delegation_id,delegate,created_at,ended_at,ended_reason FROM delegation_history "
                + "WHERE namespace=? AND delegator=? ORDER BY seq DESC LIMIT ?";
        return withConnection("read delegation history", c -> {
            List<HistoryEntry> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, namespace);
                ps.setString(2, delegator.value());
                ps.setInt(3, historyCapacity);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        long endedAt = rs.getLong("ended_at");
                        Long endedAtOrNull = rs.wasNull() ? null : endedAt;
                        out.add(new HistoryEntry(
                                rs.getLong("delegation_id"),
                                delegator,
                                new SignerId(rs.getString("delegate")),
                                rs.getLong("created_at"),
                                endedAtOrNull,
                                EndReason.valueOf(rs.getString("ended_reason"))
                        ));
                    }
                }
            }
            return List.copyOf(out);
        });
    }

    @Override
    public long nextDelegationId() {
        return withConnection("allocate delegation id", c -> {
            try (PreparedStatement up = c.prepareStatement("""
                    INSERT INTO delegation_ids(namespace,last_id) VALUES(?,1)
                    ON CONFLICT(namespace) DO UPDATE SET last_id=last_id+1
                    """);
                 PreparedStatement sel = c.prepareStatement("SELECT last_id FROM delegation_ids WHERE namespace=?")) {
                up.setString(1, namespace);
                up.executeUpdate();
                sel.setString(1, namespace);
                try (ResultSet rs = sel.executeQuery()) {
                    if (!rs.next()) {
                        throw new IllegalStateException("delegation id counter missing for namespace " + namespace);
                    }
                    return rs.getLong(1);
                }
            }
        });
    }

    @Override
    public int historyCapacity() {
        return historyCapacity;
    }

    @Override
    public UpstreamCounts getUpstream(SignerId signer) {
        String sql = "SELECT distance,count FROM upstream_counts WHERE namespace=? AND signer=? ORDER BY distance";
        return withConnection("read upstream counts", c -> {
            List<int[]> rows = new ArrayList<>();
            int maxDistance = 0;
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, namespace);
                ps.setString(2, signer.value());
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        int distance = rs.getInt("distance");
                        rows.add(new int[]{distance, rs.getInt("count")});
                        maxDistance = Math.max(maxDistance, distance);
                    }
                }
            }
            int[] byDistance = new int[maxDistance];
            for (int[] row : rows) {
                byDistance[row[0] - 1] = row[1];
            }
            return UpstreamCounts.of(byDistance);
        });
    }

    @Override
    public void putUpstream(SignerId signer, UpstreamCounts counts) {
        withConnection("write upstream counts", c -> {
            try (PreparedStatement del = c.prepareStatement(
                    "DELETE FROM upstream_counts WHERE namespace=? AND signer=?");
                 PreparedStatement ins = c.prepareStatement(
                         "INSERT INTO upstream_counts(namespace,signer,distance,count) VALUES(?,?,?,?)")) {
                del.setString(1, namespace);
                del.setString(2, signer.value());
                del.executeUpdate();
                int[] byDistance = counts == null ? new int[0] : counts.toArray();
                for (int i = 0; i < byDistance.length; i++) {
                    if (byDistance[i] == 0) {
                        continue;
                    }
                    ins.setString(1, namespace);
                    ins.setString(2, signer.value());
                    ins.setInt(3, i + 1);
                    ins.setInt(4, byDistance[i]);
                    ins.executeUpdate();
                }
            }
            return null;
        });
    }

    @Override
    public <T> T atomically(Supplier<T> work) {
        if (bound.get() != null) {
            return work.get();
        }
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            bound.set(c);
            try {
                T out = work.get();
                c.commit();
                return out;
            } catch (RuntimeException | Error e) {
                c.rollback();
                throw e;
            } finally {
                // Auto-commit stays off; closing the connection discards an unfinished transaction.
                bound.remove();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to run delegation transaction", e);
        }
    }

    private <T> T withConnection(String action, SqlWork<T> work) {
        Connection shared = bound.get();
        try {
            if (shared != null) {
                return work.apply(shared);
            }
            try (Connection c = database.openConnection()) {
                return work.apply(c);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to " + action, e);
        }
    }

    @FunctionalInterface
    private interface SqlWork<T> {
        T apply(Connection c) throws SQLException;
    }
}
