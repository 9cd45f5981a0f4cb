package io.sendshield.storage;

import io.sendshield.model.MessageKind;
import io.sendshield.model.MessagePayload;
import io.sendshield.model.MessageStatus;
import io.sendshield.model.Priority;
import io.sendshield.model.QueuedMessage;
import io.sendshield.model.SendOptions;
import io.sendshield.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Durable {@link MessageStore}. Claims are a conditional UPDATE on (status, attempts), so two
 * processes sharing the database file never both win the same message.
 */
public final class SqliteMessageStore implements MessageStore {
    private static final String COLUMNS =
            "id,account_id,recipient,kind,payload_json,options_json,priority_rank,attempts,max_attempts,"
                    + "enqueued_at_ms,next_eligible_at_ms,last_error,status,updated_at_ms";

    private final Database database;

    public SqliteMessageStore(Database database) {
        this.database = database;
    }

    @Override
    public void insert(QueuedMessage m) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "INSERT INTO queued_messages(" + COLUMNS + ") VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?,?)")) {
            ps.setString(1, m.id());
            ps.setString(2, m.accountId());
            ps.setString(3, m.recipient());
            ps.setString(4, m.kind().name());
            ps.setString(5, Jsons.toCompactJson(m.payload()));
            ps.setString(6, Jsons.toCompactJson(m.options()));
            ps.setInt(7, m.priority().rank());
            ps.setInt(8, m.attempts());
            ps.setInt(9, m.maxAttempts());
            ps.setLong(10, m.enqueuedAtMs());
            ps.setLong(11, m.nextEligibleAtMs());
            ps.setString(12, m.lastError());
            ps.setString(13, m.status().name());
            ps.setLong(14, m.updatedAtMs());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to insert message " + m.id(), e);
        }
    }

    @Override
    public Optional<QueuedMessage> find(String id) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM queued_messages WHERE id=?")) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(read(rs));
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to load message " + id, e);
        }
    }

    @Override
    public List<String> accountsWithPending() {
        List<String> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT account_id FROM queued_messages WHERE status=? GROUP BY account_id ORDER BY MIN(enqueued_at_ms), account_id")) {
            ps.setString(1, MessageStatus.PENDING.name());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(rs.getString(1));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StoreException("Failed to list accounts with pending messages", e);
        }
    }

    @Override
    public Optional<QueuedMessage> head(String accountId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT " + COLUMNS + " FROM queued_messages"
                             + " WHERE account_id=? AND status=?"
                             + " ORDER BY priority_rank ASC, enqueued_at_ms ASC, id ASC LIMIT 1")) {
            ps.setString(1, accountId);
            ps.setString(2, MessageStatus.PENDING.name());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(read(rs));
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to select head message for " + accountId, e);
        }
    }

    @Override
    public boolean compareAndSet(QueuedMessage expected, QueuedMessage next) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "UPDATE queued_messages SET attempts=?,next_eligible_at_ms=?,last_error=?,status=?,updated_at_ms=?"
                             + " WHERE id=? AND status=? AND attempts=?")) {
            ps.setInt(1, next.attempts());
            ps.setLong(2, next.nextEligibleAtMs());
            ps.setString(3, next.lastError());
            ps.setString(4, next.status().name());
            ps.setLong(5, next.updatedAtMs());
            ps.setString(6, expected.id());
            ps.setString(7, expected.status().name());
            ps.setInt(8, expected.attempts());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StoreException("Failed to update message " + expected.id(), e);
        }
    }

    @Override
    public Counts counts() {
        int pending = 0;
        int processing = 0;
        try (Connection c = database.openConnection();
             Statement st = c.createStatement();
             ResultSet rs = st.executeQuery(
                     "SELECT status, COUNT(*) FROM queued_messages WHERE status IN ('PENDING','PROCESSING') GROUP BY status")) {
            while (rs.next()) {
                if (MessageStatus.PENDING.name().equals(rs.getString(1))) {
                    pending = rs.getInt(2);
                } else {
                    processing = rs.getInt(2);
                }
            }
            return new Counts(pending, processing);
        } catch (SQLException e) {
            throw new StoreException("Failed to count queued messages", e);
        }
    }

    @Override
    public int countActive(String accountId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT COUNT(*) FROM queued_messages WHERE account_id=? AND status IN ('PENDING','PROCESSING')")) {
            ps.setString(1, accountId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to count messages for " + accountId, e);
        }
    }

    @Override
    public int clearActive() {
        try (Connection c = database.openConnection();
             Statement st = c.createStatement()) {
            return st.executeUpdate("DELETE FROM queued_messages WHERE status IN ('PENDING','PROCESSING')");
        } catch (SQLException e) {
            throw new StoreException("Failed to clear queue", e);
        }
    }

    @Override
    public List<QueuedMessage> history(int limit) {
        List<QueuedMessage> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT " + COLUMNS + " FROM queued_messages WHERE status IN ('SENT','FAILED')"
                             + " ORDER BY updated_at_ms DESC, id ASC LIMIT ?")) {
            ps.setInt(1, Math.max(0, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(read(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StoreException("Failed to read message history", e);
        }
    }

    private static QueuedMessage read(ResultSet rs) throws SQLException {
        return new QueuedMessage(
                rs.getString("id"),
                rs.getString("account_id"),
                rs.getString("recipient"),
                MessageKind.valueOf(rs.getString("kind")),
                Jsons.fromJson(rs.getString("payload_json"), MessagePayload.class),
                Jsons.fromJson(rs.getString("options_json"), SendOptions.class),
                Priority.fromRank(rs.getInt("priority_rank")),
                rs.getInt("attempts"),
                rs.getInt("max_attempts"),
                rs.getLong("enqueued_at_ms"),
                rs.getLong("next_eligible_at_ms"),
                rs.getString("last_error"),
                MessageStatus.valueOf(rs.getString("status")),
                rs.getLong("updated_at_ms")
        );
    }
}
