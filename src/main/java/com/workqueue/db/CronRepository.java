package com.workqueue.db;

import com.workqueue.core.IntervalUnit;
import com.workqueue.core.TargetRef;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Repository for cron entries: recurring definitions that spawn jobs.
 */
public class CronRepository {
    private final Database database;

    /**
     * Simple POJO to hold one cron entry.
     */
    public static class CronData {
        private long id;
        private String name;
        private TargetRef target;
        private String owner;
        private int intervalNumber;
        private IntervalUnit intervalUnit;
        private LocalDateTime nextCallAt;
        private boolean active;

        public long getId() { return id; }
        public void setId(long id) { this.id = id; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public TargetRef getTarget() { return target; }
        public void setTarget(TargetRef target) { this.target = target; }

        public String getOwner() { return owner; }
        public void setOwner(String owner) { this.owner = owner; }

        public int getIntervalNumber() { return intervalNumber; }
        public void setIntervalNumber(int intervalNumber) { this.intervalNumber = intervalNumber; }

        public IntervalUnit getIntervalUnit() { return intervalUnit; }
        public void setIntervalUnit(IntervalUnit intervalUnit) { this.intervalUnit = intervalUnit; }

        public LocalDateTime getNextCallAt() { return nextCallAt; }
        public void setNextCallAt(LocalDateTime nextCallAt) { this.nextCallAt = nextCallAt; }

        public boolean isActive() { return active; }
        public void setActive(boolean active) { this.active = active; }

        @Override
        public String toString() {
            return "CronData{id=" + id + ", name='" + name + "', every " + intervalNumber + " " + intervalUnit
                    + ", nextCallAt=" + nextCallAt + ", active=" + active + "}";
        }
    }

    public CronRepository(Database database) {
        this.database = database;
    }

    /**
     * Insert a cron entry.
     *
     * @return the generated id
     */
    public long insert(CronData cron) throws SQLException {
        String sql = "INSERT INTO crons (name, operation_domain, operation_name, subject_ids, arguments, owner, "
                + "interval_number, interval_unit, next_call_at, active) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            bindColumns(stmt, cron);
            stmt.executeUpdate();

            try (ResultSet keys = stmt.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No id generated for cron " + cron.getName());
                }
                return keys.getLong(1);
            }
        }
    }

    /**
     * Overwrite every column of an existing cron entry.
     *
     * @return true if the entry exists and was updated
     */
    public boolean update(CronData cron) throws SQLException {
        String sql = "UPDATE crons SET name = ?, operation_domain = ?, operation_name = ?, subject_ids = ?, "
                + "arguments = ?, owner = ?, interval_number = ?, interval_unit = ?, next_call_at = ?, active = ? "
                + "WHERE id = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            bindColumns(stmt, cron);
            stmt.setLong(11, cron.getId());
            return stmt.executeUpdate() == 1;
        }
    }

    public CronData getCronById(long id) throws SQLException {
        String sql = "SELECT * FROM crons WHERE id = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setLong(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? mapRow(rs) : null;
            }
        }
    }

    public List<CronData> getAllCrons() throws SQLException {
        String sql = "SELECT * FROM crons ORDER BY id";
        List<CronData> crons = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                crons.add(mapRow(rs));
            }
        }
        return crons;
    }

    /**
     * Active entries whose next call is at or before {@code now}.
     */
    public List<CronData> getDueCrons(LocalDateTime now) throws SQLException {
        String sql = "SELECT * FROM crons WHERE active = TRUE AND next_call_at <= ? ORDER BY next_call_at, id";
        List<CronData> crons = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setTimestamp(1, Timestamp.valueOf(now));
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    crons.add(mapRow(rs));
                }
            }
        }
        return crons;
    }

    /**
     * Move an entry's next call forward, only if it still holds the value the caller read.
     *
     * @param cronId   the entry
     * @param expected next call the caller observed
     * @param next     new next call
     * @return true if advanced, false if another tick or an edit changed it first
     */
    public boolean advanceNextCall(long cronId, LocalDateTime expected, LocalDateTime next) throws SQLException {
        String sql = "UPDATE crons SET next_call_at = ? WHERE id = ? AND next_call_at = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setTimestamp(1, Timestamp.valueOf(next));
            stmt.setLong(2, cronId);
            stmt.setTimestamp(3, Timestamp.valueOf(expected));
            return stmt.executeUpdate() == 1;
        }
    }

    public boolean setActive(long cronId, boolean active) throws SQLException {
        String sql = "UPDATE crons SET active = ? WHERE id = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setBoolean(1, active);
            stmt.setLong(2, cronId);
            return stmt.executeUpdate() == 1;
        }
    }

    public boolean delete(long cronId) throws SQLException {
        String sql = "DELETE FROM crons WHERE id = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setLong(1, cronId);
            return stmt.executeUpdate() == 1;
        }
    }

    private void bindColumns(PreparedStatement stmt, CronData cron) throws SQLException {
        TargetRef target = cron.getTarget();
        stmt.setString(1, cron.getName());
        stmt.setString(2, target.getOperationDomain());
        stmt.setString(3, target.getOperationName());
        stmt.setString(4, target.getSubjectIds());
        stmt.setString(5, target.getArguments());
        stmt.setString(6, cron.getOwner());
        stmt.setInt(7, cron.getIntervalNumber());
        stmt.setString(8, cron.getIntervalUnit().getToken());
        stmt.setTimestamp(9, Timestamp.valueOf(cron.getNextCallAt()));
        stmt.setBoolean(10, cron.isActive());
    }

    private CronData mapRow(ResultSet rs) throws SQLException {
        CronData cron = new CronData();
        cron.setId(rs.getLong("id"));
        cron.setName(rs.getString("name"));
        cron.setTarget(new TargetRef(
                rs.getString("operation_domain"),
                rs.getString("operation_name"),
                rs.getString("subject_ids"),
                rs.getString("arguments")));
        cron.setOwner(rs.getString("owner"));
        cron.setIntervalNumber(rs.getInt("interval_number"));
        cron.setIntervalUnit(IntervalUnit.fromToken(rs.getString("interval_unit")));
        cron.setNextCallAt(rs.getTimestamp("next_call_at").toLocalDateTime());
        cron.setActive(rs.getBoolean("active"));
        return cron;
    }
}
