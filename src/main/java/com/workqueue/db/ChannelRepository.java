package com.workqueue.db;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Repository for channels: named lanes with a bound on Enqueued + Running jobs.
 */
public class ChannelRepository {
    private static final Logger logger = Logger.getLogger(ChannelRepository.class.getName());

    /** Name of the reserved channel jobs land in when none is given. */
    public static final String DEFAULT_CHANNEL = "default";

    private final Database database;

    /**
     * Simple POJO holding one channel row.
     */
    public static class ChannelData {
        private long id;
        private String name;
        private int capacity;

        public ChannelData() {
        }

        public ChannelData(long id, String name, int capacity) {
            this.id = id;
            this.name = name;
            this.capacity = capacity;
        }

        public long getId() { return id; }
        public void setId(long id) { this.id = id; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public int getCapacity() { return capacity; }
        public void setCapacity(int capacity) { this.capacity = capacity; }

        public boolean isDefault() {
            return DEFAULT_CHANNEL.equals(name);
        }

        @Override
        public String toString() {
            return "ChannelData{id=" + id + ", name='" + name + "', capacity=" + capacity + "}";
        }
    }

    public ChannelRepository(Database database) {
        this.database = database;
    }

    /**
     * Insert a channel.
     *
     * @return the stored channel with its generated id
     * @throws SQLException if the insert fails (e.g. duplicate name)
     */
    public ChannelData insert(String name, int capacity) throws SQLException {
        String sql = "INSERT INTO channels (name, capacity) VALUES (?, ?)";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            stmt.setString(1, name);
            stmt.setInt(2, capacity);
            stmt.executeUpdate();

            try (ResultSet keys = stmt.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No id generated for channel " + name);
                }
                return new ChannelData(keys.getLong(1), name, capacity);
            }
        }
    }

    /**
     * Create the default channel if it does not exist yet.
     *
     * @param capacity capacity used when creating it
     * @return the default channel
     */
    public synchronized ChannelData ensureDefaultChannel(int capacity) throws SQLException {
        Optional<ChannelData> existing = findByName(DEFAULT_CHANNEL);
        if (existing.isPresent()) {
            return existing.get();
        }
        ChannelData created = insert(DEFAULT_CHANNEL, capacity);
        logger.info("Created default channel with capacity " + capacity);
        return created;
    }

    public Optional<ChannelData> findByName(String name) throws SQLException {
        String sql = "SELECT id, name, capacity FROM channels WHERE name = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, name);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        }
    }

    public Optional<ChannelData> findById(long id) throws SQLException {
        String sql = "SELECT id, name, capacity FROM channels WHERE id = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setLong(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        }
    }

    public List<ChannelData> findAll() throws SQLException {
        String sql = "SELECT id, name, capacity FROM channels ORDER BY id";
        List<ChannelData> channels = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                channels.add(mapRow(rs));
            }
        }
        return channels;
    }

    /**
     * Change a channel's capacity.
     *
     * @return true if a channel with that name was updated
     */
    public boolean updateCapacity(String name, int capacity) throws SQLException {
        String sql = "UPDATE channels SET capacity = ? WHERE name = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setInt(1, capacity);
            stmt.setString(2, name);
            return stmt.executeUpdate() == 1;
        }
    }

    /**
     * Count every job, in any state, that references the channel.
     */
    public int countJobs(long channelId) throws SQLException {
        String sql = "SELECT COUNT(*) FROM jobs WHERE channel_id = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setLong(1, channelId);
            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        }
    }

    /**
     * Delete a channel by name. The default channel is never deleted.
     *
     * @return true if a row was deleted
     */
    public boolean delete(String name) throws SQLException {
        String sql = "DELETE FROM channels WHERE name = ? AND name <> ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, name);
            stmt.setString(2, DEFAULT_CHANNEL);
            return stmt.executeUpdate() == 1;
        }
    }

    private ChannelData mapRow(ResultSet rs) throws SQLException {
        return new ChannelData(rs.getLong("id"), rs.getString("name"), rs.getInt("capacity"));
    }
}
