package com.workqueue.db;

import com.workqueue.core.JobState;
import com.workqueue.core.TargetRef;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Repository for job persistence and state transitions.
 *
 * <p>Every state change is a single-row conditional update
 * ({@code ... WHERE id = ? AND state = ?}). A method returning {@code false} means
 * the row was no longer in the expected state: another actor got there first, and
 * the caller treats it as a no-op.</p>
 *
 * <p>All methods use PreparedStatement and try-with-resources for resource management.</p>
 */
public class JobRepository {
    private static final Logger logger = Logger.getLogger(JobRepository.class.getName());

    private static final String CANDIDATE_CONDITION =
            "j.state = 'PENDING' AND (j.depends_on IS NULL OR EXISTS "
            + "(SELECT 1 FROM jobs d WHERE d.id = j.depends_on AND d.state = 'DONE'))";

    /** States that hold one of a channel's capacity slots. */
    private static final List<JobState> OCCUPYING_STATES = Arrays.stream(JobState.values())
            .filter(JobState::occupiesChannel)
            .collect(Collectors.toList());
    private static final String OCCUPYING_PLACEHOLDERS =
            String.join(", ", Collections.nCopies(OCCUPYING_STATES.size(), "?"));

    private final Database database;

    /**
     * Simple POJO to hold job data retrieved from the database.
     */
    public static class JobData {
        private long id;
        private String name;
        private String operationDomain;
        private String operationName;
        private String subjectIds;
        private String arguments;
        private String owner;
        private long channelId;
        private int priority;
        private Long dependsOn;
        private JobState state;
        private LocalDateTime createdAt;
        private LocalDateTime enqueuedAt;
        private LocalDateTime startedAt;
        private LocalDateTime doneAt;
        private String result;
        private String errorInfo;
        private int retryCount;
        private int maxRetries;

        // Getters and Setters
        public long getId() { return id; }
        public void setId(long id) { this.id = id; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getOperationDomain() { return operationDomain; }
        public void setOperationDomain(String operationDomain) { this.operationDomain = operationDomain; }

        public String getOperationName() { return operationName; }
        public void setOperationName(String operationName) { this.operationName = operationName; }

        public String getSubjectIds() { return subjectIds; }
        public void setSubjectIds(String subjectIds) { this.subjectIds = subjectIds; }

        public String getArguments() { return arguments; }
        public void setArguments(String arguments) { this.arguments = arguments; }

        public String getOwner() { return owner; }
        public void setOwner(String owner) { this.owner = owner; }

        public long getChannelId() { return channelId; }
        public void setChannelId(long channelId) { this.channelId = channelId; }

        public int getPriority() { return priority; }
        public void setPriority(int priority) { this.priority = priority; }

        public Long getDependsOn() { return dependsOn; }
        public void setDependsOn(Long dependsOn) { this.dependsOn = dependsOn; }

        public JobState getState() { return state; }
        public void setState(JobState state) { this.state = state; }

        public LocalDateTime getCreatedAt() { return createdAt; }
        public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

        public LocalDateTime getEnqueuedAt() { return enqueuedAt; }
        public void setEnqueuedAt(LocalDateTime enqueuedAt) { this.enqueuedAt = enqueuedAt; }

        public LocalDateTime getStartedAt() { return startedAt; }
        public void setStartedAt(LocalDateTime startedAt) { this.startedAt = startedAt; }

        public LocalDateTime getDoneAt() { return doneAt; }
        public void setDoneAt(LocalDateTime doneAt) { this.doneAt = doneAt; }

        public String getResult() { return result; }
        public void setResult(String result) { this.result = result; }

        public String getErrorInfo() { return errorInfo; }
        public void setErrorInfo(String errorInfo) { this.errorInfo = errorInfo; }

        public int getRetryCount() { return retryCount; }
        public void setRetryCount(int retryCount) { this.retryCount = retryCount; }

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public TargetRef getTarget() {
            return new TargetRef(operationDomain, operationName, subjectIds, arguments);
        }

        public void setTarget(TargetRef target) {
            this.operationDomain = target.getOperationDomain();
            this.operationName = target.getOperationName();
            this.subjectIds = target.getSubjectIds();
            this.arguments = target.getArguments();
        }

        @Override
        public String toString() {
            return "JobData{id=" + id + ", name='" + name + "', target=" + operationDomain + "."
                    + operationName + ", state=" + state + ", priority=" + priority + "}";
        }
    }

    /**
     * One line of a job's own log.
     */
    public static class LogEntry {
        private final LocalDateTime loggedAt;
        private final String level;
        private final String message;

        public LogEntry(LocalDateTime loggedAt, String level, String message) {
            this.loggedAt = loggedAt;
            this.level = level;
            this.message = message;
        }

        public LocalDateTime getLoggedAt() { return loggedAt; }
        public String getLevel() { return level; }
        public String getMessage() { return message; }

        @Override
        public String toString() {
            return level + ": " + message;
        }
    }

    public JobRepository(Database database) {
        this.database = database;
    }

    /**
     * Insert a new job. The state stored is the one carried by {@code job}
     * (PENDING for every caller in this code base).
     *
     * @param job the job to insert; its id is ignored
     * @return the generated job id
     * @throws SQLException if the insert fails
     */
    public long insert(JobData job) throws SQLException {
        String sql = "INSERT INTO jobs (name, operation_domain, operation_name, subject_ids, arguments, owner, "
                + "channel_id, priority, depends_on, state, created_at, retry_count, max_retries) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            stmt.setString(1, job.getName());
            stmt.setString(2, job.getOperationDomain());
            stmt.setString(3, job.getOperationName());
            stmt.setString(4, job.getSubjectIds());
            stmt.setString(5, job.getArguments());
            stmt.setString(6, job.getOwner());
            stmt.setLong(7, job.getChannelId());
            stmt.setInt(8, job.getPriority());
            if (job.getDependsOn() != null) {
                stmt.setLong(9, job.getDependsOn());
            } else {
                stmt.setNull(9, Types.BIGINT);
            }
            stmt.setString(10, job.getState().name());
            stmt.setTimestamp(11, Timestamp.valueOf(job.getCreatedAt()));
            stmt.setInt(12, job.getRetryCount());
            stmt.setInt(13, job.getMaxRetries());

            stmt.executeUpdate();

            try (ResultSet keys = stmt.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No id generated for job " + job.getName());
                }
                long id = keys.getLong(1);
                logger.fine("Job inserted with ID: " + id);
                return id;
            }
        }
    }

    /**
     * Retrieve a job by its ID.
     *
     * @param id the job ID
     * @return JobData object if found, null if not found
     * @throws SQLException if database operation fails
     */
    public JobData getJobById(long id) throws SQLException {
        String sql = "SELECT * FROM jobs WHERE id = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setLong(1, id);

            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return mapResultSetToJob(rs);
                }
            }
        }

        return null;
    }

    public List<JobData> getJobsByState(JobState state) throws SQLException {
        String sql = "SELECT * FROM jobs WHERE state = ? ORDER BY priority, created_at, id";
        return queryJobs(sql, state.name());
    }

    public List<JobData> getJobsByName(String name) throws SQLException {
        String sql = "SELECT * FROM jobs WHERE name = ? ORDER BY id";
        return queryJobs(sql, name);
    }

    public List<JobData> getAllJobs() throws SQLException {
        String sql = "SELECT * FROM jobs ORDER BY id";
        return queryJobs(sql, null);
    }

    public int countJobs() throws SQLException {
        String sql = "SELECT COUNT(*) FROM jobs";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            rs.next();
            return rs.getInt(1);
        }
    }

    /**
     * Count jobs of a channel that hold a capacity slot (ENQUEUED or RUNNING).
     */
    public int countOccupancy(long channelId) throws SQLException {
        try (Connection conn = database.getConnection()) {
            return countOccupancy(conn, channelId);
        }
    }

    /**
     * Admit Pending jobs of one channel up to its free capacity.
     *
     * <p><b>Transaction:</b> the channel row is locked first ({@code SELECT ... FOR UPDATE}),
     * so two admission passes over the same channel run one after the other and the
     * occupancy they count is never stale. Candidates are PENDING jobs of the channel
     * whose prerequisite, if any, is DONE, taken by priority (lowest first), then
     * creation time, then id. Each one moves PENDING → ENQUEUED through a conditional
     * update.</p>
     *
     * @param channelId the channel to fill
     * @param now       the enqueue timestamp
     * @return ids of the jobs admitted, in admission order
     * @throws SQLException if the transaction fails; nothing is admitted then
     */
    public List<Long> admitCandidates(long channelId, LocalDateTime now) throws SQLException {
        String lockSql = "SELECT capacity FROM channels WHERE id = ? FOR UPDATE";
        String candidateSql = "SELECT j.id FROM jobs j WHERE j.channel_id = ? AND " + CANDIDATE_CONDITION
                + " ORDER BY j.priority ASC, j.created_at ASC, j.id ASC LIMIT ?";
        String admitSql = "UPDATE jobs SET state = ?, enqueued_at = ? WHERE id = ? AND state = ?";

        List<Long> admitted = new ArrayList<>();
        Connection conn = database.getConnection();
        try {
            conn.setAutoCommit(false); // Start transaction

            int capacity;
            try (PreparedStatement lock = conn.prepareStatement(lockSql)) {
                lock.setLong(1, channelId);
                try (ResultSet rs = lock.executeQuery()) {
                    if (!rs.next()) {
                        conn.rollback();
                        return admitted;
                    }
                    capacity = rs.getInt(1);
                }
            }

            int available = capacity - countOccupancy(conn, channelId);
            if (available <= 0) {
                conn.commit();
                return admitted;
            }

            List<Long> candidates = new ArrayList<>();
            try (PreparedStatement select = conn.prepareStatement(candidateSql)) {
                select.setLong(1, channelId);
                select.setInt(2, available);
                try (ResultSet rs = select.executeQuery()) {
                    while (rs.next()) {
                        candidates.add(rs.getLong(1));
                    }
                }
            }

            try (PreparedStatement update = conn.prepareStatement(admitSql)) {
                for (Long jobId : candidates) {
                    update.setString(1, JobState.ENQUEUED.name());
                    update.setTimestamp(2, Timestamp.valueOf(now));
                    update.setLong(3, jobId);
                    update.setString(4, JobState.PENDING.name());
                    if (update.executeUpdate() == 1) {
                        admitted.add(jobId);
                    }
                }
            }

            conn.commit();
            return admitted;

        } catch (SQLException e) {
            try {
                conn.rollback();
            } catch (SQLException rollbackEx) {
                e.addSuppressed(rollbackEx);
            }
            throw e;
        } finally {
            try {
                conn.setAutoCommit(true); // Restore auto-commit before returning to the pool
            } finally {
                conn.close();
            }
        }
    }

    /**
     * Check whether any PENDING job could be admitted right now: its prerequisite
     * (if any) is DONE and its channel has a free slot.
     */
    public boolean hasAdmissibleCandidate() throws SQLException {
        String sql = "SELECT 1 FROM jobs j JOIN channels c ON c.id = j.channel_id WHERE " + CANDIDATE_CONDITION
                + " AND (SELECT COUNT(*) FROM jobs o WHERE o.channel_id = c.id"
                + " AND o.state IN (" + OCCUPYING_PLACEHOLDERS + ")) < c.capacity LIMIT 1";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            bindOccupyingStates(stmt, 1);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        }
    }

    /**
     * Ids of all ENQUEUED jobs, across channels, in id order.
     */
    public List<Long> getEnqueuedJobIds() throws SQLException {
        String sql = "SELECT id FROM jobs WHERE state = ? ORDER BY id";
        List<Long> ids = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, JobState.ENQUEUED.name());
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getLong(1));
                }
            }
        }
        return ids;
    }

    /**
     * Atomically claim an ENQUEUED job for execution (ENQUEUED → RUNNING).
     *
     * @return true if this caller claimed it, false if it was not ENQUEUED anymore
     */
    public boolean markRunning(long jobId, LocalDateTime startedAt) throws SQLException {
        String sql = "UPDATE jobs SET state = ?, started_at = ? WHERE id = ? AND state = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, JobState.RUNNING.name());
            stmt.setTimestamp(2, Timestamp.valueOf(startedAt));
            stmt.setLong(3, jobId);
            stmt.setString(4, JobState.ENQUEUED.name());

            return stmt.executeUpdate() == 1;
        }
    }

    /**
     * Record the end of a RUNNING job (RUNNING → DONE or RUNNING → FAILED).
     *
     * @param jobId   the job
     * @param state   DONE or FAILED
     * @param doneAt  completion timestamp
     * @param message result text for DONE, error info for FAILED
     * @return true if the job was RUNNING and has been updated
     */
    public boolean markFinished(long jobId, JobState state, LocalDateTime doneAt, String message)
            throws SQLException {
        if (!JobState.RUNNING.canTransitionTo(state)) {
            throw new IllegalArgumentException("Not a terminal state: " + state);
        }
        String column = state == JobState.DONE ? "result" : "error_info";
        String sql = "UPDATE jobs SET state = ?, done_at = ?, " + column + " = ? WHERE id = ? AND state = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, state.name());
            stmt.setTimestamp(2, Timestamp.valueOf(doneAt));
            stmt.setString(3, message);
            stmt.setLong(4, jobId);
            stmt.setString(5, JobState.RUNNING.name());

            return stmt.executeUpdate() == 1;
        }
    }

    /**
     * Change the priority of a job that is still PENDING.
     */
    public boolean updatePendingPriority(long jobId, int priority) throws SQLException {
        String sql = "UPDATE jobs SET priority = ? WHERE id = ? AND state = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setInt(1, priority);
            stmt.setLong(2, jobId);
            stmt.setString(3, JobState.PENDING.name());
            return stmt.executeUpdate() == 1;
        }
    }

    /**
     * Move a job that is still PENDING to another channel.
     */
    public boolean updatePendingChannel(long jobId, long channelId) throws SQLException {
        String sql = "UPDATE jobs SET channel_id = ? WHERE id = ? AND state = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setLong(1, channelId);
            stmt.setLong(2, jobId);
            stmt.setString(3, JobState.PENDING.name());
            return stmt.executeUpdate() == 1;
        }
    }

    /**
     * Make a job that is still PENDING wait for another job.
     */
    public boolean updatePendingDependency(long jobId, long prerequisiteId) throws SQLException {
        String sql = "UPDATE jobs SET depends_on = ? WHERE id = ? AND state = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setLong(1, prerequisiteId);
            stmt.setLong(2, jobId);
            stmt.setString(3, JobState.PENDING.name());
            return stmt.executeUpdate() == 1;
        }
    }

    /**
     * Insert a log entry into the job_logs table.
     *
     * @param jobId    the job ID
     * @param loggedAt when the entry was written
     * @param level    the log level (INFO, WARN, ERROR, DEBUG)
     * @param message  the log message
     * @throws SQLException if database operation fails
     */
    public void insertLog(long jobId, LocalDateTime loggedAt, String level, String message) throws SQLException {
        String sql = "INSERT INTO job_logs (job_id, logged_at, level, message) VALUES (?, ?, ?, ?)";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setLong(1, jobId);
            stmt.setTimestamp(2, Timestamp.valueOf(loggedAt));
            stmt.setString(3, level);
            stmt.setString(4, message);

            stmt.executeUpdate();
        }
    }

    /**
     * Log entries of a job, oldest first.
     */
    public List<LogEntry> getLogEntries(long jobId) throws SQLException {
        String sql = "SELECT logged_at, level, message FROM job_logs WHERE job_id = ? ORDER BY id";
        List<LogEntry> entries = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setLong(1, jobId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    entries.add(new LogEntry(rs.getTimestamp("logged_at").toLocalDateTime(),
                            rs.getString("level"), rs.getString("message")));
                }
            }
        }
        return entries;
    }

    /**
     * Log messages of a job, oldest first, formatted as {@code LEVEL: message}.
     */
    public List<String> getLogs(long jobId) throws SQLException {
        return getLogEntries(jobId).stream()
                .map(LogEntry::toString)
                .collect(Collectors.toList());
    }

    private int countOccupancy(Connection conn, long channelId) throws SQLException {
        String sql = "SELECT COUNT(*) FROM jobs WHERE channel_id = ? AND state IN (" + OCCUPYING_PLACEHOLDERS + ")";

        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, channelId);
            bindOccupyingStates(stmt, 2);
            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        }
    }

    private static void bindOccupyingStates(PreparedStatement stmt, int firstIndex) throws SQLException {
        for (int i = 0; i < OCCUPYING_STATES.size(); i++) {
            stmt.setString(firstIndex + i, OCCUPYING_STATES.get(i).name());
        }
    }

    private List<JobData> queryJobs(String sql, String parameter) throws SQLException {
        List<JobData> jobs = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            if (parameter != null) {
                stmt.setString(1, parameter);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    jobs.add(mapResultSetToJob(rs));
                }
            }
        }
        return jobs;
    }

    private JobData mapResultSetToJob(ResultSet rs) throws SQLException {
        JobData job = new JobData();

        job.setId(rs.getLong("id"));
        job.setName(rs.getString("name"));
        job.setOperationDomain(rs.getString("operation_domain"));
        job.setOperationName(rs.getString("operation_name"));
        job.setSubjectIds(rs.getString("subject_ids"));
        job.setArguments(rs.getString("arguments"));
        job.setOwner(rs.getString("owner"));
        job.setChannelId(rs.getLong("channel_id"));
        job.setPriority(rs.getInt("priority"));
        long dependsOn = rs.getLong("depends_on");
        job.setDependsOn(rs.wasNull() ? null : dependsOn);
        job.setState(JobState.valueOf(rs.getString("state")));
        job.setResult(rs.getString("result"));
        job.setErrorInfo(rs.getString("error_info"));
        job.setRetryCount(rs.getInt("retry_count"));
        job.setMaxRetries(rs.getInt("max_retries"));

        // Handle nullable timestamps
        job.setCreatedAt(toLocalDateTime(rs.getTimestamp("created_at")));
        job.setEnqueuedAt(toLocalDateTime(rs.getTimestamp("enqueued_at")));
        job.setStartedAt(toLocalDateTime(rs.getTimestamp("started_at")));
        job.setDoneAt(toLocalDateTime(rs.getTimestamp("done_at")));

        return job;
    }

    private static LocalDateTime toLocalDateTime(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toLocalDateTime();
    }
}
