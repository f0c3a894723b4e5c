package com.ciflow.db;

import com.ciflow.artifact.ArtifactTransport;
import com.ciflow.core.PipelineException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Artifact payloads persisted in the {@code artifacts} table.
 * All methods use PreparedStatement and try-with-resources; JDBC failures surface as
 * {@link PipelineException}s through the {@link ArtifactTransport} methods.
 */
public class ArtifactRepository implements ArtifactTransport {
    private final Database database;

    public ArtifactRepository(Database database) {
        this.database = database;
    }

    /**
     * Insert a payload. The primary key rejects a second write of the same key.
     */
    public void insert(String runId, String jobId, String name, byte[] payload) throws SQLException {
        String sql = "INSERT INTO artifacts (run_id, job_id, name, payload, size_bytes) VALUES (?, ?, ?, ?, ?)";
        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, runId);
            stmt.setString(2, jobId);
            stmt.setString(3, name);
            stmt.setBytes(4, payload);
            stmt.setLong(5, payload.length);
            stmt.executeUpdate();
        }
    }

    public byte[] find(String runId, String jobId, String name) throws SQLException {
        String sql = "SELECT payload FROM artifacts WHERE run_id = ? AND job_id = ? AND name = ?";
        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, runId);
            stmt.setString(2, jobId);
            stmt.setString(3, name);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getBytes("payload") : null;
            }
        }
    }

    /**
     * @return artifact names stored for a run, ordered by creation
     */
    public List<String> findNames(String runId) throws SQLException {
        String sql = "SELECT name FROM artifacts WHERE run_id = ? ORDER BY created_at, name";
        List<String> names = new ArrayList<>();
        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, runId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    names.add(rs.getString("name"));
                }
            }
        }
        return names;
    }

    public int deleteByRun(String runId) throws SQLException {
        String sql = "DELETE FROM artifacts WHERE run_id = ?";
        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, runId);
            return stmt.executeUpdate();
        }
    }

    // ==================== ArtifactTransport ====================

    @Override
    public void write(String runId, String jobId, String name, byte[] payload) {
        try {
            insert(runId, jobId, name, payload);
        } catch (SQLException e) {
            throw new PipelineException("Failed to store artifact '" + name + "' of " + jobId, e);
        }
    }

    @Override
    public byte[] read(String runId, String jobId, String name) {
        try {
            return find(runId, jobId, name);
        } catch (SQLException e) {
            throw new PipelineException("Failed to read artifact '" + name + "' of " + jobId, e);
        }
    }

    @Override
    public int deleteRun(String runId) {
        try {
            return deleteByRun(runId);
        } catch (SQLException e) {
            throw new PipelineException("Failed to discard artifacts of run " + runId, e);
        }
    }
}
