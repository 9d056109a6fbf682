package com.markovorder.db;

import com.markovorder.util.DoubleArrayCodec;

import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class SelectionResultDao {

    private final String dbPath;

    public SelectionResultDao(String dbPath) {
        this.dbPath = dbPath;
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + dbPath);
    }

    public void upsert(SelectionRecord record) throws SQLException {
        String sql = "INSERT INTO selection_result (class_label, selector_name, selected_states, model_states, " +
                "fallback, first_candidate, criterion_blob, created_ts) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?, ?) " +
                "ON CONFLICT(class_label, selector_name) DO UPDATE SET " +
                "selected_states = excluded.selected_states, model_states = excluded.model_states, " +
                "fallback = excluded.fallback, first_candidate = excluded.first_candidate, " +
                "criterion_blob = excluded.criterion_blob, created_ts = excluded.created_ts";

        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, record.getClassLabel());
            ps.setString(2, record.getSelectorName());
            setNullableInt(ps, 3, record.getSelectedStates());
            setNullableInt(ps, 4, record.getModelStates());
            ps.setInt(5, record.isFallback() ? 1 : 0);
            ps.setInt(6, record.getFirstCandidate());
            ps.setBytes(7, DoubleArrayCodec.toBytes(record.getCriterionScores()));
            ps.setLong(8, record.getCreatedTs());
            ps.executeUpdate();
        }
    }

    public Optional<SelectionRecord> load(String classLabel, String selectorName) throws SQLException {
        String sql = "SELECT * FROM selection_result WHERE class_label = ? AND selector_name = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, classLabel);
            ps.setString(2, selectorName);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(map(rs));
                }
            }
        }
        return Optional.empty();
    }

    public List<SelectionRecord> loadBySelector(String selectorName) throws SQLException {
        String sql = "SELECT * FROM selection_result WHERE selector_name = ? ORDER BY class_label";
        List<SelectionRecord> records = new ArrayList<>();
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, selectorName);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    records.add(map(rs));
                }
            }
        }
        return records;
    }

    public void deleteBySelector(String selectorName) throws SQLException {
        String sql = "DELETE FROM selection_result WHERE selector_name = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, selectorName);
            ps.executeUpdate();
        }
    }

    private static SelectionRecord map(ResultSet rs) throws SQLException {
        // an empty criterion array may come back as NULL
        byte[] blob = rs.getBytes("criterion_blob");
        return new SelectionRecord(
                rs.getString("class_label"),
                rs.getString("selector_name"),
                getNullableInt(rs, "selected_states"),
                getNullableInt(rs, "model_states"),
                rs.getInt("fallback") != 0,
                rs.getInt("first_candidate"),
                blob == null ? new double[0] : DoubleArrayCodec.fromBytes(blob),
                rs.getLong("created_ts"));
    }

    private static void setNullableInt(PreparedStatement ps, int idx, Integer value) throws SQLException {
        if (value == null) {
            ps.setNull(idx, Types.INTEGER);
        } else {
            ps.setInt(idx, value);
        }
    }

    private static Integer getNullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }
}
