package com.markovorder.db;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

public class SqliteInitializer {

    public static void initialize(String dbPath) throws SQLException {
        String url = "jdbc:sqlite:" + dbPath;
        try (Connection conn = DriverManager.getConnection(url)) {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("PRAGMA journal_mode = WAL;");

                stmt.execute("CREATE TABLE IF NOT EXISTS selection_result (" +
                        "id INTEGER PRIMARY KEY AUTOINCREMENT, " +
                        "class_label TEXT NOT NULL, " +
                        "selector_name TEXT NOT NULL, " +
                        "selected_states INTEGER, " +
                        "model_states INTEGER, " +
                        "fallback INTEGER NOT NULL, " +
                        "first_candidate INTEGER NOT NULL, " +
                        "criterion_blob BLOB, " +
                        "created_ts INTEGER NOT NULL, " +
                        "UNIQUE (class_label, selector_name)" +
                        ");");

                stmt.execute("CREATE INDEX IF NOT EXISTS idx_selection_lookup " +
                        "ON selection_result (selector_name, class_label);");
            }
        }
    }
}
