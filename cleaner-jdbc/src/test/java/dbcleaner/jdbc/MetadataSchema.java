package dbcleaner.jdbc;

import dbcleaner.ManagedTable;
import dbcleaner.spi.Dialect;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;

/**
 * Creates the managed tables from {@code /schema/<dialect>.sql} and seeds them with
 * rows of a given age.
 */
final class MetadataSchema {
    private final DataSource dataSource;
    private final Dialect dialect;
    private final JdbcMetadataDatabase db;
    private int nextId = 1;

    MetadataSchema(DataSource dataSource, Dialect dialect) {
        this.dataSource = dataSource;
        this.dialect = dialect;
        this.db = new JdbcMetadataDatabase(dataSource);
    }

    JdbcMetadataDatabase database() {
        return db;
    }

    void create() throws IOException, SQLException {
        String schema = loadResource("/schema/" + dialect.name() + ".sql");
        try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
            for (String stmt : schema.split(";")) {
                String trimmed = stmt.trim();
                if (!trimmed.isEmpty()) {
                    st.execute(trimmed);
                }
            }
        }
    }

    void truncateAll() {
        for (ManagedTable table : ManagedTable.values()) {
            db.update("DELETE FROM " + q(table.tableName()));
        }
    }

    /** Inserts {@code rows} rows into every managed table, dated {@code age} ago. */
    void seedAll(int rows, Duration age) {
        for (ManagedTable table : ManagedTable.values()) {
            seed(table, rows, age);
        }
    }

    void seed(ManagedTable table, int rows, Duration age) {
        Instant at = Instant.now().minus(age);
        for (int i = 0; i < rows; i++) {
            int id = nextId++;
            switch (table) {
                case DAG_RUN -> db.update("INSERT INTO " + q("dag_run") + " (" + q("id") + ", " + q("dag_id")
                        + ", " + q("execution_date") + ") VALUES (?, ?, ?)", id, "dag_" + (id % 7), at);
                case TASK_INSTANCE -> db.update("INSERT INTO " + q("task_instance") + " (" + q("dag_id") + ", "
                                + q("task_id") + ", " + q("run_id") + ", " + q("map_index") + ", " + q("start_date")
                                + ") VALUES (?, ?, ?, ?, ?)",
                        "dag_" + (id % 7), "task_" + (id % 3), "run_" + id, -1, at);
                case XCOM -> db.update("INSERT INTO " + q("xcom") + " (" + q("dag_id") + ", " + q("task_id")
                                + ", " + q("run_id") + ", " + q("map_index") + ", " + q("key") + ", "
                                + q("timestamp") + ") VALUES (?, ?, ?, ?, ?, ?)",
                        "dag_" + (id % 7), "task_" + (id % 3), "run_" + (id / 2), id % 2, "return_value", at);
                case LOG -> db.update("INSERT INTO " + q("log") + " (" + q("id") + ", " + q("dttm") + ", "
                        + q("event") + ") VALUES (?, ?, ?)", id, at, "cli_task_run");
                case JOB -> db.update("INSERT INTO " + q("job") + " (" + q("id") + ", " + q("end_date") + ", "
                        + q("state") + ") VALUES (?, ?, ?)", id, at, "success");
            }
        }
    }

    long count(ManagedTable table) {
        return db.queryForLong("SELECT COUNT(*) FROM " + q(table.tableName()));
    }

    long countOlderThan(ManagedTable table, Instant cutoff) {
        return db.queryForLong("SELECT COUNT(*) FROM " + q(table.tableName())
                + " WHERE " + q(table.dateColumn()) + " < ?", cutoff);
    }

    void dropColumn(ManagedTable table, String column) {
        db.update("ALTER TABLE " + q(table.tableName()) + " DROP COLUMN " + q(column));
    }

    private String q(String identifier) {
        return dialect.quote(identifier);
    }

    private static String loadResource(String path) throws IOException {
        try (InputStream is = MetadataSchema.class.getResourceAsStream(path)) {
            if (is == null) throw new IOException("Resource not found: " + path);
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
