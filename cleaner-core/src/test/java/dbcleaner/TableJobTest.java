package dbcleaner;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TableJobTest {

    @Test
    void cutoffSubtractsWholeDays() {
        TableJob job = ManagedTable.XCOM.toJob(7);

        assertEquals(Instant.parse("2024-03-01T12:00:00Z"), job.cutoff(Instant.parse("2024-03-08T12:00:00Z")));
    }

    @Test
    void keyShape() {
        assertTrue(ManagedTable.DAG_RUN.toJob(1).hasPrimaryKey());
        assertFalse(ManagedTable.DAG_RUN.toJob(1).hasCompositeKey());
        assertTrue(ManagedTable.TASK_INSTANCE.toJob(1).hasCompositeKey());
        assertFalse(new TableJob("log", 1, "dttm", List.of()).hasPrimaryKey());
    }

    @Test
    void rejectsInvalidIdentifiers() {
        assertThrows(IllegalArgumentException.class, () ->
                new TableJob("log; DROP TABLE log", 1, "dttm", List.of("id")));
        assertThrows(IllegalArgumentException.class, () ->
                new TableJob("log", 1, "dttm`", List.of("id")));
        assertThrows(IllegalArgumentException.class, () ->
                new TableJob("log", 1, "dttm", List.of("1id")));
        assertThrows(NullPointerException.class, () ->
                new TableJob(null, 1, "dttm", List.of("id")));
    }

    @Test
    void rejectsNegativeRetention() {
        assertThrows(IllegalArgumentException.class, () -> ManagedTable.LOG.toJob(-1));
    }

    @Test
    void primaryKeyIsCopied() {
        List<String> key = new ArrayList<>(List.of("id"));
        TableJob job = new TableJob("log", 1, "dttm", key);
        key.add("other");

        assertEquals(List.of("id"), job.primaryKey());
    }

    @Test
    void identifiersAcceptUnderscoresAndDigits() {
        assertEquals("_map_index2", Identifiers.validate("_map_index2"));
        assertThrows(IllegalArgumentException.class, () -> Identifiers.validate(""));
        assertThrows(IllegalArgumentException.class, () -> Identifiers.validate("a-b"));
    }

    @Test
    void managedTableLookup() {
        assertEquals(ManagedTable.XCOM, ManagedTable.forTableName("xcom").orElseThrow());
        assertTrue(ManagedTable.forTableName("XCOM").isEmpty());
        assertTrue(ManagedTable.XCOM.allowedColumns().contains("timestamp"));
        assertTrue(ManagedTable.XCOM.allowedColumns().contains("key"));
    }
}
