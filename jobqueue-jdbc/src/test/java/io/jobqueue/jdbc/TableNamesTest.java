package io.jobqueue.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TableNamesTest {

    @Test
    void acceptsPlainIdentifiers() {
        assertEquals("jobqueue_job", TableNames.validate("jobqueue_job"));
        assertEquals("_Jobs2", TableNames.validate("_Jobs2"));
    }

    @Test
    void rejectsAnythingElse() {
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("jobs; DROP TABLE x"));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("1jobs"));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("schema.jobs"));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate(""));
        assertThrows(NullPointerException.class, () -> TableNames.validate(null));
    }
}
