package io.jobqueue.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DaemonThreadFactoryTest {

    @Test
    void createsNumberedDaemonThreads() {
        DaemonThreadFactory factory = new DaemonThreadFactory("jobqueue-worker-default-");

        Thread first = factory.newThread(() -> { });
        Thread second = factory.newThread(() -> { });

        assertTrue(first.isDaemon());
        assertEquals("jobqueue-worker-default-1", first.getName());
        assertEquals("jobqueue-worker-default-2", second.getName());
    }
}
