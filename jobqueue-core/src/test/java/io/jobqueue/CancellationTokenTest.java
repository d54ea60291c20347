package io.jobqueue;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

class CancellationTokenTest {

    @Test
    void firstReasonWins() {
        CancellationToken token = new CancellationToken();
        assertFalse(token.isCancelled());
        assertDoesNotThrow(token::throwIfCancelled);

        token.cancel("job timed out");
        token.cancel("client stopping");

        assertTrue(token.isCancelled());
        assertEquals("job timed out", token.reason());
        CancellationException e = assertThrows(CancellationException.class, token::throwIfCancelled);
        assertEquals("job timed out", e.getMessage());
    }

    @Test
    void nullReasonGetsDefault() {
        CancellationToken token = new CancellationToken();

        token.cancel(null);

        assertEquals("cancelled", token.reason());
    }
}
