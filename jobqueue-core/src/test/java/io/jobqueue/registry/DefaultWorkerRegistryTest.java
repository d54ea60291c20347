package io.jobqueue.registry;

import io.jobqueue.DuplicateJobKindException;
import io.jobqueue.JobHandler;
import io.jobqueue.JsonJobHandler;
import io.jobqueue.UnknownJobKindException;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DefaultWorkerRegistryTest {

    record Args(String value) {
    }

    @Test
    void resolvesRegisteredHandler() {
        JobHandler<Args> handler = JsonJobHandler.of("email", Args.class, (ctx, args) -> { });
        DefaultWorkerRegistry registry = new DefaultWorkerRegistry().register(handler);

        assertSame(handler, registry.resolve("email"));
        assertTrue(registry.isRegistered("email"));
    }

    @Test
    void unknownKindThrows() {
        DefaultWorkerRegistry registry = new DefaultWorkerRegistry();

        UnknownJobKindException e = assertThrows(UnknownJobKindException.class, () -> registry.resolve("missing"));
        assertEquals("missing", e.kind());
        assertFalse(registry.isRegistered("missing"));
        assertThrows(UnknownJobKindException.class, () -> registry.resolve(null));
    }

    @Test
    void duplicateKindIsRejected() {
        DefaultWorkerRegistry registry = new DefaultWorkerRegistry()
            .register(JsonJobHandler.of("email", Args.class, (ctx, args) -> { }));

        assertThrows(DuplicateJobKindException.class, () ->
            registry.register(JsonJobHandler.of("email", Args.class, (ctx, args) -> { })));
    }

    @Test
    void blankKindIsRejected() {
        DefaultWorkerRegistry registry = new DefaultWorkerRegistry();

        assertThrows(IllegalArgumentException.class, () ->
            registry.register(JsonJobHandler.of(" ", Args.class, (ctx, args) -> { })));
    }

    @Test
    void kindsAreSorted() {
        DefaultWorkerRegistry registry = new DefaultWorkerRegistry()
            .register(JsonJobHandler.of("sort", Args.class, (ctx, args) -> { }))
            .register(JsonJobHandler.of("email", Args.class, (ctx, args) -> { }));

        assertEquals(Set.of("email", "sort"), registry.kinds());
        assertEquals("email", registry.kinds().iterator().next());
    }
}
