package work.cmdkernel.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class HandlerRegistryTest {
    @Test
    void laterRegistrationReplacesEarlierOne() {
        ActionHandler first = (ctx, values) -> 1;
        ActionHandler second = (ctx, values) -> 2;
        var registry = new HandlerRegistry().action("build.run", first).action("build.run", second);
        assertSame(second, registry.requireAction("build.run"));
        assertEquals(1, registry.actions().size());
    }

    @Test
    void missingHandlersAreReportedById() {
        var registry = new HandlerRegistry();
        var ex = assertThrows(IllegalStateException.class, () -> registry.requireBeforeHook("audit"));
        assertTrue(ex.getMessage().contains("audit"), ex.getMessage());
        assertFalse(registry.hasAction("audit"));
    }

    @Test
    void rejectsBlankIds() {
        assertThrows(IllegalArgumentException.class, () -> new HandlerRegistry().errorHook(" ", (ctx, failure) -> true));
    }

    @Test
    void actionsViewIsReadOnly() {
        var registry = new HandlerRegistry().action("a", (ctx, values) -> null);
        assertThrows(UnsupportedOperationException.class, () -> registry.actions().clear());
    }

    @Test
    void cancellationTokenThrowsOnceCancelled() {
        var token = new CancellationToken();
        token.throwIfCancelled();
        token.cancel();
        assertTrue(token.isCancelled());
        assertThrows(DispatchCancelledException.class, token::throwIfCancelled);
    }
}
