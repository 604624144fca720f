package com.landawn.graphjdbc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

public class CancellationTokenTest extends TestBase {

    @Test
    public void testCancel() {
        CancellationToken token = CancellationToken.create();
        AtomicInteger counter = new AtomicInteger();
        token.onCancel(counter::incrementAndGet);

        assertFalse(token.isCancellationRequested());
        token.throwIfCancellationRequested();

        token.cancel();
        token.cancel();

        assertTrue(token.isCancellationRequested());
        assertEquals(1, counter.get());
        assertThrows(CancellationException.class, token::throwIfCancellationRequested);
    }

    @Test
    public void testRegistrationClosed() {
        CancellationToken token = CancellationToken.create();
        AtomicInteger counter = new AtomicInteger();

        token.onCancel(counter::incrementAndGet).close();
        token.cancel();

        assertEquals(0, counter.get());
    }

    @Test
    public void testOnCancelAfterCancel() {
        CancellationToken token = CancellationToken.create();
        token.cancel();

        AtomicInteger counter = new AtomicInteger();
        token.onCancel(counter::incrementAndGet);

        assertEquals(1, counter.get());
    }

    @Test
    public void testCallbackFailure() {
        CancellationToken token = CancellationToken.create();
        AtomicInteger counter = new AtomicInteger();
        IllegalStateException first = new IllegalStateException("first");

        token.onCancel(() -> {
            throw first;
        });
        token.onCancel(counter::incrementAndGet);
        token.onCancel(() -> {
            throw new IllegalStateException("second");
        });

        IllegalStateException e = assertThrows(IllegalStateException.class, token::cancel);

        assertSame(first, e);
        assertEquals(1, e.getSuppressed().length);
        assertEquals(1, counter.get());
        assertTrue(token.isCancellationRequested());
    }

    @Test
    public void testNone() {
        assertThrows(UnsupportedOperationException.class, CancellationToken.NONE::cancel);
        assertSame(CancellationToken.Registration.EMPTY, CancellationToken.NONE.onCancel(() -> {
        }));
        assertFalse(CancellationToken.NONE.isCancellationRequested());
    }
}
