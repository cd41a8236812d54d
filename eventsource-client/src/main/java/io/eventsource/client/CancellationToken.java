package io.eventsource.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * A one-shot cooperative cancellation signal.
 *
 * <p>Blocking code either polls {@link #isCancelled()}, waits with {@link #await(Duration)}, or
 * registers a hook with {@link #onCancel(Runnable)} that unblocks it (closing a stream,
 * interrupting a thread). Tokens form a tree: cancelling a parent cancels its children.
 *
 * <p>This class is thread-safe.
 */
public final class CancellationToken {
    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final CountDownLatch latch = new CountDownLatch(1);
    private final Set<Runnable> hooks = new LinkedHashSet<>();
    private volatile boolean cancelled;

    /**
     * Handle returned by {@link #onCancel(Runnable)}; closing it unregisters the hook.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * Creates a token that is cancelled together with this one, but can also be cancelled on its own.
     *
     * @return the child token
     */
    public CancellationToken child() {
        CancellationToken child = new CancellationToken();
        Registration link = onCancel(child::cancel);
        child.onCancel(link::close);
        return child;
    }

    /**
     * Cancels the token and runs every registered hook on the calling thread.
     *
     * @return false if the token was already cancelled
     */
    public boolean cancel() {
        List<Runnable> toRun;
        synchronized (this) {
            if (cancelled) {
                return false;
            }
            cancelled = true;
            toRun = new ArrayList<>(hooks);
            hooks.clear();
        }
        latch.countDown();
        for (Runnable hook : toRun) {
            runHook(hook);
        }
        return true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Registers a hook to run on cancellation. Runs it immediately if the token is already cancelled.
     *
     * @param hook the action, typically one that unblocks a waiting thread
     * @return a registration that removes the hook when closed
     */
    public Registration onCancel(Runnable hook) {
        Objects.requireNonNull(hook, "hook");
        synchronized (this) {
            if (!cancelled) {
                hooks.add(hook);
                return () -> {
                    synchronized (CancellationToken.this) {
                        hooks.remove(hook);
                    }
                };
            }
        }
        runHook(hook);
        return () -> { };
    }

    /**
     * Waits until the token is cancelled or the timeout elapses, whichever comes first.
     *
     * @return true if the token was cancelled
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean await(Duration timeout) throws InterruptedException {
        long nanos = timeout.isNegative() ? 0 : saturatedNanos(timeout);
        return latch.await(nanos, TimeUnit.NANOSECONDS);
    }

    private static long saturatedNanos(Duration d) {
        try {
            return d.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private static void runHook(Runnable hook) {
        try {
            hook.run();
        } catch (RuntimeException e) {
            log.warn("cancellation hook failed", e);
        }
    }
}
