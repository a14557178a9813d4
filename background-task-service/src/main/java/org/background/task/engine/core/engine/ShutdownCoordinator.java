package org.background.task.engine.core.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot shutdown signal observed by the engine's loops.
 */
public class ShutdownCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(ShutdownCoordinator.class);

    private final AtomicBoolean signalled = new AtomicBoolean(false);
    private final CountDownLatch latch = new CountDownLatch(1);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    /**
     * Registers a callback run when the signal fires. Runs immediately if it already fired.
     */
    public void onShutdown(Runnable listener) {
        if (signalled.get()) {
            runSafely(listener);
            return;
        }
        listeners.add(listener);
    }

    /**
     * Fires the signal.
     *
     * @return {@code true} for the call that fired it, {@code false} afterwards
     */
    public boolean signal() {
        if (!signalled.compareAndSet(false, true)) {
            return false;
        }
        logger.info("Shutdown signalled, notifying {} listeners", listeners.size());
        listeners.forEach(this::runSafely);
        latch.countDown();
        return true;
    }

    public boolean isShutdownRequested() {
        return signalled.get();
    }

    public boolean awaitShutdown(long timeout, TimeUnit unit) throws InterruptedException {
        return latch.await(timeout, unit);
    }

    private void runSafely(Runnable listener) {
        try {
            listener.run();
        } catch (Exception e) {
            logger.error("Shutdown listener failed", e);
        }
    }
}
