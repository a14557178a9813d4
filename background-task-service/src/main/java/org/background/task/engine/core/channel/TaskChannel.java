package org.background.task.engine.core.channel;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Ordered multi-producer, single-consumer channel.
 *
 * <p>Messages are handed to the handler one at a time on a dedicated thread, in the order they
 * were sent. A failing handler is logged and the loop moves on. After {@link #close()} no new
 * messages are accepted and the consumer exits once the backlog is drained.
 *
 * @param <T> message type
 */
public class TaskChannel<T> {

    private static final Logger logger = LoggerFactory.getLogger(TaskChannel.class);
    private static final long POLL_INTERVAL_MS = 100;

    private final String name;
    private final Consumer<T> handler;
    private final BlockingQueue<T> messages = new LinkedBlockingQueue<>();
    private final ExecutorService consumer;

    private volatile boolean closed = false;

    public TaskChannel(String name, Consumer<T> handler) {
        this.name = name;
        this.handler = handler;
        this.consumer = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                .setNameFormat(name + "-%d")
                .setDaemon(true)
                .setUncaughtExceptionHandler((thread, e) ->
                        logger.error("Uncaught exception in thread {}: {}", thread.getName(), e.getMessage(), e))
                .build());
    }

    public void start() {
        consumer.submit(this::consumeLoop);
        logger.debug("Channel {} started", name);
    }

    /**
     * Queues a message for the consumer.
     *
     * @return {@code false} if the channel is closed and the message was dropped
     */
    public boolean send(T message) {
        if (closed) {
            logger.warn("Channel {} is closed, dropping message: {}", name, message);
            return false;
        }
        if (!messages.offer(message)) {
            logger.warn("Channel {} rejected message: {}", name, message);
            return false;
        }
        return true;
    }

    /**
     * Stops accepting messages. Messages already sent are still delivered.
     */
    public void close() {
        closed = true;
    }

    /**
     * Closes the channel and waits for the consumer to drain its backlog.
     *
     * @return {@code true} if the consumer finished within the timeout
     */
    public boolean closeAndAwait(long timeout, TimeUnit unit) {
        close();
        consumer.shutdown();
        try {
            if (!consumer.awaitTermination(timeout, unit)) {
                logger.warn("Channel {} did not drain within {} {}, forcing shutdown", name, timeout, unit);
                consumer.shutdownNow();
                return false;
            }
            return true;
        } catch (InterruptedException e) {
            consumer.shutdownNow();
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public boolean isClosed() {
        return closed;
    }

    public int pending() {
        return messages.size();
    }

    public String getName() {
        return name;
    }

    private void consumeLoop() {
        logger.debug("Channel {} consumer running", name);
        while (!closed || !messages.isEmpty()) {
            T message;
            try {
                message = messages.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                logger.info("Channel {} consumer interrupted with {} pending messages", name, messages.size());
                Thread.currentThread().interrupt();
                break;
            }
            if (message == null) {
                continue;
            }
            try {
                handler.accept(message);
            } catch (Exception e) {
                logger.error("Channel {} failed to handle message {}", name, message, e);
            }
        }
        logger.debug("Channel {} consumer stopped", name);
    }
}
