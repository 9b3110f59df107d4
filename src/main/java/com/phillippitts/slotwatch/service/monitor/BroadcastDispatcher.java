package com.phillippitts.slotwatch.service.monitor;

import com.phillippitts.slotwatch.service.notify.Notifier;
import com.phillippitts.slotwatch.service.subscriber.SubscriberRegistry;
import com.phillippitts.slotwatch.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Sends one message to every registered recipient, isolating recipients from each other.
 *
 * <p>With an executor, every send becomes its own task and failures are only logged from the
 * completion callback; the caller never waits. A rejected submission is logged and the next
 * recipient is still attempted. Without an executor, sends run one after another on the calling
 * thread, each guarded separately.
 *
 * <p>{@link #broadcast(String)} never throws.
 */
public class BroadcastDispatcher {

    private static final Logger LOG = LogManager.getLogger(BroadcastDispatcher.class);
    private static final int PREVIEW_CHARS = 40;

    private final Notifier notifier;
    private final SubscriberRegistry registry;
    private final Executor executor;

    /**
     * @param executor pool for sends, or null for sequential sends on the caller thread
     */
    public BroadcastDispatcher(Notifier notifier, SubscriberRegistry registry, Executor executor) {
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.executor = executor;
    }

    /**
     * Dispatches {@code text} to a snapshot of the current recipients.
     *
     * @return number of recipients a send was started for (submitted to the executor, or invoked
     *         when sequential); recipients whose submission was rejected are not counted
     */
    public int broadcast(String text) {
        List<Long> recipients;
        try {
            Collection<Long> all = registry.all();
            recipients = List.copyOf(all);
        } catch (RuntimeException e) {
            LOG.error("Could not load recipients; nothing sent", e);
            return 0;
        }
        if (recipients.isEmpty()) {
            LOG.info("No subscribers; skipping broadcast '{}'", LogSanitizer.truncate(text, PREVIEW_CHARS));
            return 0;
        }
        LOG.info("Broadcasting to {} recipient(s): '{}'", recipients.size(), LogSanitizer.truncate(text, PREVIEW_CHARS));

        int dispatched = 0;
        for (Long id : recipients) {
            if (executor == null) {
                sendNow(id, text);
                dispatched++;
            } else if (submit(id, text)) {
                dispatched++;
            }
        }
        return dispatched;
    }

    private void sendNow(long id, String text) {
        try {
            notifier.send(id, text);
        } catch (RuntimeException e) {
            LOG.warn("Send to {} failed: {}", id, e.getMessage());
        }
    }

    private boolean submit(long id, String text) {
        try {
            CompletableFuture.runAsync(() -> notifier.send(id, text), executor)
                    .whenComplete((ignored, ex) -> {
                        if (ex != null) {
                            Throwable cause = ex instanceof CompletionException && ex.getCause() != null
                                    ? ex.getCause() : ex;
                            LOG.warn("Send to {} failed: {}", id, cause.getMessage());
                        }
                    });
            return true;
        } catch (RejectedExecutionException e) {
            LOG.warn("Send to {} rejected by notification pool: {}", id, e.getMessage());
            return false;
        }
    }
}
