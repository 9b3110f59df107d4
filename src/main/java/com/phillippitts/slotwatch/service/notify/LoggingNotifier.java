package com.phillippitts.slotwatch.service.notify;

import com.phillippitts.slotwatch.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Offline notifier: writes every message to the log instead of delivering it.
 */
public class LoggingNotifier implements Notifier {

    private static final Logger LOG = LogManager.getLogger(LoggingNotifier.class);
    private static final int PREVIEW_CHARS = 120;

    @Override
    public void send(long recipientId, String text) {
        LOG.info("[notify:{}] {}", recipientId, LogSanitizer.truncate(text, PREVIEW_CHARS));
    }
}
