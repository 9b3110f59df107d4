package com.phillippitts.slotwatch.service.probe;

import com.phillippitts.slotwatch.domain.Status;

/** Turns raw page content into a {@link Status}. */
@FunctionalInterface
public interface StatusClassifier {

    /**
     * @param content raw page content, may be empty but never null
     * @return derived status; implementations return a non-alerting status instead of throwing
     */
    Status classify(String content);
}
