package com.phillippitts.slotwatch.domain;

/**
 * Semantic classification of the probed page.
 *
 * <p>{@link #CAPTCHA} and {@link #BLOCKED} are anti-automation responses that the monitor treats
 * as failures; the remaining values are regular observations of the page.
 */
public enum Status {
    OK,
    NO_SLOTS,
    MAYBE_SLOTS,
    CAPTCHA,
    BLOCKED;

    /**
     * @return true for statuses that count as a breaker failure (CAPTCHA, BLOCKED)
     */
    public boolean isAntiAutomation() {
        return this == CAPTCHA || this == BLOCKED;
    }
}
