package com.phillippitts.slotwatch.service.probe;

import com.phillippitts.slotwatch.domain.Status;
import com.phillippitts.slotwatch.exception.ProbeException;

/**
 * Capability contract for the page the monitor watches.
 *
 * <p>Implementations own the actual fetch, refresh and login mechanics (browser automation,
 * plain HTTP, a static page or an in-memory fake). The monitor loop is the only caller, from its
 * single worker thread, so implementations need no locking.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>{@link #ensureLoggedIn()} once before the first cycle (best effort)</li>
 *   <li>{@link #refresh()} then {@link #readStatus()} every cycle</li>
 *   <li>{@link #close()} exactly once when the monitor stops</li>
 * </ol>
 */
public interface Prober extends AutoCloseable {

    /**
     * Reloads the page.
     *
     * @throws ProbeException if the page cannot be reloaded
     */
    void refresh();

    /**
     * Returns the current status of the page, possibly from a short-lived cache.
     *
     * @throws ProbeException if the status cannot be derived at all
     */
    Status readStatus();

    /**
     * Makes sure the session is past the login page. Callers treat failures as non-fatal.
     *
     * @throws ProbeException if the login page cannot be opened
     */
    void ensureLoggedIn();

    /**
     * Releases the underlying page resources. Never throws.
     */
    @Override
    void close();
}
