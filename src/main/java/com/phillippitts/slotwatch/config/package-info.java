/**
 * Spring configuration: typed properties, bean wiring for the monitor and its collaborators,
 * and the notification thread pool.
 */
package com.phillippitts.slotwatch.config;
