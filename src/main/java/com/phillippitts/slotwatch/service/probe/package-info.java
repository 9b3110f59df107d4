/**
 * Page probing: the {@link com.phillippitts.slotwatch.service.probe.Prober} contract the monitor
 * loop calls, a page-source based implementation and the marker classifier.
 */
package com.phillippitts.slotwatch.service.probe;
