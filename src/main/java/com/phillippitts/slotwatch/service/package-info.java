/**
 * Service layer: probing, pacing, notification, subscribers and the monitor loop that ties
 * them together.
 */
package com.phillippitts.slotwatch.service;
