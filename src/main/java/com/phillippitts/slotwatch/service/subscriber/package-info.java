/**
 * Subscriber registry contract and its file and in-memory stores.
 */
package com.phillippitts.slotwatch.service.subscriber;
