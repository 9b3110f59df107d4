/**
 * Notification transports used by the broadcast dispatcher.
 */
package com.phillippitts.slotwatch.service.notify;
