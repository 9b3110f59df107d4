/**
 * REST surface of the service.
 */
package com.phillippitts.slotwatch.presentation;
