/**
 * Maps exceptions to JSON error responses at the REST boundary.
 */
package com.phillippitts.slotwatch.presentation.exception;
