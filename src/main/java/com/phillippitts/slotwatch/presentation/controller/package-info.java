/**
 * REST controllers: monitor status and control, subscriber management.
 */
package com.phillippitts.slotwatch.presentation.controller;
