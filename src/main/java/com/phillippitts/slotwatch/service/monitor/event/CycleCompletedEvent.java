package com.phillippitts.slotwatch.service.monitor.event;

import com.phillippitts.slotwatch.domain.Status;

import java.time.Instant;

/** Published after every cycle that produced a status. */
public record CycleCompletedEvent(long cycle, Status status, Instant at) { }
