package io.cadence.core.detached;

import java.nio.file.Path;
import java.time.Instant;

public record DetachedHandle(String ticketId, Instant fireAt, long pid, Path ticket) {
}
