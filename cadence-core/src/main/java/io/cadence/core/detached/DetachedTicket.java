package io.cadence.core.detached;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.cadence.core.dispatch.DispatchSettings;
import java.time.Instant;

/**
 * Fire-at record of a detached one-shot task, read by the background process that runs it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DetachedTicket(
    String id,
    String command,
    Instant createdAt,
    Instant fireAt,
    DispatchSettings dispatch
) {
}
