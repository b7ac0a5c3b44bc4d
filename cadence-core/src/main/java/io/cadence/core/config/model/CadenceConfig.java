package io.cadence.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.cadence.core.dispatch.DispatchSettings;
import java.time.DateTimeException;
import java.time.ZoneId;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CadenceConfig(
    String timezone,
    StoreConfig store,
    DispatchSettings dispatch,
    DetachedConfig detached
) {

    public static CadenceConfig defaults() {
        return new CadenceConfig(
            "",
            StoreConfig.defaults(),
            DispatchSettings.defaults(),
            DetachedConfig.defaults()
        );
    }

    /**
     * Zone used to interpret wall-clock times; blank means the system default.
     */
    public ZoneId zone() {
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid timezone in config: " + timezone, e);
        }
    }
}
