package io.cadence.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StoreConfig(String path) {

    public static StoreConfig defaults() {
        return new StoreConfig("~/.cadence/jobs.json");
    }
}
