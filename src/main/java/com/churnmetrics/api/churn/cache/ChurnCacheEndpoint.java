package com.churnmetrics.api.churn.cache;

import lombok.NonNull;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;
import org.springframework.boot.actuate.endpoint.annotation.WriteOperation;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Actuator endpoint ({@code /actuator/churncache}) to inspect and bump the churn cache version.
 */
@Component
@Endpoint(id = "churncache")
public class ChurnCacheEndpoint {

    private final ChurnCacheVersion cacheVersion;

    @Autowired
    ChurnCacheEndpoint(@NonNull ChurnCacheVersion cacheVersion) {
        this.cacheVersion = cacheVersion;
    }

    @NonNull
    @ReadOperation
    public Map<String, Long> version() {
        return Map.of("version", cacheVersion.current());
    }

    @NonNull
    @WriteOperation
    public Map<String, Long> bump() {
        return Map.of("version", cacheVersion.bump());
    }
}
