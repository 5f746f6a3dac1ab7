package com.churnmetrics.api.churn.cache;

import com.churnmetrics.api.churn.ChurnConfiguration;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide version of the day-level churn cache. Every cache key embeds the current version,
 * so bumping it orphans all existing entries at once.
 */
@Component
@Slf4j
public class ChurnCacheVersion {

    private final AtomicLong version;

    @Autowired
    public ChurnCacheVersion(@NonNull ChurnConfiguration config) {
        this(config.getCacheVersion());
    }

    public ChurnCacheVersion(long initialVersion) {
        this.version = new AtomicLong(initialVersion);
    }

    public long current() {
        return version.get();
    }

    /**
     * Invalidates all cached churn days.
     *
     * @return the new version.
     */
    public long bump() {
        val next = version.incrementAndGet();
        log.info("bumped churn cache version to {}", next);
        return next;
    }
}
