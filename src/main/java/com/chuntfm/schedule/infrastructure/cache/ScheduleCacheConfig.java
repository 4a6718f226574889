package com.chuntfm.schedule.infrastructure.cache;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for the schedule snapshot cache and its staleness probe.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "chuntfm.cache")
public class ScheduleCacheConfig {

    /** Maximum snapshot age before the next read triggers a rebuild. Zero disables the TTL. */
    @NotNull
    private Duration ttl = Duration.ofMinutes(5);

    private boolean probeEnabled = true;

    /** Minimum time between two fingerprint probes, across all request threads. */
    @NotNull
    private Duration probeInterval = Duration.ofSeconds(10);

    /** Columns whose latest value marks the last modification of the table. */
    @NotNull
    private List<@Pattern(regexp = "[A-Za-z_][A-Za-z0-9_]*") String> modifiedColumns =
            new ArrayList<>(List.of("updated_at", "created_at"));

    /** How long a reader waits for the very first snapshot built by another thread. */
    @NotNull
    private Duration initialLoadTimeout = Duration.ofSeconds(30);

    public Duration getTtl() {
        return ttl;
    }

    public void setTtl(Duration ttl) {
        this.ttl = ttl;
    }

    public boolean isTtlEnabled() {
        return ttl != null && !ttl.isZero() && !ttl.isNegative();
    }

    public boolean isProbeEnabled() {
        return probeEnabled;
    }

    public void setProbeEnabled(boolean probeEnabled) {
        this.probeEnabled = probeEnabled;
    }

    public Duration getProbeInterval() {
        return probeInterval;
    }

    public void setProbeInterval(Duration probeInterval) {
        this.probeInterval = probeInterval;
    }

    public List<String> getModifiedColumns() {
        return modifiedColumns;
    }

    public void setModifiedColumns(List<String> modifiedColumns) {
        this.modifiedColumns = modifiedColumns;
    }

    public Duration getInitialLoadTimeout() {
        return initialLoadTimeout;
    }

    public void setInitialLoadTimeout(Duration initialLoadTimeout) {
        this.initialLoadTimeout = initialLoadTimeout;
    }
}
