package com.splitttr.formcollab.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.List;

@ConfigMapping(prefix = "collab")
public interface CollabConfig {

    /** Inactivity after which the idle reaper evicts a collaborator. */
    @WithDefault("5m")
    Duration idleThreshold();

    @WithDefault("60s")
    Duration reaperInterval();

    @WithDefault("1000")
    int historyMaxEntries();

    @WithDefault("10m")
    Duration historyMaxAge();

    /**
     * A history entry submitted later than {@code incoming.submittedAt - conflictWindow}
     * is treated as concurrent with the incoming operation.
     */
    @WithDefault("100ms")
    Duration conflictWindow();

    @WithDefault("5")
    int storeRetryMaxAttempts();

    @WithDefault("500ms")
    Duration storeRetryInitialBackoff();

    @WithDefault("30s")
    Duration storeRetryMaxBackoff();

    @WithDefault("#EF4444,#F59E0B,#10B981,#3B82F6,#8B5CF6,#EC4899,#14B8A6,#F97316")
    List<String> colors();
}
