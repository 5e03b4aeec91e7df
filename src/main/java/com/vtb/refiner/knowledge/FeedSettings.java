package com.vtb.refiner.knowledge;

import com.vtb.refiner.config.RefinerConfig;

import java.time.Duration;

class FeedSettings {
    private final RefinerConfig.Cve config;

    FeedSettings(RefinerConfig.Cve config) {
        this.config = config;
    }

    String nvdApiUrl() {
        return config.getNvdApiUrl();
    }

    String nvdApiKey() {
        return config.getNvdApiKey();
    }

    String kevCatalogUrl() {
        return config.getKevCatalogUrl();
    }

    int timeoutSec() {
        return config.getTimeoutSec() != null ? config.getTimeoutSec() : 30;
    }

    Duration cacheTtl() {
        return Duration.ofHours(config.getCacheTtlHours() != null ? config.getCacheTtlHours() : 24);
    }

    RetryPolicy retryPolicy() {
        RefinerConfig.Retry retry = config.getRetry();
        if (retry == null) {
            return RetryPolicy.defaults();
        }
        return new RetryPolicy(retry.getMaxAttempts(), retry.getInitialDelayMs(), retry.getMultiplier());
    }
}
