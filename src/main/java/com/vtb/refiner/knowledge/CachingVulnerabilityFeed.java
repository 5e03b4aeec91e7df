package com.vtb.refiner.knowledge;

import com.vtb.refiner.config.RefinerConfig;
import com.vtb.refiner.models.VulnerabilityRecord;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Фид с локальным кэшем: свежие записи отдаются из кэша, устаревшие и отсутствующие
 * запрашиваются у делегата одним вызовом. Если делегат не смог обновить запись,
 * отдаётся устаревшая копия с предупреждением.
 */
@Slf4j
public class CachingVulnerabilityFeed implements VulnerabilityFeed {

    private final VulnerabilityFeed delegate;
    private final VulnerabilityCache cache;

    public CachingVulnerabilityFeed(VulnerabilityFeed delegate, VulnerabilityCache cache) {
        this.delegate = delegate;
        this.cache = cache;
    }

    /**
     * Удалённый фид (NVD + CISA KEV) с файловым кэшем и TTL из конфигурации
     */
    public static CachingVulnerabilityFeed remote(RefinerConfig.Cve config, Path cacheFile, Clock clock) {
        FeedSettings settings = new FeedSettings(config);
        return new CachingVulnerabilityFeed(new RemoteVulnerabilityFeed(config, clock),
            new VulnerabilityCache(cacheFile, settings.cacheTtl(), clock));
    }

    @Override
    public VulnerabilitySnapshot fetch(Set<String> cveIds) {
        VulnerabilitySnapshot snapshot = VulnerabilitySnapshot.builder().build();
        if (cveIds == null || cveIds.isEmpty()) {
            return snapshot;
        }

        Set<String> toFetch = new LinkedHashSet<>();
        for (String cveId : cveIds) {
            Optional<VulnerabilityRecord> cached = cache.getFresh(cveId);
            if (cached.isPresent()) {
                snapshot.getRecords().put(cveId, cached.get());
            } else {
                toFetch.add(cveId);
            }
        }
        log.info("CVE из кэша: {}, к запросу: {}", snapshot.getRecords().size(), toFetch.size());
        if (toFetch.isEmpty()) {
            return snapshot;
        }

        VulnerabilitySnapshot fetched;
        try {
            fetched = delegate.fetch(toFetch);
        } catch (RuntimeException e) {
            log.warn("Фид уязвимостей завершился ошибкой, используется только кэш: {}", e.getMessage());
            fetched = VulnerabilitySnapshot.builder().build();
            fetched.getNotices().add("Фид уязвимостей недоступен: " + e.getMessage());
        }
        snapshot.getNotices().addAll(fetched.getNotices());
        for (String cveId : toFetch) {
            Optional<VulnerabilityRecord> record = fetched.lookup(cveId);
            if (record.isPresent()) {
                cache.put(record.get());
                snapshot.getRecords().put(cveId, record.get());
                continue;
            }
            Optional<VulnerabilityRecord> stale = cache.getAny(cveId);
            if (stale.isPresent()) {
                snapshot.getRecords().put(cveId, stale.get());
                snapshot.getNotices().add("Для " + cveId + " использована устаревшая запись кэша от "
                    + stale.get().getFetchedAt());
            } else {
                snapshot.getUnknown().add(cveId);
            }
        }
        cache.save();
        return snapshot;
    }
}
