package com.vtb.refiner.knowledge;

import com.vtb.refiner.models.VulnerabilityRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CachingVulnerabilityFeedTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");
    private static final Duration TTL = Duration.ofHours(24);

    @TempDir
    Path tempDir;

    @Test
    void freshEntriesAreServedFromCache() {
        Path file = tempDir.resolve("cve-cache.json");
        CountingFeed delegate = new CountingFeed(true);
        CachingVulnerabilityFeed feed = new CachingVulnerabilityFeed(delegate,
            new VulnerabilityCache(file, TTL, clockAt(NOW)));

        feed.fetch(ids("CVE-2021-44228", "CVE-2023-1111"));
        VulnerabilitySnapshot second = feed.fetch(ids("CVE-2021-44228", "CVE-2023-1111"));

        assertEquals(1, delegate.calls.size(), "Второй запрос должен обслуживаться из кэша");
        assertTrue(second.isKnown("CVE-2021-44228"));
        assertTrue(Files.exists(file));
    }

    @Test
    void onlyMissingEntriesAreRequested() {
        CountingFeed delegate = new CountingFeed(true);
        CachingVulnerabilityFeed feed = new CachingVulnerabilityFeed(delegate,
            new VulnerabilityCache(tempDir.resolve("cache.json"), TTL, clockAt(NOW)));

        feed.fetch(ids("CVE-2021-44228"));
        feed.fetch(ids("CVE-2021-44228", "CVE-2023-1111"));

        assertEquals(Set.of("CVE-2023-1111"), delegate.calls.get(1));
    }

    @Test
    void staleEntryIsUsedWhenFeedFails() {
        Path file = tempDir.resolve("cve-cache.json");
        new CachingVulnerabilityFeed(new CountingFeed(true), new VulnerabilityCache(file, TTL, clockAt(NOW)))
            .fetch(ids("CVE-2021-44228"));

        Clock later = clockAt(NOW.plus(Duration.ofDays(3)));
        CountingFeed broken = new CountingFeed(false);
        VulnerabilitySnapshot snapshot = new CachingVulnerabilityFeed(broken, new VulnerabilityCache(file, TTL, later))
            .fetch(ids("CVE-2021-44228", "CVE-2099-0001"));

        assertEquals(1, broken.calls.size(), "Устаревшая запись запрашивается заново");
        assertTrue(snapshot.isKnown("CVE-2021-44228"));
        assertEquals(Set.of("CVE-2099-0001"), snapshot.getUnknown());
        assertTrue(snapshot.getNotices().stream().anyMatch(n -> n.contains("CVE-2021-44228")));
    }

    @Test
    void failingDelegateStillServesCachedEntries() {
        Path file = tempDir.resolve("cve-cache.json");
        new CachingVulnerabilityFeed(new CountingFeed(true), new VulnerabilityCache(file, TTL, clockAt(NOW)))
            .fetch(ids("CVE-2021-44228"));
        Instant later = NOW.plus(Duration.ofDays(3));
        VulnerabilityCache cache = new VulnerabilityCache(file, TTL, clockAt(later));
        cache.put(VulnerabilityRecord.builder()
            .cveId("CVE-2023-1111")
            .publishedDate(LocalDate.of(2023, 2, 1))
            .fetchedAt(later)
            .build());

        VulnerabilityFeed throwing = cveIds -> {
            throw new IllegalStateException("connection reset");
        };
        VulnerabilitySnapshot snapshot = new CachingVulnerabilityFeed(throwing, cache)
            .fetch(ids("CVE-2021-44228", "CVE-2023-1111", "CVE-2099-0001"));

        assertTrue(snapshot.isKnown("CVE-2023-1111"), "Свежая запись кэша отдаётся без делегата");
        assertTrue(snapshot.isKnown("CVE-2021-44228"), "Устаревшая запись кэша используется при сбое");
        assertEquals(Set.of("CVE-2099-0001"), snapshot.getUnknown());
        assertTrue(snapshot.getNotices().stream().anyMatch(n -> n.contains("connection reset")));
    }

    @Test
    void corruptedCacheFileIsIgnored() throws Exception {
        Path file = tempDir.resolve("cve-cache.json");
        Files.writeString(file, "{not json");

        VulnerabilityCache cache = new VulnerabilityCache(file, TTL, clockAt(NOW));

        assertEquals(0, cache.size());
    }

    private static Clock clockAt(Instant instant) {
        return Clock.fixed(instant, ZoneOffset.UTC);
    }

    private static Set<String> ids(String... ids) {
        return new LinkedHashSet<>(List.of(ids));
    }

    private static class CountingFeed implements VulnerabilityFeed {
        private final boolean available;
        private final List<Set<String>> calls = new ArrayList<>();

        CountingFeed(boolean available) {
            this.available = available;
        }

        @Override
        public VulnerabilitySnapshot fetch(Set<String> cveIds) {
            calls.add(new LinkedHashSet<>(cveIds));
            VulnerabilitySnapshot snapshot = VulnerabilitySnapshot.builder().build();
            for (String cveId : cveIds) {
                if (available && !cveId.startsWith("CVE-2099")) {
                    snapshot.getRecords().put(cveId, VulnerabilityRecord.builder()
                        .cveId(cveId)
                        .publishedDate(LocalDate.of(2021, 12, 10))
                        .inKnownExploitedCatalog(cveId.equals("CVE-2021-44228"))
                        .fetchedAt(NOW)
                        .build());
                } else {
                    snapshot.getUnknown().add(cveId);
                }
            }
            return snapshot;
        }
    }
}
