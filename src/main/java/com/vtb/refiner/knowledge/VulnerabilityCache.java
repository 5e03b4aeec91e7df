package com.vtb.refiner.knowledge;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vtb.refiner.models.VulnerabilityRecord;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Локальный кэш CVE -> VulnerabilityRecord с TTL, хранится в JSON файле.
 * Принадлежит экземпляру фида, а не глобальному состоянию.
 */
@Slf4j
public class VulnerabilityCache {

    private final Path file;
    private final Duration ttl;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final Map<String, VulnerabilityRecord> entries = new TreeMap<>();

    public VulnerabilityCache(Path file, Duration ttl, Clock clock) {
        this.file = file;
        this.ttl = ttl;
        this.clock = clock;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
        load();
    }

    public synchronized Optional<VulnerabilityRecord> getFresh(String cveId) {
        VulnerabilityRecord record = entries.get(cveId);
        if (record == null || !isFresh(record)) {
            return Optional.empty();
        }
        return Optional.of(record);
    }

    /**
     * Запись независимо от возраста (для отдачи устаревших данных при недоступном фиде)
     */
    public synchronized Optional<VulnerabilityRecord> getAny(String cveId) {
        return Optional.ofNullable(entries.get(cveId));
    }

    public synchronized void put(VulnerabilityRecord record) {
        if (record == null || record.getCveId() == null) {
            return;
        }
        entries.put(record.getCveId(), record);
    }

    public synchronized int size() {
        return entries.size();
    }

    /**
     * Сохранить кэш на диск. Ошибка записи не прерывает прогон.
     */
    public synchronized void save() {
        if (file == null) {
            return;
        }
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(file.toFile(), entries);
            log.debug("Кэш CVE сохранён: {} ({} записей)", file, entries.size());
        } catch (IOException e) {
            log.warn("Не удалось сохранить кэш CVE {}: {}", file, e.getMessage());
        }
    }

    private boolean isFresh(VulnerabilityRecord record) {
        Instant fetchedAt = record.getFetchedAt();
        if (fetchedAt == null) {
            return false;
        }
        return !fetchedAt.plus(ttl).isBefore(clock.instant());
    }

    private void load() {
        if (file == null || !Files.isRegularFile(file)) {
            return;
        }
        try {
            Map<String, VulnerabilityRecord> stored = mapper.readValue(file.toFile(),
                new TypeReference<Map<String, VulnerabilityRecord>>() {});
            if (stored != null) {
                entries.putAll(stored);
            }
            log.debug("Кэш CVE загружен: {} ({} записей)", file, entries.size());
        } catch (IOException e) {
            log.warn("Кэш CVE {} повреждён и будет перезаписан: {}", file, e.getMessage());
        }
    }
}
