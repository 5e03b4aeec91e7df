package com.vtb.refiner.knowledge;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vtb.refiner.models.VulnerabilityRecord;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Фид из фиксированного набора записей: офлайн режим и тесты.
 * CVE вне набора считаются неизвестными.
 */
public class StaticVulnerabilityFeed implements VulnerabilityFeed {

    private final Map<String, VulnerabilityRecord> records = new LinkedHashMap<>();

    public StaticVulnerabilityFeed(Collection<VulnerabilityRecord> records) {
        if (records != null) {
            for (VulnerabilityRecord record : records) {
                if (record != null && record.getCveId() != null) {
                    this.records.put(record.getCveId().trim().toUpperCase(Locale.ROOT), record);
                }
            }
        }
    }

    /**
     * Загрузить записи из JSON массива VulnerabilityRecord
     */
    public static StaticVulnerabilityFeed fromFile(Path path) throws IOException {
        ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        List<VulnerabilityRecord> loaded = mapper.readValue(path.toFile(),
            new TypeReference<List<VulnerabilityRecord>>() {});
        return new StaticVulnerabilityFeed(loaded);
    }

    @Override
    public VulnerabilitySnapshot fetch(Set<String> cveIds) {
        VulnerabilitySnapshot snapshot = VulnerabilitySnapshot.builder().build();
        if (cveIds == null) {
            return snapshot;
        }
        for (String cveId : cveIds) {
            VulnerabilityRecord record = records.get(cveId);
            if (record != null) {
                snapshot.getRecords().put(cveId, record);
            } else {
                snapshot.getUnknown().add(cveId);
            }
        }
        return snapshot;
    }
}
