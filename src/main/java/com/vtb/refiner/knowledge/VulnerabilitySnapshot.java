package com.vtb.refiner.knowledge;

import com.vtb.refiner.models.VulnerabilityRecord;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Неизменяемый на время прогона срез сведений о CVE
 */
@Data
@Builder
public class VulnerabilitySnapshot {

    @Builder.Default
    private Map<String, VulnerabilityRecord> records = new LinkedHashMap<>();

    /** CVE, по которым получить сведения не удалось: релевантность неизвестна */
    @Builder.Default
    private Set<String> unknown = new LinkedHashSet<>();

    @Builder.Default
    private List<String> notices = new ArrayList<>();

    public Optional<VulnerabilityRecord> lookup(String cveId) {
        return Optional.ofNullable(records.get(cveId));
    }

    public boolean isKnown(String cveId) {
        return records.containsKey(cveId);
    }

    public static VulnerabilitySnapshot empty() {
        return VulnerabilitySnapshot.builder().build();
    }

    /**
     * Срез, в котором все запрошенные CVE неизвестны
     */
    public static VulnerabilitySnapshot allUnknown(Set<String> cveIds, String notice) {
        VulnerabilitySnapshot snapshot = VulnerabilitySnapshot.builder().build();
        snapshot.getUnknown().addAll(cveIds);
        if (notice != null) {
            snapshot.getNotices().add(notice);
        }
        return snapshot;
    }
}
