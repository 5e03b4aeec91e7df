package com.vtb.refiner.suppression;

import com.vtb.refiner.knowledge.VulnerabilitySnapshot;
import com.vtb.refiner.models.Threat;
import com.vtb.refiner.models.VulnerabilityRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Фильтр устаревших CVE.
 *
 * CVE нерелевантна, если опубликована раньше окна актуальности (по умолчанию 5 лет до даты
 * прогона) и не входит в каталог известных эксплуатируемых уязвимостей. Угроза подавляется
 * со stale_cve, только если все её CVE нерелевантны и других обоснований риска нет.
 * Неизвестная CVE подавления не вызывает.
 */
@Slf4j
public class CveRelevanceFilter {

    public static final String STALE_CVE_REASON = "stale_cve";

    /** CWE, CAPEC и техники ATT&CK как самостоятельное обоснование риска */
    static final Pattern OTHER_JUSTIFICATION = Pattern.compile(
        "\\b(CWE-\\d+|CAPEC-\\d+|T\\d{4}(\\.\\d{3})?)\\b", Pattern.CASE_INSENSITIVE);

    private final VulnerabilitySnapshot snapshot;
    private final LocalDate referenceDate;
    private final int stalenessYears;

    public CveRelevanceFilter(VulnerabilitySnapshot snapshot, LocalDate referenceDate, int stalenessYears) {
        this.snapshot = snapshot != null ? snapshot : VulnerabilitySnapshot.empty();
        this.referenceDate = referenceDate;
        this.stalenessYears = stalenessYears;
    }

    /**
     * Отметить нерелевантные CVE и при необходимости подавить угрозу.
     *
     * @return true, если угроза подавлена
     */
    public boolean apply(Threat threat) {
        if (!threat.isActive() || threat.getCitedCves().isEmpty()) {
            return false;
        }

        Set<String> irrelevant = new LinkedHashSet<>();
        boolean allIrrelevant = true;
        for (String cveId : threat.getCitedCves()) {
            if (isIrrelevant(cveId)) {
                irrelevant.add(cveId);
            } else {
                allIrrelevant = false;
            }
        }
        threat.getIrrelevantCves().addAll(irrelevant);

        if (allIrrelevant && !hasOtherJustification(threat)) {
            threat.suppress(STALE_CVE_REASON);
            log.debug("Угроза {} подавлена: все CVE устарели {}", threat.getId(), irrelevant);
            return true;
        }
        if (!irrelevant.isEmpty()) {
            log.debug("Угроза {}: нерелевантные CVE {}", threat.getId(), irrelevant);
        }
        return false;
    }

    /**
     * Нерелевантность доказана только для известной записи: старше окна и не в KEV
     */
    public boolean isIrrelevant(String cveId) {
        Optional<VulnerabilityRecord> record = snapshot.lookup(cveId);
        return record.isPresent() && isStale(record.get());
    }

    public boolean isStale(VulnerabilityRecord record) {
        if (record.isInKnownExploitedCatalog() || record.getPublishedDate() == null) {
            return false;
        }
        return record.getPublishedDate().plusYears(stalenessYears).isBefore(referenceDate);
    }

    static boolean hasOtherJustification(Threat threat) {
        if (!threat.getOtherReferences().isEmpty()) {
            return true;
        }
        return threat.getDescription() != null && OTHER_JUSTIFICATION.matcher(threat.getDescription()).find();
    }
}
