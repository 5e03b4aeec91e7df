package com.vtb.refiner.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Сведения о CVE из внешнего фида. Неизменяемы в пределах прогона.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class VulnerabilityRecord {
    private String cveId;
    private LocalDate publishedDate;
    private boolean inKnownExploitedCatalog;
    /** Когда запись получена из фида (для TTL кэша) */
    private Instant fetchedAt;
}
