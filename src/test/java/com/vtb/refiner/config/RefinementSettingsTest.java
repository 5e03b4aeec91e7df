package com.vtb.refiner.config;

import com.vtb.refiner.models.Exploitability;
import com.vtb.refiner.models.IndustryProfile;
import com.vtb.refiner.models.MitigationMaturity;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RefinementSettingsTest {

    @Test
    void defaultsMatchDocumentedValues() {
        RefinementSettings settings = RefinementSettings.defaults();

        assertEquals(0.6, settings.getComponentAcceptanceThreshold());
        assertEquals(0.85, settings.getSimilarityThreshold());
        assertEquals(5, settings.getCveStalenessYears());
        assertEquals(0.8, settings.exploitabilityFactor(Exploitability.LOW));
        assertEquals(1.25, settings.exploitabilityFactor(Exploitability.HIGH));
        assertEquals(0.7, settings.maturityFactor(MitigationMaturity.PARTIAL));
        assertEquals(1, settings.getParallelism());
    }

    @Test
    void builtFromConfig() {
        RefinerConfig config = new RefinerConfig();
        config.ensureDefaults();
        config.getDeduplication().setSimilarityThreshold(0.9);
        config.getPipeline().setParallelism(3);
        config.getPipeline().setIndustry("healthcare");

        RefinementSettings settings = RefinementSettings.from(config);

        assertEquals(0.9, settings.getSimilarityThreshold());
        assertEquals(3, settings.getParallelism());
        assertEquals(IndustryProfile.HEALTHCARE, settings.getIndustry());
        assertEquals(0.4, settings.maturityFactor(MitigationMaturity.STRONG));
    }

    @Test
    void nonMonotonicFactorsAreReplacedWithDefaults() {
        RefinementSettings settings = RefinementSettings.builder()
            .exploitabilityFactors(Map.of(Exploitability.LOW, 1.5, Exploitability.MEDIUM, 1.0,
                Exploitability.HIGH, 1.25))
            .maturityFactors(Map.of(MitigationMaturity.NONE, 0.5, MitigationMaturity.PARTIAL, 0.7,
                MitigationMaturity.STRONG, 1.0))
            .similarityThreshold(0.9)
            .build();

        RefinementSettings corrected = settings.withMonotonicFactors();

        assertEquals(0.8, corrected.exploitabilityFactor(Exploitability.LOW));
        assertEquals(0.4, corrected.maturityFactor(MitigationMaturity.STRONG));
        assertEquals(1.0, corrected.maturityFactor(MitigationMaturity.NONE));
        assertEquals(0.9, corrected.getSimilarityThreshold(), "Остальные параметры сохраняются");
    }

    @Test
    void monotonicFactorsAreKept() {
        RefinementSettings settings = RefinementSettings.builder()
            .maturityFactors(Map.of(MitigationMaturity.NONE, 1.0, MitigationMaturity.PARTIAL, 0.8,
                MitigationMaturity.STRONG, 0.5))
            .build();

        assertSame(settings, settings.withMonotonicFactors());
    }

    @Test
    void describeListsProcessingParameters() {
        Map<String, Object> description = RefinementSettings.defaults().describe();

        assertEquals(0.85, description.get("similarityThreshold"));
        assertEquals(5, description.get("cveRelevanceYears"));
        assertFalse(description.containsKey("parallelism"), "Параллелизм не влияет на результат");
    }
}
