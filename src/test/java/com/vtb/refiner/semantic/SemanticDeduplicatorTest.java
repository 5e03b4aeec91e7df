package com.vtb.refiner.semantic;

import com.vtb.refiner.models.Cluster;
import com.vtb.refiner.models.StrideCategory;
import com.vtb.refiner.models.Threat;
import com.vtb.refiner.models.ThreatStatus;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SemanticDeduplicatorTest {

    private static final String IN_TRANSIT =
        "An attacker can tamper with payment amounts in transit to the Payment API";
    private static final String IN_TRANSIT_PARAPHRASE =
        "The attacker could tamper with payment amounts while in transit to the Payment API";

    @Test
    void paraphrasesOnSameComponentAreMerged() {
        Threat first = threat("THREAT-0001", "Payment API", StrideCategory.TAMPERING, IN_TRANSIT, 7.0);
        Threat second = threat("THREAT-0002", "Payment API", StrideCategory.TAMPERING, IN_TRANSIT_PARAPHRASE, 8.0);

        List<Cluster> clusters = new SemanticDeduplicator(0.85).deduplicate(List.of(first, second));

        assertEquals(1, clusters.size());
        assertEquals("THREAT-0002", clusters.get(0).getRepresentativeId(), "Представитель - угроза с большим риском");
        assertEquals(ThreatStatus.ACTIVE, second.getStatus());
        assertEquals(ThreatStatus.MERGED, first.getStatus());
        assertEquals("THREAT-0002", first.getMergedInto());
        assertEquals("CL-0001", first.getClusterId());
        assertEquals("CL-0001", second.getClusterId());
    }

    @Test
    void differentStrideCategoriesNeverShareCluster() {
        Threat tampering = threat("THREAT-0001", "Payment API", StrideCategory.TAMPERING, IN_TRANSIT, 7.0);
        Threat spoofing = threat("THREAT-0002", "Payment API", StrideCategory.SPOOFING, IN_TRANSIT, 7.0);

        List<Cluster> clusters = new SemanticDeduplicator(new TermVectorEmbedder(), 0.01, false)
            .deduplicate(List.of(tampering, spoofing));

        assertEquals(2, clusters.size());
        for (Cluster cluster : clusters) {
            Set<StrideCategory> categories = new LinkedHashSet<>();
            for (String id : cluster.getMemberThreatIds()) {
                categories.add(id.equals("THREAT-0001") ? tampering.getStrideCategory() : spoofing.getStrideCategory());
            }
            assertEquals(1, categories.size());
        }
        assertTrue(tampering.isActive());
        assertTrue(spoofing.isActive());
    }

    @Test
    void representativeAbsorbsReferencesAndMitigations() {
        Threat first = threat("THREAT-0001", "Payment API", StrideCategory.TAMPERING, IN_TRANSIT, 7.0);
        first.getCitedCves().add("CVE-2023-1111");
        first.getMitigationSuggestions().add("Sign requests");
        first.getMitigationSuggestions().add("Use TLS");
        Threat second = threat("THREAT-0002", "Payment API", StrideCategory.TAMPERING, IN_TRANSIT_PARAPHRASE, 8.0);
        second.getCitedCves().add("CVE-2024-2222");
        second.getOtherReferences().add("CWE-345");
        second.getMitigationSuggestions().add("Use TLS");

        Set<String> allCves = new LinkedHashSet<>();
        allCves.addAll(first.getCitedCves());
        allCves.addAll(second.getCitedCves());

        new SemanticDeduplicator(0.85).deduplicate(List.of(first, second));

        assertEquals(allCves, second.getCitedCves(), "CVE участников не должны теряться");
        assertEquals(List.of("CVE-2024-2222", "CVE-2023-1111"), new ArrayList<>(second.getCitedCves()));
        assertEquals(List.of("Use TLS", "Sign requests"), second.getMitigationSuggestions());
        assertTrue(second.getOtherReferences().contains("CWE-345"));
    }

    @Test
    void unrelatedThreatsStaySingletons() {
        Threat first = threat("THREAT-0001", "Payment API", StrideCategory.TAMPERING, IN_TRANSIT, 7.0);
        Threat other = threat("THREAT-0002", "Payment API", StrideCategory.TAMPERING,
            "Database administrator can alter stored ledger balances directly", 6.0);

        List<Cluster> clusters = new SemanticDeduplicator(0.85).deduplicate(List.of(first, other));

        assertEquals(2, clusters.size());
        assertEquals(List.of("THREAT-0001"), clusters.get(0).getMemberThreatIds());
        assertEquals("CL-0002", other.getClusterId());
        assertTrue(first.isActive());
        assertTrue(other.isActive());
    }

    @Test
    void tieOnScorePrefersShorterThenLexicalId() {
        Threat longId = threat("T-10", "Payment API", StrideCategory.TAMPERING, IN_TRANSIT, 5.0);
        Threat shortId = threat("T-2", "Payment API", StrideCategory.TAMPERING, IN_TRANSIT_PARAPHRASE, 5.0);

        List<Cluster> clusters = new SemanticDeduplicator(0.85).deduplicate(List.of(longId, shortId));

        assertEquals("T-2", clusters.get(0).getRepresentativeId());
        assertEquals(ThreatStatus.MERGED, longId.getStatus());
    }

    @Test
    void sameComponentGuardSeparatesComponents() {
        String description = "An attacker can tamper with payment amounts in transit";
        Threat payment = threat("THREAT-0001", "Payment API", StrideCategory.TAMPERING, description, 7.0);
        Threat refund = threat("THREAT-0002", "Refund API", StrideCategory.TAMPERING, description, 7.0);

        List<Cluster> merged = new SemanticDeduplicator(new TermVectorEmbedder(), 0.85, false)
            .deduplicate(List.of(payment, refund));
        assertEquals(1, merged.size(), "Без ограничения угрозы разных компонентов сливаются");

        Threat payment2 = threat("THREAT-0001", "Payment API", StrideCategory.TAMPERING, description, 7.0);
        Threat refund2 = threat("THREAT-0002", "Refund API", StrideCategory.TAMPERING, description, 7.0);
        List<Cluster> guarded = new SemanticDeduplicator(new TermVectorEmbedder(), 0.85, true)
            .deduplicate(List.of(payment2, refund2));
        assertEquals(2, guarded.size());
    }

    @Test
    void inactiveThreatIsRejected() {
        Threat suppressed = threat("THREAT-0001", "Payment API", StrideCategory.TAMPERING, IN_TRANSIT, 7.0);
        suppressed.suppress("control:WAF");

        assertThrows(IllegalStateException.class,
            () -> new SemanticDeduplicator(0.85).deduplicate(List.of(suppressed)));
    }

    private static Threat threat(String id, String component, StrideCategory category, String description, double score) {
        return Threat.builder()
            .id(id)
            .componentRef(component)
            .canonicalComponent(component)
            .strideCategory(category)
            .description(description)
            .inherentRiskScore(score)
            .build();
    }
}
