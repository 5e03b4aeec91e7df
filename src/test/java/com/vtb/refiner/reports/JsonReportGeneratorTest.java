package com.vtb.refiner.reports;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.refiner.models.Cluster;
import com.vtb.refiner.models.IndustryProfile;
import com.vtb.refiner.models.RefinementReport;
import com.vtb.refiner.models.RefinementStatistics;
import com.vtb.refiner.models.RejectedRecord;
import com.vtb.refiner.models.StrideCategory;
import com.vtb.refiner.models.Threat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonReportGeneratorTest {

    @TempDir
    Path tempDir;

    @Test
    void writesAllThreatsWithStatuses() throws Exception {
        JsonReportGenerator generator = new JsonReportGenerator();
        Path output = tempDir.resolve(generator.getFileName());

        generator.generate(sampleReport(), output);

        assertTrue(Files.exists(output));
        JsonNode root = new ObjectMapper().readTree(output.toFile());
        assertEquals("2026-01-15T10:00:00Z", root.path("generatedAt").asText(), "Дата в ISO-8601, не timestamp");
        assertEquals(2, root.path("threats").size());
        JsonNode suppressed = root.path("threats").get(1);
        assertEquals("SUPPRESSED", suppressed.path("status").asText());
        assertEquals("control:SSO", suppressed.path("suppressedReason").asText());
        assertFalse(suppressed.has("mergedInto"), "Пустые поля не сериализуются");
        assertEquals("CL-0001", root.path("clusters").get(0).path("clusterId").asText());
        assertEquals("THREAT", root.path("rejectedRecords").get(0).path("kind").asText());
        assertEquals(2, root.path("statistics").path("originalCount").asInt());
    }

    @Test
    void serializationIsStable() throws Exception {
        JsonReportGenerator generator = new JsonReportGenerator();
        assertEquals(generator.toJson(sampleReport()), generator.toJson(sampleReport()));
    }

    @Test
    void nullReportIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new JsonReportGenerator().toJson(null));
    }

    static RefinementReport sampleReport() {
        Threat active = Threat.builder()
            .id("THREAT-0001")
            .componentRef("Payment API")
            .canonicalComponent("Payment API")
            .strideCategory(StrideCategory.TAMPERING)
            .description("Payment amounts can be altered in transit")
            .inherentRiskScore(7.0)
            .clusterId("CL-0001")
            .build();
        Threat suppressed = Threat.builder()
            .id("THREAT-0002")
            .componentRef("Web Client")
            .canonicalComponent("Web Client")
            .strideCategory(StrideCategory.SPOOFING)
            .description("Session token theft")
            .inherentRiskScore(5.0)
            .build();
        suppressed.suppress("control:SSO");

        return RefinementReport.builder()
            .generatedAt(Instant.parse("2026-01-15T10:00:00Z"))
            .industry(IndustryProfile.FINANCE)
            .threats(List.of(active, suppressed))
            .clusters(List.of(Cluster.builder()
                .clusterId("CL-0001")
                .strideCategory(StrideCategory.TAMPERING)
                .memberThreatIds(List.of("THREAT-0001"))
                .representativeId("THREAT-0001")
                .build()))
            .rejectedRecords(List.of(RejectedRecord.builder()
                .kind(RejectedRecord.Kind.THREAT)
                .reference("THREAT-0003")
                .reason("пустое описание")
                .build()))
            .statistics(RefinementStatistics.builder()
                .originalCount(2)
                .suppressedByControl(1)
                .clusterCount(1)
                .finalActiveCount(1)
                .build())
            .build();
    }
}
