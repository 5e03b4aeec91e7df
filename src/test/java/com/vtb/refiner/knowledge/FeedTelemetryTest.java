package com.vtb.refiner.knowledge;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FeedTelemetryTest {

    @Test
    void summarizeCountsAndNotices() {
        FeedTelemetry telemetry = new FeedTelemetry();
        telemetry.recordResponse("/kev", 200, 120);
        telemetry.recordResponse("/nvd?cveId=CVE-2099-0001", 404, 40);
        telemetry.recordResponse("/nvd?cveId=CVE-2021-44228", 429, 30);
        telemetry.recordResponse("/nvd?cveId=CVE-2021-44228", 502, 30);
        telemetry.recordFailure("CVE-2021-44228", "HTTP 502");

        FeedTelemetry.Summary summary = telemetry.summarize();
        assertEquals(4, summary.getTotalResponses());
        assertEquals(1, summary.getSuccessResponses());
        assertEquals(1, summary.getNotFoundResponses());
        assertEquals(1, summary.getRateLimitResponses());
        assertEquals(1, summary.getServerErrors());
        assertEquals(1, summary.getFailures());
        assertEquals(220, summary.getTotalLatencyMs());

        assertEquals(3, telemetry.buildNotices().size());
    }

    @Test
    void quietRunHasNoNotices() {
        FeedTelemetry telemetry = new FeedTelemetry();
        telemetry.recordResponse("/kev", 200, 10);
        assertTrue(telemetry.buildNotices().isEmpty());
    }
}
