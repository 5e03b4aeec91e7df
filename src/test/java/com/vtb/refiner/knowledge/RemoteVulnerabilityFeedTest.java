package com.vtb.refiner.knowledge;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.vtb.refiner.config.RefinerConfig;
import com.vtb.refiner.models.VulnerabilityRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RemoteVulnerabilityFeedTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);

    private HttpServer server;
    private String baseUrl;
    private final AtomicInteger flakyCalls = new AtomicInteger();
    private volatile int kevStatus = 200;

    @BeforeEach
    void setUp() throws Exception {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/kev", this::handleKev);
        server.createContext("/nvd", this::handleNvd);
        server.start();
        baseUrl = "http://localhost:" + server.getAddress().getPort();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void combinesKevCatalogAndNvdDates() {
        VulnerabilitySnapshot snapshot = feed(RetryPolicy.noRetry())
            .fetch(ids("CVE-2021-44228", "CVE-2016-0001", "CVE-2024-3094"));

        VulnerabilityRecord log4shell = snapshot.lookup("CVE-2021-44228").orElseThrow();
        assertTrue(log4shell.isInKnownExploitedCatalog());
        assertEquals(LocalDate.of(2021, 12, 10), log4shell.getPublishedDate());
        assertEquals(CLOCK.instant(), log4shell.getFetchedAt());

        VulnerabilityRecord old = snapshot.lookup("CVE-2016-0001").orElseThrow();
        assertFalse(old.isInKnownExploitedCatalog());
        assertEquals(LocalDate.of(2016, 1, 12), old.getPublishedDate());

        assertTrue(snapshot.lookup("CVE-2024-3094").orElseThrow().isInKnownExploitedCatalog(),
            "Отметка cisaExploitAdd в NVD тоже означает KEV");
        assertTrue(snapshot.getUnknown().isEmpty());
    }

    @Test
    void missingCveIsUnknown() {
        VulnerabilitySnapshot snapshot = feed(RetryPolicy.noRetry()).fetch(ids("CVE-2099-0001", "CVE-2099-0002"));

        assertTrue(snapshot.getRecords().isEmpty());
        assertEquals(Set.of("CVE-2099-0001", "CVE-2099-0002"), snapshot.getUnknown());
        assertFalse(snapshot.getNotices().isEmpty());
    }

    @Test
    void serverErrorIsRetried() {
        List<Long> sleeps = new ArrayList<>();
        RetryPolicy retry = new RetryPolicy(2, 50L, 1.0, sleeps::add);

        VulnerabilitySnapshot snapshot = feed(retry).fetch(ids("CVE-2020-5555"));

        assertTrue(snapshot.isKnown("CVE-2020-5555"));
        assertEquals(2, flakyCalls.get());
        assertEquals(List.of(50L), sleeps);
        assertTrue(snapshot.getNotices().stream().anyMatch(n -> n.contains("5xx")));
    }

    @Test
    void kevMembershipSurvivesNvdFailure() {
        VulnerabilitySnapshot snapshot = feed(new RetryPolicy(2, 0L, 1.0, millis -> { }))
            .fetch(ids("CVE-2017-0144"));

        VulnerabilityRecord record = snapshot.lookup("CVE-2017-0144").orElseThrow();
        assertTrue(record.isInKnownExploitedCatalog(), "Наличие в KEV достаточно без ответа NVD");
        assertNull(record.getPublishedDate());
        assertTrue(snapshot.getUnknown().isEmpty());
    }

    @Test
    void kevOutageMakesAllCvesUnknown() {
        kevStatus = 503;

        VulnerabilitySnapshot snapshot = feed(new RetryPolicy(2, 0L, 1.0, millis -> { }))
            .fetch(ids("CVE-2021-44228", "CVE-2016-0001"));

        assertTrue(snapshot.getRecords().isEmpty(), "Без KEV нельзя доказать нерелевантность");
        assertEquals(2, snapshot.getUnknown().size());
        assertTrue(snapshot.getNotices().stream().anyMatch(n -> n.contains("2 CVE")));
    }

    private RemoteVulnerabilityFeed feed(RetryPolicy retryPolicy) {
        RefinerConfig.Cve config = new RefinerConfig.Cve();
        config.setKevCatalogUrl(baseUrl + "/kev");
        config.setNvdApiUrl(baseUrl + "/nvd");
        config.setTimeoutSec(5);
        return new RemoteVulnerabilityFeed(config, CLOCK, retryPolicy);
    }

    private static Set<String> ids(String... ids) {
        return new LinkedHashSet<>(List.of(ids));
    }

    private void handleKev(HttpExchange exchange) throws IOException {
        respond(exchange, kevStatus, """
            {"catalogVersion": "2026.01.14", "vulnerabilities": [{"cveID": "CVE-2021-44228"}, {"cveID": "CVE-2017-0144"}]}
            """);
    }

    private void handleNvd(HttpExchange exchange) throws IOException {
        String query = exchange.getRequestURI().getQuery();
        String cveId = query != null && query.startsWith("cveId=") ? query.substring("cveId=".length()) : "";
        switch (cveId) {
            case "CVE-2021-44228" -> respond(exchange, 200, nvd(cveId, "2021-12-10T10:15:09.143", false));
            case "CVE-2016-0001" -> respond(exchange, 200, nvd(cveId, "2016-01-12T20:59:00.000", false));
            case "CVE-2024-3094" -> respond(exchange, 200, nvd(cveId, "2024-03-29T17:15:21.150", true));
            case "CVE-2020-5555" -> {
                if (flakyCalls.incrementAndGet() == 1) {
                    respond(exchange, 500, "{}");
                } else {
                    respond(exchange, 200, nvd(cveId, "2020-07-01T00:00:00.000", false));
                }
            }
            case "CVE-2017-0144" -> respond(exchange, 503, "{}");
            case "CVE-2099-0002" -> respond(exchange, 200, "{\"totalResults\": 0, \"vulnerabilities\": []}");
            default -> respond(exchange, 404, "");
        }
    }

    private static String nvd(String cveId, String published, boolean cisa) {
        return "{\"vulnerabilities\": [{\"cve\": {\"id\": \"" + cveId + "\", \"published\": \"" + published + "\""
            + (cisa ? ", \"cisaExploitAdd\": \"2024-04-01\"" : "") + "}}]}";
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        } else {
            exchange.close();
        }
    }
}
