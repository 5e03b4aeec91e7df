package com.vtb.refiner.knowledge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.refiner.config.RefinerConfig;
import com.vtb.refiner.models.VulnerabilityRecord;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.HashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Фид уязвимостей поверх публичных источников: каталог CISA KEV (один запрос на прогон)
 * и NVD CVE API 2.0 (дата публикации, запрос на каждый CVE).
 *
 * Если каталог KEV недоступен, отсутствие CVE в нём доказать нельзя, поэтому все CVE
 * прогона считаются неизвестными.
 */
@Slf4j
public class RemoteVulnerabilityFeed implements VulnerabilityFeed {

    private static final String USER_AGENT = "VTB-Threat-Refiner/1.0 (vulnerability-feed)";

    private final FeedSettings settings;
    private final RetryPolicy retryPolicy;
    private final Clock clock;
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();

    public RemoteVulnerabilityFeed(RefinerConfig.Cve config, Clock clock) {
        this(config, clock, new FeedSettings(config).retryPolicy());
    }

    public RemoteVulnerabilityFeed(RefinerConfig.Cve config, Clock clock, RetryPolicy retryPolicy) {
        this.settings = new FeedSettings(config);
        this.retryPolicy = retryPolicy;
        this.clock = clock;
        this.httpClient = new OkHttpClient.Builder()
            .connectTimeout(settings.timeoutSec(), TimeUnit.SECONDS)
            .readTimeout(settings.timeoutSec(), TimeUnit.SECONDS)
            .callTimeout(settings.timeoutSec(), TimeUnit.SECONDS)
            .retryOnConnectionFailure(false)
            .build();
    }

    @Override
    public VulnerabilitySnapshot fetch(Set<String> cveIds) {
        if (cveIds == null || cveIds.isEmpty()) {
            return VulnerabilitySnapshot.empty();
        }
        FeedTelemetry telemetry = new FeedTelemetry();

        Set<String> kevCatalog;
        try {
            kevCatalog = retryPolicy.execute("CISA KEV", () -> fetchKevCatalog(telemetry));
            log.info("Каталог CISA KEV загружен: {} записей", kevCatalog.size());
        } catch (FeedUnavailableException e) {
            log.warn("Каталог CISA KEV недоступен: {}", e.getMessage());
            telemetry.recordFailure(settings.kevCatalogUrl(), e.getMessage());
            VulnerabilitySnapshot snapshot = VulnerabilitySnapshot.allUnknown(cveIds,
                "Каталог известных эксплуатируемых уязвимостей недоступен, релевантность "
                    + cveIds.size() + " CVE неизвестна");
            snapshot.getNotices().addAll(telemetry.buildNotices());
            return snapshot;
        }

        VulnerabilitySnapshot snapshot = VulnerabilitySnapshot.builder().build();
        for (String cveId : cveIds) {
            try {
                Optional<NvdEntry> entry = retryPolicy.execute("NVD " + cveId,
                    () -> fetchNvdEntry(cveId, telemetry));
                if (entry.isPresent()) {
                    boolean exploited = kevCatalog.contains(cveId) || entry.get().cisaListed();
                    snapshot.getRecords().put(cveId, VulnerabilityRecord.builder()
                        .cveId(cveId)
                        .publishedDate(entry.get().published())
                        .inKnownExploitedCatalog(exploited)
                        .fetchedAt(clock.instant())
                        .build());
                } else {
                    log.debug("{} не найден в NVD", cveId);
                    recordKevOnly(snapshot, cveId, kevCatalog);
                }
            } catch (FeedUnavailableException e) {
                log.warn("Не удалось получить {} из NVD: {}", cveId, e.getMessage());
                telemetry.recordFailure(cveId, e.getMessage());
                recordKevOnly(snapshot, cveId, kevCatalog);
            }
        }

        snapshot.getNotices().addAll(telemetry.buildNotices());
        if (!snapshot.getUnknown().isEmpty()) {
            snapshot.getNotices().add(String.format("Сведения по %d CVE не получены: %s",
                snapshot.getUnknown().size(), String.join(", ", snapshot.getUnknown())));
        }
        return snapshot;
    }

    /**
     * Без ответа NVD запись строится только по каталогу KEV: дата публикации неизвестна,
     * но факт эксплуатации установлен. CVE вне каталога остаётся неизвестным.
     */
    private void recordKevOnly(VulnerabilitySnapshot snapshot, String cveId, Set<String> kevCatalog) {
        if (!kevCatalog.contains(cveId)) {
            snapshot.getUnknown().add(cveId);
            return;
        }
        log.debug("{} есть в каталоге CISA KEV, дата публикации неизвестна", cveId);
        snapshot.getRecords().put(cveId, VulnerabilityRecord.builder()
            .cveId(cveId)
            .publishedDate(null)
            .inKnownExploitedCatalog(true)
            .fetchedAt(clock.instant())
            .build());
    }

    private Set<String> fetchKevCatalog(FeedTelemetry telemetry) throws FeedUnavailableException {
        String url = settings.kevCatalogUrl();
        Request request = new Request.Builder()
            .url(url)
            .addHeader("User-Agent", USER_AGENT)
            .get()
            .build();

        long start = System.nanoTime();
        try (Response response = httpClient.newCall(request).execute()) {
            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            telemetry.recordResponse(url, response.code(), durationMs);
            if (!response.isSuccessful()) {
                throw new FeedUnavailableException("CISA KEV: HTTP " + response.code());
            }
            JsonNode root = readBody(response, "CISA KEV");
            JsonNode vulnerabilities = root.path("vulnerabilities");
            if (!vulnerabilities.isArray()) {
                throw new FeedUnavailableException("CISA KEV: в ответе нет массива vulnerabilities");
            }
            Set<String> ids = new HashSet<>();
            for (JsonNode node : vulnerabilities) {
                String id = node.path("cveID").asText(null);
                if (id != null && !id.isBlank()) {
                    ids.add(id.trim().toUpperCase(Locale.ROOT));
                }
            }
            return ids;
        } catch (FeedUnavailableException e) {
            throw e;
        } catch (IOException e) {
            throw new FeedUnavailableException("CISA KEV: " + e.getMessage(), e);
        }
    }

    private Optional<NvdEntry> fetchNvdEntry(String cveId, FeedTelemetry telemetry) throws FeedUnavailableException {
        HttpUrl base = HttpUrl.parse(settings.nvdApiUrl());
        if (base == null) {
            throw new FeedUnavailableException("Некорректный URL NVD: " + settings.nvdApiUrl());
        }
        HttpUrl url = base.newBuilder().addQueryParameter("cveId", cveId).build();
        Request.Builder builder = new Request.Builder()
            .url(url)
            .addHeader("User-Agent", USER_AGENT)
            .get();
        if (settings.nvdApiKey() != null && !settings.nvdApiKey().isBlank()) {
            builder.addHeader("apiKey", settings.nvdApiKey());
        }

        long start = System.nanoTime();
        try (Response response = httpClient.newCall(builder.build()).execute()) {
            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            telemetry.recordResponse(url.toString(), response.code(), durationMs);
            if (response.code() == 404) {
                return Optional.empty();
            }
            if (!response.isSuccessful()) {
                throw new FeedUnavailableException("NVD: HTTP " + response.code());
            }
            JsonNode root = readBody(response, "NVD");
            JsonNode vulnerabilities = root.path("vulnerabilities");
            if (!vulnerabilities.isArray() || vulnerabilities.isEmpty()) {
                return Optional.empty();
            }
            JsonNode cve = vulnerabilities.get(0).path("cve");
            String published = cve.path("published").asText(null);
            if (published == null || published.length() < 10) {
                return Optional.empty();
            }
            return Optional.of(new NvdEntry(LocalDate.parse(published.substring(0, 10)),
                cve.hasNonNull("cisaExploitAdd")));
        } catch (FeedUnavailableException e) {
            throw e;
        } catch (DateTimeParseException e) {
            throw new FeedUnavailableException("NVD: некорректная дата публикации " + cveId, e);
        } catch (IOException e) {
            throw new FeedUnavailableException("NVD: " + e.getMessage(), e);
        }
    }

    private JsonNode readBody(Response response, String source) throws IOException {
        ResponseBody body = response.body();
        if (body == null) {
            throw new FeedUnavailableException(source + ": пустой ответ");
        }
        return mapper.readTree(body.string());
    }

    private record NvdEntry(LocalDate published, boolean cisaListed) {}
}
