package com.vtb.refiner.knowledge;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Счётчики обращений к внешнему фиду за прогон
 */
class FeedTelemetry {

    enum EventType { RESPONSE, FAILURE }

    @Data
    @Builder
    static class FeedEvent {
        private EventType type;
        private String endpoint;
        private int statusCode;
        private long durationMs;
        private String detail;
    }

    @Data
    @Builder
    static class Summary {
        @Builder.Default
        private int totalResponses = 0;
        @Builder.Default
        private int successResponses = 0;
        @Builder.Default
        private int notFoundResponses = 0;
        @Builder.Default
        private int rateLimitResponses = 0;
        @Builder.Default
        private int serverErrors = 0;
        @Builder.Default
        private int failures = 0;
        @Builder.Default
        private long totalLatencyMs = 0;
    }

    private final List<FeedEvent> events = new ArrayList<>();

    void recordResponse(String endpoint, int statusCode, long durationMs) {
        events.add(FeedEvent.builder()
            .type(EventType.RESPONSE)
            .endpoint(endpoint)
            .statusCode(statusCode)
            .durationMs(durationMs)
            .build());
    }

    void recordFailure(String endpoint, String message) {
        events.add(FeedEvent.builder()
            .type(EventType.FAILURE)
            .endpoint(endpoint)
            .detail(message)
            .build());
    }

    Summary summarize() {
        Summary summary = Summary.builder().build();
        for (FeedEvent event : events) {
            switch (event.getType()) {
                case RESPONSE -> {
                    summary.setTotalResponses(summary.getTotalResponses() + 1);
                    summary.setTotalLatencyMs(summary.getTotalLatencyMs() + Math.max(0, event.getDurationMs()));
                    int code = event.getStatusCode();
                    if (code >= 200 && code < 300) {
                        summary.setSuccessResponses(summary.getSuccessResponses() + 1);
                    } else if (code == 404) {
                        summary.setNotFoundResponses(summary.getNotFoundResponses() + 1);
                    } else if (code == 403 || code == 429) {
                        summary.setRateLimitResponses(summary.getRateLimitResponses() + 1);
                    } else if (code >= 500) {
                        summary.setServerErrors(summary.getServerErrors() + 1);
                    }
                }
                case FAILURE -> summary.setFailures(summary.getFailures() + 1);
            }
        }
        return summary;
    }

    List<String> buildNotices() {
        Summary summary = summarize();
        List<String> notices = new ArrayList<>();
        if (summary.getRateLimitResponses() > 0) {
            notices.add(String.format("Фид уязвимостей ограничил частоту запросов (%d ответов 403/429)",
                summary.getRateLimitResponses()));
        }
        if (summary.getServerErrors() > 0) {
            notices.add(String.format("Фид уязвимостей вернул %d ответов 5xx", summary.getServerErrors()));
        }
        if (summary.getFailures() > 0) {
            notices.add(String.format("%d запросов к фиду уязвимостей не удалось после повторов",
                summary.getFailures()));
        }
        return notices;
    }
}
