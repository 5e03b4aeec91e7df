package com.vtb.refiner.knowledge;

import lombok.extern.slf4j.Slf4j;

/**
 * Ограниченный повтор с экспоненциальной задержкой. Используется только для запросов к фиду.
 */
@Slf4j
public class RetryPolicy {

    @FunctionalInterface
    public interface FeedCall<T> {
        T call() throws FeedUnavailableException;
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final int maxAttempts;
    private final long initialDelayMs;
    private final double multiplier;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, long initialDelayMs, double multiplier) {
        this(maxAttempts, initialDelayMs, multiplier, Thread::sleep);
    }

    public RetryPolicy(int maxAttempts, long initialDelayMs, double multiplier, Sleeper sleeper) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialDelayMs = Math.max(0, initialDelayMs);
        this.multiplier = Math.max(1.0, multiplier);
        this.sleeper = sleeper;
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, 200L, 2.0);
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, 0L, 1.0);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Выполнить вызов, повторяя при {@link FeedUnavailableException}.
     * После исчерпания попыток пробрасывается последняя ошибка.
     */
    public <T> T execute(String operation, FeedCall<T> call) throws FeedUnavailableException {
        long delay = initialDelayMs;
        FeedUnavailableException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return call.call();
            } catch (FeedUnavailableException e) {
                last = e;
                if (attempt == maxAttempts) {
                    break;
                }
                log.debug("{}: попытка {}/{} не удалась ({}), повтор через {} мс",
                    operation, attempt, maxAttempts, e.getMessage(), delay);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new FeedUnavailableException(operation + ": прервано ожидание повтора", ie);
                }
                delay = Math.round(delay * multiplier);
            }
        }
        throw last;
    }
}
