package com.vtb.refiner.core;

import com.vtb.refiner.models.Threat;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Пул для поугрозных стадий. Каждая угроза обрабатывается одной задачей,
 * ошибка любой задачи прерывает прогон.
 */
@Slf4j
class StageExecutor implements AutoCloseable {

    private final ExecutorService executor;
    private final RefinementProgressListener listener;

    StageExecutor(int parallelism, RefinementProgressListener listener) {
        this.executor = parallelism > 1 ? Executors.newFixedThreadPool(parallelism) : null;
        this.listener = listener;
    }

    void forEach(String stage, List<Threat> threats, Consumer<Threat> action) {
        int total = threats.size();
        listener.stageStarted(stage, total);
        AtomicInteger completed = new AtomicInteger();

        if (executor == null) {
            for (Threat threat : threats) {
                action.accept(threat);
                listener.threatProcessed(stage, completed.incrementAndGet(), total);
            }
            return;
        }

        List<Future<?>> futures = new ArrayList<>(total);
        for (Threat threat : threats) {
            futures.add(executor.submit(() -> {
                action.accept(threat);
                listener.threatProcessed(stage, completed.incrementAndGet(), total);
            }));
        }
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new IllegalStateException("Стадия " + stage + " прервана", e);
            } catch (ExecutionException e) {
                futures.forEach(f -> f.cancel(true));
                Throwable cause = e.getCause();
                log.error("Ошибка на стадии {}: {}", stage, cause.getMessage(), cause);
                if (cause instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw new IllegalStateException("Ошибка на стадии " + stage, cause);
            }
        }
    }

    @Override
    public void close() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }
}
