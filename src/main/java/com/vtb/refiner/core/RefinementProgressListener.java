package com.vtb.refiner.core;

/**
 * Наблюдатель за ходом прогона. Вызывается из рабочих потоков, реализация должна быть потокобезопасной.
 */
public interface RefinementProgressListener {

    RefinementProgressListener NONE = new RefinementProgressListener() {};

    default void stageStarted(String stage, int total) {
    }

    default void threatProcessed(String stage, int completed, int total) {
    }

    default void stageSkipped(String stage, String reason) {
    }
}
