package com.vtb.refiner.core;

import com.vtb.refiner.config.RefinementSettings;
import com.vtb.refiner.knowledge.VulnerabilityFeed;
import com.vtb.refiner.models.IndustryProfile;
import lombok.Builder;
import lombok.Value;

import java.time.Clock;
import java.util.List;

/**
 * Входные данные одного прогона. null в components, controls или feed означает, что вход
 * не передан и соответствующая стадия деградирует.
 */
@Value
@Builder
public class RefinementRequest {
    List<RawThreatRecord> threats;
    List<RawComponentRecord> components;
    List<RawControlRecord> controls;
    /** null: профиль из настроек */
    IndustryProfile industry;
    VulnerabilityFeed feed;
    @Builder.Default
    RefinementSettings settings = RefinementSettings.defaults();
    @Builder.Default
    Clock clock = Clock.systemUTC();
    @Builder.Default
    RefinementProgressListener listener = RefinementProgressListener.NONE;
}
