package com.vtb.refiner.semantic;

import com.vtb.refiner.models.Threat;

/**
 * Векторное представление угрозы для семантической дедупликации.
 * Реализация обязана быть детерминированной.
 */
public interface ThreatEmbedder {

    SparseVector embed(Threat threat);
}
