package com.vtb.refiner.knowledge;

import java.util.Set;

/**
 * Источник сведений о CVE (дата публикации, присутствие в каталоге эксплуатируемых уязвимостей).
 *
 * Вызывается один раз за прогон для объединения всех процитированных CVE.
 * Недоступность источника не является ошибкой: такие CVE попадают в
 * {@link VulnerabilitySnapshot#getUnknown()}.
 */
public interface VulnerabilityFeed {

    VulnerabilitySnapshot fetch(Set<String> cveIds);
}
