package com.study.webflux.voice.domain.cache.model;

/** 캐시 적중 통계입니다. 요청이 없으면 적중률은 0입니다. */
public record CacheStatistics(
	long hits,
	long misses,
	long totalRequests,
	double hitRate,
	double reductionPercentage
) {

	public static CacheStatistics of(long hits, long misses) {
		long total = hits + misses;
		double hitRate = total > 0 ? (double) hits / total : 0.0;
		return new CacheStatistics(hits, misses, total, hitRate, hitRate);
	}
}
