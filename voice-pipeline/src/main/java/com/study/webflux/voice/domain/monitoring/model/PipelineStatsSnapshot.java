package com.study.webflux.voice.domain.monitoring.model;

import com.study.webflux.voice.domain.cache.model.CacheStatistics;

/** 파이프라인 전역 통계의 특정 시점 스냅샷입니다. */
public record PipelineStatsSnapshot(
	int activeConnections,
	long totalConnections,
	CacheStatistics cache,
	long cacheWrites,
	long cacheErrors,
	String breakerState,
	int breakerFailureCount
) {
}
