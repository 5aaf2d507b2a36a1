package com.study.webflux.voice.domain.monitoring.model;

import java.time.Instant;

/** 헬스 체크 결과입니다. 캐시 저장소 도달 가능 여부는 캐시 미스와 별도로 보고합니다. */
public record PipelineHealth(
	String status,
	Instant timestamp,
	int activeConnections,
	boolean cacheReachable,
	String breakerState
) {

	public static final String HEALTHY = "healthy";
	public static final String DEGRADED = "degraded";
}
