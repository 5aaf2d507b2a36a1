package com.study.webflux.voice.application.monitoring.service;

import java.time.Clock;
import java.time.Instant;

import lombok.RequiredArgsConstructor;

import org.springframework.stereotype.Service;

import com.study.webflux.voice.application.cache.AudioCacheService;
import com.study.webflux.voice.domain.monitoring.model.PipelineHealth;
import com.study.webflux.voice.domain.monitoring.model.PipelineStatsSnapshot;
import com.study.webflux.voice.domain.pipeline.port.PipelineStatusUseCase;
import com.study.webflux.voice.infrastructure.voice.adapter.tts.circuit.CircuitBreakerState;
import com.study.webflux.voice.infrastructure.voice.adapter.tts.circuit.SynthesisCircuitBreaker;
import reactor.core.publisher.Mono;

/** 통계 스냅샷과 헬스 상태를 제공합니다. */
@Service
@RequiredArgsConstructor
public class PipelineStatusService implements PipelineStatusUseCase {

	private final PipelineStatistics statistics;
	private final AudioCacheService cacheService;
	private final SynthesisCircuitBreaker circuitBreaker;
	private final Clock clock;

	@Override
	public Mono<PipelineStatsSnapshot> stats() {
		return Mono.fromSupplier(() -> new PipelineStatsSnapshot(statistics.getActiveConnections(),
			statistics.getTotalConnections(),
			cacheService.stats(),
			statistics.getCacheWrites(),
			statistics.getCacheErrors(),
			circuitBreaker.getState().getValue(),
			circuitBreaker.getFailureCount()));
	}

	/** 캐시 저장소에 도달할 수 없거나 서킷이 열려 있으면 degraded로 보고합니다. */
	@Override
	public Mono<PipelineHealth> health() {
		return cacheService.isReachable()
			.map(cacheReachable -> {
				CircuitBreakerState state = circuitBreaker.getState();
				String status = cacheReachable && state != CircuitBreakerState.OPEN
					? PipelineHealth.HEALTHY
					: PipelineHealth.DEGRADED;
				return new PipelineHealth(status,
					Instant.now(clock),
					statistics.getActiveConnections(),
					cacheReachable,
					state.getValue());
			});
	}
}
