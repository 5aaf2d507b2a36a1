package com.study.webflux.voice.infrastructure.monitoring.config;

import java.time.Duration;

import org.springframework.stereotype.Component;

import com.study.webflux.voice.application.monitoring.service.PipelineStatistics;
import com.study.webflux.voice.infrastructure.voice.adapter.tts.circuit.CircuitBreakerState;
import com.study.webflux.voice.infrastructure.voice.adapter.tts.circuit.SynthesisCircuitBreaker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * 음성 파이프라인 메트릭을 Micrometer에 노출합니다.
 *
 * <p>
 * 연결 수, 캐시 적중/미스, 서킷 브레이커 상태는 Gauge로, 요청 결과는 Counter와 Timer로 기록합니다.
 */
@Component
public class VoicePipelineMetrics {

	private final MeterRegistry meterRegistry;

	public VoicePipelineMetrics(MeterRegistry meterRegistry,
		PipelineStatistics statistics,
		SynthesisCircuitBreaker circuitBreaker) {
		this.meterRegistry = meterRegistry;

		Gauge.builder("voice.connections.active", statistics, PipelineStatistics::getActiveConnections)
			.description("Active WebSocket connections")
			.register(meterRegistry);

		Gauge.builder("voice.cache.hits", statistics, PipelineStatistics::getCacheHits)
			.description("Synthesized audio cache hits")
			.register(meterRegistry);

		Gauge.builder("voice.cache.misses", statistics, PipelineStatistics::getCacheMisses)
			.description("Synthesized audio cache misses")
			.register(meterRegistry);

		Gauge.builder("voice.cache.errors", statistics, PipelineStatistics::getCacheErrors)
			.description("Cache store errors")
			.register(meterRegistry);

		// 0=CLOSED, 1=HALF_OPEN, 2=OPEN
		Gauge.builder("voice.circuit.state", circuitBreaker, breaker -> toStateCode(breaker.getState()))
			.tag("name", circuitBreaker.getName())
			.description("Synthesis circuit breaker state")
			.register(meterRegistry);

		Gauge.builder("voice.circuit.failures", circuitBreaker, SynthesisCircuitBreaker::getFailureCount)
			.tag("name", circuitBreaker.getName())
			.description("Consecutive synthesis failures")
			.register(meterRegistry);
	}

	/** 요청 종류별 결과와 처리 시간을 기록합니다. */
	public void recordRequest(String requestType, String outcome, Duration latency) {
		Counter.builder("voice.pipeline.requests")
			.tag("type", requestType)
			.tag("outcome", outcome)
			.description("Voice pipeline requests by type and outcome")
			.register(meterRegistry)
			.increment();

		Timer.builder("voice.pipeline.latency")
			.tag("type", requestType)
			.description("Voice pipeline request latency")
			.register(meterRegistry)
			.record(latency);
	}

	private static int toStateCode(CircuitBreakerState state) {
		switch (state) {
			case CLOSED :
				return 0;
			case HALF_OPEN :
				return 1;
			case OPEN :
				return 2;
			default :
				return -1;
		}
	}
}
