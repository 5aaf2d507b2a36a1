package com.study.webflux.voice.infrastructure.voice.config;

import java.time.Clock;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.study.webflux.voice.infrastructure.voice.adapter.tts.circuit.BackendRetryPolicy;
import com.study.webflux.voice.infrastructure.voice.adapter.tts.circuit.ExponentialBackoffStrategy;
import com.study.webflux.voice.infrastructure.voice.adapter.tts.circuit.SynthesisCircuitBreaker;
import com.study.webflux.voice.infrastructure.voice.config.properties.VoicePipelineProperties;

/** 합성 백엔드 보호를 위한 서킷 브레이커와 재시도 정책을 제공합니다. */
@Configuration
public class ResilienceConfiguration {

	public static final String SYNTHESIS_BREAKER_NAME = "TTS Service";

	@Bean
	@ConditionalOnMissingBean
	public Clock clock() {
		return Clock.systemUTC();
	}

	/** 프로세스 전체에서 공유되는 합성 서킷 브레이커입니다. */
	@Bean
	public SynthesisCircuitBreaker synthesisCircuitBreaker(VoicePipelineProperties properties,
		Clock clock) {
		var circuitBreaker = properties.getCircuitBreaker();
		return new SynthesisCircuitBreaker(SYNTHESIS_BREAKER_NAME,
			circuitBreaker.getFailureThreshold(),
			circuitBreaker.getRecoveryTimeout(),
			circuitBreaker.getSuccessThreshold(),
			clock);
	}

	@Bean
	public BackendRetryPolicy backendRetryPolicy(VoicePipelineProperties properties) {
		var retry = properties.getRetry();
		var backoffStrategy = new ExponentialBackoffStrategy(retry.getMinWait(),
			retry.getMaxWait(),
			retry.getMultiplier());
		return new BackendRetryPolicy(backoffStrategy, retry.getMaxAttempts());
	}
}
