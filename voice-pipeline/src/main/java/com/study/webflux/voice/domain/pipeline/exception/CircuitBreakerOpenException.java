package com.study.webflux.voice.domain.pipeline.exception;

import java.time.Duration;

/** 서킷이 열려 백엔드 호출 없이 즉시 거절된 요청입니다. 새로운 실패로 집계되지 않습니다. */
public class CircuitBreakerOpenException extends VoicePipelineException {

	private final String name;
	private final Duration retryAfter;

	public CircuitBreakerOpenException(String name, Duration retryAfter) {
		super("Circuit breaker is OPEN for " + name + ". Retry after "
			+ Math.max(0, retryAfter.toSeconds()) + "s");
		this.name = name;
		this.retryAfter = retryAfter.isNegative() ? Duration.ZERO : retryAfter;
	}

	public String getName() {
		return name;
	}

	public Duration getRetryAfter() {
		return retryAfter;
	}

	@Override
	public String category() {
		return "circuit breaker open";
	}
}
