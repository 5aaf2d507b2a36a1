package com.study.webflux.voice.infrastructure.voice.adapter.tts.circuit;

import java.time.Duration;

/**
 * 지수 백오프 전략
 *
 * <p>
 * 시도 횟수에 따라 대기 시간을 지수적으로 증가시킵니다. 공식: {@code min(maxWait, minWait * multiplier^(attempt - 1))}
 *
 * <p>
 * 예시 (minWait=1초, multiplier=2.0, maxWait=10초):
 * <ul>
 * <li>1회 실패: 1초</li>
 * <li>2회 실패: 2초</li>
 * <li>3회 실패: 4초</li>
 * <li>4회 실패: 8초</li>
 * <li>5회 이상: 10초 (max cap)</li>
 * </ul>
 */
public class ExponentialBackoffStrategy {
	private final Duration minWait;
	private final Duration maxWait;
	private final double multiplier;

	public ExponentialBackoffStrategy(Duration minWait, Duration maxWait, double multiplier) {
		if (minWait.isNegative() || minWait.isZero()) {
			throw new IllegalArgumentException("minWait must be positive");
		}
		if (maxWait.compareTo(minWait) < 0) {
			throw new IllegalArgumentException(
				"maxWait must be greater than or equal to minWait");
		}
		if (multiplier < 1.0) {
			throw new IllegalArgumentException("multiplier must be at least 1.0");
		}
		this.minWait = minWait;
		this.maxWait = maxWait;
		this.multiplier = multiplier;
	}

	public static ExponentialBackoffStrategy defaults() {
		return new ExponentialBackoffStrategy(Duration.ofSeconds(1), Duration.ofSeconds(10), 2.0);
	}

	/**
	 * 시도 횟수에 따른 대기 시간 계산
	 *
	 * @param attempt
	 *            실패한 시도 번호 (1부터 시작)
	 * @return 다음 시도 전 대기 시간
	 */
	public Duration calculateDelay(int attempt) {
		if (attempt <= 0) {
			return Duration.ZERO;
		}

		double factor = Math.pow(multiplier, attempt - 1);
		double delayMillis = minWait.toMillis() * factor;

		// maxWait로 제한 (overflow 포함)
		if (Double.isInfinite(delayMillis) || delayMillis >= maxWait.toMillis()) {
			return maxWait;
		}
		return Duration.ofMillis(Math.round(delayMillis));
	}

	public Duration getMinWait() {
		return minWait;
	}

	public Duration getMaxWait() {
		return maxWait;
	}

	public double getMultiplier() {
		return multiplier;
	}
}
