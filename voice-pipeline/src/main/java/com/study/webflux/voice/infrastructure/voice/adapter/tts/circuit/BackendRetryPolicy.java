package com.study.webflux.voice.infrastructure.voice.adapter.tts.circuit;

import lombok.extern.slf4j.Slf4j;

import com.study.webflux.voice.domain.pipeline.exception.TransientBackendException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

/**
 * 일시적 백엔드 장애에 대한 재시도 정책
 *
 * <p>
 * 최대 maxAttempts번(최초 시도 포함) 실행하며 n번째 실패 후 {@link ExponentialBackoffStrategy#calculateDelay(int)}만큼 대기합니다.
 * {@link TransientBackendException}만 재시도하며, 재시도를 모두 소진하면 마지막 에러를 그대로 전파합니다.
 */
@Slf4j
public class BackendRetryPolicy {
	private final ExponentialBackoffStrategy backoffStrategy;
	private final int maxAttempts;
	private final Scheduler scheduler;

	public BackendRetryPolicy(ExponentialBackoffStrategy backoffStrategy, int maxAttempts) {
		this(backoffStrategy, maxAttempts, Schedulers.parallel());
	}

	public BackendRetryPolicy(ExponentialBackoffStrategy backoffStrategy,
		int maxAttempts,
		Scheduler scheduler) {
		if (maxAttempts < 1) {
			throw new IllegalArgumentException("maxAttempts must be at least 1");
		}
		this.backoffStrategy = backoffStrategy;
		this.maxAttempts = maxAttempts;
		this.scheduler = scheduler;
	}

	/**
	 * Reactor {@code retryWhen}에 사용할 재시도 스펙을 생성합니다.
	 *
	 * @param operation
	 *            로그에 남길 작업 이름
	 */
	public Retry toRetrySpec(String operation) {
		return Retry.from(signals -> signals.concatMap(signal -> {
			Throwable failure = signal.failure();
			long failedAttempt = signal.totalRetries() + 1;

			if (!isRetryable(failure)) {
				return Mono.error(failure);
			}
			if (failedAttempt >= maxAttempts) {
				log.warn("{} 재시도 소진 ({}/{}): {}", operation, failedAttempt, maxAttempts,
					failure.getMessage());
				return Mono.error(failure);
			}

			var delay = backoffStrategy.calculateDelay((int) failedAttempt);
			log.warn("{} 일시적 장애, {}ms 후 재시도 ({}/{}): {}", operation, delay.toMillis(),
				failedAttempt + 1, maxAttempts, failure.getMessage());
			return Mono.delay(delay, scheduler).thenReturn(failedAttempt);
		}));
	}

	public boolean isRetryable(Throwable error) {
		return error instanceof TransientBackendException;
	}

	public int getMaxAttempts() {
		return maxAttempts;
	}

	public ExponentialBackoffStrategy getBackoffStrategy() {
		return backoffStrategy;
	}
}
