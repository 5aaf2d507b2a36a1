package com.study.webflux.voice.infrastructure.voice.adapter.tts.circuit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

import lombok.extern.slf4j.Slf4j;

import com.study.webflux.voice.domain.pipeline.exception.CircuitBreakerOpenException;
import com.study.webflux.voice.domain.pipeline.exception.PipelineValidationException;
import reactor.core.publisher.Mono;

/**
 * 합성 백엔드용 서킷 브레이커
 *
 * <p>
 * 합성 백엔드의 연속 장애를 감지하고 복구를 관리합니다. 합성 백엔드로 가는 모든 호출은 {@link #execute(Supplier)}를 거칩니다.
 *
 * <h3>상태 전이</h3>
 * <ul>
 * <li>CLOSED → OPEN: 연속 실패 횟수가 failureThreshold에 도달</li>
 * <li>OPEN → HALF_OPEN: recoveryTimeout 경과 후 다음 호출 시점에 전이 (타이머 없음)</li>
 * <li>HALF_OPEN → CLOSED: 연속 성공 횟수가 successThreshold에 도달</li>
 * <li>HALF_OPEN → OPEN: 한 번이라도 실패 (openedAt 갱신)</li>
 * </ul>
 *
 * <h3>실패 집계</h3>
 * <ul>
 * <li>입력 검증 실패: 집계하지 않음</li>
 * <li>OPEN 상태로 인한 거절: 집계하지 않음</li>
 * <li>그 외 모든 실패(일시적, 영구): 집계</li>
 * </ul>
 *
 * <p>
 * 상태 판단과 변경은 하나의 임계 영역에서 함께 수행합니다. 이전 상태 세대에서 허용된 호출의 결과는 현재 상태에 반영하지 않습니다.
 */
@Slf4j
public class SynthesisCircuitBreaker {
	// 시험 호출 결과가 나올 때까지 기다리도록 안내하는 최소 대기 시간
	static final Duration HALF_OPEN_RETRY_HINT = Duration.ofSeconds(1);

	private final String name;
	private final int failureThreshold;
	private final Duration recoveryTimeout;
	private final int successThreshold;
	private final int halfOpenPermits;
	private final Clock clock;
	private final Object stateLock = new Object();

	private volatile CircuitBreakerState state = CircuitBreakerState.CLOSED;
	private volatile int failureCount;
	private volatile int successCount;
	private volatile Instant openedAt;
	private int halfOpenInFlight;
	private long generation;

	public SynthesisCircuitBreaker(String name,
		int failureThreshold,
		Duration recoveryTimeout,
		int successThreshold,
		Clock clock) {
		this(name, failureThreshold, recoveryTimeout, successThreshold, successThreshold, clock);
	}

	public SynthesisCircuitBreaker(String name,
		int failureThreshold,
		Duration recoveryTimeout,
		int successThreshold,
		int halfOpenPermits,
		Clock clock) {
		if (failureThreshold < 1 || successThreshold < 1 || halfOpenPermits < 1) {
			throw new IllegalArgumentException("임계값은 1 이상이어야 합니다");
		}
		if (recoveryTimeout.isNegative()) {
			throw new IllegalArgumentException("recoveryTimeout은 음수일 수 없습니다");
		}
		this.name = name;
		this.failureThreshold = failureThreshold;
		this.recoveryTimeout = recoveryTimeout;
		this.successThreshold = successThreshold;
		this.halfOpenPermits = halfOpenPermits;
		this.clock = clock;
		log.info("서킷 브레이커 초기화 - name: {}, failureThreshold: {}, recoveryTimeout: {}s",
			name, failureThreshold, recoveryTimeout.toSeconds());
	}

	/**
	 * 서킷 브레이커 보호 아래에서 호출을 실행합니다.
	 *
	 * <p>
	 * 구독 시점마다 허용 여부를 판단하므로 재구독(재시도)도 매번 상태를 다시 평가합니다.
	 *
	 * @param call
	 *            보호할 호출
	 * @return 호출 결과. 차단 시 {@link CircuitBreakerOpenException}
	 */
	public <T> Mono<T> execute(Supplier<Mono<T>> call) {
		return Mono.defer(() -> {
			Permit permit = acquirePermit();
			if (!permit.allowed()) {
				return Mono.error(new CircuitBreakerOpenException(name, permit.retryAfter()));
			}
			return Mono.defer(call)
				.doOnSuccess(ignored -> recordSuccess(permit))
				.doOnError(error -> recordFailure(permit, error))
				.doOnCancel(() -> releasePermit(permit));
		});
	}

	private Permit acquirePermit() {
		synchronized (stateLock) {
			if (state == CircuitBreakerState.OPEN) {
				Duration elapsed = Duration.between(openedAt, clock.instant());
				if (elapsed.compareTo(recoveryTimeout) < 0) {
					return Permit.rejected(recoveryTimeout.minus(elapsed));
				}
				transitionTo(CircuitBreakerState.HALF_OPEN);
			}

			if (state == CircuitBreakerState.HALF_OPEN) {
				if (halfOpenInFlight >= halfOpenPermits) {
					return Permit.rejected(HALF_OPEN_RETRY_HINT);
				}
				halfOpenInFlight++;
			}
			return Permit.allowed(generation);
		}
	}

	private void recordSuccess(Permit permit) {
		synchronized (stateLock) {
			if (permit.generation() != generation) {
				return;
			}
			if (state == CircuitBreakerState.HALF_OPEN) {
				halfOpenInFlight--;
				successCount++;
				log.debug("서킷 브레이커 {} HALF_OPEN 성공 ({}/{})", name, successCount,
					successThreshold);
				if (successCount >= successThreshold) {
					transitionTo(CircuitBreakerState.CLOSED);
				}
			} else if (state == CircuitBreakerState.CLOSED) {
				failureCount = 0;
			}
		}
	}

	private void recordFailure(Permit permit, Throwable error) {
		if (!isRecordable(error)) {
			releasePermit(permit);
			return;
		}
		synchronized (stateLock) {
			if (permit.generation() != generation) {
				return;
			}
			failureCount++;
			log.warn("서킷 브레이커 {} 실패 기록 ({}/{}): {}", name, failureCount, failureThreshold,
				error.getMessage());

			if (state == CircuitBreakerState.HALF_OPEN) {
				halfOpenInFlight--;
				transitionTo(CircuitBreakerState.OPEN);
			} else if (state == CircuitBreakerState.CLOSED && failureCount >= failureThreshold) {
				transitionTo(CircuitBreakerState.OPEN);
			}
		}
	}

	private void releasePermit(Permit permit) {
		synchronized (stateLock) {
			if (permit.generation() == generation && state == CircuitBreakerState.HALF_OPEN) {
				halfOpenInFlight--;
			}
		}
	}

	private boolean isRecordable(Throwable error) {
		return !(error instanceof PipelineValidationException)
			&& !(error instanceof CircuitBreakerOpenException);
	}

	/** stateLock 안에서만 호출합니다. */
	private void transitionTo(CircuitBreakerState target) {
		CircuitBreakerState previous = state;
		generation++;
		halfOpenInFlight = 0;
		successCount = 0;
		switch (target) {
			case OPEN -> {
				openedAt = clock.instant();
				log.error("서킷 브레이커 {}: {} -> OPEN (연속 실패: {})", name, previous, failureCount);
			}
			case HALF_OPEN -> {
				failureCount = 0;
				log.info("서킷 브레이커 {}: OPEN -> HALF_OPEN", name);
			}
			case CLOSED -> {
				failureCount = 0;
				openedAt = null;
				log.info("서킷 브레이커 {}: {} -> CLOSED", name, previous);
			}
		}
		state = target;
	}

	/** 수동으로 CLOSED 상태로 되돌립니다. */
	public void reset() {
		synchronized (stateLock) {
			log.info("서킷 브레이커 {}: 수동 초기화", name);
			transitionTo(CircuitBreakerState.CLOSED);
		}
	}

	/**
	 * 서킷 브레이커 상태 조회
	 *
	 * <p>
	 * OPEN에서 HALF_OPEN으로의 전이는 호출 시점에만 일어나므로, 복구 대기 시간이 지났더라도 다음 호출 전까지는 OPEN으로 보고됩니다.
	 */
	public CircuitBreakerState getState() {
		return state;
	}

	public int getFailureCount() {
		return failureCount;
	}

	public int getSuccessCount() {
		return successCount;
	}

	/**
	 * 서킷 오픈 시각 조회
	 *
	 * @return 서킷이 열린 시각 (null이면 CLOSED 상태)
	 */
	public Instant getOpenedAt() {
		return openedAt;
	}

	public String getName() {
		return name;
	}

	private record Permit(
		boolean allowed,
		long generation,
		Duration retryAfter) {

		static Permit allowed(long generation) {
			return new Permit(true, generation, Duration.ZERO);
		}

		static Permit rejected(Duration retryAfter) {
			return new Permit(false, -1, retryAfter);
		}
	}
}
