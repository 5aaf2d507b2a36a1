package com.study.webflux.voice.infrastructure.voice.adapter.tts;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import com.study.webflux.voice.domain.pipeline.exception.CircuitBreakerOpenException;
import com.study.webflux.voice.domain.pipeline.exception.PermanentBackendException;
import com.study.webflux.voice.domain.pipeline.exception.TransientBackendException;
import com.study.webflux.voice.domain.pipeline.model.SynthesizedAudio;
import com.study.webflux.voice.domain.pipeline.port.TtsPort;
import com.study.webflux.voice.fixture.MutableClock;
import com.study.webflux.voice.fixture.SynthesizedAudioFixture;
import com.study.webflux.voice.infrastructure.voice.adapter.tts.circuit.BackendRetryPolicy;
import com.study.webflux.voice.infrastructure.voice.adapter.tts.circuit.CircuitBreakerState;
import com.study.webflux.voice.infrastructure.voice.adapter.tts.circuit.ExponentialBackoffStrategy;
import com.study.webflux.voice.infrastructure.voice.adapter.tts.circuit.SynthesisCircuitBreaker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class ResilientTtsAdapterTest {

	private SynthesisCircuitBreaker circuitBreaker;
	private BackendRetryPolicy retryPolicy;
	private AtomicInteger backendCalls;

	@BeforeEach
	void setUp() {
		circuitBreaker = new SynthesisCircuitBreaker("TTS Service", 5, Duration.ofSeconds(60), 2,
			MutableClock.create());
		retryPolicy = new BackendRetryPolicy(
			new ExponentialBackoffStrategy(Duration.ofMillis(5), Duration.ofMillis(20), 2.0), 3);
		backendCalls = new AtomicInteger();
	}

	private ResilientTtsAdapter adapterWith(TtsPort backend, Duration timeout) {
		return new ResilientTtsAdapter(backend, circuitBreaker, retryPolicy, timeout);
	}

	@Test
	@DisplayName("백엔드 성공 시 합성 결과를 그대로 반환한다")
	void synthesize_success() {
		SynthesizedAudio audio = SynthesizedAudioFixture.create();
		ResilientTtsAdapter adapter = adapterWith(text -> {
			backendCalls.incrementAndGet();
			return Mono.just(audio);
		}, Duration.ofSeconds(1));

		StepVerifier.create(adapter.synthesize("hello")).expectNext(audio).verifyComplete();
		assertThat(backendCalls.get()).isEqualTo(1);
	}

	@Test
	@DisplayName("재시도를 모두 소진한 호출은 서킷 브레이커에 한 번의 실패로 집계된다")
	void synthesize_exhaustedRetries_countAsOneFailure() {
		ResilientTtsAdapter adapter = adapterWith(text -> {
			backendCalls.incrementAndGet();
			return Mono.error(new TransientBackendException("TTS", "503"));
		}, Duration.ofSeconds(1));

		StepVerifier.create(adapter.synthesize("hello"))
			.expectError(TransientBackendException.class)
			.verify(Duration.ofSeconds(5));

		assertThat(backendCalls.get()).isEqualTo(3);
		assertThat(circuitBreaker.getFailureCount()).isEqualTo(1);
	}

	@Test
	@DisplayName("응답이 타임아웃을 넘기면 일시적 장애로 분류되어 재시도된다")
	void synthesize_timeout_classifiedAsTransient() {
		ResilientTtsAdapter adapter = adapterWith(text -> {
			backendCalls.incrementAndGet();
			return Mono.never();
		}, Duration.ofMillis(50));

		StepVerifier.create(adapter.synthesize("hello"))
			.expectError(TransientBackendException.class)
			.verify(Duration.ofSeconds(5));

		assertThat(backendCalls.get()).isEqualTo(3);
	}

	@Test
	@DisplayName("영구 장애는 재시도 없이 전파된다")
	void synthesize_permanent_noRetry() {
		ResilientTtsAdapter adapter = adapterWith(text -> {
			backendCalls.incrementAndGet();
			return Mono.error(new PermanentBackendException("TTS", 401, "unauthorized"));
		}, Duration.ofSeconds(1));

		StepVerifier.create(adapter.synthesize("hello"))
			.expectError(PermanentBackendException.class)
			.verify(Duration.ofSeconds(5));

		assertThat(backendCalls.get()).isEqualTo(1);
	}

	@Test
	@DisplayName("서킷이 열리면 백엔드를 호출하지 않고 즉시 거절한다")
	void synthesize_open_rejectsImmediately() {
		ResilientTtsAdapter adapter = adapterWith(text -> {
			backendCalls.incrementAndGet();
			return Mono.error(new PermanentBackendException("TTS", 500, "down"));
		}, Duration.ofSeconds(1));
		for (int i = 0; i < 5; i++) {
			StepVerifier.create(adapter.synthesize("hello"))
				.expectError(PermanentBackendException.class)
				.verify(Duration.ofSeconds(5));
		}
		assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
		backendCalls.set(0);

		StepVerifier.create(adapter.synthesize("hello"))
			.expectError(CircuitBreakerOpenException.class)
			.verify(Duration.ofSeconds(1));

		assertThat(backendCalls.get()).isZero();
	}

	@Test
	@DisplayName("분류되지 않은 예외는 재시도하지 않는다")
	void synthesize_unexpectedError_noRetry() {
		ResilientTtsAdapter adapter = adapterWith(text -> {
			backendCalls.incrementAndGet();
			return Mono.error(new IllegalStateException("decode bug"));
		}, Duration.ofSeconds(1));

		StepVerifier.create(adapter.synthesize("hello"))
			.expectError(IllegalStateException.class)
			.verify(Duration.ofSeconds(5));

		assertThat(backendCalls.get()).isEqualTo(1);
	}

	@Test
	@DisplayName("백엔드가 빈 응답으로 끝나면 일시적 장애로 처리한다")
	void synthesize_emptyResponse_transient() {
		ResilientTtsAdapter adapter = adapterWith(text -> {
			backendCalls.incrementAndGet();
			return Mono.empty();
		}, Duration.ofSeconds(1));

		StepVerifier.create(adapter.synthesize("hello"))
			.expectError(TransientBackendException.class)
			.verify(Duration.ofSeconds(5));

		assertThat(backendCalls.get()).isEqualTo(3);
		assertThat(circuitBreaker.getFailureCount()).isEqualTo(1);
	}
}
