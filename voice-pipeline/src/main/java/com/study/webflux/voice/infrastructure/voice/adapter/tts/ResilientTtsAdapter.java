package com.study.webflux.voice.infrastructure.voice.adapter.tts;

import java.time.Duration;

import lombok.extern.slf4j.Slf4j;

import com.study.webflux.voice.domain.pipeline.exception.TransientBackendException;
import com.study.webflux.voice.domain.pipeline.model.SynthesizedAudio;
import com.study.webflux.voice.domain.pipeline.port.TtsPort;
import com.study.webflux.voice.infrastructure.voice.adapter.BackendErrorClassifier;
import com.study.webflux.voice.infrastructure.voice.adapter.tts.circuit.BackendRetryPolicy;
import com.study.webflux.voice.infrastructure.voice.adapter.tts.circuit.SynthesisCircuitBreaker;
import reactor.core.publisher.Mono;

/**
 * 서킷 브레이커와 재시도로 보호되는 TTS 어댑터
 *
 * <p>
 * 실행 순서: 서킷 브레이커 → 재시도 → 타임아웃 → 실제 백엔드. 재시도를 모두 소진한 호출은 서킷 브레이커에 한 번의 실패로 집계됩니다. 애플리케이션에
 * 노출되는 유일한 {@link TtsPort}이므로 백엔드를 직접 호출하는 경로는 없습니다.
 */
@Slf4j
public class ResilientTtsAdapter implements TtsPort {

	private final TtsPort delegate;
	private final SynthesisCircuitBreaker circuitBreaker;
	private final BackendRetryPolicy retryPolicy;
	private final Duration timeout;

	public ResilientTtsAdapter(TtsPort delegate,
		SynthesisCircuitBreaker circuitBreaker,
		BackendRetryPolicy retryPolicy,
		Duration timeout) {
		this.delegate = delegate;
		this.circuitBreaker = circuitBreaker;
		this.retryPolicy = retryPolicy;
		this.timeout = timeout;
	}

	@Override
	public Mono<SynthesizedAudio> synthesize(String text) {
		Mono<SynthesizedAudio> attempt = Mono.defer(() -> delegate.synthesize(text))
			.switchIfEmpty(Mono.error(() -> new TransientBackendException(
				ElevenLabsTtsAdapter.BACKEND_NAME, "TTS 응답 본문이 비어 있습니다")))
			.timeout(timeout)
			.onErrorMap(error -> BackendErrorClassifier.classify(ElevenLabsTtsAdapter.BACKEND_NAME,
				error));

		return circuitBreaker.execute(() -> attempt.retryWhen(retryPolicy.toRetrySpec("TTS 합성")));
	}
}
