package com.study.webflux.voice.application.pipeline;

import java.time.Duration;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import com.study.webflux.voice.application.pipeline.stage.SynthesisStageService;
import com.study.webflux.voice.application.pipeline.stage.TranscriptionStageService;
import com.study.webflux.voice.domain.pipeline.exception.VoicePipelineException;
import com.study.webflux.voice.domain.pipeline.model.PipelineRequest;
import com.study.webflux.voice.domain.pipeline.model.PipelineResponse;
import com.study.webflux.voice.domain.pipeline.port.VoicePipelineUseCase;
import com.study.webflux.voice.infrastructure.monitoring.config.VoicePipelineMetrics;
import reactor.core.publisher.Mono;

/**
 * 요청 종류에 따라 합성 또는 전사 단계로 분기하는 디스패처입니다.
 *
 * <p>
 * 모든 실패는 {@link PipelineResponse.Failure}로 변환되어 같은 채널로 반환됩니다. 세션은 실패 후에도 계속 사용할 수 있습니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VoicePipelineService implements VoicePipelineUseCase {

	static final String INVALID_MESSAGE_TYPE = "Invalid message type";
	static final String EMPTY_TEXT = "Empty text";
	static final String EMPTY_AUDIO = "Empty audio data";
	static final String UNEXPECTED_FAILURE = "unexpected failure";

	private final SynthesisStageService synthesisStage;
	private final TranscriptionStageService transcriptionStage;
	private final VoicePipelineMetrics metrics;

	@Override
	public Mono<PipelineResponse> handle(PipelineRequest request) {
		return request.accept(new PipelineRequest.Visitor<>() {

			@Override
			public Mono<PipelineResponse> visitSynthesis(PipelineRequest.Synthesis synthesis) {
				return synthesize(synthesis.text(), true);
			}

			@Override
			public Mono<PipelineResponse> visitTranscription(
				PipelineRequest.Transcription transcription) {
				return transcribe(transcription);
			}

			@Override
			public Mono<PipelineResponse> visitUnrecognized(PipelineRequest.Unrecognized unrecognized) {
				log.warn("알 수 없는 메시지 타입: {}", unrecognized.type());
				metrics.recordRequest("unrecognized", "failure", Duration.ZERO);
				return Mono.just(new PipelineResponse.Failure(INVALID_MESSAGE_TYPE));
			}
		});
	}

	@Override
	public Mono<PipelineResponse> synthesizeWithoutCache(String text) {
		return synthesize(text == null ? "" : text, false);
	}

	private Mono<PipelineResponse> synthesize(String text, boolean useCache) {
		if (text.isBlank()) {
			metrics.recordRequest("synthesis", "failure", Duration.ZERO);
			return Mono.just(new PipelineResponse.Failure(EMPTY_TEXT));
		}
		return measure("synthesis", "TTS",
			Mono.defer(() -> synthesisStage.synthesize(text, useCache)));
	}

	private Mono<PipelineResponse> transcribe(PipelineRequest.Transcription transcription) {
		if (!transcription.hasAudio()) {
			metrics.recordRequest("transcription", "failure", Duration.ZERO);
			return Mono.just(new PipelineResponse.Failure(EMPTY_AUDIO));
		}
		return measure("transcription", "STT",
			Mono.defer(() -> transcriptionStage.transcribe(transcription.audio(),
				transcription.languageHint())));
	}

	private Mono<PipelineResponse> measure(String requestType,
		String backend,
		Mono<? extends PipelineResponse> stage) {
		return Mono.defer(() -> {
			long startedAt = System.nanoTime();
			return stage.<PipelineResponse>map(response -> response)
				.switchIfEmpty(Mono.error(() -> new IllegalStateException(
					backend + " 처리 결과가 비어 있습니다")))
				.onErrorResume(error -> Mono.just(toFailure(backend, error)))
				.doOnNext(response -> metrics.recordRequest(requestType,
					response.isFailure() ? "failure" : "success",
					Duration.ofNanos(System.nanoTime() - startedAt)));
		});
	}

	private PipelineResponse.Failure toFailure(String backend, Throwable error) {
		String category;
		if (error instanceof VoicePipelineException pipelineException) {
			category = pipelineException.category();
			log.warn("{} 처리 실패 [{}]: {}", backend, category, error.getMessage());
		} else {
			category = UNEXPECTED_FAILURE;
			log.error("{} 처리 중 예상치 못한 오류", backend, error);
		}
		return new PipelineResponse.Failure(backend + " service error: " + category);
	}
}
