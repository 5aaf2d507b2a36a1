package com.study.webflux.voice.application.pipeline.stage;

import java.time.Duration;

import lombok.extern.slf4j.Slf4j;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.study.webflux.voice.domain.pipeline.exception.PipelineValidationException;
import com.study.webflux.voice.domain.pipeline.exception.TransientBackendException;
import com.study.webflux.voice.domain.pipeline.model.AudioTranscriptionInput;
import com.study.webflux.voice.domain.pipeline.model.PipelineResponse;
import com.study.webflux.voice.domain.pipeline.model.SentimentScore;
import com.study.webflux.voice.domain.pipeline.model.TranscriptionResult;
import com.study.webflux.voice.domain.pipeline.port.SentimentPort;
import com.study.webflux.voice.domain.pipeline.port.SttPort;
import com.study.webflux.voice.infrastructure.voice.config.properties.VoicePipelineProperties;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * 음성 → 텍스트 전사 단계입니다.
 *
 * <p>
 * 캐시와 서킷 브레이커를 거치지 않고 타임아웃만 적용합니다.
 */
@Slf4j
@Service
public class TranscriptionStageService {
	static final String BACKEND_NAME = "STT";

	private final SttPort sttPort;
	private final SentimentPort sentimentPort;
	private final Duration timeout;
	private final long maxFileSizeBytes;
	private final String defaultLanguage;
	private final Scheduler processingScheduler;

	@Autowired
	public TranscriptionStageService(SttPort sttPort,
		SentimentPort sentimentPort,
		VoicePipelineProperties properties) {
		this(sttPort, sentimentPort, properties.getStt().getTimeout(),
			properties.getStt().getMaxFileSizeBytes(), properties.getStt().getLanguage(),
			Schedulers.boundedElastic());
	}

	TranscriptionStageService(SttPort sttPort,
		SentimentPort sentimentPort,
		Duration timeout,
		long maxFileSizeBytes,
		String defaultLanguage,
		Scheduler processingScheduler) {
		this.sttPort = sttPort;
		this.sentimentPort = sentimentPort;
		this.timeout = timeout;
		this.maxFileSizeBytes = maxFileSizeBytes;
		this.defaultLanguage = defaultLanguage;
		this.processingScheduler = processingScheduler;
	}

	public Mono<PipelineResponse.Transcript> transcribe(byte[] audio, String languageHint) {
		return Mono.defer(() -> {
			long startedAt = System.nanoTime();
			if (audio.length > maxFileSizeBytes) {
				return Mono.error(new PipelineValidationException(
					"오디오 크기가 허용 범위를 초과했습니다: " + audio.length + " bytes"));
			}
			String language = languageHint != null && !languageHint.isBlank()
				? languageHint
				: defaultLanguage;

			return sttPort.transcribe(AudioTranscriptionInput.of(audio, language))
				.timeout(timeout, Mono.error(() -> new TransientBackendException(BACKEND_NAME,
					BACKEND_NAME + " 응답 시간 초과")))
				.switchIfEmpty(Mono.error(() -> new TransientBackendException(BACKEND_NAME,
					BACKEND_NAME + " 응답 본문이 비어 있습니다")))
				.flatMap(result -> analyzeSentiment(result.text())
					.map(sentiment -> toResponse(result, sentiment, startedAt)));
		});
	}

	private Mono<SentimentScore> analyzeSentiment(String text) {
		return Mono.fromCallable(() -> sentimentPort.analyze(text))
			.subscribeOn(processingScheduler)
			.onErrorResume(error -> {
				log.warn("감성 분석 실패, 중립으로 처리합니다: {}", error.getMessage());
				return Mono.just(SentimentScore.neutral());
			});
	}

	private PipelineResponse.Transcript toResponse(TranscriptionResult result,
		SentimentScore sentiment,
		long startedAt) {
		return new PipelineResponse.Transcript(result.text(),
			result.language(),
			result.languageProbability(),
			result.durationSeconds(),
			result.segments(),
			sentiment,
			(System.nanoTime() - startedAt) / 1_000_000);
	}
}
