package com.study.webflux.voice.application.pipeline.stage;

import lombok.extern.slf4j.Slf4j;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.study.webflux.voice.application.cache.AudioCacheService;
import com.study.webflux.voice.domain.cache.model.CacheKey;
import com.study.webflux.voice.domain.pipeline.model.PipelineResponse;
import com.study.webflux.voice.domain.pipeline.model.SentimentScore;
import com.study.webflux.voice.domain.pipeline.model.SynthesizedAudio;
import com.study.webflux.voice.domain.pipeline.port.AudioPostProcessorPort;
import com.study.webflux.voice.domain.pipeline.port.SentimentPort;
import com.study.webflux.voice.domain.pipeline.port.TtsPort;
import com.study.webflux.voice.infrastructure.voice.config.properties.VoicePipelineProperties;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * 텍스트 → 음성 합성 단계입니다.
 *
 * <p>
 * 캐시 적중 시 저장된(이미 정규화된) 오디오를 그대로 반환하고 백엔드를 호출하지 않습니다. 미스일 때는 보호된 {@link TtsPort}로 합성한 뒤 후처리하고
 * 캐시에 저장합니다. 감성 점수는 캐시 여부와 관계없이 매번 계산합니다.
 */
@Slf4j
@Service
public class SynthesisStageService {

	private final TtsPort ttsPort;
	private final AudioCacheService cacheService;
	private final AudioPostProcessorPort audioPostProcessor;
	private final SentimentPort sentimentPort;
	private final boolean compressionEnabled;
	private final Scheduler processingScheduler;

	@Autowired
	public SynthesisStageService(TtsPort ttsPort,
		AudioCacheService cacheService,
		AudioPostProcessorPort audioPostProcessor,
		SentimentPort sentimentPort,
		VoicePipelineProperties properties) {
		this(ttsPort, cacheService, audioPostProcessor, sentimentPort,
			properties.getAudio().isCompressionEnabled(), Schedulers.boundedElastic());
	}

	SynthesisStageService(TtsPort ttsPort,
		AudioCacheService cacheService,
		AudioPostProcessorPort audioPostProcessor,
		SentimentPort sentimentPort,
		boolean compressionEnabled,
		Scheduler processingScheduler) {
		this.ttsPort = ttsPort;
		this.cacheService = cacheService;
		this.audioPostProcessor = audioPostProcessor;
		this.sentimentPort = sentimentPort;
		this.compressionEnabled = compressionEnabled;
		this.processingScheduler = processingScheduler;
	}

	/**
	 * 텍스트를 합성합니다.
	 *
	 * @param useCache
	 *            false면 캐시 조회와 저장을 모두 건너뜁니다
	 */
	public Mono<PipelineResponse.Audio> synthesize(String text, boolean useCache) {
		return Mono.defer(() -> {
			long startedAt = System.nanoTime();
			Mono<SynthesisResult> result = useCache
				? synthesizeWithCache(text)
				: synthesizeFresh(text).map(SynthesisResult::fresh);

			return Mono.zip(result, analyzeSentiment(text))
				.map(tuple -> {
					SynthesisResult synthesis = tuple.getT1();
					return new PipelineResponse.Audio(synthesis.audio().audio(),
						synthesis.audio().durationSeconds(),
						synthesis.cached(),
						tuple.getT2(),
						elapsedMillis(startedAt));
				});
		});
	}

	private Mono<SynthesisResult> synthesizeWithCache(String text) {
		CacheKey key = CacheKey.fromText(text);
		return cacheService.get(key)
			.map(hit -> SynthesisResult.cached(new SynthesizedAudio(hit.audio(),
				hit.durationSeconds())))
			.switchIfEmpty(Mono.defer(() -> synthesizeFresh(text)
				.flatMap(audio -> cacheService.put(key, audio.audio(), audio.durationSeconds())
					.thenReturn(SynthesisResult.fresh(audio)))));
	}

	private Mono<SynthesizedAudio> synthesizeFresh(String text) {
		return ttsPort.synthesize(text)
			.publishOn(processingScheduler)
			.map(this::postProcess);
	}

	private SynthesizedAudio postProcess(SynthesizedAudio synthesized) {
		byte[] processed = audioPostProcessor.normalize(synthesized.audio());
		if (compressionEnabled) {
			processed = audioPostProcessor.compress(processed);
		}
		return synthesized.withAudio(processed);
	}

	private Mono<SentimentScore> analyzeSentiment(String text) {
		return Mono.fromCallable(() -> sentimentPort.analyze(text))
			.subscribeOn(processingScheduler)
			.onErrorResume(error -> {
				log.warn("감성 분석 실패, 중립으로 처리합니다: {}", error.getMessage());
				return Mono.just(SentimentScore.neutral());
			});
	}

	private static long elapsedMillis(long startedAt) {
		return (System.nanoTime() - startedAt) / 1_000_000;
	}

	private record SynthesisResult(
		SynthesizedAudio audio,
		boolean cached) {

		static SynthesisResult cached(SynthesizedAudio audio) {
			return new SynthesisResult(audio, true);
		}

		static SynthesisResult fresh(SynthesizedAudio audio) {
			return new SynthesisResult(audio, false);
		}
	}
}
