package com.study.webflux.voice.infrastructure.voice.adapter.tts;

import java.util.HashMap;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;

import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import com.study.webflux.voice.domain.pipeline.model.SynthesizedAudio;
import com.study.webflux.voice.domain.pipeline.port.TtsPort;
import com.study.webflux.voice.infrastructure.voice.adapter.BackendErrorClassifier;
import com.study.webflux.voice.infrastructure.voice.config.properties.VoicePipelineProperties;
import reactor.core.publisher.Mono;

/**
 * ElevenLabs TTS 어댑터
 *
 * <p>
 * 재시도, 타임아웃, 서킷 브레이커는 {@link ResilientTtsAdapter}가 담당하며 이 어댑터는 단일 호출과 에러 분류만 수행합니다. 백엔드가 재생 시간을
 * 반환하지 않으므로 출력 비트레이트로 추정합니다.
 */
@Slf4j
public class ElevenLabsTtsAdapter implements TtsPort {
	static final String BACKEND_NAME = "TTS";
	private static final String API_KEY_HEADER = "xi-api-key";

	private final WebClient webClient;
	private final VoicePipelineProperties.Tts settings;

	public ElevenLabsTtsAdapter(WebClient.Builder webClientBuilder,
		VoicePipelineProperties.Tts settings) {
		this.settings = settings;
		this.webClient = webClientBuilder
			.baseUrl(normalizeBaseUrl(settings.getBaseUrl()))
			.defaultHeader(API_KEY_HEADER, settings.getApiKey() == null ? "" : settings.getApiKey())
			.build();
	}

	@Override
	public Mono<SynthesizedAudio> synthesize(String text) {
		log.debug("TTS 합성 요청 - voiceId: {}, length: {}", settings.getVoiceId(), text.length());

		var payload = new HashMap<String, Object>();
		payload.put("text", text);
		payload.put("model_id", settings.getModelId());
		payload.put("voice_settings", Map.of(
			"stability", settings.getStability(),
			"similarity_boost", settings.getSimilarityBoost()));

		return webClient.post()
			.uri(uriBuilder -> uriBuilder
				.path("/v1/text-to-speech/{voice_id}")
				.queryParam("output_format", settings.getOutputFormat())
				.build(settings.getVoiceId()))
			.contentType(MediaType.APPLICATION_JSON)
			.accept(MediaType.parseMediaType("audio/mpeg"), MediaType.APPLICATION_OCTET_STREAM)
			.bodyValue(payload)
			.retrieve()
			.bodyToMono(byte[].class)
			.map(audio -> new SynthesizedAudio(audio, estimateDurationSeconds(audio.length)))
			.doOnSuccess(result -> log.info("TTS 합성 완료: {} bytes",
				result != null ? result.audio().length : 0))
			.onErrorMap(error -> BackendErrorClassifier.classify(BACKEND_NAME, error));
	}

	double estimateDurationSeconds(int byteLength) {
		double bytesPerSecond = settings.getBitrateKbps() * 1000.0 / 8.0;
		return Math.round(byteLength / bytesPerSecond * 1000.0) / 1000.0;
	}

	private String normalizeBaseUrl(String baseUrl) {
		String normalized = baseUrl == null || baseUrl.isBlank()
			? "https://api.elevenlabs.io"
			: baseUrl.trim();

		if (normalized.endsWith("/")) {
			normalized = normalized.substring(0, normalized.length() - 1);
		}
		if (normalized.endsWith("/v1")) {
			return normalized.substring(0, normalized.length() - 3);
		}
		return normalized;
	}
}
