package com.study.webflux.voice.infrastructure.voice.adapter.stt;

import java.util.List;

import lombok.extern.slf4j.Slf4j;

import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.study.webflux.voice.domain.pipeline.model.AudioTranscriptionInput;
import com.study.webflux.voice.domain.pipeline.model.TranscriptSegment;
import com.study.webflux.voice.domain.pipeline.model.TranscriptionResult;
import com.study.webflux.voice.domain.pipeline.port.SttPort;
import com.study.webflux.voice.infrastructure.voice.adapter.BackendErrorClassifier;
import reactor.core.publisher.Mono;

/**
 * OpenAI Whisper API 기반 STT 어댑터입니다.
 *
 * <p>
 * {@code verbose_json} 응답으로 언어, 재생 시간, 구간 정보를 함께 받습니다. 구간 신뢰도는 평균 로그 확률의 지수값입니다. API가 언어 확률을 제공하지
 * 않으므로 언어 힌트가 주어진 경우 1.0, 그렇지 않으면 구간 신뢰도 평균을 사용합니다.
 */
@Slf4j
public class OpenAiWhisperSttAdapter implements SttPort {
	static final String BACKEND_NAME = "STT";

	private final WebClient webClient;
	private final String model;

	public OpenAiWhisperSttAdapter(WebClient.Builder webClientBuilder,
		String apiKey,
		String baseUrl,
		String model) {
		this.model = model;
		this.webClient = webClientBuilder
			.baseUrl(normalizeBaseUrl(baseUrl))
			.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
			.build();
	}

	@Override
	public Mono<TranscriptionResult> transcribe(AudioTranscriptionInput input) {
		log.info("STT 변환 요청 - fileName: {}, contentType: {}, size: {} bytes",
			input.fileName(),
			input.contentType(),
			input.audioBytes().length);

		MultipartBodyBuilder builder = new MultipartBodyBuilder();
		builder.part("model", model);
		if (input.language() != null) {
			builder.part("language", input.language());
		}
		builder.part("response_format", "verbose_json");
		builder.part("timestamp_granularities[]", "segment");

		ByteArrayResource audioResource = new ByteArrayResource(input.audioBytes()) {
			@Override
			public String getFilename() {
				return input.fileName();
			}
		};

		builder.part("file", audioResource)
			.contentType(MediaType.parseMediaType(input.contentType()));

		return webClient.post()
			.uri("/audio/transcriptions")
			.contentType(MediaType.MULTIPART_FORM_DATA)
			.body(BodyInserters.fromMultipartData(builder.build()))
			.retrieve()
			.bodyToMono(VerboseTranscriptionResponse.class)
			.map(response -> toResult(response, input.language()))
			.doOnSuccess(result -> log.info("STT 변환 완료: {} chars, {} segments, language: {}",
				result != null ? result.text().length() : 0,
				result != null ? result.segments().size() : 0,
				result != null ? result.language() : null))
			.onErrorMap(error -> BackendErrorClassifier.classify(BACKEND_NAME, error));
	}

	TranscriptionResult toResult(VerboseTranscriptionResponse response, String languageHint) {
		List<TranscriptSegment> segments = response.segments() == null
			? List.of()
			: response.segments().stream()
				.map(segment -> new TranscriptSegment(segment.start(), segment.end(),
					segment.text(), round(Math.min(1.0, Math.exp(segment.avgLogprob())))))
				.toList();

		double languageProbability = languageHint != null
			? 1.0
			: round(segments.stream().mapToDouble(TranscriptSegment::confidence).average()
				.orElse(0.0));

		String language = response.language() != null ? response.language() : languageHint;
		return new TranscriptionResult(response.text(), language, languageProbability,
			response.duration(), segments);
	}

	private double round(double value) {
		return Math.round(value * 1000.0) / 1000.0;
	}

	private String normalizeBaseUrl(String baseUrl) {
		String normalized = baseUrl == null || baseUrl.isBlank()
			? "https://api.openai.com"
			: baseUrl.trim();

		if (normalized.endsWith("/")) {
			normalized = normalized.substring(0, normalized.length() - 1);
		}
		if (normalized.endsWith("/v1")) {
			return normalized;
		}
		return normalized + "/v1";
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	record VerboseTranscriptionResponse(
		String text,
		String language,
		double duration,
		List<Segment> segments) {
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	record Segment(
		double start,
		double end,
		String text,
		@JsonProperty("avg_logprob") double avgLogprob) {
	}
}
