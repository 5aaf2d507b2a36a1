package com.study.webflux.voice.application.voice.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "음성 전사 결과")
public record SttResponse(
	@Schema(description = "전사된 텍스트", example = "Hello, how are you today?")
	String text,

	@Schema(description = "감지된 언어", example = "en")
	String language,

	@Schema(description = "언어 감지 확률", example = "0.98")
	@JsonProperty("language_probability") double languageProbability,

	@Schema(description = "오디오 길이(초)", example = "2.4")
	double duration,

	@Schema(description = "구간별 전사 결과")
	List<VoiceOutboundMessage.SegmentPayload> segments,

	@Schema(description = "처리 시간(ms)", example = "830")
	@JsonProperty("latency_ms") long latencyMs,

	@Schema(description = "전사 텍스트 감성")
	VoiceOutboundMessage.SentimentPayload sentiment
) {
}
