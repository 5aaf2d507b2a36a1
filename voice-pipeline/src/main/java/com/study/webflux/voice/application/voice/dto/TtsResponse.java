package com.study.webflux.voice.application.voice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "음성 합성 결과")
public record TtsResponse(
	@Schema(description = "Base64 인코딩된 오디오")
	String audio,

	@Schema(description = "재생 시간(초)", example = "1.52")
	double duration,

	@Schema(description = "캐시 적중 여부", example = "false")
	boolean cached,

	@Schema(description = "처리 시간(ms)", example = "420")
	@JsonProperty("latency_ms") long latencyMs,

	@Schema(description = "입력 텍스트 감성")
	VoiceOutboundMessage.SentimentPayload sentiment
) {
}
