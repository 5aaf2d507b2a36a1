package com.study.webflux.voice.application.voice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

@Schema(description = "음성 전사 Request")
public record SttRequest(
	@Schema(description = "Base64 인코딩된 오디오")
	@JsonProperty("audio_base64") @NotNull String audioBase64,

	@Schema(description = "언어 힌트 (ISO-639-1)", example = "en")
	String language
) {
}
