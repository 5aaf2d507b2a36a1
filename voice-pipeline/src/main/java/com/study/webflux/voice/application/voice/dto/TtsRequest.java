package com.study.webflux.voice.application.voice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

@Schema(description = "음성 합성 Request")
public record TtsRequest(
	@Schema(description = "합성할 텍스트", example = "Hello, how are you today?")
	@NotNull String text,

	@Schema(description = "캐시 사용 여부. false면 캐시 조회와 저장을 모두 건너뜁니다", example = "true", defaultValue = "true")
	@JsonProperty("use_cache") Boolean useCache
) {

	public boolean cacheEnabled() {
		return useCache == null || useCache;
	}
}
