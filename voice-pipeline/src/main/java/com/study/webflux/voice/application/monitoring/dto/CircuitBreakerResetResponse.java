package com.study.webflux.voice.application.monitoring.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "서킷 브레이커 수동 초기화 결과")
public record CircuitBreakerResetResponse(
	@Schema(description = "서킷 브레이커 이름", example = "TTS Service")
	String name,

	@Schema(description = "초기화 이후 상태", example = "closed")
	String state
) {
}
