package com.study.webflux.voice.application.monitoring.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "오디오 캐시 관리 결과")
public record CacheAdminResponse(
	@Schema(description = "처리된 항목 수", example = "42")
	long entries
) {
}
