package com.study.webflux.voice.application.monitoring.controller;

import lombok.RequiredArgsConstructor;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import com.study.webflux.voice.domain.monitoring.model.PipelineHealth;
import com.study.webflux.voice.domain.monitoring.model.PipelineStatsSnapshot;
import com.study.webflux.voice.domain.pipeline.port.PipelineStatusUseCase;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import reactor.core.publisher.Mono;

/** 헬스 체크와 파이프라인 통계 조회용 REST 컨트롤러입니다. */
@Tag(name = "상태 API", description = "헬스 체크 및 캐시/서킷 브레이커 통계")
@RestController
@RequiredArgsConstructor
public class PipelineStatusController {

	private final PipelineStatusUseCase pipelineStatusUseCase;

	@Operation(summary = "헬스 체크", description = "캐시 저장소 도달 여부와 서킷 브레이커 상태를 함께 반환합니다")
	@GetMapping("/health")
	public Mono<PipelineHealth> health() {
		return pipelineStatusUseCase.health();
	}

	@Operation(summary = "파이프라인 통계", description = "연결 수, 캐시 적중률, 서킷 브레이커 상태를 반환합니다")
	@GetMapping("/stats")
	public Mono<PipelineStatsSnapshot> stats() {
		return pipelineStatusUseCase.stats();
	}
}
