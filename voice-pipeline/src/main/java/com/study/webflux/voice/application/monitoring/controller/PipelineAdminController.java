package com.study.webflux.voice.application.monitoring.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import com.study.webflux.voice.application.cache.AudioCacheService;
import com.study.webflux.voice.application.monitoring.dto.CacheAdminResponse;
import com.study.webflux.voice.application.monitoring.dto.CircuitBreakerResetResponse;
import com.study.webflux.voice.infrastructure.voice.adapter.tts.circuit.SynthesisCircuitBreaker;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import reactor.core.publisher.Mono;

/** 캐시 비우기, 캐시 크기 조회, 서킷 브레이커 초기화 등 운영용 API입니다. */
@Slf4j
@Tag(name = "운영 API", description = "오디오 캐시와 서킷 브레이커 관리")
@RestController
@RequiredArgsConstructor
@RequestMapping("/api")
public class PipelineAdminController {

	private final AudioCacheService cacheService;
	private final SynthesisCircuitBreaker circuitBreaker;

	@Operation(summary = "오디오 캐시 비우기", description = "저장된 합성 오디오를 모두 삭제하고 삭제된 개수를 반환합니다")
	@DeleteMapping("/cache")
	public Mono<CacheAdminResponse> evictCache() {
		return cacheService.evictAll()
			.map(CacheAdminResponse::new)
			.onErrorMap(error -> !(error instanceof ResponseStatusException),
				error -> unavailable("캐시 비우기 실패", error));
	}

	@Operation(summary = "오디오 캐시 크기", description = "저장된 합성 오디오 항목 수를 반환합니다")
	@GetMapping("/cache/size")
	public Mono<CacheAdminResponse> cacheSize() {
		return cacheService.size()
			.map(CacheAdminResponse::new)
			.onErrorMap(error -> !(error instanceof ResponseStatusException),
				error -> unavailable("캐시 크기 조회 실패", error));
	}

	@Operation(summary = "서킷 브레이커 초기화", description = "합성 서킷 브레이커를 CLOSED 상태로 되돌립니다")
	@PostMapping("/circuit-breaker/reset")
	public Mono<CircuitBreakerResetResponse> resetCircuitBreaker() {
		return Mono.fromSupplier(() -> {
			circuitBreaker.reset();
			return new CircuitBreakerResetResponse(circuitBreaker.getName(),
				circuitBreaker.getState().getValue());
		});
	}

	private ResponseStatusException unavailable(String message, Throwable error) {
		log.error("{}: {}", message, error.getMessage());
		return new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, message, error);
	}
}
