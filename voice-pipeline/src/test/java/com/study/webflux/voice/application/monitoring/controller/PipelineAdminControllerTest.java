package com.study.webflux.voice.application.monitoring.controller;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.reactive.server.WebTestClient;

import com.study.webflux.voice.application.cache.AudioCacheService;
import com.study.webflux.voice.config.annotation.ControllerWebFluxTest;
import com.study.webflux.voice.infrastructure.voice.adapter.tts.circuit.CircuitBreakerState;
import com.study.webflux.voice.infrastructure.voice.adapter.tts.circuit.SynthesisCircuitBreaker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ControllerWebFluxTest(PipelineAdminController.class)
class PipelineAdminControllerTest {

	@Autowired
	private WebTestClient webTestClient;

	@MockitoBean
	private AudioCacheService cacheService;

	@MockitoBean
	private SynthesisCircuitBreaker circuitBreaker;

	@Test
	@DisplayName("캐시를 비우고 삭제된 개수를 반환한다")
	void evictCache() {
		when(cacheService.evictAll()).thenReturn(Mono.just(4L));

		webTestClient.delete().uri("/api/cache")
			.exchange()
			.expectStatus().isOk()
			.expectBody().jsonPath("$.entries").isEqualTo(4);
	}

	@Test
	@DisplayName("저장소 오류는 503으로 변환된다")
	void cacheSize_storeDown() {
		when(cacheService.size()).thenReturn(Mono.error(new IllegalStateException("refused")));

		webTestClient.get().uri("/api/cache/size")
			.exchange()
			.expectStatus().isEqualTo(503);
	}

	@Test
	@DisplayName("서킷 브레이커를 초기화하고 현재 상태를 반환한다")
	void resetCircuitBreaker() {
		when(circuitBreaker.getName()).thenReturn("TTS Service");
		when(circuitBreaker.getState()).thenReturn(CircuitBreakerState.CLOSED);

		webTestClient.post().uri("/api/circuit-breaker/reset")
			.exchange()
			.expectStatus().isOk()
			.expectBody()
			.jsonPath("$.name").isEqualTo("TTS Service")
			.jsonPath("$.state").isEqualTo("closed");

		verify(circuitBreaker).reset();
	}
}
