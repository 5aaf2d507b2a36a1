package com.study.webflux.voice.application.cache;

import java.time.Duration;

import com.study.webflux.voice.application.monitoring.service.PipelineStatistics;
import com.study.webflux.voice.domain.cache.model.CacheKey;
import com.study.webflux.voice.domain.cache.model.CachedAudio;
import com.study.webflux.voice.domain.cache.port.AudioCachePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AudioCacheServiceTest {

	private static final Duration TTL = Duration.ofHours(1);
	private static final CacheKey KEY = CacheKey.fromText("hello");

	@Mock
	private AudioCachePort cachePort;

	private PipelineStatistics statistics;
	private AudioCacheService service;

	@BeforeEach
	void setUp() {
		statistics = new PipelineStatistics();
		service = new AudioCacheService(cachePort, statistics, TTL);
	}

	@Test
	@DisplayName("적중 시 저장된 오디오를 반환하고 적중 수를 올린다")
	void get_hit() {
		CachedAudio cached = new CachedAudio(KEY, new byte[]{1, 2}, 0.5, null, TTL);
		when(cachePort.get(KEY)).thenReturn(Mono.just(cached));

		StepVerifier.create(service.get(KEY)).expectNext(cached).verifyComplete();

		assertThat(statistics.getCacheHits()).isEqualTo(1);
		assertThat(statistics.getCacheMisses()).isZero();
	}

	@Test
	@DisplayName("미스 시 빈 결과를 반환하고 미스 수를 올린다")
	void get_miss() {
		when(cachePort.get(KEY)).thenReturn(Mono.empty());

		StepVerifier.create(service.get(KEY)).verifyComplete();

		assertThat(statistics.getCacheMisses()).isEqualTo(1);
		assertThat(statistics.getCacheErrors()).isZero();
	}

	@Test
	@DisplayName("저장소 오류는 미스로 처리하고 한 번만 집계한다")
	void get_storeError_treatedAsMiss() {
		when(cachePort.get(KEY)).thenReturn(Mono.error(new IllegalStateException("connection refused")));

		StepVerifier.create(service.get(KEY)).verifyComplete();

		assertThat(statistics.getCacheMisses()).isEqualTo(1);
		assertThat(statistics.getCacheErrors()).isEqualTo(1);
		assertThat(statistics.getCacheHits()).isZero();
	}

	@Test
	@DisplayName("저장 시 설정된 TTL로 저장하고 저장 수를 올린다")
	void put_success() {
		when(cachePort.put(eq(KEY), any(CachedAudio.class), eq(TTL))).thenReturn(Mono.just(true));

		StepVerifier.create(service.put(KEY, new byte[]{3}, 0.2)).expectNext(true).verifyComplete();

		ArgumentCaptor<CachedAudio> captor = ArgumentCaptor.forClass(CachedAudio.class);
		verify(cachePort).put(eq(KEY), captor.capture(), eq(TTL));
		assertThat(captor.getValue().audio()).containsExactly(3);
		assertThat(captor.getValue().ttl()).isEqualTo(TTL);
		assertThat(statistics.getCacheWrites()).isEqualTo(1);
	}

	@Test
	@DisplayName("저장 오류는 false로 반환하고 오류 수를 올린다")
	void put_error_returnsFalse() {
		when(cachePort.put(eq(KEY), any(CachedAudio.class), eq(TTL)))
			.thenReturn(Mono.error(new IllegalStateException("timeout")));

		StepVerifier.create(service.put(KEY, new byte[]{3}, 0.2)).expectNext(false).verifyComplete();

		assertThat(statistics.getCacheErrors()).isEqualTo(1);
		assertThat(statistics.getCacheWrites()).isZero();
	}

	@Test
	@DisplayName("저장소가 반영하지 않으면 false를 반환한다")
	void put_notStored_returnsFalse() {
		when(cachePort.put(eq(KEY), any(CachedAudio.class), eq(TTL))).thenReturn(Mono.just(false));

		StepVerifier.create(service.put(KEY, new byte[]{3}, 0.2)).expectNext(false).verifyComplete();

		assertThat(statistics.getCacheErrors()).isEqualTo(1);
	}

	@Test
	@DisplayName("적중률은 적중과 미스로 계산한다")
	void stats_hitRate() {
		CachedAudio cached = new CachedAudio(KEY, new byte[]{1}, 0.1, null, TTL);
		when(cachePort.get(KEY)).thenReturn(Mono.just(cached), Mono.empty(), Mono.empty(),
			Mono.just(cached));

		for (int i = 0; i < 4; i++) {
			service.get(KEY).block();
		}

		assertThat(service.stats().hits()).isEqualTo(2);
		assertThat(service.stats().misses()).isEqualTo(2);
		assertThat(service.stats().hitRate()).isEqualTo(0.5);
	}

	@Test
	@DisplayName("저장소 ping 오류는 도달 불가로 판단한다")
	void isReachable_error() {
		when(cachePort.ping()).thenReturn(Mono.error(new IllegalStateException("down")));

		StepVerifier.create(service.isReachable()).expectNext(false).verifyComplete();
	}

	@Test
	@DisplayName("저장소 ping 성공은 도달 가능으로 판단한다")
	void isReachable_ok() {
		when(cachePort.ping()).thenReturn(Mono.just(true));

		StepVerifier.create(service.isReachable()).expectNext(true).verifyComplete();
	}

	@Test
	@DisplayName("전체 삭제는 삭제된 항목 수를 반환한다")
	void evictAll() {
		when(cachePort.evictAll()).thenReturn(Mono.just(5L));

		StepVerifier.create(service.evictAll()).expectNext(5L).verifyComplete();
	}
}
