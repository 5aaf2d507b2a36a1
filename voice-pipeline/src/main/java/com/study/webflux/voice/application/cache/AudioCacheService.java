package com.study.webflux.voice.application.cache;

import java.time.Duration;

import lombok.extern.slf4j.Slf4j;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.study.webflux.voice.application.monitoring.service.PipelineStatistics;
import com.study.webflux.voice.domain.cache.model.CacheKey;
import com.study.webflux.voice.domain.cache.model.CacheStatistics;
import com.study.webflux.voice.domain.cache.model.CachedAudio;
import com.study.webflux.voice.domain.cache.port.AudioCachePort;
import com.study.webflux.voice.infrastructure.voice.config.properties.VoicePipelineProperties;
import reactor.core.publisher.Mono;

/**
 * 합성 오디오 캐시 서비스입니다.
 *
 * <p>
 * 저장소 장애는 요청을 실패시키지 않습니다. 조회 오류는 미스로, 저장 오류는 {@code false}로 처리하고 통계에 반영합니다.
 */
@Slf4j
@Service
public class AudioCacheService {

	private static final Duration PING_TIMEOUT = Duration.ofSeconds(2);

	private final AudioCachePort cachePort;
	private final PipelineStatistics statistics;
	private final Duration ttl;

	@Autowired
	public AudioCacheService(AudioCachePort cachePort,
		PipelineStatistics statistics,
		VoicePipelineProperties properties) {
		this(cachePort, statistics, properties.getCache().getTtl());
	}

	AudioCacheService(AudioCachePort cachePort, PipelineStatistics statistics, Duration ttl) {
		this.cachePort = cachePort;
		this.statistics = statistics;
		this.ttl = ttl;
	}

	/** 캐시된 오디오를 조회합니다. 미스와 저장소 오류는 모두 빈 결과입니다. */
	public Mono<CachedAudio> get(CacheKey key) {
		return Mono.defer(() -> cachePort.get(key))
			.doOnNext(hit -> {
				statistics.recordCacheHit();
				log.info("캐시 적중: {}", key.abbreviated());
			})
			.switchIfEmpty(Mono.<CachedAudio>fromRunnable(() -> {
				statistics.recordCacheMiss();
				log.info("캐시 미스: {}", key.abbreviated());
			}))
			.onErrorResume(error -> {
				statistics.recordCacheReadError();
				log.warn("캐시 조회 실패, 미스로 처리합니다: {} - {}", key.abbreviated(), error.getMessage());
				return Mono.empty();
			});
	}

	/** 오디오를 설정된 TTL로 저장합니다. 같은 키에 대한 저장은 마지막 값이 남습니다. */
	public Mono<Boolean> put(CacheKey key, byte[] audio, double durationSeconds) {
		return Mono.defer(() -> {
			CachedAudio entry = new CachedAudio(key, audio, durationSeconds, null, ttl);
			return cachePort.put(key, entry, ttl);
		})
			.defaultIfEmpty(false)
			.doOnNext(stored -> {
				if (stored) {
					statistics.recordCacheWrite();
					log.info("캐시 저장: {} (TTL: {}s)", key.abbreviated(), ttl.toSeconds());
				} else {
					statistics.recordCacheWriteError();
					log.warn("캐시 저장이 반영되지 않았습니다: {}", key.abbreviated());
				}
			})
			.onErrorResume(error -> {
				statistics.recordCacheWriteError();
				log.error("캐시 저장 실패: {} - {}", key.abbreviated(), error.getMessage());
				return Mono.just(false);
			});
	}

	public CacheStatistics stats() {
		return statistics.cacheStatistics();
	}

	/** 합성 오디오 캐시를 모두 비웁니다. */
	public Mono<Long> evictAll() {
		return cachePort.evictAll()
			.defaultIfEmpty(0L)
			.doOnNext(count -> log.info("오디오 캐시 비움: {} entries", count));
	}

	public Mono<Long> size() {
		return cachePort.count().defaultIfEmpty(0L);
	}

	/** 저장소에 실제로 도달 가능한지 확인합니다. 캐시 미스와는 무관합니다. */
	public Mono<Boolean> isReachable() {
		return Mono.defer(cachePort::ping)
			.timeout(PING_TIMEOUT)
			.defaultIfEmpty(false)
			.onErrorResume(error -> {
				log.warn("캐시 저장소 응답 없음: {}", error.getMessage());
				return Mono.just(false);
			});
	}
}
