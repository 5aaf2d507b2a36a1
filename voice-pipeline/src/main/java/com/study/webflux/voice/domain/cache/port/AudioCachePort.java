package com.study.webflux.voice.domain.cache.port;

import java.time.Duration;

import com.study.webflux.voice.domain.cache.model.CacheKey;
import com.study.webflux.voice.domain.cache.model.CachedAudio;
import reactor.core.publisher.Mono;

/**
 * 합성 오디오를 보관하는 저장소 포트입니다.
 *
 * <p>
 * 만료와 용량 초과 시 제거는 저장소가 책임집니다.
 */
public interface AudioCachePort {

	Mono<CachedAudio> get(CacheKey key);

	Mono<Boolean> put(CacheKey key, CachedAudio entry, Duration ttl);

	/** 합성 오디오 키를 모두 삭제하고 삭제된 개수를 반환합니다. */
	Mono<Long> evictAll();

	Mono<Long> count();

	Mono<Boolean> ping();
}
