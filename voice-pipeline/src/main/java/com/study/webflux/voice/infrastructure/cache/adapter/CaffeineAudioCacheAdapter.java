package com.study.webflux.voice.infrastructure.cache.adapter;

import java.time.Duration;

import lombok.extern.slf4j.Slf4j;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.study.webflux.voice.domain.cache.model.CacheKey;
import com.study.webflux.voice.domain.cache.model.CachedAudio;
import com.study.webflux.voice.domain.cache.port.AudioCachePort;
import reactor.core.publisher.Mono;

/**
 * 프로세스 내부 메모리 캐시 어댑터입니다.
 *
 * <p>
 * 항목별 TTL이 지나면 만료되고, 최대 항목 수를 넘으면 Caffeine의 정책에 따라 제거됩니다. Redis 없이 단일 인스턴스로 실행할 때 사용합니다.
 */
@Slf4j
public class CaffeineAudioCacheAdapter implements AudioCachePort {

	private final Cache<String, CachedAudio> cache;

	public CaffeineAudioCacheAdapter(long maxEntries) {
		this(maxEntries, Ticker.systemTicker());
	}

	CaffeineAudioCacheAdapter(long maxEntries, Ticker ticker) {
		this.cache = Caffeine.newBuilder()
			.maximumSize(maxEntries)
			.expireAfter(new TtlExpiry())
			.ticker(ticker)
			.build();
		log.info("메모리 오디오 캐시 초기화: maxEntries={}", maxEntries);
	}

	@Override
	public Mono<CachedAudio> get(CacheKey key) {
		return Mono.fromCallable(() -> cache.getIfPresent(key.value()));
	}

	@Override
	public Mono<Boolean> put(CacheKey key, CachedAudio entry, Duration ttl) {
		return Mono.fromCallable(() -> {
			CachedAudio stored = ttl == null || ttl.equals(entry.ttl())
				? entry
				: new CachedAudio(entry.key(), entry.audio(), entry.durationSeconds(),
					entry.createdAt(), ttl);
			cache.put(key.value(), stored);
			return true;
		});
	}

	@Override
	public Mono<Long> evictAll() {
		return Mono.fromCallable(() -> {
			long size = cache.estimatedSize();
			cache.invalidateAll();
			cache.cleanUp();
			log.info("메모리 오디오 캐시 삭제: {} entries", size);
			return size;
		});
	}

	@Override
	public Mono<Long> count() {
		return Mono.fromCallable(() -> {
			cache.cleanUp();
			return cache.estimatedSize();
		});
	}

	@Override
	public Mono<Boolean> ping() {
		return Mono.just(true);
	}

	private static final class TtlExpiry implements Expiry<String, CachedAudio> {

		@Override
		public long expireAfterCreate(String key, CachedAudio value, long currentTime) {
			return toNanos(value.ttl());
		}

		@Override
		public long expireAfterUpdate(String key,
			CachedAudio value,
			long currentTime,
			long currentDuration) {
			return toNanos(value.ttl());
		}

		@Override
		public long expireAfterRead(String key,
			CachedAudio value,
			long currentTime,
			long currentDuration) {
			return currentDuration;
		}

		private static long toNanos(Duration ttl) {
			if (ttl.isZero() || ttl.isNegative()) {
				return Long.MAX_VALUE;
			}
			return ttl.toNanos();
		}
	}
}
