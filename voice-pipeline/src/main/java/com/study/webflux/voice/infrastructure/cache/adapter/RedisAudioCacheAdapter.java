package com.study.webflux.voice.infrastructure.cache.adapter;

import java.time.Duration;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.data.redis.connection.ReactiveRedisConnection;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;

import com.study.webflux.voice.domain.cache.model.CacheKey;
import com.study.webflux.voice.domain.cache.model.CachedAudio;
import com.study.webflux.voice.domain.cache.port.AudioCachePort;
import reactor.core.publisher.Mono;

/** Redis에 합성 오디오를 저장하는 캐시 어댑터입니다. 만료는 Redis TTL에 맡깁니다. */
@Slf4j
@RequiredArgsConstructor
public class RedisAudioCacheAdapter implements AudioCachePort {

	private static final long SCAN_BATCH_SIZE = 500;

	private final ReactiveRedisTemplate<String, RedisAudioEntry> redisTemplate;
	private final ReactiveRedisConnectionFactory connectionFactory;

	@Override
	public Mono<CachedAudio> get(CacheKey key) {
		return redisTemplate.opsForValue().get(key.value()).map(entry -> entry.toCachedAudio(key));
	}

	@Override
	public Mono<Boolean> put(CacheKey key, CachedAudio entry, Duration ttl) {
		RedisAudioEntry value = RedisAudioEntry.from(entry);
		if (ttl == null || ttl.isZero() || ttl.isNegative()) {
			return redisTemplate.opsForValue().set(key.value(), value);
		}
		return redisTemplate.opsForValue().set(key.value(), value, ttl);
	}

	@Override
	public Mono<Long> evictAll() {
		return redisTemplate.delete(redisTemplate.scan(scanOptions()))
			.defaultIfEmpty(0L)
			.doOnNext(deleted -> log.info("Redis 오디오 캐시 삭제: {} keys", deleted));
	}

	@Override
	public Mono<Long> count() {
		return redisTemplate.scan(scanOptions()).count();
	}

	@Override
	public Mono<Boolean> ping() {
		return Mono.usingWhen(
			Mono.fromSupplier(connectionFactory::getReactiveConnection),
			connection -> connection.ping().map("PONG"::equalsIgnoreCase),
			ReactiveRedisConnection::closeLater);
	}

	private ScanOptions scanOptions() {
		return ScanOptions.scanOptions().match(CacheKey.PATTERN).count(SCAN_BATCH_SIZE).build();
	}
}
