package com.study.webflux.voice.infrastructure.cache.adapter;

import java.time.Duration;
import java.time.Instant;

import com.study.webflux.voice.domain.cache.model.CacheKey;
import com.study.webflux.voice.domain.cache.model.CachedAudio;

/** Redis에 JSON으로 저장되는 오디오 항목입니다. 오디오는 Base64 문자열로 직렬화됩니다. */
public record RedisAudioEntry(
	byte[] audio,
	double durationSeconds,
	long createdAtEpochMillis,
	long ttlSeconds
) {

	static RedisAudioEntry from(CachedAudio cachedAudio) {
		return new RedisAudioEntry(cachedAudio.audio(),
			cachedAudio.durationSeconds(),
			cachedAudio.createdAt().toEpochMilli(),
			cachedAudio.ttl().toSeconds());
	}

	CachedAudio toCachedAudio(CacheKey key) {
		return new CachedAudio(key,
			audio,
			durationSeconds,
			Instant.ofEpochMilli(createdAtEpochMillis),
			Duration.ofSeconds(ttlSeconds));
	}
}
