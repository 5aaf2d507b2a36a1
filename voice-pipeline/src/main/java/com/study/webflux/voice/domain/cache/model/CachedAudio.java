package com.study.webflux.voice.domain.cache.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;

/** 캐시에 저장된 합성 오디오입니다. 생성 후 변경되지 않습니다. */
public record CachedAudio(
	CacheKey key,
	byte[] audio,
	double durationSeconds,
	Instant createdAt,
	Duration ttl
) {

	public CachedAudio {
		if (key == null) {
			throw new IllegalArgumentException("캐시 키는 null일 수 없습니다");
		}
		if (audio == null || audio.length == 0) {
			throw new IllegalArgumentException("캐시할 오디오 데이터가 비어 있습니다");
		}
		if (durationSeconds < 0) {
			throw new IllegalArgumentException("재생 시간은 음수일 수 없습니다");
		}
		audio = audio.clone();
		createdAt = createdAt == null ? Instant.now() : createdAt;
		ttl = ttl == null ? Duration.ZERO : ttl;
	}

	@Override
	public byte[] audio() {
		return audio.clone();
	}

	@Override
	public boolean equals(Object other) {
		if (this == other) {
			return true;
		}
		return other instanceof CachedAudio that
			&& key.equals(that.key)
			&& Arrays.equals(audio, that.audio)
			&& Double.compare(durationSeconds, that.durationSeconds) == 0
			&& createdAt.equals(that.createdAt)
			&& ttl.equals(that.ttl);
	}

	@Override
	public int hashCode() {
		int result = key.hashCode();
		result = 31 * result + Arrays.hashCode(audio);
		result = 31 * result + Double.hashCode(durationSeconds);
		return 31 * result + createdAt.hashCode();
	}

	@Override
	public String toString() {
		return "CachedAudio[key=" + key.abbreviated() + ", audio=" + audio.length
			+ " bytes, durationSeconds=" + durationSeconds + ", createdAt=" + createdAt
			+ ", ttl=" + ttl + "]";
	}
}
