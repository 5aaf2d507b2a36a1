package com.study.webflux.voice.application.monitoring.service;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.springframework.stereotype.Component;

import com.study.webflux.voice.domain.cache.model.CacheStatistics;

/**
 * 프로세스 전역 파이프라인 카운터입니다.
 *
 * <p>
 * 모든 세션이 같은 인스턴스를 공유하며 각 카운터는 원자적으로 갱신됩니다.
 */
@Component
public class PipelineStatistics {

	private final AtomicInteger activeConnections = new AtomicInteger();
	private final AtomicLong totalConnections = new AtomicLong();
	private final AtomicLong cacheHits = new AtomicLong();
	private final AtomicLong cacheMisses = new AtomicLong();
	private final AtomicLong cacheWrites = new AtomicLong();
	private final AtomicLong cacheErrors = new AtomicLong();

	public void connectionOpened() {
		activeConnections.incrementAndGet();
		totalConnections.incrementAndGet();
	}

	/** 활성 연결 수를 감소시킵니다. 0 미만으로는 내려가지 않습니다. */
	public void connectionClosed() {
		activeConnections.updateAndGet(current -> Math.max(0, current - 1));
	}

	public void recordCacheHit() {
		cacheHits.incrementAndGet();
	}

	public void recordCacheMiss() {
		cacheMisses.incrementAndGet();
	}

	/** 저장소 오류로 인한 미스입니다. 미스와 오류를 함께 집계합니다. */
	public void recordCacheReadError() {
		cacheMisses.incrementAndGet();
		cacheErrors.incrementAndGet();
	}

	public void recordCacheWrite() {
		cacheWrites.incrementAndGet();
	}

	public void recordCacheWriteError() {
		cacheErrors.incrementAndGet();
	}

	public CacheStatistics cacheStatistics() {
		return CacheStatistics.of(cacheHits.get(), cacheMisses.get());
	}

	public int getActiveConnections() {
		return activeConnections.get();
	}

	public long getTotalConnections() {
		return totalConnections.get();
	}

	public long getCacheHits() {
		return cacheHits.get();
	}

	public long getCacheMisses() {
		return cacheMisses.get();
	}

	public long getCacheWrites() {
		return cacheWrites.get();
	}

	public long getCacheErrors() {
		return cacheErrors.get();
	}
}
