package com.study.webflux.voice.fixture;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/** 테스트에서 시간을 직접 진행시킬 수 있는 Clock입니다. */
public final class MutableClock extends Clock {

	public static final Instant DEFAULT_INSTANT = Instant.parse("2024-12-21T12:00:00Z");

	private volatile Instant now;

	private MutableClock(Instant now) {
		this.now = now;
	}

	public static MutableClock create() {
		return new MutableClock(DEFAULT_INSTANT);
	}

	public void advance(Duration duration) {
		now = now.plus(duration);
	}

	@Override
	public ZoneId getZone() {
		return ZoneOffset.UTC;
	}

	@Override
	public Clock withZone(ZoneId zone) {
		return this;
	}

	@Override
	public Instant instant() {
		return now;
	}
}
