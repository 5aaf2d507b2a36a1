package com.study.webflux.voice.fixture;

import java.nio.charset.StandardCharsets;

import com.study.webflux.voice.domain.pipeline.model.SynthesizedAudio;

public final class SynthesizedAudioFixture {

	public static final double DEFAULT_DURATION = 1.5;

	private SynthesizedAudioFixture() {
	}

	public static SynthesizedAudio create() {
		return create("fake-mp3-audio");
	}

	public static SynthesizedAudio create(String content) {
		return new SynthesizedAudio(content.getBytes(StandardCharsets.UTF_8), DEFAULT_DURATION);
	}
}
