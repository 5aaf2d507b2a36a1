package com.study.webflux.voice.fixture;

import java.util.List;

import com.study.webflux.voice.domain.pipeline.model.TranscriptSegment;
import com.study.webflux.voice.domain.pipeline.model.TranscriptionResult;

public final class TranscriptionResultFixture {

	public static final String DEFAULT_TEXT = "This is a great day";

	private TranscriptionResultFixture() {
	}

	public static TranscriptionResult create() {
		return create(DEFAULT_TEXT);
	}

	public static TranscriptionResult create(String text) {
		return new TranscriptionResult(text, "en", 0.98, 2.4,
			List.of(new TranscriptSegment(0.0, 2.4, text, 0.91)));
	}
}
