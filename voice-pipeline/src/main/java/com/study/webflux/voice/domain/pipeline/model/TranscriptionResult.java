package com.study.webflux.voice.domain.pipeline.model;

import java.util.List;

/** 전사 백엔드가 반환한 결과입니다. */
public record TranscriptionResult(
	String text,
	String language,
	double languageProbability,
	double durationSeconds,
	List<TranscriptSegment> segments
) {

	public TranscriptionResult {
		text = text == null ? "" : text.strip();
		segments = segments == null ? List.of() : List.copyOf(segments);
	}
}
