package com.study.webflux.voice.domain.pipeline.model;

/** 전사 결과의 구간 정보입니다. 시간 단위는 초입니다. */
public record TranscriptSegment(
	double start,
	double end,
	String text,
	double confidence
) {

	public TranscriptSegment {
		if (end < start) {
			throw new IllegalArgumentException("구간 종료 시각이 시작 시각보다 앞설 수 없습니다");
		}
		text = text == null ? "" : text.strip();
	}
}
