package com.study.webflux.voice.domain.pipeline.model;

/** 감성 분석 결과 라벨입니다. */
public enum SentimentLabel {
	POSITIVE("positive"),
	NEGATIVE("negative"),
	NEUTRAL("neutral");

	private static final double POLARITY_THRESHOLD = 0.1;

	private final String value;

	SentimentLabel(String value) {
		this.value = value;
	}

	public String getValue() {
		return value;
	}

	/** 극성 값으로부터 라벨을 결정합니다. ±0.1 이내는 중립입니다. */
	public static SentimentLabel fromPolarity(double polarity) {
		if (polarity > POLARITY_THRESHOLD) {
			return POSITIVE;
		}
		if (polarity < -POLARITY_THRESHOLD) {
			return NEGATIVE;
		}
		return NEUTRAL;
	}
}
