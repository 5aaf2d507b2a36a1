package com.study.webflux.voice.domain.pipeline.model;

/** 텍스트 감성 점수입니다. polarity는 [-1, 1], subjectivity는 [0, 1] 범위입니다. */
public record SentimentScore(
	double polarity,
	double subjectivity,
	SentimentLabel label
) {

	public SentimentScore {
		if (polarity < -1.0 || polarity > 1.0) {
			throw new IllegalArgumentException("polarity는 -1 ~ 1 범위여야 합니다: " + polarity);
		}
		if (subjectivity < 0.0 || subjectivity > 1.0) {
			throw new IllegalArgumentException("subjectivity는 0 ~ 1 범위여야 합니다: " + subjectivity);
		}
		if (label == null) {
			label = SentimentLabel.fromPolarity(polarity);
		}
	}

	public static SentimentScore of(double polarity, double subjectivity) {
		return new SentimentScore(polarity, subjectivity, SentimentLabel.fromPolarity(polarity));
	}

	public static SentimentScore neutral() {
		return new SentimentScore(0.0, 0.0, SentimentLabel.NEUTRAL);
	}
}
