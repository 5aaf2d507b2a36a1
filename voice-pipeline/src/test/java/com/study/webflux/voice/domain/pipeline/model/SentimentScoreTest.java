package com.study.webflux.voice.domain.pipeline.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SentimentScoreTest {

	@Test
	@DisplayName("극성 ±0.1 이내는 중립으로 분류한다")
	void of_labelThresholds() {
		assertThat(SentimentScore.of(0.1, 0.5).label()).isEqualTo(SentimentLabel.NEUTRAL);
		assertThat(SentimentScore.of(-0.1, 0.5).label()).isEqualTo(SentimentLabel.NEUTRAL);
		assertThat(SentimentScore.of(0.11, 0.5).label()).isEqualTo(SentimentLabel.POSITIVE);
		assertThat(SentimentScore.of(-0.11, 0.5).label()).isEqualTo(SentimentLabel.NEGATIVE);
	}

	@Test
	@DisplayName("범위를 벗어난 점수는 거부한다")
	void constructor_outOfRange() {
		assertThatThrownBy(() -> SentimentScore.of(1.5, 0.5))
			.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> SentimentScore.of(0.5, -0.1))
			.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("라벨 값은 소문자 문자열이다")
	void label_value() {
		assertThat(SentimentLabel.POSITIVE.getValue()).isEqualTo("positive");
		assertThat(SentimentScore.neutral().label().getValue()).isEqualTo("neutral");
	}
}
