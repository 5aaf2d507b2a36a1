package com.study.webflux.voice.infrastructure.voice.adapter.tts.circuit;

import java.time.Duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExponentialBackoffStrategyTest {

	@Test
	@DisplayName("기본 설정은 1초에서 시작해 2배씩 증가한다")
	void calculateDelay_defaults() {
		ExponentialBackoffStrategy strategy = ExponentialBackoffStrategy.defaults();

		assertThat(strategy.calculateDelay(1)).isEqualTo(Duration.ofSeconds(1));
		assertThat(strategy.calculateDelay(2)).isEqualTo(Duration.ofSeconds(2));
		assertThat(strategy.calculateDelay(3)).isEqualTo(Duration.ofSeconds(4));
		assertThat(strategy.calculateDelay(4)).isEqualTo(Duration.ofSeconds(8));
	}

	@Test
	@DisplayName("최대 대기 시간을 넘지 않는다")
	void calculateDelay_cappedAtMaxWait() {
		ExponentialBackoffStrategy strategy = ExponentialBackoffStrategy.defaults();

		assertThat(strategy.calculateDelay(5)).isEqualTo(Duration.ofSeconds(10));
		assertThat(strategy.calculateDelay(50)).isEqualTo(Duration.ofSeconds(10));
	}

	@Test
	@DisplayName("0 이하의 시도 번호는 대기하지 않는다")
	void calculateDelay_nonPositiveAttempt() {
		ExponentialBackoffStrategy strategy = ExponentialBackoffStrategy.defaults();

		assertThat(strategy.calculateDelay(0)).isEqualTo(Duration.ZERO);
		assertThat(strategy.calculateDelay(-1)).isEqualTo(Duration.ZERO);
	}

	@Test
	@DisplayName("잘못된 설정은 생성 시점에 거부한다")
	void constructor_invalidArguments() {
		assertThatThrownBy(() -> new ExponentialBackoffStrategy(Duration.ZERO,
			Duration.ofSeconds(1), 2.0)).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new ExponentialBackoffStrategy(Duration.ofSeconds(5),
			Duration.ofSeconds(1), 2.0)).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new ExponentialBackoffStrategy(Duration.ofSeconds(1),
			Duration.ofSeconds(10), 0.5)).isInstanceOf(IllegalArgumentException.class);
	}
}
