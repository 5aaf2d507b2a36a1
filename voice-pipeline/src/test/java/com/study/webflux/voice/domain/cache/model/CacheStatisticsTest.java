package com.study.webflux.voice.domain.cache.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CacheStatisticsTest {

	@Test
	@DisplayName("요청이 없으면 적중률은 0이다")
	void of_noRequests() {
		CacheStatistics stats = CacheStatistics.of(0, 0);

		assertThat(stats.totalRequests()).isZero();
		assertThat(stats.hitRate()).isZero();
		assertThat(stats.reductionPercentage()).isZero();
	}

	@Test
	@DisplayName("적중률은 적중 수를 전체 요청 수로 나눈 값이다")
	void of_hitRate() {
		CacheStatistics stats = CacheStatistics.of(3, 1);

		assertThat(stats.totalRequests()).isEqualTo(4);
		assertThat(stats.hitRate()).isEqualTo(0.75);
		assertThat(stats.reductionPercentage()).isEqualTo(0.75);
	}

	@Test
	@DisplayName("모두 미스면 적중률은 0이다")
	void of_allMisses() {
		assertThat(CacheStatistics.of(0, 10).hitRate()).isZero();
	}
}
