package com.study.webflux.voice.domain.pipeline.port;

import com.study.webflux.voice.domain.monitoring.model.PipelineHealth;
import com.study.webflux.voice.domain.monitoring.model.PipelineStatsSnapshot;
import reactor.core.publisher.Mono;

public interface PipelineStatusUseCase {

	Mono<PipelineStatsSnapshot> stats();

	Mono<PipelineHealth> health();
}
