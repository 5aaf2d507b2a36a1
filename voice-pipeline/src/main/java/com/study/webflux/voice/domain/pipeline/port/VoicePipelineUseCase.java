package com.study.webflux.voice.domain.pipeline.port;

import com.study.webflux.voice.domain.pipeline.model.PipelineRequest;
import com.study.webflux.voice.domain.pipeline.model.PipelineResponse;
import reactor.core.publisher.Mono;

public interface VoicePipelineUseCase {

	/** 요청 종류에 따라 합성 또는 전사 경로를 실행합니다. 실패도 응답으로 반환되며 에러 시그널을 내보내지 않습니다. */
	Mono<PipelineResponse> handle(PipelineRequest request);

	/** 캐시를 거치지 않고 합성합니다. */
	Mono<PipelineResponse> synthesizeWithoutCache(String text);
}
