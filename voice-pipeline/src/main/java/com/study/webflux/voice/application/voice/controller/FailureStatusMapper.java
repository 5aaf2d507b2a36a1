package com.study.webflux.voice.application.voice.controller;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import com.study.webflux.voice.domain.pipeline.model.PipelineResponse;

/** 파이프라인 실패 응답을 HTTP 상태로 변환합니다. */
final class FailureStatusMapper {

	private FailureStatusMapper() {
	}

	static ResponseStatusException toException(PipelineResponse.Failure failure) {
		return new ResponseStatusException(resolveStatus(failure.message()), failure.message());
	}

	static HttpStatus resolveStatus(String message) {
		if (message.endsWith("circuit breaker open") || message.endsWith("backend unavailable")) {
			return HttpStatus.SERVICE_UNAVAILABLE;
		}
		if (message.endsWith("backend rejected request")) {
			return HttpStatus.BAD_GATEWAY;
		}
		if (message.endsWith("unexpected failure")) {
			return HttpStatus.INTERNAL_SERVER_ERROR;
		}
		return HttpStatus.BAD_REQUEST;
	}
}
