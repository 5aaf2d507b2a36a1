package com.study.webflux.voice.domain.pipeline.exception;

/** 비어 있거나 형식이 잘못된 입력입니다. 재시도하지 않으며 서킷 브레이커에 집계되지 않습니다. */
public class PipelineValidationException extends VoicePipelineException {

	public PipelineValidationException(String message) {
		super(message);
	}

	public PipelineValidationException(String message, Throwable cause) {
		super(message, cause);
	}

	@Override
	public String category() {
		return "invalid request";
	}
}
