package com.study.webflux.voice.domain.pipeline.exception;

/**
 * 음성 파이프라인 예외의 기반 클래스입니다.
 *
 * <p>
 * 하위 예외는 재시도 여부와 서킷 브레이커 집계 여부를 결정하는 분류 기준이 됩니다.
 */
public abstract class VoicePipelineException extends RuntimeException {

	protected VoicePipelineException(String message) {
		super(message);
	}

	protected VoicePipelineException(String message, Throwable cause) {
		super(message, cause);
	}

	/** 클라이언트에 노출 가능한 장애 분류 문구입니다. */
	public abstract String category();
}
