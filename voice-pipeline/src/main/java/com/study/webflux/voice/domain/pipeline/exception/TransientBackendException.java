package com.study.webflux.voice.domain.pipeline.exception;

/** 타임아웃, 연결 실패, 5xx 등 일시적 백엔드 장애입니다. 재시도 대상이며 서킷 브레이커 실패로 집계됩니다. */
public class TransientBackendException extends VoicePipelineException {

	private final String backend;

	public TransientBackendException(String backend, String message) {
		super(message);
		this.backend = backend;
	}

	public TransientBackendException(String backend, String message, Throwable cause) {
		super(message, cause);
		this.backend = backend;
	}

	public String getBackend() {
		return backend;
	}

	@Override
	public String category() {
		return "backend unavailable";
	}
}
