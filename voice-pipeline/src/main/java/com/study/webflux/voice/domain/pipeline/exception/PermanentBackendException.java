package com.study.webflux.voice.domain.pipeline.exception;

/** 인증 실패, 쿼터 초과 등 백엔드의 명시적 거절입니다. 재시도하지 않지만 서킷 브레이커 실패로 집계됩니다. */
public class PermanentBackendException extends VoicePipelineException {

	private final String backend;
	private final int statusCode;

	public PermanentBackendException(String backend, int statusCode, String message) {
		super(message);
		this.backend = backend;
		this.statusCode = statusCode;
	}

	public PermanentBackendException(String backend, int statusCode, String message,
		Throwable cause) {
		super(message, cause);
		this.backend = backend;
		this.statusCode = statusCode;
	}

	public String getBackend() {
		return backend;
	}

	public int getStatusCode() {
		return statusCode;
	}

	@Override
	public String category() {
		return "backend rejected request";
	}
}
