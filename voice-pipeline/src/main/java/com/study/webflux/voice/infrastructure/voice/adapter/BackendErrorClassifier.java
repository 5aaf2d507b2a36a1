package com.study.webflux.voice.infrastructure.voice.adapter;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import com.study.webflux.voice.domain.pipeline.exception.PermanentBackendException;
import com.study.webflux.voice.domain.pipeline.exception.PipelineValidationException;
import com.study.webflux.voice.domain.pipeline.exception.TransientBackendException;
import com.study.webflux.voice.domain.pipeline.exception.VoicePipelineException;

/**
 * 외부 백엔드 호출 에러를 파이프라인 예외로 분류합니다.
 *
 * <ul>
 * <li>TRANSIENT: 408, 429, 5xx, 연결 실패, 타임아웃, I/O 에러</li>
 * <li>VALIDATION: 400, 413, 415, 422 (요청 자체의 문제)</li>
 * <li>PERMANENT: 401, 402, 403, 404 및 그 외 4xx</li>
 * </ul>
 *
 * <p>
 * 어느 쪽에도 해당하지 않는 예외(디코딩 실패, 프로그래밍 오류 등)는 변환하지 않고 그대로 반환합니다. 재시도 대상이 아니며 호출자에게 예상치 못한 오류로 전달됩니다.
 */
public final class BackendErrorClassifier {

	private BackendErrorClassifier() {
	}

	public static Throwable classify(String backend, Throwable error) {
		if (error instanceof VoicePipelineException pipelineException) {
			return pipelineException;
		}
		if (error instanceof WebClientResponseException responseException) {
			return classifyStatus(backend, responseException.getStatusCode().value(), error);
		}
		if (error instanceof TimeoutException) {
			return new TransientBackendException(backend, backend + " 응답 시간 초과", error);
		}
		if (error instanceof WebClientRequestException || error instanceof IOException
			|| error.getCause() instanceof IOException) {
			return new TransientBackendException(backend,
				backend + " 연결 실패: " + describe(error), error);
		}
		return error;
	}

	public static VoicePipelineException classifyStatus(String backend, int statusCode,
		Throwable cause) {
		String description = String.format("%s [%d] %s", backend, statusCode,
			getErrorDescription(statusCode));
		if (statusCode == 408 || statusCode == 429 || statusCode >= 500) {
			return new TransientBackendException(backend, description, cause);
		}
		if (statusCode == 400 || statusCode == 413 || statusCode == 415 || statusCode == 422) {
			return new PipelineValidationException(description, cause);
		}
		return new PermanentBackendException(backend, statusCode, description, cause);
	}

	public static String getErrorDescription(int statusCode) {
		return switch (statusCode) {
			case 400 -> "Bad Request";
			case 401 -> "Unauthorized";
			case 402 -> "Payment Required";
			case 403 -> "Forbidden";
			case 404 -> "Not Found";
			case 408 -> "Request Timeout";
			case 413 -> "Payload Too Large";
			case 415 -> "Unsupported Media Type";
			case 422 -> "Unprocessable Entity";
			case 429 -> "Too Many Requests";
			case 500 -> "Internal Server Error";
			case 502 -> "Bad Gateway";
			case 503 -> "Service Unavailable";
			case 504 -> "Gateway Timeout";
			default -> "HTTP " + statusCode;
		};
	}

	private static String describe(Throwable error) {
		return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
	}
}
