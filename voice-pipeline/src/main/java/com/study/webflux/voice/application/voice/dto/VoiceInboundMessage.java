package com.study.webflux.voice.application.voice.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * WebSocket 수신 메시지입니다.
 *
 * <p>
 * {@code type}이 text면 {@code text}를, audio면 Base64 인코딩된 {@code audio}와 선택적인 {@code language}를 사용합니다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VoiceInboundMessage(
	String type,
	String text,
	String audio,
	String language
) {
}
