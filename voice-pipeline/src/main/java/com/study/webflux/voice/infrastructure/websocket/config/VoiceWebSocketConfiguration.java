package com.study.webflux.voice.infrastructure.websocket.config;

import java.util.Map;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;

import com.study.webflux.voice.application.voice.websocket.VoiceWebSocketHandler;

/** 음성 WebSocket 엔드포인트를 등록합니다. */
@Configuration
public class VoiceWebSocketConfiguration {

	public static final String VOICE_PATH = "/ws/voice";

	@Bean
	public HandlerMapping voiceWebSocketHandlerMapping(VoiceWebSocketHandler voiceWebSocketHandler) {
		return new SimpleUrlHandlerMapping(Map.of(VOICE_PATH, voiceWebSocketHandler),
			Ordered.HIGHEST_PRECEDENCE);
	}
}
