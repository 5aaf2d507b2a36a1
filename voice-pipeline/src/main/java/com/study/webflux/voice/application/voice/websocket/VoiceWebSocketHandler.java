package com.study.webflux.voice.application.voice.websocket;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.study.webflux.voice.application.monitoring.service.PipelineStatistics;
import com.study.webflux.voice.application.voice.dto.VoiceInboundMessage;
import com.study.webflux.voice.application.voice.dto.VoiceOutboundMessage;
import com.study.webflux.voice.domain.pipeline.port.VoicePipelineUseCase;
import reactor.core.publisher.Mono;

/**
 * {@code /ws/voice} 세션 핸들러입니다.
 *
 * <p>
 * 한 세션의 메시지는 {@code concatMap}으로 순서대로 처리되어 요청 순서대로 응답합니다. 처리 실패는 error 메시지로 응답하고 세션은 유지됩니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VoiceWebSocketHandler implements WebSocketHandler {

	static final String INVALID_MESSAGE_TYPE = "Invalid message type";
	static final String SERIALIZATION_FAILURE_FRAME = "{\"type\":\"error\",\"message\":\"Internal server error\"}";

	private final VoicePipelineUseCase voicePipelineUseCase;
	private final VoiceMessageMapper messageMapper;
	private final PipelineStatistics statistics;
	private final ObjectMapper objectMapper;

	@Override
	public Mono<Void> handle(WebSocketSession session) {
		String sessionId = session.getId();
		// 페이로드 버퍼는 수신 직후 해제되므로 concatMap 대기 전에 문자열로 꺼내 둡니다
		var responses = session.receive()
			.map(InboundFrame::from)
			.concatMap(this::process)
			.map(session::textMessage);

		return session.send(responses)
			.doFirst(() -> {
				statistics.connectionOpened();
				log.info("WebSocket 연결: {} (active: {})", sessionId,
					statistics.getActiveConnections());
			})
			.doFinally(signal -> {
				statistics.connectionClosed();
				log.info("WebSocket 종료: {} - {} (active: {})", sessionId, signal,
					statistics.getActiveConnections());
			});
	}

	private Mono<String> process(InboundFrame frame) {
		if (!frame.text()) {
			return Mono.just(write(VoiceOutboundMessage.error(INVALID_MESSAGE_TYPE)));
		}
		String payload = frame.payload();
		return Mono.fromCallable(() -> messageMapper.toRequest(
			objectMapper.readValue(payload, VoiceInboundMessage.class)))
			.flatMap(voicePipelineUseCase::handle)
			.map(messageMapper::toOutbound)
			.onErrorResume(JsonProcessingException.class, error -> invalidMessage(error))
			.onErrorResume(IllegalArgumentException.class, error -> invalidMessage(error))
			.map(this::write);
	}

	private Mono<VoiceOutboundMessage> invalidMessage(Exception error) {
		log.warn("잘못된 메시지: {}", error.getMessage());
		return Mono.just(VoiceOutboundMessage.error(INVALID_MESSAGE_TYPE));
	}

	private String write(VoiceOutboundMessage message) {
		try {
			return objectMapper.writeValueAsString(message);
		} catch (JsonProcessingException e) {
			log.error("응답 메시지 직렬화 실패", e);
			return SERIALIZATION_FAILURE_FRAME;
		}
	}

	private record InboundFrame(
		boolean text,
		String payload) {

		static InboundFrame from(WebSocketMessage message) {
			if (message.getType() != WebSocketMessage.Type.TEXT) {
				return new InboundFrame(false, "");
			}
			return new InboundFrame(true, message.getPayloadAsText());
		}
	}
}
