package com.study.webflux.voice.application.voice.websocket;

import java.util.Base64;
import java.util.List;

import org.springframework.stereotype.Component;

import com.study.webflux.voice.application.voice.dto.VoiceInboundMessage;
import com.study.webflux.voice.application.voice.dto.VoiceOutboundMessage;
import com.study.webflux.voice.domain.pipeline.model.PipelineRequest;
import com.study.webflux.voice.domain.pipeline.model.PipelineResponse;
import com.study.webflux.voice.domain.pipeline.model.SentimentScore;
import com.study.webflux.voice.domain.pipeline.model.TranscriptSegment;

/** WebSocket 메시지와 파이프라인 요청/응답 사이의 변환을 담당합니다. */
@Component
public class VoiceMessageMapper {

	static final String TYPE_TEXT = "text";
	static final String TYPE_AUDIO = "audio";

	/**
	 * 수신 메시지를 파이프라인 요청으로 변환합니다.
	 *
	 * @throws IllegalArgumentException
	 *             메시지가 비어 있거나 audio 필드가 올바른 Base64가 아닌 경우
	 */
	public PipelineRequest toRequest(VoiceInboundMessage message) {
		if (message == null) {
			throw new IllegalArgumentException("메시지 본문이 비어 있습니다");
		}
		String type = message.type();
		if (TYPE_TEXT.equals(type)) {
			return PipelineRequest.synthesis(message.text());
		}
		if (TYPE_AUDIO.equals(type)) {
			byte[] audio = message.audio() == null || message.audio().isEmpty()
				? new byte[0]
				: Base64.getDecoder().decode(message.audio());
			return PipelineRequest.transcription(audio, message.language());
		}
		return PipelineRequest.unrecognized(type);
	}

	public VoiceOutboundMessage toOutbound(PipelineResponse response) {
		return response.accept(new PipelineResponse.Visitor<>() {

			@Override
			public VoiceOutboundMessage visitAudio(PipelineResponse.Audio audio) {
				return VoiceOutboundMessage.audio(Base64.getEncoder().encodeToString(audio.audio()),
					audio.durationSeconds(),
					audio.latencyMs(),
					audio.cached(),
					toPayload(audio.sentiment()));
			}

			@Override
			public VoiceOutboundMessage visitTranscript(PipelineResponse.Transcript transcript) {
				return VoiceOutboundMessage.transcript(transcript.text(),
					transcript.language(),
					transcript.languageProbability(),
					transcript.durationSeconds(),
					toPayloads(transcript.segments()),
					transcript.latencyMs(),
					toPayload(transcript.sentiment()));
			}

			@Override
			public VoiceOutboundMessage visitFailure(PipelineResponse.Failure failure) {
				return VoiceOutboundMessage.error(failure.message());
			}
		});
	}

	public VoiceOutboundMessage.SentimentPayload toPayload(SentimentScore sentiment) {
		return new VoiceOutboundMessage.SentimentPayload(sentiment.polarity(),
			sentiment.subjectivity(),
			sentiment.label().getValue());
	}

	private static List<VoiceOutboundMessage.SegmentPayload> toPayloads(
		List<TranscriptSegment> segments) {
		return segments.stream()
			.map(segment -> new VoiceOutboundMessage.SegmentPayload(segment.start(),
				segment.end(),
				segment.text(),
				segment.confidence()))
			.toList();
	}
}
