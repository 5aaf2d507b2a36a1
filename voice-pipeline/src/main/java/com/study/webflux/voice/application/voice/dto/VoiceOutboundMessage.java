package com.study.webflux.voice.application.voice.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** WebSocket 송신 메시지입니다. 응답 종류에 해당하는 필드만 직렬화됩니다. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VoiceOutboundMessage(
	String type,
	String audio,
	Double duration,
	@JsonProperty("latency_ms") Long latencyMs,
	Boolean cached,
	SentimentPayload sentiment,
	String text,
	String language,
	@JsonProperty("language_probability") Double languageProbability,
	List<SegmentPayload> segments,
	String message
) {

	public static final String TYPE_AUDIO = "audio";
	public static final String TYPE_TRANSCRIPT = "transcript";
	public static final String TYPE_ERROR = "error";

	public static VoiceOutboundMessage audio(String audio,
		double duration,
		long latencyMs,
		boolean cached,
		SentimentPayload sentiment) {
		return new VoiceOutboundMessage(TYPE_AUDIO, audio, duration, latencyMs, cached, sentiment,
			null, null, null, null, null);
	}

	public static VoiceOutboundMessage transcript(String text,
		String language,
		double languageProbability,
		double duration,
		List<SegmentPayload> segments,
		long latencyMs,
		SentimentPayload sentiment) {
		return new VoiceOutboundMessage(TYPE_TRANSCRIPT, null, duration, latencyMs, null,
			sentiment, text, language, languageProbability, segments, null);
	}

	public static VoiceOutboundMessage error(String message) {
		return new VoiceOutboundMessage(TYPE_ERROR, null, null, null, null, null, null, null,
			null, null, message);
	}

	public record SentimentPayload(
		double polarity,
		double subjectivity,
		String label) {
	}

	public record SegmentPayload(
		double start,
		double end,
		String text,
		double confidence) {
	}
}
