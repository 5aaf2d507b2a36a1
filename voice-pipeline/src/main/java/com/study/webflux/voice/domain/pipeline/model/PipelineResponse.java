package com.study.webflux.voice.domain.pipeline.model;

import java.util.List;

/**
 * 파이프라인 처리 결과입니다.
 *
 * <p>
 * 성공과 실패 모두 같은 채널로 전달되며 전송 계층은 {@link Visitor}로 응답 형태를 결정합니다.
 */
public sealed interface PipelineResponse
	permits PipelineResponse.Audio, PipelineResponse.Transcript, PipelineResponse.Failure {

	<R> R accept(Visitor<R> visitor);

	default boolean isFailure() {
		return false;
	}

	/** 합성된 오디오 응답입니다. */
	record Audio(
		byte[] audio,
		double durationSeconds,
		boolean cached,
		SentimentScore sentiment,
		long latencyMs
	) implements PipelineResponse {

		public Audio {
			audio = audio.clone();
		}

		@Override
		public byte[] audio() {
			return audio.clone();
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitAudio(this);
		}

		@Override
		public String toString() {
			return "Audio[audio=" + audio.length + " bytes, durationSeconds=" + durationSeconds
				+ ", cached=" + cached + ", sentiment=" + sentiment + ", latencyMs=" + latencyMs
				+ "]";
		}
	}

	/** 전사 결과 응답입니다. */
	record Transcript(
		String text,
		String language,
		double languageProbability,
		double durationSeconds,
		List<TranscriptSegment> segments,
		SentimentScore sentiment,
		long latencyMs
	) implements PipelineResponse {

		public Transcript {
			segments = segments == null ? List.of() : List.copyOf(segments);
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitTranscript(this);
		}
	}

	/** 요청 단위 실패 응답입니다. 내부 스택 트레이스는 포함하지 않습니다. */
	record Failure(
		String message
	) implements PipelineResponse {

		@Override
		public boolean isFailure() {
			return true;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitFailure(this);
		}
	}

	interface Visitor<R> {

		R visitAudio(Audio response);

		R visitTranscript(Transcript response);

		R visitFailure(Failure response);
	}
}
