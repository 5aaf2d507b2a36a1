package com.study.webflux.voice.domain.pipeline.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * 파이프라인으로 들어오는 요청입니다.
 *
 * <p>
 * 요청 종류는 닫힌 타입으로 관리하며 {@link Visitor}를 통해 모든 종류를 빠짐없이 처리합니다. 새 종류를 추가하면 모든 Visitor 구현이 컴파일 단계에서
 * 갱신되어야 합니다.
 */
public sealed interface PipelineRequest
	permits PipelineRequest.Synthesis, PipelineRequest.Transcription, PipelineRequest.Unrecognized {

	<R> R accept(Visitor<R> visitor);

	static PipelineRequest synthesis(String text) {
		return new Synthesis(text);
	}

	static PipelineRequest transcription(byte[] audio, String languageHint) {
		return new Transcription(audio, languageHint);
	}

	static PipelineRequest unrecognized(String type) {
		return new Unrecognized(type);
	}

	/** 텍스트 → 음성 합성 요청입니다. */
	record Synthesis(
		String text
	) implements PipelineRequest {

		public Synthesis {
			text = text == null ? "" : text;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitSynthesis(this);
		}
	}

	/** 음성 → 텍스트 전사 요청입니다. */
	record Transcription(
		byte[] audio,
		String languageHint
	) implements PipelineRequest {

		public Transcription {
			audio = audio == null ? new byte[0] : audio.clone();
		}

		@Override
		public byte[] audio() {
			return audio.clone();
		}

		public boolean hasAudio() {
			return audio.length > 0;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitTranscription(this);
		}

		@Override
		public boolean equals(Object other) {
			if (this == other) {
				return true;
			}
			if (!(other instanceof Transcription that)) {
				return false;
			}
			return Arrays.equals(audio, that.audio)
				&& Objects.equals(languageHint, that.languageHint);
		}

		@Override
		public int hashCode() {
			return 31 * Arrays.hashCode(audio) + Objects.hashCode(languageHint);
		}

		@Override
		public String toString() {
			return "Transcription[audio=" + audio.length + " bytes, languageHint=" + languageHint
				+ "]";
		}
	}

	/** 알 수 없는 형태의 요청입니다. 원본 타입 문자열만 보관합니다. */
	record Unrecognized(
		String type
	) implements PipelineRequest {

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitUnrecognized(this);
		}
	}

	interface Visitor<R> {

		R visitSynthesis(Synthesis request);

		R visitTranscription(Transcription request);

		R visitUnrecognized(Unrecognized request);
	}
}
