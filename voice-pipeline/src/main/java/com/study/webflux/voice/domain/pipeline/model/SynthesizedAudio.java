package com.study.webflux.voice.domain.pipeline.model;

import java.util.Arrays;

/** 합성 백엔드가 반환한 오디오와 재생 시간(초)입니다. */
public record SynthesizedAudio(
	byte[] audio,
	double durationSeconds
) {

	public SynthesizedAudio {
		if (audio == null) {
			throw new IllegalArgumentException("오디오 데이터는 null일 수 없습니다");
		}
		if (durationSeconds < 0) {
			throw new IllegalArgumentException("재생 시간은 음수일 수 없습니다");
		}
		audio = audio.clone();
	}

	@Override
	public byte[] audio() {
		return audio.clone();
	}

	public SynthesizedAudio withAudio(byte[] processed) {
		return new SynthesizedAudio(processed, durationSeconds);
	}

	@Override
	public boolean equals(Object other) {
		if (this == other) {
			return true;
		}
		return other instanceof SynthesizedAudio that
			&& Double.compare(durationSeconds, that.durationSeconds) == 0
			&& Arrays.equals(audio, that.audio);
	}

	@Override
	public int hashCode() {
		return 31 * Arrays.hashCode(audio) + Double.hashCode(durationSeconds);
	}

	@Override
	public String toString() {
		return "SynthesizedAudio[audio=" + audio.length + " bytes, durationSeconds="
			+ durationSeconds + "]";
	}
}
