package com.study.webflux.voice.infrastructure.voice.adapter.audio;

import java.nio.charset.StandardCharsets;

import com.study.webflux.voice.fixture.WavAudioFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class WavLoudnessNormalizerTest {

	private static final int SAMPLES = 16_000;

	private WavLoudnessNormalizer normalizer;

	@BeforeEach
	void setUp() {
		normalizer = new WavLoudnessNormalizer(-20.0, -20.0, 4.0);
	}

	@Test
	@DisplayName("큰 소리는 목표 dBFS로 낮춘다")
	void normalize_loudAudio_reducedToTarget() {
		byte[] loud = WavAudioFixture.sine(0.5, SAMPLES);

		byte[] normalized = normalizer.normalize(loud);

		assertThat(WavAudioFixture.rmsDbfs(loud)).isGreaterThan(-10.0);
		assertThat(WavAudioFixture.rmsDbfs(normalized)).isCloseTo(-20.0, within(0.1));
	}

	@Test
	@DisplayName("작은 소리는 목표 dBFS로 키운다")
	void normalize_quietAudio_raisedToTarget() {
		byte[] quiet = WavAudioFixture.sine(0.01, SAMPLES);

		byte[] normalized = normalizer.normalize(quiet);

		assertThat(WavAudioFixture.rmsDbfs(normalized)).isCloseTo(-20.0, within(0.1));
	}

	@Test
	@DisplayName("무음은 변경하지 않는다")
	void normalize_silence_unchanged() {
		byte[] silence = WavAudioFixture.silence(SAMPLES);

		assertThat(normalizer.normalize(silence)).isSameAs(silence);
	}

	@Test
	@DisplayName("WAV가 아닌 데이터는 원본을 그대로 반환한다")
	void normalize_nonWav_returnsOriginal() {
		byte[] mp3 = "ID3-not-a-wave-file".getBytes(StandardCharsets.UTF_8);

		assertThat(normalizer.normalize(mp3)).isSameAs(mp3);
		assertThat(normalizer.compress(mp3)).isSameAs(mp3);
	}

	@Test
	@DisplayName("빈 데이터는 그대로 반환한다")
	void normalize_empty_returnsOriginal() {
		byte[] empty = new byte[0];

		assertThat(normalizer.normalize(empty)).isSameAs(empty);
	}

	@Test
	@DisplayName("임계값을 넘는 피크는 비율만큼 압축한다")
	void compress_loudPeaks_reduced() {
		byte[] loud = WavAudioFixture.sine(0.9, SAMPLES);

		byte[] compressed = normalizer.compress(loud);

		// -0.9 dBFS 피크는 -20 + (19.1 / 4) ≈ -15.2 dBFS로 줄어듭니다
		assertThat(WavAudioFixture.peak(compressed)).isCloseTo(0.173, within(0.005));
	}

	@Test
	@DisplayName("임계값 이하의 신호는 압축하지 않는다")
	void compress_quietSignal_unchanged() {
		byte[] quiet = WavAudioFixture.sine(0.05, SAMPLES);

		byte[] compressed = normalizer.compress(quiet);

		assertThat(WavAudioFixture.peak(compressed))
			.isCloseTo(WavAudioFixture.peak(quiet), within(0.0001));
	}

	@Test
	@DisplayName("압축 비율은 1 이상이어야 한다")
	void constructor_invalidRatio() {
		assertThatThrownBy(() -> new WavLoudnessNormalizer(-20.0, -20.0, 0.5))
			.isInstanceOf(IllegalArgumentException.class);
	}
}
