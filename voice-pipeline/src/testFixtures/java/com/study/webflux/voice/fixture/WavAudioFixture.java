package com.study.webflux.voice.fixture;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;

/** 16비트 모노 PCM WAV 테스트 데이터를 만듭니다. */
public final class WavAudioFixture {

	public static final float SAMPLE_RATE = 16_000f;

	private WavAudioFixture() {
	}

	/** 지정한 진폭(0~1)의 440Hz 사인파입니다. */
	public static byte[] sine(double amplitude, int sampleCount) {
		short[] samples = new short[sampleCount];
		for (int i = 0; i < sampleCount; i++) {
			samples[i] = (short) Math.round(
				amplitude * Short.MAX_VALUE * Math.sin(2 * Math.PI * 440 * i / SAMPLE_RATE));
		}
		return wav(samples);
	}

	public static byte[] silence(int sampleCount) {
		return wav(new short[sampleCount]);
	}

	public static byte[] wav(short[] samples) {
		ByteBuffer buffer = ByteBuffer.allocate(samples.length * 2).order(ByteOrder.LITTLE_ENDIAN);
		for (short sample : samples) {
			buffer.putShort(sample);
		}
		AudioFormat format = new AudioFormat(SAMPLE_RATE, 16, 1, true, false);
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		try (AudioInputStream stream = new AudioInputStream(
			new ByteArrayInputStream(buffer.array()), format, samples.length)) {
			AudioSystem.write(stream, AudioFileFormat.Type.WAVE, out);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
		return out.toByteArray();
	}

	/** WAV 데이터의 RMS 레벨(dBFS)을 계산합니다. */
	public static double rmsDbfs(byte[] wav) {
		try (AudioInputStream stream = AudioSystem.getAudioInputStream(new ByteArrayInputStream(wav))) {
			byte[] pcm = stream.readAllBytes();
			ByteBuffer buffer = ByteBuffer.wrap(pcm).order(ByteOrder.LITTLE_ENDIAN);
			int count = pcm.length / 2;
			double sum = 0.0;
			for (int i = 0; i < count; i++) {
				double sample = buffer.getShort() / 32768.0;
				sum += sample * sample;
			}
			return 20.0 * Math.log10(Math.sqrt(sum / count));
		} catch (Exception e) {
			throw new IllegalStateException(e);
		}
	}

	/** WAV 데이터의 최대 절대 샘플 값(0~1)입니다. */
	public static double peak(byte[] wav) {
		try (AudioInputStream stream = AudioSystem.getAudioInputStream(new ByteArrayInputStream(wav))) {
			byte[] pcm = stream.readAllBytes();
			ByteBuffer buffer = ByteBuffer.wrap(pcm).order(ByteOrder.LITTLE_ENDIAN);
			double peak = 0.0;
			for (int i = 0; i < pcm.length / 2; i++) {
				peak = Math.max(peak, Math.abs(buffer.getShort() / 32768.0));
			}
			return peak;
		} catch (Exception e) {
			throw new IllegalStateException(e);
		}
	}
}
