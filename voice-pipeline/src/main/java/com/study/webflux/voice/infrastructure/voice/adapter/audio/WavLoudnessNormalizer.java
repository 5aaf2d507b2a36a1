package com.study.webflux.voice.infrastructure.voice.adapter.audio;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.function.DoubleUnaryOperator;

import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;

import lombok.extern.slf4j.Slf4j;

import com.study.webflux.voice.domain.pipeline.port.AudioPostProcessorPort;

/**
 * 16비트 PCM WAV 오디오의 음량 정규화와 다이나믹 레인지 압축을 수행합니다.
 *
 * <p>
 * WAV가 아니거나(예: MP3) 16비트 PCM이 아닌 데이터는 손대지 않고 원본을 반환합니다. 처리 중 오류가 나도 원본을 반환합니다.
 */
@Slf4j
public class WavLoudnessNormalizer implements AudioPostProcessorPort {

	private static final double FULL_SCALE = 32768.0;

	private final double targetDbfs;
	private final double compressionThresholdDbfs;
	private final double compressionRatio;

	public WavLoudnessNormalizer(double targetDbfs,
		double compressionThresholdDbfs,
		double compressionRatio) {
		if (compressionRatio < 1.0) {
			throw new IllegalArgumentException("압축 비율은 1 이상이어야 합니다: " + compressionRatio);
		}
		this.targetDbfs = targetDbfs;
		this.compressionThresholdDbfs = compressionThresholdDbfs;
		this.compressionRatio = compressionRatio;
	}

	@Override
	public byte[] normalize(byte[] audio) {
		return process(audio, "normalize", samples -> {
			double rms = rms(samples);
			if (rms == 0.0) {
				return null;
			}
			double gainDb = targetDbfs - toDbfs(rms);
			double gain = Math.pow(10.0, gainDb / 20.0);
			log.debug("음량 정규화: {} dBFS -> {} dBFS", round(toDbfs(rms)), targetDbfs);
			return sample -> sample * gain;
		});
	}

	@Override
	public byte[] compress(byte[] audio) {
		return process(audio, "compress", samples -> sample -> {
			double magnitude = Math.abs(sample);
			if (magnitude == 0.0) {
				return sample;
			}
			double level = toDbfs(magnitude);
			if (level <= compressionThresholdDbfs) {
				return sample;
			}
			double compressed = compressionThresholdDbfs
				+ (level - compressionThresholdDbfs) / compressionRatio;
			return Math.signum(sample) * Math.pow(10.0, compressed / 20.0);
		});
	}

	private byte[] process(byte[] audio, String operation, GainPlanner planner) {
		if (audio == null || audio.length == 0) {
			return audio;
		}
		try (AudioInputStream input = AudioSystem.getAudioInputStream(new ByteArrayInputStream(audio))) {
			AudioFormat format = input.getFormat();
			if (!isSigned16BitPcm(format)) {
				log.debug("{} 건너뜀: 지원하지 않는 포맷 {}", operation, format);
				return audio;
			}

			byte[] pcm = input.readAllBytes();
			ByteOrder order = format.isBigEndian() ? ByteOrder.BIG_ENDIAN : ByteOrder.LITTLE_ENDIAN;
			double[] samples = readSamples(pcm, order);

			DoubleUnaryOperator transform = planner.plan(samples);
			if (transform == null) {
				return audio;
			}

			ByteBuffer output = ByteBuffer.allocate(samples.length * 2).order(order);
			for (double sample : samples) {
				double value = clip(transform.applyAsDouble(sample)) * FULL_SCALE;
				output.putShort((short) Math.max(Short.MIN_VALUE,
					Math.min(Short.MAX_VALUE, Math.round(value))));
			}
			return writeWav(output.array(), format);
		} catch (UnsupportedAudioFileException e) {
			log.debug("{} 건너뜀: WAV 형식이 아닙니다", operation);
			return audio;
		} catch (IOException | RuntimeException e) {
			log.warn("오디오 {} 실패, 원본을 사용합니다: {}", operation, e.getMessage());
			return audio;
		}
	}

	private static boolean isSigned16BitPcm(AudioFormat format) {
		return AudioFormat.Encoding.PCM_SIGNED.equals(format.getEncoding())
			&& format.getSampleSizeInBits() == 16;
	}

	private static double[] readSamples(byte[] pcm, ByteOrder order) {
		ByteBuffer buffer = ByteBuffer.wrap(pcm).order(order);
		double[] samples = new double[pcm.length / 2];
		for (int i = 0; i < samples.length; i++) {
			samples[i] = buffer.getShort() / FULL_SCALE;
		}
		return samples;
	}

	private static byte[] writeWav(byte[] pcm, AudioFormat format) throws IOException {
		long frames = pcm.length / format.getFrameSize();
		ByteArrayOutputStream out = new ByteArrayOutputStream(pcm.length + 44);
		try (AudioInputStream stream = new AudioInputStream(new ByteArrayInputStream(pcm), format,
			frames)) {
			AudioSystem.write(stream, AudioFileFormat.Type.WAVE, out);
		}
		return out.toByteArray();
	}

	private static double rms(double[] samples) {
		if (samples.length == 0) {
			return 0.0;
		}
		double sum = 0.0;
		for (double sample : samples) {
			sum += sample * sample;
		}
		return Math.sqrt(sum / samples.length);
	}

	private static double toDbfs(double amplitude) {
		return 20.0 * Math.log10(amplitude);
	}

	private static double clip(double sample) {
		return Math.max(-1.0, Math.min(1.0, sample));
	}

	private static double round(double value) {
		return Math.round(value * 10.0) / 10.0;
	}

	@FunctionalInterface
	private interface GainPlanner {

		/** 샘플 전체를 보고 변환을 결정합니다. null이면 변경하지 않습니다. */
		DoubleUnaryOperator plan(double[] samples);
	}
}
