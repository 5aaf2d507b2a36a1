package com.study.webflux.voice.infrastructure.voice.config.properties;

import java.time.Duration;

import lombok.Getter;
import lombok.Setter;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/** 음성 파이프라인 설정입니다. {@code voice.pipeline} 접두사로 바인딩됩니다. */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "voice.pipeline")
public class VoicePipelineProperties {

	@Valid
	private Cache cache = new Cache();

	@Valid
	private CircuitBreaker circuitBreaker = new CircuitBreaker();

	@Valid
	private Retry retry = new Retry();

	@Valid
	private Tts tts = new Tts();

	@Valid
	private Stt stt = new Stt();

	@Valid
	private Audio audio = new Audio();

	@Valid
	private Sentiment sentiment = new Sentiment();

	@Getter
	@Setter
	public static class Cache {
		/** redis 또는 memory */
		@NotNull
		private CacheStore store = CacheStore.REDIS;
		@NotNull
		private Duration ttl = Duration.ofSeconds(3600);
		/** memory 저장소 사용 시 최대 항목 수 */
		@Min(1)
		private long maxEntries = 10_000;
	}

	public enum CacheStore {
		REDIS,
		MEMORY
	}

	@Getter
	@Setter
	public static class CircuitBreaker {
		@Min(1)
		private int failureThreshold = 5;
		@NotNull
		private Duration recoveryTimeout = Duration.ofSeconds(60);
		@Min(1)
		private int successThreshold = 2;
	}

	@Getter
	@Setter
	public static class Retry {
		@Min(1)
		private int maxAttempts = 3;
		@NotNull
		private Duration minWait = Duration.ofSeconds(1);
		@NotNull
		private Duration maxWait = Duration.ofSeconds(10);
		@DecimalMin("1.0")
		private double multiplier = 2.0;
	}

	@Getter
	@Setter
	public static class Tts {
		@NotBlank
		private String baseUrl = "https://api.elevenlabs.io";
		private String apiKey;
		@NotBlank
		private String voiceId = "IKne3meq5aSn9XLyUdCD";
		@NotBlank
		private String modelId = "eleven_monolingual_v1";
		@NotBlank
		private String outputFormat = "mp3_44100_128";
		/** 백엔드가 재생 시간을 주지 않을 때 추정에 사용하는 비트레이트 */
		@Min(1)
		private int bitrateKbps = 128;
		private double stability = 0.5;
		private double similarityBoost = 0.75;
		@NotNull
		private Duration timeout = Duration.ofSeconds(15);
	}

	@Getter
	@Setter
	public static class Stt {
		private String baseUrl = "https://api.openai.com";
		private String apiKey;
		@NotBlank
		private String model = "whisper-1";
		private String language;
		@Min(1)
		private long maxFileSizeBytes = 25L * 1024 * 1024;
		@NotNull
		private Duration timeout = Duration.ofSeconds(30);
	}

	@Getter
	@Setter
	public static class Audio {
		private double targetDbfs = -20.0;
		private boolean compressionEnabled = false;
		private double compressionThresholdDbfs = -20.0;
		@DecimalMin("1.0")
		private double compressionRatio = 4.0;
	}

	@Getter
	@Setter
	public static class Sentiment {
		/** 단어, 극성, 주관성을 탭으로 구분한 사전 파일 위치 */
		@NotBlank
		private String lexicon = "classpath:sentiment/lexicon.tsv";
	}
}
