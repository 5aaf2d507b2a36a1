package com.study.webflux.voice.infrastructure.voice.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import com.study.webflux.voice.domain.pipeline.port.SttPort;
import com.study.webflux.voice.infrastructure.voice.adapter.stt.OpenAiWhisperSttAdapter;
import com.study.webflux.voice.infrastructure.voice.config.properties.VoicePipelineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Whisper 기반 STT 구성을 제공합니다. */
@Configuration
public class SttConfiguration {

	private static final Logger log = LoggerFactory.getLogger(SttConfiguration.class);
	private static final String DEFAULT_BASE_URL = "https://api.openai.com";

	/** OpenAI Whisper STT 포트를 생성합니다. */
	@Bean
	public SttPort sttPort(WebClient.Builder webClientBuilder,
		VoicePipelineProperties properties,
		@Value("${OPENAI_API_KEY:}") String environmentApiKey) {
		var stt = properties.getStt();
		String apiKey = resolveApiKey(stt, environmentApiKey);
		String baseUrl = resolveBaseUrl(stt);
		return new OpenAiWhisperSttAdapter(webClientBuilder, apiKey, baseUrl, stt.getModel());
	}

	private String resolveApiKey(VoicePipelineProperties.Stt stt, String environmentApiKey) {
		String configuredApiKey = stt.getApiKey();
		if (configuredApiKey != null && !configuredApiKey.isBlank()) {
			return configuredApiKey;
		}
		if (environmentApiKey == null || environmentApiKey.isBlank()) {
			log.warn("OpenAI API 키가 설정되지 않았습니다. 전사 요청은 백엔드에서 거부됩니다");
			return "";
		}
		return environmentApiKey;
	}

	private String resolveBaseUrl(VoicePipelineProperties.Stt stt) {
		String configuredBaseUrl = stt.getBaseUrl();
		if (configuredBaseUrl == null || configuredBaseUrl.isBlank()) {
			return DEFAULT_BASE_URL;
		}
		return configuredBaseUrl;
	}
}
