package com.study.webflux.voice.infrastructure.voice.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import com.study.webflux.voice.domain.pipeline.port.TtsPort;
import com.study.webflux.voice.infrastructure.voice.adapter.tts.ElevenLabsTtsAdapter;
import com.study.webflux.voice.infrastructure.voice.adapter.tts.ResilientTtsAdapter;
import com.study.webflux.voice.infrastructure.voice.adapter.tts.circuit.BackendRetryPolicy;
import com.study.webflux.voice.infrastructure.voice.adapter.tts.circuit.SynthesisCircuitBreaker;
import com.study.webflux.voice.infrastructure.voice.config.properties.VoicePipelineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** ElevenLabs TTS 구성을 제공합니다. */
@Configuration
public class TtsConfiguration {

	private static final Logger log = LoggerFactory.getLogger(TtsConfiguration.class);

	/**
	 * 서킷 브레이커와 재시도로 감싼 TTS 포트를 생성합니다.
	 *
	 * <p>
	 * ElevenLabs 어댑터는 빈으로 등록하지 않으므로 합성 호출은 항상 보호 계층을 거칩니다.
	 */
	@Bean
	public TtsPort ttsPort(WebClient.Builder webClientBuilder,
		VoicePipelineProperties properties,
		SynthesisCircuitBreaker synthesisCircuitBreaker,
		BackendRetryPolicy backendRetryPolicy) {
		var tts = properties.getTts();
		if (tts.getApiKey() == null || tts.getApiKey().isBlank()) {
			log.warn("ElevenLabs API 키가 설정되지 않았습니다. 합성 요청은 백엔드에서 거부됩니다");
		}
		var backend = new ElevenLabsTtsAdapter(webClientBuilder, tts);
		return new ResilientTtsAdapter(backend, synthesisCircuitBreaker, backendRetryPolicy,
			tts.getTimeout());
	}
}
