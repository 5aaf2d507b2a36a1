package com.study.webflux.voice.infrastructure.voice.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import com.study.webflux.voice.domain.pipeline.port.AudioPostProcessorPort;
import com.study.webflux.voice.domain.pipeline.port.SentimentPort;
import com.study.webflux.voice.infrastructure.voice.adapter.audio.WavLoudnessNormalizer;
import com.study.webflux.voice.infrastructure.voice.adapter.sentiment.LexiconSentimentAdapter;
import com.study.webflux.voice.infrastructure.voice.config.properties.VoicePipelineProperties;

/** 감성 분석과 오디오 후처리 구성을 제공합니다. */
@Configuration
@EnableConfigurationProperties(VoicePipelineProperties.class)
public class VoiceProcessingConfiguration {

	@Bean
	public SentimentPort sentimentPort(VoicePipelineProperties properties,
		ResourceLoader resourceLoader) {
		return new LexiconSentimentAdapter(
			resourceLoader.getResource(properties.getSentiment().getLexicon()));
	}

	@Bean
	public AudioPostProcessorPort audioPostProcessorPort(VoicePipelineProperties properties) {
		var audio = properties.getAudio();
		return new WavLoudnessNormalizer(audio.getTargetDbfs(),
			audio.getCompressionThresholdDbfs(),
			audio.getCompressionRatio());
	}
}
