package com.study.webflux.voice.infrastructure.cache.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.study.webflux.voice.domain.cache.port.AudioCachePort;
import com.study.webflux.voice.infrastructure.cache.adapter.CaffeineAudioCacheAdapter;
import com.study.webflux.voice.infrastructure.cache.adapter.RedisAudioCacheAdapter;
import com.study.webflux.voice.infrastructure.cache.adapter.RedisAudioEntry;
import com.study.webflux.voice.infrastructure.voice.config.properties.VoicePipelineProperties;

/** 오디오 캐시 저장소 구성을 제공합니다. {@code voice.pipeline.cache.store} 값으로 저장소를 선택합니다. */
@Configuration
public class CacheConfiguration {

	/** 오디오 항목을 JSON으로 저장하는 ReactiveRedisTemplate을 생성합니다. */
	@Bean
	@ConditionalOnProperty(prefix = "voice.pipeline.cache", name = "store", havingValue = "redis", matchIfMissing = true)
	public ReactiveRedisTemplate<String, RedisAudioEntry> reactiveRedisAudioTemplate(
		ReactiveRedisConnectionFactory connectionFactory,
		ObjectMapper objectMapper) {
		RedisSerializationContext<String, RedisAudioEntry> context = RedisSerializationContext
			.<String, RedisAudioEntry>newSerializationContext(new StringRedisSerializer())
			.value(new Jackson2JsonRedisSerializer<>(objectMapper, RedisAudioEntry.class)).build();

		return new ReactiveRedisTemplate<>(connectionFactory, context);
	}

	@Bean
	@ConditionalOnProperty(prefix = "voice.pipeline.cache", name = "store", havingValue = "redis", matchIfMissing = true)
	public AudioCachePort redisAudioCachePort(
		ReactiveRedisTemplate<String, RedisAudioEntry> reactiveRedisAudioTemplate,
		ReactiveRedisConnectionFactory connectionFactory) {
		return new RedisAudioCacheAdapter(reactiveRedisAudioTemplate, connectionFactory);
	}

	@Bean
	@ConditionalOnProperty(prefix = "voice.pipeline.cache", name = "store", havingValue = "memory")
	public AudioCachePort memoryAudioCachePort(VoicePipelineProperties properties) {
		return new CaffeineAudioCacheAdapter(properties.getCache().getMaxEntries());
	}
}
