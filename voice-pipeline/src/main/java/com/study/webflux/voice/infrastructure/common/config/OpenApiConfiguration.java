package com.study.webflux.voice.infrastructure.common.config;

import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;

/**
 * REST API 문서 설정입니다.
 *
 * <p>
 * WebSocket 엔드포인트 {@code /ws/voice}는 OpenAPI로 표현할 수 없어 설명 문구로만 안내합니다.
 */
@Configuration
public class OpenApiConfiguration {

	private static final String DESCRIPTION = """
		캐시된 TTS, 서킷 브레이커로 보호되는 합성 백엔드, STT를 제공하는 실시간 음성 파이프라인입니다.

		실시간 세션은 WebSocket `/ws/voice`로 연결하며 `{"type":"text","text":"..."}` 또는
		`{"type":"audio","audio":"<base64>","language":"en"}` 메시지를 보냅니다.""";

	@Bean
	public OpenAPI voicePipelineOpenApi(
		@Value("${voice.pipeline.api.server-url:}") String serverUrl,
		@Value("${spring.application.name:voice-pipeline}") String applicationName) {
		OpenAPI openApi = new OpenAPI()
			.info(new Info()
				.title("Voice Pipeline API")
				.description(DESCRIPTION)
				.version("1.0.0"))
			.tags(List.of(
				new Tag().name("음성 API").description("텍스트 음성 합성과 음성 전사"),
				new Tag().name("상태 API").description("헬스 체크와 통계"),
				new Tag().name("운영 API").description("캐시와 서킷 브레이커 관리")));

		if (!serverUrl.isBlank()) {
			openApi.servers(List.of(new Server().url(serverUrl).description(applicationName)));
		}
		return openApi;
	}
}
