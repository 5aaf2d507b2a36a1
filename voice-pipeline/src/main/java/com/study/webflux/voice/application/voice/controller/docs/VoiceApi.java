package com.study.webflux.voice.application.voice.controller.docs;

import com.study.webflux.voice.application.voice.dto.SttRequest;
import com.study.webflux.voice.application.voice.dto.SttResponse;
import com.study.webflux.voice.application.voice.dto.TtsRequest;
import com.study.webflux.voice.application.voice.dto.TtsResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import reactor.core.publisher.Mono;

@Tag(
	name = "음성 API",
	description = "캐시와 서킷 브레이커로 보호되는 TTS, STT 단건 처리"
)
public interface VoiceApi {

	@Operation(
		summary = "텍스트 음성 합성",
		description = "텍스트를 합성해 Base64 오디오로 반환합니다. 동일 텍스트는 캐시에서 응답합니다"
	)
	@ApiResponse(responseCode = "200", description = "합성 성공")
	@ApiResponse(responseCode = "400", description = "빈 텍스트 또는 잘못된 요청")
	@ApiResponse(responseCode = "502", description = "합성 백엔드가 요청을 거부함")
	@ApiResponse(responseCode = "503", description = "서킷 브레이커 차단 또는 백엔드 일시 장애")
	Mono<TtsResponse> synthesize(
		@Valid TtsRequest request
	);

	@Operation(
		summary = "음성 텍스트 전사",
		description = "Base64 오디오를 전사하고 구간 정보와 감성 점수를 반환합니다"
	)
	@ApiResponse(responseCode = "200", description = "전사 성공")
	@ApiResponse(responseCode = "400", description = "빈 오디오 또는 잘못된 인코딩")
	@ApiResponse(responseCode = "502", description = "전사 백엔드가 요청을 거부함")
	@ApiResponse(responseCode = "503", description = "전사 백엔드 일시 장애")
	Mono<SttResponse> transcribe(
		@Valid SttRequest request
	);
}
