package com.study.webflux.voice.application.voice.controller;

import java.util.Base64;

import lombok.RequiredArgsConstructor;

import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import com.study.webflux.voice.application.voice.controller.docs.VoiceApi;
import com.study.webflux.voice.application.voice.dto.SttRequest;
import com.study.webflux.voice.application.voice.dto.SttResponse;
import com.study.webflux.voice.application.voice.dto.TtsRequest;
import com.study.webflux.voice.application.voice.dto.TtsResponse;
import com.study.webflux.voice.application.voice.dto.VoiceOutboundMessage;
import com.study.webflux.voice.application.voice.websocket.VoiceMessageMapper;
import com.study.webflux.voice.domain.pipeline.model.PipelineRequest;
import com.study.webflux.voice.domain.pipeline.model.PipelineResponse;
import com.study.webflux.voice.domain.pipeline.port.VoicePipelineUseCase;
import jakarta.validation.Valid;
import reactor.core.publisher.Mono;

@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/api")
public class VoiceController implements VoiceApi {

	private final VoicePipelineUseCase voicePipelineUseCase;
	private final VoiceMessageMapper messageMapper;

	@PostMapping("/tts")
	public Mono<TtsResponse> synthesize(
		@Valid @RequestBody TtsRequest request) {
		Mono<PipelineResponse> response = request.cacheEnabled()
			? voicePipelineUseCase.handle(PipelineRequest.synthesis(request.text()))
			: voicePipelineUseCase.synthesizeWithoutCache(request.text());

		return response.flatMap(result -> result.accept(new RestVisitor<TtsResponse>() {
			@Override
			public Mono<TtsResponse> visitAudio(PipelineResponse.Audio audio) {
				return Mono.just(new TtsResponse(Base64.getEncoder().encodeToString(audio.audio()),
					audio.durationSeconds(),
					audio.cached(),
					audio.latencyMs(),
					messageMapper.toPayload(audio.sentiment())));
			}
		}));
	}

	@PostMapping("/stt")
	public Mono<SttResponse> transcribe(
		@Valid @RequestBody SttRequest request) {
		byte[] audio;
		try {
			audio = Base64.getDecoder().decode(request.audioBase64());
		} catch (IllegalArgumentException e) {
			return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST,
				"Invalid audio encoding"));
		}

		return voicePipelineUseCase.handle(PipelineRequest.transcription(audio, request.language()))
			.flatMap(result -> result.accept(new RestVisitor<SttResponse>() {
				@Override
				public Mono<SttResponse> visitTranscript(PipelineResponse.Transcript transcript) {
					VoiceOutboundMessage outbound = messageMapper.toOutbound(transcript);
					return Mono.just(new SttResponse(transcript.text(),
						transcript.language(),
						transcript.languageProbability(),
						transcript.durationSeconds(),
						outbound.segments(),
						transcript.latencyMs(),
						outbound.sentiment()));
				}
			}));
	}

	/** 기대하지 않은 응답 종류와 실패를 HTTP 오류로 변환하는 기본 Visitor입니다. */
	private abstract static class RestVisitor<T> implements PipelineResponse.Visitor<Mono<T>> {

		@Override
		public Mono<T> visitAudio(PipelineResponse.Audio response) {
			return unexpected();
		}

		@Override
		public Mono<T> visitTranscript(PipelineResponse.Transcript response) {
			return unexpected();
		}

		@Override
		public Mono<T> visitFailure(PipelineResponse.Failure response) {
			return Mono.error(FailureStatusMapper.toException(response));
		}

		private Mono<T> unexpected() {
			return Mono.error(new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR,
				"unexpected response type"));
		}
	}
}
