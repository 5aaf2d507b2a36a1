package com.study.webflux.voice.application.voice.websocket;

import java.util.Base64;
import java.util.List;

import com.study.webflux.voice.application.voice.dto.VoiceInboundMessage;
import com.study.webflux.voice.application.voice.dto.VoiceOutboundMessage;
import com.study.webflux.voice.domain.pipeline.model.PipelineRequest;
import com.study.webflux.voice.domain.pipeline.model.PipelineResponse;
import com.study.webflux.voice.domain.pipeline.model.SentimentScore;
import com.study.webflux.voice.domain.pipeline.model.TranscriptSegment;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VoiceMessageMapperTest {

	private final VoiceMessageMapper mapper = new VoiceMessageMapper();

	@Test
	@DisplayName("text 메시지는 합성 요청으로 변환된다")
	void toRequest_text() {
		PipelineRequest request = mapper.toRequest(new VoiceInboundMessage("text", "hello", null, null));

		assertThat(request).isEqualTo(new PipelineRequest.Synthesis("hello"));
	}

	@Test
	@DisplayName("audio 메시지는 Base64를 디코딩해 전사 요청으로 변환된다")
	void toRequest_audio() {
		String encoded = Base64.getEncoder().encodeToString(new byte[]{1, 2, 3});

		PipelineRequest request = mapper.toRequest(new VoiceInboundMessage("audio", null, encoded, "ko"));

		assertThat(request).isEqualTo(new PipelineRequest.Transcription(new byte[]{1, 2, 3}, "ko"));
	}

	@Test
	@DisplayName("audio 필드가 없으면 빈 오디오 요청이 된다")
	void toRequest_audioMissing() {
		PipelineRequest request = mapper.toRequest(new VoiceInboundMessage("audio", null, null, null));

		assertThat(((PipelineRequest.Transcription) request).hasAudio()).isFalse();
	}

	@Test
	@DisplayName("잘못된 Base64는 IllegalArgumentException을 던진다")
	void toRequest_invalidBase64() {
		assertThatThrownBy(() -> mapper.toRequest(
			new VoiceInboundMessage("audio", null, "***not-base64***", null)))
			.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("알 수 없는 타입과 누락된 타입은 미인식 요청이 된다")
	void toRequest_unrecognized() {
		assertThat(mapper.toRequest(new VoiceInboundMessage("video", null, null, null)))
			.isInstanceOf(PipelineRequest.Unrecognized.class);
		assertThat(mapper.toRequest(new VoiceInboundMessage(null, "hello", null, null)))
			.isInstanceOf(PipelineRequest.Unrecognized.class);
	}

	@Test
	@DisplayName("오디오 응답은 Base64 오디오와 감성 라벨을 담는다")
	void toOutbound_audio() {
		PipelineResponse.Audio audio = new PipelineResponse.Audio(new byte[]{1, 2}, 1.5, true,
			SentimentScore.of(0.8, 0.75), 42);

		VoiceOutboundMessage message = mapper.toOutbound(audio);

		assertThat(message.type()).isEqualTo(VoiceOutboundMessage.TYPE_AUDIO);
		assertThat(message.audio()).isEqualTo(Base64.getEncoder().encodeToString(new byte[]{1, 2}));
		assertThat(message.cached()).isTrue();
		assertThat(message.latencyMs()).isEqualTo(42L);
		assertThat(message.sentiment().label()).isEqualTo("positive");
	}

	@Test
	@DisplayName("전사 응답은 구간 정보를 포함한다")
	void toOutbound_transcript() {
		PipelineResponse.Transcript transcript = new PipelineResponse.Transcript("hi", "en", 0.9,
			1.2, List.of(new TranscriptSegment(0.0, 1.2, "hi", 0.8)), SentimentScore.neutral(), 30);

		VoiceOutboundMessage message = mapper.toOutbound(transcript);

		assertThat(message.type()).isEqualTo(VoiceOutboundMessage.TYPE_TRANSCRIPT);
		assertThat(message.segments()).containsExactly(
			new VoiceOutboundMessage.SegmentPayload(0.0, 1.2, "hi", 0.8));
		assertThat(message.sentiment().label()).isEqualTo("neutral");
	}

	@Test
	@DisplayName("실패 응답은 error 메시지가 된다")
	void toOutbound_failure() {
		VoiceOutboundMessage message = mapper.toOutbound(new PipelineResponse.Failure("Empty text"));

		assertThat(message.type()).isEqualTo(VoiceOutboundMessage.TYPE_ERROR);
		assertThat(message.message()).isEqualTo("Empty text");
		assertThat(message.audio()).isNull();
	}
}
