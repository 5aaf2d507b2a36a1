package com.study.webflux.voice.application.pipeline.stage;

import java.time.Duration;

import com.study.webflux.voice.domain.pipeline.exception.PipelineValidationException;
import com.study.webflux.voice.domain.pipeline.exception.TransientBackendException;
import com.study.webflux.voice.domain.pipeline.model.AudioTranscriptionInput;
import com.study.webflux.voice.domain.pipeline.model.SentimentLabel;
import com.study.webflux.voice.domain.pipeline.model.SentimentScore;
import com.study.webflux.voice.domain.pipeline.port.SentimentPort;
import com.study.webflux.voice.domain.pipeline.port.SttPort;
import com.study.webflux.voice.fixture.TranscriptionResultFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TranscriptionStageServiceTest {

	private static final byte[] AUDIO = {1, 2, 3, 4};

	@Mock
	private SttPort sttPort;

	@Mock
	private SentimentPort sentimentPort;

	private TranscriptionStageService stage(Duration timeout) {
		return new TranscriptionStageService(sttPort, sentimentPort, timeout, 1024, "en",
			Schedulers.immediate());
	}

	@Test
	@DisplayName("전사 결과와 감성 점수를 함께 반환한다")
	void transcribe_success() {
		when(sttPort.transcribe(any())).thenReturn(Mono.just(TranscriptionResultFixture.create()));
		when(sentimentPort.analyze(TranscriptionResultFixture.DEFAULT_TEXT))
			.thenReturn(SentimentScore.of(0.8, 0.75));

		StepVerifier.create(stage(Duration.ofSeconds(1)).transcribe(AUDIO, "ko"))
			.assertNext(transcript -> {
				assertThat(transcript.text()).isEqualTo(TranscriptionResultFixture.DEFAULT_TEXT);
				assertThat(transcript.language()).isEqualTo("en");
				assertThat(transcript.languageProbability()).isEqualTo(0.98);
				assertThat(transcript.segments()).hasSize(1);
				assertThat(transcript.sentiment().label()).isEqualTo(SentimentLabel.POSITIVE);
			})
			.verifyComplete();

		ArgumentCaptor<AudioTranscriptionInput> captor = ArgumentCaptor.forClass(
			AudioTranscriptionInput.class);
		verify(sttPort).transcribe(captor.capture());
		assertThat(captor.getValue().language()).isEqualTo("ko");
		assertThat(captor.getValue().audioBytes()).containsExactly(AUDIO);
	}

	@Test
	@DisplayName("언어 힌트가 없으면 기본 언어를 사용한다")
	void transcribe_defaultLanguage() {
		when(sttPort.transcribe(any())).thenReturn(Mono.just(TranscriptionResultFixture.create()));
		when(sentimentPort.analyze(any())).thenReturn(SentimentScore.neutral());

		stage(Duration.ofSeconds(1)).transcribe(AUDIO, " ").block();

		ArgumentCaptor<AudioTranscriptionInput> captor = ArgumentCaptor.forClass(
			AudioTranscriptionInput.class);
		verify(sttPort).transcribe(captor.capture());
		assertThat(captor.getValue().language()).isEqualTo("en");
	}

	@Test
	@DisplayName("허용 크기를 넘는 오디오는 백엔드를 호출하지 않고 거절한다")
	void transcribe_tooLarge() {
		StepVerifier.create(stage(Duration.ofSeconds(1)).transcribe(new byte[2048], null))
			.expectError(PipelineValidationException.class)
			.verify();

		verify(sttPort, never()).transcribe(any());
	}

	@Test
	@DisplayName("응답 시간이 초과되면 일시적 장애로 변환한다")
	void transcribe_timeout() {
		when(sttPort.transcribe(any())).thenReturn(Mono.never());

		StepVerifier.create(stage(Duration.ofMillis(100)).transcribe(AUDIO, null))
			.expectError(TransientBackendException.class)
			.verify(Duration.ofSeconds(2));
	}

	@Test
	@DisplayName("STT 백엔드가 빈 응답으로 끝나면 일시적 장애로 처리한다")
	void transcribe_emptyResponse() {
		when(sttPort.transcribe(any())).thenReturn(Mono.empty());

		StepVerifier.create(stage(Duration.ofSeconds(1)).transcribe(AUDIO, "en"))
			.expectError(TransientBackendException.class)
			.verify();

		verify(sentimentPort, never()).analyze(any());
	}
}
