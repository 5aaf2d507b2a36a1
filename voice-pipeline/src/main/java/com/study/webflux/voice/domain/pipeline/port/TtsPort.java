package com.study.webflux.voice.domain.pipeline.port;

import com.study.webflux.voice.domain.pipeline.model.SynthesizedAudio;
import reactor.core.publisher.Mono;

/** 텍스트를 음성으로 합성하는 TTS 포트입니다. */
public interface TtsPort {

	/**
	 * 텍스트를 합성합니다.
	 *
	 * @return 합성된 오디오. 실패 시 {@code TransientBackendException} 또는 {@code PermanentBackendException}
	 */
	Mono<SynthesizedAudio> synthesize(String text);
}
