package com.study.webflux.voice.domain.pipeline.port;

/** 합성된 오디오의 후처리(음량 정규화, 다이나믹 레인지 압축)를 담당하는 포트입니다. */
public interface AudioPostProcessorPort {

	/** 음량을 목표 수준으로 정규화합니다. 처리할 수 없는 형식이면 원본을 반환합니다. */
	byte[] normalize(byte[] audio);

	/** 다이나믹 레인지를 압축합니다. 처리할 수 없는 형식이면 원본을 반환합니다. */
	byte[] compress(byte[] audio);
}
