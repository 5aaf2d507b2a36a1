package com.study.webflux.voice.domain.pipeline.port;

import com.study.webflux.voice.domain.pipeline.model.SentimentScore;

/** 텍스트 감성 점수를 계산하는 포트입니다. */
public interface SentimentPort {

	SentimentScore analyze(String text);
}
