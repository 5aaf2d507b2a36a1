package com.study.webflux.voice.infrastructure.voice.adapter.tts.circuit;

/**
 * 서킷 브레이커 상태
 *
 * <p>
 * 서킷 브레이커는 3가지 상태를 가지며 다음과 같이 전이합니다:
 * <ul>
 * <li>CLOSED → OPEN: 연속 실패 횟수가 임계값에 도달했을 때</li>
 * <li>OPEN → HALF_OPEN: 복구 대기 시간이 지난 뒤 첫 호출 시점</li>
 * <li>HALF_OPEN → CLOSED: 연속 성공 횟수가 임계값에 도달했을 때</li>
 * <li>HALF_OPEN → OPEN: 한 번이라도 실패했을 때</li>
 * </ul>
 */
public enum CircuitBreakerState {
	/**
	 * 정상 상태 - 모든 요청 허용
	 */
	CLOSED("closed"),

	/**
	 * 차단 상태 - 요청 즉시 거절
	 */
	OPEN("open"),

	/**
	 * 복구 테스트 상태 - 제한된 수의 probe 요청만 허용
	 */
	HALF_OPEN("half_open");

	private final String value;

	CircuitBreakerState(String value) {
		this.value = value;
	}

	public String getValue() {
		return value;
	}
}
