package com.study.webflux.voice.domain.cache.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 정규화된 요청 텍스트의 SHA-256 지문으로 만든 캐시 키입니다.
 *
 * <p>
 * 정규화: 소문자 변환, 앞뒤 공백 제거, 연속 공백을 하나로 축약. 동일하게 정규화되는 텍스트는 항상 같은 키를 가집니다.
 */
public record CacheKey(
	String value
) {

	public static final String PREFIX = "tts:audio:";
	public static final String PATTERN = PREFIX + "*";

	private static final Pattern WHITESPACE = Pattern.compile("\\s+");
	private static final int DIGEST_HEX_LENGTH = 64;

	public CacheKey {
		if (value == null || !value.startsWith(PREFIX)
			|| value.length() != PREFIX.length() + DIGEST_HEX_LENGTH) {
			throw new IllegalArgumentException("올바르지 않은 캐시 키입니다: " + value);
		}
	}

	public static CacheKey fromText(String text) {
		String normalized = normalize(text);
		return new CacheKey(PREFIX + HexFormat.of().formatHex(sha256(normalized)));
	}

	public static String normalize(String text) {
		if (text == null) {
			return "";
		}
		return WHITESPACE.matcher(text.toLowerCase(Locale.ROOT).strip()).replaceAll(" ");
	}

	/** 로그 출력용 축약 표현입니다. */
	public String abbreviated() {
		return value.substring(0, PREFIX.length() + 12) + "...";
	}

	private static byte[] sha256(String normalized) {
		try {
			return MessageDigest.getInstance("SHA-256")
				.digest(normalized.getBytes(StandardCharsets.UTF_8));
		} catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 알고리즘을 사용할 수 없습니다", e);
		}
	}
}
