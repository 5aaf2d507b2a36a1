package com.study.webflux.voice.infrastructure.voice.adapter.sentiment;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.extern.slf4j.Slf4j;

import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;

import com.study.webflux.voice.domain.pipeline.model.SentimentScore;
import com.study.webflux.voice.domain.pipeline.port.SentimentPort;

/**
 * 단어 사전 기반 감성 분석 어댑터입니다.
 *
 * <p>
 * 사전에 있는 단어마다 극성과 주관성을 수집해 평균을 냅니다. 바로 앞의 강조어는 점수를 키우고, 부정어는 극성을 뒤집고 절반으로 줄입니다.
 */
@Slf4j
public class LexiconSentimentAdapter implements SentimentPort {
	public static final String DEFAULT_LEXICON = "sentiment/lexicon.tsv";

	private static final Pattern WORD = Pattern.compile("[a-z]+(?:'[a-z]+)?");
	private static final double NEGATION_FACTOR = -0.5;
	private static final Set<String> NEGATIONS = Set.of("not", "no", "never", "none", "nobody",
		"nothing", "neither", "nor", "isn't", "wasn't", "aren't", "weren't", "don't", "doesn't",
		"didn't", "can't", "cannot", "won't", "wouldn't", "shouldn't", "couldn't");
	private static final Map<String, Double> INTENSIFIERS = Map.of(
		"very", 1.3,
		"really", 1.3,
		"extremely", 1.5,
		"so", 1.2,
		"too", 1.2,
		"quite", 1.1,
		"incredibly", 1.5,
		"slightly", 0.5,
		"somewhat", 0.7,
		"barely", 0.4);

	private final Map<String, LexiconEntry> lexicon;

	public LexiconSentimentAdapter() {
		this(new ClassPathResource(DEFAULT_LEXICON));
	}

	public LexiconSentimentAdapter(Resource lexiconResource) {
		this.lexicon = loadLexicon(lexiconResource);
		log.info("감성 사전 로드 완료: {} words", lexicon.size());
	}

	LexiconSentimentAdapter(Map<String, LexiconEntry> lexicon) {
		this.lexicon = Map.copyOf(lexicon);
	}

	@Override
	public SentimentScore analyze(String text) {
		if (text == null || text.isBlank()) {
			return SentimentScore.neutral();
		}
		try {
			return score(text);
		} catch (RuntimeException e) {
			log.error("감성 분석 실패, 중립으로 처리합니다: {}", e.getMessage());
			return SentimentScore.neutral();
		}
	}

	private SentimentScore score(String text) {
		List<Double> polarities = new ArrayList<>();
		List<Double> subjectivities = new ArrayList<>();

		boolean negated = false;
		double intensity = 1.0;

		Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
		while (matcher.find()) {
			String word = matcher.group();
			if (NEGATIONS.contains(word) || word.endsWith("n't")) {
				negated = true;
				continue;
			}
			Double intensifier = INTENSIFIERS.get(word);
			if (intensifier != null) {
				intensity *= intensifier;
				continue;
			}

			LexiconEntry entry = lexicon.get(word);
			if (entry == null) {
				continue;
			}

			double polarity = entry.polarity() * intensity;
			if (negated) {
				polarity *= NEGATION_FACTOR;
			}
			polarities.add(clamp(polarity, -1.0, 1.0));
			subjectivities.add(clamp(entry.subjectivity() * intensity, 0.0, 1.0));
			negated = false;
			intensity = 1.0;
		}

		if (polarities.isEmpty()) {
			return SentimentScore.neutral();
		}

		double polarity = round(average(polarities));
		double subjectivity = round(average(subjectivities));
		log.debug("감성 분석: {}... -> {}", abbreviate(text), polarity);
		return SentimentScore.of(polarity, subjectivity);
	}

	private static Map<String, LexiconEntry> loadLexicon(Resource resource) {
		Map<String, LexiconEntry> entries = new HashMap<>();
		try (InputStream input = resource.getInputStream();
			BufferedReader reader = new BufferedReader(
				new InputStreamReader(input, StandardCharsets.UTF_8))) {
			String line;
			while ((line = reader.readLine()) != null) {
				if (line.isBlank() || line.startsWith("#")) {
					continue;
				}
				String[] columns = line.split("\t");
				if (columns.length != 3) {
					throw new IllegalStateException("감성 사전 형식이 올바르지 않습니다: " + line);
				}
				entries.put(columns[0].trim().toLowerCase(Locale.ROOT),
					new LexiconEntry(Double.parseDouble(columns[1].trim()),
						Double.parseDouble(columns[2].trim())));
			}
		} catch (IOException e) {
			throw new IllegalStateException("감성 사전을 읽을 수 없습니다: " + resource, e);
		}
		return Map.copyOf(entries);
	}

	private static double average(List<Double> values) {
		return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
	}

	private static double clamp(double value, double min, double max) {
		return Math.max(min, Math.min(max, value));
	}

	private static double round(double value) {
		return Math.round(value * 1000.0) / 1000.0;
	}

	private static String abbreviate(String text) {
		return text.length() <= 30 ? text : text.substring(0, 30);
	}

	record LexiconEntry(
		double polarity,
		double subjectivity) {
	}
}
