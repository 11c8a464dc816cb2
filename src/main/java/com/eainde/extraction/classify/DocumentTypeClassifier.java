package com.eainde.extraction.classify;

import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Scores text against weighted indicator phrases for each portal.
 *
 * <p>Each indicator found (case-insensitive substring) adds its weight once.
 * The label with the strictly higher score wins if that score reaches
 * {@value #MIN_SCORE}; ties and low scores fall back to
 * {@link DocumentType#GENERIC}.</p>
 */
@Slf4j
public class DocumentTypeClassifier {

    static final int MIN_SCORE = 2;

    private static final Map<String, Integer> GEM_INDICATORS = new LinkedHashMap<>();
    private static final Map<String, Integer> CPPP_INDICATORS = new LinkedHashMap<>();

    static {
        GEM_INDICATORS.put("gem.gov.in", 3);
        GEM_INDICATORS.put("government e-marketplace", 3);
        GEM_INDICATORS.put("gem portal", 2);
        GEM_INDICATORS.put("gem/20", 2);
        GEM_INDICATORS.put("bid to ra", 1);
        GEM_INDICATORS.put("epbg", 1);
        GEM_INDICATORS.put("buyer added", 1);
        GEM_INDICATORS.put("document required from seller", 1);

        CPPP_INDICATORS.put("eprocure.gov.in", 3);
        CPPP_INDICATORS.put("central public procurement portal", 3);
        CPPP_INDICATORS.put("cppp", 2);
        CPPP_INDICATORS.put("notice inviting tender", 1);
        CPPP_INDICATORS.put("online submission", 1);
        CPPP_INDICATORS.put("offline submission", 1);
        CPPP_INDICATORS.put("cover 1", 1);
        CPPP_INDICATORS.put("tender fee", 1);
    }

    public ClassificationScore classify(String text) {
        String haystack = text == null ? "" : text.toLowerCase(Locale.ROOT);

        Map<DocumentType, Integer> scores = new EnumMap<>(DocumentType.class);
        scores.put(DocumentType.GEM, score(haystack, GEM_INDICATORS));
        scores.put(DocumentType.CPPP, score(haystack, CPPP_INDICATORS));

        int gem = scores.get(DocumentType.GEM);
        int cppp = scores.get(DocumentType.CPPP);
        DocumentType selected;
        if (gem > cppp && gem >= MIN_SCORE) {
            selected = DocumentType.GEM;
        } else if (cppp > gem && cppp >= MIN_SCORE) {
            selected = DocumentType.CPPP;
        } else {
            selected = DocumentType.GENERIC;
        }

        log.info("Classified document as {} (scores: GeM={}, CPPP={})", selected.label(), gem, cppp);
        return new ClassificationScore(selected, scores);
    }

    private static int score(String haystack, Map<String, Integer> indicators) {
        int total = 0;
        for (Map.Entry<String, Integer> indicator : indicators.entrySet()) {
            if (haystack.contains(indicator.getKey())) {
                total += indicator.getValue();
            }
        }
        return total;
    }
}
