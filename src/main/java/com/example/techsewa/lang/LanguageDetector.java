package com.example.techsewa.lang;

import java.util.List;
import java.util.Locale;

/**
 * Guesses whether free text is Nepali or English from its share of Devanagari
 * characters and a few common Nepali words.
 */
public class LanguageDetector {

    private static final double STRONG_RATIO = 0.3;
    private static final double MIXED_RATIO = 0.1;
    private static final int MIXED_MIN_WORDS = 4;

    static final List<String> NEPALI_KEYPHRASES = List.of(
            "इन्टरनेट", "चल्दैन", "कम्प्युटर", "फोन", "समस्या", "छ",
            "भएको", "मर्मत", "कृपया", "सहयोग", "गर्नुहोस्", "हुन्छ");

    public String detect(String text) {
        if (text == null || text.isBlank()) {
            return Languages.EN;
        }
        long devanagari = text.codePoints().filter(LanguageDetector::isDevanagari).count();
        double ratio = (double) devanagari / text.length();
        if (ratio > STRONG_RATIO) {
            return Languages.NP;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String kw : NEPALI_KEYPHRASES) {
            if (lower.contains(kw)) {
                return Languages.NP;
            }
        }
        if (ratio > MIXED_RATIO && text.trim().split("\\s+").length >= MIXED_MIN_WORDS) {
            return Languages.NP;
        }
        return Languages.EN;
    }

    /**
     * Resolve {@code auto} (or a blank code) through {@link #detect}; pass anything else through
     * {@link Languages#normalize}.
     */
    public String resolve(String lang, String text) {
        if (lang == null || lang.isBlank() || Languages.AUTO.equalsIgnoreCase(lang.trim())) {
            return detect(text);
        }
        return Languages.normalize(lang);
    }

    private static boolean isDevanagari(int cp) {
        return cp >= 0x0900 && cp <= 0x097F;
    }
}
