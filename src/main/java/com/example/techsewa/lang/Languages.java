package com.example.techsewa.lang;

import java.util.List;
import java.util.Locale;

/**
 * Language codes understood by the engine.  {@code en} is the fallback answer language.
 */
public final class Languages {

    public static final String EN = "en";
    public static final String NP = "np";
    public static final String AUTO = "auto";

    /** Languages every taught record is registered under. */
    public static final List<String> SUPPORTED = List.of(EN, NP);

    private Languages() {}

    /**
     * Normalise a caller supplied code: blank means {@code en}, {@code ne} is accepted for Nepali.
     */
    public static String normalize(String lang) {
        if (lang == null || lang.isBlank()) {
            return EN;
        }
        String l = lang.trim().toLowerCase(Locale.ROOT);
        return "ne".equals(l) ? NP : l;
    }

    /** Value for the Accept-Language header of outbound searches. */
    public static String acceptLanguage(String lang) {
        return NP.equals(lang) ? "ne" : "en";
    }
}
