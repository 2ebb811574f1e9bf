package com.example.techsewa.knowledge;

import com.example.techsewa.lang.Languages;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One knowledge-base entry: trigger phrases per language and the answer text per language.
 * Instances are immutable; a learned record is a new instance appended to the store.
 */
@Value
@Builder(toBuilder = true)
public class ProblemRecord {

    String id;

    /** language code -> ordered trigger phrases */
    @Singular("alias")
    Map<String, List<String>> aliases;

    /** language code -> answer text */
    @Singular
    Map<String, String> answers;

    boolean autoFix;

    boolean learned;

    public List<String> aliasesFor(String lang) {
        return aliases.getOrDefault(lang, List.of());
    }

    public Set<String> aliasLanguages() {
        return aliases.keySet();
    }

    /**
     * Answer in the requested language, falling back to English when absent or blank.
     */
    public String answerFor(String lang) {
        String a = answers.get(lang);
        if (a == null || a.isBlank()) {
            return answers.get(Languages.EN);
        }
        return a;
    }

    public boolean hasAnyAlias() {
        return aliases.values().stream()
                .flatMap(List::stream)
                .anyMatch(a -> a != null && !a.isBlank());
    }

    /** First non-blank alias in language order, or an empty string. */
    public String firstAlias() {
        return aliases.values().stream()
                .flatMap(List::stream)
                .filter(a -> a != null && !a.isBlank())
                .findFirst()
                .orElse("");
    }
}
