package com.example.techsewa.match;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Order-independent, case-insensitive similarity on a 0-100 scale.
 *
 * <p>Both inputs are split into word tokens.  With {@code t0} the sorted intersection,
 * {@code t1 = t0 + rest(a)} and {@code t2 = t0 + rest(b)}, the score is the best of the
 * pairwise ratios of {@code (t0,t1)}, {@code (t0,t2)} and {@code (t1,t2)}, where a ratio is
 * {@code 2 * LCS / (|x| + |y|)}.  An alias whose words all appear in the query scores 100.</p>
 */
public final class TokenSetSimilarity {

    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{M}\\p{N}_]+");

    private TokenSetSimilarity() {}

    /** Lowercased word tokens in order of appearance. */
    public static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        Matcher m = WORD.matcher(text.toLowerCase(Locale.ROOT).strip());
        while (m.find()) {
            out.add(m.group());
        }
        return out;
    }

    public static int score(String a, String b) {
        Set<String> ta = new TreeSet<>(tokenize(a));
        Set<String> tb = new TreeSet<>(tokenize(b));
        if (ta.isEmpty() || tb.isEmpty()) {
            return 0;
        }
        Set<String> common = new TreeSet<>(ta);
        common.retainAll(tb);
        Set<String> onlyA = new TreeSet<>(ta);
        onlyA.removeAll(common);
        Set<String> onlyB = new TreeSet<>(tb);
        onlyB.removeAll(common);

        String t0 = String.join(" ", common);
        String t1 = join(t0, onlyA);
        String t2 = join(t0, onlyB);

        int best = ratio(t1, t2);
        if (!t0.isEmpty()) {
            best = Math.max(best, Math.max(ratio(t0, t1), ratio(t0, t2)));
        }
        return best;
    }

    private static String join(String head, Set<String> tail) {
        String rest = String.join(" ", tail);
        if (head.isEmpty()) {
            return rest;
        }
        return rest.isEmpty() ? head : head + " " + rest;
    }

    /** Indel similarity rounded to 0-100. */
    static int ratio(String x, String y) {
        int total = x.length() + y.length();
        if (total == 0) {
            return 100;
        }
        return (int) Math.round(100.0 * 2 * lcs(x, y) / total);
    }

    private static int lcs(String x, String y) {
        int[] prev = new int[y.length() + 1];
        int[] cur = new int[y.length() + 1];
        for (int i = 1; i <= x.length(); i++) {
            char cx = x.charAt(i - 1);
            for (int j = 1; j <= y.length(); j++) {
                cur[j] = (cx == y.charAt(j - 1))
                        ? prev[j - 1] + 1
                        : Math.max(prev[j], cur[j - 1]);
            }
            int[] t = prev;
            prev = cur;
            cur = t;
        }
        return prev[y.length()];
    }
}
