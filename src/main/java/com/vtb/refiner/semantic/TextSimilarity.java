package com.vtb.refiner.semantic;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Строковые метрики сходства. Все метрики симметричны, детерминированы и лежат в [0, 1].
 */
public final class TextSimilarity {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

    private TextSimilarity() {
    }

    /**
     * Нижний регистр, схлопнутые пробелы, обрезка краёв
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text.trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
    }

    public static Set<String> tokens(String text) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return new LinkedHashSet<>();
        }
        return Arrays.stream(NON_WORD.split(normalized))
            .filter(token -> !token.isEmpty())
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Коэффициент Дайса по множествам слов: 2|A∩B| / (|A| + |B|)
     */
    public static double tokenDice(String left, String right) {
        Set<String> a = tokens(left);
        Set<String> b = tokens(right);
        if (a.isEmpty() && b.isEmpty()) {
            return 0.0;
        }
        long common = a.stream().filter(b::contains).count();
        return (2.0 * common) / (a.size() + b.size());
    }

    /**
     * 1 - levenshtein / max(len) по нормализованным строкам
     */
    public static double levenshteinSimilarity(String left, String right) {
        String a = normalize(left);
        String b = normalize(right);
        int maxLength = Math.max(a.length(), b.length());
        if (maxLength == 0) {
            return 0.0;
        }
        return 1.0 - (double) levenshtein(a, b) / maxLength;
    }

    /**
     * Итоговая метрика стандартизатора: максимум из Дайса и Левенштейна,
     * точное совпадение после нормализации даёт 1.0.
     */
    public static double componentSimilarity(String left, String right) {
        String a = normalize(left);
        String b = normalize(right);
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        if (a.equals(b)) {
            return 1.0;
        }
        return Math.max(tokenDice(a, b), levenshteinSimilarity(a, b));
    }

    static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
