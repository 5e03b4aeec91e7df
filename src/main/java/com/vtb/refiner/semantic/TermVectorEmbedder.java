package com.vtb.refiner.semantic;

import com.vtb.refiner.models.Threat;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Детерминированный эмбеддинг без ML: слова текста (компонент, категория STRIDE, описание)
 * без стоп-слов, с упрощённым стеммингом и сублинейной частотой.
 */
public class TermVectorEmbedder implements ThreatEmbedder {

    private static final Pattern WORD_SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}]+");

    static final Set<String> STOP_WORDS = Set.of(
        "a", "an", "the", "and", "or", "of", "to", "in", "on", "at", "by", "for", "with", "from",
        "into", "via", "through", "over", "while", "when", "which", "that", "this", "these", "those",
        "it", "its", "is", "are", "was", "were", "be", "been", "being", "as",
        "can", "could", "may", "might", "will", "would", "should", "shall", "must",
        "potentially", "possibly", "also", "so", "such", "any", "some");

    @Override
    public SparseVector embed(Threat threat) {
        StringBuilder text = new StringBuilder();
        if (threat.getEffectiveComponent() != null) {
            text.append(threat.getEffectiveComponent()).append(' ');
        }
        if (threat.getStrideCategory() != null) {
            text.append(threat.getStrideCategory().getDisplayName()).append(' ');
        }
        if (threat.getDescription() != null) {
            text.append(threat.getDescription());
        }
        return embedText(text.toString());
    }

    SparseVector embedText(String text) {
        Map<String, Double> weights = new HashMap<>();
        for (String word : WORD_SEPARATOR.split(TextSimilarity.normalize(text))) {
            if (word.length() < 2 || STOP_WORDS.contains(word)) {
                continue;
            }
            weights.merge(stem(word), 1.0, Double::sum);
        }
        weights.replaceAll((term, tf) -> 1.0 + Math.log(tf));
        return SparseVector.normalized(weights);
    }

    static String stem(String word) {
        if (word.length() > 5 && word.endsWith("ing")) {
            return word.substring(0, word.length() - 3);
        }
        if (word.length() > 4 && word.endsWith("ed")) {
            return word.substring(0, word.length() - 2);
        }
        if (word.length() > 4 && word.endsWith("ies")) {
            return word.substring(0, word.length() - 3) + "y";
        }
        if (word.length() > 3 && word.endsWith("s") && !word.endsWith("ss")) {
            return word.substring(0, word.length() - 1);
        }
        return word;
    }
}
