package ai.bundlewatch.backend.service.checker;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Keyword matching over free-text notes.
 */
public final class NoteKeywords {

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "a", "an", "is", "are", "was", "were", "be", "been",
            "being", "have", "has", "had", "do", "does", "did", "will",
            "would", "could", "should", "may", "might", "must", "shall",
            "can", "need", "dare", "ought", "used", "to", "of", "in",
            "for", "on", "with", "at", "by", "from", "as", "into",
            "through", "during", "before", "after", "above", "below",
            "between", "under", "again", "further", "then", "once",
            "here", "there", "when", "where", "why", "how", "all",
            "each", "few", "more", "most", "other", "some", "such",
            "no", "nor", "not", "only", "own", "same", "so", "than",
            "too", "very", "just", "and", "but", "if", "or", "because",
            "until", "while", "documented", "documentation");

    private static final List<String> CLINICAL_PHRASES = List.of(
            "blood culture", "id consult", "infectious disease", "follow up", "risk assessment");

    private static final int MAX_KEYWORDS = 10;

    private NoteKeywords() {
    }

    /**
     * Derives search keywords from an element description: words longer than three
     * characters that are not stop words, then known clinical phrases, capped at ten.
     */
    public static List<String> extract(String description) {
        List<String> keywords = new ArrayList<>();
        if (description == null) {
            return keywords;
        }
        String lower = description.toLowerCase(Locale.ROOT);
        for (String word : lower.split("\\W+")) {
            if (word.length() > 3 && !STOP_WORDS.contains(word)) {
                keywords.add(word);
            }
        }
        for (String phrase : CLINICAL_PHRASES) {
            if (lower.contains(phrase)) {
                keywords.add(phrase);
            }
        }
        return keywords.size() > MAX_KEYWORDS ? new ArrayList<>(keywords.subList(0, MAX_KEYWORDS)) : keywords;
    }

    public static boolean mentionsAny(String text, List<String> keywords) {
        if (text == null) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return keywords.stream().anyMatch(lower::contains);
    }
}
