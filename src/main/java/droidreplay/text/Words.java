package droidreplay.text;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Word-level string helpers shared by the selector, the segment matcher and
 * the fuzzy-text patterns.
 */
public final class Words {

    private static final Pattern SEPARATORS = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final Pattern CAMEL_CASE = Pattern.compile("(?<=\\p{Ll})(?=\\p{Lu})");

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "about", "above", "after", "again", "against", "all", "am", "an", "and",
            "any", "are", "as", "at", "be", "because", "been", "before", "being", "below",
            "between", "both", "but", "by", "can", "did", "do", "does", "doing", "down",
            "during", "each", "few", "for", "from", "further", "had", "has", "have", "having",
            "he", "her", "here", "hers", "herself", "him", "himself", "his", "how", "i",
            "if", "in", "into", "is", "it", "its", "itself", "just", "me", "more",
            "most", "my", "myself", "no", "nor", "not", "now", "of", "off", "on",
            "once", "only", "or", "other", "our", "ours", "ourselves", "out", "over", "own",
            "same", "she", "should", "so", "some", "such", "than", "that", "the", "their",
            "theirs", "them", "themselves", "then", "there", "these", "they", "this", "those", "through",
            "to", "too", "under", "until", "up", "very", "was", "we", "were", "what",
            "when", "where", "which", "while", "who", "whom", "why", "will", "with", "you",
            "your", "yours", "yourself", "yourselves");

    private Words() {}

    /**
     * Splits {@code text} into words at every non-alphanumeric character and
     * at camel-case boundaries. {@code "btnSubmit_order"} gives
     * {@code [btn, Submit, order]}. Case is preserved.
     */
    public static List<String> splitAsWords(String text) {
        if (text == null || text.isBlank()) {
            return Collections.emptyList();
        }
        List<String> words = new ArrayList<>();
        for (String chunk : SEPARATORS.split(text)) {
            if (chunk.isEmpty()) continue;
            for (String word : CAMEL_CASE.split(chunk)) {
                if (!word.isEmpty()) words.add(word);
            }
        }
        return words;
    }

    /** Whether {@code word} (any case) is an English stop word. */
    public static boolean isStopWord(String word) {
        return STOP_WORDS.contains(word.toLowerCase(Locale.ROOT));
    }

    public static List<String> filterStopWords(List<String> words) {
        List<String> kept = new ArrayList<>(words.size());
        for (String w : words) {
            if (!isStopWord(w)) kept.add(w);
        }
        return kept;
    }

    /**
     * Joins each run of {@code n} consecutive words with {@code separator}.
     * For {@code n <= 1} the words are returned unchanged.
     */
    public static List<String> ngrams(List<String> words, int n, String separator) {
        if (n <= 1) {
            return new ArrayList<>(words);
        }
        List<String> grams = new ArrayList<>();
        for (int i = 0; i + n <= words.size(); i++) {
            grams.add(String.join(separator, words.subList(i, i + n)));
        }
        return grams;
    }

    /**
     * Whether every word of {@code needle} appears among the words of
     * {@code haystack}, ignoring case. An empty needle is never included.
     */
    public static boolean wordsInclude(String haystack, String needle) {
        List<String> wanted = lower(splitAsWords(needle));
        if (wanted.isEmpty()) {
            return false;
        }
        return lower(splitAsWords(haystack)).containsAll(wanted);
    }

    /** Whether {@code text} contains every one of {@code words}, ignoring case. */
    public static boolean containsAll(String text, String... words) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (String w : words) {
            if (!lower.contains(w.toLowerCase(Locale.ROOT))) return false;
        }
        return true;
    }

    static List<String> lower(List<String> words) {
        List<String> out = new ArrayList<>(words.size());
        for (String w : words) {
            out.add(w.toLowerCase(Locale.ROOT));
        }
        return out;
    }
}
