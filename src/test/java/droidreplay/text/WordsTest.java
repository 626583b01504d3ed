package droidreplay.text;

import org.testng.annotations.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class WordsTest {

    // ── Words ─────────────────────────────────────────────────────────────

    @Test(description = "Words split at separators and camel-case boundaries")
    public void splitAsWords_separatorsAndCamelCase() {
        assertThat(Words.splitAsWords("btnSubmit_order")).containsExactly("btn", "Submit", "order");
        assertThat(Words.splitAsWords("  Open   navigation drawer ")).containsExactly("Open", "navigation", "drawer");
        assertThat(Words.splitAsWords("")).isEmpty();
    }

    @Test(description = "Word inclusion ignores case and order; an empty needle is never included")
    public void wordsInclude_caseInsensitive() {
        assertThat(Words.wordsInclude("Save the draft now", "draft SAVE")).isTrue();
        assertThat(Words.wordsInclude("Save", "Save draft")).isFalse();
        assertThat(Words.wordsInclude("anything", "")).isFalse();
    }

    @Test(description = "containsAll matches substrings ignoring case")
    public void containsAll_substrings() {
        assertThat(Words.containsAll("Close navigation drawer", "close", "DRAWER")).isTrue();
        assertThat(Words.containsAll("Open navigation drawer", "close", "drawer")).isFalse();
    }

    @Test(description = "n-grams join consecutive words")
    public void ngrams_joinRuns() {
        assertThat(Words.ngrams(List.of("a", "b", "c"), 2, " ")).containsExactly("a b", "b c");
        assertThat(Words.ngrams(List.of("a", "b"), 1, " ")).containsExactly("a", "b");
    }

    // ── Models ────────────────────────────────────────────────────────────

    @Test(description = "Bag-of-words vectors hold term frequencies over a shared sorted vocabulary")
    public void bow_termFrequencies() {
        BowModel model = new BowModel(List.of("save draft", "Save save"), false, 1);
        assertThat(model.vocabulary()).containsExactly("draft", "save");
        assertThat(model.vector(1).get("save")).isEqualTo(1.0);
        assertThat(model.vector(0).get("draft")).isEqualTo(0.5);
        assertThat(model.vector(1).get("draft")).isEqualTo(0.0);
    }

    @Test(description = "Closest picks the most similar vector, -1 when there are no candidates")
    public void closest_picksMostSimilar() {
        BowModel model = new BowModel(List.of("save btn", "cancel btn", "save btn save", "save btn"));
        List<WordVector> vectors = model.vectors();
        assertThat(Vectors.closest(vectors.get(0), vectors.subList(1, 4))).isEqualTo(2);
        assertThat(Vectors.closest(vectors.get(0), List.of())).isEqualTo(-1);
    }

    @Test(description = "Cosine of identical vectors is one and of an empty vector NaN")
    public void cosine_edgeCases() {
        assertThat(Vectors.cosine(new double[] {1, 2}, new double[] {2, 4})).isCloseTo(1.0, within(1e-9));
        assertThat(Vectors.cosine(new double[] {0, 0}, new double[] {1, 0})).isNaN();
    }

    @Test(description = "TF-IDF weighs rare terms above common ones")
    public void tfIdf_rareTermsWeighMore() {
        TfIdfModel model = new TfIdfModel(List.of("inbox mail", "mail settings", "mail drafts", "mail sent"));
        assertThat(model.vector(0).get("inbox")).isGreaterThan(model.vector(0).get("mail"));
    }
}
