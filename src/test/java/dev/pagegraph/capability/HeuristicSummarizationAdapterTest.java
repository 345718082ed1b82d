package dev.pagegraph.capability;

import dev.pagegraph.exception.SummarizeException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HeuristicSummarizationAdapterTest {

    private static final String ARTICLE = """
            Neural Networks are a family of models.   Neural Networks learn representations.
            Researchers train Neural Networks with gradient descent. A fourth sentence is never part of the summary.""";

    private final HeuristicSummarizationAdapter adapter = new HeuristicSummarizationAdapter();

    @Test
    @DisplayName("summary is the leading sentences with whitespace collapsed")
    void leadSentences() {
        SummaryResult result = adapter.summarize(ARTICLE);

        assertThat(result.summary()).isEqualTo("Neural Networks are a family of models. Neural Networks learn "
                + "representations. Researchers train Neural Networks with gradient descent.");
    }

    @Test
    @DisplayName("recurring capitalized phrases rank first, one-off words are dropped")
    void conceptsRanked() {
        List<String> concepts = HeuristicSummarizationAdapter.concepts(ARTICLE);

        assertThat(concepts).first().isEqualTo("Neural Networks");
        assertThat(concepts).doesNotContain("family", "gradient", "descent");
    }

    @Test
    @DisplayName("stopwords never become concepts")
    void stopwordsIgnored() {
        List<String> concepts = HeuristicSummarizationAdapter.concepts(
                "This that with from. This that with from. Kafka streams and Kafka topics.");

        assertThat(concepts).contains("kafka").doesNotContain("this", "that", "with", "from");
    }

    @Test
    void rejectsBlankText() {
        assertThatThrownBy(() -> adapter.summarize("  \n ")).isInstanceOf(SummarizeException.class);
    }
}
