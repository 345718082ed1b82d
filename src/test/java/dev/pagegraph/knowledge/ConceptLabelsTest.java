package dev.pagegraph.knowledge;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConceptLabelsTest {

    @Test
    @DisplayName("labels differing only in case, spacing or edge punctuation normalize alike")
    void normalizes() {
        assertThat(ConceptLabels.normalize("  Neural   Networks. ")).isEqualTo("neural networks");
        assertThat(ConceptLabels.normalize("\"neural networks\"")).isEqualTo("neural networks");
        assertThat(ConceptLabels.normalize("C++")).isEqualTo("c");
        assertThat(ConceptLabels.normalize("Node.js")).isEqualTo("node.js");
    }

    @Test
    void blankAndNullNormalizeToEmpty() {
        assertThat(ConceptLabels.normalize(null)).isEmpty();
        assertThat(ConceptLabels.normalize(" -- ")).isEmpty();
    }

    @Test
    void capsLength() {
        assertThat(ConceptLabels.normalize("a".repeat(400))).hasSize(ConceptLabels.MAX_LENGTH);
    }

    @Test
    @DisplayName("display form keeps case")
    void displayKeepsCase() {
        assertThat(ConceptLabels.display("  Neural   Networks, ")).isEqualTo("Neural Networks");
    }

    @Test
    @DisplayName("distinct keeps the first spelling of each concept and drops blanks")
    void distinct() {
        List<String> labels = Arrays.asList("Neural Networks", "neural networks", " ", "Backpropagation", "NEURAL NETWORKS!");

        assertThat(ConceptLabels.distinct(labels)).containsExactly("Neural Networks", "Backpropagation");
    }
}
