package ch.so.arp.assistant.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;

class InMemoryVectorIndexTest {

    private final InMemoryVectorIndex index = new InMemoryVectorIndex();

    @Test
    void searchOnEmptyIndexReturnsNothing() {
        assertThat(index.search(new float[] { 1f, 0f }, 3)).isEmpty();
    }

    @Test
    void ranksByDotProductDescending() {
        index.addAll(List.of(
                chunk("a", "far", 0f, 1f),
                chunk("b", "close", 1f, 0f),
                chunk("c", "middle", 0.6f, 0.8f)));

        List<InMemoryVectorIndex.ScoredChunk> hits = index.search(new float[] { 1f, 0f }, 3);

        assertThat(hits).extracting(hit -> hit.chunk().text()).containsExactly("close", "middle", "far");
        assertThat(hits.get(0).score()).isEqualTo(1.0d);
    }

    @Test
    void tiesKeepInsertionOrderAcrossRepeatedSearches() {
        index.addAll(List.of(chunk("a", "first", 1f, 0f), chunk("b", "second", 1f, 0f)));
        index.addAll(List.of(chunk("c", "third", 1f, 0f)));

        for (int i = 0; i < 5; i++) {
            assertThat(index.search(new float[] { 1f, 0f }, 2)).extracting(hit -> hit.chunk().text())
                    .containsExactly("first", "second");
        }
    }

    @Test
    void limitsResultsAndAllowsZero() {
        index.addAll(List.of(chunk("a", "one", 1f, 0f), chunk("a", "two", 0f, 1f)));

        assertThat(index.search(new float[] { 1f, 0f }, 1)).hasSize(1);
        assertThat(index.search(new float[] { 1f, 0f }, 0)).isEmpty();
        assertThat(index.search(new float[] { 1f, 0f }, 10)).hasSize(2);
        assertThatThrownBy(() -> index.search(new float[] { 1f, 0f }, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsBatchWithMismatchingDimensionsWithoutStoringAnything() {
        index.addAll(List.of(chunk("a", "one", 1f, 0f)));

        assertThatThrownBy(() -> index.addAll(List.of(chunk("b", "ok", 0f, 1f), chunk("b", "bad", 1f, 0f, 0f))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("dimensions");
        assertThat(index.size()).isEqualTo(1);
    }

    @Test
    void rejectsChunksWithoutEmbedding() {
        assertThatThrownBy(() -> index.addAll(List.of(new DocumentChunk("a", "text", null))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(index.size()).isZero();
    }

    @Test
    void removesAllChunksOfASource() {
        index.addAll(List.of(chunk("a", "one", 1f, 0f), chunk("b", "two", 1f, 0f), chunk("a", "three", 0f, 1f)));

        assertThat(index.removeBySource("a")).isEqualTo(2);
        assertThat(index.removeBySource("missing")).isZero();
        assertThat(index.sourceIds()).containsExactly("b");
    }

    @Test
    void emptiedIndexAcceptsNewDimensions() {
        index.addAll(List.of(chunk("a", "one", 1f, 0f)));
        index.removeBySource("a");

        index.addAll(List.of(chunk("b", "two", 1f, 0f, 0f)));

        assertThat(index.dimensions()).isEqualTo(3);
    }

    @Test
    void storedEmbeddingsCannotBeChangedFromOutside() {
        float[] vector = { 1f, 0f };
        DocumentChunk chunk = new DocumentChunk("a", "one", vector);
        index.addAll(List.of(chunk));

        vector[0] = -1f;
        chunk.embedding()[0] = -1f;

        assertThat(index.search(new float[] { 1f, 0f }, 1).get(0).score()).isEqualTo(1.0d);
    }

    private static DocumentChunk chunk(String sourceId, String text, float... embedding) {
        return new DocumentChunk(sourceId, text, embedding);
    }
}
