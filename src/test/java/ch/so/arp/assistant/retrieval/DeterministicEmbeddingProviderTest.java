package ch.so.arp.assistant.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class DeterministicEmbeddingProviderTest {

    private final DeterministicEmbeddingProvider provider = new DeterministicEmbeddingProvider(128);

    @Test
    void producesUnitVectorsOfConfiguredSize() {
        float[] vector = provider.embed("The sky is blue.");

        assertThat(vector).hasSize(128);
        assertThat(dot(vector, vector)).isCloseTo(1.0d, within(1e-4));
    }

    @Test
    void sameTextYieldsSameVector() {
        assertThat(provider.embed("Grass is green")).containsExactly(provider.embed("grass IS green"));
    }

    @Test
    void sharedWordsIncreaseSimilarity() {
        float[] query = provider.embed("What color is the sky?");

        double related = dot(query, provider.embed("The sky is blue."));
        double unrelated = dot(query, provider.embed("Pumpkins grow slowly."));

        assertThat(related).isGreaterThan(unrelated);
    }

    @Test
    void keepsNonAsciiLettersInsideTokens() {
        float[] query = provider.embed("Grünfläche");

        assertThat(dot(query, provider.embed("Die Grünfläche am Fluss"))).isGreaterThan(
                dot(query, provider.embed("gr nfl che")));
        assertThat(provider.embed("天空是蓝色的")).hasSize(128);
    }

    @Test
    void rejectsTextWithoutWords() {
        assertThatThrownBy(() -> provider.embed("   ")).isInstanceOf(EmbeddingException.class);
        assertThatThrownBy(() -> provider.embed("?!")).isInstanceOf(EmbeddingException.class);
    }

    @Test
    void rejectsNonPositiveDimensions() {
        assertThatThrownBy(() -> new DeterministicEmbeddingProvider(0)).isInstanceOf(IllegalArgumentException.class);
    }

    private static double dot(float[] a, float[] b) {
        double sum = 0.0d;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }
}
