package com.bank.categorization.integration;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class HashingEmbeddingProviderTest {

    private final HashingEmbeddingProvider provider = new HashingEmbeddingProvider(384);

    private static double dot(float[] a, float[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) sum += a[i] * b[i];
        return sum;
    }

    @Test
    void embed_isUnitLengthWithConfiguredDimensions() {
        float[] vector = provider.embed("Office supplies from ACME");

        assertThat(vector).hasSize(384);
        assertThat(dot(vector, vector)).isCloseTo(1.0, within(1e-5));
    }

    @Test
    void embed_isDeterministicAndCaseInsensitive() {
        assertThat(provider.embed("Fuel for Vehicles")).containsExactly(provider.embed("fuel for vehicles"));
    }

    @Test
    void sharedVocabulary_isCloserThanUnrelatedText() {
        float[] query = provider.embed("printer toner");
        float[] related = provider.embed("toner for the office printer");
        float[] unrelated = provider.embed("monthly warehouse rent");

        assertThat(dot(query, related)).isGreaterThan(dot(query, unrelated));
    }

    @Test
    void blankText_isRejected() {
        assertThatThrownBy(() -> provider.embed(" ")).isInstanceOf(EmbeddingException.class);
        assertThatThrownBy(() -> provider.embed("!!!")).isInstanceOf(EmbeddingException.class);
    }

    @Test
    void nonPositiveDimensions_isRejected() {
        assertThatThrownBy(() -> new HashingEmbeddingProvider(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
