package com.bank.categorization.integration;

public interface EmbeddingProvider {

    /**
     * @throws EmbeddingException when no vector can be produced for the text
     */
    float[] embed(String text);
}
