package com.iudex.cograg.capability;

public interface EmbeddingService {

    /**
     * @throws com.iudex.cograg.exception.EmbeddingException when no vector can be produced
     */
    float[] embed(String text);
}
