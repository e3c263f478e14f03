package com.iudex.cograg.model;

/**
 * One hit as returned by a retrieval adapter, before fusion.
 *
 * @param source   backend that produced the hit
 * @param id       opaque document or chunk identifier
 * @param text     raw chunk text
 * @param score    backend-native score; scales differ between backends
 * @param metadata structured metadata
 */
public record RetrievalCandidate(BackendType source, String id, String text, double score, SourceMetadata metadata) {

    public RetrievalCandidate {
        text = text == null ? "" : text;
        metadata = metadata == null ? SourceMetadata.EMPTY : metadata;
    }
}
