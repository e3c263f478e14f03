package com.iudex.cograg.capability;

import java.util.List;
import java.util.Map;

/**
 * Dense-vector similarity search backend.
 */
public interface VectorIndex {

    List<IndexHit> search(float[] embedding, Map<String, Object> filters, int topK);
}
