package com.iudex.cograg.capability;

import java.util.List;
import java.util.Map;

/**
 * Keyword (sparse) search backend.
 */
public interface LexicalIndex {

    List<IndexHit> search(String query, Map<String, Object> filters, int topK);
}
