package com.iudex.cograg.capability;

import java.util.List;
import java.util.Map;

public interface GraphStore {

    List<IndexHit> query(GraphOperation operation, Map<String, Object> params, String scope);
}
