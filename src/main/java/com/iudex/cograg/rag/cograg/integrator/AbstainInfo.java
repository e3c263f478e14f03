package com.iudex.cograg.rag.cograg.integrator;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record AbstainInfo(String reason, List<String> issues, int partialAnswerCount) {

    public AbstainInfo {
        issues = List.copyOf(issues);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("reason", this.reason);
        map.put("issues", this.issues);
        map.put("partialAnswerCount", this.partialAnswerCount);
        return map;
    }
}
