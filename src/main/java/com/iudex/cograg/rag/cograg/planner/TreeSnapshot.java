package com.iudex.cograg.rag.cograg.planner;

import java.util.List;

/**
 * Immutable, storable copy of a planned {@link CognitiveTree}.
 */
public record TreeSnapshot(String rootId, List<NodeSnapshot> nodes) {

    public TreeSnapshot {
        nodes = List.copyOf(nodes);
    }

    public record NodeSnapshot(String id, String parentId, String question, int level, NodeState state, List<String> childIds) {

        public NodeSnapshot {
            childIds = List.copyOf(childIds);
        }
    }
}
