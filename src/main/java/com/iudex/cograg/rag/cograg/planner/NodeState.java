package com.iudex.cograg.rag.cograg.planner;

public enum NodeState {
    /** Has, or is waiting for, children. */
    CONTINUE,
    /** Leaf answered directly from retrieved evidence. */
    END
}
