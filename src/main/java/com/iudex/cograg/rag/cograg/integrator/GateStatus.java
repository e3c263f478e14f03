package com.iudex.cograg.rag.cograg.integrator;

public enum GateStatus {
    PROCEED,
    ABSTAIN
}
