package com.iudex.cograg.rag.cograg.refiner;

public enum ConflictType {
    INTRA_NODE("intra_node"),
    CROSS_NODE("cross_node");

    private final String label;

    ConflictType(String label) {
        this.label = label;
    }

    public String label() {
        return this.label;
    }
}
