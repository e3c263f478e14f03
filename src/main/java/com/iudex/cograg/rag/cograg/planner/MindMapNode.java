package com.iudex.cograg.rag.cograg.planner;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * One question in the mind-map. Holds ids only; the owning {@link CognitiveTree} resolves them.
 */
public final class MindMapNode {
    private final String id;
    private final String parentId;
    private final String question;
    private final int level;
    private final List<String> childIds = new CopyOnWriteArrayList<>();
    private volatile NodeState state;

    MindMapNode(String id, String parentId, String question, int level, NodeState state) {
        this.id = id;
        this.parentId = parentId;
        this.question = question;
        this.level = level;
        this.state = state;
    }

    public String getId() {
        return this.id;
    }

    public String getParentId() {
        return this.parentId;
    }

    public String getQuestion() {
        return this.question;
    }

    public int getLevel() {
        return this.level;
    }

    public NodeState getState() {
        return this.state;
    }

    public List<String> getChildIds() {
        return List.copyOf(this.childIds);
    }

    public boolean isLeaf() {
        return this.state == NodeState.END;
    }

    public boolean isRoot() {
        return this.parentId == null;
    }

    void setState(NodeState state) {
        this.state = state;
    }

    void addChildId(String childId) {
        this.childIds.add(childId);
    }

    @Override
    public String toString() {
        return "MindMapNode[" + this.id + ", level=" + this.level + ", " + this.state + ", children=" + this.childIds.size() + "]";
    }
}
