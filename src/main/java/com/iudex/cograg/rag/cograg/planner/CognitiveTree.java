package com.iudex.cograg.rag.cograg.planner;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Mind-map of sub-questions stored as a flat arena: node id to node, each node holding its
 * parent id and child ids.
 *
 * <p>Nodes are added only while planning. {@link #freeze()} ends planning; after that the tree is
 * read-only and safe to read from concurrent leaf branches.</p>
 */
public final class CognitiveTree {
    private final Map<String, MindMapNode> nodes = new ConcurrentHashMap<>();
    private final Set<String> normalizedQuestions = ConcurrentHashMap.newKeySet();
    private final AtomicInteger sequence = new AtomicInteger();
    private final String rootId;
    private volatile boolean frozen;

    public CognitiveTree(String rootQuestion) {
        MindMapNode root = new MindMapNode(this.nextId(), null, rootQuestion, 0, NodeState.CONTINUE);
        this.register(root);
        this.rootId = root.getId();
    }

    private CognitiveTree(TreeSnapshot snapshot) {
        for (TreeSnapshot.NodeSnapshot node : snapshot.nodes()) {
            MindMapNode restored = new MindMapNode(node.id(), node.parentId(), node.question(), node.level(), node.state());
            node.childIds().forEach(restored::addChildId);
            this.register(restored);
        }
        this.rootId = snapshot.rootId();
        this.sequence.set(snapshot.nodes().size());
        this.frozen = true;
    }

    public static CognitiveTree fromSnapshot(TreeSnapshot snapshot) {
        if (snapshot == null || snapshot.nodes().isEmpty()) {
            throw new IllegalArgumentException("Snapshot has no nodes");
        }
        CognitiveTree tree = new CognitiveTree(snapshot);
        if (tree.node(tree.rootId) == null) {
            throw new IllegalArgumentException("Snapshot root " + snapshot.rootId() + " is missing");
        }
        return tree;
    }

    /**
     * Adds a child under {@code parentId}. Returns {@code null} when an equivalent question
     * already exists anywhere in the tree.
     */
    public synchronized MindMapNode addChild(String parentId, String question, NodeState state) {
        this.ensureMutable();
        MindMapNode parent = this.nodes.get(parentId);
        if (parent == null) {
            throw new IllegalArgumentException("Unknown parent node " + parentId);
        }
        if (question == null || question.isBlank() || this.normalizedQuestions.contains(normalize(question))) {
            return null;
        }
        MindMapNode child = new MindMapNode(this.nextId(), parentId, question.trim(), parent.getLevel() + 1, state);
        this.register(child);
        parent.addChildId(child.getId());
        if (parent.getState() == NodeState.END) {
            parent.setState(NodeState.CONTINUE);
        }
        return child;
    }

    public synchronized void markEnd(String nodeId) {
        this.ensureMutable();
        MindMapNode node = this.nodes.get(nodeId);
        if (node != null) {
            node.setState(NodeState.END);
        }
    }

    /**
     * Forces every childless {@code CONTINUE} node to {@code END} and closes the tree for writes.
     *
     * @return number of nodes that were forced to {@code END}
     */
    public synchronized int freeze() {
        if (this.frozen) {
            return 0;
        }
        int forced = 0;
        for (MindMapNode node : this.nodes.values()) {
            if (node.getState() == NodeState.CONTINUE && node.getChildIds().isEmpty()) {
                node.setState(NodeState.END);
                forced++;
            }
        }
        this.frozen = true;
        return forced;
    }

    public boolean isFrozen() {
        return this.frozen;
    }

    public MindMapNode root() {
        return this.nodes.get(this.rootId);
    }

    public String getRootId() {
        return this.rootId;
    }

    public MindMapNode node(String nodeId) {
        return this.nodes.get(nodeId);
    }

    public List<MindMapNode> children(String nodeId) {
        MindMapNode node = this.nodes.get(nodeId);
        if (node == null) {
            return List.of();
        }
        List<MindMapNode> children = new ArrayList<>();
        for (String childId : node.getChildIds()) {
            children.add(this.nodes.get(childId));
        }
        return children;
    }

    /**
     * All nodes in breadth-first order.
     */
    public List<MindMapNode> nodes() {
        List<MindMapNode> ordered = new ArrayList<>(this.nodes.size());
        List<String> frontier = List.of(this.rootId);
        while (!frontier.isEmpty()) {
            List<String> next = new ArrayList<>();
            for (String id : frontier) {
                MindMapNode node = this.nodes.get(id);
                if (node != null) {
                    ordered.add(node);
                    next.addAll(node.getChildIds());
                }
            }
            frontier = next;
        }
        return ordered;
    }

    public List<MindMapNode> leaves() {
        return this.nodes().stream().filter(MindMapNode::isLeaf).toList();
    }

    public Set<String> questions() {
        Set<String> questions = new LinkedHashSet<>();
        for (MindMapNode node : this.nodes()) {
            questions.add(node.getQuestion());
        }
        return questions;
    }

    public int size() {
        return this.nodes.size();
    }

    public int depth() {
        return this.nodes.values().stream().mapToInt(MindMapNode::getLevel).max().orElse(0) + 1;
    }

    public TreeSnapshot snapshot() {
        List<TreeSnapshot.NodeSnapshot> copies = new ArrayList<>();
        for (MindMapNode node : this.nodes()) {
            copies.add(new TreeSnapshot.NodeSnapshot(node.getId(), node.getParentId(), node.getQuestion(),
                    node.getLevel(), node.getState(), node.getChildIds()));
        }
        return new TreeSnapshot(this.rootId, copies);
    }

    /**
     * Nested map rendering of the mind-map for audit output.
     */
    public Map<String, Object> toMap() {
        return this.toMap(this.root());
    }

    private Map<String, Object> toMap(MindMapNode node) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", node.getId());
        map.put("question", node.getQuestion());
        map.put("level", node.getLevel());
        map.put("state", node.getState().name());
        List<Map<String, Object>> children = new ArrayList<>();
        for (MindMapNode child : this.children(node.getId())) {
            children.add(this.toMap(child));
        }
        map.put("children", children);
        return map;
    }

    private void register(MindMapNode node) {
        this.nodes.put(node.getId(), node);
        this.normalizedQuestions.add(normalize(node.getQuestion()));
    }

    private void ensureMutable() {
        if (this.frozen) {
            throw new IllegalStateException("Cognitive tree is frozen after planning");
        }
    }

    private String nextId() {
        return "n" + this.sequence.getAndIncrement();
    }

    static String normalize(String question) {
        if (question == null) {
            return "";
        }
        return question.toLowerCase(Locale.ROOT).replaceAll("[\\p{Punct}\\s]+", " ").trim();
    }
}
