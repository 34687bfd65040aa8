package com.galois.multifunction.dot;

/**
 * An edge in a {@link DirectedGraph}.
 */
public final class DirectedEdge {
    private final Node from;
    private final Node to;
    public final Attributes attributes;

    DirectedEdge(Node from, Node to) {
        this.from = from;
        this.to = to;
        this.attributes = new Attributes();
    }

    public Node from() {
        return from;
    }

    public Node to() {
        return to;
    }
}
