package com.galois.multifunction.dot;

/**
 * A node in a {@link DirectedGraph}.
 */
public final class Node {
    private final int index;
    public final Attributes attributes;

    Node(int index, String label) {
        this.index = index;
        this.attributes = new Attributes();
        attributes.set("label", label);
    }

    /** Identifier of the node in dot source. */
    public String id() {
        return "n" + index;
    }

    public String label() {
        return attributes.get("label");
    }

    public void setShape(Shape shape) {
        attributes.set("shape", shape.dotName());
    }
}
