package com.galois.multifunction.dot;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A directed graph that can be written as dot source.
 */
public final class DirectedGraph {
    private final List<Node> nodes = new ArrayList<Node>();
    private final List<DirectedEdge> edges = new ArrayList<DirectedEdge>();

    /**
     * Create a new node.
     * @param label text shown in the node.
     * @return the node
     */
    public Node newNode(String label) {
        if (label == null) throw new NullPointerException("label");
        Node n = new Node(nodes.size(), label);
        nodes.add(n);
        return n;
    }

    /**
     * Create a new edge between two nodes of this graph.
     * @return the edge
     */
    public DirectedEdge newEdge(Node from, Node to) {
        if (from == null) throw new NullPointerException("from");
        if (to == null) throw new NullPointerException("to");
        DirectedEdge e = new DirectedEdge(from, to);
        edges.add(e);
        return e;
    }

    public List<Node> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public List<DirectedEdge> edges() {
        return Collections.unmodifiableList(edges);
    }

    /**
     * Write the graph as dot source.  Nodes and edges appear in creation
     * order.
     */
    public String toDotString() {
        StringBuilder b = new StringBuilder();
        b.append("digraph {\n");
        for (Node n : nodes) {
            b.append("  ").append(n.id()).append(' ');
            n.attributes.appendTo(b);
            b.append(";\n");
        }
        for (DirectedEdge e : edges) {
            b.append("  ").append(e.from().id()).append(" -> ").append(e.to().id());
            if (!e.attributes.isEmpty()) {
                b.append(' ');
                e.attributes.appendTo(b);
            }
            b.append(";\n");
        }
        b.append("}\n");
        return b.toString();
    }
}
