package com.galois.multifunction.procedure;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.galois.multifunction.MultiFunction;
import com.galois.multifunction.dot.DirectedEdge;
import com.galois.multifunction.dot.DirectedGraph;
import com.galois.multifunction.dot.Node;
import com.galois.multifunction.dot.Shape;

/**
 * Renders a procedure as a dot graph with one rectangular node per basic
 * block.  Missing successors are drawn as diamond nodes so that incomplete
 * procedures can be inspected too.
 */
public final class ProcedureDotExporter {
    /** Edge color for the true target of a branch. */
    public static final String BRANCH_TRUE_COLOR = "#118811";
    /** Edge color for the false target of a branch. */
    public static final String BRANCH_FALSE_COLOR = "#881111";

    private final Procedure procedure;
    private DirectedGraph digraph;
    private final Map<Instruction,Node> nodesByBegin;
    private final Map<Instruction,Node> nodesByEnd;

    public ProcedureDotExporter(Procedure procedure) {
        if (procedure == null) throw new NullPointerException("procedure");
        this.procedure = procedure;
        this.nodesByBegin = new HashMap<Instruction,Node>();
        this.nodesByEnd = new LinkedHashMap<Instruction,Node>();
    }

    /**
     * Build the graph.
     * @return the dot source
     */
    public String toDot() {
        return toGraph().toDotString();
    }

    /**
     * Build the graph without serializing it.  Every call builds a new
     * graph from the current state of the procedure.
     */
    public DirectedGraph toGraph() {
        digraph = new DirectedGraph();
        nodesByBegin.clear();
        nodesByEnd.clear();
        for (List<Instruction> block : BasicBlocks.partition(procedure)) {
            StringBuilder label = new StringBuilder();
            for (Instruction current : block) {
                label.append(current.accept(LABEL)).append("\\l");
            }
            Node node = digraph.newNode(label.toString());
            node.setShape(Shape.RECTANGLE);
            nodesByBegin.put(block.get(0), node);
            nodesByEnd.put(block.get(block.size() - 1), node);
        }

        for (Map.Entry<Instruction,Node> e : nodesByEnd.entrySet()) {
            final Node from = e.getValue();
            e.getKey().accept(new InstructionVisitor<Void>() {
                    public Void visitCall(CallInstruction instruction) {
                        createEdge(from, instruction.next());
                        return null;
                    }

                    public Void visitDestruct(DestructInstruction instruction) {
                        createEdge(from, instruction.next());
                        return null;
                    }

                    public Void visitDummy(DummyInstruction instruction) {
                        createEdge(from, instruction.next());
                        return null;
                    }

                    public Void visitBranch(BranchInstruction instruction) {
                        createEdge(from, instruction.branchTrue())
                            .attributes.set("color", BRANCH_TRUE_COLOR);
                        createEdge(from, instruction.branchFalse())
                            .attributes.set("color", BRANCH_FALSE_COLOR);
                        return null;
                    }

                    public Void visitReturn(ReturnInstruction instruction) {
                        return null;
                    }
                });
        }

        Node entryNode = digraph.newNode("Entry");
        entryNode.setShape(Shape.CIRCLE);
        createEdge(entryNode, procedure.entry());
        return digraph;
    }

    private DirectedEdge createEdge(Node from, Instruction to) {
        if (to == null) {
            Node missing = digraph.newNode("missing");
            missing.setShape(Shape.DIAMOND);
            return digraph.newEdge(from, missing);
        }
        return digraph.newEdge(from, nodesByBegin.get(to));
    }

    private static void appendVariable(StringBuilder b, Variable variable) {
        if (variable == null) {
            b.append("<none>");
        } else {
            appendText(b, variable.toString());
        }
    }

    // Labels keep backslashes raw for the \l line ends, so user text has
    // its own backslashes doubled.
    private static void appendText(StringBuilder b, String text) {
        b.append(text.replace("\\", "\\\\"));
    }

    /** One line of a block label per instruction. */
    private static final InstructionVisitor<String> LABEL = new InstructionVisitor<String>() {
            public String visitCall(CallInstruction instruction) {
                MultiFunction fn = instruction.fn();
                StringBuilder b = new StringBuilder();
                appendText(b, fn.name());
                b.append(" - ");
                for (int paramIndex : fn.paramIndices()) {
                    if (paramIndex > 0) {
                        b.append(", ");
                    }
                    b.append(fn.paramType(paramIndex).interfaceType().shortName()).append(' ');
                    appendVariable(b, instruction.param(paramIndex));
                }
                return b.toString();
            }

            public String visitBranch(BranchInstruction instruction) {
                StringBuilder b = new StringBuilder("Branch on ");
                appendVariable(b, instruction.condition());
                return b.toString();
            }

            public String visitDestruct(DestructInstruction instruction) {
                StringBuilder b = new StringBuilder("Destruct ");
                appendVariable(b, instruction.variable());
                return b.toString();
            }

            public String visitDummy(DummyInstruction instruction) {
                return "Dummy";
            }

            public String visitReturn(ReturnInstruction instruction) {
                return "Return";
            }
        };
}
