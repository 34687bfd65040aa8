package com.galois.multifunction.procedure;

import java.util.ArrayList;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import com.galois.multifunction.DataType;
import com.galois.multifunction.dot.DirectedEdge;
import com.galois.multifunction.dot.DirectedGraph;
import com.galois.multifunction.dot.Node;

public class TestProcedureDotExporter {
    private static List<Node> nodesWithShape(DirectedGraph g, String shape) {
        List<Node> r = new ArrayList<Node>();
        for (Node n : g.nodes()) {
            if (shape.equals(n.attributes.get("shape"))) {
                r.add(n);
            }
        }
        return r;
    }

    private static int countLines(String label) {
        return label.split("\\\\l", -1).length - 1;
    }

    @Test
    public void straightLineLabel() {
        Procedure p = SampleProcedures.outputThenDestruct();
        DirectedGraph g = new ProcedureDotExporter(p).toGraph();

        List<Node> blocks = nodesWithShape(g, "rectangle");
        Assert.assertEquals(1, blocks.size());
        Assert.assertEquals("constant - out $0(v)\\lDestruct $0(v)\\lReturn\\l",
                            blocks.get(0).label());

        // Only the entry edge, since the block ends with a return.
        Assert.assertEquals(1, g.edges().size());
        DirectedEdge entryEdge = g.edges().get(0);
        Assert.assertEquals("Entry", entryEdge.from().label());
        Assert.assertEquals("circle", entryEdge.from().attributes.get("shape"));
        Assert.assertSame(blocks.get(0), entryEdge.to());
    }

    @Test
    public void branchEdgesAreColored() {
        Procedure p = SampleProcedures.loop();
        DirectedGraph g = new ProcedureDotExporter(p).toGraph();

        int trueEdges = 0;
        int falseEdges = 0;
        for (DirectedEdge e : g.edges()) {
            String color = e.attributes.get("color");
            if (ProcedureDotExporter.BRANCH_TRUE_COLOR.equals(color)) {
                ++trueEdges;
                Assert.assertTrue(e.to().label().startsWith("Destruct $1(c)\\lincrement"));
            } else if (ProcedureDotExporter.BRANCH_FALSE_COLOR.equals(color)) {
                ++falseEdges;
                Assert.assertTrue(e.to().label().startsWith("Destruct $1(c)\\lReturn"));
            }
        }
        Assert.assertEquals(1, trueEdges);
        Assert.assertEquals(1, falseEdges);
    }

    @Test
    public void everyInstructionRenderedOnce() {
        Procedure p = SampleProcedures.loop();
        DirectedGraph g = new ProcedureDotExporter(p).toGraph();

        int lines = 0;
        for (Node n : nodesWithShape(g, "rectangle")) {
            lines += countLines(n.label());
        }
        Assert.assertEquals(p.allInstructions().size(), lines);

        // head block -> 2 branch edges, true block -> back edge, false
        // block -> none, plus the entry edge.
        Assert.assertEquals(4, g.edges().size());
        Assert.assertTrue(nodesWithShape(g, "diamond").isEmpty());
    }

    @Test
    public void missingSuccessorIsDiamond() {
        Procedure p = new Procedure();
        Variable v = p.newVariable(DataType.FLOAT);
        CallInstruction call = p.newCallInstruction(SampleFunctions.ADD);
        call.setParamVariable(0, v);
        p.setEntry(call);

        DirectedGraph g = new ProcedureDotExporter(p).toGraph();
        List<Node> missing = nodesWithShape(g, "diamond");
        Assert.assertEquals(1, missing.size());
        Assert.assertEquals("missing", missing.get(0).label());

        String dot = p.toDot();
        Assert.assertTrue(dot, dot.contains("add - in $0, in <none>, out <none>\\l"));
    }

    @Test
    public void missingEntryIsDiamond() {
        Procedure p = new Procedure();
        p.newReturnInstruction();
        DirectedGraph g = new ProcedureDotExporter(p).toGraph();
        Assert.assertEquals(1, nodesWithShape(g, "diamond").size());
    }

    @Test
    public void branchAndDummyLabels() {
        Procedure p = SampleProcedures.initializedOnOnePath();
        String dot = p.toDot();
        Assert.assertTrue(dot, dot.startsWith("digraph {\n"));
        Assert.assertTrue(dot, dot.contains("Branch on $0(cond)\\l"));
        Assert.assertTrue(dot, dot.contains("Dummy\\lDestruct $1(v)\\lDestruct $0(cond)\\lReturn\\l"));
        Assert.assertTrue(dot, dot.contains("color=\"#118811\""));
        Assert.assertTrue(dot, dot.contains("color=\"#881111\""));
    }

    @Test
    public void mutableParameterLabel() {
        Procedure p = SampleProcedures.loop();
        Assert.assertTrue(p.toDot().contains("increment - mut $0(value)\\l"));
    }

    @Test
    public void exportIsRepeatable() {
        Procedure p = SampleProcedures.loop();
        ProcedureDotExporter exporter = new ProcedureDotExporter(p);
        Assert.assertEquals(exporter.toDot(), exporter.toDot());
        Assert.assertEquals(p.toDot(), p.toDot());
    }

    @Test
    public void backslashesInNamesAreEscaped() {
        Procedure p = SampleProcedures.outputThenDestruct();
        p.variables().get(0).setName("a\\\"b");

        DirectedGraph g = new ProcedureDotExporter(p).toGraph();
        List<Node> blocks = nodesWithShape(g, "rectangle");
        Assert.assertEquals("constant - out $0(a\\\\\"b)\\lDestruct $0(a\\\\\"b)\\lReturn\\l",
                            blocks.get(0).label());

        String dot = p.toDot();
        Assert.assertTrue(dot, dot.contains("[label=\"constant - out $0(a\\\\\\\"b)\\lDestruct"));
    }

    @Test
    public void exporterSeesLaterChanges() {
        Procedure p = new Procedure();
        ReturnInstruction ret = p.newReturnInstruction();
        p.setEntry(ret);
        ProcedureDotExporter exporter = new ProcedureDotExporter(p);
        Assert.assertEquals(1, nodesWithShape(exporter.toGraph(), "rectangle").size());

        DummyInstruction dummy = p.newDummyInstruction();
        dummy.setNext(ret);
        p.setEntry(dummy);

        List<Node> blocks = nodesWithShape(exporter.toGraph(), "rectangle");
        Assert.assertEquals(1, blocks.size());
        Assert.assertEquals("Dummy\\lReturn\\l", blocks.get(0).label());
        Assert.assertEquals(exporter.toDot(), p.toDot());
    }
}
