package com.galois.multifunction.procedure;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.galois.multifunction.DataType;
import com.galois.multifunction.MultiFunction;
import com.galois.multifunction.ParamType;
import com.galois.multifunction.ParamType.InterfaceType;

/**
 * Appends instructions to a procedure in execution order.
 *
 * The builder keeps a set of cursors: successor links that are still open.
 * Every added instruction is linked to all open cursors, which then move
 * to the new instruction.  A fresh builder has a single cursor that sets the
 * entry of the procedure.
 */
public final class ProcedureBuilder {
    private final Procedure procedure;
    private final List<Cursor> cursors;

    /**
     * Create a builder that starts at the entry of <code>procedure</code>.
     */
    public ProcedureBuilder(Procedure procedure) {
        this(procedure, Collections.singletonList(new Cursor(null, Cursor.Kind.ENTRY)));
    }

    private ProcedureBuilder(Procedure procedure, List<Cursor> cursors) {
        if (procedure == null) throw new NullPointerException("procedure");
        this.procedure = procedure;
        this.cursors = new ArrayList<Cursor>(cursors);
    }

    public Procedure getProcedure() {
        return procedure;
    }

    /**
     * Returns true when there are no open cursors, for example after a
     * return has been added.
     */
    public boolean isTerminated() {
        return cursors.isEmpty();
    }

    /**
     * Continue after all of the given builders: their open cursors replace
     * the cursors of this builder.  Used to join the two sides of a branch.
     * The given builders are terminated afterwards.
     */
    public void setCursorAfter(ProcedureBuilder... builders) {
        for (ProcedureBuilder b : builders) {
            if (b.procedure != procedure) {
                throw new IllegalArgumentException("Builder belongs to a different procedure.");
            }
        }
        List<Cursor> joined = new ArrayList<Cursor>();
        for (ProcedureBuilder b : builders) {
            joined.addAll(b.cursors);
            b.cursors.clear();
        }
        cursors.clear();
        cursors.addAll(joined);
    }

    /**
     * Continue after both sides of a branch.
     */
    public void setCursorAfter(Branch branch) {
        setCursorAfter(branch.ifTrue(), branch.ifFalse());
    }

    /**
     * Link all open cursors to an existing instruction, for example to
     * jump back to the start of a loop.  Leaves the builder terminated.
     */
    public void linkTo(Instruction instruction) {
        if (instruction == null) throw new NullPointerException("instruction");
        checkCursors();
        for (Cursor c : cursors) {
            c.link(procedure, instruction);
        }
        cursors.clear();
    }

    /**
     * Add a call with all parameters unset.
     */
    public CallInstruction addCall(MultiFunction fn) {
        checkCursors();
        CallInstruction i = procedure.newCallInstruction(fn);
        insertAtCursors(i);
        cursors.add(new Cursor(i, Cursor.Kind.NEXT));
        return i;
    }

    /**
     * Add a call that passes the given variables to the function.
     * @param variables one variable per function parameter
     */
    public CallInstruction addCallWithAllVariables(MultiFunction fn, Variable... variables) {
        if (variables.length != fn.paramAmount()) {
            throw new IllegalArgumentException("Incorrect number of variables.");
        }
        CallInstruction i = addCall(fn);
        i.setParams(variables);
        return i;
    }

    /**
     * Add a call, passing the given variables to the input and mutable
     * parameters and creating a fresh variable for every output parameter.
     * @param inputs one variable per input or mutable parameter, in order
     * @return the new output variables, in parameter order
     */
    public List<Variable> addCallWithNewOutputs(MultiFunction fn, Variable... inputs) {
        Variable[] variables = new Variable[fn.paramAmount()];
        List<Variable> outputs = new ArrayList<Variable>();
        int inputIndex = 0;
        for (int paramIndex : fn.paramIndices()) {
            ParamType type = fn.paramType(paramIndex);
            if (type.interfaceType() == InterfaceType.OUTPUT) {
                continue;
            }
            if (inputIndex == inputs.length) {
                throw new IllegalArgumentException("Too few input variables.");
            }
            variables[paramIndex] = inputs[inputIndex++];
        }
        if (inputIndex != inputs.length) {
            throw new IllegalArgumentException("Too many input variables.");
        }
        checkCursors();
        for (int paramIndex : fn.paramIndices()) {
            ParamType type = fn.paramType(paramIndex);
            if (type.interfaceType() == InterfaceType.OUTPUT) {
                Variable v = procedure.newVariable(type.type());
                variables[paramIndex] = v;
                outputs.add(v);
            }
        }
        addCallWithAllVariables(fn, variables);
        return outputs;
    }

    public DestructInstruction addDestruct(Variable variable) {
        checkCursors();
        DestructInstruction i = procedure.newDestructInstruction();
        insertAtCursors(i);
        i.setVariable(variable);
        cursors.add(new Cursor(i, Cursor.Kind.NEXT));
        return i;
    }

    /**
     * Add one destruct instruction per variable, in order.
     */
    public void addDestruct(Iterable<Variable> variables) {
        for (Variable v : variables) {
            addDestruct(v);
        }
    }

    public DummyInstruction addDummy() {
        checkCursors();
        DummyInstruction i = procedure.newDummyInstruction();
        insertAtCursors(i);
        cursors.add(new Cursor(i, Cursor.Kind.NEXT));
        return i;
    }

    /**
     * Add a return.  The builder is terminated afterwards.
     */
    public ReturnInstruction addReturn() {
        checkCursors();
        ReturnInstruction i = procedure.newReturnInstruction();
        insertAtCursors(i);
        return i;
    }

    /**
     * Add a branch on <code>condition</code>.  This builder is terminated
     * afterwards; building continues with the builders of the returned
     * branch.
     */
    public Branch addBranch(Variable condition) {
        checkCursors();
        BranchInstruction i = procedure.newBranchInstruction();
        insertAtCursors(i);
        i.setCondition(condition);
        return new Branch(i,
            new ProcedureBuilder(procedure,
                Collections.singletonList(new Cursor(i, Cursor.Kind.BRANCH_TRUE))),
            new ProcedureBuilder(procedure,
                Collections.singletonList(new Cursor(i, Cursor.Kind.BRANCH_FALSE))));
    }

    public void addParameter(InterfaceType type, Variable variable) {
        procedure.addParameter(type, variable);
    }

    /**
     * Create a variable and add it as a procedure parameter.
     * @return the new variable
     */
    public Variable addParameter(InterfaceType type, DataType dataType, String name) {
        Variable v = procedure.newVariable(dataType, name);
        procedure.addParameter(type, v);
        return v;
    }

    public Variable addInputParameter(DataType dataType, String name) {
        return addParameter(InterfaceType.INPUT, dataType, name);
    }

    public Variable addOutputParameter(DataType dataType, String name) {
        return addParameter(InterfaceType.OUTPUT, dataType, name);
    }

    // Link every open cursor to the new instruction and close them.
    private void insertAtCursors(Instruction instruction) {
        checkCursors();
        for (Cursor c : cursors) {
            c.link(procedure, instruction);
        }
        cursors.clear();
    }

    private void checkCursors() {
        if (cursors.isEmpty()) {
            throw new IllegalStateException("Builder has no open cursor to add instructions at.");
        }
    }

    /**
     * The two sides of a branch added by {@link #addBranch(Variable)}.
     */
    public static final class Branch {
        private final BranchInstruction instruction;
        private final ProcedureBuilder ifTrue;
        private final ProcedureBuilder ifFalse;

        Branch(BranchInstruction instruction, ProcedureBuilder ifTrue, ProcedureBuilder ifFalse) {
            this.instruction = instruction;
            this.ifTrue = ifTrue;
            this.ifFalse = ifFalse;
        }

        public BranchInstruction instruction() {
            return instruction;
        }

        /** Builder for the instructions run when the condition is true. */
        public ProcedureBuilder ifTrue() {
            return ifTrue;
        }

        /** Builder for the instructions run when the condition is false. */
        public ProcedureBuilder ifFalse() {
            return ifFalse;
        }
    }

    /**
     * An open successor link.
     */
    private static final class Cursor {
        enum Kind { ENTRY, NEXT, BRANCH_TRUE, BRANCH_FALSE }

        private final Instruction instruction;
        private final Kind kind;

        Cursor(Instruction instruction, Kind kind) {
            this.instruction = instruction;
            this.kind = kind;
        }

        void link(Procedure procedure, Instruction target) {
            switch (kind) {
            case ENTRY:
                procedure.setEntry(target);
                break;
            case NEXT:
                setNext(instruction, target);
                break;
            case BRANCH_TRUE:
                ((BranchInstruction) instruction).setBranchTrue(target);
                break;
            case BRANCH_FALSE:
                ((BranchInstruction) instruction).setBranchFalse(target);
                break;
            default:
                throw new AssertionError(kind);
            }
        }

        private static void setNext(Instruction instruction, final Instruction target) {
            instruction.accept(new InstructionVisitor<Void>() {
                    public Void visitCall(CallInstruction i) {
                        i.setNext(target);
                        return null;
                    }

                    public Void visitDestruct(DestructInstruction i) {
                        i.setNext(target);
                        return null;
                    }

                    public Void visitDummy(DummyInstruction i) {
                        i.setNext(target);
                        return null;
                    }

                    public Void visitBranch(BranchInstruction i) {
                        throw new IllegalStateException("Branches have no next instruction.");
                    }

                    public Void visitReturn(ReturnInstruction i) {
                        throw new IllegalStateException("Returns have no next instruction.");
                    }
                });
        }
    }
}
