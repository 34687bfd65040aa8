package com.galois.multifunction.procedure;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.galois.multifunction.DataType;
import com.galois.multifunction.MultiFunction;
import com.galois.multifunction.ParamType.InterfaceType;
import com.galois.multifunction.proto.Protos;

/**
 * A control flow graph of instructions that call multi-functions, together
 * with the variables they operate on.
 *
 * The procedure owns all of its variables and instructions; they live as
 * long as the procedure and cannot be removed individually.  Instructions
 * are linked through their setters, which keep predecessor and user lists
 * consistent after every call.  A procedure should only be executed after
 * {@link #validate()} returned true.
 */
public final class Procedure {
    /** List of all variables allocated in procedure. */
    private final List<Variable> variables;

    private final List<CallInstruction> callInstructions;
    private final List<BranchInstruction> branchInstructions;
    private final List<DestructInstruction> destructInstructions;
    private final List<DummyInstruction> dummyInstructions;
    private final List<ReturnInstruction> returnInstructions;

    /** Number of instructions allocated so far. */
    private int instructionCount;

    /** Parameters passed by the caller of this procedure. */
    private final List<Parameter> params;

    /** Entry instruction, or <code>null</code> if not set yet. */
    private Instruction entry;

    private final ProcedureValidator validator;

    public Procedure() {
        this.variables = new ArrayList<Variable>();
        this.callInstructions = new ArrayList<CallInstruction>();
        this.branchInstructions = new ArrayList<BranchInstruction>();
        this.destructInstructions = new ArrayList<DestructInstruction>();
        this.dummyInstructions = new ArrayList<DummyInstruction>();
        this.returnInstructions = new ArrayList<ReturnInstruction>();
        this.params = new ArrayList<Parameter>();
        this.validator = new ProcedureValidator(this);
    }

    /**
     * Allocate a new variable.
     * @param type the type of the variable.
     * @param name debug name of the variable, may be empty.
     * @return the variable
     */
    public Variable newVariable(DataType type, String name) {
        if (type == null) throw new NullPointerException("type");
        if (name == null) throw new NullPointerException("name");
        Variable v = new Variable(this, variables.size(), type, name);
        variables.add(v);
        return v;
    }

    /**
     * Allocate a new unnamed variable.
     * @param type the type of the variable.
     * @return the variable
     */
    public Variable newVariable(DataType type) {
        return newVariable(type, "");
    }

    /**
     * Create a call instruction with all parameters unset.
     * @param fn the function to call.
     * @return the instruction
     */
    public CallInstruction newCallInstruction(MultiFunction fn) {
        if (fn == null) throw new NullPointerException("fn");
        CallInstruction i = new CallInstruction(this, instructionCount++, fn);
        callInstructions.add(i);
        return i;
    }

    public BranchInstruction newBranchInstruction() {
        BranchInstruction i = new BranchInstruction(this, instructionCount++);
        branchInstructions.add(i);
        return i;
    }

    public DestructInstruction newDestructInstruction() {
        DestructInstruction i = new DestructInstruction(this, instructionCount++);
        destructInstructions.add(i);
        return i;
    }

    public DummyInstruction newDummyInstruction() {
        DummyInstruction i = new DummyInstruction(this, instructionCount++);
        dummyInstructions.add(i);
        return i;
    }

    public ReturnInstruction newReturnInstruction() {
        ReturnInstruction i = new ReturnInstruction(this, instructionCount++);
        returnInstructions.add(i);
        return i;
    }

    /**
     * Append a parameter to the calling convention of this procedure.
     * @param type how the caller passes the variable.
     * @param variable the variable bound to the parameter.
     */
    public void addParameter(InterfaceType type, Variable variable) {
        if (type == null) throw new NullPointerException("type");
        if (variable == null) throw new NullPointerException("variable");
        if (variable.getProcedure() != this) {
            throw new IllegalArgumentException("Variable belongs to a different procedure.");
        }
        params.add(new Parameter(type, variable));
    }

    /**
     * Set the instruction executed first.
     */
    public void setEntry(Instruction entry) {
        if (entry == null) throw new NullPointerException("entry");
        if (entry.getProcedure() != this) {
            throw new IllegalArgumentException("Instruction belongs to a different procedure.");
        }
        this.entry = entry;
    }

    /**
     * Get entry instruction.
     * @return the entry, or <code>null</code> if none was set.
     */
    public Instruction entry() {
        return entry;
    }

    public List<Parameter> params() {
        return Collections.unmodifiableList(params);
    }

    public List<Variable> variables() {
        return Collections.unmodifiableList(variables);
    }

    public List<CallInstruction> callInstructions() {
        return Collections.unmodifiableList(callInstructions);
    }

    public List<BranchInstruction> branchInstructions() {
        return Collections.unmodifiableList(branchInstructions);
    }

    public List<DestructInstruction> destructInstructions() {
        return Collections.unmodifiableList(destructInstructions);
    }

    public List<DummyInstruction> dummyInstructions() {
        return Collections.unmodifiableList(dummyInstructions);
    }

    public List<ReturnInstruction> returnInstructions() {
        return Collections.unmodifiableList(returnInstructions);
    }

    /**
     * All instructions: calls, then branches, destructs, dummies and
     * returns, each group in creation order.
     */
    public List<Instruction> allInstructions() {
        List<Instruction> r = new ArrayList<Instruction>(instructionCount);
        r.addAll(callInstructions);
        r.addAll(branchInstructions);
        r.addAll(destructInstructions);
        r.addAll(dummyInstructions);
        r.addAll(returnInstructions);
        return r;
    }

    /**
     * Validator used by the <code>validate</code> methods of this
     * procedure.  Its status stream can be set to get reasons for failures.
     */
    public ProcedureValidator validator() {
        return validator;
    }

    /**
     * Check that the procedure is well-formed and can be executed.
     * @return true if all checks pass
     */
    public boolean validate() {
        return validator.validate();
    }

    /**
     * Like {@link #validate()}, but throws on the first failing check.
     * @throws ProcedureValidationException naming the failed check
     */
    public void assertValid() {
        validator.assertValid();
    }

    public boolean validateAllInstructionPointersSet() {
        return validator.validateAllInstructionPointersSet();
    }

    public boolean validateAllParamsProvided() {
        return validator.validateAllParamsProvided();
    }

    public boolean validateSameVariablesInOneCall() {
        return validator.validateSameVariablesInOneCall();
    }

    public boolean validateParameters() {
        return validator.validateParameters();
    }

    public boolean validateInitialization() {
        return validator.validateInitialization();
    }

    /**
     * Find whether a variable can be initialized or uninitialized right
     * before an instruction runs.
     */
    public InitState findInitializationStateBeforeInstruction(Instruction instruction,
                                                             Variable variable) {
        return validator.findInitializationStateBeforeInstruction(instruction, variable);
    }

    /**
     * Render the procedure in the dot graph language, with one node per
     * basic block.
     * @return the dot source
     */
    public String toDot() {
        return new ProcedureDotExporter(this).toDot();
    }

    /**
     * Get the Protocol buffer representation.
     * @return the representation object.
     * @throws IllegalStateException if the procedure does not validate
     */
    public Protos.Procedure getProcedureRep() {
        if (!validate()) {
            throw new IllegalStateException("Only valid procedures can be serialized.");
        }
        Protos.Procedure.Builder b
            = Protos.Procedure.newBuilder()
            .setEntry(entry.index());
        for (Variable v : variables) {
            b.addVariable(v.getVariableRep());
        }
        for (Instruction i : allInstructions()) {
            b.addInstruction(i.getInstructionRep());
        }
        for (Parameter p : params) {
            b.addParameter(p.getParameterRep());
        }
        return b.build();
    }
}
