package com.galois.multifunction.procedure;
import java.io.PrintStream;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.galois.multifunction.MultiFunction;
import com.galois.multifunction.ParamType;
import com.galois.multifunction.ParamType.InterfaceType;

/**
 * Checks that a procedure is well-formed.
 *
 * Each check is independent and only returns whether it passed.  Reasons
 * for failures are written to the status stream when one is set.  The
 * validator never modifies the procedure.
 */
public final class ProcedureValidator {
    private final Procedure procedure;

    /** Stream to log failures to, or <code>null</code>. */
    private PrintStream statusStream;

    ProcedureValidator(Procedure procedure) {
        this.procedure = procedure;
    }

    /**
     * Set the stream that failed checks and ambiguous initialization states
     * are reported to.
     * @param s Stream to write status messages to, or <code>null</code> to disable them.
     */
    public void setStatusStream(PrintStream s) {
        this.statusStream = s;
    }

    public PrintStream getStatusStream() {
        return statusStream;
    }

    private void logStatus(String msg) {
        if (statusStream != null) {
            statusStream.printf("procedure-validator: %s%n", msg);
            statusStream.flush();
        }
    }

    // Log a failed check and return its message.
    private String fail(String msg) {
        logStatus(msg);
        return msg;
    }

    /**
     * Run all checks in order.
     * @return true if every check passes
     */
    public boolean validate() {
        return firstFailure() == null;
    }

    /**
     * Run all checks in order and throw on the first one that fails.
     * @throws ProcedureValidationException describing the failure
     */
    public void assertValid() {
        String failure = firstFailure();
        if (failure != null) {
            throw new ProcedureValidationException(failure);
        }
    }

    private String firstFailure() {
        if (procedure.entry() == null) {
            return fail("Procedure has no entry instruction.");
        }
        String r = checkAllInstructionPointersSet();
        if (r == null) {
            r = checkAllParamsProvided();
        }
        if (r == null) {
            r = checkSameVariablesInOneCall();
        }
        if (r == null) {
            r = checkParameters();
        }
        if (r == null) {
            r = checkInitialization();
        }
        return r;
    }

    /**
     * Check that every instruction except returns has its successors set.
     */
    public boolean validateAllInstructionPointersSet() {
        return checkAllInstructionPointersSet() == null;
    }

    private String checkAllInstructionPointersSet() {
        for (CallInstruction i : procedure.callInstructions()) {
            if (i.next() == null) {
                return fail(i + " (" + i.fn().name() + ") has no next instruction.");
            }
        }
        for (DestructInstruction i : procedure.destructInstructions()) {
            if (i.next() == null) {
                return fail(i + " has no next instruction.");
            }
        }
        for (BranchInstruction i : procedure.branchInstructions()) {
            if (i.branchTrue() == null) {
                return fail(i + " has no true branch.");
            }
            if (i.branchFalse() == null) {
                return fail(i + " has no false branch.");
            }
        }
        for (DummyInstruction i : procedure.dummyInstructions()) {
            if (i.next() == null) {
                return fail(i + " has no next instruction.");
            }
        }
        return null;
    }

    /**
     * Check that every variable slot of every instruction is filled.
     */
    public boolean validateAllParamsProvided() {
        return checkAllParamsProvided() == null;
    }

    private String checkAllParamsProvided() {
        for (CallInstruction i : procedure.callInstructions()) {
            List<Variable> params = i.params();
            for (int p = 0; p != params.size(); ++p) {
                if (params.get(p) == null) {
                    return fail(i + " (" + i.fn().name() + ") has no variable for parameter " + p + ".");
                }
            }
        }
        for (BranchInstruction i : procedure.branchInstructions()) {
            if (i.condition() == null) {
                return fail(i + " has no condition.");
            }
        }
        for (DestructInstruction i : procedure.destructInstructions()) {
            if (i.variable() == null) {
                return fail(i + " has no variable.");
            }
        }
        return null;
    }

    /**
     * Check that a variable passed to more than one parameter of a call is
     * only used as input.
     */
    public boolean validateSameVariablesInOneCall() {
        return checkSameVariablesInOneCall() == null;
    }

    private String checkSameVariablesInOneCall() {
        for (CallInstruction i : procedure.callInstructions()) {
            MultiFunction fn = i.fn();
            for (int paramIndex : fn.paramIndices()) {
                Variable variable = i.param(paramIndex);
                if (variable == null) {
                    continue;
                }
                ParamType paramType = fn.paramType(paramIndex);
                for (int otherIndex : fn.paramIndices()) {
                    if (otherIndex == paramIndex || i.param(otherIndex) != variable) {
                        continue;
                    }
                    // A mutable or output variable can only be used once.
                    if (paramType.interfaceType() != InterfaceType.INPUT
                        || fn.paramType(otherIndex).interfaceType() != InterfaceType.INPUT) {
                        return fail(i + " (" + fn.name() + ") passes " + variable
                                    + " to parameters " + paramIndex + " and " + otherIndex
                                    + ", but not only as input.");
                    }
                }
            }
        }
        return null;
    }

    /**
     * Check that no variable is bound to more than one procedure parameter.
     */
    public boolean validateParameters() {
        return checkParameters() == null;
    }

    private String checkParameters() {
        Set<Variable> variables = new HashSet<Variable>();
        for (Parameter param : procedure.params()) {
            if (!variables.add(param.variable())) {
                return fail(param.variable() + " is used for more than one procedure parameter.");
            }
        }
        return null;
    }

    /**
     * Check that every variable is in the right initialization state where
     * it is used, and that only output and mutable parameters are
     * initialized when the procedure returns.
     *
     * A use is accepted if at least one path reaches it in the required
     * state.
     */
    public boolean validateInitialization() {
        return checkInitialization() == null;
    }

    private String checkInitialization() {
        for (DestructInstruction i : procedure.destructInstructions()) {
            Variable variable = i.variable();
            if (variable == null) {
                continue;
            }
            InitState state = findInitializationStateBeforeInstruction(i, variable);
            if (!state.canBeInitialized()) {
                return fail(variable + " is not initialized before " + i + ".");
            }
            warnIfAmbiguous(state, i, variable);
        }
        for (BranchInstruction i : procedure.branchInstructions()) {
            Variable variable = i.condition();
            if (variable == null) {
                continue;
            }
            InitState state = findInitializationStateBeforeInstruction(i, variable);
            if (!state.canBeInitialized()) {
                return fail(variable + " is not initialized before " + i + ".");
            }
            warnIfAmbiguous(state, i, variable);
        }
        for (CallInstruction i : procedure.callInstructions()) {
            MultiFunction fn = i.fn();
            for (int paramIndex : fn.paramIndices()) {
                Variable variable = i.param(paramIndex);
                if (variable == null) {
                    continue;
                }
                InitState state = findInitializationStateBeforeInstruction(i, variable);
                switch (fn.paramType(paramIndex).interfaceType()) {
                case INPUT:
                case MUTABLE:
                    if (!state.canBeInitialized()) {
                        return fail(variable + " is not initialized before "
                                    + i + " (" + fn.name() + ").");
                    }
                    break;
                case OUTPUT:
                    if (!state.canBeUninitialized()) {
                        return fail(variable + " is already initialized before "
                                    + i + " (" + fn.name() + ") writes it.");
                    }
                    break;
                default:
                    throw new AssertionError(fn.paramType(paramIndex).interfaceType());
                }
                warnIfAmbiguous(state, i, variable);
            }
        }

        Set<Variable> initializedOnReturn = new HashSet<Variable>();
        for (Parameter param : procedure.params()) {
            if (param.type() == InterfaceType.MUTABLE || param.type() == InterfaceType.OUTPUT) {
                initializedOnReturn.add(param.variable());
            }
        }
        for (ReturnInstruction i : procedure.returnInstructions()) {
            for (Variable variable : procedure.variables()) {
                InitState state = findInitializationStateBeforeInstruction(i, variable);
                if (initializedOnReturn.contains(variable)) {
                    if (!state.canBeInitialized()) {
                        return fail(variable + " is not initialized at " + i + ".");
                    }
                } else {
                    if (!state.canBeUninitialized()) {
                        return fail(variable + " is not destructed before " + i + ".");
                    }
                }
                warnIfAmbiguous(state, i, variable);
            }
        }
        return null;
    }

    private void warnIfAmbiguous(InitState state, Instruction instruction, Variable variable) {
        if (state.isAmbiguous()) {
            logStatus(variable + " may or may not be initialized before " + instruction + ".");
        }
    }

    /**
     * Walk backwards from <code>targetInstruction</code> to find the
     * initialization states <code>targetVariable</code> can have right
     * before the instruction runs.
     *
     * A path stops at the closest call that outputs the variable or the
     * closest destruct of it.  Paths that reach the entry instruction take
     * their state from the procedure parameters.
     */
    public InitState findInitializationStateBeforeInstruction(Instruction targetInstruction,
                                                             Variable targetVariable) {
        if (targetInstruction == null) throw new NullPointerException("targetInstruction");
        if (targetVariable == null) throw new NullPointerException("targetVariable");

        InitState state = new InitState();
        Instruction entry = procedure.entry();

        if (targetInstruction == entry) {
            checkEntryInstruction(state, targetVariable);
        }

        Set<Instruction> checked = new HashSet<Instruction>();
        Deque<Instruction> toCheck = new ArrayDeque<Instruction>(targetInstruction.prev());
        StateChange change = new StateChange(state, targetVariable);

        while (!toCheck.isEmpty()) {
            Instruction instruction = toCheck.pop();
            // Skip if the instruction has been checked already.
            if (!checked.add(instruction)) {
                continue;
            }
            boolean stateModified = instruction.accept(change);
            if (!stateModified) {
                if (instruction == entry) {
                    checkEntryInstruction(state, targetVariable);
                }
                for (Instruction p : instruction.prev()) {
                    toCheck.push(p);
                }
            }
        }
        return state;
    }

    // Seed the state of a variable when control enters the procedure.
    private void checkEntryInstruction(InitState state, Variable variable) {
        boolean callerInitialized = false;
        for (Parameter param : procedure.params()) {
            if (param.variable() == variable
                && (param.type() == InterfaceType.INPUT || param.type() == InterfaceType.MUTABLE)) {
                callerInitialized = true;
                break;
            }
        }
        if (callerInitialized) {
            state.markInitialized();
        } else {
            state.markUninitialized();
        }
    }

    /**
     * Updates the state if an instruction decides the initialization state
     * of the variable, and returns whether it did.
     */
    private static final class StateChange implements InstructionVisitor<Boolean> {
        private final InitState state;
        private final Variable variable;

        StateChange(InitState state, Variable variable) {
            this.state = state;
            this.variable = variable;
        }

        public Boolean visitCall(CallInstruction instruction) {
            MultiFunction fn = instruction.fn();
            for (int paramIndex : fn.paramIndices()) {
                if (instruction.param(paramIndex) == variable
                    && fn.paramType(paramIndex).interfaceType() == InterfaceType.OUTPUT) {
                    state.markInitialized();
                    return true;
                }
            }
            return false;
        }

        public Boolean visitDestruct(DestructInstruction instruction) {
            if (instruction.variable() == variable) {
                state.markUninitialized();
                return true;
            }
            return false;
        }

        public Boolean visitBranch(BranchInstruction instruction) {
            return false;
        }

        public Boolean visitDummy(DummyInstruction instruction) {
            return false;
        }

        public Boolean visitReturn(ReturnInstruction instruction) {
            return false;
        }
    }
}
