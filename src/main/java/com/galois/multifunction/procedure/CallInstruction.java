package com.galois.multifunction.procedure;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.galois.multifunction.MultiFunction;
import com.galois.multifunction.ParamType;
import com.galois.multifunction.proto.Protos;

/**
 * Calls a multi-function with one variable per function parameter.
 */
public final class CallInstruction extends Instruction {
    private final MultiFunction fn;
    private final Variable[] params;
    private Instruction next;

    CallInstruction(Procedure procedure, int index, MultiFunction fn) {
        super(procedure, index, InstructionType.CALL);
        this.fn = fn;
        this.params = new Variable[fn.paramAmount()];
    }

    public MultiFunction fn() {
        return fn;
    }

    /**
     * Variables passed to the function, with <code>null</code> for
     * parameters that have not been provided yet.
     */
    public List<Variable> params() {
        return Collections.unmodifiableList(Arrays.asList(params));
    }

    public Variable param(int paramIndex) {
        checkParamIndex(paramIndex);
        return params[paramIndex];
    }

    public Instruction next() {
        return next;
    }

    public void setNext(Instruction instruction) {
        next = relink(next, instruction);
    }

    /**
     * Bind a variable to a parameter of the called function.
     * @param paramIndex index of the function parameter
     * @param variable variable to pass, or <code>null</code> to unbind
     */
    public void setParamVariable(int paramIndex, Variable variable) {
        checkParamIndex(paramIndex);
        assert variable == null
            || fn.paramType(paramIndex).type().equals(variable.type())
            : "Variable type does not match parameter type.";
        params[paramIndex] = relink(params[paramIndex], variable);
    }

    /**
     * Bind all parameters at once.
     * @param variables one variable per function parameter
     */
    public void setParams(Variable... variables) {
        assert variables.length == params.length : "Incorrect number of variables.";
        for (int i = 0; i != variables.length; ++i) {
            setParamVariable(i, variables[i]);
        }
    }

    private void checkParamIndex(int paramIndex) {
        if (!(0 <= paramIndex && paramIndex < params.length)) {
            throw new IllegalArgumentException("Bad parameter index.");
        }
    }

    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitCall(this);
    }

    public Protos.Instruction getInstructionRep() {
        Protos.Instruction.Builder b = newInstructionRep()
            .setFunctionName(fn.name())
            .addSuccessor(requireIndex(next, "next instruction"));
        for (int i = 0; i != params.length; ++i) {
            ParamType type = fn.paramType(i);
            b.addVariable(requireId(params[i], "variable for parameter " + i));
            b.addParamInterface(type.interfaceType().getInterfaceRep());
        }
        return b.build();
    }
}
