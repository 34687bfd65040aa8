package com.galois.multifunction.procedure;

import com.galois.multifunction.proto.Protos;

/**
 * Destructs the value of a variable, leaving it uninitialized.
 */
public final class DestructInstruction extends Instruction {
    private Variable variable;
    private Instruction next;

    DestructInstruction(Procedure procedure, int index) {
        super(procedure, index, InstructionType.DESTRUCT);
    }

    public Variable variable() {
        return variable;
    }

    public void setVariable(Variable variable) {
        this.variable = relink(this.variable, variable);
    }

    public Instruction next() {
        return next;
    }

    public void setNext(Instruction instruction) {
        next = relink(next, instruction);
    }

    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitDestruct(this);
    }

    public Protos.Instruction getInstructionRep() {
        return newInstructionRep()
            .addSuccessor(requireIndex(next, "next instruction"))
            .addVariable(requireId(variable, "variable"))
            .build();
    }
}
