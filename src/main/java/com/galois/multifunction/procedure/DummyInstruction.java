package com.galois.multifunction.procedure;

import com.galois.multifunction.proto.Protos;

/**
 * Instruction without effect.  Used as a joining point in the graph, for
 * example as a stable target to jump back to at the start of a loop.
 */
public final class DummyInstruction extends Instruction {
    private Instruction next;

    DummyInstruction(Procedure procedure, int index) {
        super(procedure, index, InstructionType.DUMMY);
    }

    public Instruction next() {
        return next;
    }

    public void setNext(Instruction instruction) {
        next = relink(next, instruction);
    }

    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitDummy(this);
    }

    public Protos.Instruction getInstructionRep() {
        return newInstructionRep()
            .addSuccessor(requireIndex(next, "next instruction"))
            .build();
    }
}
