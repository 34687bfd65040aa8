package com.galois.multifunction.procedure;

import com.galois.multifunction.proto.Protos;

/**
 * Returns from the procedure.
 */
public final class ReturnInstruction extends Instruction {
    ReturnInstruction(Procedure procedure, int index) {
        super(procedure, index, InstructionType.RETURN);
    }

    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitReturn(this);
    }

    public Protos.Instruction getInstructionRep() {
        return newInstructionRep().build();
    }
}
