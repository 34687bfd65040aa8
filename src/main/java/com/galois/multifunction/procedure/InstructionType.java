package com.galois.multifunction.procedure;

import com.galois.multifunction.proto.Protos;

/**
 * Tag identifying which variant an {@link Instruction} is.
 */
public enum InstructionType {
    CALL,
    BRANCH,
    DESTRUCT,
    DUMMY,
    RETURN;

    /**
     * Get representation of the tag in protocol buffer format.
     */
    Protos.InstructionCode getCodeRep() {
        switch (this) {
        case CALL:
            return Protos.InstructionCode.CallInstruction;
        case BRANCH:
            return Protos.InstructionCode.BranchInstruction;
        case DESTRUCT:
            return Protos.InstructionCode.DestructInstruction;
        case DUMMY:
            return Protos.InstructionCode.DummyInstruction;
        case RETURN:
            return Protos.InstructionCode.ReturnInstruction;
        default:
            throw new AssertionError(this);
        }
    }
}
