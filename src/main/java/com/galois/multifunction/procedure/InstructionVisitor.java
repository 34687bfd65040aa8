package com.galois.multifunction.procedure;

/**
 * Visitor over the instruction variants.
 *
 * Every consumer that needs to tell the variants apart goes through this
 * interface, so a new variant cannot be forgotten by any of them.
 *
 * @param <R> result type of the visit
 */
public interface InstructionVisitor<R> {
    R visitCall(CallInstruction instruction);
    R visitBranch(BranchInstruction instruction);
    R visitDestruct(DestructInstruction instruction);
    R visitDummy(DummyInstruction instruction);
    R visitReturn(ReturnInstruction instruction);
}
