package com.galois.multifunction.procedure;

import com.galois.multifunction.proto.Protos;

/**
 * Transfers control to one of two instructions depending on a Boolean
 * condition variable.
 */
public final class BranchInstruction extends Instruction {
    private Variable condition;
    private Instruction branchTrue;
    private Instruction branchFalse;

    BranchInstruction(Procedure procedure, int index) {
        super(procedure, index, InstructionType.BRANCH);
    }

    public Variable condition() {
        return condition;
    }

    public void setCondition(Variable variable) {
        condition = relink(condition, variable);
    }

    public Instruction branchTrue() {
        return branchTrue;
    }

    public void setBranchTrue(Instruction instruction) {
        branchTrue = relink(branchTrue, instruction);
    }

    public Instruction branchFalse() {
        return branchFalse;
    }

    public void setBranchFalse(Instruction instruction) {
        branchFalse = relink(branchFalse, instruction);
    }

    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitBranch(this);
    }

    public Protos.Instruction getInstructionRep() {
        return newInstructionRep()
            .addSuccessor(requireIndex(branchTrue, "true branch"))
            .addSuccessor(requireIndex(branchFalse, "false branch"))
            .addVariable(requireId(condition, "condition"))
            .build();
    }
}
