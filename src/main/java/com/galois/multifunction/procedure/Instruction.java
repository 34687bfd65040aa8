package com.galois.multifunction.procedure;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.galois.multifunction.proto.Protos;

/**
 * Common base class of the nodes in a procedure's control flow graph.
 *
 * Forward edges (successors and referenced variables) are declared by the
 * variant subclasses.  The predecessor list is the inverse of the forward
 * edges of all instructions, and is only changed by their setters.
 */
public abstract class Instruction {
    private final Procedure procedure;
    /** The index of this instruction in the procedure. */
    private final int index;
    private final InstructionType type;
    private final ArrayList<Instruction> prev;

    /**
     * Internal method for creating an instruction
     */
    Instruction(Procedure procedure, int index, InstructionType type) {
        this.procedure = procedure;
        this.index = index;
        this.type = type;
        this.prev = new ArrayList<Instruction>();
    }

    /**
     * Get procedure that this instruction is part of.
     */
    public Procedure getProcedure() {
        return procedure;
    }

    /**
     * Get index of instruction.  Indices are unique within a procedure and
     * assigned in creation order.
     */
    public int index() {
        return index;
    }

    public InstructionType type() {
        return type;
    }

    /**
     * Instructions that can transfer control to this one.  A branch that
     * has this instruction as both targets is listed twice.
     */
    public List<Instruction> prev() {
        return Collections.unmodifiableList(prev);
    }

    public abstract <R> R accept(InstructionVisitor<R> visitor);

    /**
     * Get the Protocol buffer representation.
     * @return the representation object.
     */
    public abstract Protos.Instruction getInstructionRep();

    /**
     * Start a representation with the fields common to all instructions.
     */
    Protos.Instruction.Builder newInstructionRep() {
        return Protos.Instruction.newBuilder()
            .setCode(type.getCodeRep())
            .setIndex(index);
    }

    /**
     * Move this instruction from the predecessors of <code>oldTarget</code>
     * to those of <code>newTarget</code>.
     * @return <code>newTarget</code>
     */
    final Instruction relink(Instruction oldTarget, Instruction newTarget) {
        if (newTarget != null) {
            checkSameProcedure(newTarget.procedure);
        }
        if (oldTarget != null) {
            removeFirstOccurrenceAndReorder(oldTarget.prev, this);
        }
        if (newTarget != null) {
            newTarget.prev.add(this);
        }
        return newTarget;
    }

    /**
     * Move this instruction from the users of <code>oldVariable</code>
     * to those of <code>newVariable</code>.
     * @return <code>newVariable</code>
     */
    final Variable relink(Variable oldVariable, Variable newVariable) {
        if (newVariable != null) {
            checkSameProcedure(newVariable.getProcedure());
        }
        if (oldVariable != null) {
            oldVariable.removeUser(this);
        }
        if (newVariable != null) {
            newVariable.addUser(this);
        }
        return newVariable;
    }

    private void checkSameProcedure(Procedure other) {
        if (other != procedure) {
            throw new IllegalArgumentException(
                "Instructions and variables of different procedures cannot be linked.");
        }
    }

    /**
     * Remove the first occurrence of <code>item</code>, moving the last
     * element into its slot.
     */
    static <T> void removeFirstOccurrenceAndReorder(ArrayList<T> list, T item) {
        int i = list.indexOf(item);
        assert i >= 0 : "Item is not in list.";
        if (i < 0) {
            return;
        }
        int last = list.size() - 1;
        list.set(i, list.get(last));
        list.remove(last);
    }

    static long requireIndex(Instruction target, String what) {
        if (target == null) {
            throw new IllegalStateException("Instruction has no " + what + ".");
        }
        return target.index;
    }

    static long requireId(Variable variable, String what) {
        if (variable == null) {
            throw new IllegalStateException("Instruction has no " + what + ".");
        }
        return variable.id();
    }

    public String toString() {
        return type.name().toLowerCase() + " #" + index;
    }
}
