package com.galois.multifunction.procedure;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Groups the instructions of a procedure into basic blocks: runs of
 * instructions that are always executed together.
 *
 * Blocks are only used for display; the procedure itself has no notion of
 * them.
 */
public final class BasicBlocks {
    private BasicBlocks() {}

    /**
     * Returns whether an instruction has to start a new block.  This is the
     * case for the entry, for instructions with zero or several
     * predecessors, and for branch targets.
     */
    public static boolean hasToBeBlockBegin(Procedure procedure, Instruction instruction) {
        if (procedure.entry() == instruction) {
            return true;
        }
        List<Instruction> prev = instruction.prev();
        if (prev.size() != 1) {
            return true;
        }
        return prev.get(0).type() == InstructionType.BRANCH;
    }

    /**
     * Find the first instruction of the block containing
     * <code>representative</code>.
     *
     * A loop that has no entry or exit has no natural start; it is cut at
     * the representative.
     */
    public static Instruction firstInstructionInBlock(Procedure procedure,
                                                      Instruction representative) {
        Instruction current = representative;
        while (!hasToBeBlockBegin(procedure, current)) {
            current = current.prev().get(0);
            if (current == representative) {
                break;
            }
        }
        return current;
    }

    /**
     * Get the instructions of the block containing
     * <code>representative</code>, in execution order.
     */
    public static List<Instruction> instructionsInBlock(Procedure procedure,
                                                        Instruction representative) {
        List<Instruction> instructions = new ArrayList<Instruction>();
        Instruction begin = firstInstructionInBlock(procedure, representative);
        for (Instruction current = begin;
             current != null;
             current = nextInstructionInBlock(procedure, current, begin)) {
            instructions.add(current);
        }
        return instructions;
    }

    /**
     * Split all instructions of the procedure into blocks.  Every
     * instruction is in exactly one block.  Blocks are ordered by their
     * first instruction that comes up in {@link Procedure#allInstructions()}.
     */
    public static List<List<Instruction>> partition(Procedure procedure) {
        List<List<Instruction>> blocks = new ArrayList<List<Instruction>>();
        Set<Instruction> handled = new HashSet<Instruction>();
        for (Instruction representative : procedure.allInstructions()) {
            if (handled.contains(representative)) {
                continue;
            }
            List<Instruction> block = instructionsInBlock(procedure, representative);
            handled.addAll(block);
            blocks.add(block);
        }
        return blocks;
    }

    private static Instruction nextInstructionInBlock(Procedure procedure,
                                                      Instruction instruction,
                                                      Instruction blockBegin) {
        Instruction next = instruction.accept(FALL_THROUGH);
        if (next == null || next == blockBegin) {
            return null;
        }
        if (hasToBeBlockBegin(procedure, next)) {
            return null;
        }
        return next;
    }

    /** The single successor of an instruction, or null for branches and returns. */
    private static final InstructionVisitor<Instruction> FALL_THROUGH =
        new InstructionVisitor<Instruction>() {
            public Instruction visitCall(CallInstruction instruction) {
                return instruction.next();
            }

            public Instruction visitDestruct(DestructInstruction instruction) {
                return instruction.next();
            }

            public Instruction visitDummy(DummyInstruction instruction) {
                return instruction.next();
            }

            public Instruction visitBranch(BranchInstruction instruction) {
                return null;
            }

            public Instruction visitReturn(ReturnInstruction instruction) {
                return null;
            }
        };
}
