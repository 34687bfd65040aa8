package com.galois.multifunction.procedure;

/**
 * Possible initialization states of a variable right before an instruction
 * runs.  Both flags may be set when the state depends on the path taken to
 * reach the instruction.
 */
public final class InitState {
    private boolean canBeInitialized;
    private boolean canBeUninitialized;

    InitState() {
    }

    /**
     * True if some path reaches the instruction with the variable initialized.
     */
    public boolean canBeInitialized() {
        return canBeInitialized;
    }

    /**
     * True if some path reaches the instruction with the variable uninitialized.
     */
    public boolean canBeUninitialized() {
        return canBeUninitialized;
    }

    /**
     * True if the state depends on the path taken.
     */
    public boolean isAmbiguous() {
        return canBeInitialized && canBeUninitialized;
    }

    void markInitialized() {
        canBeInitialized = true;
    }

    void markUninitialized() {
        canBeUninitialized = true;
    }

    public String toString() {
        return "InitState(initialized=" + canBeInitialized
            + ", uninitialized=" + canBeUninitialized + ")";
    }
}
