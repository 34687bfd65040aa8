package com.galois.multifunction;

/**
 * Base class for multi-functions whose parameters are described by a
 * {@link Signature}.
 */
public abstract class AbstractMultiFunction implements MultiFunction {
    private final Signature signature;

    protected AbstractMultiFunction(Signature signature) {
        if (signature == null) throw new NullPointerException("signature");
        this.signature = signature;
    }

    public Signature signature() {
        return signature;
    }

    public String name() {
        return signature.functionName();
    }

    public int paramAmount() {
        return signature.paramAmount();
    }

    public int[] paramIndices() {
        int[] r = new int[signature.paramAmount()];
        for (int i = 0; i != r.length; ++i) {
            r[i] = i;
        }
        return r;
    }

    public ParamType paramType(int index) {
        return signature.paramType(index);
    }

    public String toString() {
        return name();
    }
}
