package com.galois.multifunction;

/**
 * A named, pure, vectorized operation with a fixed ordered list of
 * parameters.
 *
 * Procedures only inspect the signature of a multi-function; evaluating
 * it is left to the execution engine.
 */
public interface MultiFunction {
    /**
     * Name used when printing calls to this function.
     * @return the name
     */
    String name();

    /**
     * Number of parameters expected by the function.
     * @return the number of parameters
     */
    int paramAmount();

    /**
     * Indices of all parameters, in order.
     * @return an array containing <code>0 .. paramAmount() - 1</code>
     */
    int[] paramIndices();

    /**
     * Return type of parameter at given index.
     * @param index the index of the parameter
     * @return the parameter type
     */
    ParamType paramType(int index);
}
