/**
 * Types shared by multi-functions and the procedures that call them.
 *
 * <p>
 * A {@link com.galois.multifunction.MultiFunction} is an opaque vectorized
 * operation with a fixed {@link com.galois.multifunction.Signature}.
 * Procedures that call multi-functions are built in
 * {@link com.galois.multifunction.procedure}.
 */
package com.galois.multifunction;
