package com.galois.multifunction;

/**
 * An object with a data type associated.
 */
public interface Typed {
    /**
     * Return type of object.
     * @return the type
     */
    DataType type();
}
