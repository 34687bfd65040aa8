package com.galois.multifunction;
import java.util.Arrays;

import com.galois.multifunction.proto.Protos;

/**
 * Type of a single function or procedure parameter: how the parameter is
 * used, and the data type of the values passed through it.
 */
public final class ParamType implements Typed {
    /**
     * How a parameter is used by the callee.
     */
    public enum InterfaceType {
        /** The value is initialized by the caller and only read. */
        INPUT,
        /** The value is initialized by the caller and may be modified. */
        MUTABLE,
        /** The value is uninitialized on entry and initialized by the callee. */
        OUTPUT;

        /**
         * Short name used when printing instructions.
         */
        public String shortName() {
            switch (this) {
            case INPUT:
                return "in";
            case MUTABLE:
                return "mut";
            case OUTPUT:
                return "out";
            default:
                throw new AssertionError(this);
            }
        }

        /**
         * Get representation of the interface type in protocol buffer format.
         */
        public Protos.InterfaceType getInterfaceRep() {
            switch (this) {
            case INPUT:
                return Protos.InterfaceType.InputParam;
            case MUTABLE:
                return Protos.InterfaceType.MutableParam;
            case OUTPUT:
                return Protos.InterfaceType.OutputParam;
            default:
                throw new AssertionError(this);
            }
        }
    }

    private final InterfaceType interfaceType;
    private final DataType dataType;

    public ParamType(InterfaceType interfaceType, DataType dataType) {
        if (interfaceType == null) throw new NullPointerException("interfaceType");
        if (dataType == null) throw new NullPointerException("dataType");
        this.interfaceType = interfaceType;
        this.dataType = dataType;
    }

    public InterfaceType interfaceType() {
        return interfaceType;
    }

    public DataType type() {
        return dataType;
    }

    /** Compare if object equals this. */
    public boolean equals(Object o) {
        if (!(o instanceof ParamType)) return false;
        ParamType other = (ParamType) o;
        return this.interfaceType == other.interfaceType
            && this.dataType.equals(other.dataType);
    }

    /** Hash fields together. */
    public int hashCode() {
        return Arrays.hashCode(new Object[] { interfaceType, dataType });
    }

    public String toString() {
        return interfaceType.shortName() + " " + dataType;
    }
}
