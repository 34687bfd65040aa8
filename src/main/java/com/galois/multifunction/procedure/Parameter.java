package com.galois.multifunction.procedure;

import com.galois.multifunction.ParamType.InterfaceType;
import com.galois.multifunction.proto.Protos;

/**
 * A parameter of the procedure itself: a variable passed in or out by the
 * caller of the procedure.
 */
public final class Parameter {
    private final InterfaceType type;
    private final Variable variable;

    Parameter(InterfaceType type, Variable variable) {
        this.type = type;
        this.variable = variable;
    }

    public InterfaceType type() {
        return type;
    }

    public Variable variable() {
        return variable;
    }

    /**
     * Get the Protocol buffer representation.
     * @return the representation object.
     */
    public Protos.Parameter getParameterRep() {
        return Protos.Parameter.newBuilder()
            .setInterfaceType(type.getInterfaceRep())
            .setVariable(variable.id())
            .build();
    }

    public String toString() {
        return type.shortName() + " " + variable;
    }
}
