package com.galois.multifunction;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.galois.multifunction.ParamType.InterfaceType;

/**
 * Name and ordered parameter list of a multi-function.
 */
public final class Signature {
    private final String functionName;
    private final List<String> paramNames;
    private final List<ParamType> paramTypes;

    private Signature(String functionName,
                      List<String> paramNames,
                      List<ParamType> paramTypes) {
        this.functionName = functionName;
        this.paramNames = Collections.unmodifiableList(new ArrayList<String>(paramNames));
        this.paramTypes = Collections.unmodifiableList(new ArrayList<ParamType>(paramTypes));
    }

    /**
     * Start building a signature for a function with the given name.
     * @param functionName name of the function
     * @return a fresh builder
     */
    public static Builder builder(String functionName) {
        return new Builder(functionName);
    }

    public String functionName() {
        return functionName;
    }

    public int paramAmount() {
        return paramTypes.size();
    }

    public String paramName(int index) {
        checkIndex(index);
        return paramNames.get(index);
    }

    public ParamType paramType(int index) {
        checkIndex(index);
        return paramTypes.get(index);
    }

    private void checkIndex(int index) {
        if (!(0 <= index && index < paramTypes.size())) {
            throw new IllegalArgumentException("Bad parameter index.");
        }
    }

    /**
     * Incrementally collects the parameters of a signature.
     */
    public static final class Builder {
        private final String functionName;
        private final List<String> paramNames = new ArrayList<String>();
        private final List<ParamType> paramTypes = new ArrayList<ParamType>();

        private Builder(String functionName) {
            if (functionName == null) throw new NullPointerException("functionName");
            this.functionName = functionName;
        }

        public Builder add(String name, ParamType type) {
            if (name == null) throw new NullPointerException("name");
            if (type == null) throw new NullPointerException("type");
            paramNames.add(name);
            paramTypes.add(type);
            return this;
        }

        public Builder singleInput(String name, DataType type) {
            return add(name, new ParamType(InterfaceType.INPUT, type.singleType()));
        }

        public Builder singleMutable(String name, DataType type) {
            return add(name, new ParamType(InterfaceType.MUTABLE, type.singleType()));
        }

        public Builder singleOutput(String name, DataType type) {
            return add(name, new ParamType(InterfaceType.OUTPUT, type.singleType()));
        }

        public Builder vectorInput(String name, String baseType) {
            return add(name, new ParamType(InterfaceType.INPUT, DataType.forVector(baseType)));
        }

        public Builder vectorMutable(String name, String baseType) {
            return add(name, new ParamType(InterfaceType.MUTABLE, DataType.forVector(baseType)));
        }

        public Builder vectorOutput(String name, String baseType) {
            return add(name, new ParamType(InterfaceType.OUTPUT, DataType.forVector(baseType)));
        }

        public Signature build() {
            return new Signature(functionName, paramNames, paramTypes);
        }
    }
}
