package com.galois.multifunction;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import com.galois.multifunction.proto.Protos;

/**
 * Data type of a variable or function parameter.
 *
 * A data type is either a single value of some base type, or a vector
 * holding any number of values of that base type.  The base type is an
 * opaque name; two data types are equal when their category and base type
 * are equal.
 */
public final class DataType {
    /** Whether a parameter holds one value or a vector of values. */
    public enum Category { SINGLE, VECTOR }

    private final Category category;
    private final String baseType;

    private DataType(Category category, String baseType) {
        this.category = category;
        this.baseType = baseType;
    }

    // Cache used for single and vector types.
    private static final Map<String,DataType> singleTypes = new HashMap<String,DataType>();
    private static final Map<String,DataType> vectorTypes = new HashMap<String,DataType>();

    /**
     * Returns the type of a single value of the given base type.
     *
     * @param baseType name of the base type.
     * @return The given type.
     */
    public static DataType forSingle(String baseType) {
        return lookup(singleTypes, Category.SINGLE, baseType);
    }

    /**
     * Returns the type of a vector of values of the given base type.
     *
     * @param baseType name of the base type.
     * @return The given type.
     */
    public static DataType forVector(String baseType) {
        return lookup(vectorTypes, Category.VECTOR, baseType);
    }

    private static DataType lookup(Map<String,DataType> cache,
                                   Category category,
                                   String baseType) {
        if (baseType == null) throw new NullPointerException("baseType");
        if (baseType.isEmpty()) {
            throw new IllegalArgumentException("Base type name must not be empty.");
        }
        synchronized (cache) {
            DataType r = cache.get(baseType);
            if (r == null) {
                r = new DataType(category, baseType);
                cache.put(baseType, r);
            }
            return r;
        }
    }

    /** Single float value. */
    public static final DataType FLOAT = forSingle("float");

    /** Single three component float vector. */
    public static final DataType FLOAT3 = forSingle("float3");

    /** Single integer value. */
    public static final DataType INT = forSingle("int");

    /** Single Boolean value, as used by branch conditions. */
    public static final DataType BOOL = forSingle("bool");

    /** Single string value. */
    public static final DataType STRING = forSingle("string");

    public Category category() {
        return category;
    }

    public boolean isSingle() {
        return category == Category.SINGLE;
    }

    public boolean isVector() {
        return category == Category.VECTOR;
    }

    /**
     * Name of the base type.
     * @return the name
     */
    public String baseType() {
        return baseType;
    }

    /**
     * Return the single type with the same base type as this one.
     */
    public DataType singleType() {
        return isSingle() ? this : forSingle(baseType);
    }

    /**
     * Get representation of DataType in protocol buffer format.
     */
    public Protos.DataType getTypeRep() {
        return Protos.DataType.newBuilder()
            .setCategory(isSingle()
                         ? Protos.DataTypeCategory.SingleType
                         : Protos.DataTypeCategory.VectorType)
            .setBaseType(baseType)
            .build();
    }

    /** Compare if object equals this. */
    public boolean equals(Object o) {
        if (!(o instanceof DataType)) return false;
        DataType other = (DataType) o;
        return this.category == other.category
            && this.baseType.equals(other.baseType);
    }

    /** Hash fields together. */
    public int hashCode() {
        return Arrays.hashCode(new Object[] { category, baseType });
    }

    public String toString() {
        return isSingle() ? baseType : "vector<" + baseType + ">";
    }
}
