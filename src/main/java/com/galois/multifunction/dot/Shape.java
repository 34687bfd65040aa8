package com.galois.multifunction.dot;

/**
 * Node shapes understood by dot.
 */
public enum Shape {
    RECTANGLE("rectangle"),
    CIRCLE("circle"),
    DIAMOND("diamond");

    private final String name;

    Shape(String name) {
        this.name = name;
    }

    /** Name of the shape in dot source. */
    public String dotName() {
        return name;
    }
}
