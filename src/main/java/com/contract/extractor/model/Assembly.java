package com.contract.extractor.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A named unit of analysis, such as a compiled library or one source file, holding the
 * methods to extract contracts from.
 */
public final class Assembly {

    private final String name;
    private final List<MethodBody> methods;

    public Assembly(String name, List<MethodBody> methods) {
        this.name = Objects.requireNonNull(name, "name");
        this.methods = Collections.unmodifiableList(new ArrayList<>(methods));
    }

    public String getName() {
        return name;
    }

    public List<MethodBody> getMethods() {
        return methods;
    }

    @Override
    public String toString() {
        return name + " (" + methods.size() + " methods)";
    }
}
