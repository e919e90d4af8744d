package com.basic.frontend.registry;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Function names shipped with the standard runtime library.
 */
public class DefaultFunctionRegistry implements FunctionRegistry {

    private static final Set<String> BUILT_INS = Set.of(
        "ABS", "ASC", "ATN", "CHR", "COLOR", "COS", "EXP", "GETCHAR", "GETCLICK",
        "INT", "LEFT", "LEN", "LOG", "MID", "RANDOM", "RIGHT", "RND", "SGN",
        "SIN", "SQR", "STR", "TAN", "TIME", "VAL"
    );

    private final Set<String> names;

    public DefaultFunctionRegistry() {
        this.names = BUILT_INS;
    }

    private DefaultFunctionRegistry(Set<String> names) {
        this.names = Set.copyOf(names);
    }

    /**
     * Registry holding the built-ins plus the given extra names.
     */
    public static DefaultFunctionRegistry withAdditional(Collection<String> extraNames) {
        Set<String> merged = new LinkedHashSet<>(BUILT_INS);
        for (String name : extraNames) {
            merged.add(name.trim().toUpperCase());
        }
        return new DefaultFunctionRegistry(merged);
    }

    @Override
    public Set<String> getFunctionNames() {
        return names;
    }
}
