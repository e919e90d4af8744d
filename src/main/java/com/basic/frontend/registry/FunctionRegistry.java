package com.basic.frontend.registry;

import java.util.Set;

/**
 * Read-only view of the built-in function names known to the runtime.
 * The tokenizer only needs the names; what a function does is the runtime's business.
 */
public interface FunctionRegistry {

    /**
     * Upper-case names of all registered functions.
     */
    Set<String> getFunctionNames();
}
