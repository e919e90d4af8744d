package com.basic.frontend.config;

import com.basic.frontend.registry.DefaultFunctionRegistry;
import com.basic.frontend.registry.FunctionRegistry;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Settings shared by the tokenizer, statement parser and expression translator.
 */
@Value
@Builder(toBuilder = true)
public class ParserConfig {

    public static final int DEFAULT_MAX_IF_DEPTH = 16;
    public static final int DEFAULT_MAX_EXPRESSION_DEPTH = 64;
    public static final int DEFAULT_MAX_EXPRESSION_LENGTH = 256;

    /**
     * Names the tokenizer recognizes as built-in functions.
     */
    @NonNull
    @Builder.Default
    FunctionRegistry functionRegistry = new DefaultFunctionRegistry();

    /**
     * How many IF statements may be nested inside each other on one line.
     */
    @Builder.Default
    int maxIfDepth = DEFAULT_MAX_IF_DEPTH;

    /**
     * How deeply parentheses, brackets and unary minus may nest inside one expression.
     */
    @Builder.Default
    int maxExpressionDepth = DEFAULT_MAX_EXPRESSION_DEPTH;

    /**
     * How many tokens one expression may span. A long operator chain turns into
     * a deep tree, so this bounds the tree depth together with {@code maxExpressionDepth}.
     */
    @Builder.Default
    int maxExpressionLength = DEFAULT_MAX_EXPRESSION_LENGTH;

    public static ParserConfig defaults() {
        return ParserConfig.builder().build();
    }
}
