package com.basic.frontend.expression;

import com.basic.frontend.exception.ParseException;
import com.basic.frontend.lexer.LineTokenizer;
import com.basic.frontend.lexer.Token;
import com.basic.frontend.registry.DefaultFunctionRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ExpressionTranslator.
 */
class ExpressionTranslatorTest {

    private final LineTokenizer tokenizer = new LineTokenizer(DefaultFunctionRegistry.withAdditional(List.of("F")));
    private final ExpressionTranslator translator = new ExpressionTranslator(64, 256);
    private final ExpressionPrinter printer = new ExpressionPrinter();

    @Test
    void testMultiplicationBindsTighterThanAddition() {
        assertThat(print("1 + 2 * 3")).isEqualTo("(1 + (2 * 3))");
        assertThat(print("1 * 2 + 3")).isEqualTo("((1 * 2) + 3)");
    }

    @Test
    void testSamePrecedenceGroupsLeft() {
        assertThat(print("1 - 2 - 3")).isEqualTo("((1 - 2) - 3)");
        assertThat(print("8 / 4 / 2")).isEqualTo("((8 / 4) / 2)");
        assertThat(print("7 % 4 * 2")).isEqualTo("((7 % 4) * 2)");
        assertThat(print("A < B = C")).isEqualTo("((A < B) = C)");
    }

    @Test
    void testParenthesesOverridePrecedence() {
        assertThat(print("(1 + 2) * 3")).isEqualTo("((1 + 2) * 3)");
        assertThat(print("2 * (3 - (4 - 5))")).isEqualTo("(2 * (3 - (4 - 5)))");
    }

    @Test
    void testUnaryMinusBindsTightest() {
        assertThat(print("-A * B")).isEqualTo("((-A) * B)");
        assertThat(print("2 * -3")).isEqualTo("(2 * (-3))");
        assertThat(print("--A")).isEqualTo("(-(-A))");
        assertThat(print("-(1 + 2)")).isEqualTo("(-(1 + 2))");
    }

    @Test
    void testLogicOperatorsAreLoosest() {
        assertThat(print("A + 1 > B AND C = 2 OR D"))
                .isEqualTo("((((A + 1) > B) AND (C = 2)) OR D)");
        assertThat(print("A OR B AND C")).isEqualTo("((A OR B) AND C)");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "A <> B | (A <> B)",
            "A >= B | (A >= B)",
            "A <= B | (A <= B)",
            "A > B  | (A > B)",
            "A < B  | (A < B)",
            "A = B  | (A = B)",
            "A + 1 = B * 2 | ((A + 1) = (B * 2))"
    })
    void testComparisonOperators(String source, String expected) {
        assertThat(print(source)).isEqualTo(expected);
    }

    @Test
    void testTreeShape() {
        Expression expression = translate("1 + X * 2");

        assertThat(expression).isEqualTo(new BinaryOperation(
                NumberLiteral.of("1"),
                BinaryOperator.ADD,
                new BinaryOperation(VariableAccess.scalar("X"), BinaryOperator.MULTIPLY, NumberLiteral.of("2"))));
    }

    @Test
    void testCallWithSubscriptedArgument() {
        Expression expression = translate("F(B[1], C)");

        assertThat(expression).isInstanceOf(FunctionCall.class);
        FunctionCall call = (FunctionCall) expression;
        assertThat(call.getName()).isEqualTo("F");
        assertThat(call.getArguments()).containsExactly(
                new VariableAccess("B", NumberLiteral.of("1")),
                VariableAccess.scalar("C"));
        assertThat(printer.print(expression)).isEqualTo("F(B[1], C)");
    }

    @Test
    void testCallArguments() {
        assertThat(print("RND()")).isEqualTo("RND()");
        assertThat(print("MID(A$, 2, 3)")).isEqualTo("MID(A, 2, 3)");
        assertThat(print("ABS(SIN(X) - 1)")).isEqualTo("ABS((SIN(X) - 1))");
    }

    @Test
    void testSubscriptIsNotACall() {
        Expression expression = translate("A[I + 1]");

        assertThat(expression).isInstanceOf(VariableAccess.class);
        assertThat(((VariableAccess) expression).isSubscripted()).isTrue();
        assertThat(printer.print(expression)).isEqualTo("A[(I + 1)]");
    }

    @Test
    void testLiteralsAndConstants() {
        assertThat(translate("\"hi\"")).isEqualTo(new StringLiteral("hi"));
        assertThat(translate("PI")).isEqualTo(new ConstantReference("PI"));
        assertThat(translate("2.5")).isEqualTo(new NumberLiteral("2.5", 2.5));
        assertThat(print("\"a\" + \"b\"")).isEqualTo("(\"a\" + \"b\")");
    }

    @Test
    void testEmptySliceFails() {
        assertThatThrownBy(() -> translator.translate(List.of(), 10))
                .isInstanceOf(ParseException.class)
                .hasMessage("Expected expression");
    }

    @Test
    void testTrailingOperatorFails() {
        assertThatThrownBy(() -> translate("1 +"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("end of expression");
    }

    @Test
    void testMissingOperandFails() {
        assertThatThrownBy(() -> translate("* 2"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Expected operand");
        assertThatThrownBy(() -> translate("F(1,)"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Expected operand");
    }

    @Test
    void testMismatchedBracketsFail() {
        assertThatThrownBy(() -> translate("(1 + 2"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Expected ')'");
        assertThatThrownBy(() -> translate("1 + 2)"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Unexpected");
        assertThatThrownBy(() -> translate("A[1"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Expected ']'");
        assertThatThrownBy(() -> translate("A[1)"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Expected ']'");
    }

    @Test
    void testTopLevelCommaFails() {
        assertThatThrownBy(() -> translate("1, 2"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("','");
    }

    @Test
    void testFunctionWithoutParenthesesFails() {
        assertThatThrownBy(() -> translate("SIN 1"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Expected '('");
    }

    @Test
    void testNestingLimit() {
        ExpressionTranslator shallow = new ExpressionTranslator(3, 256);

        assertThat(printer.print(shallow.translate(slice("((1))"), 10))).isEqualTo("1");
        assertThatThrownBy(() -> shallow.translate(slice("((((1))))"), 10))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("nested deeper than 3");
    }

    @Test
    void testLengthLimit() {
        ExpressionTranslator shortOnly = new ExpressionTranslator(64, 5);

        assertThat(printer.print(shortOnly.translate(slice("1 + 2 + 3"), 10))).isEqualTo("((1 + 2) + 3)");
        assertThatThrownBy(() -> shortOnly.translate(slice("1 + 2 + 3 + 4"), 10))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("longer than 5 tokens");
    }

    @Test
    void testLongOperatorChainIsRejected() {
        String chain = "1" + " + 1".repeat(5000);

        assertThatThrownBy(() -> translate(chain))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("longer than 256 tokens");
    }

    @Test
    void testFailureCarriesLineNumber() {
        assertThatThrownBy(() -> translator.translate(slice("1 +"), 250))
                .isInstanceOf(ParseException.class)
                .extracting(e -> ((ParseException) e).getLineNumber())
                .isEqualTo(250);
    }

    private String print(String source) {
        return printer.print(translate(source));
    }

    private Expression translate(String source) {
        return translator.translate(slice(source), 10);
    }

    /**
     * Tokens of {@code source} as they would follow a PRINT keyword.
     */
    private List<Token> slice(String source) {
        List<Token> tokens = tokenizer.tokenize("10 PRINT " + source).getTokens();
        return tokens.subList(2, tokens.size());
    }
}
