package com.conveyal.coverage.expression;

import com.conveyal.coverage.CoverageProcessException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExpressionParserTest {

    /** Run a script that needs no bands and return its scalar result. */
    private static double scalar (String source) {
        BandScript script = BandScript.compile("x", source);
        EvaluationScope scope = new EvaluationScope(Map.of(), System.nanoTime() + TimeUnit.SECONDS.toNanos(10), 1000);
        Value value = script.run(scope);
        assertTrue(value.isScalar());
        return ((Value.Scalar) value).value;
    }

    @Test
    void operatorPrecedence () {
        assertEquals(7, scalar("1 + 2 * 3"));
        assertEquals(9, scalar("(1 + 2) * 3"));
        assertEquals(-4, scalar("-2 ** 2"));
        assertEquals(512, scalar("2 ** 3 ** 2"));
        assertEquals(1, scalar("1 < 2 and 3 >= 3"));
        assertEquals(0, scalar("not 1 or 0"));
    }

    @Test
    void moduloTakesSignOfDivisor () {
        assertEquals(1, scalar("7 % 3"));
        assertEquals(2, scalar("-7 % 3"));
    }

    @Test
    void statementsAndVariables () {
        assertEquals(6, scalar("x = 2; y = x * 3\ny"));
        assertEquals(6, scalar("x = 2\n\n\ny = x * 3\n"));
        assertEquals(4, scalar("x = 1\nreturn x + 3\nx = 100"));
    }

    @Test
    void newlinesInsideParenthesesDoNotEndStatements () {
        assertEquals(3, scalar("(1 +\n 2)"));
        assertEquals(2, scalar("max(1,\n 2)"));
    }

    @Test
    void commentsRunToEndOfLine () {
        assertEquals(2, scalar("# leading comment\n1 + 1 # trailing"));
    }

    @Test
    void ifElseChains () {
        assertEquals(20, scalar("if (1 > 2) { 10 } else if (2 > 1) { 20 } else { 30 }"));
        assertEquals(30, scalar("if (0) {\n 10\n}\nelse {\n 30\n}"));
        assertEquals(5, scalar("n = 0\nwhile (n < 5) { n = n + 1 }\nn"));
    }

    @Test
    void literalsAndFunctions () {
        assertEquals(1, scalar("isnan(nan)"));
        assertEquals(Double.POSITIVE_INFINITY, scalar("inf"));
        assertEquals(0.25, scalar(".25"));
        assertEquals(1500, scalar("1.5e3"));
        assertEquals(2, scalar("clip(5, 0, 2)"));
        assertEquals(3, scalar("round(sqrt(9.2))"));
    }

    @Test
    void wrongArityIsRuntimeError () {
        CoverageProcessException e = assertThrows(CoverageProcessException.class, () -> scalar("clip(1, 2)"));
        assertEquals(CoverageProcessException.Type.EXPRESSION_RUNTIME_ERROR, e.type);
    }

    @ParameterizedTest
    @ValueSource(strings = {"1 +", "x = ", "", "  \n# only a comment\n", "1 2", "(1 + 2", "foo(1)", "a $ b",
            "if 1 { 2 }", "while (1) 2", "B04[1]", "1 != ", "= 3"})
    void malformedScriptsAreSyntaxErrors (String source) {
        CoverageProcessException e = assertThrows(CoverageProcessException.class,
                () -> BandScript.compile("bad", source));
        assertEquals(CoverageProcessException.Type.EXPRESSION_SYNTAX_ERROR, e.type);
        assertTrue(e.getMessage().contains("bad"));
    }

    @Test
    void deepNestingIsRejected () {
        String source = "(".repeat(150) + "1" + ")".repeat(150);
        CoverageProcessException e = assertThrows(CoverageProcessException.class,
                () -> ExpressionParser.parse(source));
        assertEquals(CoverageProcessException.Type.EXPRESSION_SYNTAX_ERROR, e.type);
    }

    @Test
    void longOperatorChainsAreRejected () {
        CoverageProcessException e = assertThrows(CoverageProcessException.class,
                () -> BandScript.compile("out", "B04" + " + B04".repeat(200_000)));
        assertEquals(CoverageProcessException.Type.EXPRESSION_SYNTAX_ERROR, e.type);
        assertThrows(CoverageProcessException.class, () -> BandScript.compile("out", "1" + " * 1".repeat(600)));
    }

    @Test
    void moderateOperatorChainsStillRun () {
        assertEquals(301, scalar("1" + " + 1".repeat(300)));
    }

    @Test
    void longElseIfChainsAreRejected () {
        String source = "if (0) { 0 }" + " else if (0) { 0 }".repeat(150) + " else { 1 }";
        CoverageProcessException e = assertThrows(CoverageProcessException.class,
                () -> BandScript.compile("out", source));
        assertEquals(CoverageProcessException.Type.EXPRESSION_SYNTAX_ERROR, e.type);
        assertEquals(1, scalar("if (0) { 0 }" + " else if (0) { 0 }".repeat(20) + " else { 1 }"));
    }

    @Test
    void onlyAsciiDigitsFormNumbers () {
        // Arabic-Indic digit three.
        CoverageProcessException e = assertThrows(CoverageProcessException.class,
                () -> BandScript.compile("out", "B04 * \u0663"));
        assertEquals(CoverageProcessException.Type.EXPRESSION_SYNTAX_ERROR, e.type);
    }

    @Test
    void freeIdentifiersExcludeLocals () {
        BandScript script = BandScript.compile("ndvi", "t = B08 - B04\nt / (B08 + B04)");
        assertEquals(List.of("B08", "B04"), List.copyOf(script.freeIdentifiers()));
    }

    @Test
    void conditionallyAssignedNamesStayFree () {
        BandScript script = BandScript.compile("y", "if (B04 > 0) { y = 1 }\ny");
        assertEquals(Set.of("B04", "y"), script.freeIdentifiers());
        BandScript both = BandScript.compile("y", "if (B04 > 0) { y = 1 } else { y = 2 }\ny");
        assertEquals(Set.of("B04"), both.freeIdentifiers());
    }

    @Test
    void functionNamesAreNotIdentifiers () {
        assertEquals(Set.of("B04"), BandScript.compile("m", "max(B04, 0) + abs(B04)").freeIdentifiers());
    }

    @Test
    void datasetListReferencesResolveToBandNames () {
        BandScript script = BandScript.compile("ndvi", "(ds[0].B08 - ds[0].B04) / (ds[0].B08 + ds[0].B04)");
        assertEquals(Set.of("B08", "B04"), script.freeIdentifiers());
    }

}
