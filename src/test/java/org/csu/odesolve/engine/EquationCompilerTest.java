package org.csu.odesolve.engine;

import org.csu.odesolve.common.exception.EquationException;
import org.csu.odesolve.common.exception.ErrorKind;
import org.csu.odesolve.compiler.lexer.ValidationMode;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 编译 + 规范化 + 求值的集成测试
 */
public class EquationCompilerTest {

    private static final double DELTA = 1e-9;
    private static final double[][] POINTS = {{0, 0}, {1, 1}, {-2.5, 3}, {10, -4}, {0.3, 0.7}};

    private final EquationCompiler strict = new EquationCompiler().verbose(true);
    private final EquationCompiler relaxed = new EquationCompiler(ValidationMode.RELAXED);

    private ErrorKind failureKind(EquationCompiler compiler, String equation) {
        EquationException e = assertThrows(EquationException.class, () -> compiler.parse(equation));
        System.out.println("Input: " + equation + " -> " + e.getKind() + ": " + e.getMessage());
        return e.getKind();
    }

    @Test
    void testConstantRightHandSide() {
        System.out.println("--- Test: y' = k ---");
        for (String k : new String[]{"5", "0", "2.5", "12,75"}) {
            CompiledEquation equation = relaxed.parse("y' = " + k);
            double expected = Double.parseDouble(k.replace(',', '.'));
            for (double[] p : POINTS) {
                assertEquals(expected, equation.compute(p[0], p[1]), DELTA, "y' = " + k);
            }
        }
    }

    @Test
    void testIdentityOfArgument() {
        CompiledEquation equation = relaxed.parse("y'=x");
        for (double[] p : POINTS) {
            assertEquals(p[0], equation.compute(p[0], p[1]), DELTA);
        }
    }

    @Test
    void testOperatorInverses() {
        System.out.println("--- Test: Operator inverses ---");
        double a = 3;
        double b = 7;
        for (double[] p : POINTS) {
            assertEquals(b - a, relaxed.parse("y'+3=7").compute(p[0], p[1]), DELTA);
            assertEquals(b + a, relaxed.parse("y'-3=7").compute(p[0], p[1]), DELTA);
            assertEquals(b / a, relaxed.parse("3*y'=7").compute(p[0], p[1]), DELTA);
            assertEquals(Math.pow(b, 1 / a), relaxed.parse("y'^3=7").compute(p[0], p[1]), DELTA);
        }
    }

    @Test
    void testConcreteScenarios() {
        System.out.println("--- Test: Concrete scenarios ---");
        CompiledEquation sum = strict.parse("y'=x+y");
        assertEquals(1.0, sum.compute(0, 1), DELTA);
        assertEquals(2.0, sum.compute(1, 1), DELTA);

        CompiledEquation twice = relaxed.parse("y'=2*x");
        assertEquals(6.0, twice.compute(3, 100), DELTA);
        assertEquals(6.0, twice.compute(3, -42), DELTA);

        CompiledEquation half = relaxed.parse("y'*2=x");
        assertEquals("(x)/(2)", half.toExpressionString());
        assertEquals(5.0, half.compute(10, 0), DELTA);

        CompiledEquation exponential = strict.parse("Y' + Y = E ^ X");
        assertEquals(1.0, exponential.compute(0, 0), DELTA);
        assertEquals(Math.E - 1, exponential.compute(1, 1), DELTA);
    }

    @Test
    void testEvaluationIsRepeatable() {
        CompiledEquation equation = strict.parse("(y' - x) / 2 = y ^ 2");
        double first = equation.compute(0.5, 1.5);
        double second = equation.compute(0.5, 1.5);
        assertEquals(first, second);
        assertEquals(2 * 1.5 * 1.5 + 0.5, first, DELTA);
    }

    @Test
    void testMalformedInputRejection() {
        System.out.println("--- Test: Malformed input ---");
        assertTrue(Set.of(ErrorKind.NOT_AN_ODE, ErrorKind.NO_DIFFERENTIAL).contains(failureKind(strict, "x=y")));
        assertTrue(Set.of(ErrorKind.NOT_AN_ODE, ErrorKind.NO_DIFFERENTIAL).contains(failureKind(relaxed, "x=y")));
        assertEquals(ErrorKind.NO_EQUATION, failureKind(strict, "y' + x + y"));
        // 词法校验先于语法分析: x'=y 中 y 只出现一次
        assertEquals(ErrorKind.NOT_AN_ODE, failureKind(strict, "x'=y"));
        assertEquals(ErrorKind.ARGUMENT_DIFFERENTIATED, failureKind(strict, "x'+y'=y"));
        assertEquals(ErrorKind.NOT_AN_ODE, failureKind(strict, "y'=x"));
        assertEquals(ErrorKind.NO_ARGUMENT, failureKind(strict, "y'=5"));
        assertEquals(ErrorKind.SYNTAX_ERROR, failureKind(strict, "y'=x+*y"));
        assertEquals(ErrorKind.UNSUPPORTED_EQUATION, failureKind(strict, "y'=x=y"));
    }

    @Test
    void testTryParse() {
        System.out.println("--- Test: tryParse ---");
        ParseResult ok = strict.tryParse("y'=x*y");
        assertTrue(ok.isSuccess());
        assertEquals("y' = (x)*(y)", ok.getEquation().orElseThrow().toString());
        assertTrue(ok.getErrorKind().isEmpty());

        ParseResult failed = strict.tryParse("y'=x+y#");
        assertFalse(failed.isSuccess());
        assertEquals(ErrorKind.UNDEFINED_LEXEME, failed.getErrorKind().orElseThrow());
        assertTrue(failed.getMessage().contains("position 6"), failed.getMessage());
        assertTrue(failed.getEquation().isEmpty());
        assertInstanceOf(ParseResult.Failure.class, failed);
        assertInstanceOf(ParseResult.Success.class, ok);
    }

    @Test
    void testNumericFailurePropagates() {
        CompiledEquation equation = strict.parse("y' = y / x");
        EquationException e = assertThrows(EquationException.class, () -> equation.compute(0, 1));
        assertEquals(ErrorKind.NUMERIC_ERROR, e.getKind());
        assertEquals(2.0, equation.compute(2, 4), DELTA);
    }

    @Test
    void testSourceIsNormalizedText() {
        CompiledEquation equation = strict.parse(" Y' = X + Y ");
        assertEquals("y'=x+y", equation.source());
        assertEquals(ValidationMode.STRICT, strict.getMode());
    }
}
