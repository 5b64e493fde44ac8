package org.csu.odesolve.cli;

import org.csu.odesolve.compiler.lexer.ValidationMode;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 交互式命令行的测试, 用内存中的输入输出流模拟用户
 */
public class OdeShellTest {

    private String run(String input, ValidationMode mode) throws Exception {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        new OdeShell(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)), out, mode).run();
        String output = buffer.toString(StandardCharsets.UTF_8);
        System.out.println(output);
        return output;
    }

    private static int countOccurrences(String text, String fragment) {
        int count = 0;
        int from = text.indexOf(fragment);
        while (from >= 0) {
            count++;
            from = text.indexOf(fragment, from + fragment.length());
        }
        return count;
    }

    @Test
    void testFullSessionWithRetries() throws Exception {
        System.out.println("--- Running test: testFullSessionWithRetries ---");
        String input = String.join("\n",
                "y'=x",          // STRICT 模式下不是 ODE
                "y' = x + y",
                "0 1",
                "0",             // 步数必须大于 0
                "2",
                "0, 1",
                "3",             // Runge-Kutta
                "e") + "\n";
        String output = run(input, ValidationMode.STRICT);

        assertTrue(output.contains("NotAnOde"), "Invalid equation should be reported");
        assertTrue(output.contains("Equation accepted: y' = (x)+(y)"));
        assertTrue(output.contains("InputError"), "Invalid step count should be reported");
        assertTrue(output.contains("[Solver] Solving with the Runge-Kutta 4th order method."));
        assertTrue(output.contains("| x   | y        |"), output);
        assertTrue(output.contains("| 0.0 | 1.000000 |"), output);
        assertEquals(1, countOccurrences(output, "| x   | y        |"), "Exactly one table should be printed");
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testOversizedStepCountIsRejected() throws Exception {
        System.out.println("--- Running test: testOversizedStepCountIsRejected ---");
        String input = String.join("\n",
                "y'=x+y",
                "0 1",
                "1e10",          // 不是整数
                "2147483647",    // 超过上限
                "2.5",
                "2",
                "0 1",
                "2",             // Euler-Cauchy
                "e") + "\n";
        String output = assertDoesNotThrow(() -> run(input, ValidationMode.STRICT));

        assertEquals(3, countOccurrences(output, "InputError"), output);
        assertTrue(output.contains("between 1 and 1000000"), output);
        assertTrue(output.contains("[Solver] Solving with the Euler-Cauchy method."), output);
        assertTrue(output.contains("| 0.5 |"), output);
        assertTrue(output.contains("| 1.0 |"), output);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testInitialConditionMustBeComputable() throws Exception {
        System.out.println("--- Running test: testInitialConditionMustBeComputable ---");
        String input = String.join("\n",
                "y' = y / x",
                "1 2",
                "4",
                "0 1",           // 除零
                "1 1",
                "2",             // Euler-Cauchy
                "*") + "\n";     // 换一个方程, 随后输入结束
        String output = run(input, ValidationMode.STRICT);

        assertTrue(output.contains("NumericError"), output);
        assertTrue(output.contains("Euler-Cauchy"), output);
        assertTrue(output.contains("| 1.00 | 1.000000 |"), output);
        // "*" 之后重新提示输入方程
        assertEquals(2, countOccurrences(output, "Enter a first-order ODE"), output);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testRelaxedModeAndEndOfInput() throws Exception {
        String output = run("y' = 2\n", ValidationMode.RELAXED);
        assertTrue(output.contains("Equation accepted: y' = 2"), output);
        assertFalse(output.contains("[Solver]"), output);
    }
}
