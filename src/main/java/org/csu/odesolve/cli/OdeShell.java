package org.csu.odesolve.cli;

import org.csu.odesolve.cli.tool.SolutionTableFormatter;
import org.csu.odesolve.common.exception.EquationException;
import org.csu.odesolve.common.exception.ErrorKind;
import org.csu.odesolve.compiler.lexer.ValidationMode;
import org.csu.odesolve.engine.CompiledEquation;
import org.csu.odesolve.engine.EquationCompiler;
import org.csu.odesolve.engine.ParseResult;
import org.csu.odesolve.solver.InitialValueProblem;
import org.csu.odesolve.solver.OdeSolver;
import org.csu.odesolve.solver.SolutionPoint;
import org.csu.odesolve.solver.SolverMethod;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * 交互式命令行: 读取方程、区间、步数和初值，再选择数值解法输出结果表格。
 * 每一步输入错误都会重新提示，输入流结束时退出。
 */
public class OdeShell {

    private static final String EXIT_KEY = "e";

    private final BufferedReader in;
    private final PrintStream out;
    private final EquationCompiler compiler;

    public OdeShell(InputStream in, PrintStream out, ValidationMode mode) {
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
        this.compiler = new EquationCompiler(mode);
    }

    public static void main(String[] args) {
        ValidationMode mode = ValidationMode.STRICT;
        for (String arg : args) {
            if (arg.equalsIgnoreCase("--relaxed")) {
                mode = ValidationMode.RELAXED;
            }
        }
        try {
            new OdeShell(System.in, System.out, mode).run();
        } catch (IOException e) {
            System.err.println("Error reading input: " + e.getMessage());
        }
        System.out.println("Bye!");
    }

    public void run() throws IOException {
        while (true) {
            CompiledEquation equation = readEquation();
            if (equation == null) return;
            double[] bounds = readNumbers("Enter the interval bounds (a b):", 2);
            if (bounds == null) return;
            Integer steps = readSteps();
            if (steps == null) return;
            double[] initial = readInitialCondition(equation);
            if (initial == null) return;

            InitialValueProblem problem = new InitialValueProblem(initial[0], initial[1], bounds[0], bounds[1], steps);
            if (!chooseMethodAndSolve(equation, problem)) {
                return;
            }
        }
    }

    private CompiledEquation readEquation() throws IOException {
        while (true) {
            String line = prompt("Enter a first-order ODE using x, y and y':");
            if (line == null) return null;
            ParseResult result = compiler.tryParse(line);
            if (result.isSuccess()) {
                CompiledEquation equation = result.getEquation().orElseThrow();
                out.println("Equation accepted: " + equation);
                return equation;
            }
            printError(result.getErrorKind().map(ErrorKind::displayName).orElse("Error"), result.getMessage());
        }
    }

    private Integer readSteps() throws IOException {
        while (true) {
            String line = prompt("Enter the number of steps inside the interval (n):");
            if (line == null) return null;
            int steps;
            try {
                steps = Integer.parseInt(line.trim());
            } catch (NumberFormatException e) {
                printError("InputError", "the number of steps must be an integer: " + line.trim());
                continue;
            }
            if (steps <= 0 || steps > InitialValueProblem.MAX_STEPS) {
                printError("InputError", "the number of steps must be between 1 and " + InitialValueProblem.MAX_STEPS);
                continue;
            }
            return steps;
        }
    }

    private double[] readInitialCondition(CompiledEquation equation) throws IOException {
        while (true) {
            double[] initial = readNumbers("Enter the initial condition (x0 y0):", 2);
            if (initial == null) return null;
            try {
                equation.compute(initial[0], initial[1]);
                return initial;
            } catch (EquationException e) {
                printError(e.getKind().displayName(), "the equation is not defined at the initial condition: " + e.getMessage());
            }
        }
    }

    /**
     * @return false 表示用户选择退出
     */
    private boolean chooseMethodAndSolve(CompiledEquation equation, InitialValueProblem problem) throws IOException {
        while (true) {
            String choice = prompt("Choose a method:\n1) Adams method\n2) Euler-Cauchy method\n3) Runge-Kutta method\n"
                    + EXIT_KEY + ") Exit\n*) Solve another equation");
            if (choice == null || choice.trim().equalsIgnoreCase(EXIT_KEY)) {
                return false;
            }
            SolverMethod method = SolverMethod.fromKey(choice).orElse(null);
            if (method == null) {
                return true;
            }
            OdeSolver solver = method.createSolver();
            out.println("[Solver] Solving with the " + solver.getName() + " method.");
            try {
                List<SolutionPoint> points = solver.solve(equation, problem);
                out.println(SolutionTableFormatter.format(points, problem.stepSize()));
            } catch (EquationException e) {
                printError(e.getKind().displayName(), e.getMessage());
            }
        }
    }

    private double[] readNumbers(String message, int count) throws IOException {
        while (true) {
            String line = prompt(message);
            if (line == null) return null;
            String[] parts = line.trim().split("[\\s,;]+");
            if (parts.length != count || parts[0].isEmpty()) {
                printError("InputError", "expected " + count + " value(s)");
                continue;
            }
            try {
                double[] values = new double[count];
                for (int i = 0; i < count; i++) {
                    values[i] = Double.parseDouble(parts[i]);
                }
                return values;
            } catch (NumberFormatException e) {
                printError("InputError", "not a number: " + e.getMessage());
            }
        }
    }

    private String prompt(String message) throws IOException {
        out.println(message);
        out.print("> ");
        out.flush();
        return in.readLine();
    }

    private void printError(String kind, String message) {
        out.println();
        out.println("\t" + kind + ": " + message);
        out.println();
    }
}
