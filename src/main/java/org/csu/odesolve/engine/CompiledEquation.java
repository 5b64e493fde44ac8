package org.csu.odesolve.engine;

import org.csu.odesolve.compiler.parser.ast.ExpressionNode;

/**
 * 编译完成的方程 y' = f(x, y)。
 *
 * @param source     用户输入的原始方程
 * @param expression 规范化后的 f(x, y) 语法树
 */
public record CompiledEquation(String source, ExpressionNode expression) implements OdeFunction {

    @Override
    public double compute(double x, double y) {
        return ExpressionEvaluator.evaluate(expression, x, y);
    }

    public String toExpressionString() {
        return ExpressionPrinter.print(expression);
    }

    @Override
    public String toString() {
        return "y' = " + toExpressionString();
    }
}
