package org.csu.odesolve.engine;

import org.csu.odesolve.common.exception.ErrorKind;
import org.csu.odesolve.common.exception.EvaluationException;
import org.csu.odesolve.compiler.parser.ast.*;

/**
 * 表达式求值器。
 * 对规范化后的语法树计算 f(x, y)，不分配新节点，也不修改树，可以被多个线程同时调用。
 */
public class ExpressionEvaluator {

    public static double evaluate(ExpressionNode expression, double x, double y) {
        if (expression instanceof NumberNode number) {
            return Double.parseDouble(number.literal());
        }
        if (expression instanceof EulerNode) {
            return Math.E;
        }
        if (expression instanceof VariableNode variable) {
            return switch (variable.type()) {
                case ARGUMENT -> x;
                case FUNCTION -> y;
                default -> throw new IllegalStateException("Unexpected variable type: " + variable.type());
            };
        }
        if (expression instanceof NegationNode negation) {
            return -evaluate(negation.operand(), x, y);
        }
        if (expression instanceof BinaryExpressionNode node) {
            double left = evaluate(node.left(), x, y);
            double right = evaluate(node.right(), x, y);
            return switch (node.operator()) {
                case PLUS -> left + right;
                case MINUS -> left - right;
                case MULTIPLY -> left * right;
                case DIVIDE -> divide(left, right);
                case POWER -> power(left, right);
                default -> throw new IllegalStateException("Unsupported arithmetic operator: " + node.operator());
            };
        }
        if (expression instanceof DerivativeNode) {
            throw new EvaluationException(ErrorKind.DERIVATIVE_EVALUATION,
                    "The value of a derivative cannot be computed, check that the equation tree was normalized");
        }
        if (expression instanceof EquationNode) {
            throw new EvaluationException(ErrorKind.DERIVATIVE_EVALUATION,
                    "An equation cannot be evaluated, check that the equation tree was normalized");
        }
        throw new UnsupportedOperationException("Unsupported expression type: " + expression.getClass().getSimpleName());
    }

    private static double divide(double left, double right) {
        if (right == 0.0) {
            throw new EvaluationException(ErrorKind.NUMERIC_ERROR, "Division by zero");
        }
        return left / right;
    }

    private static double power(double base, double exponent) {
        if (base == 0.0 && exponent < 0) {
            throw new EvaluationException(ErrorKind.NUMERIC_ERROR,
                    "Zero cannot be raised to a negative power (" + exponent + ")");
        }
        double result = Math.pow(base, exponent);
        if (Double.isNaN(result) && !Double.isNaN(base) && !Double.isNaN(exponent)) {
            throw new EvaluationException(ErrorKind.NUMERIC_ERROR,
                    "Power is not defined for base " + base + " and exponent " + exponent);
        }
        if (Double.isInfinite(result) && Double.isFinite(base) && Double.isFinite(exponent)) {
            throw new EvaluationException(ErrorKind.NUMERIC_ERROR,
                    "Power overflow for base " + base + " and exponent " + exponent);
        }
        return result;
    }
}
