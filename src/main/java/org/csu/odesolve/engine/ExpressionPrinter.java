package org.csu.odesolve.engine;

import org.csu.odesolve.common.exception.ErrorKind;
import org.csu.odesolve.common.exception.EvaluationException;
import org.csu.odesolve.compiler.lexer.TokenType;
import org.csu.odesolve.compiler.parser.ast.*;

import java.util.List;

/**
 * 把语法树转换为字符串。
 */
public class ExpressionPrinter {

    /**
     * 完全加括号的中缀形式, e.g. (x)+(y), -(x)
     */
    public static String print(ExpressionNode node) {
        if (node instanceof DerivativeNode) {
            throw new EvaluationException(ErrorKind.DERIVATIVE_EVALUATION,
                    "The derivative cannot be printed, check the tree for reordering");
        }
        List<ExpressionNode> children = node.children();
        if (children.size() == 1) {
            return symbol(node) + "(" + print(children.get(0)) + ")";
        }
        if (children.size() == 2) {
            return "(" + print(children.get(0)) + ")" + symbol(node) + "(" + print(children.get(1)) + ")";
        }
        return symbol(node);
    }

    /**
     * 缩进格式的调试输出
     */
    public static String dump(ExpressionNode node) {
        StringBuilder sb = new StringBuilder();
        dump(node, 0, sb);
        return sb.toString();
    }

    private static void dump(ExpressionNode node, int depth, StringBuilder sb) {
        sb.append("    ".repeat(depth))
                .append("Node(").append(node.type()).append(", ").append(symbol(node)).append(")");
        for (ExpressionNode child : node.children()) {
            sb.append("\n");
            dump(child, depth + 1, sb);
        }
    }

    private static String symbol(ExpressionNode node) {
        if (node instanceof NumberNode number) {
            return number.literal();
        }
        if (node instanceof VariableNode variable) {
            return variable.name();
        }
        return symbol(node.type());
    }

    private static String symbol(TokenType type) {
        return switch (type) {
            case EULER -> "e";
            case PLUS -> "+";
            case NEGATE, MINUS -> "-";
            case MULTIPLY -> "*";
            case DIVIDE -> "/";
            case POWER -> "^";
            case PRIME -> "'";
            case EQUAL -> "=";
            default -> type.name();
        };
    }
}
