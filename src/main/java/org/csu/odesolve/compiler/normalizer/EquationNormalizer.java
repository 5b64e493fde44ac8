package org.csu.odesolve.compiler.normalizer;

import org.csu.odesolve.common.exception.ErrorKind;
import org.csu.odesolve.common.exception.ParseException;
import org.csu.odesolve.compiler.lexer.TokenType;
import org.csu.odesolve.compiler.parser.ast.*;

/**
 * 方程规范化器。
 *
 * 把 "左边 = 右边" 形式的方程改写为 y' = f(x, y)：
 * 找到含有导数标记的一侧，沿着从该侧根节点到导数标记的路径向下走，
 * 每经过一个运算符，就对另一侧的表达式施加对应的逆运算。
 * 整个过程只生成新节点，不修改输入的语法树。
 */
public class EquationNormalizer {

    public ExpressionNode normalize(EquationNode equation) {
        boolean derivativeOnRight = equation.right().contains(TokenType.PRIME);
        ExpressionNode target = derivativeOnRight ? equation.right() : equation.left();
        ExpressionNode source = derivativeOnRight ? equation.left() : equation.right();

        if (!target.contains(TokenType.PRIME)) {
            throw new ParseException(ErrorKind.NO_DIFFERENTIAL, "The equation does not contain a derivative");
        }

        ExpressionNode result = isolate(target, source);

        if (result.contains(TokenType.PRIME) || result.contains(TokenType.EQUAL)) {
            throw new ParseException(ErrorKind.UNSUPPORTED_EQUATION,
                    "The derivative cannot be isolated: the other side still contains a derivative or an equation");
        }
        return result;
    }

    /**
     * 沿路径向下, 直到遇到导数标记。
     *
     * @param node 当前所在的节点, 其子树中一定包含导数标记
     * @param acc  已经改写过的另一侧表达式
     */
    private ExpressionNode isolate(ExpressionNode node, ExpressionNode acc) {
        if (node instanceof DerivativeNode derivative) {
            if (derivative.operand().type() != TokenType.FUNCTION) {
                throw new ParseException(ErrorKind.UNSUPPORTED_EQUATION,
                        "Only the derivative of the function 'y' is supported");
            }
            return acc;
        }
        if (node instanceof NegationNode negation) {
            return isolate(negation.operand(), new NegationNode(acc));
        }
        if (node instanceof BinaryExpressionNode binary) {
            // 深度优先, 左子树优先
            boolean leftSide = binary.left().contains(TokenType.PRIME);
            ExpressionNode next = leftSide ? binary.left() : binary.right();
            ExpressionNode sibling = binary.sibling(leftSide);
            return isolate(next, invert(binary.operator(), leftSide, sibling, acc));
        }
        if (node instanceof EquationNode) {
            throw new ParseException(ErrorKind.UNSUPPORTED_EQUATION, "Chained equations are not supported");
        }
        // 叶子节点不可能位于通往导数标记的路径上
        throw new IllegalStateException("Node on derivative path has no derivative below it: " + node);
    }

    private ExpressionNode invert(TokenType operator, boolean leftSide, ExpressionNode sibling, ExpressionNode acc) {
        return switch (operator) {
            // y' - a = b  ->  y' = a + b ;  a - y' = b  ->  y' = a - b
            case MINUS -> leftSide
                    ? new BinaryExpressionNode(sibling, TokenType.PLUS, acc)
                    : new BinaryExpressionNode(sibling, TokenType.MINUS, acc);
            case PLUS -> new BinaryExpressionNode(acc, TokenType.MINUS, sibling);
            case MULTIPLY -> new BinaryExpressionNode(acc, TokenType.DIVIDE, sibling);
            case DIVIDE -> leftSide
                    ? new BinaryExpressionNode(sibling, TokenType.MULTIPLY, acc)
                    : new BinaryExpressionNode(sibling, TokenType.DIVIDE, acc);
            // 不区分底数与指数, 统一开 sibling 次方
            case POWER -> new BinaryExpressionNode(acc, TokenType.POWER,
                    new BinaryExpressionNode(NumberNode.ONE, TokenType.DIVIDE, sibling));
            default -> throw new IllegalStateException("Unexpected operator on derivative path: " + operator);
        };
    }
}
