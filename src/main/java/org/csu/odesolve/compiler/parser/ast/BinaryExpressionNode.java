package org.csu.odesolve.compiler.parser.ast;

import org.csu.odesolve.compiler.lexer.TokenType;

import java.util.List;
import java.util.Set;

/**
 * AST 节点: 表示一个二元运算表达式 (e.g., x + y)
 */
public record BinaryExpressionNode(
        ExpressionNode left,
        TokenType operator,
        ExpressionNode right
) implements ExpressionNode {

    private static final Set<TokenType> OPERATORS = Set.of(
            TokenType.PLUS, TokenType.MINUS, TokenType.MULTIPLY, TokenType.DIVIDE, TokenType.POWER
    );

    public BinaryExpressionNode {
        if (!OPERATORS.contains(operator)) {
            throw new IllegalArgumentException("Not a binary operator: " + operator);
        }
    }

    @Override
    public TokenType type() {
        return operator;
    }

    @Override
    public List<ExpressionNode> children() {
        return List.of(left, right);
    }

    /**
     * 返回另一侧的操作数
     * @param leftSide 为 true 时表示当前关注的是左操作数
     */
    public ExpressionNode sibling(boolean leftSide) {
        return leftSide ? right : left;
    }
}
