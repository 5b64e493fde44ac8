package org.csu.odesolve.compiler.parser.ast;

import org.csu.odesolve.compiler.lexer.TokenType;

import java.util.List;

/**
 * AST 节点: 导数标记，表示其唯一子表达式对 x 的导数。
 * 该节点不可求值，规范化之后不应再出现在树中。
 */
public record DerivativeNode(ExpressionNode operand) implements ExpressionNode {

    @Override
    public TokenType type() {
        return TokenType.PRIME;
    }

    @Override
    public List<ExpressionNode> children() {
        return List.of(operand);
    }
}
