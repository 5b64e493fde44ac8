package org.csu.odesolve.compiler.parser.ast;

import org.csu.odesolve.compiler.lexer.TokenType;

import java.util.List;

/**
 * AST 节点: 一元负号, e.g. -x
 */
public record NegationNode(ExpressionNode operand) implements ExpressionNode {

    @Override
    public TokenType type() {
        return TokenType.NEGATE;
    }

    @Override
    public List<ExpressionNode> children() {
        return List.of(operand);
    }
}
