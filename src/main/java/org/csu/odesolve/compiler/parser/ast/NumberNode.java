package org.csu.odesolve.compiler.parser.ast;

import org.csu.odesolve.compiler.lexer.TokenType;

import java.util.List;

/**
 * AST 节点: 数字字面量, e.g. "2", "0.5"
 */
public record NumberNode(String literal) implements ExpressionNode {

    public static final NumberNode ZERO = new NumberNode("0");
    public static final NumberNode ONE = new NumberNode("1");

    @Override
    public TokenType type() {
        return TokenType.NUMBER;
    }

    @Override
    public List<ExpressionNode> children() {
        return List.of();
    }
}
