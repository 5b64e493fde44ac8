package org.csu.odesolve.compiler.parser.ast;

import org.csu.odesolve.compiler.lexer.TokenType;

import java.util.List;

/**
 * AST 节点: 自然常数 e
 */
public record EulerNode() implements ExpressionNode {

    @Override
    public TokenType type() {
        return TokenType.EULER;
    }

    @Override
    public List<ExpressionNode> children() {
        return List.of();
    }
}
