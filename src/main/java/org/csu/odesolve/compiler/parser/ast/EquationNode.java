package org.csu.odesolve.compiler.parser.ast;

import org.csu.odesolve.compiler.lexer.TokenType;

import java.util.List;

/**
 * AST 节点: 方程 left = right, 语法树的根节点
 */
public record EquationNode(ExpressionNode left, ExpressionNode right) implements ExpressionNode {

    @Override
    public TokenType type() {
        return TokenType.EQUAL;
    }

    @Override
    public List<ExpressionNode> children() {
        return List.of(left, right);
    }
}
