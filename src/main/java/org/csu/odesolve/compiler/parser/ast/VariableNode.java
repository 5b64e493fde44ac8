package org.csu.odesolve.compiler.parser.ast;

import org.csu.odesolve.compiler.lexer.TokenType;

import java.util.List;

/**
 * AST 节点: 自变量 x (ARGUMENT) 或因变量 y (FUNCTION)
 */
public record VariableNode(TokenType type, String name) implements ExpressionNode {

    public VariableNode {
        if (type != TokenType.ARGUMENT && type != TokenType.FUNCTION) {
            throw new IllegalArgumentException("Not a variable type: " + type);
        }
    }

    public static VariableNode argument() {
        return new VariableNode(TokenType.ARGUMENT, "x");
    }

    public static VariableNode function() {
        return new VariableNode(TokenType.FUNCTION, "y");
    }

    @Override
    public List<ExpressionNode> children() {
        return List.of();
    }
}
