package org.csu.odesolve.compiler.parser.ast;

import org.csu.odesolve.compiler.lexer.TokenType;

import java.util.List;

/**
 * 所有 AST 节点的公共接口。
 * 节点都是不可变的 record，子节点的个数由具体类型决定。
 */
public sealed interface ExpressionNode
        permits NumberNode, EulerNode, VariableNode, NegationNode, DerivativeNode, BinaryExpressionNode, EquationNode {

    TokenType type();

    List<ExpressionNode> children();

    /**
     * 递归查找子树中是否存在指定类型的节点 (包括自身)
     */
    default boolean contains(TokenType type) {
        if (type() == type) {
            return true;
        }
        for (ExpressionNode child : children()) {
            if (child.contains(type)) {
                return true;
            }
        }
        return false;
    }
}
