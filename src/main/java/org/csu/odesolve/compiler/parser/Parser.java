package org.csu.odesolve.compiler.parser;

import org.csu.odesolve.common.exception.ErrorKind;
import org.csu.odesolve.common.exception.ParseException;
import org.csu.odesolve.compiler.lexer.Token;
import org.csu.odesolve.compiler.lexer.TokenType;
import org.csu.odesolve.compiler.parser.ast.*;

import java.util.List;

/**
 * @author hidyouth
 *
 * 语法分析器
 * 采用递归下降法，将Token流转换为以 EquationNode 为根的抽象语法树(AST)。
 *
 * 优先级从低到高: 等式 -> 加减 -> 乘除 -> 乘方 -> 一元负号 -> 基本项。
 * 每一层都是左结合的，乘方也不例外。
 */
public class Parser {

    private final List<Token> tokens;
    private int position = 0;

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    public EquationNode parse() {
        ExpressionNode root = parseEquality();
        consume(TokenType.EOF, "end of equation");
        if (!(root instanceof EquationNode equation)) {
            throw new ParseException("Syntax Error: the expression is not an equation");
        }
        return equation;
    }

    private ExpressionNode parseEquality() {
        ExpressionNode left = parseSum();
        while (match(TokenType.EQUAL)) {
            ExpressionNode right = parseSum();
            left = new EquationNode(left, right);
        }
        return left;
    }

    private ExpressionNode parseSum() {
        ExpressionNode left = parseProduct();
        while (match(TokenType.PLUS, TokenType.NEGATE)) {
            // 词法层面的 '-' 在这里被解释为二元减法
            TokenType operator = previous().type() == TokenType.NEGATE ? TokenType.MINUS : TokenType.PLUS;
            ExpressionNode right = parseProduct();
            left = new BinaryExpressionNode(left, operator, right);
        }
        return left;
    }

    private ExpressionNode parseProduct() {
        ExpressionNode left = parsePower();
        while (match(TokenType.MULTIPLY, TokenType.DIVIDE)) {
            TokenType operator = previous().type();
            ExpressionNode right = parsePower();
            left = new BinaryExpressionNode(left, operator, right);
        }
        return left;
    }

    // 注意: 2^3^2 按 (2^3)^2 处理
    private ExpressionNode parsePower() {
        ExpressionNode left = parseUnary();
        while (match(TokenType.POWER)) {
            ExpressionNode right = parseUnary();
            left = new BinaryExpressionNode(left, TokenType.POWER, right);
        }
        return left;
    }

    private ExpressionNode parseUnary() {
        if (match(TokenType.NEGATE)) {
            return new NegationNode(parsePrimaryExpression());
        }
        return parsePrimaryExpression();
    }

    private ExpressionNode parsePrimaryExpression() {
        if (match(TokenType.ARGUMENT)) {
            if (check(TokenType.PRIME)) {
                throw new ParseException(ErrorKind.ARGUMENT_DIFFERENTIATED,
                        "The argument 'x' cannot be differentiated (position " + previous().position() + ")");
            }
            return VariableNode.argument();
        }
        if (check(TokenType.NUMBER)) {
            return parseNumber();
        }
        if (match(TokenType.FUNCTION)) {
            ExpressionNode function = VariableNode.function();
            if (match(TokenType.PRIME)) {
                return new DerivativeNode(function);
            }
            return function;
        }
        if (match(TokenType.EULER)) {
            return new EulerNode();
        }
        consume(TokenType.LPAREN, "an expression (a number, x, y, e or '(')");
        ExpressionNode expr = parseSum();
        consume(TokenType.RPAREN, "')' after expression");
        if (match(TokenType.PRIME)) {
            return new DerivativeNode(expr);
        }
        return expr;
    }

    /**
     * 把连续的数字和小数点折叠成一个数字字面量。
     * 常数的导数在这里直接折叠为 0。
     */
    private NumberNode parseNumber() {
        Token first = advance();
        StringBuilder literal = new StringBuilder(first.lexeme());
        while (match(TokenType.NUMBER, TokenType.POINT)) {
            Token token = previous();
            literal.append(token.type() == TokenType.POINT ? "." : token.lexeme());
        }
        if (match(TokenType.PRIME)) {
            return NumberNode.ZERO;
        }
        String text = literal.toString();
        try {
            Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new ParseException(String.format("Syntax Error at position %d: Malformed number '%s'",
                    first.position(), text));
        }
        return new NumberNode(text);
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (peek().type() == type) return advance();
        throw new ParseException(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private Token advance() {
        Token current = peek();
        if (!isAtEnd()) position++;
        return current;
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(position);
    }

    private Token previous() {
        return tokens.get(position - 1);
    }
}
