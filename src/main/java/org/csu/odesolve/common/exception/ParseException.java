package org.csu.odesolve.common.exception;

import org.csu.odesolve.compiler.lexer.Token;

/**
 * @author hidyouth
 * @description: 语法分析阶段的异常, 默认种类为 SYNTAX_ERROR
 */
public class ParseException extends EquationException {

    public ParseException(String message) {
        super(ErrorKind.SYNTAX_ERROR, message);
    }

    public ParseException(ErrorKind kind, String message) {
        super(kind, message);
    }

    public ParseException(Token token, String expected) {
        super(ErrorKind.SYNTAX_ERROR, String.format("Syntax Error at position %d: Expected %s, but found '%s' (%s)",
                token.position(),
                expected,
                token.lexeme(),
                token.type()));
    }
}
