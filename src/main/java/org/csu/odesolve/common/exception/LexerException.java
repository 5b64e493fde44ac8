package org.csu.odesolve.common.exception;

/**
 * 词法分析阶段的异常 (包括对原始字符串的预校验)
 */
public class LexerException extends EquationException {

    public LexerException(ErrorKind kind, String message) {
        super(kind, message);
    }

    public static LexerException undefinedLexeme(char ch, int position) {
        return new LexerException(ErrorKind.UNDEFINED_LEXEME,
                String.format("Undefined lexeme '%c' at position %d", ch, position));
    }
}
