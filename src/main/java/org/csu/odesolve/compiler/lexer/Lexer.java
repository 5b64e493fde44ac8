package org.csu.odesolve.compiler.lexer;

import org.csu.odesolve.common.exception.ErrorKind;
import org.csu.odesolve.common.exception.LexerException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * @author hidyouth
 *
 * 词法分析器 (Lexer/Scanner)
 *
 * 先对整个方程字符串做结构校验，再逐字符转换为 Token 序列。
 * 数字在这里不合并，每个字符对应一个 Token，多位数字由语法分析器折叠。
 */
public class Lexer {

    private static final char EQUAL = '=';
    private static final char ARGUMENT = 'x';
    private static final char FUNCTION = 'y';
    private static final char PRIME = '\'';

    // 单字符符号表
    private static final Map<Character, TokenType> symbols;

    static {
        symbols = new HashMap<>();
        symbols.put('(', TokenType.LPAREN);
        symbols.put(')', TokenType.RPAREN);
        symbols.put('+', TokenType.PLUS);
        symbols.put('-', TokenType.NEGATE);
        symbols.put('*', TokenType.MULTIPLY);
        symbols.put('/', TokenType.DIVIDE);
        symbols.put('^', TokenType.POWER);
        symbols.put(PRIME, TokenType.PRIME);
        symbols.put('.', TokenType.POINT);
        symbols.put(',', TokenType.POINT);
        symbols.put(EQUAL, TokenType.EQUAL);
        symbols.put(ARGUMENT, TokenType.ARGUMENT);
        symbols.put(FUNCTION, TokenType.FUNCTION);
        symbols.put('e', TokenType.EULER);
    }

    private final String input;
    private final ValidationMode mode;

    public Lexer(String input) {
        this(input, ValidationMode.STRICT);
    }

    public Lexer(String input, ValidationMode mode) {
        this.input = normalize(input);
        this.mode = mode;
    }

    /**
     * 主方法，执行校验与词法分析并返回所有Token (以 EOF 结尾)
     * @return 不可变的 Token 列表
     */
    public List<Token> tokenize() {
        validate();

        List<Token> tokens = new ArrayList<>(input.length() + 1);
        for (int position = 0; position < input.length(); position++) {
            tokens.add(nextToken(position));
        }
        tokens.add(new Token(TokenType.EOF, "", input.length()));
        return Collections.unmodifiableList(tokens);
    }

    /**
     * 去掉所有空白并转为小写后的输入
     */
    public String getInput() {
        return input;
    }

    private Token nextToken(int position) {
        char currentChar = input.charAt(position);
        TokenType type = symbols.get(currentChar);
        if (type != null) {
            return new Token(type, String.valueOf(currentChar), position);
        }
        if (isDigit(currentChar)) {
            return new Token(TokenType.NUMBER, String.valueOf(currentChar), position);
        }
        throw LexerException.undefinedLexeme(currentChar, position);
    }

    // 校验顺序固定，每一步对应一种错误
    private void validate() {
        if (input.indexOf(EQUAL) < 0) {
            throw new LexerException(ErrorKind.NO_EQUATION, "The expression must contain an equation");
        }
        if (mode == ValidationMode.STRICT && input.indexOf(ARGUMENT) < 0) {
            throw new LexerException(ErrorKind.NO_ARGUMENT, "The equation must contain at least one argument 'x'");
        }
        int functionCount = countOccurrences(String.valueOf(FUNCTION));
        boolean functionCountValid = mode == ValidationMode.STRICT
                ? functionCount == 2
                : functionCount == 1 || functionCount == 2;
        if (!functionCountValid) {
            throw new LexerException(ErrorKind.NOT_AN_ODE, "The equation must contain the function 'y' and its derivative");
        }
        if (countOccurrences("" + FUNCTION + PRIME) != 1) {
            throw new LexerException(ErrorKind.NO_DIFFERENTIAL, "The equation must contain exactly one derivative y'");
        }
    }

    // --- 辅助方法 ---

    private int countOccurrences(String fragment) {
        int count = 0;
        int from = input.indexOf(fragment);
        while (from >= 0) {
            count++;
            from = input.indexOf(fragment, from + fragment.length());
        }
        return count;
    }

    private static String normalize(String raw) {
        StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char ch = raw.charAt(i);
            if (!Character.isWhitespace(ch)) {
                sb.append(ch);
            }
        }
        return sb.toString().toLowerCase();
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
