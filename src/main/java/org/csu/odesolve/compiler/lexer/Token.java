package org.csu.odesolve.compiler.lexer;

/**
 * @param type 词法单元的类型 (种别码)
 * @param lexeme 词法单元的原始文本 (词素值)
 * @param position 在去除空白并转为小写后的字符串中的位置 (从0开始)
 */
public record Token(TokenType type, String lexeme, int position) {

    @Override
    public String toString() {
        return String.format("Token[Type=%-8s, Lexeme='%s', Position=%d]", type, lexeme, position);
    }
}
