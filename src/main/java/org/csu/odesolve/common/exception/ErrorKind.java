package org.csu.odesolve.common.exception;

/**
 * 方程编译与求值过程中可能出现的失败种类。
 * 交互层根据种类向用户展示提示信息。
 */
public enum ErrorKind {
    // ---- 词法分析 (Lexer) ----
    NO_EQUATION,            // 缺少 '='
    NO_ARGUMENT,            // 缺少自变量 x
    NOT_AN_ODE,             // y 出现次数不对
    NO_DIFFERENTIAL,        // y' 出现次数不对
    UNDEFINED_LEXEME,       // 未知字符

    // ---- 语法分析 / 规范化 (Parser / Normalizer) ----
    SYNTAX_ERROR,
    ARGUMENT_DIFFERENTIATED, // x'
    UNSUPPORTED_EQUATION,

    // ---- 求值 (Evaluator) ----
    DERIVATIVE_EVALUATION,
    NUMERIC_ERROR;

    /**
     * 用于控制台输出的名称, e.g. NOT_AN_ODE -> "NotAnOde"
     */
    public String displayName() {
        StringBuilder sb = new StringBuilder();
        for (String part : name().split("_")) {
            sb.append(part.charAt(0)).append(part.substring(1).toLowerCase());
        }
        return sb.toString();
    }
}
