package org.csu.odesolve.compiler.lexer;

/**
 * 定义词法单元（Token）的类型，即“种别码”。
 * AST 节点复用同一套类型来标识自身的种类。
 */
public enum TokenType {
    // ---- 变量与常量 ----
    ARGUMENT,   // x, 自变量
    FUNCTION,   // y, 因变量
    NUMBER,     // 单个数字, 语法分析时合并为数字字面量
    EULER,      // e
    POINT,      // '.' 或 ','

    // ---- 运算符 (Operators) ----
    PLUS,       // +
    NEGATE,     // - (词法层面的负号, 在加法层被改写为 MINUS)
    MINUS,      // 二元减法
    MULTIPLY,   // *
    DIVIDE,     // /
    PRIME,      // ' 导数标记
    POWER,      // ^

    // ---- 分隔符 (Delimiters) ----
    LPAREN,     // (
    RPAREN,     // )
    EQUAL,      // =

    // ---- 特殊 Token ----
    EOF
}
