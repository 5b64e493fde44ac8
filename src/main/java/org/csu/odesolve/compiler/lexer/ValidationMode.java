package org.csu.odesolve.compiler.lexer;

/**
 * 词法分析前的预校验模式。
 */
public enum ValidationMode {
    /**
     * 要求出现 x，且 y 恰好出现两次 (函数本身和它的导数)。
     */
    STRICT,
    /**
     * 不要求出现 x，y 可以只以 y' 的形式出现一次, e.g. "y'=2"。
     */
    RELAXED
}
