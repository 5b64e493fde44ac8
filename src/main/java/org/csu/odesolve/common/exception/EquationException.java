package org.csu.odesolve.common.exception;

import lombok.Getter;

/**
 * 所有方程相关异常的基类，携带具体的失败种类。
 */
@Getter
public class EquationException extends RuntimeException {

    private final ErrorKind kind;

    public EquationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public EquationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
