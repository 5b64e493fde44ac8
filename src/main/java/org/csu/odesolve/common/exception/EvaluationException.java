package org.csu.odesolve.common.exception;

/**
 * 表达式求值阶段的异常。
 * DERIVATIVE_EVALUATION 表示树没有经过规范化 (不变量被破坏)，
 * NUMERIC_ERROR 表示除零、幂运算越界等数值错误。
 */
public class EvaluationException extends EquationException {

    public EvaluationException(ErrorKind kind, String message) {
        super(kind, message);
    }
}
