package org.csu.odesolve.engine;

import org.csu.odesolve.common.exception.EquationException;
import org.csu.odesolve.common.exception.ErrorKind;

import java.util.Optional;

/**
 * 编译结果: 要么是编译好的方程 (Success)，要么是失败的种类和原因 (Failure)。
 */
public sealed interface ParseResult permits ParseResult.Success, ParseResult.Failure {

    record Success(CompiledEquation equation) implements ParseResult {
    }

    record Failure(ErrorKind kind, String message) implements ParseResult {
    }

    static ParseResult success(CompiledEquation equation) {
        return new Success(equation);
    }

    static ParseResult failure(EquationException e) {
        return new Failure(e.getKind(), e.getMessage());
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default Optional<CompiledEquation> getEquation() {
        return this instanceof Success success ? Optional.of(success.equation()) : Optional.empty();
    }

    default Optional<ErrorKind> getErrorKind() {
        return this instanceof Failure failure ? Optional.of(failure.kind()) : Optional.empty();
    }

    default String getMessage() {
        return this instanceof Failure failure ? failure.message() : null;
    }
}
