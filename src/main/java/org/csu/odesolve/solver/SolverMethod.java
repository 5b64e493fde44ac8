package org.csu.odesolve.solver;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * 交互菜单中可选的数值解法
 */
public enum SolverMethod {
    ADAMS("1", AdamsSolver::new),
    EULER_CAUCHY("2", EulerCauchySolver::new),
    RUNGE_KUTTA("3", RungeKuttaSolver::new);

    private final String key;
    private final Supplier<OdeSolver> factory;

    SolverMethod(String key, Supplier<OdeSolver> factory) {
        this.key = key;
        this.factory = factory;
    }

    public String getKey() {
        return key;
    }

    public OdeSolver createSolver() {
        return factory.get();
    }

    public static Optional<SolverMethod> fromKey(String key) {
        for (SolverMethod method : values()) {
            if (method.key.equals(key.trim())) {
                return Optional.of(method);
            }
        }
        return Optional.empty();
    }
}
