package org.csu.odesolve.solver;

import org.csu.odesolve.engine.OdeFunction;

import java.util.List;

/**
 * 一阶常微分方程 y' = f(x, y) 的数值解法。
 * 求值失败 (EvaluationException) 原样向上抛出。
 */
public interface OdeSolver {

    List<SolutionPoint> solve(OdeFunction function, InitialValueProblem problem);

    String getName();
}
