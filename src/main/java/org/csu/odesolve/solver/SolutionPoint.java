package org.csu.odesolve.solver;

/**
 * 数值解中的一个点 (x, y)
 */
public record SolutionPoint(double x, double y) {
}
