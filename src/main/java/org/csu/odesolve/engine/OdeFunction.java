package org.csu.odesolve.engine;

/**
 * 右端函数 f(x, y)，数值解法只依赖这个接口。
 */
@FunctionalInterface
public interface OdeFunction {
    double compute(double x, double y);
}
