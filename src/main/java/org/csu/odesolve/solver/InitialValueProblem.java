package org.csu.odesolve.solver;

/**
 * 初值问题的参数。
 *
 * @param x0    初始点的 x
 * @param y0    初始点的 y
 * @param lower 区间下界
 * @param upper 区间上界
 * @param steps 区间内的步数, 取值范围 [1, MAX_STEPS]
 */
public record InitialValueProblem(double x0, double y0, double lower, double upper, int steps) {

    public static final int MAX_STEPS = 1_000_000;

    public InitialValueProblem {
        if (steps <= 0) {
            throw new IllegalArgumentException("The number of steps must be greater than 0, got " + steps);
        }
        if (steps > MAX_STEPS) {
            throw new IllegalArgumentException("The number of steps must not exceed " + MAX_STEPS + ", got " + steps);
        }
        // 允许用户以任意顺序输入区间端点
        if (lower > upper) {
            double tmp = lower;
            lower = upper;
            upper = tmp;
        }
    }

    public double stepSize() {
        return (upper - lower) / steps;
    }
}
