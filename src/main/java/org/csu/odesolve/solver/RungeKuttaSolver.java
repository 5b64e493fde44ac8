package org.csu.odesolve.solver;

import org.csu.odesolve.engine.OdeFunction;

import java.util.ArrayList;
import java.util.List;

/**
 * 经典四阶龙格-库塔法
 */
public class RungeKuttaSolver implements OdeSolver {

    @Override
    public List<SolutionPoint> solve(OdeFunction function, InitialValueProblem problem) {
        return solve(function, problem.x0(), problem.y0(), problem.stepSize(), problem.steps());
    }

    /**
     * 从 (x0, y0) 出发走 steps 步, 返回 steps + 1 个点 (包括起点)
     */
    List<SolutionPoint> solve(OdeFunction function, double x0, double y0, double h, int steps) {
        List<SolutionPoint> points = new ArrayList<>(steps + 1);
        points.add(new SolutionPoint(x0, y0));
        double x = x0;
        double y = y0;
        for (int i = 0; i < steps; i++) {
            y = step(function, x, y, h);
            x += h;
            points.add(new SolutionPoint(x, y));
        }
        return points;
    }

    static double step(OdeFunction f, double x0, double y0, double h) {
        double k1 = f.compute(x0, y0);
        double k2 = f.compute(x0 + h / 2, y0 + h / 2 * k1);
        double k3 = f.compute(x0 + h / 2, y0 + h / 2 * k2);
        double k4 = f.compute(x0 + h, y0 + h * k3);
        return y0 + h / 6 * (k1 + 2 * k2 + 2 * k3 + k4);
    }

    @Override
    public String getName() {
        return "Runge-Kutta 4th order";
    }
}
