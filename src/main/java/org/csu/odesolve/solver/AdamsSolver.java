package org.csu.odesolve.solver;

import org.csu.odesolve.engine.OdeFunction;

import java.util.List;

/**
 * 四阶 Adams-Bashforth 线性多步法。
 * 前 4 个点由龙格-库塔法给出，所以结果至少有 4 个点。
 */
public class AdamsSolver implements OdeSolver {

    private static final int SEED_POINTS = 4;

    private final RungeKuttaSolver starter = new RungeKuttaSolver();

    @Override
    public List<SolutionPoint> solve(OdeFunction function, InitialValueProblem problem) {
        double h = problem.stepSize();
        List<SolutionPoint> points = starter.solve(function, problem.x0(), problem.y0(), h, SEED_POINTS - 1);
        for (int i = SEED_POINTS - 1; i < problem.steps(); i++) {
            points.add(next(function, points, h));
        }
        return points;
    }

    private SolutionPoint next(OdeFunction f, List<SolutionPoint> points, double h) {
        int last = points.size() - 1;
        SolutionPoint p0 = points.get(last);
        SolutionPoint p1 = points.get(last - 1);
        SolutionPoint p2 = points.get(last - 2);
        SolutionPoint p3 = points.get(last - 3);
        double y = p0.y() + h * (55.0 / 24 * f.compute(p0.x(), p0.y())
                - 59.0 / 24 * f.compute(p1.x(), p1.y())
                + 37.0 / 24 * f.compute(p2.x(), p2.y())
                - 9.0 / 24 * f.compute(p3.x(), p3.y()));
        return new SolutionPoint(p0.x() + h, y);
    }

    @Override
    public String getName() {
        return "Adams 4th order";
    }
}
