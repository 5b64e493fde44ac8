package org.csu.odesolve.solver;

import org.csu.odesolve.engine.OdeFunction;

import java.util.ArrayList;
import java.util.List;

/**
 * 欧拉-柯西法 (预估-校正)
 */
public class EulerCauchySolver implements OdeSolver {

    @Override
    public List<SolutionPoint> solve(OdeFunction function, InitialValueProblem problem) {
        double h = problem.stepSize();
        List<SolutionPoint> points = new ArrayList<>(problem.steps() + 1);
        SolutionPoint current = new SolutionPoint(problem.x0(), problem.y0());
        points.add(current);
        for (int i = 0; i < problem.steps(); i++) {
            current = step(function, current, h);
            points.add(current);
        }
        return points;
    }

    private SolutionPoint step(OdeFunction f, SolutionPoint point, double h) {
        double slope = f.compute(point.x(), point.y());
        double x = point.x() + h;
        double predicted = point.y() + h * slope;
        return new SolutionPoint(x, point.y() + h / 2 * (slope + f.compute(x, predicted)));
    }

    @Override
    public String getName() {
        return "Euler-Cauchy";
    }
}
