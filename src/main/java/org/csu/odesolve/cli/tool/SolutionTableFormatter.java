package org.csu.odesolve.cli.tool;

import org.csu.odesolve.solver.SolutionPoint;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 将数值解格式化为带边框的控制台表格。
 */
public class SolutionTableFormatter {

    private static final int Y_DECIMALS = 6;

    /**
     * 将给定的解点列表格式化为字符串表格。
     *
     * @param points 数值解
     * @param h      步长, x 列按步长的小数位数输出
     * @return 格式化后的表格字符串
     */
    public static String format(List<SolutionPoint> points, double h) {
        if (points.isEmpty()) {
            return "No points to display.";
        }

        int xDecimals = decimalsOf(h);
        List<String> xs = new ArrayList<>(points.size());
        List<String> ys = new ArrayList<>(points.size());
        int xWidth = 1;
        int yWidth = 1;
        for (SolutionPoint point : points) {
            String x = String.format(Locale.ROOT, "%." + xDecimals + "f", point.x());
            String y = String.format(Locale.ROOT, "%." + Y_DECIMALS + "f", point.y());
            xs.add(x);
            ys.add(y);
            xWidth = Math.max(xWidth, x.length());
            yWidth = Math.max(yWidth, y.length());
        }

        StringBuilder sb = new StringBuilder();
        String separator = getSeparator(xWidth, yWidth);
        sb.append(separator).append("\n");
        sb.append(getRow("x", "y", xWidth, yWidth)).append("\n");
        sb.append(separator).append("\n");
        for (int i = 0; i < points.size(); i++) {
            sb.append(getRow(xs.get(i), ys.get(i), xWidth, yWidth)).append("\n");
        }
        sb.append(separator);
        return sb.toString();
    }

    static int decimalsOf(double h) {
        return Math.max(0, BigDecimal.valueOf(h).stripTrailingZeros().scale());
    }

    private static String getRow(String x, String y, int xWidth, int yWidth) {
        return String.format("| %-" + xWidth + "s | %-" + yWidth + "s |", x, y);
    }

    private static String getSeparator(int xWidth, int yWidth) {
        return "+" + "-".repeat(xWidth + 2) + "+" + "-".repeat(yWidth + 2) + "+";
    }
}
