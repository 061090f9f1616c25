package com.smartchoice.common.numeric;

import java.util.ArrayList;
import java.util.List;

public final class Grids {
    private Grids() {
    }

    /**
     * {@code count} evenly spaced points from {@code start} to {@code stop}, both included.
     * The last point is exactly {@code stop}.
     */
    public static List<Double> linspace(double start, double stop, int count) {
        if (count < 1) throw new IllegalArgumentException("count must be >= 1 but was " + count);
        if (count == 1) return List.of(start);
        List<Double> points = new ArrayList<>(count);
        double step = (stop - start) / (count - 1);
        for (int i = 0; i < count - 1; i++) points.add(start + i * step);
        points.add(stop);
        return List.copyOf(points);
    }
}
