package com.smartchoice.sensitivity;

import java.util.List;

/** One line of a sensitivity chart: the value at a node (or one of its branches) against the swept parameter. */
public record SensitivitySeries(String label, List<SensitivityPoint> points) {
    public SensitivitySeries {
        points = List.copyOf(points);
    }

    public List<Double> xs() {
        return points.stream().map(SensitivityPoint::x).toList();
    }

    public List<Double> ys() {
        return points.stream().map(SensitivityPoint::y).toList();
    }
}
