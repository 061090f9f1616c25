package com.smartchoice.sensitivity;

import java.util.List;
import java.util.NoSuchElementException;

/**
 * Output of a sweep.
 *
 * @param targetIndex node whose value was recorded
 * @param xLabel      what the x values are
 * @param baseValue   the unperturbed parameter where there is one (branch value, risk tolerance), else null
 * @param series      one series for a single target, otherwise one per branch of the target in branch order
 */
public record SensitivityResult(int targetIndex, String xLabel, Double baseValue, List<SensitivitySeries> series) {
    public SensitivityResult {
        series = List.copyOf(series);
    }

    public SensitivitySeries series(String label) {
        return series.stream()
                .filter(s -> s.label().equals(label))
                .findFirst()
                .orElseThrow(() -> new NoSuchElementException("No series " + label + " in " + labels()));
    }

    public List<String> labels() {
        return series.stream().map(SensitivitySeries::label).toList();
    }
}
