package com.smartchoice.sensitivity;

public record SensitivityPoint(double x, double y) {
}
