package com.sahd.search.retrieval;

import java.util.List;

public final class VectorMath {
    private VectorMath() {
    }

    public static double norm(List<Double> vector) {
        if (vector == null || vector.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (Double value : vector) {
            if (value != null) {
                sum += value * value;
            }
        }
        return Math.sqrt(sum);
    }

    static double cosine(List<Double> left, List<Double> right) {
        if (left == null || right == null || left.size() != right.size()) {
            return 0.0;
        }
        double leftNorm = norm(left);
        double rightNorm = norm(right);
        if (leftNorm == 0.0 || rightNorm == 0.0) {
            return 0.0;
        }
        double dot = 0.0;
        for (int i = 0; i < left.size(); i++) {
            Double a = left.get(i);
            Double b = right.get(i);
            if (a != null && b != null) {
                dot += a * b;
            }
        }
        return dot / (leftNorm * rightNorm);
    }
}
