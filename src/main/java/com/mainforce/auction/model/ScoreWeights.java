package com.mainforce.auction.model;

/**
 * Weight vector over the four auction metrics. Weights are non-negative and sum to 1.
 */
public final class ScoreWeights {
    private static final double SUM_TOLERANCE = 1e-6;

    public final double volumeRatio;
    public final double turnoverRate;
    public final double gapPercent;
    public final double amount;

    public ScoreWeights(double volumeRatio, double turnoverRate, double gapPercent, double amount) {
        requireWeight("weights.volumeRatio", volumeRatio);
        requireWeight("weights.turnoverRate", turnoverRate);
        requireWeight("weights.gapPercent", gapPercent);
        requireWeight("weights.amount", amount);
        double sum = volumeRatio + turnoverRate + gapPercent + amount;
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new InvalidParameterException("weights", String.format("sum=%.6f", sum), "sum == 1.0");
        }
        this.volumeRatio = volumeRatio;
        this.turnoverRate = turnoverRate;
        this.gapPercent = gapPercent;
        this.amount = amount;
    }

    public static ScoreWeights defaults() {
        return new ScoreWeights(0.4, 0.2, 0.3, 0.1);
    }

    public double weigh(SubScores s) {
        if (s == null) {
            return 0.0;
        }
        return volumeRatio * s.volumeRatio
                + turnoverRate * s.turnoverRate
                + gapPercent * s.gapPercent
                + amount * s.amount;
    }

    private static void requireWeight(String name, double value) {
        if (!Double.isFinite(value) || value < 0.0) {
            throw new InvalidParameterException(name, value, "finite and >= 0");
        }
    }
}
