package co.codecraft.jresilience;

/**
 * Exponentially weighted moving average. The first sample seeds the average; each later sample contributes 10%.
 * Not threadsafe.
 */
public class MovingAverage {

    private static final double OLD_WEIGHT = 0.9;
    private static final double NEW_WEIGHT = 0.1;

    private double value = 0.0;
    private boolean seeded = false;

    public void add(double sample) {
        if (!seeded) {
            value = sample;
            seeded = true;
        } else {
            value = (value * OLD_WEIGHT) + (sample * NEW_WEIGHT);
        }
    }

    public double get() {
        return value;
    }
}
