package com.timeseries.anomaly.engine.forecast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;

/**
 * Linear trend plus daily and weekly Fourier terms, with a symmetric normal interval.
 * Time is measured in hours since {@code origin}, the first timestamp of the training history.
 */
@Getter
public class HarmonicRegressionModel implements TrainedModel {

    static final double DAY_HOURS = 24.0;
    static final double WEEK_HOURS = 168.0;

    private final Instant origin;
    private final double[] coefficients;
    private final int dailyOrder;
    private final int weeklyOrder;
    private final double sigma;
    private final double z;

    @JsonCreator
    public HarmonicRegressionModel(@JsonProperty("origin") Instant origin,
                                   @JsonProperty("coefficients") double[] coefficients,
                                   @JsonProperty("dailyOrder") int dailyOrder,
                                   @JsonProperty("weeklyOrder") int weeklyOrder,
                                   @JsonProperty("sigma") double sigma,
                                   @JsonProperty("z") double z) {
        this.origin = origin;
        this.coefficients = Arrays.copyOf(coefficients, coefficients.length);
        this.dailyOrder = dailyOrder;
        this.weeklyOrder = weeklyOrder;
        this.sigma = sigma;
        this.z = z;
    }

    @Override
    public Forecast predict(Instant timestamp) {
        double[] features = features(hoursSince(origin, timestamp), dailyOrder, weeklyOrder);
        if (features.length + 1 != coefficients.length) {
            throw new ForecastException("Model expects " + (coefficients.length - 1)
                    + " regressors but the basis has " + features.length);
        }

        double point = coefficients[0];
        for (int i = 0; i < features.length; i++) {
            point += coefficients[i + 1] * features[i];
        }
        double halfWidth = z * sigma;

        if (!Double.isFinite(point) || !Double.isFinite(halfWidth)) {
            throw new ForecastException("Non-finite forecast at " + timestamp);
        }
        return new Forecast(point, point - halfWidth, point + halfWidth);
    }

    public double[] getCoefficients() {
        return Arrays.copyOf(coefficients, coefficients.length);
    }

    /**
     * Regressors for one point in time: trend, then sin/cos pairs for each daily harmonic,
     * then sin/cos pairs for each weekly harmonic. The intercept is not included.
     */
    static double[] features(double hours, int dailyOrder, int weeklyOrder) {
        double[] row = new double[1 + 2 * dailyOrder + 2 * weeklyOrder];
        int col = 0;
        row[col++] = hours;
        for (int k = 1; k <= dailyOrder; k++) {
            double angle = 2.0 * Math.PI * k * hours / DAY_HOURS;
            row[col++] = Math.sin(angle);
            row[col++] = Math.cos(angle);
        }
        for (int k = 1; k <= weeklyOrder; k++) {
            double angle = 2.0 * Math.PI * k * hours / WEEK_HOURS;
            row[col++] = Math.sin(angle);
            row[col++] = Math.cos(angle);
        }
        return row;
    }

    static double hoursSince(Instant origin, Instant timestamp) {
        return Duration.between(origin, timestamp).toMillis() / 3_600_000.0;
    }
}
