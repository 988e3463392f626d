package com.timeseries.anomaly.engine.forecast;

import com.timeseries.anomaly.model.Observation;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Fits {@link HarmonicRegressionModel}s by ordinary least squares.
 * <p>
 * Seasonal terms are only used once the history covers a full cycle, and their order is
 * capped by what the sampling interval can resolve, so daily data never gets daily terms.
 */
public class HarmonicRegressionForecaster implements Forecaster {

    private static final Logger log = LoggerFactory.getLogger(HarmonicRegressionForecaster.class);

    private static final double SINGULARITY_THRESHOLD = 1e-10;

    private final int dailyOrder;
    private final int weeklyOrder;
    private final double minSigma;
    private final double z;

    public HarmonicRegressionForecaster(int dailyOrder, int weeklyOrder, double minSigma,
                                        double confidenceLevel) {
        if (confidenceLevel <= 0.0 || confidenceLevel >= 1.0) {
            throw new IllegalArgumentException("Confidence level must be in (0, 1): " + confidenceLevel);
        }
        this.dailyOrder = Math.max(0, dailyOrder);
        this.weeklyOrder = Math.max(0, weeklyOrder);
        this.minSigma = Math.max(0.0, minSigma);
        // two-sided quantile, e.g. 1.96 for 0.95
        this.z = new NormalDistribution().inverseCumulativeProbability(0.5 + confidenceLevel / 2.0);
    }

    @Override
    public TrainedModel fit(List<Observation> history) {
        if (history == null || history.isEmpty()) {
            throw new ForecastException("Cannot fit on an empty history");
        }

        int n = history.size();
        Instant origin = history.get(0).getTimestamp();
        double[] hours = new double[n];
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            Observation obs = history.get(i);
            if (!Double.isFinite(obs.getValue())) {
                throw new ForecastException("Non-finite value at " + obs.getTimestamp());
            }
            hours[i] = HarmonicRegressionModel.hoursSince(origin, obs.getTimestamp());
            y[i] = obs.getValue();
        }

        double span = StatUtils.max(hours) - StatUtils.min(hours);
        double step = medianStep(hours);
        int daily = effectiveOrder(dailyOrder, HarmonicRegressionModel.DAY_HOURS, span, step);
        int weekly = effectiveOrder(weeklyOrder, HarmonicRegressionModel.WEEK_HOURS, span, step);

        int regressors = 1 + 2 * daily + 2 * weekly;
        if (n < regressors + 2) {
            throw new ForecastException(String.format(
                    "Need at least %d observations to fit %d regressors, got %d", regressors + 2, regressors, n));
        }

        double[][] x = new double[n][];
        for (int i = 0; i < n; i++) {
            x[i] = HarmonicRegressionModel.features(hours[i], daily, weekly);
        }

        double[] beta;
        double residualVariance;
        try {
            OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression(SINGULARITY_THRESHOLD);
            ols.newSampleData(y, x);
            beta = ols.estimateRegressionParameters();
            residualVariance = ols.estimateErrorVariance();
        } catch (MathIllegalArgumentException e) {
            throw new ForecastException("Least-squares fit failed on " + n + " observations: " + e.getMessage(), e);
        }

        if (Arrays.stream(beta).anyMatch(b -> !Double.isFinite(b)) || !Double.isFinite(residualVariance)) {
            throw new ForecastException("Least-squares fit produced non-finite parameters on " + n + " observations");
        }

        double sigma = Math.max(Math.sqrt(Math.max(residualVariance, 0.0)), minSigma);
        log.debug("Fitted harmonic regression: n={}, dailyOrder={}, weeklyOrder={}, sigma={}",
                n, daily, weekly, sigma);

        return new HarmonicRegressionModel(origin, beta, daily, weekly, sigma, z);
    }

    /**
     * Highest usable harmonic order for a seasonal period: zero until the history covers a full
     * cycle, and never above what the sampling step can resolve.
     */
    static int effectiveOrder(int order, double periodHours, double spanHours, double stepHours) {
        if (order <= 0 || stepHours <= 0.0 || spanHours + stepHours < periodHours) {
            return 0;
        }
        int resolvable = (int) Math.floor((periodHours / stepHours - 1.0) / 2.0);
        return Math.max(0, Math.min(order, resolvable));
    }

    private static double medianStep(double[] hours) {
        if (hours.length < 2) {
            return 0.0;
        }
        double[] steps = new double[hours.length - 1];
        for (int i = 1; i < hours.length; i++) {
            steps[i - 1] = Math.abs(hours[i] - hours[i - 1]);
        }
        return StatUtils.percentile(steps, 50.0);
    }
}
