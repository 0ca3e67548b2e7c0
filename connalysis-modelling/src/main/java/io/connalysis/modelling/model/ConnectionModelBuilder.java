/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.connalysis.modelling.model;

import io.connalysis.modelling.ConnectionProbabilityTable;
import io.connalysis.modelling.fit.CurveFitter;
import io.connalysis.modelling.fit.LeastSquaresCurveFitter;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;

/// Fits [ConnectionModel]s to extracted connection probabilities.
///
/// Each bin is represented by its centre and its probability. The starting
/// point handed to the [CurveFitter] comes from a linear regression of
/// `ln p` on distance over the bins with non-zero probability.
public final class ConnectionModelBuilder {

    private static final Logger logger = LogManager.getLogger(ConnectionModelBuilder.class);

    /// Index of the `dz < 0` bin of a bipolar table.
    public static final int BIPOLAR_NEGATIVE_BIN = 0;
    /// Index of the `dz > 0` bin of a bipolar table.
    public static final int BIPOLAR_POSITIVE_BIN = 2;

    private final CurveFitter fitter;

    /// Creates a builder backed by [LeastSquaresCurveFitter].
    public ConnectionModelBuilder() {
        this(new LeastSquaresCurveFitter());
    }

    /// @param fitter curve-fitting collaborator
    public ConnectionModelBuilder(CurveFitter fitter) {
        this.fitter = fitter;
    }

    /// Fits `a * exp(-b d)` to a one-dimensional distance table.
    ///
    /// @param table table with a single distance dimension
    /// @return the fitted model
    public ExponentialModel buildDistanceDependent(ConnectionProbabilityTable table) {
        if (table.dimensions() != 1) {
            throw new IllegalArgumentException("Distance-dependent model needs a 1-dimensional table, got "
                + table.dimensions() + " dimensions");
        }
        ExponentialModel model = fitExponential(table.binCentres(0), table.probabilities());
        logger.info("MODEL FIT: {}", model);
        return model;
    }

    /// Fits one exponential per depth sign to a distance x bipolar table.
    ///
    /// @param table table with a distance dimension and a three-bin bipolar dimension
    /// @return the fitted model
    public BipolarExponentialModel buildBipolarDistanceDependent(ConnectionProbabilityTable table) {
        if (table.dimensions() != 2 || table.shape()[1] != 3) {
            throw new IllegalArgumentException("Bipolar model needs a distance x 3-bin bipolar table, got shape "
                + Arrays.toString(table.shape()));
        }
        double[] centres = table.binCentres(0);
        ExponentialModel negative = fitExponential(centres, table.probabilitiesAlongFirst(BIPOLAR_NEGATIVE_BIN));
        ExponentialModel positive = fitExponential(centres, table.probabilitiesAlongFirst(BIPOLAR_POSITIVE_BIN));
        BipolarExponentialModel model = new BipolarExponentialModel(negative, positive);
        logger.info("BIPOLAR MODEL FIT: {}", model);
        return model;
    }

    ExponentialModel fitExponential(double[] x, double[] y) {
        double[] guess = initialGuess(x, y);
        if (guess[0] == 0.0) {
            logger.warn("All {} probabilities are zero, returning the zero model", y.length);
            return new ExponentialModel(0.0, 0.0);
        }
        double[] fitted = fitter.fit(ExponentialModel.FUNCTION, x, y, guess);
        logger.debug("Exponential fit from a={}, b={} to a={}, b={}", guess[0], guess[1], fitted[0], fitted[1]);
        return new ExponentialModel(fitted[0], fitted[1]);
    }

    /// Log-linear estimate of `(a, b)`; falls back to `(max p, 0)` with fewer
    /// than two positive samples.
    static double[] initialGuess(double[] x, double[] y) {
        SimpleRegression regression = new SimpleRegression();
        double max = 0.0;
        for (int i = 0; i < x.length; i++) {
            if (Double.isFinite(x[i]) && Double.isFinite(y[i])) {
                max = Math.max(max, y[i]);
                if (y[i] > 0) {
                    regression.addData(x[i], Math.log(y[i]));
                }
            }
        }
        if (regression.getN() < 2 || !Double.isFinite(regression.getSlope())) {
            return new double[]{max, 0.0};
        }
        return new double[]{Math.exp(regression.getIntercept()), -regression.getSlope()};
    }
}
