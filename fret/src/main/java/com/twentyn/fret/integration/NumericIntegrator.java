/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.twentyn.fret.integration;

import com.twentyn.fret.errors.AnalysisStage;
import com.twentyn.fret.errors.DataQualityException;
import com.twentyn.fret.errors.InsufficientDataException;
import org.apache.commons.math3.exception.NonMonotonicSequenceException;
import org.apache.commons.math3.util.MathArrays;

/**
 * Composite Simpson's rule over sampled data.  Samples need not be evenly spaced: every pair of intervals is weighted
 * by the quadratic through its three points, so the rule is exact for quadratics on any grid and for cubics on a
 * uniform grid with an odd number of points.
 *
 * With an even number of points, the trailing interval can't be paired.  It is integrated over the quadratic through
 * the last three points instead, which keeps quadratics exact rather than falling back to a trapezoid.
 */
public class NumericIntegrator {
  private static final int MIN_POINTS = 2;

  /**
   * Integrates y over x.
   * @param y Sample values.
   * @param x Sample positions, strictly increasing.
   * @return The approximate definite integral from x[0] to x[n-1].
   * @throws InsufficientDataException if fewer than two points are given.
   * @throws DataQualityException if x is not strictly increasing.
   */
  public double integrate(double[] y, double[] x) throws DataQualityException {
    if (x.length != y.length) {
      throw new IllegalArgumentException(String.format(
          "x and y must have the same number of samples, got %d and %d", x.length, y.length));
    }
    int n = x.length;
    if (n < MIN_POINTS) {
      throw new InsufficientDataException(n);
    }

    try {
      MathArrays.checkOrder(x, MathArrays.OrderDirection.INCREASING, true);
    } catch (NonMonotonicSequenceException e) {
      int i = e.getIndex();
      throw new DataQualityException(AnalysisStage.INTEGRATION, String.format(
          "sample positions must be strictly increasing, but x[%d] = %s follows x[%d] = %s",
          i, x[i], i - 1, x[i - 1]));
    }

    if (n == 2) {
      return trapezoid(y[0], y[1], x[1] - x[0]);
    }

    if (n % 2 == 1) {
      return simpsonPairs(y, x, n - 1);
    }

    double area = simpsonPairs(y, x, n - 2);
    return area + lastIntervalCorrection(y, x);
  }

  /**
   * Sums Simpson's rule over consecutive interval pairs from index 0 up to {@code last}, which must be even.
   */
  private double simpsonPairs(double[] y, double[] x, int last) {
    double area = 0.0;
    for (int i = 0; i < last; i += 2) {
      double h0 = x[i + 1] - x[i];
      double h1 = x[i + 2] - x[i + 1];
      double hSum = h0 + h1;
      double hProd = h0 * h1;
      double h0DivH1 = h0 / h1;
      area += hSum / 6.0 * (
          y[i] * (2.0 - 1.0 / h0DivH1) +
          y[i + 1] * (hSum * hSum / hProd) +
          y[i + 2] * (2.0 - h0DivH1));
    }
    return area;
  }

  /**
   * Exact integral over [x[n-2], x[n-1]] of the parabola through the last three samples.
   */
  private double lastIntervalCorrection(double[] y, double[] x) {
    int n = x.length;
    double h0 = x[n - 2] - x[n - 3];
    double h1 = x[n - 1] - x[n - 2];

    double alpha = (2.0 * h1 * h1 + 3.0 * h0 * h1) / (6.0 * (h0 + h1));
    double beta = (h1 * h1 + 3.0 * h0 * h1) / (6.0 * h0);
    double eta = (h1 * h1 * h1) / (6.0 * h0 * (h0 + h1));

    return alpha * y[n - 1] + beta * y[n - 2] - eta * y[n - 3];
  }

  private double trapezoid(double y0, double y1, double width) {
    return 0.5 * width * (y0 + y1);
  }
}
