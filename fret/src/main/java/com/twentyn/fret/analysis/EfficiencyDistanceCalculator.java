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

package com.twentyn.fret.analysis;

import com.twentyn.fret.errors.AnalysisStage;
import com.twentyn.fret.errors.NumericDomainException;

/**
 * Derives the transfer efficiency E = 1 - F/F0 from donor quenching, and the donor-acceptor distance
 * r = R0 * ((1 - E) / E)^(1/6).
 *
 * E outside (0, 1) is physically implausible but not rejected as such.  It is only an error when it leaves r without a
 * real value, i.e. when (1 - E) / E is negative or E is zero.
 */
public class EfficiencyDistanceCalculator {
  private static final double SIXTH = 1.0 / 6.0;

  public EfficiencyAndDistance calculate(IntensityReadings readings, double forsterDistance)
      throws NumericDomainException {
    double f0 = readings.getInitialIntensity();
    double f = readings.getQuenchedIntensity();

    if (!Double.isFinite(f0) || !Double.isFinite(f)) {
      throw new NumericDomainException(AnalysisStage.EFFICIENCY_DISTANCE, "E",
          String.format("E is undefined: intensities must be finite (F0 = %s, F = %s)", f0, f));
    }
    if (f0 == 0.0) {
      throw new NumericDomainException(AnalysisStage.EFFICIENCY_DISTANCE, "E",
          "E is undefined: baseline intensity F0 is zero");
    }
    if (!Double.isFinite(forsterDistance)) {
      throw new NumericDomainException(AnalysisStage.EFFICIENCY_DISTANCE, "r",
          String.format("r is undefined: R0 is %s", forsterDistance));
    }

    double efficiency = 1.0 - f / f0;
    if (efficiency == 0.0) {
      throw new NumericDomainException(AnalysisStage.EFFICIENCY_DISTANCE, "r",
          "E is zero: quenched intensity equals baseline intensity, so r is unbounded");
    }

    double ratio = (1.0 - efficiency) / efficiency;
    if (ratio < 0.0) {
      throw new NumericDomainException(AnalysisStage.EFFICIENCY_DISTANCE, "r", String.format(
          "r is undefined: (1 - E) / E = %.4f is negative for E = %.4f (F0 = %s, F = %s)",
          ratio, efficiency, f0, f));
    }

    double distance = forsterDistance * Math.pow(ratio, SIXTH);
    return new EfficiencyAndDistance(efficiency, distance);
  }
}
