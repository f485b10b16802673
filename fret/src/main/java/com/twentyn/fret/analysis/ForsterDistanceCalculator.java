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
 * R0 = 0.02108 * (k2 * phiD * n^-4 * J)^(1/6), giving R0 in nm for J in nm^4 M^-1 cm^-1.
 */
public class ForsterDistanceCalculator {
  public static final double FORSTER_PREFACTOR = 0.02108;
  private static final double SIXTH = 1.0 / 6.0;

  private final PhysicalConstants constants;

  public ForsterDistanceCalculator(PhysicalConstants constants) {
    this.constants = constants;
  }

  public double calculate(double overlapIntegral) throws NumericDomainException {
    double radicand = constants.getOrientationFactor() * constants.getDonorQuantumYield() *
        Math.pow(constants.getRefractiveIndex(), -4) * overlapIntegral;

    if (Double.isNaN(radicand) || Double.isInfinite(radicand)) {
      throw new NumericDomainException(AnalysisStage.FORSTER_DISTANCE, "R0",
          String.format("R0 is undefined: k2 * phiD * n^-4 * J evaluated to %s (J = %s)", radicand, overlapIntegral));
    }
    if (radicand < 0.0) {
      throw new NumericDomainException(AnalysisStage.FORSTER_DISTANCE, "R0", String.format(
          "R0 is undefined: k2 * phiD * n^-4 * J = %e is negative (J = %e); check for negative values in the spectra",
          radicand, overlapIntegral));
    }
    if (radicand == 0.0) {
      throw new NumericDomainException(AnalysisStage.FORSTER_DISTANCE, "R0",
          "R0 is zero: the donor emission and acceptor absorption spectra do not overlap");
    }

    return FORSTER_PREFACTOR * Math.pow(radicand, SIXTH);
  }
}
