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

/**
 * Photophysical parameters of a donor/acceptor pair and its medium that enter the Forster distance.
 */
public class PhysicalConstants {
  // Isotropic dynamic averaging, 2/3.
  public static final double DEFAULT_ORIENTATION_FACTOR = 0.667;
  public static final double DEFAULT_DONOR_QUANTUM_YIELD = 0.118;
  // Water.
  public static final double DEFAULT_REFRACTIVE_INDEX = 1.33;

  private final double orientationFactor;
  private final double donorQuantumYield;
  private final double refractiveIndex;

  public PhysicalConstants() {
    this(DEFAULT_ORIENTATION_FACTOR, DEFAULT_DONOR_QUANTUM_YIELD, DEFAULT_REFRACTIVE_INDEX);
  }

  public PhysicalConstants(double orientationFactor, double donorQuantumYield, double refractiveIndex) {
    if (!(orientationFactor > 0.0) || Double.isInfinite(orientationFactor)) {
      throw new IllegalArgumentException(
          String.format("Orientation factor must be a positive number, got %s", orientationFactor));
    }
    if (!(donorQuantumYield > 0.0 && donorQuantumYield <= 1.0)) {
      throw new IllegalArgumentException(
          String.format("Donor quantum yield must be in (0, 1], got %s", donorQuantumYield));
    }
    if (!(refractiveIndex > 0.0) || Double.isInfinite(refractiveIndex)) {
      throw new IllegalArgumentException(
          String.format("Refractive index must be a positive number, got %s", refractiveIndex));
    }
    this.orientationFactor = orientationFactor;
    this.donorQuantumYield = donorQuantumYield;
    this.refractiveIndex = refractiveIndex;
  }

  /**
   * kappa squared
   */
  public double getOrientationFactor() {
    return orientationFactor;
  }

  public double getDonorQuantumYield() {
    return donorQuantumYield;
  }

  public double getRefractiveIndex() {
    return refractiveIndex;
  }

  @Override
  public String toString() {
    return String.format("PhysicalConstants{k2=%s, phiD=%s, n=%s}",
        orientationFactor, donorQuantumYield, refractiveIndex);
  }
}
