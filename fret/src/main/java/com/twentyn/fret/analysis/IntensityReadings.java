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
 * Donor fluorescence intensity measured without (F0) and with (F) the acceptor present.  Values are not range
 * checked here; {@link EfficiencyDistanceCalculator} reports readings it can't use.
 */
public class IntensityReadings {
  public static final double DEFAULT_INITIAL_INTENSITY = 3787.66;
  public static final double DEFAULT_QUENCHED_INTENSITY = 2278.21;

  private final double initialIntensity;
  private final double quenchedIntensity;

  public IntensityReadings(double initialIntensity, double quenchedIntensity) {
    this.initialIntensity = initialIntensity;
    this.quenchedIntensity = quenchedIntensity;
  }

  /**
   * F0, the unquenched donor intensity.
   */
  public double getInitialIntensity() {
    return initialIntensity;
  }

  /**
   * F, the donor intensity in the presence of the acceptor.
   */
  public double getQuenchedIntensity() {
    return quenchedIntensity;
  }

  public IntensityReadings withInitialIntensity(double initialIntensity) {
    return new IntensityReadings(initialIntensity, this.quenchedIntensity);
  }

  @Override
  public String toString() {
    return String.format("IntensityReadings{F0=%s, F=%s}", initialIntensity, quenchedIntensity);
  }
}
