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

import java.util.List;

/**
 * Everything one FRET run produces: J, R0, E, r, the sensitivity verdict, and the curves behind J.
 */
public class ComputationResult {
  private final OverlapIntegral overlapIntegral;
  private final double forsterDistance;
  private final EfficiencyAndDistance efficiencyAndDistance;
  private final RangeVerdict verdict;

  public ComputationResult(OverlapIntegral overlapIntegral, double forsterDistance,
                           EfficiencyAndDistance efficiencyAndDistance, RangeVerdict verdict) {
    this.overlapIntegral = overlapIntegral;
    this.forsterDistance = forsterDistance;
    this.efficiencyAndDistance = efficiencyAndDistance;
    this.verdict = verdict;
  }

  public double getOverlapIntegral() {
    return overlapIntegral.getValue();
  }

  public double getForsterDistance() {
    return forsterDistance;
  }

  public double getEfficiency() {
    return efficiencyAndDistance.getEfficiency();
  }

  public double getDistance() {
    return efficiencyAndDistance.getDistance();
  }

  public RangeVerdict getVerdict() {
    return verdict;
  }

  public List<SpectrumPoint> getNormalizedDonorEmission() {
    return overlapIntegral.getNormalizedDonorEmission();
  }

  public List<SpectrumPoint> getAcceptorAbsorptivity() {
    return overlapIntegral.getAcceptorAbsorptivity();
  }
}
