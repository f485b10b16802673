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

import java.util.Collections;
import java.util.List;

/**
 * The spectral overlap J of a dataset, together with the two curves it was computed from, for plotting.
 */
public class OverlapIntegral {
  private final double value;
  private final double donorArea;
  private final List<SpectrumPoint> normalizedDonorEmission;
  private final List<SpectrumPoint> acceptorAbsorptivity;

  public OverlapIntegral(double value, double donorArea,
                         List<SpectrumPoint> normalizedDonorEmission, List<SpectrumPoint> acceptorAbsorptivity) {
    this.value = value;
    this.donorArea = donorArea;
    this.normalizedDonorEmission = Collections.unmodifiableList(normalizedDonorEmission);
    this.acceptorAbsorptivity = Collections.unmodifiableList(acceptorAbsorptivity);
  }

  /**
   * J, in nm^4 M^-1 cm^-1 when wavelengths are in nm and absorptivity in M^-1 cm^-1.
   */
  public double getValue() {
    return value;
  }

  /**
   * The area under the raw donor emission curve that was used for normalization.
   */
  public double getDonorArea() {
    return donorArea;
  }

  public List<SpectrumPoint> getNormalizedDonorEmission() {
    return normalizedDonorEmission;
  }

  public List<SpectrumPoint> getAcceptorAbsorptivity() {
    return acceptorAbsorptivity;
  }
}
