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

package com.twentyn.fret.spectra;

import java.util.Objects;

/**
 * One row of a cleaned spectral table: the donor emission and acceptor molar absorptivity measured at a wavelength.
 */
public class SpectralSample {
  private final double wavelength;
  private final double donorIntensity;
  private final double acceptorAbsorptivity;

  public SpectralSample(double wavelength, double donorIntensity, double acceptorAbsorptivity) {
    if (!Double.isFinite(wavelength) || !Double.isFinite(donorIntensity) || !Double.isFinite(acceptorAbsorptivity)) {
      throw new IllegalArgumentException(String.format(
          "Spectral sample values must be finite: (%s, %s, %s)", wavelength, donorIntensity, acceptorAbsorptivity));
    }
    this.wavelength = wavelength;
    this.donorIntensity = donorIntensity;
    this.acceptorAbsorptivity = acceptorAbsorptivity;
  }

  public double getWavelength() {
    return wavelength;
  }

  public double getDonorIntensity() {
    return donorIntensity;
  }

  public double getAcceptorAbsorptivity() {
    return acceptorAbsorptivity;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    SpectralSample that = (SpectralSample) o;
    return Double.compare(that.wavelength, wavelength) == 0 &&
        Double.compare(that.donorIntensity, donorIntensity) == 0 &&
        Double.compare(that.acceptorAbsorptivity, acceptorAbsorptivity) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(wavelength, donorIntensity, acceptorAbsorptivity);
  }

  @Override
  public String toString() {
    return String.format("SpectralSample{wavelength=%s, donor=%s, acceptor=%s}",
        wavelength, donorIntensity, acceptorAbsorptivity);
  }
}
