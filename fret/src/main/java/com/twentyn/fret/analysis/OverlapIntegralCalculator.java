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
import com.twentyn.fret.errors.DataQualityException;
import com.twentyn.fret.errors.NumericDomainException;
import com.twentyn.fret.integration.NumericIntegrator;
import com.twentyn.fret.spectra.SpectralDataset;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes the overlap integral J = integral of F_D(l) * eps_A(l) * l^4 dl, where F_D is the donor emission
 * normalized to unit area over the measured range.
 */
public class OverlapIntegralCalculator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(OverlapIntegralCalculator.class);

  private final NumericIntegrator integrator;

  public OverlapIntegralCalculator() {
    this(new NumericIntegrator());
  }

  public OverlapIntegralCalculator(NumericIntegrator integrator) {
    this.integrator = integrator;
  }

  public OverlapIntegral calculate(SpectralDataset dataset) throws DataQualityException, NumericDomainException {
    double[] wavelengths = dataset.getWavelengths();
    double[] donor = dataset.getDonorIntensities();
    double[] acceptor = dataset.getAcceptorAbsorptivities();

    double donorArea = integrator.integrate(donor, wavelengths);
    if (!Double.isFinite(donorArea) || donorArea <= 0.0) {
      throw new NumericDomainException(AnalysisStage.OVERLAP_INTEGRAL, "area_D", String.format(
          "donor emission area is %s; the donor spectrum must enclose a positive, finite area to be normalized",
          donorArea));
    }
    LOGGER.debug("Donor emission area over %.2f-%.2f nm: %e",
        wavelengths[0], wavelengths[wavelengths.length - 1], donorArea);

    double[] integrand = new double[wavelengths.length];
    List<SpectrumPoint> normalizedDonor = new ArrayList<>(wavelengths.length);
    List<SpectrumPoint> acceptorSeries = new ArrayList<>(wavelengths.length);
    for (int i = 0; i < wavelengths.length; i++) {
      double normalized = donor[i] / donorArea;
      integrand[i] = normalized * acceptor[i] * Math.pow(wavelengths[i], 4);
      normalizedDonor.add(new SpectrumPoint(wavelengths[i], normalized));
      acceptorSeries.add(new SpectrumPoint(wavelengths[i], acceptor[i]));
    }

    double j = integrator.integrate(integrand, wavelengths);
    if (!Double.isFinite(j)) {
      throw new NumericDomainException(AnalysisStage.OVERLAP_INTEGRAL, "J",
          String.format("overlap integral evaluated to %s", j));
    }
    LOGGER.debug("Overlap integral J = %e", j);

    return new OverlapIntegral(j, donorArea, normalizedDonor, acceptorSeries);
  }
}
