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

import com.twentyn.fret.spectra.SpectralDataset;
import com.twentyn.fret.spectra.SpectralSample;
import com.twentyn.fret.spectra.SpectralTable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Synthetic donor emission / acceptor absorption spectra shaped like a typical green donor and orange acceptor.
 */
final class SpectraFixtures {
  static final String WAVELENGTH = "lambda";
  static final String DONOR = "I_D";
  static final String ACCEPTOR = "eps_A";

  private SpectraFixtures() {
  }

  static double donor(double wavelength) {
    return 1000.0 * Math.exp(-Math.pow((wavelength - 520.0) / 25.0, 2));
  }

  static double acceptor(double wavelength) {
    return 80000.0 * Math.exp(-Math.pow((wavelength - 560.0) / 30.0, 2));
  }

  static SpectralDataset gaussianDataset(double from, double to, double step) {
    List<SpectralSample> samples = new ArrayList<>();
    for (double l = from; l <= to + 1e-9; l += step) {
      samples.add(new SpectralSample(l, donor(l), acceptor(l)));
    }
    return new SpectralDataset(samples);
  }

  static SpectralTable gaussianTable() {
    List<Map<String, String>> rows = new ArrayList<>();
    // Deliberately out of order, with one unusable row.
    for (int l = 650; l >= 450; l -= 2) {
      Map<String, String> row = new HashMap<>();
      row.put(WAVELENGTH, Integer.toString(l));
      row.put(DONOR, Double.toString(donor(l)));
      row.put(ACCEPTOR, Double.toString(acceptor(l)));
      rows.add(row);
    }
    Map<String, String> bad = new HashMap<>();
    bad.put(WAVELENGTH, "--");
    bad.put(DONOR, "1.0");
    bad.put(ACCEPTOR, "1.0");
    rows.add(bad);
    return new SpectralTable(Arrays.asList(WAVELENGTH, DONOR, ACCEPTOR), rows);
  }
}
