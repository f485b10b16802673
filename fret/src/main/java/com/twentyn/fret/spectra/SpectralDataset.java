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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An immutable, wavelength-ordered list of at least two spectral samples.  Instances are normally produced by
 * {@link DataCleaner}; the constructor re-checks ordering so hand-built datasets obey the same rules.
 */
public class SpectralDataset {
  public static final int MIN_SAMPLES = 2;

  private final List<SpectralSample> samples;

  public SpectralDataset(List<SpectralSample> samples) {
    if (samples == null || samples.size() < MIN_SAMPLES) {
      throw new IllegalArgumentException(String.format("A spectral dataset needs at least %d samples, got %d",
          MIN_SAMPLES, samples == null ? 0 : samples.size()));
    }
    for (int i = 1; i < samples.size(); i++) {
      if (samples.get(i).getWavelength() < samples.get(i - 1).getWavelength()) {
        throw new IllegalArgumentException(String.format(
            "Spectral samples must be ordered by wavelength, but sample %d (%s nm) precedes sample %d (%s nm)",
            i - 1, samples.get(i - 1).getWavelength(), i, samples.get(i).getWavelength()));
      }
    }
    this.samples = Collections.unmodifiableList(new ArrayList<>(samples));
  }

  public int size() {
    return samples.size();
  }

  public SpectralSample get(int i) {
    return samples.get(i);
  }

  public double[] getWavelengths() {
    double[] vals = new double[samples.size()];
    for (int i = 0; i < vals.length; i++) {
      vals[i] = samples.get(i).getWavelength();
    }
    return vals;
  }

  public double[] getDonorIntensities() {
    double[] vals = new double[samples.size()];
    for (int i = 0; i < vals.length; i++) {
      vals[i] = samples.get(i).getDonorIntensity();
    }
    return vals;
  }

  public double[] getAcceptorAbsorptivities() {
    double[] vals = new double[samples.size()];
    for (int i = 0; i < vals.length; i++) {
      vals[i] = samples.get(i).getAcceptorAbsorptivity();
    }
    return vals;
  }
}
