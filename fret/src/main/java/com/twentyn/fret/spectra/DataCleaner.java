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

import com.twentyn.fret.config.ColumnMapping;
import com.twentyn.fret.config.SpectralRole;
import com.twentyn.fret.errors.AnalysisStage;
import com.twentyn.fret.errors.DataQualityException;
import com.twentyn.fret.errors.InputException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a raw table into a {@link SpectralDataset}: the three mapped columns are coerced to numbers, rows with a
 * missing or non-numeric value in any of them are dropped, and the survivors are stably sorted by wavelength.
 */
public class DataCleaner {
  private static final Logger LOGGER = LogManager.getFormatterLogger(DataCleaner.class);

  public SpectralDataset clean(SpectralTable table, ColumnMapping mapping)
      throws InputException, DataQualityException {
    mapping.validate(table);

    String wavelengthColumn = mapping.getColumn(SpectralRole.WAVELENGTH);
    String donorColumn = mapping.getColumn(SpectralRole.DONOR_INTENSITY);
    String acceptorColumn = mapping.getColumn(SpectralRole.ACCEPTOR_ABSORPTIVITY);

    List<SpectralSample> samples = new ArrayList<>(table.getRowCount());
    for (Map<String, String> row : table.getRows()) {
      Optional<Double> wavelength = NumericCoercion.coerce(row.get(wavelengthColumn));
      Optional<Double> donor = NumericCoercion.coerce(row.get(donorColumn));
      Optional<Double> acceptor = NumericCoercion.coerce(row.get(acceptorColumn));
      if (wavelength.isPresent() && donor.isPresent() && acceptor.isPresent()) {
        samples.add(new SpectralSample(wavelength.get(), donor.get(), acceptor.get()));
      }
    }

    int dropped = table.getRowCount() - samples.size();
    if (dropped > 0) {
      LOGGER.info("Dropped %d of %d rows with missing or non-numeric values in columns '%s', '%s', '%s'",
          dropped, table.getRowCount(), wavelengthColumn, donorColumn, acceptorColumn);
    }

    if (samples.size() < SpectralDataset.MIN_SAMPLES) {
      throw new DataQualityException(AnalysisStage.CLEANING, String.format(
          "only %d of %d rows have numeric values in all of '%s', '%s' and '%s'; at least %d are required",
          samples.size(), table.getRowCount(), wavelengthColumn, donorColumn, acceptorColumn,
          SpectralDataset.MIN_SAMPLES));
    }

    // List.sort is a stable merge sort, so rows sharing a wavelength keep their original order.
    samples.sort(Comparator.comparingDouble(SpectralSample::getWavelength));
    return new SpectralDataset(samples);
  }
}
