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

import com.twentyn.fret.errors.AnalysisStage;
import com.twentyn.fret.errors.DataQualityException;
import com.twentyn.fret.errors.InputException;

import java.util.List;
import java.util.Optional;

/**
 * Finds the largest numeric value in a raw intensity column.  The result is only a suggestion for the unquenched donor
 * intensity F0; callers decide whether to pass it on to {@code IntensityReadings}.
 */
public class PeakDetector {

  public double findPeak(List<String> rawValues) throws DataQualityException {
    Double max = null;
    for (String cell : rawValues) {
      Optional<Double> value = NumericCoercion.coerce(cell);
      if (value.isPresent() && (max == null || value.get() > max)) {
        max = value.get();
      }
    }
    if (max == null) {
      throw new DataQualityException(AnalysisStage.PEAK_DETECTION,
          String.format("none of the %d values in the intensity column are numeric", rawValues.size()));
    }
    return max;
  }

  public double suggestInitialIntensity(SpectralTable table, String column)
      throws InputException, DataQualityException {
    if (!table.hasColumn(column)) {
      throw new InputException(String.format("column '%s' is not present in the table (columns: %s)",
          column, table.getHeader()));
    }
    return findPeak(table.getColumn(column));
  }
}
