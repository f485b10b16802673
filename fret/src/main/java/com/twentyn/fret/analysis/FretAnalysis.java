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

import com.twentyn.fret.config.ColumnMapping;
import com.twentyn.fret.errors.FretException;
import com.twentyn.fret.spectra.DataCleaner;
import com.twentyn.fret.spectra.SpectralDataset;
import com.twentyn.fret.spectra.SpectralTable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs the whole FRET calculation: clean the table, compute J, then R0, then E and r, then classify r.  Holds no state
 * between runs beyond the physical constants it was built with.
 */
public class FretAnalysis {
  private static final Logger LOGGER = LogManager.getFormatterLogger(FretAnalysis.class);

  private final DataCleaner dataCleaner;
  private final OverlapIntegralCalculator overlapIntegralCalculator;
  private final ForsterDistanceCalculator forsterDistanceCalculator;
  private final EfficiencyDistanceCalculator efficiencyDistanceCalculator;
  private final RangeValidator rangeValidator;

  public FretAnalysis(PhysicalConstants constants) {
    this.dataCleaner = new DataCleaner();
    this.overlapIntegralCalculator = new OverlapIntegralCalculator();
    this.forsterDistanceCalculator = new ForsterDistanceCalculator(constants);
    this.efficiencyDistanceCalculator = new EfficiencyDistanceCalculator();
    this.rangeValidator = new RangeValidator();
  }

  public ComputationResult analyze(SpectralTable table, ColumnMapping mapping, IntensityReadings readings)
      throws FretException {
    SpectralDataset dataset = dataCleaner.clean(table, mapping);
    LOGGER.info("Using %d of %d rows spanning %.2f-%.2f nm", dataset.size(), table.getRowCount(),
        dataset.get(0).getWavelength(), dataset.get(dataset.size() - 1).getWavelength());
    return analyze(dataset, readings);
  }

  public ComputationResult analyze(SpectralDataset dataset, IntensityReadings readings) throws FretException {
    OverlapIntegral overlapIntegral = overlapIntegralCalculator.calculate(dataset);
    double forsterDistance = forsterDistanceCalculator.calculate(overlapIntegral.getValue());
    EfficiencyAndDistance efficiencyAndDistance = efficiencyDistanceCalculator.calculate(readings, forsterDistance);
    RangeVerdict verdict = rangeValidator.validate(efficiencyAndDistance.getDistance(), forsterDistance);

    LOGGER.info("J = %e, R0 = %.4f nm, E = %.4f, r = %.4f nm (%s)", overlapIntegral.getValue(), forsterDistance,
        efficiencyAndDistance.getEfficiency(), efficiencyAndDistance.getDistance(), verdict.getStatus());
    return new ComputationResult(overlapIntegral, forsterDistance, efficiencyAndDistance, verdict);
  }

  public AnalysisOutcome analyzeSafely(SpectralTable table, ColumnMapping mapping, IntensityReadings readings) {
    try {
      return AnalysisOutcome.success(analyze(table, mapping, readings));
    } catch (FretException e) {
      LOGGER.warn("FRET analysis failed: %s", e.getMessage());
      return AnalysisOutcome.failure(e);
    }
  }

  public AnalysisOutcome analyzeSafely(SpectralDataset dataset, IntensityReadings readings) {
    try {
      return AnalysisOutcome.success(analyze(dataset, readings));
    } catch (FretException e) {
      LOGGER.warn("FRET analysis failed: %s", e.getMessage());
      return AnalysisOutcome.failure(e);
    }
  }
}
