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
import com.twentyn.fret.errors.AnalysisStage;
import com.twentyn.fret.errors.NumericDomainException;
import com.twentyn.fret.spectra.DataCleaner;
import com.twentyn.fret.spectra.SpectralDataset;
import com.twentyn.fret.spectra.SpectralTable;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class FretAnalysisTest {

  private FretAnalysis analysis;
  private SpectralTable table;
  private ColumnMapping mapping;
  private IntensityReadings readings;

  @Before
  public void setUp() {
    analysis = new FretAnalysis(new PhysicalConstants());
    table = SpectraFixtures.gaussianTable();
    mapping = ColumnMapping.of(SpectraFixtures.WAVELENGTH, SpectraFixtures.DONOR, SpectraFixtures.ACCEPTOR);
    readings = new IntensityReadings(IntensityReadings.DEFAULT_INITIAL_INTENSITY,
        IntensityReadings.DEFAULT_QUENCHED_INTENSITY);
  }

  @Test
  public void testEndToEnd() throws Exception {
    ComputationResult result = analysis.analyze(table, mapping, readings);

    assertTrue(result.getOverlapIntegral() > 0.0);
    assertTrue("R0 should be a few nm, was " + result.getForsterDistance(),
        result.getForsterDistance() > 3.0 && result.getForsterDistance() < 6.0);
    assertEquals(0.39852, result.getEfficiency(), 1e-4);
    assertEquals(Math.pow(2278.21 / (3787.66 - 2278.21), 1.0 / 6.0),
        result.getDistance() / result.getForsterDistance(), 1e-9);
    assertTrue(result.getVerdict().isOk());

    // The unusable row is gone and the series come out sorted.
    assertEquals(101, result.getNormalizedDonorEmission().size());
    assertEquals(450.0, result.getNormalizedDonorEmission().get(0).getWavelength(), 0.0);
    assertEquals(650.0, result.getAcceptorAbsorptivity().get(100).getWavelength(), 0.0);
  }

  @Test
  public void testTableAndDatasetPathsAgree() throws Exception {
    SpectralDataset dataset = new DataCleaner().clean(table, mapping);
    ComputationResult fromTable = analysis.analyze(table, mapping, readings);
    ComputationResult fromDataset = analysis.analyze(dataset, readings);

    assertEquals(fromTable.getOverlapIntegral(), fromDataset.getOverlapIntegral(), 0.0);
    assertEquals(fromTable.getForsterDistance(), fromDataset.getForsterDistance(), 0.0);
    assertEquals(fromTable.getDistance(), fromDataset.getDistance(), 0.0);
  }

  @Test
  public void testRepeatedRunsAreIdentical() throws Exception {
    ComputationResult first = analysis.analyze(table, mapping, readings);
    ComputationResult second = analysis.analyze(table, mapping, readings);
    assertEquals(first.getOverlapIntegral(), second.getOverlapIntegral(), 0.0);
    assertEquals(first.getEfficiency(), second.getEfficiency(), 0.0);
    assertEquals(first.getDistance(), second.getDistance(), 0.0);
  }

  @Test
  public void testSuggestedBaselineIsPassedExplicitly() throws Exception {
    // Half of the peak as the quenched reading puts r exactly at R0.
    IntensityReadings halfQuenched = new IntensityReadings(1000.0, 500.0);
    ComputationResult result = analysis.analyze(table, mapping, halfQuenched);
    assertEquals(0.5, result.getEfficiency(), 1e-12);
    assertEquals(result.getForsterDistance(), result.getDistance(), 1e-12);
  }

  @Test
  public void testZeroBaselineStopsThePipeline() throws Exception {
    try {
      analysis.analyze(table, mapping, new IntensityReadings(0.0, 2278.21));
      fail("Expected a NumericDomainException");
    } catch (NumericDomainException e) {
      assertEquals(AnalysisStage.EFFICIENCY_DISTANCE, e.getStage());
    }
  }

  @Test
  public void testOutcomeOfNumericFailure() {
    AnalysisOutcome outcome = analysis.analyzeSafely(table, mapping, new IntensityReadings(0.0, 2278.21));
    assertFalse(outcome.isSuccess());
    assertEquals(AnalysisOutcome.Kind.NUMERIC_DOMAIN_ERROR, outcome.getKind());
    assertEquals(AnalysisStage.EFFICIENCY_DISTANCE, outcome.getFailedStage().get());
    assertFalse(outcome.getResult().isPresent());
  }

  @Test
  public void testOutcomeOfDataQualityFailure() {
    Map<String, String> only = Collections.singletonMap(SpectraFixtures.WAVELENGTH, "500");
    SpectralTable sparse = new SpectralTable(
        Arrays.asList(SpectraFixtures.WAVELENGTH, SpectraFixtures.DONOR, SpectraFixtures.ACCEPTOR),
        Collections.singletonList(only));
    AnalysisOutcome outcome = analysis.analyzeSafely(sparse, mapping, readings);
    assertEquals(AnalysisOutcome.Kind.DATA_QUALITY_ERROR, outcome.getKind());
    assertEquals(AnalysisStage.CLEANING, outcome.getFailedStage().get());
  }

  @Test
  public void testOutcomeOfInputFailure() {
    AnalysisOutcome outcome = analysis.analyzeSafely(table,
        ColumnMapping.of(SpectraFixtures.WAVELENGTH, "missing", SpectraFixtures.ACCEPTOR), readings);
    assertEquals(AnalysisOutcome.Kind.INPUT_ERROR, outcome.getKind());
    assertTrue(outcome.getError().get().getMessage().contains("missing"));
  }

  @Test
  public void testOutcomeOfSuccess() {
    AnalysisOutcome outcome = analysis.analyzeSafely(table, mapping, readings);
    assertTrue(outcome.isSuccess());
    assertEquals(AnalysisOutcome.Kind.SUCCESS, outcome.getKind());
    assertFalse(outcome.getError().isPresent());
    assertFalse(outcome.getFailedStage().isPresent());
  }
}
