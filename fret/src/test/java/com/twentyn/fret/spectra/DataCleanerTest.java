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
import com.twentyn.fret.errors.AnalysisStage;
import com.twentyn.fret.errors.DataQualityException;
import com.twentyn.fret.errors.InputException;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class DataCleanerTest {
  private static final String WAVELENGTH = "Wavelength";
  private static final String DONOR = "Donor";
  private static final String ACCEPTOR = "Acceptor";
  private static final List<String> HEADER = Arrays.asList(WAVELENGTH, DONOR, ACCEPTOR, "Notes");

  private DataCleaner cleaner;
  private ColumnMapping mapping;

  @Before
  public void setUp() {
    cleaner = new DataCleaner();
    mapping = ColumnMapping.of(WAVELENGTH, DONOR, ACCEPTOR);
  }

  @Test
  public void testNonNumericRowsAreDroppedAndRestSorted() throws Exception {
    List<Map<String, String>> rows = new ArrayList<>();
    rows.add(row("500", "10", "100"));
    rows.add(row("abc", "5", "5"));
    rows.add(row("480", "20", "200"));
    rows.add(row("490", " 15 ", "150"));
    rows.add(row("510", "", "1"));
    rows.add(row("520", "NaN", "3"));
    SpectralTable table = new SpectralTable(HEADER, rows);

    SpectralDataset dataset = cleaner.clean(table, mapping);

    assertEquals(3, dataset.size());
    assertEquals(new SpectralSample(480.0, 20.0, 200.0), dataset.get(0));
    assertEquals(new SpectralSample(490.0, 15.0, 150.0), dataset.get(1));
    assertEquals(new SpectralSample(500.0, 10.0, 100.0), dataset.get(2));

    // The raw table is left untouched.
    assertEquals(6, table.getRowCount());
    assertEquals("500", table.getRows().get(0).get(WAVELENGTH));
    assertEquals("abc", table.getRows().get(1).get(WAVELENGTH));
  }

  @Test
  public void testEqualWavelengthsKeepTheirOrder() throws Exception {
    List<Map<String, String>> rows = new ArrayList<>();
    rows.add(row("500", "1", "1"));
    rows.add(row("490", "2", "2"));
    rows.add(row("500", "3", "3"));
    SpectralDataset dataset = cleaner.clean(new SpectralTable(HEADER, rows), mapping);

    assertEquals(2.0, dataset.get(0).getDonorIntensity(), 0.0);
    assertEquals(1.0, dataset.get(1).getDonorIntensity(), 0.0);
    assertEquals(3.0, dataset.get(2).getDonorIntensity(), 0.0);
  }

  @Test
  public void testAbsentCellsCountAsMissing() throws Exception {
    List<Map<String, String>> rows = new ArrayList<>();
    rows.add(row("500", "1", "1"));
    rows.add(row("510", "2", "2"));
    Map<String, String> shortRow = new HashMap<>();
    shortRow.put(WAVELENGTH, "520");
    rows.add(shortRow);

    assertEquals(2, cleaner.clean(new SpectralTable(HEADER, rows), mapping).size());
  }

  @Test
  public void testTooFewValidRowsFails() throws Exception {
    List<Map<String, String>> rows = new ArrayList<>();
    rows.add(row("500", "1", "1"));
    rows.add(row("x", "2", "2"));
    rows.add(row("520", "inf", "2"));
    try {
      cleaner.clean(new SpectralTable(HEADER, rows), mapping);
      fail("Expected a DataQualityException");
    } catch (DataQualityException e) {
      assertEquals(AnalysisStage.CLEANING, e.getStage());
      assertTrue(e.getMessage(), e.getMessage().contains("only 1 of 3 rows"));
    }
  }

  @Test(expected = InputException.class)
  public void testMissingColumnFailsFast() throws Exception {
    List<Map<String, String>> rows = new ArrayList<>();
    rows.add(row("500", "1", "1"));
    rows.add(row("510", "2", "2"));
    cleaner.clean(new SpectralTable(HEADER, rows), ColumnMapping.of(WAVELENGTH, "Emission", ACCEPTOR));
  }

  @Test(expected = InputException.class)
  public void testUnmappedRoleFailsFast() throws Exception {
    List<Map<String, String>> rows = new ArrayList<>();
    rows.add(row("500", "1", "1"));
    rows.add(row("510", "2", "2"));
    cleaner.clean(new SpectralTable(HEADER, rows), ColumnMapping.of(WAVELENGTH, DONOR, null));
  }

  private static Map<String, String> row(String wavelength, String donor, String acceptor) {
    Map<String, String> row = new HashMap<>();
    row.put(WAVELENGTH, wavelength);
    row.put(DONOR, donor);
    row.put(ACCEPTOR, acceptor);
    row.put("Notes", "");
    return row;
  }
}
