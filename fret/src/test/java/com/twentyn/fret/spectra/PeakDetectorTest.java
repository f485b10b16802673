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
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class PeakDetectorTest {

  private PeakDetector detector = new PeakDetector();

  @Test
  public void testMaximumIgnoresNonNumericEntries() throws Exception {
    List<String> column = Arrays.asList("12.5", "abc", null, "3787.66", "", "Infinity", "-4");
    assertEquals(3787.66, detector.findPeak(column), 0.0);
  }

  @Test
  public void testNegativeOnlyColumn() throws Exception {
    assertEquals(-1.5, detector.findPeak(Arrays.asList("-3", "-1.5", "n/a")), 0.0);
  }

  @Test
  public void testNoNumericEntriesFails() throws Exception {
    try {
      detector.findPeak(Arrays.asList("a", "", null));
      fail("Expected a DataQualityException");
    } catch (DataQualityException e) {
      assertEquals(AnalysisStage.PEAK_DETECTION, e.getStage());
    }
  }

  @Test
  public void testSuggestionFromTableColumn() throws Exception {
    Map<String, String> first = new HashMap<>();
    first.put("F", "100");
    Map<String, String> second = new HashMap<>();
    second.put("F", "250");
    SpectralTable table = new SpectralTable(Collections.singletonList("F"), Arrays.asList(first, second));

    assertEquals(250.0, detector.suggestInitialIntensity(table, "F"), 0.0);
    // Suggesting does not change the table.
    assertEquals("250", table.getRows().get(1).get("F"));
  }

  @Test(expected = InputException.class)
  public void testSuggestionFromAbsentColumnFails() throws Exception {
    SpectralTable table = new SpectralTable(Collections.singletonList("F"),
        Collections.<Map<String, String>>emptyList());
    detector.suggestInitialIntensity(table, "F0");
  }
}
