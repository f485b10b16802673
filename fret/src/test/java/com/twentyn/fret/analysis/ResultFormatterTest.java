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

import org.junit.Test;

import java.util.Collections;

import static org.junit.Assert.assertEquals;

public class ResultFormatterTest {

  private ResultFormatter formatter = new ResultFormatter();

  @Test
  public void testOverlapIntegralNotation() {
    assertEquals("1.234 x 10^14", formatter.formatOverlapIntegral(1.234e14));
    assertEquals("1.235 x 10^15", formatter.formatOverlapIntegral(1.2345678e15));
    assertEquals("5.600 x 10^-5", formatter.formatOverlapIntegral(5.6e-5));
    assertEquals("-2.000 x 10^3", formatter.formatOverlapIntegral(-2000.0));
  }

  @Test
  public void testFixedPointQuantities() {
    assertEquals("3.9755 nm", formatter.formatForsterDistance(3.9755233757698));
    assertEquals("0.3985", formatter.formatEfficiency(0.3985178183891901));
    assertEquals("4.2578 nm", formatter.formatDistance(4.257847949397962));
  }

  @Test
  public void testSummary() {
    OverlapIntegral overlap = new OverlapIntegral(1.0e15, 1.0,
        Collections.<SpectrumPoint>emptyList(), Collections.<SpectrumPoint>emptyList());
    ComputationResult result = new ComputationResult(overlap, 3.9755233757698,
        new EfficiencyAndDistance(0.3985178183891901, 4.257847949397962),
        new RangeVerdict(RangeVerdict.Status.OK, "ok"));
    assertEquals("E = 0.399 | R0 = 3.976 nm | r = 4.258 nm", formatter.summarize(result));
  }
}
