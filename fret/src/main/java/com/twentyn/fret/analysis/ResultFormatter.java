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

import java.util.Locale;

/**
 * Renders results the way they are reported to users.
 */
public class ResultFormatter {

  /**
   * Formats J with three decimals in "a.bcd x 10^e" notation, e.g. 1.234 x 10^14.
   */
  public String formatOverlapIntegral(double j) {
    String scientific = String.format(Locale.US, "%.3e", j);
    int e = scientific.indexOf('e');
    if (e < 0) {
      // NaN or Infinity
      return scientific;
    }
    String mantissa = scientific.substring(0, e);
    int exponent = Integer.parseInt(scientific.substring(e + 1));
    return String.format(Locale.US, "%s x 10^%d", mantissa, exponent);
  }

  public String formatForsterDistance(double r0) {
    return String.format(Locale.US, "%.4f nm", r0);
  }

  public String formatEfficiency(double efficiency) {
    return String.format(Locale.US, "%.4f", efficiency);
  }

  public String formatDistance(double r) {
    return String.format(Locale.US, "%.4f nm", r);
  }

  public String summarize(ComputationResult result) {
    return String.format(Locale.US, "E = %.3f | R0 = %.3f nm | r = %.3f nm",
        result.getEfficiency(), result.getForsterDistance(), result.getDistance());
  }
}
