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
 * FRET is most sensitive to distance changes near R0.  Distances within [0.5 R0, 1.5 R0] are reported as OK, anything
 * else (including a NaN distance) as a warning.  This never throws.
 */
public class RangeValidator {
  public static final double LOWER_BOUND_FACTOR = 0.5;
  public static final double UPPER_BOUND_FACTOR = 1.5;

  public RangeVerdict validate(double distance, double forsterDistance) {
    boolean ok = LOWER_BOUND_FACTOR * forsterDistance <= distance && distance <= UPPER_BOUND_FACTOR * forsterDistance;
    if (ok) {
      return new RangeVerdict(RangeVerdict.Status.OK, String.format(Locale.US,
          "Distance r (%.2f nm) is within sensitive range (0.5R0 to 1.5R0)", distance));
    }
    return new RangeVerdict(RangeVerdict.Status.WARN, String.format(Locale.US,
        "Distance r (%.2f nm) is outside optimal sensitivity range for FRET (0.5R0 to 1.5R0)", distance));
  }
}
