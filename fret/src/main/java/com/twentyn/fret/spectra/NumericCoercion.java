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

import org.apache.commons.lang3.StringUtils;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Lenient text-to-number conversion for spreadsheet cells.  Anything that isn't a finite number counts as missing.
 * Only plain decimal and scientific notation is read: Java literal forms like {@code 12d}, {@code 3f} or
 * {@code 0x1p3} are treated as text.
 */
public final class NumericCoercion {
  private static final Pattern DECIMAL_PATTERN =
      Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?$");

  private NumericCoercion() {
  }

  public static Optional<Double> coerce(String cell) {
    if (StringUtils.isBlank(cell)) {
      return Optional.empty();
    }
    String text = cell.trim();
    if (!DECIMAL_PATTERN.matcher(text).matches()) {
      return Optional.empty();
    }
    double value = Double.parseDouble(text);
    if (!Double.isFinite(value)) {
      return Optional.empty();
    }
    return Optional.of(value);
  }
}
