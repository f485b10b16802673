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

import org.junit.Test;

import java.util.Optional;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

public class NumericCoercionTest {

  @Test
  public void testDecimalAndScientificNotationAreRead() {
    assertEquals(Optional.of(520.0), NumericCoercion.coerce("520"));
    assertEquals(Optional.of(-0.5), NumericCoercion.coerce(" -.5 "));
    assertEquals(Optional.of(5.0), NumericCoercion.coerce("5."));
    assertEquals(Optional.of(12000.0), NumericCoercion.coerce("+1.2E4"));
    assertEquals(Optional.of(0.003), NumericCoercion.coerce("3e-3"));
  }

  @Test
  public void testJavaLiteralSuffixesAndHexAreMissing() {
    for (String cell : new String[]{"12d", "3f", "4.5D", "7F", "0x1p3", "0x10", "1e", "1.2.3", "n/a"}) {
      assertFalse("'" + cell + "' should not be read as a number", NumericCoercion.coerce(cell).isPresent());
    }
  }

  @Test
  public void testBlankAndNonFiniteCellsAreMissing() {
    for (String cell : new String[]{null, "", "   ", "NaN", "Infinity", "-Infinity", "1e999"}) {
      assertFalse(NumericCoercion.coerce(cell).isPresent());
    }
  }
}
