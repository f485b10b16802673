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

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

public class SpectrumPoint implements Serializable {
  private static final long serialVersionUID = 3371920552478113106L;

  @JsonProperty("wavelength")
  private Double wavelength;

  @JsonProperty("value")
  private Double value;

  public SpectrumPoint(Double wavelength, Double value) {
    this.wavelength = wavelength;
    this.value = value;
  }

  public SpectrumPoint() {}

  public Double getWavelength() {
    return wavelength;
  }

  public Double getValue() {
    return value;
  }
}
