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

package com.twentyn.fret.config;

/**
 * The semantic roles a caller assigns to columns of an uploaded spectral table.
 */
public enum SpectralRole {
  WAVELENGTH("wavelength"),
  DONOR_INTENSITY("donor_intensity"),
  ACCEPTOR_ABSORPTIVITY("acceptor_absorptivity");

  private String key;

  SpectralRole(String key) {
    this.key = key;
  }

  /**
   * The name used for this role in JSON configuration files.
   */
  public String getKey() {
    return key;
  }

  public static SpectralRole fromKey(String key) {
    for (SpectralRole role : values()) {
      if (role.key.equals(key)) {
        return role;
      }
    }
    throw new IllegalArgumentException(String.format("Unknown spectral role '%s'", key));
  }
}
