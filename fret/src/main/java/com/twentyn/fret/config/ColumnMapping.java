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

import com.twentyn.fret.errors.InputException;
import com.twentyn.fret.spectra.SpectralTable;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Maps each {@link SpectralRole} to the name of the table column holding it.  Tables carry no fixed schema, so the
 * mapping is checked against a table's header once, before any value is read.
 */
public class ColumnMapping {
  private final Map<SpectralRole, String> columns;

  public ColumnMapping(Map<SpectralRole, String> columns) {
    this.columns = new EnumMap<>(SpectralRole.class);
    this.columns.putAll(columns);
  }

  public static ColumnMapping of(String wavelengthColumn, String donorColumn, String acceptorColumn) {
    Map<SpectralRole, String> columns = new EnumMap<>(SpectralRole.class);
    if (wavelengthColumn != null) {
      columns.put(SpectralRole.WAVELENGTH, wavelengthColumn);
    }
    if (donorColumn != null) {
      columns.put(SpectralRole.DONOR_INTENSITY, donorColumn);
    }
    if (acceptorColumn != null) {
      columns.put(SpectralRole.ACCEPTOR_ABSORPTIVITY, acceptorColumn);
    }
    return new ColumnMapping(columns);
  }

  public String getColumn(SpectralRole role) {
    return columns.get(role);
  }

  /**
   * Checks that every role is mapped and that every mapped column exists in the table.
   * @param table The table the mapping will be applied to.
   * @throws InputException listing all unmapped roles and absent columns.
   */
  public void validate(SpectralTable table) throws InputException {
    List<String> problems = new ArrayList<>();
    for (SpectralRole role : SpectralRole.values()) {
      String column = columns.get(role);
      if (column == null || column.isEmpty()) {
        problems.add(String.format("no column is mapped to role '%s'", role.getKey()));
      } else if (!table.hasColumn(column)) {
        problems.add(String.format("column '%s' mapped to role '%s' is not in the table", column, role.getKey()));
      }
    }
    if (!problems.isEmpty()) {
      throw new InputException(String.format("invalid column mapping: %s (available columns: %s)",
          String.join("; ", problems), table.getHeader()));
    }
  }

  @Override
  public String toString() {
    return "ColumnMapping" + columns;
  }
}
