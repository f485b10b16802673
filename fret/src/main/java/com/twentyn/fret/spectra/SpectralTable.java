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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A raw table as handed over by a file parser: the header in column order, and every row as a map from column name to
 * the cell's text.  A cell that was absent from its row maps to null.  Nothing here has been coerced to a number yet.
 */
public class SpectralTable {
  private final List<String> header;
  private final List<Map<String, String>> rows;

  public SpectralTable(List<String> header, List<Map<String, String>> rows) {
    this.header = Collections.unmodifiableList(new ArrayList<>(header));
    List<Map<String, String>> copies = new ArrayList<>(rows.size());
    for (Map<String, String> row : rows) {
      copies.add(Collections.unmodifiableMap(new HashMap<>(row)));
    }
    this.rows = Collections.unmodifiableList(copies);
  }

  public List<String> getHeader() {
    return header;
  }

  public boolean hasColumn(String column) {
    return header.contains(column);
  }

  public List<Map<String, String>> getRows() {
    return rows;
  }

  public int getRowCount() {
    return rows.size();
  }

  /**
   * Returns the raw cells of one column, in row order.
   */
  public List<String> getColumn(String column) {
    List<String> values = new ArrayList<>(rows.size());
    for (Map<String, String> row : rows) {
      values.add(row.get(column));
    }
    return values;
  }
}
