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

package com.twentyn.fret.io;

import com.twentyn.fret.analysis.SpectrumPoint;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.Closeable;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.Writer;
import java.util.Arrays;
import java.util.List;

/**
 * Writes the normalized donor emission and acceptor absorptivity curves side by side as TSV, for plotting.
 */
public class SpectralSeriesWriter implements Closeable {
  public static final String WAVELENGTH = "wavelength";
  public static final String NORMALIZED_DONOR_EMISSION = "normalized_donor_emission";
  public static final String ACCEPTOR_ABSORPTIVITY = "acceptor_absorptivity";
  public static final List<String> HEADER = Arrays.asList(WAVELENGTH, NORMALIZED_DONOR_EMISSION, ACCEPTOR_ABSORPTIVITY);

  public static final CSVFormat TSV_FORMAT = CSVFormat.newFormat('\t').
      withRecordSeparator('\n').withQuote('"').withIgnoreEmptyLines(true);

  private CSVPrinter printer;

  public void open(File f) throws IOException {
    open(new FileWriter(f));
  }

  public void open(Writer writer) throws IOException {
    printer = new CSVPrinter(writer, TSV_FORMAT.withHeader(HEADER.toArray(new String[HEADER.size()])));
  }

  @Override
  public void close() throws IOException {
    if (printer != null) {
      printer.close();
      printer = null;
    }
  }

  /**
   * Appends both series.  They are projections of the same dataset and must line up wavelength by wavelength.
   */
  public void append(List<SpectrumPoint> normalizedDonor, List<SpectrumPoint> acceptor) throws IOException {
    if (normalizedDonor.size() != acceptor.size()) {
      throw new IllegalArgumentException(String.format(
          "Series lengths differ: %d donor points vs %d acceptor points", normalizedDonor.size(), acceptor.size()));
    }
    for (int i = 0; i < normalizedDonor.size(); i++) {
      printer.printRecord(normalizedDonor.get(i).getWavelength(),
          normalizedDonor.get(i).getValue(), acceptor.get(i).getValue());
    }
    printer.flush();
  }
}
