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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.twentyn.fret.analysis.ComputationResult;
import com.twentyn.fret.analysis.IntensityReadings;
import com.twentyn.fret.analysis.PhysicalConstants;
import com.twentyn.fret.analysis.ResultFormatter;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serializes a run's inputs and results to JSON: raw values, their display strings, the verdict and both curves.
 */
public class ResultJsonWriter {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  private final ResultFormatter formatter = new ResultFormatter();

  public void write(File file, ComputationResult result, PhysicalConstants constants, IntensityReadings readings)
      throws IOException {
    OBJECT_MAPPER.writeValue(file, toDocument(result, constants, readings));
  }

  public void write(OutputStream outStream, ComputationResult result, PhysicalConstants constants,
                    IntensityReadings readings) throws IOException {
    OBJECT_MAPPER.writeValue(outStream, toDocument(result, constants, readings));
  }

  Map<String, Object> toDocument(ComputationResult result, PhysicalConstants constants, IntensityReadings readings) {
    Map<String, Object> inputs = new LinkedHashMap<>();
    inputs.put("orientation_factor", constants.getOrientationFactor());
    inputs.put("donor_quantum_yield", constants.getDonorQuantumYield());
    inputs.put("refractive_index", constants.getRefractiveIndex());
    inputs.put("initial_intensity", readings.getInitialIntensity());
    inputs.put("quenched_intensity", readings.getQuenchedIntensity());

    Map<String, Object> formatted = new LinkedHashMap<>();
    formatted.put("overlap_integral", formatter.formatOverlapIntegral(result.getOverlapIntegral()));
    formatted.put("forster_distance", formatter.formatForsterDistance(result.getForsterDistance()));
    formatted.put("efficiency", formatter.formatEfficiency(result.getEfficiency()));
    formatted.put("distance", formatter.formatDistance(result.getDistance()));
    formatted.put("summary", formatter.summarize(result));

    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put("inputs", inputs);
    doc.put("overlap_integral", result.getOverlapIntegral());
    doc.put("forster_distance_nm", result.getForsterDistance());
    doc.put("efficiency", result.getEfficiency());
    doc.put("distance_nm", result.getDistance());
    doc.put("validation", result.getVerdict());
    doc.put("formatted", formatted);
    doc.put("normalized_donor_emission", result.getNormalizedDonorEmission());
    doc.put("acceptor_absorptivity", result.getAcceptorAbsorptivity());
    return doc;
  }
}
