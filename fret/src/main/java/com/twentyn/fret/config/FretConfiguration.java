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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.twentyn.fret.analysis.IntensityReadings;
import com.twentyn.fret.analysis.PhysicalConstants;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * User-editable settings for a FRET run, bound from JSON.  Fields left out of a configuration file, or set to null in
 * it, keep their defaults, which are the reference values used by the lab this tool was written for.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class FretConfiguration {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  @JsonProperty("orientation_factor")
  @JsonSetter(nulls = Nulls.SKIP)
  private double orientationFactor = PhysicalConstants.DEFAULT_ORIENTATION_FACTOR;

  @JsonProperty("donor_quantum_yield")
  @JsonSetter(nulls = Nulls.SKIP)
  private double donorQuantumYield = PhysicalConstants.DEFAULT_DONOR_QUANTUM_YIELD;

  @JsonProperty("refractive_index")
  @JsonSetter(nulls = Nulls.SKIP)
  private double refractiveIndex = PhysicalConstants.DEFAULT_REFRACTIVE_INDEX;

  @JsonProperty("initial_intensity")
  @JsonSetter(nulls = Nulls.SKIP)
  private double initialIntensity = IntensityReadings.DEFAULT_INITIAL_INTENSITY;

  @JsonProperty("quenched_intensity")
  @JsonSetter(nulls = Nulls.SKIP)
  private double quenchedIntensity = IntensityReadings.DEFAULT_QUENCHED_INTENSITY;

  // Keyed by SpectralRole.getKey().
  @JsonProperty("columns")
  @JsonSetter(nulls = Nulls.SKIP)
  private Map<String, String> columns = new HashMap<>();

  public FretConfiguration() {}

  public static FretConfiguration load(File file) throws IOException {
    return OBJECT_MAPPER.readValue(file, FretConfiguration.class);
  }

  public static FretConfiguration load(InputStream inStream) throws IOException {
    return OBJECT_MAPPER.readValue(inStream, FretConfiguration.class);
  }

  public double getOrientationFactor() {
    return orientationFactor;
  }

  public void setOrientationFactor(double orientationFactor) {
    this.orientationFactor = orientationFactor;
  }

  public double getDonorQuantumYield() {
    return donorQuantumYield;
  }

  public void setDonorQuantumYield(double donorQuantumYield) {
    this.donorQuantumYield = donorQuantumYield;
  }

  public double getRefractiveIndex() {
    return refractiveIndex;
  }

  public void setRefractiveIndex(double refractiveIndex) {
    this.refractiveIndex = refractiveIndex;
  }

  public double getInitialIntensity() {
    return initialIntensity;
  }

  public void setInitialIntensity(double initialIntensity) {
    this.initialIntensity = initialIntensity;
  }

  public double getQuenchedIntensity() {
    return quenchedIntensity;
  }

  public void setQuenchedIntensity(double quenchedIntensity) {
    this.quenchedIntensity = quenchedIntensity;
  }

  public Map<String, String> getColumns() {
    return columns;
  }

  public void setColumn(SpectralRole role, String column) {
    this.columns.put(role.getKey(), column);
  }

  public PhysicalConstants toPhysicalConstants() {
    return new PhysicalConstants(orientationFactor, donorQuantumYield, refractiveIndex);
  }

  public IntensityReadings toIntensityReadings() {
    return new IntensityReadings(initialIntensity, quenchedIntensity);
  }

  public ColumnMapping toColumnMapping() {
    Map<SpectralRole, String> mapping = new EnumMap<>(SpectralRole.class);
    for (Map.Entry<String, String> entry : columns.entrySet()) {
      mapping.put(SpectralRole.fromKey(entry.getKey()), entry.getValue());
    }
    return new ColumnMapping(mapping);
  }
}
