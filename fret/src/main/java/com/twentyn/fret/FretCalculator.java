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

package com.twentyn.fret;

import com.twentyn.fret.analysis.ComputationResult;
import com.twentyn.fret.analysis.FretAnalysis;
import com.twentyn.fret.analysis.IntensityReadings;
import com.twentyn.fret.analysis.PhysicalConstants;
import com.twentyn.fret.analysis.ResultFormatter;
import com.twentyn.fret.config.ColumnMapping;
import com.twentyn.fret.config.FretConfiguration;
import com.twentyn.fret.config.SpectralRole;
import com.twentyn.fret.errors.FretException;
import com.twentyn.fret.io.ResultJsonWriter;
import com.twentyn.fret.io.SpectralSeriesWriter;
import com.twentyn.fret.io.SpectralTableParser;
import com.twentyn.fret.spectra.PeakDetector;
import com.twentyn.fret.spectra.SpectralTable;
import com.twentyn.fret.util.CLIUtil;
import com.twentyn.fret.util.UsageException;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

public class FretCalculator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(FretCalculator.class);

  public static final String OPTION_INPUT = "i";
  public static final String OPTION_WAVELENGTH_COLUMN = "w";
  public static final String OPTION_DONOR_COLUMN = "d";
  public static final String OPTION_ACCEPTOR_COLUMN = "a";
  public static final String OPTION_CONFIG = "c";
  public static final String OPTION_ORIENTATION_FACTOR = "k";
  public static final String OPTION_QUANTUM_YIELD = "y";
  public static final String OPTION_REFRACTIVE_INDEX = "n";
  public static final String OPTION_INITIAL_INTENSITY = "b";
  public static final String OPTION_QUENCHED_INTENSITY = "q";
  public static final String OPTION_PEAK_COLUMN = "p";
  public static final String OPTION_OUTPUT_PREFIX = "o";

  public static final String SERIES_SUFFIX = ".series.tsv";
  public static final String RESULT_SUFFIX = ".result.json";

  public static final String HELP_MESSAGE = StringUtils.join(new String[]{
      "Computes FRET parameters from a spectral table: the overlap integral J between donor emission and acceptor ",
      "absorption, the Forster distance R0, the transfer efficiency E from donor quenching, and the donor-acceptor ",
      "distance r.  The table must contain wavelength (nm), donor intensity and acceptor molar absorptivity ",
      "(M^-1 cm^-1) columns; their names are given with the column options or in a JSON config file."
  }, "");

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder(OPTION_INPUT)
        .argName("input file")
        .desc("A CSV, TSV or Excel file whose first row names the columns")
        .hasArg().required()
        .longOpt("input")
    );
    add(Option.builder(OPTION_WAVELENGTH_COLUMN)
        .argName("column")
        .desc("Name of the wavelength column")
        .hasArg()
        .longOpt("wavelength-column")
    );
    add(Option.builder(OPTION_DONOR_COLUMN)
        .argName("column")
        .desc("Name of the donor emission intensity column")
        .hasArg()
        .longOpt("donor-column")
    );
    add(Option.builder(OPTION_ACCEPTOR_COLUMN)
        .argName("column")
        .desc("Name of the acceptor molar absorptivity column")
        .hasArg()
        .longOpt("acceptor-column")
    );
    add(Option.builder(OPTION_CONFIG)
        .argName("config file")
        .desc("A JSON file with physical constants, intensities and column names; command line options win")
        .hasArg()
        .longOpt("config")
    );
    add(Option.builder(OPTION_ORIENTATION_FACTOR)
        .argName("k2")
        .desc(String.format("Orientation factor kappa^2 (default %s)", PhysicalConstants.DEFAULT_ORIENTATION_FACTOR))
        .hasArg()
        .longOpt("orientation-factor")
    );
    add(Option.builder(OPTION_QUANTUM_YIELD)
        .argName("phiD")
        .desc(String.format("Donor quantum yield (default %s)", PhysicalConstants.DEFAULT_DONOR_QUANTUM_YIELD))
        .hasArg()
        .longOpt("quantum-yield")
    );
    add(Option.builder(OPTION_REFRACTIVE_INDEX)
        .argName("n")
        .desc(String.format("Refractive index of the medium (default %s)", PhysicalConstants.DEFAULT_REFRACTIVE_INDEX))
        .hasArg()
        .longOpt("refractive-index")
    );
    add(Option.builder(OPTION_INITIAL_INTENSITY)
        .argName("F0")
        .desc(String.format("Unquenched donor intensity F0 (default %s)", IntensityReadings.DEFAULT_INITIAL_INTENSITY))
        .hasArg()
        .longOpt("initial-intensity")
    );
    add(Option.builder(OPTION_QUENCHED_INTENSITY)
        .argName("F")
        .desc(String.format("Quenched donor intensity F (default %s)", IntensityReadings.DEFAULT_QUENCHED_INTENSITY))
        .hasArg()
        .longOpt("quenched-intensity")
    );
    add(Option.builder(OPTION_PEAK_COLUMN)
        .argName("column")
        .desc("Use the maximum of this column as F0, unless F0 is given on the command line")
        .hasArg()
        .longOpt("peak-column")
    );
    add(Option.builder(OPTION_OUTPUT_PREFIX)
        .argName("output prefix")
        .desc("Write the plotting series to <prefix>" + SERIES_SUFFIX + " and the results to <prefix>" + RESULT_SUFFIX)
        .hasArg()
        .longOpt("output-prefix")
    );
  }};

  private final FretConfiguration configuration;
  private final SpectralTableParser tableParser = new SpectralTableParser();
  private final PeakDetector peakDetector = new PeakDetector();
  private final ResultFormatter formatter = new ResultFormatter();

  public FretCalculator(FretConfiguration configuration) {
    this.configuration = configuration;
  }

  /**
   * Runs one analysis over a table file.
   * @param input The spectral table.
   * @param peakColumn If non-null, the column whose maximum replaces the configured F0.
   * @param outputPrefix If non-null, where to write the series and result files.
   * @return The computed result.
   * @throws FretException if the table or the numbers in it can't produce a result.
   * @throws IOException if the output files can't be written.
   */
  public ComputationResult run(File input, String peakColumn, String outputPrefix) throws FretException, IOException {
    SpectralTable table = tableParser.parse(input);
    ColumnMapping mapping = configuration.toColumnMapping();
    PhysicalConstants constants = configuration.toPhysicalConstants();
    IntensityReadings readings = configuration.toIntensityReadings();

    if (peakColumn != null) {
      double suggested = peakDetector.suggestInitialIntensity(table, peakColumn);
      LOGGER.info("Using peak intensity %.2f of column '%s' as F0", suggested, peakColumn);
      readings = readings.withInitialIntensity(suggested);
    }

    LOGGER.info("Running with %s, %s, %s", constants, readings, mapping);
    ComputationResult result = new FretAnalysis(constants).analyze(table, mapping, readings);
    report(result);

    if (outputPrefix != null) {
      File seriesFile = new File(outputPrefix + SERIES_SUFFIX);
      try (SpectralSeriesWriter writer = new SpectralSeriesWriter()) {
        writer.open(seriesFile);
        writer.append(result.getNormalizedDonorEmission(), result.getAcceptorAbsorptivity());
      }
      File resultFile = new File(outputPrefix + RESULT_SUFFIX);
      new ResultJsonWriter().write(resultFile, result, constants, readings);
      LOGGER.info("Wrote %s and %s", seriesFile.getPath(), resultFile.getPath());
    }
    return result;
  }

  private void report(ComputationResult result) {
    LOGGER.info("Overlap integral (J): %s", formatter.formatOverlapIntegral(result.getOverlapIntegral()));
    LOGGER.info("Forster distance (R0): %s", formatter.formatForsterDistance(result.getForsterDistance()));
    LOGGER.info("Efficiency (E): %s", formatter.formatEfficiency(result.getEfficiency()));
    LOGGER.info("Distance (r): %s", formatter.formatDistance(result.getDistance()));
    LOGGER.info("Summary: %s", formatter.summarize(result));
    if (result.getVerdict().isOk()) {
      LOGGER.info(result.getVerdict().getMessage());
    } else {
      LOGGER.warn(result.getVerdict().getMessage());
    }
  }

  static void applyOverrides(CLIUtil cliUtil, CommandLine cl, FretConfiguration config) throws UsageException {
    if (cl.hasOption(OPTION_WAVELENGTH_COLUMN)) {
      config.setColumn(SpectralRole.WAVELENGTH, cl.getOptionValue(OPTION_WAVELENGTH_COLUMN));
    }
    if (cl.hasOption(OPTION_DONOR_COLUMN)) {
      config.setColumn(SpectralRole.DONOR_INTENSITY, cl.getOptionValue(OPTION_DONOR_COLUMN));
    }
    if (cl.hasOption(OPTION_ACCEPTOR_COLUMN)) {
      config.setColumn(SpectralRole.ACCEPTOR_ABSORPTIVITY, cl.getOptionValue(OPTION_ACCEPTOR_COLUMN));
    }
    Double value = cliUtil.getDoubleOption(cl, OPTION_ORIENTATION_FACTOR);
    if (value != null) {
      config.setOrientationFactor(value);
    }
    value = cliUtil.getDoubleOption(cl, OPTION_QUANTUM_YIELD);
    if (value != null) {
      config.setDonorQuantumYield(value);
    }
    value = cliUtil.getDoubleOption(cl, OPTION_REFRACTIVE_INDEX);
    if (value != null) {
      config.setRefractiveIndex(value);
    }
    value = cliUtil.getDoubleOption(cl, OPTION_INITIAL_INTENSITY);
    if (value != null) {
      config.setInitialIntensity(value);
    }
    value = cliUtil.getDoubleOption(cl, OPTION_QUENCHED_INTENSITY);
    if (value != null) {
      config.setQuenchedIntensity(value);
    }
  }

  static FretConfiguration loadConfiguration(CLIUtil cliUtil, CommandLine cl) throws UsageException, IOException {
    File configFile = cliUtil.getExistingFile(cl, OPTION_CONFIG, "Config file");
    FretConfiguration config = configFile == null ? new FretConfiguration() : FretConfiguration.load(configFile);
    applyOverrides(cliUtil, cl, config);
    return config;
  }

  public static void main(String[] args) throws Exception {
    CLIUtil cliUtil = new CLIUtil(FretCalculator.class, HELP_MESSAGE, OPTION_BUILDERS);
    CommandLine cl;
    FretConfiguration config;
    File inputFile;
    try {
      cl = cliUtil.parseCommandLine(args);
      config = loadConfiguration(cliUtil, cl);
      inputFile = cliUtil.getExistingFile(cl, OPTION_INPUT, "Input file");
    } catch (UsageException e) {
      System.exit(cliUtil.reportUsage(e));
      return;
    }

    // An explicit F0 always beats the peak suggestion.
    String peakColumn = cl.hasOption(OPTION_INITIAL_INTENSITY) ? null : cl.getOptionValue(OPTION_PEAK_COLUMN);

    try {
      new FretCalculator(config).run(inputFile, peakColumn, cl.getOptionValue(OPTION_OUTPUT_PREFIX));
    } catch (IllegalArgumentException e) {
      LOGGER.error("Invalid configuration: %s", e.getMessage());
      System.exit(1);
    } catch (FretException e) {
      LOGGER.error("FRET calculation failed during %s: %s", e.getStage().getDescription(), e.getMessage());
      System.exit(1);
    }
  }
}
