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

package com.twentyn.fret.util;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

/**
 * Option handling shared by the command line entry points: parsing, typed option lookup and usage output.  Problems
 * with the arguments surface as {@link UsageException}s so the caller decides how to exit.
 */
public class CLIUtil {
  private static final Logger LOGGER = LogManager.getFormatterLogger(CLIUtil.class);

  public static final String OPTION_HELP = "h";

  private static final int HELP_WIDTH = 100;

  private final String commandName;
  private final String helpMessage;
  private final Options opts = new Options();

  public CLIUtil(Class<?> callingClass, String helpMessage, List<Option.Builder> optionBuilders) {
    this.commandName = callingClass.getCanonicalName();
    this.helpMessage = helpMessage;

    List<Option.Builder> builders = new ArrayList<>(optionBuilders);
    builders.add(Option.builder(OPTION_HELP)
        .argName("help")
        .desc("Prints this help message")
        .longOpt("help")
    );
    for (Option.Builder b : builders) {
      opts.addOption(b.build());
    }
  }

  /**
   * Parses the arguments against the registered options.
   * @param args The raw arguments.
   * @return The parsed command line.
   * @throws UsageException with exit status 0 if help was requested, or 1 if the arguments don't parse.
   */
  public CommandLine parseCommandLine(String[] args) throws UsageException {
    // Help wins over missing required options, so look for it before a strict parse.
    for (String arg : args) {
      if (("-" + OPTION_HELP).equals(arg) || "--help".equals(arg)) {
        throw new UsageException(null, 0);
      }
    }
    try {
      CommandLineParser parser = new DefaultParser();
      return parser.parse(opts, args);
    } catch (ParseException e) {
      throw new UsageException(String.format("Argument parsing failed: %s", e.getMessage()));
    }
  }

  /**
   * Reads a numeric option.
   * @return The option's value, or null if it wasn't given.
   * @throws UsageException if the value is not a finite number.
   */
  public Double getDoubleOption(CommandLine cl, String option) throws UsageException {
    if (!cl.hasOption(option)) {
      return null;
    }
    String value = cl.getOptionValue(option);
    double parsed;
    try {
      parsed = Double.parseDouble(value);
    } catch (NumberFormatException e) {
      throw new UsageException(String.format("Option -%s expects a number, got '%s'", option, value));
    }
    if (!Double.isFinite(parsed)) {
      throw new UsageException(String.format("Option -%s expects a finite number, got '%s'", option, value));
    }
    return parsed;
  }

  /**
   * Reads an option naming a file that must already exist.
   * @return The file, or null if the option wasn't given.
   * @throws UsageException if the named file does not exist.
   */
  public File getExistingFile(CommandLine cl, String option, String description) throws UsageException {
    if (!cl.hasOption(option)) {
      return null;
    }
    File file = new File(cl.getOptionValue(option));
    if (!file.isFile()) {
      throw new UsageException(String.format("%s at %s does not exist", description, file.getPath()));
    }
    return file;
  }

  public String formatHelp() {
    StringWriter out = new StringWriter();
    try (PrintWriter writer = new PrintWriter(out)) {
      HelpFormatter formatter = new HelpFormatter();
      formatter.printHelp(writer, HELP_WIDTH, commandName, helpMessage, opts,
          formatter.getLeftPadding(), formatter.getDescPadding(), null, true);
    }
    return out.toString();
  }

  /**
   * Logs the problem, if any, and prints usage to stdout.
   * @return The exit status the process should end with.
   */
  public int reportUsage(UsageException e) {
    if (e.getMessage() != null) {
      LOGGER.error(e.getMessage());
    }
    System.out.print(formatHelp());
    return e.getExitStatus();
  }
}
