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

import com.twentyn.fret.errors.InputException;
import com.twentyn.fret.spectra.SpectralTable;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PushbackReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads a spectral table from a delimited text file or a spreadsheet.  The first row is always the header; cell text is
 * kept as-is so that numeric coercion can happen later, per column.
 */
public class SpectralTableParser {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SpectralTableParser.class);

  private static final int BYTE_ORDER_MARK = 0xFEFF;

  // The header row is read as an ordinary record so that blank and repeated column names can be renamed.
  public static final CSVFormat CSV_FORMAT = CSVFormat.DEFAULT.
      withIgnoreEmptyLines(true).withIgnoreSurroundingSpaces(true);

  public static final CSVFormat TSV_FORMAT = CSVFormat.newFormat('\t').
      withRecordSeparator('\n').withQuote('"').withIgnoreEmptyLines(true);

  public enum Format {
    CSV,
    TSV,
    EXCEL;

    public static Format fromFileName(String name) throws InputException {
      String lower = name.toLowerCase(Locale.ROOT);
      if (lower.endsWith(".csv")) {
        return CSV;
      }
      if (lower.endsWith(".tsv") || lower.endsWith(".txt")) {
        return TSV;
      }
      if (lower.endsWith(".xlsx") || lower.endsWith(".xls")) {
        return EXCEL;
      }
      throw new InputException(String.format(
          "can't tell the format of '%s'; expected a .csv, .tsv, .txt, .xlsx or .xls file", name));
    }
  }

  public SpectralTable parse(File file) throws InputException {
    Format format = Format.fromFileName(file.getName());
    LOGGER.info("Reading %s table from %s", format, file.getAbsolutePath());
    try (InputStream inStream = new FileInputStream(file)) {
      return parse(inStream, format);
    } catch (IOException e) {
      throw new InputException(String.format("could not read '%s': %s", file.getPath(), e.getMessage()), e);
    }
  }

  public SpectralTable parse(InputStream inStream, Format format) throws InputException {
    try {
      switch (format) {
        case CSV:
          return parseDelimited(inStream, CSV_FORMAT);
        case TSV:
          return parseDelimited(inStream, TSV_FORMAT);
        case EXCEL:
          return parseWorkbook(inStream);
        default:
          throw new IllegalArgumentException("Unhandled format " + format);
      }
    } catch (IOException e) {
      throw new InputException(String.format("could not parse %s table: %s", format, e.getMessage()), e);
    } catch (IllegalArgumentException | IllegalStateException | UncheckedIOException e) {
      // commons-csv reports malformed records this way.
      throw new InputException(String.format("malformed %s table: %s", format, e.getMessage()), e);
    }
  }

  private SpectralTable parseDelimited(InputStream inStream, CSVFormat csvFormat) throws IOException, InputException {
    List<Map<String, String>> results = new ArrayList<>();
    List<String> header = new ArrayList<>();
    try (CSVParser parser = new CSVParser(skipByteOrderMark(
        new InputStreamReader(inStream, StandardCharsets.UTF_8)), csvFormat)) {
      Iterator<CSVRecord> iter = parser.iterator();
      if (!iter.hasNext()) {
        throw new InputException("table has no header row");
      }
      Set<String> seen = new HashSet<>();
      for (String name : iter.next()) {
        header.add(columnName(name, header.size(), seen));
      }
      while (iter.hasNext()) {
        CSVRecord r = iter.next();
        // Cells past the end of a short row are left out; cells past the last header are dropped.
        Map<String, String> values = new HashMap<>();
        for (int c = 0; c < header.size() && c < r.size(); c++) {
          values.put(header.get(c), r.get(c));
        }
        results.add(values);
      }
    }
    return new SpectralTable(header, results);
  }

  // Spreadsheet programs like to prefix CSV exports with a BOM, which would otherwise end up in the first column name.
  private Reader skipByteOrderMark(Reader reader) throws IOException {
    PushbackReader pushbackReader = new PushbackReader(reader, 1);
    int first = pushbackReader.read();
    if (first != -1 && first != BYTE_ORDER_MARK) {
      pushbackReader.unread(first);
    }
    return pushbackReader;
  }

  private SpectralTable parseWorkbook(InputStream inStream) throws IOException, InputException {
    DataFormatter formatter = new DataFormatter();
    try (Workbook workbook = WorkbookFactory.create(inStream)) {
      if (workbook.getNumberOfSheets() == 0) {
        throw new InputException("workbook has no sheets");
      }
      Sheet sheet = workbook.getSheetAt(0);
      Row headerRow = sheet.getRow(sheet.getFirstRowNum());
      if (headerRow == null || headerRow.getLastCellNum() <= 0) {
        throw new InputException(String.format("sheet '%s' has no header row", sheet.getSheetName()));
      }

      List<String> header = new ArrayList<>(headerRow.getLastCellNum());
      Set<String> seen = new HashSet<>();
      for (int c = 0; c < headerRow.getLastCellNum(); c++) {
        Cell cell = headerRow.getCell(c);
        header.add(columnName(cell == null ? "" : formatter.formatCellValue(cell), c, seen));
      }

      List<Map<String, String>> results = new ArrayList<>();
      for (int r = headerRow.getRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
        Row row = sheet.getRow(r);
        if (row == null) {
          continue;
        }
        Map<String, String> values = new HashMap<>();
        for (int c = 0; c < header.size(); c++) {
          values.put(header.get(c), cellText(row.getCell(c)));
        }
        results.add(values);
      }
      LOGGER.debug("Read %d rows from sheet '%s'", results.size(), sheet.getSheetName());
      return new SpectralTable(header, results);
    }
  }

  /**
   * Names a header cell the way spreadsheet users expect: a blank cell becomes "Unnamed: <index>", and a name already
   * taken gets a ".1", ".2", ... suffix.  Index columns and trailing delimiters written by other tools produce blanks.
   * @param raw The header cell text.
   * @param index The zero-based column index.
   * @param seen Names already assigned to earlier columns; updated with the returned name.
   */
  static String columnName(String raw, int index, Set<String> seen) {
    String base = StringUtils.isBlank(raw) ? String.format("Unnamed: %d", index) : raw.trim();
    String name = base;
    for (int copy = 1; seen.contains(name); copy++) {
      name = String.format("%s.%d", base, copy);
    }
    seen.add(name);
    return name;
  }

  private String cellText(Cell cell) {
    if (cell == null) {
      return "";
    }
    CellType type = cell.getCellType();
    if (type == CellType.FORMULA) {
      type = cell.getCachedFormulaResultType();
    }
    switch (type) {
      case NUMERIC:
        return Double.toString(cell.getNumericCellValue());
      case STRING:
        return cell.getStringCellValue();
      case BOOLEAN:
        return Boolean.toString(cell.getBooleanCellValue());
      default:
        return "";
    }
  }
}
