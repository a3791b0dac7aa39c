package ca.gc.cra.halo.infrastructure.storage;

import ca.gc.cra.halo.domain.session.SessionResult;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

/** Single-sheet workbook using the flattened column layout; numeric cells stay numeric. */
final class SpreadsheetResultCodec {
  static final String SHEET_NAME = "results";

  void write(List<SessionResult> results, OutputStream out) throws IOException {
    List<Map<String, String>> rows = new ArrayList<>(results.size());
    for (SessionResult result : results) {
      rows.add(ResultFlattener.flatten(result));
    }
    List<String> columns = ResultFlattener.columns(rows);
    try (XSSFWorkbook workbook = new XSSFWorkbook()) {
      Sheet sheet = workbook.createSheet(SHEET_NAME);
      Row header = sheet.createRow(0);
      for (int c = 0; c < columns.size(); c++) {
        header.createCell(c).setCellValue(columns.get(c));
      }
      for (int r = 0; r < rows.size(); r++) {
        Row row = sheet.createRow(r + 1);
        Map<String, String> values = rows.get(r);
        for (int c = 0; c < columns.size(); c++) {
          String value = values.get(columns.get(c));
          if (value == null || value.isEmpty()) {
            continue;
          }
          Cell cell = row.createCell(c);
          if (isNumeric(columns.get(c), value)) {
            cell.setCellValue(Double.parseDouble(value));
          } else {
            cell.setCellValue(value);
          }
        }
      }
      workbook.write(out);
    }
  }

  List<SessionResult> read(InputStream in) throws IOException {
    List<SessionResult> results = new ArrayList<>();
    try (XSSFWorkbook workbook = new XSSFWorkbook(in)) {
      Sheet sheet = workbook.getSheet(SHEET_NAME);
      if (sheet == null) {
        sheet = workbook.getSheetAt(0);
      }
      Row header = sheet.getRow(0);
      if (header == null) {
        return results;
      }
      List<String> columns = new ArrayList<>();
      for (int c = 0; c < header.getLastCellNum(); c++) {
        columns.add(cellText(header.getCell(c)));
      }
      for (int r = 1; r <= sheet.getLastRowNum(); r++) {
        Row row = sheet.getRow(r);
        if (row == null) {
          continue;
        }
        Map<String, String> values = new LinkedHashMap<>();
        for (int c = 0; c < columns.size(); c++) {
          values.put(columns.get(c), cellText(row.getCell(c)));
        }
        results.add(ResultFlattener.unflatten(values));
      }
    }
    return results;
  }

  private static boolean isNumeric(String column, String value) {
    if (column.equals(ResultFlattener.SESSION_ID) || column.endsWith("_note")) {
      return false;
    }
    try {
      Double.parseDouble(value);
      return true;
    } catch (NumberFormatException notNumeric) {
      return false;
    }
  }

  private static String cellText(Cell cell) {
    if (cell == null) {
      return "";
    }
    if (cell.getCellType() == CellType.NUMERIC) {
      return ResultFlattener.formatNumber(cell.getNumericCellValue());
    }
    if (cell.getCellType() == CellType.STRING) {
      return cell.getStringCellValue();
    }
    return "";
  }
}
