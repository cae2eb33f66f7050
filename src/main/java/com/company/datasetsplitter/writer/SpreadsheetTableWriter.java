package com.company.datasetsplitter.writer;

import com.company.datasetsplitter.model.WriterKind;
import com.company.datasetsplitter.table.Table;
import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.streaming.SXSSFWorkbook;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Single-sheet xlsx writer. The header goes in the first row; null values leave the cell absent.
 * Uses the streaming workbook so only a window of rows is held in memory.
 */
public class SpreadsheetTableWriter extends AbstractTableWriter {

    /** Data rows that fit below the header row. */
    public static final int MAX_DATA_ROWS = SpreadsheetVersion.EXCEL2007.getLastRowIndex();

    private static final int ROW_ACCESS_WINDOW = 100;

    private final String sheetName;

    public SpreadsheetTableWriter(String sheetName) {
        this.sheetName = sheetName;
    }

    public String getSheetName() {
        return sheetName;
    }

    @Override
    public WriterKind getKind() {
        return WriterKind.SPREADSHEET;
    }

    @Override
    protected void writeFile(Table table, Path file) throws IOException {
        if (table.getRowCount() > MAX_DATA_ROWS) {
            throw new IOException("Spreadsheet row limit exceeded: " + table.getRowCount()
                    + " rows, at most " + MAX_DATA_ROWS + " fit in one sheet");
        }

        SXSSFWorkbook workbook = new SXSSFWorkbook(ROW_ACCESS_WINDOW);
        try (OutputStream out = Files.newOutputStream(file)) {
            Sheet sheet = workbook.createSheet(sheetName);
            writeRow(sheet.createRow(0), table.getColumns().toArray(new String[0]));
            List<String[]> rows = table.getRows();
            for (int i = 0; i < rows.size(); i++) {
                writeRow(sheet.createRow(i + 1), rows.get(i));
            }
            workbook.write(out);
        } finally {
            workbook.dispose();
            workbook.close();
        }
    }

    private static void writeRow(Row row, String[] values) {
        for (int i = 0; i < values.length; i++) {
            if (values[i] != null) {
                row.createCell(i).setCellValue(values[i]);
            }
        }
    }
}
