package com.deepansh.desk.render;

import com.deepansh.desk.context.ContextKeys;
import com.deepansh.desk.context.ContextPropagator;
import com.deepansh.desk.validation.ExpenseCategory;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Writes the application form as an Excel workbook with Apache POI.
 *
 * Layout: title, applicant block, then either a route table (travel) or
 * the receipt details, followed by purpose, manager pre-approval, total
 * and approval status. Amounts are numeric cells formatted {@code #,##0}.
 */
public class XlsxReportRenderer extends FileReportRenderer {

    static final String SHEET_NAME = "Application";
    static final String[] ROUTE_HEADERS = {"No.", "Departure", "Destination", "Date", "Transport", "Cost (yen)"};

    public XlsxReportRenderer(Path outputDirectory, Clock clock) {
        super(outputDirectory, clock);
    }

    @Override
    protected String extension() {
        return "xlsx";
    }

    @Override
    protected void write(Path target, RenderRequest request, String applicant) throws IOException {
        Map<String, Object> p = request.parameters();
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            Styles styles = new Styles(workbook);
            Sheet sheet = workbook.createSheet(SHEET_NAME);

            Row titleRow = sheet.createRow(0);
            titleRow.createCell(0).setCellValue(ReportLines.title(request.actionName()));
            titleRow.getCell(0).setCellStyle(styles.title);
            sheet.addMergedRegion(new CellRangeAddress(0, 0, 0, ROUTE_HEADERS.length - 1));

            int row = 2;
            row = labelled(sheet, row, styles, "Applicant", applicant);
            row = labelled(sheet, row, styles, "Application date",
                    ContextPropagator.valueOf(request.context(), ContextKeys.APPLICATION_DATE, "-"));
            row++;

            if (p.get("routes") instanceof List<?> routes) {
                row = routeTable(sheet, row, styles, routes);
            } else {
                row = labelled(sheet, row, styles, "Store", p.get("storeName"));
                row = amount(sheet, row, styles, "Amount", p.get("amount"));
                row = labelled(sheet, row, styles, "Purchase date", p.get("date"));
                row = labelled(sheet, row, styles, "Category", categoryLabel(p.get("expenseCategory")));
                row = labelled(sheet, row, styles, "Items", joined(p.get("items")));
            }
            row++;

            row = labelled(sheet, row, styles, "Purpose", p.get("purpose"));
            Object approved = p.get("managerApproved");
            if (approved != null) {
                row = labelled(sheet, row, styles, "Manager pre-approval", Boolean.TRUE.equals(approved) ? "yes" : "no");
            }
            row = amount(sheet, row, styles, "Total", p.get("totalAmount"));
            row++;

            Row status = sheet.createRow(row);
            status.createCell(0).setCellValue("Approval status");
            status.getCell(0).setCellStyle(styles.label);
            status.createCell(1).setCellValue("Approved");
            status.getCell(1).setCellStyle(styles.approved);

            sheet.setColumnWidth(0, 22 * 256);
            for (int c = 1; c < ROUTE_HEADERS.length; c++) {
                sheet.setColumnWidth(c, 18 * 256);
            }

            try (OutputStream out = Files.newOutputStream(target)) {
                workbook.write(out);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private static int routeTable(Sheet sheet, int row, Styles styles, List<?> routes) {
        Row header = sheet.createRow(row++);
        for (int c = 0; c < ROUTE_HEADERS.length; c++) {
            header.createCell(c).setCellValue(ROUTE_HEADERS[c]);
            header.getCell(c).setCellStyle(styles.label);
        }
        int n = 1;
        for (Object o : routes) {
            Map<String, Object> route = (Map<String, Object>) o;
            Row r = sheet.createRow(row++);
            r.createCell(0).setCellValue(n++);
            r.createCell(1).setCellValue(text(route.get("departure")));
            r.createCell(2).setCellValue(text(route.get("destination")));
            r.createCell(3).setCellValue(text(route.get("date")));
            r.createCell(4).setCellValue(text(route.get("transportType")));
            if (route.get("cost") instanceof Number cost) {
                r.createCell(5).setCellValue(cost.doubleValue());
                r.getCell(5).setCellStyle(styles.yen);
            } else {
                r.createCell(5).setCellValue(text(route.get("cost")));
            }
        }
        return row;
    }

    private static int labelled(Sheet sheet, int row, Styles styles, String label, Object value) {
        if (value == null || value.toString().isBlank()) {
            return row;
        }
        Row r = sheet.createRow(row);
        r.createCell(0).setCellValue(label);
        r.getCell(0).setCellStyle(styles.label);
        r.createCell(1).setCellValue(value.toString());
        return row + 1;
    }

    private static int amount(Sheet sheet, int row, Styles styles, String label, Object value) {
        if (!(value instanceof Number number)) {
            return labelled(sheet, row, styles, label, value);
        }
        Row r = sheet.createRow(row);
        r.createCell(0).setCellValue(label);
        r.getCell(0).setCellStyle(styles.label);
        r.createCell(1).setCellValue(number.doubleValue());
        r.getCell(1).setCellStyle(styles.yen);
        return row + 1;
    }

    private static String categoryLabel(Object category) {
        if (category == null) {
            return null;
        }
        return ExpenseCategory.fromText(category.toString())
                .map(ExpenseCategory::label)
                .orElse(category.toString());
    }

    private static String joined(Object items) {
        if (items instanceof List<?> list) {
            return String.join(", ", list.stream().map(String::valueOf).toList());
        }
        return items == null ? null : items.toString();
    }

    private static String text(Object value) {
        return value == null ? "" : value.toString();
    }

    private static final class Styles {

        final CellStyle title;
        final CellStyle label;
        final CellStyle yen;
        final CellStyle approved;

        Styles(XSSFWorkbook workbook) {
            Font titleFont = workbook.createFont();
            titleFont.setBold(true);
            titleFont.setFontHeightInPoints((short) 14);
            title = workbook.createCellStyle();
            title.setFont(titleFont);

            Font labelFont = workbook.createFont();
            labelFont.setBold(true);
            label = workbook.createCellStyle();
            label.setFont(labelFont);
            label.setFillForegroundColor(IndexedColors.PALE_BLUE.getIndex());
            label.setFillPattern(FillPatternType.SOLID_FOREGROUND);

            yen = workbook.createCellStyle();
            yen.setDataFormat(workbook.createDataFormat().getFormat("#,##0"));

            Font approvedFont = workbook.createFont();
            approvedFont.setBold(true);
            approvedFont.setColor(IndexedColors.GREEN.getIndex());
            approved = workbook.createCellStyle();
            approved.setFont(approvedFont);
        }
    }
}
