package com.csd.codeagent.service;

import com.csd.codeagent.model.AggregatedResult;
import com.csd.codeagent.model.AnalysisResult;
import com.csd.codeagent.model.Finding;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Exports the findings of a completed analysis as CSV, Excel or JSON.
 */
@Slf4j
@Service
public class FindingExportService {

    private static final String[] HEADERS =
            {"Severity", "Category", "Title", "Line", "Confidence", "Sources", "Description", "Suggestion"};

    private final ObjectMapper objectMapper;

    public FindingExportService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * One row per merged finding.
     */
    public String exportCsv(AggregatedResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.join(",", HEADERS)).append("\n");
        for (Finding finding : findings(result)) {
            String[] cells = cells(finding);
            for (int i = 0; i < cells.length; i++) {
                if (i > 0) sb.append(",");
                sb.append(escapeCsv(cells[i]));
            }
            sb.append("\n");
        }
        return sb.toString();
    }

    /**
     * A "Findings" sheet, followed by one sheet per backend when individual analyses
     * were kept.
     */
    public byte[] exportExcel(AggregatedResult result) throws IOException {
        try (Workbook workbook = new XSSFWorkbook()) {
            CellStyle headerStyle = workbook.createCellStyle();
            Font headerFont = workbook.createFont();
            headerFont.setBold(true);
            headerStyle.setFont(headerFont);

            writeSheet(workbook.createSheet("Findings"), headerStyle, findings(result));

            Map<String, AnalysisResult> individual = result.getIndividualAnalyses();
            if (individual != null) {
                for (Map.Entry<String, AnalysisResult> entry : individual.entrySet()) {
                    List<Finding> backendFindings = entry.getValue().getFindings();
                    writeSheet(workbook.createSheet(sanitizeSheetName(entry.getKey())), headerStyle,
                            backendFindings != null ? backendFindings : List.of());
                }
            }

            ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
            workbook.write(outputStream);
            log.debug("Exported {} findings of {} to xlsx", findings(result).size(), result.getId());
            return outputStream.toByteArray();
        }
    }

    public String exportJson(AggregatedResult result) throws IOException {
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result);
    }

    private void writeSheet(Sheet sheet, CellStyle headerStyle, List<Finding> findings) {
        Row headerRow = sheet.createRow(0);
        for (int i = 0; i < HEADERS.length; i++) {
            Cell cell = headerRow.createCell(i);
            cell.setCellValue(HEADERS[i]);
            cell.setCellStyle(headerStyle);
        }

        int rowNum = 1;
        for (Finding finding : findings) {
            Row row = sheet.createRow(rowNum++);
            String[] cells = cells(finding);
            for (int i = 0; i < cells.length; i++) {
                if (i == 3 && finding.getLine() != null) {
                    row.createCell(i).setCellValue(finding.getLine());
                } else {
                    row.createCell(i).setCellValue(cells[i]);
                }
            }
        }

        for (int i = 0; i < HEADERS.length; i++) {
            sheet.autoSizeColumn(i);
        }
    }

    private static List<Finding> findings(AggregatedResult result) {
        return result.getFindings() != null ? result.getFindings() : List.of();
    }

    private static String[] cells(Finding finding) {
        return new String[]{
                finding.getSeverity() != null ? finding.getSeverity().value() : "",
                finding.getCategory(),
                finding.getTitle(),
                finding.getLine() != null ? String.valueOf(finding.getLine()) : "",
                finding.getConfidence() != null ? finding.getConfidence().value() : "",
                finding.getSources() != null ? String.join(";", finding.getSources()) : "",
                finding.getDescription(),
                finding.getSuggestion()
        };
    }

    private String escapeCsv(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    private String sanitizeSheetName(String name) {
        // Excel sheet names can't contain: \ / ? * [ ]
        String sanitized = name.replaceAll("[\\\\/:*?\\[\\]]", "_");
        if (sanitized.length() > 31) {
            sanitized = sanitized.substring(0, 31);
        }
        return sanitized;
    }
}
