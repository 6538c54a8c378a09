package com.csd.codeagent.controller;

import com.csd.codeagent.exception.ValidationException;
import com.csd.codeagent.model.AggregatedResult;
import com.csd.codeagent.model.AnalysisRequest;
import com.csd.codeagent.model.AnalysisResponse;
import com.csd.codeagent.model.ExportFormat;
import com.csd.codeagent.model.SecretScanReport;
import com.csd.codeagent.model.StatusEntry;
import com.csd.codeagent.service.AnalysisOrchestrator;
import com.csd.codeagent.service.FindingExportService;
import com.csd.codeagent.service.scanner.SecretScanService;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

@Slf4j
@RestController
@RequestMapping("/api")
public class AnalysisController {

    private static final String XLSX_MEDIA_TYPE = "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";

    private final AnalysisOrchestrator orchestrator;
    private final SecretScanService secretScanService;
    private final FindingExportService exportService;

    @Value("${spring.application.name:ai-code-agent}")
    private String applicationName;

    public AnalysisController(AnalysisOrchestrator orchestrator,
                              SecretScanService secretScanService,
                              FindingExportService exportService) {
        this.orchestrator = orchestrator;
        this.secretScanService = secretScanService;
        this.exportService = exportService;
    }

    @PostMapping("/analyze")
    public Mono<AnalysisResponse> analyze(@RequestBody AnalysisRequest request) {
        log.info("Analyze request received for backends {}", request.getBackends());
        return orchestrator.execute(request);
    }

    @PostMapping("/secrets/scan")
    public SecretScanReport scanSecrets(@RequestBody SecretScanRequest request) {
        return secretScanService.scanSecrets(request.getCode(), request.getFileName());
    }

    @GetMapping("/analysis/{id}/status")
    public Mono<StatusEntry> status(@PathVariable String id) {
        return orchestrator.getStatus(id);
    }

    /**
     * Findings of a completed analysis as csv, xlsx or json.
     */
    @GetMapping("/analysis/{id}/export/{format}")
    public Mono<ResponseEntity<byte[]>> export(@PathVariable String id, @PathVariable String format) {
        ExportFormat exportFormat;
        try {
            exportFormat = ExportFormat.fromValue(format);
        } catch (IllegalArgumentException e) {
            return Mono.error(new ValidationException("Unsupported export format: " + format));
        }
        log.info("Export request: analysis={}, format={}", id, exportFormat);
        return orchestrator.getResult(id).map(result -> render(id, result, exportFormat));
    }

    private ResponseEntity<byte[]> render(String id, AggregatedResult result, ExportFormat format) {
        byte[] body;
        MediaType mediaType;
        try {
            switch (format) {
                case CSV -> {
                    body = exportService.exportCsv(result).getBytes(StandardCharsets.UTF_8);
                    mediaType = MediaType.parseMediaType("text/csv");
                }
                case XLSX -> {
                    body = exportService.exportExcel(result);
                    mediaType = MediaType.parseMediaType(XLSX_MEDIA_TYPE);
                }
                default -> {
                    body = exportService.exportJson(result).getBytes(StandardCharsets.UTF_8);
                    mediaType = MediaType.APPLICATION_JSON;
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Export of " + id + " failed", e);
        }

        HttpHeaders headers = new HttpHeaders();
        headers.add(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + applicationName + "-" + id + "."
                + format.name().toLowerCase(Locale.ROOT) + "\"");
        return ResponseEntity.ok()
                .headers(headers)
                .contentType(mediaType)
                .body(body);
    }

    @Data
    public static class SecretScanRequest {
        private String code;
        private String fileName;
    }
}
