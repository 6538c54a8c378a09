package com.csd.codeagent.service.scanner;

import com.csd.codeagent.exception.ScanException;
import com.csd.codeagent.exception.ValidationException;
import com.csd.codeagent.model.Finding;
import com.csd.codeagent.model.FindingSummary;
import com.csd.codeagent.model.SecretFinding;
import com.csd.codeagent.model.SecretScanReport;
import com.csd.codeagent.service.ResultFormatter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Standalone secret scan over a code snippet, independent of any backend.
 */
@Slf4j
public class SecretScanService {

    private final SecretScanner scanner;
    private final ResultFormatter formatter;
    private final Clock clock;
    private final int maxCodeLength;

    public SecretScanService(SecretScanner scanner, ResultFormatter formatter, Clock clock, int maxCodeLength) {
        this.scanner = scanner;
        this.formatter = formatter;
        this.clock = clock;
        this.maxCodeLength = maxCodeLength;
    }

    public SecretScanReport scanSecrets(String code, String fileName) {
        if (code == null || code.isEmpty()) {
            throw new ValidationException("Code cannot be empty");
        }
        if (code.length() > maxCodeLength) {
            throw new ValidationException(String.format("Code exceeds maximum length of %,d characters", maxCodeLength));
        }

        Instant started = clock.instant();
        List<SecretFinding> secrets;
        try {
            secrets = scanner.scan(code, fileName);
        } catch (RuntimeException e) {
            throw new ScanException("Secret scan failed", e);
        }
        List<Finding> asFindings = scanner.toFindings(secrets);

        Map<String, Integer> byCategory = new TreeMap<>();
        for (SecretFinding secret : secrets) {
            byCategory.merge(secret.getCategory().value(), 1, Integer::sum);
        }

        long durationMs = Math.max(0, clock.millis() - started.toEpochMilli());
        SecretScanReport report = SecretScanReport.builder()
                .scanId("secrets-" + UUID.randomUUID())
                .timestamp(started)
                .summary(FindingSummary.of(asFindings))
                .byCategory(byCategory)
                .findings(secrets)
                .patternsUsed(scanner.patternCount())
                .durationMs(durationMs)
                .fileName(fileName)
                .build();
        report.setText(formatter.formatSecretScan(report));

        log.info("Secret scan {} completed: {} findings in {}ms", report.getScanId(), secrets.size(), durationMs);
        return report;
    }
}
