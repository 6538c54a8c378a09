package com.csd.codeagent.service.scanner;

import com.csd.codeagent.config.AgentProperties;
import com.csd.codeagent.exception.ValidationException;
import com.csd.codeagent.model.SecretScanReport;
import com.csd.codeagent.service.ResultFormatter;
import com.csd.codeagent.support.MutableClock;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SecretScanServiceTest {

    private final SecretScanService service = new SecretScanService(
            new SecretScanner(new AgentProperties.SecretScanning()),
            new ResultFormatter(200, 200_000),
            MutableClock.startingAt("2024-05-01T10:00:00Z"),
            1_000);

    @Test
    void reportCountsBySeverityAndCategory() {
        SecretScanReport report = service.scanSecrets("const key = \"ghp_" + "b".repeat(36) + "\";", "client.ts");

        assertTrue(report.getScanId().startsWith("secrets-"));
        assertEquals(1, report.getFindings().size());
        assertEquals(1, report.getSummary().getCritical());
        assertEquals(1, report.getByCategory().get("token"));
        assertTrue(report.getPatternsUsed() > 0);
        assertEquals("client.ts", report.getFileName());
        assertNotNull(report.getText());
        assertFalse(report.getText().contains("b".repeat(36)));
    }

    @Test
    void cleanCodeGivesEmptyReport() {
        SecretScanReport report = service.scanSecrets("int x = 1;", null);
        assertTrue(report.getFindings().isEmpty());
        assertEquals(0, report.getSummary().getTotalFindings());
        assertFalse(report.getText().isBlank());
    }

    @Test
    void rejectsEmptyAndOversizedCode() {
        assertThrows(ValidationException.class, () -> service.scanSecrets("", null));
        assertThrows(ValidationException.class, () -> service.scanSecrets(null, null));
        assertThrows(ValidationException.class, () -> service.scanSecrets("x".repeat(1_001), null));
    }
}
