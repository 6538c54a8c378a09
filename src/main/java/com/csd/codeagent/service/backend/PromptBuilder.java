package com.csd.codeagent.service.backend;

import com.csd.codeagent.model.AnalysisContext;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders the text sent to a backend from a template id, the resolved context and the
 * code under review.
 */
@Service
public class PromptBuilder {

    public static final String DEFAULT_TEMPLATE = "default";
    public static final Set<String> TEMPLATES = Set.of("default", "security", "performance");

    private static final String DIRECT_ANALYSIS = """
            CRITICAL: Perform DIRECT CODE ANALYSIS, not a summary.

            YOU MUST:
            - Analyze the actual code structure, logic flow, and implementation details
            - Identify specific issues with line numbers when possible
            - Provide concrete, actionable findings based on the ACTUAL code content

            DO NOT:
            - Simply describe what the code does at a high level
            - Make assumptions without examining the code""";

    static final String FORMAT_INSTRUCTIONS = """
            IMPORTANT: You MUST respond with ONLY valid JSON in this exact structure (no additional text):
            {
              "findings": [{"type": "bug|security|performance|style", "severity": "critical|high|medium|low", "line": number, "title": "string", "description": "string", "suggestion": "string"}],
              "overallAssessment": "string",
              "recommendations": ["string"]
            }
            If a field is not applicable, use an empty string.""";

    private static final String SECURITY_FOCUS = """
            Focus specifically on security vulnerabilities including:
            - Injection attacks (SQL, Command, XSS, LDAP)
            - Authentication and Authorization issues
            - Data exposure and information leakage
            - Cryptographic weaknesses
            - Input validation issues
            - Unsafe deserialization""";

    private static final String PERFORMANCE_FOCUS = """
            Focus specifically on performance issues including:
            - Inefficient algorithms and data structures
            - Memory leaks and excessive allocations
            - N+1 queries and database performance
            - Blocking operations in async code
            - Cache opportunities""";

    private static final Map<String, String> THREAT_GUIDELINES = Map.of(
            "local-user-tool", """
                    This is a LOCAL tool used by TRUSTED developers. The user controls all input.
                    - Command injection via CLI args or config files is LOW severity
                    - File path operations on the local filesystem are LOW severity
                    Focus analysis on error handling, type safety, code quality and bugs.""",
            "internal-service", """
                    This is an INTERNAL service behind authentication with limited exposure.
                    - SQL injection is HIGH
                    - SSRF is MEDIUM
                    - Missing authentication is MEDIUM""",
            "multi-tenant", """
                    This handles UNTRUSTED input from multiple tenants.
                    - All injection attacks are CRITICAL
                    - Data isolation issues are HIGH
                    - Authorization bypass is CRITICAL""",
            "public-api", """
                    This is INTERNET-FACING with untrusted input.
                    - All injection attacks are CRITICAL
                    - Authentication issues are CRITICAL
                    - Missing rate limiting is HIGH""");

    public boolean isKnown(String template) {
        return template != null && TEMPLATES.contains(template);
    }

    public String render(String template, String code, AnalysisContext context) {
        String id = isKnown(template) ? template : DEFAULT_TEMPLATE;
        StringBuilder sb = new StringBuilder();
        sb.append(DIRECT_ANALYSIS).append("\n\n");

        String contextSection = contextSection(context);
        if (!contextSection.isEmpty()) {
            sb.append(contextSection).append("\n\n");
        }
        switch (id) {
            case "security" -> sb.append(SECURITY_FOCUS).append("\n\n");
            case "performance" -> sb.append(PERFORMANCE_FOCUS).append("\n\n");
            default -> {
            }
        }
        sb.append(FORMAT_INSTRUCTIONS).append("\n\n");
        sb.append("Review this code:\n");
        String language = context != null && context.getLanguage() != null ? context.getLanguage() : "";
        sb.append("```").append(language).append("\n").append(code).append("\n```\n");
        return sb.toString();
    }

    private String contextSection(AnalysisContext context) {
        if (context == null) return "";
        List<String> parts = new ArrayList<>();
        if (context.getScope() != null) parts.add("Code Scope: " + context.getScope());
        if (context.getThreatModel() != null) parts.add("Threat Model: " + context.getThreatModel());
        if (context.getPlatform() != null) parts.add("Platform: " + context.getPlatform());
        if (context.getProjectType() != null) parts.add("Project Type: " + context.getProjectType());
        if (context.getLanguage() != null) parts.add("Language: " + context.getLanguage());
        if (context.getFramework() != null) parts.add("Framework: " + context.getFramework());
        if (context.getFocus() != null && !context.getFocus().isEmpty()) {
            parts.add("Focus Areas: " + String.join(", ", context.getFocus()));
        }
        if (context.getFileName() != null) parts.add("File: " + context.getFileName());
        if (parts.isEmpty()) return "";

        StringBuilder sb = new StringBuilder("Analysis Context:\n");
        for (String part : parts) {
            sb.append("- ").append(part).append("\n");
        }
        if (context.getThreatModel() != null) {
            String guideline = THREAT_GUIDELINES.get(context.getThreatModel());
            sb.append("\nSeverity Guidelines for \"").append(context.getThreatModel()).append("\":\n")
                    .append(guideline != null ? guideline : "Use this threat model for severity assessment.")
                    .append("\n");
        }
        return sb.toString().trim();
    }
}
