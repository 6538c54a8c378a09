package com.csd.codeagent.service;

import com.csd.codeagent.model.AnalysisContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Best-effort guesses for language, framework and scope from the file name and the code.
 */
@Slf4j
@Service
public class ContextAutoDetector {

    private static final Map<String, String> EXTENSION_LANGUAGES = new LinkedHashMap<>();
    private static final Map<Pattern, String> FRAMEWORK_IMPORTS = new LinkedHashMap<>();

    static {
        EXTENSION_LANGUAGES.put("ts", "typescript");
        EXTENSION_LANGUAGES.put("tsx", "typescript");
        EXTENSION_LANGUAGES.put("js", "javascript");
        EXTENSION_LANGUAGES.put("jsx", "javascript");
        EXTENSION_LANGUAGES.put("mjs", "javascript");
        EXTENSION_LANGUAGES.put("cjs", "javascript");
        EXTENSION_LANGUAGES.put("py", "python");
        EXTENSION_LANGUAGES.put("go", "go");
        EXTENSION_LANGUAGES.put("rs", "rust");
        EXTENSION_LANGUAGES.put("java", "java");
        EXTENSION_LANGUAGES.put("kt", "kotlin");
        EXTENSION_LANGUAGES.put("kts", "kotlin");
        EXTENSION_LANGUAGES.put("cs", "csharp");
        EXTENSION_LANGUAGES.put("rb", "ruby");
        EXTENSION_LANGUAGES.put("php", "php");
        EXTENSION_LANGUAGES.put("swift", "swift");
        EXTENSION_LANGUAGES.put("c", "c");
        EXTENSION_LANGUAGES.put("h", "c");
        EXTENSION_LANGUAGES.put("cpp", "cpp");
        EXTENSION_LANGUAGES.put("cc", "cpp");
        EXTENSION_LANGUAGES.put("hpp", "cpp");
        EXTENSION_LANGUAGES.put("scala", "scala");
        EXTENSION_LANGUAGES.put("sh", "shell");
        EXTENSION_LANGUAGES.put("bash", "shell");
        EXTENSION_LANGUAGES.put("sql", "sql");
        EXTENSION_LANGUAGES.put("vue", "vue");
        EXTENSION_LANGUAGES.put("svelte", "svelte");

        FRAMEWORK_IMPORTS.put(Pattern.compile("from\\s+['\"]react['\"]|require\\(['\"]react['\"]\\)"), "react");
        FRAMEWORK_IMPORTS.put(Pattern.compile("from\\s+['\"]next(/[\\w-]+)?['\"]"), "nextjs");
        FRAMEWORK_IMPORTS.put(Pattern.compile("from\\s+['\"]vue['\"]"), "vue");
        FRAMEWORK_IMPORTS.put(Pattern.compile("from\\s+['\"]@angular/core['\"]"), "angular");
        FRAMEWORK_IMPORTS.put(Pattern.compile("from\\s+['\"]@nestjs/core['\"]|from\\s+['\"]@nestjs/common['\"]"), "nestjs");
        FRAMEWORK_IMPORTS.put(Pattern.compile("from\\s+['\"]express['\"]|require\\(['\"]express['\"]\\)"), "express");
        FRAMEWORK_IMPORTS.put(Pattern.compile("from\\s+['\"]fastify['\"]|require\\(['\"]fastify['\"]\\)"), "fastify");
        FRAMEWORK_IMPORTS.put(Pattern.compile("(?m)^\\s*(from\\s+django|import\\s+django)"), "django");
        FRAMEWORK_IMPORTS.put(Pattern.compile("(?m)^\\s*(from\\s+flask|import\\s+flask)"), "flask");
        FRAMEWORK_IMPORTS.put(Pattern.compile("(?m)^\\s*(from\\s+fastapi|import\\s+fastapi)"), "fastapi");
        FRAMEWORK_IMPORTS.put(Pattern.compile("import\\s+org\\.springframework\\.boot"), "spring-boot");
        FRAMEWORK_IMPORTS.put(Pattern.compile("import\\s+org\\.springframework"), "spring");
    }

    private static final Pattern TS_TYPES = Pattern.compile(":\\s*(string|number|boolean|any|void|never)\\b");
    private static final Pattern TS_INTERFACE = Pattern.compile("interface\\s+\\w+\\s*\\{");
    private static final Pattern PYTHON = Pattern.compile("(?m)^(def\\s+\\w+\\s*\\(|class\\s+\\w+.*:\\s*$|from\\s+\\w+\\s+import)");
    private static final Pattern GO = Pattern.compile("(?m)^(package\\s+\\w+\\s*$|func\\s+\\w+\\s*\\()");
    private static final Pattern RUST = Pattern.compile("(?m)^(fn\\s+\\w+\\s*\\(|use\\s+\\w+::)");
    private static final Pattern JAVA = Pattern.compile("(?m)^(public\\s+)?(final\\s+)?(class|interface|enum)\\s+\\w+.*\\{|^package\\s+[\\w.]+;");
    private static final Pattern JS_MODULE = Pattern.compile("(?m)^(import|export)\\s+");

    private static final Pattern HAS_IMPORTS = Pattern.compile("(?m)^import\\s");
    private static final Pattern HAS_REQUIRE = Pattern.compile("(?m)^(const|let|var)\\s+.*=\\s*require\\(");
    private static final Pattern FULL_FILE = Pattern.compile(
            "(?m)^export\\s|module\\.exports\\s*=|^(async\\s+)?function\\s+main|^(export\\s+)?(public\\s+)?(class|interface|type|enum)\\s+\\w+");

    public AnalysisContext detect(String code, String fileName) {
        AnalysisContext.AnalysisContextBuilder detected = AnalysisContext.builder();
        if (code == null) {
            return detected.build();
        }

        String language = fileName != null ? languageFromExtension(fileName) : null;
        if (language == null) {
            language = languageFromCode(code);
        }
        detected.language(language);
        detected.framework(frameworkFromImports(code));
        detected.scope(scopeOf(code));

        AnalysisContext result = detected.build();
        log.debug("Auto-detected context: language={}, framework={}, scope={}",
                result.getLanguage(), result.getFramework(), result.getScope());
        return result;
    }

    String languageFromExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) return null;
        return EXTENSION_LANGUAGES.get(fileName.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    String languageFromCode(String code) {
        if (TS_TYPES.matcher(code).find() || TS_INTERFACE.matcher(code).find()) return "typescript";
        if (JAVA.matcher(code).find()) return "java";
        if (PYTHON.matcher(code).find()) return "python";
        if (GO.matcher(code).find()) return "go";
        if (RUST.matcher(code).find()) return "rust";
        if (JS_MODULE.matcher(code).find()) return "javascript";
        return null;
    }

    String frameworkFromImports(String code) {
        for (Map.Entry<Pattern, String> entry : FRAMEWORK_IMPORTS.entrySet()) {
            if (entry.getKey().matcher(code).find()) {
                return entry.getValue();
            }
        }
        return null;
    }

    String scopeOf(String code) {
        String trimmed = code.trim();
        int lineCount = trimmed.split("\n", -1).length;
        if (FULL_FILE.matcher(trimmed).find()) {
            return "full";
        }
        boolean imports = HAS_IMPORTS.matcher(trimmed).find() || HAS_REQUIRE.matcher(trimmed).find();
        if (imports && lineCount > 10) {
            return "partial";
        }
        return lineCount < 10 ? "snippet" : "partial";
    }
}
