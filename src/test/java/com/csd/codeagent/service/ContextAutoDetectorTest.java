package com.csd.codeagent.service;

import com.csd.codeagent.model.AnalysisContext;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ContextAutoDetectorTest {

    private final ContextAutoDetector detector = new ContextAutoDetector();

    @Test
    void extensionDecidesLanguage() {
        assertEquals("typescript", detector.languageFromExtension("src/App.TSX"));
        assertEquals("python", detector.languageFromExtension("main.py"));
        assertNull(detector.languageFromExtension("Makefile"));
        assertNull(detector.languageFromExtension("weird."));
    }

    @Test
    void codeHeuristicsWhenNoFileName() {
        assertEquals("typescript", detector.languageFromCode("function f(a: string): void {}"));
        assertEquals("python", detector.languageFromCode("def handler(event):\n    return event"));
        assertEquals("go", detector.languageFromCode("package main\n\nfunc main() {}"));
        assertEquals("java", detector.languageFromCode("public class Foo {\n}"));
        assertNull(detector.languageFromCode("x = 1"));
    }

    @Test
    void frameworkFromImports() {
        assertEquals("react", detector.frameworkFromImports("import React from 'react';"));
        assertEquals("express", detector.frameworkFromImports("const express = require('express');"));
        assertEquals("spring-boot", detector.frameworkFromImports("import org.springframework.boot.SpringApplication;"));
        assertEquals("fastapi", detector.frameworkFromImports("from fastapi import FastAPI"));
        assertNull(detector.frameworkFromImports("import os"));
    }

    @Test
    void scopeFromShape() {
        assertEquals("snippet", detector.scopeOf("a = 1\nb = 2"));
        assertEquals("full", detector.scopeOf("export function main() {}\n"));
        assertEquals("partial", detector.scopeOf("x = 1\n".repeat(12)));
    }

    @Test
    void detectCombinesSignals() {
        AnalysisContext context = detector.detect("import express from 'express';\nconst app = express();", "server.js");
        assertEquals("javascript", context.getLanguage());
        assertEquals("express", context.getFramework());
        assertEquals("snippet", context.getScope());
    }
}
