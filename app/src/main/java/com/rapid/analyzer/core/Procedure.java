package com.rapid.analyzer.core;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A single PROC or FUNC found in a RAPID file.
 * Body lines are appended by the scanner while the procedure is open and never afterwards.
 */
public final class Procedure {

    private final String moduleName;
    private final Path file;
    private final String name;
    private final String qualifiedName;
    private final List<String> bodyLines = new ArrayList<>();
    private int codeLines;

    public Procedure(String moduleName, Path file, String name) {
        this.moduleName = moduleName;
        this.file = Objects.requireNonNull(file);
        this.name = Objects.requireNonNull(name);
        this.qualifiedName = qualify(moduleName, name);
    }

    /**
     * {@code module::name}, or the bare name when the module is unknown.
     */
    public static String qualify(String moduleName, String name) {
        return moduleName == null || moduleName.isEmpty() ? name : moduleName + "::" + name;
    }

    public void addLine(String line) {
        bodyLines.add(line);
        codeLines++;
    }

    public String moduleName() {
        return moduleName;
    }

    public Path file() {
        return file;
    }

    public String name() {
        return name;
    }

    public String qualifiedName() {
        return qualifiedName;
    }

    public List<String> bodyLines() {
        return Collections.unmodifiableList(bodyLines);
    }

    public int codeLines() {
        return codeLines;
    }

    /**
     * Entry points are named MAIN in any letter case.
     */
    public boolean isEntryPoint() {
        return isEntryPointName(qualifiedName) || "main".equalsIgnoreCase(name);
    }

    public static boolean isEntryPointName(String qualifiedName) {
        String lower = qualifiedName.toLowerCase(Locale.ROOT);
        return lower.equals("main") || lower.endsWith("::main");
    }

    @Override
    public String toString() {
        return qualifiedName + " (" + codeLines + " lines)";
    }
}
