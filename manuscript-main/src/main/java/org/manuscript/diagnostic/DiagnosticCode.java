package org.manuscript.diagnostic;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The stable code table. Codes are part of the tool's public surface (users name them
 * in suppression comments and config files), so existing entries never change meaning
 * and new entries are appended.
 * <p>
 * Templates are {@link String#format} patterns filled by {@link Diagnostic#of}.
 */
public enum DiagnosticCode {

    // ── Structural ──────────────────────────────────────────────
    E001("MS-E001", Severity.ERROR, Category.STRUCTURAL, "Unmatched closing '%s'"),
    E002("MS-E002", Severity.ERROR, Category.STRUCTURAL, "Mismatched delimiter: expected '%s' (opened at %s), got '%s'"),
    E003("MS-E003", Severity.ERROR, Category.STRUCTURAL, "Unclosed '%s'"),
    E010("MS-E010", Severity.ERROR, Category.STRUCTURAL, "Plugin must start with '{'"),
    E011("MS-E011", Severity.ERROR, Category.STRUCTURAL, "Plugin must end with '}'"),

    // ── Plugin envelope ─────────────────────────────────────────
    E012("MS-E012", Severity.ERROR, Category.SYNTAX, "Expected member definition (Name \"...\"), got '%s'"),
    E013("MS-E013", Severity.ERROR, Category.SYNTAX, "Malformed method '%s': %s"),

    // ── Call arity ──────────────────────────────────────────────
    E020("MS-E020", Severity.ERROR, Category.ARITY, "%s() requires at least %d args, got %d"),
    E021("MS-E021", Severity.ERROR, Category.ARITY, "%s() accepts at most %d args, got %d"),
    E022("MS-E022", Severity.ERROR, Category.ARITY, "%s() expects %s args, got %d"),

    // ── Tokenization ────────────────────────────────────────────
    E030("MS-E030", Severity.ERROR, Category.TOKENIZATION, "Unterminated string"),
    E031("MS-E031", Severity.ERROR, Category.TOKENIZATION, "Unexpected character '%s'"),

    // ── Statements and expressions ──────────────────────────────
    E040("MS-E040", Severity.ERROR, Category.SYNTAX, "Expected '(' after '%s'"),
    E041("MS-E041", Severity.ERROR, Category.SYNTAX, "Expected loop variable after '%s'"),
    E042("MS-E042", Severity.ERROR, Category.SYNTAX, "Expected 'case' or 'default' in switch, got '%s'"),
    E043("MS-E043", Severity.ERROR, Category.SYNTAX, "Expected '{' after %s"),
    E044("MS-E044", Severity.ERROR, Category.SYNTAX, "Expected ';' after %s"),
    E045("MS-E045", Severity.ERROR, Category.SYNTAX, "Expected expression after '='"),
    E046("MS-E046", Severity.ERROR, Category.SYNTAX, "Expected expression after '%s'"),
    E047("MS-E047", Severity.ERROR, Category.SYNTAX, "Expected name after '.'"),
    E048("MS-E048", Severity.ERROR, Category.SYNTAX, "Unexpected token '%s'"),
    E049("MS-E049", Severity.ERROR, Category.SYNTAX, "Expected expression, got '%s'"),
    E050("MS-E050", Severity.ERROR, Category.SYNTAX, "Expected ')' after %s condition"),
    E051("MS-E051", Severity.ERROR, Category.SYNTAX, "Expected 'in' after loop variable '%s'"),
    E052("MS-E052", Severity.ERROR, Category.SYNTAX, "Expected 'in' or loop variable after '%s'"),
    E053("MS-E053", Severity.ERROR, Category.SYNTAX, "Expected '=' after loop variable '%s'"),
    E054("MS-E054", Severity.ERROR, Category.SYNTAX, "Expected 'to' in for loop"),
    E055("MS-E055", Severity.ERROR, Category.SYNTAX, "Expected ')' to close arguments of '%s'"),
    E056("MS-E056", Severity.ERROR, Category.SYNTAX, "Expected ']' after index"),
    E057("MS-E057", Severity.ERROR, Category.SYNTAX, "Expected property name after ':'"),
    E058("MS-E058", Severity.ERROR, Category.SYNTAX, "Expected '}' to close block opened at %s"),
    E059("MS-E059", Severity.ERROR, Category.SYNTAX, "Expected '}' to close switch opened at %s"),
    E060("MS-E060", Severity.ERROR, Category.SYNTAX, "Expected ')' to close expression opened at %s"),

    // ── Warnings ────────────────────────────────────────────────
    W001("MS-W001", Severity.WARNING, Category.DEFINEDNESS, "Method name '%s' is a reserved word"),
    W002("MS-W002", Severity.WARNING, Category.STYLE, "Trailing whitespace"),
    W003("MS-W003", Severity.WARNING, Category.STYLE, "Line too long (%d chars)"),
    W010("MS-W010", Severity.WARNING, Category.STYLE, "Missing 'Initialize' method"),
    W011("MS-W011", Severity.WARNING, Category.STYLE, "Initialize should call 'AddToPluginsMenu'"),
    W020("MS-W020", Severity.WARNING, Category.DEFINEDNESS, "Variable '%s' may be undefined"),
    W025("MS-W025", Severity.WARNING, Category.DEFINEDNESS, "Variable '%s' is assigned but never used"),
    W026("MS-W026", Severity.WARNING, Category.SEMANTIC, "Unreachable code after return"),
    W028("MS-W028", Severity.WARNING, Category.SEMANTIC, "Condition is always %s"),
    W029("MS-W029", Severity.WARNING, Category.SEMANTIC, "Self-assignment of '%s'"),
    W031("MS-W031", Severity.WARNING, Category.SEMANTIC, "%s by zero"),
    W032("MS-W032", Severity.WARNING, Category.SEMANTIC, "Comparison of '%s' with itself is always %s"),
    W033("MS-W033", Severity.WARNING, Category.DEFINEDNESS, "Assignment to '%s' shadows parameter"),
    W022("MS-W022", Severity.WARNING, Category.SEMANTIC, "Unknown function '%s'"),
    W024("MS-W024", Severity.WARNING, Category.SEMANTIC, "Unknown property '%s' on '%s'%s");

    private static final Map<String, DiagnosticCode> BY_CODE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(DiagnosticCode::code, Function.identity()));

    private final String code;
    private final Severity severity;
    private final Category category;
    private final String template;

    DiagnosticCode(String code, Severity severity, Category category, String template) {
        this.code = code;
        this.severity = severity;
        this.category = category;
        this.template = template;
    }

    public String code() {
        return code;
    }

    public Severity severity() {
        return severity;
    }

    public Category category() {
        return category;
    }

    public String template() {
        return template;
    }

    /**
     * Structural codes describe the envelope itself and are exempt from inline and
     * region suppression.
     */
    public boolean isStructural() {
        return category == Category.STRUCTURAL;
    }

    /**
     * Look up a code by its printed form, e.g. {@code "MS-W020"}; case-insensitive.
     */
    public static Optional<DiagnosticCode> fromCode(String code) {
        return Optional.ofNullable(BY_CODE.get(code.trim().toUpperCase(Locale.ROOT)));
    }
}
