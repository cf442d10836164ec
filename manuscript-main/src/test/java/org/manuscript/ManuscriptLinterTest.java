package org.manuscript;

import org.junit.jupiter.api.Test;
import org.manuscript.config.LintConfig;
import org.manuscript.diagnostic.Diagnostic;
import org.manuscript.diagnostic.Severity;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ManuscriptLinterTest {

    private static final String INITIALIZE = "    Initialize \"() { AddToPluginsMenu('Test', 'Run'); }\"";

    private final ManuscriptLinter linter = new ManuscriptLinter();

    private static String plugin(String... members) {
        StringBuilder source = new StringBuilder("{\n").append(INITIALIZE).append('\n');
        for (String member : members) {
            source.append(member).append('\n');
        }
        return source.append("}\n").toString();
    }

    // 1. Missing envelope close
    @Test
    void missingClosingBrace_reportsUnclosedAndEnvelopeEnd() {
        LintReport report = linter.lint("{ Initialize \"() { AddToPluginsMenu('Test','Run'); }\"");

        assertThat(report.codes()).containsExactly("MS-E003", "MS-E011");
        assertThat(report.errorCount()).isEqualTo(2);
    }

    // 2. Undefined read and unused write in one statement
    @Test
    void undefinedAndUnused_inOneAssignment() {
        LintReport report = linter.lint(plugin("    Run \"() { x = y + 1; }\""));

        assertThat(report.codes()).containsExactly("MS-W025", "MS-W020");
        assertThat(report.warnings()).extracting(Diagnostic::message).containsExactly(
                "Variable 'x' is assigned but never used",
                "Variable 'y' may be undefined");
        assertThat(report.hasErrors()).isFalse();
    }

    // 3. Header without parentheses, body still analysed
    @Test
    void ifWithoutParentheses_reportedOnce() {
        LintReport report = linter.lint(plugin("    Run \"() { if x = 1 { y = 2; } }\""));

        assertThat(report.codes()).containsExactly("MS-E040", "MS-W025");
    }

    // 5. Trailing whitespace and its suppression
    @Test
    void trailingWhitespace_suppressedByNoqaOnSameLine() {
        LintReport flagged = linter.lint(plugin("    Count \"1\"   "));
        LintReport suppressed = linter.lint(plugin("    Count \"1\" // noqa: MS-W002   "));

        assertThat(flagged.codes()).containsExactly("MS-W002");
        assertThat(flagged.diagnostics().get(0).line()).isEqualTo(3);
        assertThat(suppressed.isClean()).isTrue();
        assertThat(suppressed.suppressed()).isEqualTo(1);
    }

    @Test
    void positions_areAbsoluteInsideMethodStrings() {
        LintReport singleLine = linter.lint(plugin("    Run \"() { Trace(z); }\""));
        LintReport multiLine = linter.lint(plugin(
                "    Run \"() {",
                "        Trace(ghost);",
                "    }\""));

        assertThat(singleLine.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.line()).isEqualTo(3);
            assertThat(d.column()).isEqualTo(21);
        });
        assertThat(multiLine.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.line()).isEqualTo(4);
            assertThat(d.column()).isEqualTo(15);
        });
    }

    @Test
    void disableRegion_removesOnlyCoveredDiagnostics() {
        String run = "    Run \"() { Trace(ghost); }\"";
        LintReport without = linter.lint(plugin(run));
        LintReport with = linter.lint(plugin(
                "    // manuscript: disable MS-W020",
                run,
                "    // manuscript: enable MS-W020"));

        assertThat(without.codes()).containsExactly("MS-W020");
        assertThat(with.isClean()).isTrue();
        assertThat(with.suppressed()).isEqualTo(1);
    }

    @Test
    void mahlifRegion_suppressesLikeManuscriptRegion() {
        LintReport report = linter.lint(plugin(
                "    // mahlif: disable MS-W020",
                "    Run \"() { Trace(y); }\"",
                "    // mahlif: enable MS-W020"));

        assertThat(report.isClean()).isTrue();
        assertThat(report.suppressed()).isEqualTo(1);
    }

    @Test
    void structuralDiagnostics_ignoreInlineDirectives() {
        LintReport report = linter.lint("{ // noqa\n    Run \"() { }\"");

        assertThat(report.codes()).contains("MS-E003", "MS-E011");
    }

    @Test
    void pluginVariables_areVisibleInMethods() {
        LintReport report = linter.lint(plugin(
                "    Count \"0\"",
                "    Run \"() { Count = Count + 1; Trace(Count); }\""));

        assertThat(report.isClean()).isTrue();
    }

    @Test
    void callsToOtherPluginMethods_areKnown() {
        LintReport report = linter.lint(plugin(
                "    Run \"() { Helper(1); Missing(2); }\"",
                "    Helper \"(a) { Trace(a); }\""));

        assertThat(report.diagnostics()).singleElement()
                .satisfies(d -> assertThat(d.message()).isEqualTo("Unknown function 'Missing'"));
    }

    @Test
    void missingInitialize_isWarned() {
        LintReport report = linter.lint("{\n    Run \"() { }\"\n}\n");

        assertThat(report.codes()).containsExactly("MS-W010");
    }

    @Test
    void strictMode_elevatesDefinednessWarnings() {
        ManuscriptLinter strict = new ManuscriptLinter(LintConfig.defaults().withStrict(true));
        LintReport report = strict.lint(plugin("    Run \"() { Trace(ghost); }\"", "    Bad \"() { x = 1; }\"   "));

        assertThat(report.errors()).extracting(Diagnostic::code).containsExactly("MS-W020", "MS-W025");
        assertThat(report.warnings()).extracting(Diagnostic::code).containsExactly("MS-W002");
    }

    @Test
    void configuration_ignoreAndLineLength() {
        LintConfig config = new LintConfig(Set.of("MS-W010"), false, Set.of(), Set.of(), Set.of(), 20);
        LintReport report = new ManuscriptLinter(config).lint("{\n    Value \"a fairly long string\"\n}");

        assertThat(report.codes()).containsExactly("MS-W003");
        assertThat(report.suppressed()).isEqualTo(1);
    }

    @Test
    void diagnostics_areSortedByPosition() {
        LintReport report = linter.lint(plugin(
                "    B \"() { Trace(second); }\"",
                "    A \"() { Trace(first); if (1) { } }\""));

        assertThat(report.diagnostics()).isSortedAccordingTo(Diagnostic.BY_POSITION);
        assertThat(report.codes()).containsExactly("MS-W020", "MS-W020", "MS-W028");
    }

    @Test
    void sharedLinter_givesSameResultsFromManyThreads() {
        List<String> sources = List.of(
                plugin("    Run \"() { x = y + 1; }\""),
                plugin("    Run \"() { if x = 1 { y = 2; } }\""),
                "{ Initialize \"() { AddToPluginsMenu('Test','Run'); }\"",
                plugin("    Run \"(a) { Trace(a / 0); }\""));
        List<List<Diagnostic>> sequential = sources.stream().map(s -> linter.lint(s).diagnostics()).toList();

        for (int round = 0; round < 20; round++) {
            List<List<Diagnostic>> parallel = sources.parallelStream().map(s -> linter.lint(s).diagnostics()).toList();
            assertThat(parallel).isEqualTo(sequential);
        }
    }

    @Test
    void warningsOnly_reportHasNoErrors() {
        LintReport report = linter.lint(plugin("    Run \"(a) { Trace(a % 0); }\""));

        assertThat(report.diagnostics()).extracting(Diagnostic::severity).containsOnly(Severity.WARNING);
        assertThat(report.errorCount()).isZero();
        assertThat(report.warningCount()).isEqualTo(1);
    }
}
