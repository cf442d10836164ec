package org.manuscript.suppression;

import org.junit.jupiter.api.Test;
import org.manuscript.diagnostic.Diagnostic;
import org.manuscript.diagnostic.DiagnosticCode;
import org.manuscript.diagnostic.Span;

import static org.assertj.core.api.Assertions.assertThat;

class SuppressionDirectivesTest {

    private static Diagnostic at(DiagnosticCode code, int line) {
        return Diagnostic.of(code, Span.at(line, 1), "x");
    }

    @Test
    void bareNoqa_coversEveryCodeOnItsLine() {
        SuppressionDirectives directives = SuppressionDirectives.scan("x = 1; // noqa\ny = 2;");

        assertThat(directives.covers(at(DiagnosticCode.W020, 1))).isTrue();
        assertThat(directives.covers(at(DiagnosticCode.E044, 1))).isTrue();
        assertThat(directives.covers(at(DiagnosticCode.W020, 2))).isFalse();
    }

    @Test
    void noqaWithCodes_onOwnLineAlsoCoversNextLine() {
        SuppressionDirectives directives = SuppressionDirectives.scan("    // noqa: MS-W020, ms-w025\nx = y;\nz = y;");

        assertThat(directives.covers(at(DiagnosticCode.W020, 1))).isTrue();
        assertThat(directives.covers(at(DiagnosticCode.W025, 2))).isTrue();
        assertThat(directives.covers(at(DiagnosticCode.W029, 2))).isFalse();
        assertThat(directives.covers(at(DiagnosticCode.W020, 3))).isFalse();
    }

    @Test
    void ignoreDirective_isCaseInsensitive() {
        SuppressionDirectives directives = SuppressionDirectives.scan("a\nb // Manuscript: IGNORE MS-W020\nc");

        assertThat(directives.covers(at(DiagnosticCode.W020, 2))).isTrue();
        assertThat(directives.covers(at(DiagnosticCode.W020, 3))).isFalse();
        assertThat(directives.covers(at(DiagnosticCode.W025, 2))).isFalse();
    }

    @Test
    void ignoreWithoutCodes_suppressesNothing() {
        SuppressionDirectives directives = SuppressionDirectives.scan("// manuscript: ignore\nx = y;\nz = y; // manuscript: ignore");

        assertThat(directives.isEmpty()).isTrue();
        assertThat(directives.covers(at(DiagnosticCode.W020, 2))).isFalse();
        assertThat(directives.covers(at(DiagnosticCode.W020, 3))).isFalse();
    }

    @Test
    void mahlifMarker_isAcceptedForEveryDirective() {
        String source = String.join("\n",
                "a // mahlif: ignore MS-W025",
                "// Mahlif: disable MS-W020",
                "b",
                "// mahlif: enable MS-W020",
                "c");
        SuppressionDirectives directives = SuppressionDirectives.scan(source);

        assertThat(directives.covers(at(DiagnosticCode.W025, 1))).isTrue();
        assertThat(directives.covers(at(DiagnosticCode.W020, 3))).isTrue();
        assertThat(directives.covers(at(DiagnosticCode.W020, 5))).isFalse();
    }

    @Test
    void region_isInclusiveOfBothDirectiveLines() {
        String source = String.join("\n",
                "a",
                "// manuscript: disable MS-W020",
                "b",
                "// manuscript: enable MS-W020",
                "c");
        SuppressionDirectives directives = SuppressionDirectives.scan(source);

        assertThat(directives.covers(at(DiagnosticCode.W020, 1))).isFalse();
        assertThat(directives.covers(at(DiagnosticCode.W020, 2))).isTrue();
        assertThat(directives.covers(at(DiagnosticCode.W020, 3))).isTrue();
        assertThat(directives.covers(at(DiagnosticCode.W020, 4))).isTrue();
        assertThat(directives.covers(at(DiagnosticCode.W020, 5))).isFalse();
        assertThat(directives.covers(at(DiagnosticCode.W025, 3))).isFalse();
    }

    @Test
    void unmatchedDisableWithoutCodes_runsToEndOfFile() {
        SuppressionDirectives directives = SuppressionDirectives.scan("a\n// manuscript: disable\nb\nc");

        assertThat(directives.covers(at(DiagnosticCode.W025, 1))).isFalse();
        assertThat(directives.covers(at(DiagnosticCode.W025, 4))).isTrue();
        assertThat(directives.covers(at(DiagnosticCode.E044, 1000))).isTrue();
    }

    @Test
    void enableWithoutCodes_closesEveryRegion() {
        String source = String.join("\n",
                "// manuscript: disable MS-W020",
                "// manuscript: disable MS-W025",
                "a",
                "// manuscript: enable",
                "b");
        SuppressionDirectives directives = SuppressionDirectives.scan(source);

        assertThat(directives.covers(at(DiagnosticCode.W025, 3))).isTrue();
        assertThat(directives.covers(at(DiagnosticCode.W020, 5))).isFalse();
        assertThat(directives.covers(at(DiagnosticCode.W025, 5))).isFalse();
    }

    @Test
    void sourceWithoutDirectives_isEmpty() {
        assertThat(SuppressionDirectives.scan("{\n    A \"x\"\n}").isEmpty()).isTrue();
        assertThat(SuppressionDirectives.none().covers(at(DiagnosticCode.W020, 1))).isFalse();
    }
}
