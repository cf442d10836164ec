package org.manuscript.diagnostic;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DiagnosticCodeTest {

    @Test
    void codes_areUniqueAndPrefixedBySeverity() {
        Set<String> printed = Arrays.stream(DiagnosticCode.values())
                .map(DiagnosticCode::code)
                .collect(Collectors.toSet());
        assertThat(printed).hasSize(DiagnosticCode.values().length);

        for (DiagnosticCode code : DiagnosticCode.values()) {
            String expectedPrefix = code.severity() == Severity.ERROR ? "MS-E" : "MS-W";
            assertThat(code.code()).startsWith(expectedPrefix).hasSize(7);
            assertThat(code.code()).endsWith(code.name().substring(1));
        }
    }

    @Test
    void structuralCodes_areExactlyTheDelimiterAndEnvelopeChecks() {
        List<DiagnosticCode> structural = Arrays.stream(DiagnosticCode.values())
                .filter(DiagnosticCode::isStructural)
                .toList();
        assertThat(structural).containsExactly(
                DiagnosticCode.E001, DiagnosticCode.E002, DiagnosticCode.E003,
                DiagnosticCode.E010, DiagnosticCode.E011);
    }

    @Test
    void fromCode_isCaseInsensitive() {
        assertThat(DiagnosticCode.fromCode("MS-W020")).contains(DiagnosticCode.W020);
        assertThat(DiagnosticCode.fromCode("ms-e044 ")).contains(DiagnosticCode.E044);
        assertThat(DiagnosticCode.fromCode("MS-X999")).isEmpty();
    }

    @Test
    void definednessCategory_coversNameWarnings() {
        assertThat(Arrays.stream(DiagnosticCode.values())
                .filter(c -> c.category() == Category.DEFINEDNESS))
                .containsExactlyInAnyOrder(DiagnosticCode.W001, DiagnosticCode.W020,
                        DiagnosticCode.W025, DiagnosticCode.W033);
    }

    @Test
    void unknownNameWarnings_formatWithOptionalHint() {
        assertThat(Diagnostic.of(DiagnosticCode.W022, Span.at(1, 1), "Sibelius.WriteTextFile").message())
                .isEqualTo("Unknown function 'Sibelius.WriteTextFile'");
        assertThat(Diagnostic.of(DiagnosticCode.W024, Span.at(1, 1), "Foo", "Sibelius", "").message())
                .isEqualTo("Unknown property 'Foo' on 'Sibelius'");
        assertThat(DiagnosticCode.W024.category()).isEqualTo(Category.SEMANTIC);
    }

    @Test
    void diagnostic_formatsMessageFromTemplate() {
        Diagnostic diagnostic = Diagnostic.of(DiagnosticCode.E020, Span.at(3, 7), "AddToPluginsMenu", 2, 1);

        assertThat(diagnostic.code()).isEqualTo("MS-E020");
        assertThat(diagnostic.isError()).isTrue();
        assertThat(diagnostic.message()).isEqualTo("AddToPluginsMenu() requires at least 2 args, got 1");
        assertThat(diagnostic).hasToString("3:7 [MS-E020] AddToPluginsMenu() requires at least 2 args, got 1");
    }

    @Test
    void diagnostic_withSeverityKeepsEverythingElse() {
        Diagnostic warning = Diagnostic.of(DiagnosticCode.W020, Span.at(1, 2), "x");
        Diagnostic error = warning.withSeverity(Severity.ERROR);

        assertThat(error.isError()).isTrue();
        assertThat(error.code()).isEqualTo(warning.code());
        assertThat(error.message()).isEqualTo(warning.message());
        assertThat(error.span()).isEqualTo(warning.span());
        assertThat(warning.withSeverity(Severity.WARNING)).isSameAs(warning);
    }

    @Test
    void byPosition_ordersByLineColumnThenCode() {
        Diagnostic late = Diagnostic.of(DiagnosticCode.W002, Span.at(2, 1));
        Diagnostic early = Diagnostic.of(DiagnosticCode.W020, Span.at(1, 9), "y");
        Diagnostic sameSpotE = Diagnostic.of(DiagnosticCode.E044, Span.at(1, 3), "assignment");
        Diagnostic sameSpotW = Diagnostic.of(DiagnosticCode.W029, Span.at(1, 3), "x");

        assertThat(List.of(late, sameSpotW, early, sameSpotE).stream().sorted(Diagnostic.BY_POSITION).toList())
                .containsExactly(sameSpotE, sameSpotW, early, late);
    }

    @Test
    void span_rejectsZeroBasedPositions() {
        assertThatThrownBy(() -> Span.at(0, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThat(new Span(2, 5, 1, 1)).isEqualTo(Span.at(2, 5));
        assertThat(new Span(2, 1, 4, 3).coversLine(3)).isTrue();
    }

    @Test
    void registry_keepsReportingOrder() {
        DiagnosticRegistry registry = new DiagnosticRegistry();
        registry.report(DiagnosticCode.W002, Span.at(5, 1));
        registry.report(DiagnosticCode.E001, Span.at(1, 1), "}");

        assertThat(registry.size()).isEqualTo(2);
        assertThat(registry.diagnostics()).extracting(Diagnostic::code).containsExactly("MS-W002", "MS-E001");
        assertThatThrownBy(() -> registry.diagnostics().clear()).isInstanceOf(UnsupportedOperationException.class);
    }
}
