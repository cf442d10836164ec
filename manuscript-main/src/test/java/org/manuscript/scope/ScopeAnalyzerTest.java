package org.manuscript.scope;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.manuscript.diagnostic.Diagnostic;
import org.manuscript.diagnostic.DiagnosticRegistry;
import org.manuscript.lexer.Token;
import org.manuscript.lexer.TokenType;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ScopeAnalyzerTest {

    private DiagnosticRegistry registry;
    private ScopeAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        registry = new DiagnosticRegistry();
        analyzer = new ScopeAnalyzer(registry, LanguageData.standard(), Set.of("Counter"));
    }

    private static Token name(String text) {
        return new Token(TokenType.IDENTIFIER, text, 1, 1);
    }

    @Test
    void topLevelAssignment_isDefined() {
        analyzer.beginMethod(List.of());
        analyzer.assign(name("x"));

        assertThat(analyzer.definedness("x")).isEqualTo(Definedness.DEFINED);
    }

    @Test
    void nestedAssignment_isOnlyPossiblyDefined() {
        analyzer.beginMethod(List.of());
        analyzer.enterBlock();
        analyzer.assign(name("x"));
        analyzer.exitBlock();

        assertThat(analyzer.definedness("x")).isEqualTo(Definedness.POSSIBLY_DEFINED);

        analyzer.assign(name("x"));
        assertThat(analyzer.definedness("x")).isEqualTo(Definedness.DEFINED);
    }

    @Test
    void possiblyDefinedRead_isNotReported() {
        analyzer.beginMethod(List.of());
        analyzer.enterBlock();
        analyzer.assign(name("x"));
        analyzer.exitBlock();
        analyzer.read(name("x"), false);
        analyzer.endMethod();

        assertThat(registry.isEmpty()).isTrue();
    }

    @Test
    void globalsAndPluginVariables_areAlwaysDefined() {
        assertThat(analyzer.definedness("Counter")).isEqualTo(Definedness.DEFINED);
        assertThat(analyzer.definedness("Sibelius")).isEqualTo(Definedness.DEFINED);
        assertThat(analyzer.definedness("nothing")).isEqualTo(Definedness.UNDEFINED);
    }

    @Test
    void undefinedRead_reportedOncePerMethod() {
        analyzer.beginMethod(List.of());
        analyzer.read(name("ghost"), false);
        analyzer.read(name("ghost"), false);
        analyzer.endMethod();
        analyzer.beginMethod(List.of());
        analyzer.read(name("ghost"), false);
        analyzer.endMethod();

        assertThat(registry.diagnostics()).extracting(Diagnostic::code).containsExactly("MS-W020", "MS-W020");
    }

    @Test
    void invokedName_isNotReported() {
        analyzer.beginMethod(List.of());
        analyzer.read(name("HostObject"), true);
        analyzer.endMethod();

        assertThat(registry.isEmpty()).isTrue();
    }

    @Test
    void methodsDoNotShareLocals() {
        analyzer.beginMethod(List.of());
        analyzer.assign(name("x"));
        analyzer.read(name("x"), false);
        analyzer.endMethod();
        analyzer.beginMethod(List.of());

        assertThat(analyzer.definedness("x")).isEqualTo(Definedness.UNDEFINED);
    }

    @Test
    void loopVariables_areNeverUnused() {
        analyzer.beginMethod(List.of(name("p")));
        analyzer.defineLoopVariable(name("i"));
        analyzer.endMethod();

        assertThat(registry.isEmpty()).isTrue();
    }

    @Test
    void reservedMethodName_isCaseInsensitive() {
        analyzer.checkMethodName(name("While"));
        analyzer.checkMethodName(name("Whilst"));

        assertThat(registry.diagnostics()).singleElement()
                .satisfies(d -> assertThat(d.code()).isEqualTo("MS-W001"));
    }
}
