package org.manuscript;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.manuscript.config.LintConfigLoader;
import org.manuscript.diagnostic.DiagnosticRegistry;
import org.manuscript.lexer.Token;
import org.manuscript.lexer.TokenType;
import org.manuscript.parser.TokenCursor;
import org.manuscript.scope.LanguageData;
import org.manuscript.scope.Scope;
import org.manuscript.scope.ScopeAnalyzer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ErrorHandlingTest {

    @TempDir
    Path dir;

    // 1. ConfigurationException: invalid TOML
    @Test
    void configSyntaxError_carriesPath() throws IOException {
        Path file = Files.writeString(dir.resolve(LintConfigLoader.FILE_NAME), "[lint\nignore = [\n");
        assertThatThrownBy(() -> new LintConfigLoader().load(file))
            .isInstanceOf(ConfigurationException.class)
            .satisfies(e -> {
                ConfigurationException ce = (ConfigurationException) e;
                assertThat(ce.getPath()).isEqualTo(file);
                assertThat(ce.getMessage()).contains("Invalid TOML");
                assertThat(ce.getCause()).isNotNull();
            });
    }

    // 2. ConfigurationException: wrong value type, no location
    @Test
    void configShapeError_hasNoLocation() throws IOException {
        Path file = Files.writeString(dir.resolve(LintConfigLoader.FILE_NAME), "[lint]\nstrict = \"yes\"\n");
        assertThatThrownBy(() -> new LintConfigLoader().load(file))
            .isInstanceOf(ConfigurationException.class)
            .satisfies(e -> {
                ConfigurationException ce = (ConfigurationException) e;
                assertThat(ce.getMessage()).contains("lint.strict");
                assertThat(ce.getLine()).isEqualTo(-1);
                assertThat(ce.getColumn()).isEqualTo(-1);
            });
    }

    // 3. LanguageDataException: missing resource
    @Test
    void languageData_missingResourceIsNamed() {
        assertThatThrownBy(() -> LanguageData.load("/org/manuscript/scope/no-such-table.json"))
            .isInstanceOf(LanguageDataException.class)
            .satisfies(e -> {
                LanguageDataException le = (LanguageDataException) e;
                assertThat(le.getResource()).isEqualTo("/org/manuscript/scope/no-such-table.json");
                assertThat(le.getMessage()).contains("no-such-table.json");
                assertThat(le).isInstanceOf(ManuscriptException.class);
            });
    }

    // 4. Malformed plugin text is reported, never thrown
    @Test
    void malformedSource_neverThrows() {
        ManuscriptLinter linter = new ManuscriptLinter();
        for (String source : List.of("", "}}}{{{", "{ A \"(\" }", "{ Run \"() { if (\" }", "\"", "{ X \"(a,,) {\" }")) {
            assertThatCode(() -> linter.lint(source)).doesNotThrowAnyException();
        }
    }

    // 5. Scope: unknown variable
    @Test
    void scope_markUsedOnUnknownName() {
        Scope scope = new Scope(List.of());
        assertThatThrownBy(() -> scope.markUsed("ghost"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Unknown variable: ghost");
    }

    // 6. ScopeAnalyzer: used outside a method
    @Test
    void scopeAnalyzer_requiresMethod() {
        ScopeAnalyzer analyzer = new ScopeAnalyzer(new DiagnosticRegistry(), LanguageData.standard(), Set.of());
        assertThatThrownBy(() -> analyzer.read(new Token(TokenType.IDENTIFIER, "x", 1, 1), false))
            .isInstanceOf(IllegalStateException.class);
    }

    // 7. TokenCursor: token list without EOF
    @Test
    void tokenCursor_rejectsListWithoutEof() {
        assertThatThrownBy(() -> new TokenCursor(List.of(new Token(TokenType.IDENTIFIER, "x", 1, 1))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("EOF");
    }

    // 8. Hierarchy: every specific exception is a ManuscriptException
    @Test
    void hierarchy_allExtendRoot() {
        assertThat(ManuscriptException.class).isAssignableFrom(ConfigurationException.class);
        assertThat(ManuscriptException.class).isAssignableFrom(LanguageDataException.class);
        assertThat(RuntimeException.class).isAssignableFrom(ManuscriptException.class);
    }

    // 9. Catching the root type catches configuration failures
    @Test
    void rootCatch_catchesConfigurationError() throws IOException {
        Path file = Files.writeString(dir.resolve(LintConfigLoader.FILE_NAME), "[lint]\nignore = \"MS-W020\"\n");
        assertCaughtByRoot(() -> new LintConfigLoader().load(file));
    }

    // 10. Catching the root type catches language data failures
    @Test
    void rootCatch_catchesLanguageDataError() {
        assertCaughtByRoot(() -> LanguageData.load("/missing.json"));
    }

    private static void assertCaughtByRoot(Runnable action) {
        boolean caught = false;
        try {
            action.run();
        } catch (ManuscriptException e) {
            caught = true;
        }
        assertThat(caught).as("ManuscriptException should be caught by root catch").isTrue();
    }
}
