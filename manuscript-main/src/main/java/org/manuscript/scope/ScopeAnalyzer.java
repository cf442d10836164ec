package org.manuscript.scope;

import org.manuscript.diagnostic.DiagnosticCode;
import org.manuscript.diagnostic.DiagnosticRegistry;
import org.manuscript.lexer.Token;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Tracks variable definedness across the methods of one plugin.
 * <p>
 * The parser drives the analyzer in source order: it announces each method, block
 * entry and exit, assignment, loop variable and read. Names resolve, in order, against
 * the method's {@link Scope}, the plugin-level variables and the built-in
 * {@link LanguageData} table.
 * <p>
 * One analyzer serves one file; it is not thread-safe.
 */
public final class ScopeAnalyzer {

    private static final Set<String> RESERVED_WORDS = Set.of(
            "if", "else", "for", "each", "in", "to", "while", "switch", "case", "default",
            "return", "true", "false", "null", "and", "or", "not");

    private final DiagnosticRegistry registry;
    private final LanguageData language;
    private final Set<String> pluginVariables;
    private final Set<String> pluginMethods;

    private Scope scope;
    private int depth;
    private final Set<String> reportedUndefined = new HashSet<>();
    private final Set<String> reportedShadows = new HashSet<>();

    public ScopeAnalyzer(DiagnosticRegistry registry, LanguageData language, Set<String> pluginVariables) {
        this(registry, language, pluginVariables, Set.of());
    }

    public ScopeAnalyzer(DiagnosticRegistry registry, LanguageData language,
                         Set<String> pluginVariables, Set<String> pluginMethods) {
        this.registry = registry;
        this.language = language;
        this.pluginVariables = Set.copyOf(pluginVariables);
        this.pluginMethods = Set.copyOf(pluginMethods);
    }

    /**
     * Check a method's name. Called for every method, including ones whose header
     * cannot be parsed.
     */
    public void checkMethodName(Token name) {
        if (RESERVED_WORDS.contains(name.text().toLowerCase(Locale.ROOT))) {
            registry.report(DiagnosticCode.W001, name.span(), name.text());
        }
    }

    public void beginMethod(List<Token> parameters) {
        scope = new Scope(parameters);
        depth = 0;
        reportedUndefined.clear();
        reportedShadows.clear();
    }

    /**
     * Close the current method and report locals that were never read.
     */
    public void endMethod() {
        requireMethod();
        for (Token unused : scope.unusedLocals()) {
            registry.report(DiagnosticCode.W025, unused.span(), unused.text());
        }
        scope = null;
    }

    public void enterBlock() {
        depth++;
    }

    public void exitBlock() {
        if (depth > 0) {
            depth--;
        }
    }

    /**
     * Record an assignment to a plain name. Called before the right-hand side is read,
     * so {@code x = x} counts as a use of {@code x}.
     */
    public void assign(Token target) {
        requireMethod();
        Scope.Origin origin = scope.define(target, Scope.Origin.LOCAL, currentLevel());
        if (origin == Scope.Origin.PARAMETER && reportedShadows.add(target.text())) {
            registry.report(DiagnosticCode.W033, target.span(), target.text());
        }
    }

    public void defineLoopVariable(Token variable) {
        requireMethod();
        scope.define(variable, Scope.Origin.LOOP_VARIABLE, currentLevel());
    }

    /**
     * Record a read of {@code name}.
     *
     * @param invokedOrDereferenced the name is immediately followed by a call or a
     *                              member access; such names are not reported when
     *                              unknown, since they usually denote host objects
     */
    public void read(Token name, boolean invokedOrDereferenced) {
        requireMethod();
        String text = name.text();
        if (scope.contains(text)) {
            scope.markUsed(text);
            return;
        }
        if (invokedOrDereferenced || pluginVariables.contains(text) || language.isGlobal(text)) {
            return;
        }
        if (reportedUndefined.add(text)) {
            registry.report(DiagnosticCode.W020, name.span(), text);
        }
    }

    public Definedness definedness(String name) {
        if (pluginVariables.contains(name) || language.isGlobal(name)) {
            return Definedness.DEFINED;
        }
        return scope == null ? Definedness.UNDEFINED : scope.lookup(name);
    }

    /**
     * Whether a bare call to {@code name} resolves: a built-in function or object, a
     * method of this plugin, or a variable that may hold a method reference.
     */
    public boolean isCallable(String name) {
        return language.isCallable(name) || pluginMethods.contains(name) || isVariable(name);
    }

    /**
     * Whether {@code name} is a local, parameter or plugin variable, any of which hides
     * a host object of the same name.
     */
    public boolean isVariable(String name) {
        return pluginVariables.contains(name) || (scope != null && scope.contains(name));
    }

    private Definedness currentLevel() {
        return depth == 0 ? Definedness.DEFINED : Definedness.POSSIBLY_DEFINED;
    }

    private void requireMethod() {
        if (scope == null) {
            throw new IllegalStateException("No method is being analysed");
        }
    }
}
