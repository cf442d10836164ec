package org.manuscript.scope;

import org.manuscript.lexer.Token;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Name table for one method body. Variables are function-scoped, so a single flat
 * table covers every nested block; the nesting depth at assignment only decides
 * whether a name is certainly or possibly defined.
 * <p>
 * Built-ins and plugin-level variables are not stored here, see {@link ScopeAnalyzer}.
 */
public final class Scope {

    public enum Origin {
        PARAMETER,
        LOCAL,
        LOOP_VARIABLE
    }

    private static final class Entry {
        private final Origin origin;
        private final Token declaration;
        private Definedness state;
        private boolean used;

        private Entry(Origin origin, Token declaration, Definedness state) {
            this.origin = origin;
            this.declaration = declaration;
            this.state = state;
        }
    }

    private final Map<String, Entry> entries = new LinkedHashMap<>();

    /**
     * Create a scope pre-populated with the method parameters, all {@link Definedness#DEFINED}.
     */
    public Scope(List<Token> parameters) {
        for (Token parameter : parameters) {
            entries.put(parameter.text(), new Entry(Origin.PARAMETER, parameter, Definedness.DEFINED));
        }
    }

    /**
     * Record a definition. An existing entry keeps its origin and first declaration;
     * its state is joined with {@code state}.
     *
     * @return the origin of the (possibly pre-existing) entry
     */
    public Origin define(Token name, Origin origin, Definedness state) {
        Entry entry = entries.get(name.text());
        if (entry == null) {
            entries.put(name.text(), new Entry(origin, name, state));
            return origin;
        }
        entry.state = entry.state.join(state);
        return entry.origin;
    }

    public boolean contains(String name) {
        return entries.containsKey(name);
    }

    public Definedness lookup(String name) {
        Entry entry = entries.get(name);
        return entry == null ? Definedness.UNDEFINED : entry.state;
    }

    public Optional<Origin> origin(String name) {
        Entry entry = entries.get(name);
        return entry == null ? Optional.empty() : Optional.of(entry.origin);
    }

    /**
     * Mark a name as read.
     *
     * @throws IllegalArgumentException if the name is not in the table
     */
    public void markUsed(String name) {
        Entry entry = entries.get(name);
        if (entry == null) {
            throw new IllegalArgumentException("Unknown variable: " + name);
        }
        entry.used = true;
    }

    /**
     * Locals that were assigned and never read afterwards, in declaration order.
     * Parameters and loop variables are never reported.
     */
    public List<Token> unusedLocals() {
        List<Token> unused = new ArrayList<>();
        for (Entry entry : entries.values()) {
            if (entry.origin == Origin.LOCAL && !entry.used) {
                unused.add(entry.declaration);
            }
        }
        return unused;
    }
}
