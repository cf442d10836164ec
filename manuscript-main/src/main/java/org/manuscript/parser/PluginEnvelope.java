package org.manuscript.parser;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The members of a plugin file, in source order.
 */
public record PluginEnvelope(List<PluginMember> members) {

    public PluginEnvelope {
        members = List.copyOf(members);
    }

    public List<PluginMember.Method> methods() {
        return members.stream()
                .filter(PluginMember.Method.class::isInstance)
                .map(PluginMember.Method.class::cast)
                .toList();
    }

    public Set<String> variableNames() {
        return members.stream()
                .filter(PluginMember.Variable.class::isInstance)
                .map(PluginMember::name)
                .collect(Collectors.toUnmodifiableSet());
    }

    public Set<String> methodNames() {
        return methods().stream().map(PluginMember::name).collect(Collectors.toUnmodifiableSet());
    }

    public Optional<PluginMember.Method> method(String name) {
        return methods().stream().filter(m -> m.name().equals(name)).findFirst();
    }
}
