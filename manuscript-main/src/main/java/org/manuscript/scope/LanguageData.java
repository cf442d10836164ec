package org.manuscript.scope;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.manuscript.LanguageDataException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable tables describing the host environment: names that are always in scope
 * (objects, functions, constants), the argument counts of known calls and the members
 * of the host objects whose API is known.
 * <p>
 * The bundled table is read once from {@value #STANDARD_RESOURCE} and shared by every
 * lint run; instances are safe to use from any thread.
 */
public final class LanguageData {

    private static final Logger LOG = LoggerFactory.getLogger(LanguageData.class);

    public static final String STANDARD_RESOURCE = "/org/manuscript/scope/manuscript-language.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Set<String> objects;
    private final Set<String> functions;
    private final Set<String> globals;
    private final Map<String, List<Arity>> signatures;
    private final Map<String, ObjectApi> objectApis;

    public LanguageData(Set<String> objects, Set<String> functions, Set<String> constants,
                        Map<String, List<Arity>> signatures, Map<String, ObjectApi> objectApis) {
        this.objects = Set.copyOf(objects);
        this.functions = Set.copyOf(functions);
        Set<String> all = new HashSet<>(objects);
        all.addAll(functions);
        all.addAll(constants);
        this.globals = Set.copyOf(all);
        Map<String, List<Arity>> copy = new HashMap<>();
        signatures.forEach((name, overloads) -> copy.put(name, List.copyOf(overloads)));
        this.signatures = Map.copyOf(copy);
        this.objectApis = Map.copyOf(objectApis);
    }

    public static LanguageData standard() {
        return StandardHolder.INSTANCE;
    }

    /**
     * Load a table from the classpath.
     *
     * @throws LanguageDataException if the resource is missing or not a valid table
     */
    public static LanguageData load(String resource) {
        try (InputStream in = LanguageData.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new LanguageDataException(resource, null);
            }
            LanguageData data = parse(MAPPER.readTree(in));
            LOG.debug("Loaded {} globals, {} call signatures and {} object APIs from {}",
                    data.globals.size(), data.signatures.size(), data.objectApis.size(), resource);
            return data;
        } catch (IOException | IllegalArgumentException e) {
            throw new LanguageDataException(resource, e);
        }
    }

    private static LanguageData parse(JsonNode root) {
        Set<String> objects = names(root.path("objects"));
        Set<String> functions = names(root.path("functions"));
        Set<String> constants = names(root.path("constants"));

        Map<String, List<Arity>> signatures = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.path("signatures").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            List<Arity> overloads = new ArrayList<>();
            for (JsonNode overload : field.getValue()) {
                overloads.add(new Arity(overload.path("min").asInt(0), overload.path("max").asInt(0)));
            }
            if (overloads.isEmpty()) {
                throw new IllegalArgumentException("Signature '" + field.getKey() + "' has no overloads");
            }
            signatures.put(field.getKey(), overloads);
        }

        Map<String, ObjectApi> objectApis = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> members = root.path("members").fields();
        while (members.hasNext()) {
            Map.Entry<String, JsonNode> member = members.next();
            if (!objects.contains(member.getKey())) {
                throw new IllegalArgumentException("Members given for unknown object '" + member.getKey() + "'");
            }
            objectApis.put(member.getKey(), new ObjectApi(
                    names(member.getValue().path("methods")), names(member.getValue().path("properties"))));
        }
        return new LanguageData(objects, functions, constants, signatures, objectApis);
    }

    private static Set<String> names(JsonNode array) {
        Set<String> names = new HashSet<>();
        for (JsonNode name : array) {
            names.add(name.asText());
        }
        return names;
    }

    public boolean isGlobal(String name) {
        return globals.contains(name);
    }

    /**
     * Whether {@code name} may be called bare: a built-in function, or an object name
     * used as a constructor.
     */
    public boolean isCallable(String name) {
        return functions.contains(name) || objects.contains(name);
    }

    /**
     * Members of a global object, when its API is known.
     */
    public Optional<ObjectApi> objectApi(String name) {
        return Optional.ofNullable(objectApis.get(name));
    }

    public Optional<List<Arity>> signature(String name) {
        return Optional.ofNullable(signatures.get(name));
    }

    public Set<String> globals() {
        return globals;
    }

    private static final class StandardHolder {
        private static final LanguageData INSTANCE = load(STANDARD_RESOURCE);
    }
}
