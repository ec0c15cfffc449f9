package io.fmxform.core.directive;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fmxform.core.path.PropertyPath;
import io.fmxform.core.path.PropertyPathResolver;

/** Helpers shared by handlers that write a derived value at their own data path. */
public final class DirectiveSupport {

    private DirectiveSupport() {}

    /** Writes {@code value} at the directive's data path inside {@code scope}. */
    public static void writeAtDataPath(
            PropertyPathResolver resolver, ObjectNode scope, Directive directive, JsonNode value) {
        resolver.set(scope, resolver.parse(directive.dataPath()), value);
    }

    /** Reads the value at the directive's data path inside {@code scope}, or {@code null}. */
    public static JsonNode readAtDataPath(PropertyPathResolver resolver, ObjectNode scope, Directive directive) {
        PropertyPath path = resolver.parse(directive.dataPath());
        return path.isRoot() ? scope : resolver.get(scope, path);
    }
}
