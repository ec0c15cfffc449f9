package io.fmxform.core.directive;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fmxform.core.model.FrontmatterData;
import io.fmxform.core.model.Schema;
import io.fmxform.core.path.PropertyPathResolver;
import java.util.List;
import java.util.Objects;

/**
 * Read-mostly state shared by the handlers of one directive processing pass.
 *
 * @param schema the schema being applied
 * @param documents front matter of the processed documents, in input order
 * @param root the whole aggregate as it stands before the current directive
 * @param resolver property path resolver (possibly cached)
 */
public record DirectiveContext(
        Schema schema,
        List<FrontmatterData> documents,
        ObjectNode root,
        PropertyPathResolver resolver) {

    public DirectiveContext {
        Objects.requireNonNull(schema, "schema must not be null");
        documents = List.copyOf(documents);
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(resolver, "resolver must not be null");
    }
}
