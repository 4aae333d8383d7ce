package com.rbparser.jackson;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.DatabindContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.jsontype.impl.TypeIdResolverBase;
import com.rbparser.ast.Node;

/**
 * Uses the node type tag ({@code "assign"}, {@code "var_field"}, ...) as the
 * JSON type id. Write only: trees are never read back from JSON.
 */
public class NodeTypeIdResolver extends TypeIdResolverBase {

    @Override
    public String idFromValue(Object value) {
        return ((Node) value).type().tag();
    }

    @Override
    public String idFromValueAndType(Object value, Class<?> suggestedType) {
        return idFromValue(value);
    }

    @Override
    public JavaType typeFromId(DatabindContext context, String id) {
        throw new UnsupportedOperationException("Syntax trees are not read from JSON: " + id);
    }

    @Override
    public JsonTypeInfo.Id getMechanism() {
        return JsonTypeInfo.Id.CUSTOM;
    }
}
