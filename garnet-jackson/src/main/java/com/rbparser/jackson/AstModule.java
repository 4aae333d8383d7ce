package com.rbparser.jackson;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonTypeIdResolver;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.BeanPropertyWriter;
import com.fasterxml.jackson.databind.ser.BeanSerializerModifier;
import com.rbparser.ast.Comment;
import com.rbparser.ast.Location;
import com.rbparser.ast.Node;

import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Jackson module for the syntax tree.
 *
 * This module handles:
 * - the {@code type} tag of every node, taken from its node type
 * - locations written as {@code [startLine, startChar, endLine, endChar]}
 * - record fields written in declaration order, helper getters left out
 * - attached comments, written only when a node has any
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.rbparser", "garnet-jackson"));
        addSerializer(Location.class, new LocationSerializer());
        addSerializer(Comment.class, new CommentSerializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);
        context.setMixInAnnotations(Node.class, NodeMixin.class);
        context.addBeanSerializerModifier(new AstSerializerModifier());
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.CUSTOM, include = JsonTypeInfo.As.PROPERTY, property = "type")
    @JsonTypeIdResolver(NodeTypeIdResolver.class)
    private interface NodeMixin {
    }

    // ==================== Serializer Modifier ====================

    private static class AstSerializerModifier extends BeanSerializerModifier {
        @Override
        public List<BeanPropertyWriter> changeProperties(SerializationConfig config,
                                                          BeanDescription beanDesc,
                                                          List<BeanPropertyWriter> beanProperties) {
            Class<?> beanClass = beanDesc.getBeanClass();
            if (!Node.class.isAssignableFrom(beanClass) || !beanClass.isRecord()) {
                return beanProperties;
            }

            // Only record components, in declaration order. Drops helpers such as isEmpty().
            List<BeanPropertyWriter> ordered = new ArrayList<>();
            for (RecordComponent component : beanClass.getRecordComponents()) {
                for (BeanPropertyWriter property : beanProperties) {
                    if (!property.getName().equals(component.getName())) {
                        continue;
                    }
                    ordered.add(property.getName().equals("comments") ? new NonEmptyPropertyWriter(property) : property);
                }
            }
            return ordered;
        }
    }

    /**
     * Leaves a collection property out of the output while it is empty.
     */
    private static class NonEmptyPropertyWriter extends BeanPropertyWriter {

        NonEmptyPropertyWriter(BeanPropertyWriter base) {
            super(base);
        }

        @Override
        public void serializeAsField(Object bean, JsonGenerator gen, SerializerProvider prov) throws Exception {
            Object value = get(bean);
            if (value instanceof Collection<?> collection && collection.isEmpty()) {
                return;
            }
            super.serializeAsField(bean, gen, prov);
        }
    }
}
