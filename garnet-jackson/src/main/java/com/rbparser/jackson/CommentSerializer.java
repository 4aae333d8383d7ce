package com.rbparser.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.jsontype.TypeSerializer;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.rbparser.ast.Comment;

import java.io.IOException;

/**
 * Comments are plain classes, not records, so they are written by hand. The
 * type tag is part of the object whether or not the declared type asks for one.
 */
public class CommentSerializer extends StdSerializer<Comment> {

    public CommentSerializer() {
        super(Comment.class);
    }

    @Override
    public void serialize(Comment value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("type", value.type().tag());
        gen.writeFieldName("location");
        provider.defaultSerializeValue(value.location(), gen);
        gen.writeStringField("value", value.value());
        gen.writeBooleanField("inline", value.inline());
        gen.writeEndObject();
    }

    @Override
    public void serializeWithType(Comment value, JsonGenerator gen, SerializerProvider provider,
                                  TypeSerializer typeSer) throws IOException {
        serialize(value, gen, provider);
    }
}
