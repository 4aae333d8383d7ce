package com.rbparser.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.rbparser.ast.Location;

import java.io.IOException;

/**
 * Writes a location as {@code [startLine, startChar, endLine, endChar]}.
 */
public class LocationSerializer extends StdSerializer<Location> {

    public LocationSerializer() {
        super(Location.class);
    }

    @Override
    public void serialize(Location value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartArray();
        gen.writeNumber(value.startLine());
        gen.writeNumber(value.startChar());
        gen.writeNumber(value.endLine());
        gen.writeNumber(value.endChar());
        gen.writeEndArray();
    }
}
