package com.rbparser.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rbparser.SyntaxTree;
import com.rbparser.ast.Program;
import com.rbparser.json.AstJsonProvider;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonAstJsonProviderTest {

    private final ObjectMapper reader = new ObjectMapper();

    @Test
    void providerIsDiscovered() {
        assertTrue(AstJsonProvider.isProviderAvailable());
        assertEquals("Jackson", AstJsonProvider.getProvider().getName());
        assertInstanceOf(JacksonAstJsonProvider.class, AstJsonProvider.getProvider("jackson"));
    }

    @Test
    void nodesCarryTypeAndLocation() throws Exception {
        Program program = SyntaxTree.parse("x = 1");
        JsonNode json = reader.readTree(AstJsonProvider.getProvider().getSerializer().serialize(program));

        assertEquals("program", json.get("type").asText());
        assertEquals("[1,0,1,5]", json.get("location").toString());

        JsonNode assign = json.get("statements").get("body").get(0);
        assertEquals("assign", assign.get("type").asText());
        assertEquals("var_field", assign.get("target").get("type").asText());
        assertEquals("ident", assign.get("target").get("value").get("type").asText());
        assertEquals("x", assign.get("target").get("value").get("value").asText());
        assertEquals("int", assign.get("value").get("type").asText());
        assertEquals("1", assign.get("value").get("value").asText());
        assertEquals("[1,4,1,5]", assign.get("value").get("location").toString());
    }

    @Test
    void commentsOnlyWhenPresent() throws Exception {
        Program program = SyntaxTree.parse("foo # note\nbar\n");
        JsonNode body = reader.readTree(AstJsonProvider.getProvider().getSerializer().serialize(program))
            .get("statements").get("body");

        JsonNode comment = body.get(0).get("comments").get(0);
        assertEquals("comment", comment.get("type").asText());
        assertEquals("# note", comment.get("value").asText());
        assertTrue(comment.get("inline").asBoolean());
        assertEquals("[1,4,1,10]", comment.get("location").toString());

        assertFalse(body.get(1).has("comments"));
    }

    @Test
    void absentChildrenAreLeftOut() throws Exception {
        Program program = SyntaxTree.parse("if a\n  b\nend\n");
        JsonNode ifNode = reader.readTree(GarnetJackson.createObjectMapper().writeValueAsString(program))
            .get("statements").get("body").get(0);
        assertEquals("if", ifNode.get("type").asText());
        assertFalse(ifNode.has("consequent"));
    }

    @Test
    void prettyOutputSpansLines() {
        String json = AstJsonProvider.getProvider().getSerializer().serializePretty(SyntaxTree.parse("x"));
        assertTrue(json.contains("\n"));
        assertTrue(json.contains("\"type\" : \"program\""));
    }
}
