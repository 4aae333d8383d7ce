package com.rbparser;

import com.rbparser.ast.Assign;
import com.rbparser.ast.Comment;
import com.rbparser.ast.Int;
import com.rbparser.ast.Program;
import com.rbparser.ast.VarField;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class SyntaxTreeTest {

    @Test
    void parseBuildsAssignment() {
        Program program = SyntaxTree.parse("x = 1");
        Assign assign = assertInstanceOf(Assign.class, program.statements().body().get(0));
        assertInstanceOf(VarField.class, assign.target());
        assertEquals("1", assertInstanceOf(Int.class, assign.value()).value());
    }

    @Test
    void parseErrorsCarryPosition() {
        ParseException error = assertThrows(ParseException.class, () -> SyntaxTree.parse("x = (1"));
        assertTrue(error.getLine() >= 1);
    }

    @Test
    void unterminatedStringIsAParseError() {
        assertThrows(ParseException.class, () -> SyntaxTree.parse("\"abc"));
    }

    @Test
    void sexpNamesFieldsByType() {
        Program program = SyntaxTree.parse("x = 1");
        assertEquals("(program (statements ((assign (var_field (ident \"x\")) (int \"1\")))))",
            SyntaxTree.sexp(program));
    }

    @Test
    void sexpListsComments() {
        Program program = SyntaxTree.parse("foo # note");
        assertTrue(SyntaxTree.sexp(program).contains("(comments (comment \"# note\"))"));
    }

    @Test
    void sexpQuotesSpecialCharacters() {
        assertEquals("\"a\\\"b\\\\c\\n\"", SexpPrinter.quote("a\"b\\c\n"));
    }

    @Test
    void commentValuesAreTrimmed() {
        Program program = SyntaxTree.parse("foo # note   \n");
        Comment comment = program.statements().body().get(0).comments().get(0);
        assertEquals("# note", comment.value());
        assertTrue(comment.inline());
    }

    @Test
    void readDefaultsToUtf8(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("plain.rb");
        Files.writeString(file, "x = \"é\"\n", StandardCharsets.UTF_8);
        assertEquals("x = \"é\"\n", SyntaxTree.read(file));
    }

    @Test
    void readHonoursMagicComment(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("latin.rb");
        Files.write(file, "# encoding: iso-8859-1\nx = \"é\"\n".getBytes(StandardCharsets.ISO_8859_1));
        assertEquals("# encoding: iso-8859-1\nx = \"é\"\n", SyntaxTree.read(file));
    }

    @Test
    void readFindsMagicCommentAfterShebang(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("script.rb");
        String source = "#!/usr/bin/env ruby\n# -*- coding: iso-8859-1 -*-\nputs \"é\"\n";
        Files.write(file, source.getBytes(StandardCharsets.ISO_8859_1));
        assertEquals(source, SyntaxTree.read(file));
    }

    @Test
    void unknownEncodingFallsBackToUtf8() {
        byte[] bytes = "# encoding: not-a-charset\n".getBytes(StandardCharsets.US_ASCII);
        assertEquals(StandardCharsets.UTF_8, SyntaxTree.detectEncoding(bytes));
    }
}
