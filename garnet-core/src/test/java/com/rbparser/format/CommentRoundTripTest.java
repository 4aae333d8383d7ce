package com.rbparser.format;

import com.rbparser.SyntaxTree;
import com.rbparser.ast.BasicVisitor;
import com.rbparser.ast.Comment;
import com.rbparser.ast.Node;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CommentRoundTripTest {

    private static List<String> comments(String source) {
        List<String> values = new ArrayList<>();
        SyntaxTree.parse(source).accept(new BasicVisitor<Void>() {
            @Override
            protected Void visitChildNodes(Node node) {
                if (node instanceof Comment comment) {
                    values.add(comment.value());
                }
                for (Comment comment : node.comments()) {
                    values.add(comment.value());
                }
                return super.visitChildNodes(node);
            }
        });
        Collections.sort(values);
        return values;
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "foo # a\nbar # b\n",
        "# top\nclass Foo # c\n  # inside\n  def bar # d\n    baz # e\n  end\nend\n",
        "foo(1) # a\n  .bar # b\n  .baz\n",
        "foo.bar # a\n  .baz # b\n  .qux # c\n",
        "x = [\n  1, # one\n  2 # two\n]\n",
        "foo(<<~EOS) # c\n  body\nEOS\n",
        "if a # cond\n  b\nelse\n  c # other\nend\n",
        "items.each do |item|\n  # skip blanks\n  next if item.empty?\n  puts item # print\nend\n",
        "=begin\ndocs\n=end\nfoo\n"
    })
    void everyCommentSurvivesFormatting(String source) {
        List<String> before = comments(source);
        String formatted = SyntaxTree.format(source);
        assertEquals(before, comments(formatted), formatted);
        assertEquals(formatted, SyntaxTree.format(formatted));
    }
}
