package com.rbparser.ast;

import com.rbparser.SyntaxTree;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LocationPropertiesTest {

    @ParameterizedTest
    @ValueSource(strings = {
        "x = 1\ny = x + 2\n",
        "def foo(a, b = 1)\n  [a, b].map { |x| x * 2 }\nend\n",
        "class Foo < Bar\n  attr_reader :baz\nend\n",
        "if a\n  b\nelsif c\n  d\nelse\n  e\nend\n",
        "foo(<<~EOS, 1)\n  body #{x}\nEOS\nbar\n",
        "x = \"héllo\" # ünïcode\ny = [x, \"😀\", :ok]\n",
        "case value\nin [Integer => a, *rest]\n  a\nin {name: String => name}\n  name\nelse\n  nil\nend\n",
        "begin\n  risky\nrescue ArgumentError, TypeError => e\n  retry\nelse\n  ok\nensure\n  done\nend\n",
        "def foo\n  bar\nrescue\n  baz\nend\n",
        "# top\nclass Foo # c\n  # inside\n  def bar # d\n    baz # e\n  end\nend\n",
        "foo(1) # a\n  .bar # b\n  .baz\n",
        "items.each do |item|\n  # skip blanks\n  next if item.empty?\n  puts item\nend\n"
    })
    void childrenNestInsideParentsInOrder(String source) {
        Program program = SyntaxTree.parse(source);
        program.accept(new BasicVisitor<Void>() {
            @Override
            protected Void visitChildNodes(Node node) {
                List<Node> children = node.childNodes();
                Node previous = null;
                for (Node child : children) {
                    assertTrue(node.location().contains(child.location()),
                        child.type().tag() + " " + child.location() + " escapes " + node.type().tag() + " " + node.location());
                    if (previous != null) {
                        assertTrue(previous.location().endChar() <= child.location().startChar(),
                            previous.type().tag() + " overlaps " + child.type().tag() + " in " + node.type().tag());
                    }
                    previous = child;
                }
                return super.visitChildNodes(node);
            }
        });
    }
}
