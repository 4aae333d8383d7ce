package com.rbparser;

import com.rbparser.ast.Comment;
import com.rbparser.ast.Node;
import com.rbparser.doc.DocBuilder;
import com.rbparser.doc.LayoutPrinter;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.List;

/**
 * Dumps a syntax tree as an S-expression: {@code (tag field...)} per node with
 * fields in declaration order. Locations are left out; attached comments follow
 * the fields as a {@code (comments ...)} entry.
 */
public final class SexpPrinter extends DocBuilder {

    public static String print(Node node) {
        return print(node, LayoutPrinter.DEFAULT_PRINT_WIDTH);
    }

    public static String print(Node node, int width) {
        SexpPrinter printer = new SexpPrinter();
        printer.value(node);
        return new LayoutPrinter(width).print(printer.root());
    }

    private void value(Object value) {
        if (value == null) {
            text("nil");
        } else if (value instanceof String string) {
            text(quote(string));
        } else if (value instanceof Boolean || value instanceof Number) {
            text(value.toString());
        } else if (value instanceof Comment comment) {
            text("(" + comment.type().tag() + " " + quote(comment.value()) + ")");
        } else if (value instanceof Node node) {
            node(node);
        } else if (value instanceof List<?> list) {
            list(list);
        } else if (value instanceof Record record) {
            list(fields(record));
        } else {
            throw new IllegalStateException("Cannot dump " + value.getClass().getName());
        }
    }

    private void node(Node node) {
        List<Object> fields = fields((Record) node);
        group(() -> {
            text("(" + node.type().tag());
            indent(() -> {
                for (Object field : fields) {
                    breakableSpace();
                    value(field);
                }
                if (!node.comments().isEmpty()) {
                    breakableSpace();
                    group(() -> {
                        text("(comments");
                        indent(() -> {
                            for (Comment comment : node.comments()) {
                                breakableSpace();
                                value(comment);
                            }
                        });
                        text(")");
                    });
                }
            });
            text(")");
        });
    }

    private void list(List<?> values) {
        group(() -> {
            text("(");
            indent(() -> {
                breakableEmpty();
                seplist(values, this::breakableSpace, this::value);
            });
            breakableEmpty();
            text(")");
        });
    }

    private static List<Object> fields(Record record) {
        List<Object> fields = new ArrayList<>();
        for (RecordComponent component : record.getClass().getRecordComponents()) {
            String name = component.getName();
            if (name.equals("location") || name.equals("comments")) {
                continue;
            }
            try {
                fields.add(component.getAccessor().invoke(record));
            } catch (IllegalAccessException | InvocationTargetException e) {
                throw new IllegalStateException("Cannot read " + name + " of " + record.getClass().getSimpleName(), e);
            }
        }
        return fields;
    }

    static String quote(String value) {
        StringBuilder quoted = new StringBuilder("\"");
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> quoted.append("\\\"");
                case '\\' -> quoted.append("\\\\");
                case '\n' -> quoted.append("\\n");
                case '\t' -> quoted.append("\\t");
                case '\r' -> quoted.append("\\r");
                default -> quoted.append(c);
            }
        }
        return quoted.append('"').toString();
    }
}
