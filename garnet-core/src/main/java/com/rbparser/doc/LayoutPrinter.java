package com.rbparser.doc;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Renders a {@link Doc} tree to text in a single pass. Each group is printed
 * flat when its contents, plus everything after it up to the next possible line
 * break, fit in the remaining width; otherwise it breaks.
 */
public final class LayoutPrinter {

    public static final int DEFAULT_PRINT_WIDTH = 80;

    private static final String INDENT = "  ";

    private enum Mode { BREAK, FLAT }

    private record Command(String indentation, Mode mode, Doc doc) {}

    private record Suffix(Command command, int priority) {}

    private final int maxWidth;

    private final StringBuilder buffer = new StringBuilder();
    private final Deque<Command> commands = new ArrayDeque<>();
    private final List<Suffix> lineSuffixes = new ArrayList<>();
    private int position;
    private boolean shouldRemeasure;

    public LayoutPrinter(int maxWidth) {
        this.maxWidth = maxWidth;
    }

    public LayoutPrinter() {
        this(DEFAULT_PRINT_WIDTH);
    }

    public String print(Doc doc) {
        buffer.setLength(0);
        commands.clear();
        lineSuffixes.clear();
        position = 0;
        shouldRemeasure = false;

        commands.push(new Command("", Mode.BREAK, doc));
        while (!commands.isEmpty() || !lineSuffixes.isEmpty()) {
            if (commands.isEmpty()) {
                flushLineSuffixes();
                continue;
            }
            Command command = commands.pop();
            Doc current = command.doc();
            if (current instanceof Doc.Text text) {
                printText(text);
            } else if (current instanceof Doc.Group group) {
                printGroup(command, group);
            } else if (current instanceof Doc.Breakable breakable) {
                printBreakable(command, breakable);
            } else if (current instanceof Doc.Indent indent) {
                pushAll(command.indentation() + INDENT, command.mode(), indent.contents());
            } else if (current instanceof Doc.Align align) {
                pushAll(align(command.indentation(), align.width()), command.mode(), align.contents());
            } else if (current instanceof Doc.IfBreak ifBreak) {
                List<Doc> contents = command.mode() == Mode.BREAK ? ifBreak.breakContents() : ifBreak.flatContents();
                pushAll(command.indentation(), command.mode(), contents);
            } else if (current instanceof Doc.LineSuffix suffix) {
                lineSuffixes.add(new Suffix(command, suffix.priority()));
            } else if (current instanceof Doc.Fill fill) {
                printFill(command, fill);
            } else if (current instanceof Doc.Trim) {
                position -= trimTrailing();
            } else if (!(current instanceof Doc.BreakParent)) {
                throw new IllegalStateException("Unknown doc " + current);
            }
        }
        return buffer.toString();
    }

    private static String align(String indentation, int width) {
        if (width >= 0) {
            return indentation + " ".repeat(width);
        }
        return indentation.substring(0, Math.max(0, indentation.length() + width));
    }

    private void printText(Doc.Text text) {
        String value = text.value();
        buffer.append(value);
        int newline = value.lastIndexOf('\n');
        if (newline >= 0) {
            position = value.codePointCount(newline + 1, value.length());
        } else {
            position += text.width();
        }
    }

    private void printGroup(Command command, Doc.Group group) {
        if (command.mode() == Mode.FLAT && !group.broken() && !shouldRemeasure) {
            pushAll(command.indentation(), Mode.FLAT, group.contents());
            return;
        }
        shouldRemeasure = false;
        Command flat = new Command(command.indentation(), Mode.FLAT, group);
        boolean flatFits = !group.broken() && fits(List.of(flat), commands, maxWidth - position, false);
        pushAll(command.indentation(), flatFits ? Mode.FLAT : Mode.BREAK, group.contents());
    }

    private void printBreakable(Command command, Doc.Breakable breakable) {
        if (command.mode() == Mode.FLAT) {
            if (!breakable.force()) {
                buffer.append(breakable.separator());
                position += breakable.width();
                return;
            }
            shouldRemeasure = true;
        }
        if (!lineSuffixes.isEmpty()) {
            commands.push(command);
            flushLineSuffixes();
            return;
        }
        trimTrailing();
        buffer.append('\n');
        if (breakable.indent()) {
            buffer.append(command.indentation());
            position = command.indentation().length();
        } else {
            position = 0;
        }
    }

    private void printFill(Command command, Doc.Fill fill) {
        List<Doc> parts = fill.parts();
        if (parts.isEmpty()) {
            return;
        }
        String indentation = command.indentation();
        int remaining = maxWidth - position;

        Command contentFlat = new Command(indentation, Mode.FLAT, parts.get(0));
        Command contentBreak = new Command(indentation, Mode.BREAK, parts.get(0));
        boolean contentFits = fits(List.of(contentFlat), new ArrayDeque<>(), remaining, true);
        if (parts.size() == 1) {
            commands.push(contentFits ? contentFlat : contentBreak);
            return;
        }

        Command separatorFlat = new Command(indentation, Mode.FLAT, parts.get(1));
        Command separatorBreak = new Command(indentation, Mode.BREAK, parts.get(1));
        if (parts.size() == 2) {
            commands.push(contentFits ? separatorFlat : separatorBreak);
            commands.push(contentFits ? contentFlat : contentBreak);
            return;
        }

        Command rest = new Command(indentation, command.mode(), new Doc.Fill(parts.subList(2, parts.size())));
        List<Command> firstAndSecond = List.of(
            contentFlat, separatorFlat, new Command(indentation, Mode.FLAT, parts.get(2)));
        boolean bothFit = fits(firstAndSecond, new ArrayDeque<>(), remaining, true);

        commands.push(rest);
        if (bothFit) {
            commands.push(separatorFlat);
            commands.push(contentFlat);
        } else if (contentFits) {
            commands.push(separatorBreak);
            commands.push(contentFlat);
        } else {
            commands.push(separatorBreak);
            commands.push(contentBreak);
        }
    }

    /**
     * Pushes the buffered line suffixes so that they run before the command on top
     * of the stack: lowest priority first, insertion order within a priority.
     */
    private void flushLineSuffixes() {
        List<Suffix> ordered = new ArrayList<>(lineSuffixes);
        ordered.sort(Comparator.comparingInt(Suffix::priority));
        lineSuffixes.clear();
        for (int i = ordered.size() - 1; i >= 0; i--) {
            Command command = ordered.get(i).command();
            Doc.LineSuffix suffix = (Doc.LineSuffix) command.doc();
            pushAll(command.indentation(), command.mode(), suffix.contents());
        }
    }

    private boolean fits(List<Command> next, Deque<Command> rest, int width, boolean mustBeFlat) {
        Deque<Command> pending = new ArrayDeque<>();
        for (int i = next.size() - 1; i >= 0; i--) {
            pending.push(next.get(i));
        }
        Iterator<Command> restIterator = rest.iterator();
        int remaining = width;

        while (remaining >= 0) {
            if (pending.isEmpty()) {
                if (!restIterator.hasNext()) {
                    return true;
                }
                pending.push(restIterator.next());
                continue;
            }
            Command command = pending.pop();
            Doc current = command.doc();
            Mode mode = command.mode();
            if (current instanceof Doc.Text text) {
                int newline = text.value().indexOf('\n');
                if (newline >= 0) {
                    return remaining - text.value().codePointCount(0, newline) >= 0;
                }
                remaining -= text.width();
            } else if (current instanceof Doc.Group group) {
                if (mustBeFlat && group.broken()) {
                    return false;
                }
                pushAll(pending, command.indentation(), group.broken() ? Mode.BREAK : mode, group.contents());
            } else if (current instanceof Doc.Breakable breakable) {
                if (mode == Mode.FLAT && !breakable.force()) {
                    remaining -= breakable.width();
                } else {
                    return true;
                }
            } else if (current instanceof Doc.Indent indent) {
                pushAll(pending, command.indentation(), mode, indent.contents());
            } else if (current instanceof Doc.Align align) {
                pushAll(pending, command.indentation(), mode, align.contents());
            } else if (current instanceof Doc.Fill fill) {
                pushAll(pending, command.indentation(), mode, fill.parts());
            } else if (current instanceof Doc.IfBreak ifBreak) {
                pushAll(pending, command.indentation(), mode,
                    mode == Mode.BREAK ? ifBreak.breakContents() : ifBreak.flatContents());
            }
        }
        return false;
    }

    private void pushAll(String indentation, Mode mode, List<Doc> contents) {
        pushAll(commands, indentation, mode, contents);
    }

    private static void pushAll(Deque<Command> stack, String indentation, Mode mode, List<Doc> contents) {
        for (int i = contents.size() - 1; i >= 0; i--) {
            stack.push(new Command(indentation, mode, contents.get(i)));
        }
    }

    private int trimTrailing() {
        int trimmed = 0;
        int length = buffer.length();
        while (length > 0 && (buffer.charAt(length - 1) == ' ' || buffer.charAt(length - 1) == '\t')) {
            length--;
            trimmed++;
        }
        buffer.setLength(length);
        return trimmed;
    }
}
