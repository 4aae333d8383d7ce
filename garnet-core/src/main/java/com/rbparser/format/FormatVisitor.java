package com.rbparser.format;

import com.rbparser.ast.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * The layout rules for each node. Children always go through
 * {@link Formatter#format(Node)} so that their comments are printed.
 */
final class FormatVisitor implements Visitor<Void> {

    private static final Set<String> ACCESS_CONTROLS = Set.of("private", "protected", "public", "module_function");

    private final Formatter f;

    FormatVisitor(Formatter formatter) {
        this.f = formatter;
    }

    // ========================================================================
    // Program and statements
    // ========================================================================

    @Override
    public Void visitProgram(Program node) {
        f.format(node.statements());
        f.breakableForce();
        return null;
    }

    @Override
    public Void visitStatements(Statements node) {
        boolean embedded = f.parent() instanceof StringEmbExpr;
        int line = -1;
        Node previous = null;
        for (Node statement : node.body()) {
            if (statement instanceof VoidStmt) {
                continue;
            }
            if (line < 0) {
                f.format(statement);
            } else if (statement.location().startLine() - line > 1
                    || isAccessControl(statement) || isAccessControl(previous)) {
                f.breakableForce();
                f.breakableForce();
                f.format(statement);
            } else if (statement.location().startLine() != line || !embedded) {
                f.breakableForce();
                f.format(statement);
            } else {
                f.text("; ");
                f.format(statement);
            }
            line = Formatter.lastLine(statement);
            previous = statement;
        }
        return null;
    }

    private static boolean isAccessControl(Node node) {
        return node instanceof VCall call && ACCESS_CONTROLS.contains(call.value().value());
    }

    @Override
    public Void visitVoidStmt(VoidStmt node) {
        return null;
    }

    @Override
    public Void visitComment(Comment node) {
        f.formatComment(node);
        return null;
    }

    @Override
    public Void visitEndContent(EndContent node) {
        String value = node.value();
        if (value.endsWith("\n")) {
            value = value.substring(0, value.length() - 1);
        }
        printLines(value, false);
        return null;
    }

    /**
     * Prints text line by line, each following line starting at column zero.
     */
    private void printLines(String value, boolean trailingNewline) {
        int start = 0;
        while (true) {
            int newline = value.indexOf('\n', start);
            if (newline < 0) {
                if (start < value.length()) {
                    f.text(value.substring(start));
                }
                break;
            }
            f.text(value.substring(start, newline));
            if (newline + 1 < value.length() || trailingNewline) {
                f.breakableReturn();
            }
            start = newline + 1;
        }
    }

    // ========================================================================
    // Leaves
    // ========================================================================

    @Override
    public Void visitIdent(Ident node) {
        f.text(node.value());
        return null;
    }

    @Override
    public Void visitConst(Const node) {
        f.text(node.value());
        return null;
    }

    @Override
    public Void visitIVar(IVar node) {
        f.text(node.value());
        return null;
    }

    @Override
    public Void visitCVar(CVar node) {
        f.text(node.value());
        return null;
    }

    @Override
    public Void visitGVar(GVar node) {
        f.text(node.value());
        return null;
    }

    @Override
    public Void visitBackref(Backref node) {
        f.text(node.value());
        return null;
    }

    @Override
    public Void visitBacktick(Backtick node) {
        f.text(node.value());
        return null;
    }

    @Override
    public Void visitKw(Kw node) {
        f.text(node.value());
        return null;
    }

    @Override
    public Void visitOp(Op node) {
        f.text(node.value());
        return null;
    }

    @Override
    public Void visitPeriod(Period node) {
        f.text(node.value());
        return null;
    }

    @Override
    public Void visitLabel(Label node) {
        f.text(node.value());
        return null;
    }

    @Override
    public Void visitLBrace(LBrace node) {
        f.text(node.value());
        return null;
    }

    @Override
    public Void visitLBracket(LBracket node) {
        f.text(node.value());
        return null;
    }

    @Override
    public Void visitLParen(LParen node) {
        f.text(node.value());
        return null;
    }

    @Override
    public Void visitExcessedComma(ExcessedComma node) {
        f.text(",");
        return null;
    }

    @Override
    public Void visitInt(Int node) {
        f.text(groupDigits(node.value()));
        return null;
    }

    /**
     * Inserts underscores every three digits into plain decimal literals of five
     * digits or more.
     */
    static String groupDigits(String value) {
        if (value.length() < 5 || value.startsWith("0")) {
            return value;
        }
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return value;
            }
        }
        StringBuilder grouped = new StringBuilder();
        int leading = value.length() % 3;
        for (int i = 0; i < value.length(); i++) {
            if (i > 0 && (i - leading) % 3 == 0) {
                grouped.append('_');
            }
            grouped.append(value.charAt(i));
        }
        return grouped.toString();
    }

    @Override
    public Void visitFloatLiteral(FloatLiteral node) {
        f.text(node.value());
        return null;
    }

    @Override
    public Void visitRationalLiteral(RationalLiteral node) {
        f.text(node.value());
        return null;
    }

    @Override
    public Void visitImaginary(Imaginary node) {
        f.text(node.value());
        return null;
    }

    @Override
    public Void visitCharLiteral(CharLiteral node) {
        String value = node.value();
        String quote = f.quote();
        if (value.length() == 2 && value.charAt(1) != '\\' && value.charAt(1) != '#'
                && !value.substring(1).equals(quote)) {
            f.text(quote + value.charAt(1) + quote);
        } else {
            f.text(value);
        }
        return null;
    }

    // ========================================================================
    // Variables and constants
    // ========================================================================

    @Override
    public Void visitVarRef(VarRef node) {
        f.format(node.value());
        return null;
    }

    @Override
    public Void visitVarField(VarField node) {
        f.format(node.value());
        return null;
    }

    @Override
    public Void visitVCall(VCall node) {
        f.format(node.value());
        return null;
    }

    @Override
    public Void visitPinnedVarRef(PinnedVarRef node) {
        f.text("^");
        f.format(node.value());
        return null;
    }

    @Override
    public Void visitPinnedBegin(PinnedBegin node) {
        f.text("^(");
        f.format(node.statement());
        f.text(")");
        return null;
    }

    @Override
    public Void visitConstRef(ConstRef node) {
        f.format(node.constant());
        return null;
    }

    @Override
    public Void visitConstPathRef(ConstPathRef node) {
        f.format(node.parent());
        f.text("::");
        f.format(node.constant());
        return null;
    }

    @Override
    public Void visitConstPathField(ConstPathField node) {
        f.format(node.parent());
        f.text("::");
        f.format(node.constant());
        return null;
    }

    @Override
    public Void visitTopConstRef(TopConstRef node) {
        f.text("::");
        f.format(node.constant());
        return null;
    }

    @Override
    public Void visitTopConstField(TopConstField node) {
        f.text("::");
        f.format(node.constant());
        return null;
    }

    @Override
    public Void visitField(Field node) {
        f.format(node.parent());
        f.format(node.operator());
        f.format(node.name());
        return null;
    }

    @Override
    public Void visitARef(ARef node) {
        formatIndex(node.collection(), node.index());
        return null;
    }

    @Override
    public Void visitARefField(ARefField node) {
        formatIndex(node.collection(), node.index());
        return null;
    }

    private void formatIndex(Node collection, Args index) {
        f.format(collection);
        f.group(() -> {
            f.text("[");
            if (index != null) {
                f.indent(() -> {
                    f.breakableEmpty();
                    f.format(index);
                });
                f.breakableEmpty();
            }
            f.text("]");
        });
    }

    // ========================================================================
    // Assignment
    // ========================================================================

    @Override
    public Void visitAssign(Assign node) {
        f.group(() -> {
            f.format(node.target());
            f.text(" =");
            formatAssignedValue(node.value());
        });
        return null;
    }

    @Override
    public Void visitOpAssign(OpAssign node) {
        f.group(() -> {
            f.format(node.target());
            f.text(" ");
            f.format(node.operator());
            formatAssignedValue(node.value());
        });
        return null;
    }

    private void formatAssignedValue(Node value) {
        if (skipIndent(value)) {
            f.text(" ");
            f.format(value);
        } else {
            f.indent(() -> {
                f.breakableSpace();
                f.format(value);
            });
        }
    }

    /**
     * Values that read best starting on the line of their target, because they
     * carry their own delimiters or break internally anyway.
     */
    private static boolean skipIndent(Node value) {
        return value instanceof ArrayLiteral || value instanceof HashLiteral || value instanceof Heredoc
            || value instanceof Lambda || value instanceof QWords || value instanceof QSymbols
            || value instanceof Words || value instanceof Symbols || value instanceof Case
            || value instanceof Begin || value instanceof MethodAddBlock || value instanceof StringConcat
            || value instanceof MRHS
            || value instanceof IfNode ifNode && !isModifier(ifNode.predicate(), ifNode.statements())
            || value instanceof UnlessNode unless && !isModifier(unless.predicate(), unless.statements());
    }

    @Override
    public Void visitMAssign(MAssign node) {
        f.group(() -> {
            f.format(node.target());
            f.text(" =");
            formatAssignedValue(node.value());
        });
        return null;
    }

    @Override
    public Void visitMLHS(MLHS node) {
        f.seplist(node.parts(), () -> f.text(", "), f::format);
        if (node.comma()) {
            f.text(",");
        }
        return null;
    }

    @Override
    public Void visitMLHSParen(MLHSParen node) {
        f.text("(");
        f.format(node.contents());
        f.text(")");
        return null;
    }

    @Override
    public Void visitMRHS(MRHS node) {
        f.group(() -> f.seplist(node.parts(), f::commaBreakable, f::format));
        return null;
    }

    @Override
    public Void visitRAssign(RAssign node) {
        f.format(node.value());
        f.text(" ");
        f.format(node.operator());
        f.text(" ");
        f.format(node.pattern());
        return null;
    }

    // ========================================================================
    // Arguments
    // ========================================================================

    @Override
    public Void visitArgs(Args node) {
        f.seplist(node.parts(), f::commaBreakable, f::format);
        return null;
    }

    @Override
    public Void visitArgParen(ArgParen node) {
        Node arguments = node.arguments();
        if (arguments == null) {
            f.text("()");
            return null;
        }
        f.group(() -> {
            f.text("(");
            f.indent(() -> {
                f.breakableEmpty();
                f.format(arguments);
                if (f.options().trailingComma() && allowsTrailingComma(arguments)) {
                    f.ifBreak(() -> f.text(","));
                }
            });
            f.breakableEmpty();
            f.text(")");
        });
        return null;
    }

    private static boolean allowsTrailingComma(Node arguments) {
        if (!(arguments instanceof Args args) || args.parts().isEmpty()) {
            return false;
        }
        Node last = args.parts().get(args.parts().size() - 1);
        return !(last instanceof ArgBlock || last instanceof ArgsForward
            || last instanceof Command || last instanceof CommandCall);
    }

    @Override
    public Void visitArgBlock(ArgBlock node) {
        f.text("&");
        f.format(node.value());
        return null;
    }

    @Override
    public Void visitArgStar(ArgStar node) {
        f.text("*");
        f.format(node.value());
        return null;
    }

    @Override
    public Void visitArgsForward(ArgsForward node) {
        f.text("...");
        return null;
    }

    @Override
    public Void visitAssocSplat(AssocSplat node) {
        f.text("**");
        f.format(node.value());
        return null;
    }

    @Override
    public Void visitBareAssocHash(BareAssocHash node) {
        f.seplist(node.assocs(), f::commaBreakable, f::format);
        return null;
    }

    @Override
    public Void visitAssoc(Assoc node) {
        Node key = node.key();
        Node value = node.value();
        f.format(key);
        if (value == null) {
            return null;
        }
        if (!isLabel(key)) {
            f.text(" =>");
        }
        if (skipIndent(value)) {
            f.text(" ");
            f.format(value);
        } else {
            f.group(() -> f.indent(() -> {
                f.breakableSpace();
                f.format(value);
            }));
        }
        return null;
    }

    private static boolean isLabel(Node key) {
        return key instanceof Label
            || key instanceof DynaSymbol symbol && !symbol.quote().startsWith(":") && !symbol.quote().startsWith("%");
    }

    // ========================================================================
    // Collections
    // ========================================================================

    @Override
    public Void visitArrayLiteral(ArrayLiteral node) {
        Args contents = node.contents();
        if (contents == null || contents.parts().isEmpty()) {
            f.format(node.lbracket());
            f.text("]");
            return null;
        }
        List<Node> parts = contents.parts();
        boolean plain = node.lbracket().value().equals("[") && contents.comments().isEmpty()
            && parts.size() > 1 && parts.stream().allMatch(part -> part.comments().isEmpty());

        if (plain && parts.stream().allMatch(FormatVisitor::isWordElement)) {
            formatWordArray("%w[", parts, part -> {
                if (part instanceof CharLiteral character) {
                    f.text(character.value().substring(1));
                } else {
                    f.format(((StringLiteral) part).parts().get(0));
                }
            });
        } else if (plain && parts.stream().allMatch(FormatVisitor::isSymbolElement)) {
            formatWordArray("%i[", parts, part -> f.format(((SymbolLiteral) part).value()));
        } else if (plain && parts.size() > 2 && parts.stream().allMatch(part -> part instanceof VarRef)) {
            formatVarRefArray(contents);
        } else {
            f.group(() -> {
                f.format(node.lbracket());
                f.indent(() -> {
                    f.breakableEmpty();
                    f.format(contents);
                    if (f.options().trailingComma()) {
                        f.ifBreak(() -> f.text(","));
                    }
                });
                f.breakableEmpty();
                f.text("]");
            });
        }
        return null;
    }

    private static boolean isWordElement(Node part) {
        if (part instanceof CharLiteral character) {
            return character.value().length() == 2 && isWordText(character.value().substring(1));
        }
        return part instanceof StringLiteral string
            && !Quotes.isPercent(string.quote())
            && string.parts().size() == 1
            && string.parts().get(0) instanceof TStringContent content
            && !content.value().isEmpty()
            && isWordText(content.value());
    }

    private static boolean isWordText(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isWhitespace(c) || c == '[' || c == ']' || c == '\\') {
                return false;
            }
        }
        return true;
    }

    private static boolean isSymbolElement(Node part) {
        return part instanceof SymbolLiteral symbol
            && symbol.location().startChar() != symbol.value().location().startChar()
            && (symbol.value() instanceof Ident || symbol.value() instanceof Const || symbol.value() instanceof Kw);
    }

    private void formatWordArray(String opening, List<Node> parts, Consumer<Node> element) {
        f.group(() -> {
            f.text(opening);
            f.indent(() -> {
                f.breakableEmpty();
                f.seplist(parts, f::breakableSpace, part -> f.formatWith(part, () -> element.accept(part)));
            });
            f.breakableEmpty();
            f.text("]");
        });
    }

    private void formatVarRefArray(Args contents) {
        List<Node> parts = contents.parts();
        f.group(() -> {
            f.text("[");
            f.indent(() -> {
                f.breakableEmpty();
                f.formatWith(contents, () -> f.fill(() -> {
                    for (int i = 0; i < parts.size(); i++) {
                        Node part = parts.get(i);
                        boolean last = i == parts.size() - 1;
                        f.group(() -> {
                            f.format(part);
                            if (!last) {
                                f.text(",");
                            }
                        });
                        if (!last) {
                            f.breakableSpace();
                        }
                    }
                }));
                if (f.options().trailingComma()) {
                    f.ifBreak(() -> f.text(","));
                }
            });
            f.breakableEmpty();
            f.text("]");
        });
    }

    @Override
    public Void visitHashLiteral(HashLiteral node) {
        if (node.assocs().isEmpty()) {
            f.format(node.lbrace());
            f.text("}");
            return null;
        }
        f.group(() -> {
            f.format(node.lbrace());
            f.indent(() -> {
                f.breakableSpace();
                f.seplist(node.assocs(), f::commaBreakable, f::format);
                if (f.options().trailingComma()) {
                    f.ifBreak(() -> f.text(","));
                }
            });
            f.breakableSpace();
            f.text("}");
        });
        return null;
    }

    @Override
    public Void visitQWords(QWords node) {
        formatWordList(node.opening(), node.elements());
        return null;
    }

    @Override
    public Void visitQSymbols(QSymbols node) {
        formatWordList(node.opening(), node.elements());
        return null;
    }

    @Override
    public Void visitWords(Words node) {
        formatWordList(node.opening(), node.elements());
        return null;
    }

    @Override
    public Void visitSymbols(Symbols node) {
        formatWordList(node.opening(), node.elements());
        return null;
    }

    /**
     * Percent word lists switch to square brackets unless an element contains one.
     */
    private void formatWordList(String opening, List<? extends Node> elements) {
        String written = opening.strip();
        boolean brackets = elements.stream().noneMatch(element -> {
            String text = f.slice(element.location());
            return text.indexOf('[') >= 0 || text.indexOf(']') >= 0;
        });
        String open = brackets ? written.substring(0, 2) + "[" : written;
        String close = brackets ? "]" : Quotes.closing(written);
        f.group(() -> {
            f.text(open);
            f.indent(() -> {
                f.breakableEmpty();
                f.seplist(elements, f::breakableSpace, f::format);
            });
            f.breakableEmpty();
            f.text(close);
        });
    }

    @Override
    public Void visitWord(Word node) {
        formatParts(node.parts());
        return null;
    }

    // ========================================================================
    // Strings, symbols and regular expressions
    // ========================================================================

    @Override
    public Void visitStringLiteral(StringLiteral node) {
        String opening = node.quote();
        if (Quotes.isPercent(opening)) {
            f.text(opening);
            formatParts(node.parts());
            f.text(Quotes.closing(opening));
            return null;
        }
        String quote = Quotes.locked(node.parts(), f.quote()) ? opening : f.quote();
        f.text(quote);
        formatParts(node.parts());
        f.text(quote);
        return null;
    }

    private void formatParts(List<Node> parts) {
        for (Node part : parts) {
            f.format(part);
        }
    }

    @Override
    public Void visitTStringContent(TStringContent node) {
        f.text(node.value());
        return null;
    }

    @Override
    public Void visitStringEmbExpr(StringEmbExpr node) {
        Location location = node.location();
        if (location.startLine() != location.endLine()) {
            f.text(f.slice(location));
            return null;
        }
        f.text("#{");
        f.flat(() -> f.format(node.statements()));
        f.text("}");
        return null;
    }

    @Override
    public Void visitStringDVar(StringDVar node) {
        f.text("#{");
        f.format(node.variable());
        f.text("}");
        return null;
    }

    @Override
    public Void visitStringConcat(StringConcat node) {
        f.group(() -> {
            f.format(node.left());
            f.text(" \\");
            f.indent(() -> {
                f.breakableForce();
                f.format(node.right());
            });
        });
        return null;
    }

    @Override
    public Void visitXStringLiteral(XStringLiteral node) {
        f.text("`");
        formatParts(node.parts());
        f.text("`");
        return null;
    }

    @Override
    public Void visitHeredoc(Heredoc node) {
        f.group(() -> {
            f.format(node.beginning());
            f.lineSuffix(Formatter.HEREDOC_PRIORITY, () -> {
                f.breakableReturn();
                for (Node part : node.parts()) {
                    if (part instanceof TStringContent content) {
                        f.formatWith(part, () -> printLines(content.value(), true));
                    } else {
                        f.format(part);
                    }
                }
                f.format(node.ending());
            });
        });
        return null;
    }

    @Override
    public Void visitHeredocBeg(HeredocBeg node) {
        f.text(node.value());
        return null;
    }

    @Override
    public Void visitHeredocEnd(HeredocEnd node) {
        f.text(node.value());
        return null;
    }

    @Override
    public Void visitSymbolLiteral(SymbolLiteral node) {
        if (node.location().startChar() != node.value().location().startChar()) {
            f.text(":");
        }
        f.format(node.value());
        return null;
    }

    @Override
    public Void visitDynaSymbol(DynaSymbol node) {
        String quote = node.quote();
        f.text(quote);
        formatParts(node.parts());
        if (Quotes.isPercent(quote)) {
            f.text(Quotes.closing(quote));
        } else if (quote.startsWith(":")) {
            f.text(quote.substring(1));
        } else {
            f.text(quote + ":");
        }
        return null;
    }

    @Override
    public Void visitRegexpLiteral(RegexpLiteral node) {
        f.text(node.beginning());
        formatParts(node.parts());
        f.text(node.ending());
        return null;
    }

    // ========================================================================
    // Operators
    // ========================================================================

    @Override
    public Void visitBinary(Binary node) {
        String operator = node.operator();
        if (operator.equals("**")) {
            f.format(node.left());
            f.text("**");
            f.format(node.right());
            return null;
        }
        f.group(() -> {
            f.format(node.left());
            f.text(" " + operator);
            f.indent(() -> {
                f.breakableSpace();
                f.format(node.right());
            });
        });
        return null;
    }

    @Override
    public Void visitUnary(Unary node) {
        f.text(node.operator());
        f.format(node.statement());
        return null;
    }

    @Override
    public Void visitNot(Not node) {
        f.text("not");
        if (node.parentheses()) {
            f.text("(");
            f.format(node.statement());
            f.text(")");
        } else {
            f.text(" ");
            f.format(node.statement());
        }
        return null;
    }

    @Override
    public Void visitDefined(Defined node) {
        f.text("defined?(");
        f.format(node.value());
        f.text(")");
        return null;
    }

    @Override
    public Void visitRangeNode(RangeNode node) {
        f.format(node.left());
        f.format(node.operator());
        f.format(node.right());
        return null;
    }

    @Override
    public Void visitParen(Paren node) {
        Node contents = node.contents();
        boolean empty = contents == null
            || contents instanceof Params params && params.isEmpty()
            || contents instanceof Statements statements && statements.isEmpty();
        f.group(() -> {
            if (node.lparen() != null) {
                f.format(node.lparen());
            } else {
                f.text("(");
            }
            if (!empty) {
                f.indent(() -> {
                    f.breakableEmpty();
                    f.format(contents);
                });
                f.breakableEmpty();
            }
            f.text(")");
        });
        return null;
    }

    @Override
    public Void visitIfOp(IfOp node) {
        Node parent = f.parent();
        boolean commandArgument = parent instanceof Command || parent instanceof CommandCall
            || parent instanceof Args && (f.grandparent() instanceof Command || f.grandparent() instanceof CommandCall);
        if (commandArgument) {
            formatTernary(node.predicate(), node.truthy(), node.falsy());
            return null;
        }
        f.group(() -> f.ifBreak(
            () -> {
                f.text("if ");
                f.nest(3, () -> f.format(node.predicate()));
                f.indent(() -> {
                    f.breakableSpace();
                    f.format(node.truthy());
                });
                f.breakableSpace();
                f.text("else");
                f.indent(() -> {
                    f.breakableSpace();
                    f.format(node.falsy());
                });
                f.breakableSpace();
                f.text("end");
            },
            () -> formatTernary(node.predicate(), node.truthy(), node.falsy())));
        return null;
    }

    private void formatTernary(Node predicate, Node truthy, Node falsy) {
        f.format(predicate);
        f.text(" ? ");
        f.format(truthy);
        f.text(" : ");
        f.format(falsy);
    }

    // ========================================================================
    // Calls
    // ========================================================================

    @Override
    public Void visitCallNode(CallNode node) {
        if (chainLength(node) >= 3) {
            formatChain(node);
            return null;
        }
        formatCall(node);
        return null;
    }

    private void formatCall(CallNode node) {
        if (node.receiver() == null) {
            formatMessage(node);
        } else if (hasTrailingComment(node.receiver())) {
            // the comment ends the receiver's line, so the call continues on the next one
            f.format(node.receiver());
            f.indent(() -> {
                f.breakableForce();
                f.format(node.operator());
                formatMessage(node);
            });
        } else {
            f.format(node.receiver());
            f.format(node.operator());
            formatMessage(node);
        }
    }

    private void formatMessage(CallNode node) {
        f.format(node.message());
        Node arguments = node.arguments();
        if (arguments instanceof ArgParen paren && paren.arguments() == null && node.message() != null
                && !(node.message() instanceof Const) && paren.comments().isEmpty()) {
            return;
        }
        f.format(arguments);
    }

    private static boolean hasTrailingComment(Node node) {
        for (Comment comment : node.comments()) {
            if (!comment.leading()) {
                return true;
            }
        }
        return false;
    }

    private static boolean isLink(Node node) {
        if (node instanceof MethodAddBlock block) {
            return isLink(block.call());
        }
        return node instanceof CallNode call
            && call.receiver() != null
            && call.operator() instanceof Period period
            && !period.value().equals("::");
    }

    private static int chainLength(Node node) {
        int length = 0;
        Node current = node;
        while (isLink(current)) {
            if (current instanceof MethodAddBlock block) {
                current = block.call();
            } else {
                length++;
                current = ((CallNode) current).receiver();
            }
        }
        return length;
    }

    /**
     * A chain of three or more calls breaks before every dot when it does not
     * fit on one line.
     */
    private void formatChain(Node top) {
        List<Node> links = new ArrayList<>();
        Node current = top;
        while (isLink(current)) {
            links.add(current);
            current = current instanceof MethodAddBlock block ? block.call() : ((CallNode) current).receiver();
        }
        Node root = current;
        f.group(() -> {
            f.format(root);
            f.indent(() -> {
                for (int i = links.size() - 1; i >= 0; i--) {
                    Node link = links.get(i);
                    if (link == top) {
                        formatLink(link);
                    } else {
                        f.formatWith(link, () -> formatLink(link));
                    }
                }
            });
        });
    }

    private void formatLink(Node link) {
        if (link instanceof MethodAddBlock block) {
            f.format(block.block());
            return;
        }
        CallNode call = (CallNode) link;
        f.breakableEmpty();
        f.format(call.operator());
        f.format(call.message());
        Node arguments = call.arguments();
        if (arguments instanceof ArgParen paren && paren.arguments() == null && call.message() != null
                && !(call.message() instanceof Const) && paren.comments().isEmpty()) {
            return;
        }
        f.format(arguments);
    }

    @Override
    public Void visitCommand(Command node) {
        f.group(() -> {
            f.format(node.message());
            formatCommandArguments(node.arguments(), messageWidth(node.message()));
        });
        f.format(node.block());
        return null;
    }

    @Override
    public Void visitCommandCall(CommandCall node) {
        f.group(() -> {
            f.format(node.receiver());
            f.format(node.operator());
            f.format(node.message());
            formatCommandArguments(node.arguments(), -1);
        });
        f.format(node.block());
        return null;
    }

    private static int messageWidth(Node message) {
        if (message instanceof Ident ident) {
            return ident.value().length();
        }
        if (message instanceof Const constant) {
            return constant.value().length();
        }
        return -1;
    }

    /**
     * Arguments of a command line up under the first one when they break.
     */
    private void formatCommandArguments(Args arguments, int width) {
        if (arguments == null) {
            return;
        }
        f.text(" ");
        List<Node> parts = arguments.parts();
        if (parts.size() == 1 && (parts.get(0) instanceof DefNode || parts.get(0) instanceof Command
                || parts.get(0) instanceof CommandCall)) {
            f.format(arguments);
        } else if (width >= 0) {
            f.nest(width + 1, () -> f.format(arguments));
        } else {
            f.indent(() -> f.format(arguments));
        }
    }

    @Override
    public Void visitMethodAddBlock(MethodAddBlock node) {
        if (chainLength(node) >= 3) {
            formatChain(node);
            return null;
        }
        f.format(node.call());
        f.format(node.block());
        return null;
    }

    @Override
    public Void visitBlockNode(BlockNode node) {
        boolean writtenDo = node.opening() instanceof Kw;
        boolean complex = node.bodystmt() instanceof BodyStmt body
            && (body.rescueClause() != null || body.elseClause() != null || body.ensureClause() != null);
        boolean unchangeable = unchangeableBounds();
        boolean forcedDo = complex || f.parent() instanceof MethodAddBlock call && call.call() instanceof Super;
        boolean forcedBraces = !forcedDo && forcedBraceBounds();

        String breakOpening;
        String flatOpening;
        if (unchangeable) {
            breakOpening = writtenDo ? "do" : "{";
            flatOpening = breakOpening;
        } else {
            breakOpening = forcedBraces ? "{" : "do";
            flatOpening = forcedDo ? "do" : "{";
        }

        f.group(() -> {
            f.text(" ");
            if (flatOpening.equals("do")) {
                f.breakParent();
            }
            f.ifBreak(() -> formatBlockBroken(node, breakOpening), () -> formatBlockFlat(node, flatOpening));
        });
        return null;
    }

    private void formatBlockBroken(BlockNode node, String opening) {
        f.text(opening);
        if (node.blockVar() != null) {
            f.text(" ");
            f.format(node.blockVar());
        }
        if (!isEmptyBody(node.bodystmt())) {
            f.indent(() -> {
                f.breakableSpace();
                f.format(node.bodystmt());
            });
        }
        f.breakableSpace();
        f.text(opening.equals("do") ? "end" : "}");
    }

    private void formatBlockFlat(BlockNode node, String opening) {
        f.text(opening);
        boolean empty = isEmptyBody(node.bodystmt());
        if (node.blockVar() == null && empty) {
            f.text(opening.equals("do") ? " end" : "}");
            return;
        }
        if (node.blockVar() != null) {
            f.text(" ");
            f.format(node.blockVar());
        }
        if (!empty) {
            f.text(" ");
            f.format(node.bodystmt());
        }
        f.text(opening.equals("do") ? " end" : " }");
    }

    private static boolean isEmptyBody(Node body) {
        if (body instanceof BodyStmt bodystmt) {
            return bodystmt.isEmpty();
        }
        return body instanceof Statements statements && statements.isEmpty();
    }

    /**
     * Inside command arguments the keyword decides which call a block binds to,
     * so it stays as written.
     */
    private boolean unchangeableBounds() {
        for (Node ancestor : f.ancestors()) {
            if (ancestor instanceof Statements || ancestor instanceof ArgParen) {
                return false;
            }
            if (ancestor instanceof Command || ancestor instanceof CommandCall) {
                return true;
            }
        }
        return false;
    }

    /**
     * A {@code do} inside a loop or conditional predicate would be read as part of
     * that statement.
     */
    private boolean forcedBraceBounds() {
        Node previous = f.current();
        for (Node ancestor : f.ancestors()) {
            if (ancestor instanceof Paren || ancestor instanceof Statements) {
                return false;
            }
            Node predicate = predicateOf(ancestor);
            if (predicate != null && predicate == previous) {
                return true;
            }
            previous = ancestor;
        }
        return false;
    }

    private static Node predicateOf(Node node) {
        if (node instanceof IfNode ifNode) {
            return ifNode.predicate();
        }
        if (node instanceof UnlessNode unless) {
            return unless.predicate();
        }
        if (node instanceof WhileNode whileNode) {
            return whileNode.predicate();
        }
        if (node instanceof UntilNode until) {
            return until.predicate();
        }
        if (node instanceof IfOp ifOp) {
            return ifOp.predicate();
        }
        return null;
    }

    @Override
    public Void visitBlockVar(BlockVar node) {
        f.text("|");
        f.flat(() -> {
            f.format(node.params());
            formatLocals(node.locals());
        });
        f.text("|");
        return null;
    }

    private void formatLocals(List<Ident> locals) {
        if (!locals.isEmpty()) {
            f.text("; ");
            f.seplist(locals, () -> f.text(", "), f::format);
        }
    }

    @Override
    public Void visitLambdaVar(LambdaVar node) {
        f.format(node.params());
        formatLocals(node.locals());
        return null;
    }

    @Override
    public Void visitLambda(Lambda node) {
        f.text("->");
        Node params = node.params();
        if (params instanceof Paren paren) {
            if (!isEmptyParams(paren.contents())) {
                f.format(paren);
            }
        } else if (params != null && !isEmptyParams(params)) {
            f.text("(");
            f.format(params);
            f.text(")");
        }
        Node body = node.statements();
        boolean empty = isEmptyBody(body);
        boolean complex = body instanceof BodyStmt bodystmt
            && (bodystmt.rescueClause() != null || bodystmt.elseClause() != null || bodystmt.ensureClause() != null);
        f.group(() -> {
            f.text(" ");
            if (complex) {
                f.breakParent();
            }
            f.ifBreak(
                () -> {
                    f.text("do");
                    if (!empty) {
                        f.indent(() -> {
                            f.breakableSpace();
                            f.format(body);
                        });
                    }
                    f.breakableSpace();
                    f.text("end");
                },
                () -> {
                    if (empty) {
                        f.text("{}");
                    } else {
                        f.text("{ ");
                        f.format(body);
                        f.text(" }");
                    }
                });
        });
        return null;
    }

    private static boolean isEmptyParams(Node contents) {
        if (contents instanceof LambdaVar lambdaVar) {
            return lambdaVar.params().isEmpty() && lambdaVar.locals().isEmpty();
        }
        return contents == null || contents instanceof Params params && params.isEmpty();
    }

    // ========================================================================
    // Parameters
    // ========================================================================

    @Override
    public Void visitParams(Params node) {
        List<Runnable> parts = new ArrayList<>();
        for (Node required : node.requireds()) {
            parts.add(() -> f.format(required));
        }
        for (Params.OptionalParam optional : node.optionals()) {
            parts.add(() -> {
                f.format(optional.name());
                f.text(" = ");
                f.format(optional.value());
            });
        }
        Node rest = node.rest();
        if (rest != null && !(rest instanceof ExcessedComma)) {
            parts.add(() -> f.format(rest));
        }
        for (Node post : node.posts()) {
            parts.add(() -> f.format(post));
        }
        for (Params.KeywordParam keyword : node.keywords()) {
            parts.add(() -> {
                f.format(keyword.name());
                if (keyword.value() != null) {
                    f.text(" ");
                    f.format(keyword.value());
                }
            });
        }
        if (node.keywordRest() != null) {
            parts.add(() -> f.format(node.keywordRest()));
        }
        if (node.block() != null) {
            parts.add(() -> f.format(node.block()));
        }
        f.seplist(parts, f::commaBreakable, Runnable::run);
        if (rest instanceof ExcessedComma) {
            f.format(rest);
        }
        return null;
    }

    @Override
    public Void visitRestParam(RestParam node) {
        f.text("*");
        f.format(node.name());
        return null;
    }

    @Override
    public Void visitKwRestParam(KwRestParam node) {
        f.text("**");
        f.format(node.name());
        return null;
    }

    @Override
    public Void visitBlockArg(BlockArg node) {
        f.text("&");
        f.format(node.name());
        return null;
    }

    // ========================================================================
    // Definitions
    // ========================================================================

    @Override
    public Void visitDefNode(DefNode node) {
        f.group(() -> {
            f.text("def ");
            if (node.target() != null) {
                f.format(node.target());
                f.format(node.operator());
            }
            f.format(node.name());
            Node params = node.params();
            if (params instanceof Paren paren) {
                if (!isEmptyParams(paren.contents())) {
                    f.format(paren);
                }
            } else if (params instanceof Params bare && !bare.isEmpty()) {
                f.group(() -> {
                    f.text("(");
                    f.indent(() -> {
                        f.breakableEmpty();
                        f.format(bare);
                    });
                    f.breakableEmpty();
                    f.text(")");
                });
            }
            if (!(node.bodystmt() instanceof BodyStmt)) {
                f.text(" =");
                formatAssignedValue(node.bodystmt());
            }
        });
        if (node.bodystmt() instanceof BodyStmt bodystmt) {
            formatBodyAndEnd(bodystmt);
        }
        return null;
    }

    private void formatBodyAndEnd(BodyStmt bodystmt) {
        if (!bodystmt.isEmpty()) {
            f.indent(() -> {
                if (!bodystmt.statements().isEmpty()) {
                    f.breakableForce();
                }
                f.format(bodystmt);
            });
        }
        f.breakableForce();
        f.text("end");
    }

    @Override
    public Void visitClassDeclaration(ClassDeclaration node) {
        f.group(() -> {
            f.text("class ");
            f.format(node.constant());
            if (node.superclass() != null) {
                f.text(" < ");
                f.format(node.superclass());
            }
        });
        formatBodyAndEnd(node.bodystmt());
        return null;
    }

    @Override
    public Void visitModuleDeclaration(ModuleDeclaration node) {
        f.group(() -> {
            f.text("module ");
            f.format(node.constant());
        });
        formatBodyAndEnd(node.bodystmt());
        return null;
    }

    @Override
    public Void visitSClass(SClass node) {
        f.text("class << ");
        f.format(node.target());
        formatBodyAndEnd(node.bodystmt());
        return null;
    }

    @Override
    public Void visitAliasNode(AliasNode node) {
        f.text("alias ");
        f.format(node.left());
        f.text(" ");
        f.format(node.right());
        return null;
    }

    @Override
    public Void visitUndef(Undef node) {
        f.text("undef ");
        f.seplist(node.symbols(), () -> f.text(", "), f::format);
        return null;
    }

    @Override
    public Void visitBEGINBlock(BEGINBlock node) {
        formatHookBlock("BEGIN", node.statements());
        return null;
    }

    @Override
    public Void visitENDBlock(ENDBlock node) {
        formatHookBlock("END", node.statements());
        return null;
    }

    private void formatHookBlock(String keyword, Statements statements) {
        f.group(() -> {
            f.text(keyword + " {");
            if (!statements.isEmpty()) {
                f.indent(() -> {
                    f.breakableSpace();
                    f.format(statements);
                });
            }
            f.breakableSpace();
            f.text("}");
        });
    }

    // ========================================================================
    // Control flow
    // ========================================================================

    @Override
    public Void visitBegin(Begin node) {
        f.text("begin");
        formatBodyAndEnd(node.bodystmt());
        return null;
    }

    @Override
    public Void visitBodyStmt(BodyStmt node) {
        f.format(node.statements());
        if (node.rescueClause() != null) {
            f.nest(-2, () -> {
                f.breakableForce();
                f.format(node.rescueClause());
            });
        }
        if (node.elseClause() != null) {
            f.nest(-2, () -> {
                f.breakableForce();
                f.format(node.elseKeyword());
            });
            if (!node.elseClause().isEmpty()) {
                f.breakableForce();
                f.format(node.elseClause());
            }
        }
        if (node.ensureClause() != null) {
            f.nest(-2, () -> {
                f.breakableForce();
                f.format(node.ensureClause());
            });
        }
        return null;
    }

    @Override
    public Void visitRescue(Rescue node) {
        f.text("rescue");
        if (node.exception() != null) {
            f.text(" ");
            f.format(node.exception());
        }
        if (!node.statements().isEmpty()) {
            f.indent(() -> {
                f.breakableForce();
                f.format(node.statements());
            });
        }
        if (node.consequent() != null) {
            f.breakableForce();
            f.format(node.consequent());
        }
        return null;
    }

    @Override
    public Void visitRescueEx(RescueEx node) {
        if (node.exceptions() != null) {
            f.format(node.exceptions());
            if (node.variable() != null) {
                f.text(" ");
            }
        }
        if (node.variable() != null) {
            f.text("=> ");
            f.format(node.variable());
        }
        return null;
    }

    @Override
    public Void visitRescueMod(RescueMod node) {
        f.format(node.statement());
        f.text(" rescue ");
        f.format(node.value());
        return null;
    }

    @Override
    public Void visitEnsure(Ensure node) {
        f.text("ensure");
        if (!node.statements().isEmpty()) {
            f.indent(() -> {
                f.breakableForce();
                f.format(node.statements());
            });
        }
        return null;
    }

    @Override
    public Void visitElse(Else node) {
        formatElse(node, true);
        return null;
    }

    private void formatElse(Else node, boolean force) {
        f.text("else");
        if (!node.statements().isEmpty()) {
            f.indent(() -> {
                lineBreak(force);
                f.format(node.statements());
            });
        }
    }

    @Override
    public Void visitElsif(Elsif node) {
        f.group(() -> {
            f.text("elsif ");
            f.nest(6, () -> f.format(node.predicate()));
        });
        if (!node.statements().isEmpty()) {
            f.indent(() -> {
                f.breakableForce();
                f.format(node.statements());
            });
        }
        if (node.consequent() != null) {
            f.breakableForce();
            f.format(node.consequent());
        }
        return null;
    }

    private void lineBreak(boolean force) {
        if (force) {
            f.breakableForce();
        } else {
            f.breakableSpace();
        }
    }

    /**
     * A modifier ({@code a if b}) is the only form whose statements precede its
     * predicate.
     */
    static boolean isModifier(Node predicate, Statements statements) {
        return statements.location().startChar() < predicate.location().startChar();
    }

    @Override
    public Void visitIfNode(IfNode node) {
        formatConditional("if", node.predicate(), node.statements(), node.consequent(), true);
        return null;
    }

    @Override
    public Void visitUnlessNode(UnlessNode node) {
        formatConditional("unless", node.predicate(), node.statements(), node.consequent(), false);
        return null;
    }

    private void formatConditional(String keyword, Node predicate, Statements statements, Node consequent,
                                   boolean ternaryAllowed) {
        if (isModifier(predicate, statements)) {
            formatModifier(keyword, predicate, statements);
        } else if (ternaryAllowed && ternaryable(predicate, statements, consequent)) {
            Else otherwise = (Else) consequent;
            f.group(() -> f.ifBreak(
                () -> formatBlock(keyword, predicate, statements, consequent, false),
                () -> formatTernary(predicate, single(statements), single(otherwise.statements()))));
        } else {
            formatBlock(keyword, predicate, statements, consequent, true);
        }
    }

    private void formatBlock(String keyword, Node predicate, Statements statements, Node consequent,
                             boolean force) {
        f.text(keyword + " ");
        f.nest(keyword.length() + 1, () -> f.format(predicate));
        if (!statements.isEmpty()) {
            f.indent(() -> {
                lineBreak(force);
                f.format(statements);
            });
        }
        if (consequent != null) {
            lineBreak(force);
            if (!force && consequent instanceof Else otherwise) {
                f.formatWith(otherwise, () -> formatElse(otherwise, false));
            } else {
                f.format(consequent);
            }
        }
        lineBreak(force);
        f.text("end");
    }

    /**
     * Modifiers stay modifiers while they fit and become blocks otherwise. A
     * {@code begin} loop body keeps its modifier, since the block form would no
     * longer run it before the first check.
     */
    private void formatModifier(String keyword, Node predicate, Statements statements) {
        Node statement = single(statements);
        if (statement instanceof Begin) {
            formatModifierFlat(keyword, predicate, statements);
            return;
        }
        f.group(() -> f.ifBreak(
            () -> formatBlock(keyword, predicate, statements, null, false),
            () -> formatModifierFlat(keyword, predicate, statements)));
    }

    private void formatModifierFlat(String keyword, Node predicate, Statements statements) {
        f.format(statements);
        f.text(" " + keyword + " ");
        f.format(predicate);
    }

    private static Node single(Statements statements) {
        Node found = null;
        for (Node node : statements.body()) {
            if (node instanceof VoidStmt) {
                continue;
            }
            if (found != null || node instanceof Comment) {
                return null;
            }
            found = node;
        }
        return found;
    }

    private boolean ternaryable(Node predicate, Statements statements, Node consequent) {
        if (f.options().disableAutoTernary() || !(consequent instanceof Else otherwise)) {
            return false;
        }
        Node truthy = single(statements);
        Node falsy = single(otherwise.statements());
        return truthy != null && falsy != null
            && otherwise.comments().isEmpty() && statements.comments().isEmpty()
            && otherwise.statements().comments().isEmpty()
            && isSimple(predicate) && isSimple(truthy) && isSimple(falsy);
    }

    /**
     * Expressions that read the same inside a ternary as on their own line.
     */
    private static boolean isSimple(Node node) {
        if (hasComments(node)) {
            return false;
        }
        if (node instanceof Binary binary) {
            String operator = binary.operator();
            return !operator.equals("and") && !operator.equals("or")
                && isSimple(binary.left()) && isSimple(binary.right());
        }
        if (node instanceof StringLiteral string) {
            return string.location().startLine() == string.location().endLine();
        }
        return node instanceof VarRef || node instanceof VCall || node instanceof CallNode
            || node instanceof ARef || node instanceof Int || node instanceof FloatLiteral
            || node instanceof RationalLiteral || node instanceof Imaginary || node instanceof SymbolLiteral
            || node instanceof ConstPathRef || node instanceof TopConstRef || node instanceof Paren
            || node instanceof Unary;
    }

    private static boolean hasComments(Node node) {
        if (!node.comments().isEmpty()) {
            return true;
        }
        for (Node child : node.childNodes()) {
            if (child instanceof Comment || hasComments(child)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Void visitWhileNode(WhileNode node) {
        formatLoop("while", node.predicate(), node.statements());
        return null;
    }

    @Override
    public Void visitUntilNode(UntilNode node) {
        formatLoop("until", node.predicate(), node.statements());
        return null;
    }

    private void formatLoop(String keyword, Node predicate, Statements statements) {
        if (isModifier(predicate, statements)) {
            formatModifier(keyword, predicate, statements);
        } else {
            formatBlock(keyword, predicate, statements, null, true);
        }
    }

    @Override
    public Void visitFor(For node) {
        f.group(() -> {
            f.text("for ");
            f.format(node.index());
            f.text(" in ");
            f.format(node.collection());
        });
        if (!node.statements().isEmpty()) {
            f.indent(() -> {
                f.breakableForce();
                f.format(node.statements());
            });
        }
        f.breakableForce();
        f.text("end");
        return null;
    }

    @Override
    public Void visitCase(Case node) {
        f.text("case");
        if (node.value() != null) {
            f.text(" ");
            f.format(node.value());
        }
        f.breakableForce();
        f.format(node.consequent());
        f.breakableForce();
        f.text("end");
        return null;
    }

    @Override
    public Void visitWhen(When node) {
        f.group(() -> {
            f.text("when ");
            f.nest(5, () -> f.format(node.arguments()));
        });
        formatClauseTail(node.statements(), node.consequent());
        return null;
    }

    @Override
    public Void visitIn(In node) {
        f.text("in ");
        Node pattern = node.pattern();
        if (pattern instanceof IfNode guard && isModifier(guard.predicate(), guard.statements())) {
            f.formatWith(guard, () -> formatModifierFlat("if", guard.predicate(), guard.statements()));
        } else if (pattern instanceof UnlessNode guard && isModifier(guard.predicate(), guard.statements())) {
            f.formatWith(guard, () -> formatModifierFlat("unless", guard.predicate(), guard.statements()));
        } else {
            f.format(pattern);
        }
        formatClauseTail(node.statements(), node.consequent());
        return null;
    }

    private void formatClauseTail(Statements statements, Node consequent) {
        if (!statements.isEmpty()) {
            f.indent(() -> {
                f.breakableForce();
                f.format(statements);
            });
        }
        if (consequent != null) {
            f.breakableForce();
            f.format(consequent);
        }
    }

    // ========================================================================
    // Patterns
    // ========================================================================

    @Override
    public Void visitAryPtn(AryPtn node) {
        List<Runnable> parts = new ArrayList<>();
        for (Node required : node.requireds()) {
            parts.add(() -> f.format(required));
        }
        if (node.rest() != null) {
            parts.add(() -> formatSplat("*", node.rest()));
        }
        for (Node post : node.posts()) {
            parts.add(() -> f.format(post));
        }
        f.format(node.constant());
        formatPatternList("[", "]", parts);
        return null;
    }

    @Override
    public Void visitFndPtn(FndPtn node) {
        List<Runnable> parts = new ArrayList<>();
        parts.add(() -> formatSplat("*", node.left()));
        for (Node value : node.values()) {
            parts.add(() -> f.format(value));
        }
        parts.add(() -> formatSplat("*", node.right()));
        f.format(node.constant());
        formatPatternList("[", "]", parts);
        return null;
    }

    @Override
    public Void visitHshPtn(HshPtn node) {
        List<Runnable> parts = new ArrayList<>();
        for (HshPtn.Entry entry : node.keys()) {
            parts.add(() -> {
                f.format(entry.key());
                if (entry.value() != null) {
                    f.text(" ");
                    f.format(entry.value());
                }
            });
        }
        if (node.keywordRest() != null) {
            parts.add(() -> formatSplat("**", node.keywordRest()));
        }
        if (node.constant() != null) {
            f.format(node.constant());
            formatPatternList("(", ")", parts);
        } else if (parts.isEmpty()) {
            f.text("{}");
        } else {
            f.group(() -> {
                f.text("{");
                f.indent(() -> {
                    f.breakableSpace();
                    f.seplist(parts, f::commaBreakable, Runnable::run);
                });
                f.breakableSpace();
                f.text("}");
            });
        }
        return null;
    }

    private void formatSplat(String operator, Node field) {
        f.formatWith(field, () -> {
            f.text(operator);
            if (field instanceof VarField varField) {
                f.format(varField.value());
            }
        });
    }

    private void formatPatternList(String open, String close, List<Runnable> parts) {
        f.group(() -> {
            f.text(open);
            if (!parts.isEmpty()) {
                f.indent(() -> {
                    f.breakableEmpty();
                    f.seplist(parts, f::commaBreakable, Runnable::run);
                });
                f.breakableEmpty();
            }
            f.text(close);
        });
    }

    // ========================================================================
    // Jumps and yields
    // ========================================================================

    @Override
    public Void visitReturnNode(ReturnNode node) {
        formatJump("return", node.arguments());
        return null;
    }

    @Override
    public Void visitBreak(Break node) {
        formatJump("break", node.arguments());
        return null;
    }

    @Override
    public Void visitNext(Next node) {
        formatJump("next", node.arguments());
        return null;
    }

    private void formatJump(String keyword, Args arguments) {
        f.group(() -> {
            f.text(keyword);
            if (arguments != null && !arguments.parts().isEmpty()) {
                f.text(" ");
                f.nest(keyword.length() + 1, () -> f.format(arguments));
            }
        });
    }

    @Override
    public Void visitRedo(Redo node) {
        f.text("redo");
        return null;
    }

    @Override
    public Void visitRetry(Retry node) {
        f.text("retry");
        return null;
    }

    @Override
    public Void visitYieldNode(YieldNode node) {
        f.text("yield");
        formatKeywordArguments(node.arguments());
        return null;
    }

    @Override
    public Void visitSuper(Super node) {
        f.text("super");
        formatKeywordArguments(node.arguments());
        return null;
    }

    private void formatKeywordArguments(Node arguments) {
        if (arguments instanceof Args) {
            f.text(" ");
            f.group(() -> f.nest(6, () -> f.format(arguments)));
        } else {
            f.format(arguments);
        }
    }

    @Override
    public Void visitZSuper(ZSuper node) {
        f.text("super");
        return null;
    }
}
