package com.rbparser;

import com.rbparser.ast.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds nodes as the grammar reduces productions. Keywords, operators and
 * delimiters that a node owns are looked up in the {@link TokenLedger}; since
 * productions finish bottom-up, the owner of a token is the last unclaimed match.
 *
 * <p>The grammar must call a production's method right after it consumed the
 * production's closing token and before it looks further ahead.
 */
public final class TreeBuilder {

    private final ParserState state;
    private final TokenLedger ledger;
    private final LineIndex lineIndex;

    public TreeBuilder(ParserState state) {
        this.state = state;
        this.ledger = state.ledger();
        this.lineIndex = state.lineIndex();
    }

    // ========================================================================
    // Scanner events
    // ========================================================================

    /**
     * Receives every lexed token. Comments, embedded documents and the
     * {@code __END__} section are kept aside; the return value tells whether the
     * grammar should see the token.
     */
    public boolean onToken(Token token) {
        Location location = locationOf(token);
        state.position(location);
        switch (token.type()) {
            case COMMENT, EMBDOC -> {
                state.pendingComments().add(new Comment(token.value(), inline(location), location));
                return false;
            }
            case END_CONTENT -> {
                state.endContent(new EndContent(token.value(), location));
                return false;
            }
            case HEREDOC_BEG -> {
                state.pushHeredoc(new HeredocBeg(token.value(), location));
                return true;
            }
            case HEREDOC_END -> {
                state.endHeredoc(new HeredocEnd(token.value(), location));
                return true;
            }
            default -> {
                if (recorded(token.type())) {
                    ledger.record(new Lexeme(token.type().ledgerType(), token.value(), location));
                }
                return true;
            }
        }
    }

    private static boolean recorded(TokenType type) {
        if (type.isLeaf()) {
            return false;
        }
        return switch (type) {
            case COMMA, SEMICOLON, NEWLINE, WORDS_SEP, EOF -> false;
            default -> true;
        };
    }

    private boolean inline(Location location) {
        String source = state.source();
        for (int i = lineIndex.lineStart(location.startLine()); i < location.startChar(); i++) {
            char c = source.charAt(i);
            if (c != ' ' && c != '\t' && c != '\r' && c != '\f') {
                return true;
            }
        }
        return false;
    }

    public Location locationOf(Token token) {
        int start = lineIndex.charOffset(token.line(), token.column());
        String value = token.value();
        int newlines = 0;
        for (int i = 0; i < value.length(); i++) {
            if (value.charAt(i) == '\n') {
                newlines++;
            }
        }
        return new Location(token.line(), start, token.line() + newlines, start + value.length());
    }

    /**
     * A zero-width location right after a token.
     */
    public Location endOf(Token token) {
        Location location = locationOf(token);
        return Location.fixed(location.endLine(), location.endChar());
    }

    private Lexeme take(Token token) {
        return ledger.consumeAt(token.type().ledgerType(), locationOf(token).startChar());
    }

    private Lexeme keyword(String value) {
        return ledger.consume(TokenType.KEYWORD, value);
    }

    private static Kw kw(Lexeme lexeme) {
        return new Kw(lexeme.value(), lexeme.location());
    }

    private static Location span(Node first, Node last) {
        return first.location().to(last.location());
    }

    private int nextStatementStart(int charOffset) {
        return state.nextStatementStart(charOffset);
    }

    // ========================================================================
    // Leaves
    // ========================================================================

    public Node leaf(Token token) {
        Location location = locationOf(token);
        String value = token.value();
        return switch (token.type()) {
            case IDENTIFIER -> new Ident(value, location);
            case CONSTANT -> new Const(value, location);
            case IVAR -> new IVar(value, location);
            case CVAR -> new CVar(value, location);
            case GVAR -> new GVar(value, location);
            case BACKREF -> new Backref(value, location);
            case INTEGER -> new Int(value, location);
            case FLOAT -> new FloatLiteral(value, location);
            case RATIONAL -> new RationalLiteral(value, location);
            case IMAGINARY -> new Imaginary(value, location);
            case CHAR -> new CharLiteral(value, location);
            case LABEL -> new Label(value, location);
            case TSTRING_CONTENT -> new TStringContent(value, location);
            case KEYWORD -> keyword(token);
            case OP, STAR, DSTAR, AMPER, UMINUS, UPLUS -> operator(token);
            case PERIOD, COLON2, COLON3 -> period(token);
            case BACKTICK -> {
                take(token);
                yield new Backtick(value, location);
            }
            default -> throw new IllegalArgumentException("Not a leaf token: " + token);
        };
    }

    public Ident ident(Token token) {
        return new Ident(token.value(), locationOf(token));
    }

    public Kw keyword(Token token) {
        return kw(take(token));
    }

    public Op operator(Token token) {
        Lexeme lexeme = take(token);
        return new Op(lexeme.value(), lexeme.location());
    }

    public Period period(Token token) {
        Lexeme lexeme = take(token);
        return new Period(lexeme.value(), lexeme.location());
    }

    public ExcessedComma onExcessedComma(Token comma) {
        return new ExcessedComma(comma.value(), locationOf(comma));
    }

    public VoidStmt onVoidStmt(Location location) {
        return new VoidStmt(location);
    }

    // ========================================================================
    // Program and statements
    // ========================================================================

    public Program onProgram(Statements statements) {
        String source = state.source();
        Statements bound = statements.bind(state, 0, source.length());
        EndContent endContent = state.endContent();
        if (endContent != null) {
            List<Node> body = new ArrayList<>(bound.body());
            body.add(endContent);
            bound = new Statements(body, bound.location(), bound.comments());
        }
        return new Program(bound, state.range(0, source.length()));
    }

    /**
     * Attaches the comments that no statement list claimed.
     */
    public void attachComments(Program program) {
        List<Comment> remaining = new ArrayList<>(state.pendingComments());
        state.pendingComments().clear();
        new CommentAttacher(program).attach(remaining);
    }

    public Statements onStatements(List<Node> body) {
        Location location = body.get(0).location();
        for (int i = 1; i < body.size(); i++) {
            location = location.to(body.get(i).location());
        }
        return new Statements(body, location);
    }

    private Statements single(Node statement) {
        return new Statements(new ArrayList<>(List.of(statement)), statement.location());
    }

    // ========================================================================
    // Variables and constants
    // ========================================================================

    public VarRef onVarRef(Node value) {
        return new VarRef(value, value.location());
    }

    public VCall onVCall(Ident value) {
        return new VCall(value, value.location());
    }

    public VarField onVarField(Node value) {
        return new VarField(value, value.location());
    }

    /**
     * A splat binding in a pattern; the location includes the operator.
     */
    public VarField onSplatField(Token operator, Node value) {
        Lexeme op = take(operator);
        return new VarField(value, value == null ? op.location() : op.location().to(value.location()));
    }

    public PinnedVarRef onPinnedVarRef(Token caret, Node value) {
        Lexeme op = take(caret);
        return new PinnedVarRef(value, op.location().to(value.location()));
    }

    public PinnedBegin onPinnedBegin(Token caret, Node statement) {
        Lexeme rparen = ledger.consume(TokenType.RPAREN, null);
        ledger.consume(TokenType.LPAREN, null);
        Lexeme op = take(caret);
        return new PinnedBegin(statement, op.location().to(rparen.location()));
    }

    public ConstRef onConstRef(Const constant) {
        return new ConstRef(constant, constant.location());
    }

    public ConstPathRef onConstPathRef(Node parent, Const constant, Token colons) {
        take(colons);
        return new ConstPathRef(parent, constant, span(parent, constant));
    }

    public TopConstRef onTopConstRef(Token colons, Const constant) {
        Lexeme op = take(colons);
        return new TopConstRef(constant, op.location().to(constant.location()));
    }

    public ConstPathField onConstPathField(ConstPathRef ref) {
        return new ConstPathField(ref.parent(), ref.constant(), ref.location());
    }

    public TopConstField onTopConstField(TopConstRef ref) {
        return new TopConstField(ref.constant(), ref.location());
    }

    public Field onField(Node parent, Node operator, Node name) {
        return new Field(parent, operator, name, span(parent, name));
    }

    public ARefField onARefField(ARef ref) {
        return new ARefField(ref.collection(), ref.index(), ref.location());
    }

    // ========================================================================
    // Assignment
    // ========================================================================

    public Assign onAssign(Node target, Node value) {
        ledger.consumeBetween(TokenType.OP, "=", target.location().endChar(), value.location().startChar());
        return new Assign(target, value, span(target, value));
    }

    public OpAssign onOpAssign(Node target, Op operator, Node value) {
        return new OpAssign(target, operator, value, span(target, value));
    }

    public MAssign onMAssign(MLHS target, Node value) {
        ledger.consumeBetween(TokenType.OP, "=", target.location().endChar(), value.location().startChar());
        return new MAssign(target, value, span(target, value));
    }

    public MLHS onMLHS(List<Node> parts, boolean comma, Token trailingComma) {
        Location location = span(parts.get(0), parts.get(parts.size() - 1));
        if (trailingComma != null) {
            location = location.to(locationOf(trailingComma));
        }
        return new MLHS(parts, comma, location);
    }

    public MLHSParen onMLHSParen(Node contents) {
        Lexeme rparen = ledger.consume(TokenType.RPAREN, null);
        Lexeme lparen = ledger.consume(TokenType.LPAREN, null);
        return new MLHSParen(contents, false, lparen.location().to(rparen.location()));
    }

    public MRHS onMRHS(List<Node> parts) {
        return new MRHS(parts, span(parts.get(0), parts.get(parts.size() - 1)));
    }

    // ========================================================================
    // Arguments
    // ========================================================================

    public ArgParen onArgParen(Node arguments) {
        Lexeme rparen = ledger.consume(TokenType.RPAREN, null);
        Lexeme lparen = ledger.consume(TokenType.LPAREN, null);
        return new ArgParen(arguments, lparen.location().to(rparen.location()));
    }

    public Args onArgs(List<Node> parts, Location empty) {
        if (parts.isEmpty()) {
            return new Args(parts, empty);
        }
        return new Args(parts, span(parts.get(0), parts.get(parts.size() - 1)));
    }

    public ArgBlock onArgBlock(Token amper, Node value) {
        Lexeme op = take(amper);
        return new ArgBlock(value, value == null ? op.location() : op.location().to(value.location()));
    }

    public ArgStar onArgStar(Token star, Node value) {
        Lexeme op = take(star);
        return new ArgStar(value, value == null ? op.location() : op.location().to(value.location()));
    }

    public AssocSplat onAssocSplat(Token dstar, Node value) {
        Lexeme op = take(dstar);
        return new AssocSplat(value, value == null ? op.location() : op.location().to(value.location()));
    }

    public ArgsForward onArgsForward(Token dots) {
        return new ArgsForward(take(dots).location());
    }

    public BareAssocHash onBareAssocHash(List<Node> assocs) {
        return new BareAssocHash(assocs, span(assocs.get(0), assocs.get(assocs.size() - 1)));
    }

    public Assoc onAssoc(Node key, Node value) {
        if (value == null) {
            return new Assoc(key, null, key.location());
        }
        ledger.consumeBetween(TokenType.OP, "=>", key.location().endChar(), value.location().startChar());
        return new Assoc(key, value, span(key, value));
    }

    // ========================================================================
    // Literals
    // ========================================================================

    public ArrayLiteral onArray(Args contents) {
        Lexeme rbracket = ledger.consume(TokenType.RBRACKET, null);
        Lexeme lbracket = ledger.consume(TokenType.LBRACKET, null);
        return new ArrayLiteral(
            new LBracket(lbracket.value(), lbracket.location()),
            contents,
            lbracket.location().to(rbracket.location()));
    }

    public HashLiteral onHash(List<Node> assocs) {
        Lexeme rbrace = ledger.consume(TokenType.RBRACE, null);
        Lexeme lbrace = ledger.consume(TokenType.LBRACE, null);
        return new HashLiteral(
            new LBrace(lbrace.value(), lbrace.location()),
            assocs,
            lbrace.location().to(rbrace.location()));
    }

    public QWords onQWords(List<TStringContent> elements) {
        Lexeme end = ledger.consume(TokenType.TSTRING_END, null);
        Lexeme beg = ledger.consume(TokenType.QWORDS_BEG, null);
        return new QWords(beg.value(), elements, beg.location().to(end.location()));
    }

    public QSymbols onQSymbols(List<TStringContent> elements) {
        Lexeme end = ledger.consume(TokenType.TSTRING_END, null);
        Lexeme beg = ledger.consume(TokenType.QSYMBOLS_BEG, null);
        return new QSymbols(beg.value(), elements, beg.location().to(end.location()));
    }

    public Words onWords(List<Word> elements) {
        Lexeme end = ledger.consume(TokenType.TSTRING_END, null);
        Lexeme beg = ledger.consume(TokenType.WORDS_BEG, null);
        return new Words(beg.value(), elements, beg.location().to(end.location()));
    }

    public Symbols onSymbols(List<Word> elements) {
        Lexeme end = ledger.consume(TokenType.TSTRING_END, null);
        Lexeme beg = ledger.consume(TokenType.SYMBOLS_BEG, null);
        return new Symbols(beg.value(), elements, beg.location().to(end.location()));
    }

    public Word onWord(List<Node> parts) {
        return new Word(parts, span(parts.get(0), parts.get(parts.size() - 1)));
    }

    /**
     * A quoted string, or the heredoc on top of the stack when its terminator has
     * been reached.
     */
    public Node onStringLiteral(List<Node> parts) {
        ParserState.HeredocFrame frame = state.heredocs().peek();
        if (frame != null && frame.ending() != null) {
            return heredoc(parts);
        }
        Lexeme end = ledger.consume(TokenType.TSTRING_END, null);
        Lexeme beg = ledger.consume(TokenType.TSTRING_BEG, null);
        return new StringLiteral(parts, beg.value(), beg.location().to(end.location()));
    }

    public Node onXStringLiteral(List<Node> parts) {
        ParserState.HeredocFrame frame = state.heredocs().peek();
        if (frame != null && frame.ending() != null) {
            return heredoc(parts);
        }
        Lexeme end = ledger.consume(TokenType.TSTRING_END, null);
        Lexeme beg = ledger.consume(TokenType.XSTRING_BEG, null);
        return new XStringLiteral(parts, beg.location().to(end.location()));
    }

    private Heredoc heredoc(List<Node> parts) {
        ParserState.HeredocFrame frame = state.heredocs().pop();
        HeredocBeg beginning = frame.beginning();
        int dedent = beginning.value().startsWith("<<~") ? dedent(parts) : 0;
        return new Heredoc(beginning, frame.ending(), dedent, parts, beginning.location());
    }

    /**
     * The common indentation of a squiggly heredoc body. Blank lines do not
     * count; a line opening with an interpolation has no indentation.
     */
    private int dedent(List<Node> parts) {
        int dedent = Integer.MAX_VALUE;
        for (Node part : parts) {
            Location location = part.location();
            if (location.startChar() != lineIndex.lineStart(location.startLine())) {
                continue;
            }
            if (!(part instanceof TStringContent content)) {
                return 0;
            }
            String value = content.value();
            int width = 0;
            int index = 0;
            while (index < value.length() && (value.charAt(index) == ' ' || value.charAt(index) == '\t')) {
                width = value.charAt(index) == '\t' ? (width / 8 + 1) * 8 : width + 1;
                index++;
            }
            boolean blank = index == value.length() || value.charAt(index) == '\n' || value.charAt(index) == '\r';
            if (!blank) {
                dedent = Math.min(dedent, width);
            }
        }
        return dedent == Integer.MAX_VALUE ? 0 : dedent;
    }

    /**
     * {@code "key": value} inside a hash or argument list.
     */
    public DynaSymbol onLabelSymbol(List<Node> parts) {
        Lexeme end = ledger.consume(TokenType.LABEL_END, null);
        Lexeme beg = ledger.consume(TokenType.TSTRING_BEG, null);
        return new DynaSymbol(parts, beg.value(), beg.location().to(end.location()));
    }

    public DynaSymbol onDynaSymbol(List<Node> parts) {
        Lexeme end = ledger.consume(TokenType.TSTRING_END, null);
        Lexeme beg = ledger.consume(TokenType.SYMBEG, null);
        return new DynaSymbol(parts, beg.value(), beg.location().to(end.location()));
    }

    public StringConcat onStringConcat(Node left, Node right) {
        return new StringConcat(left, right, span(left, right));
    }

    public StringEmbExpr onStringEmbExpr(Statements statements) {
        Lexeme end = ledger.consume(TokenType.EMBEXPR_END, null);
        Lexeme beg = ledger.consume(TokenType.EMBEXPR_BEG, null);
        Statements bound = statements.bind(state, beg.location().endChar(), end.location().startChar());
        return new StringEmbExpr(bound, beg.location().to(end.location()));
    }

    public StringDVar onStringDVar(Node variable) {
        Lexeme embvar = ledger.consume(TokenType.EMBVAR, null);
        return new StringDVar(variable, embvar.location().to(variable.location()));
    }

    public SymbolLiteral onSymbol(Token colon, Node value) {
        Lexeme symbeg = take(colon);
        return new SymbolLiteral(value, symbeg.location().to(value.location()));
    }

    /**
     * A method name without a colon, as in {@code alias foo bar}.
     */
    public SymbolLiteral onBareSymbol(Node value) {
        return new SymbolLiteral(value, value.location());
    }

    public RegexpLiteral onRegexp(List<Node> parts) {
        Lexeme end = ledger.consume(TokenType.REGEXP_END, null);
        Lexeme beg = ledger.consume(TokenType.REGEXP_BEG, null);
        return new RegexpLiteral(beg.value(), end.value(), parts, beg.location().to(end.location()));
    }

    // ========================================================================
    // Operators
    // ========================================================================

    public RangeNode onRange(Node left, Op operator, Node right) {
        Location start = left != null ? left.location() : operator.location();
        Location end = right != null ? right.location() : operator.location();
        return new RangeNode(left, operator, right, start.to(end));
    }

    public Binary onBinary(Node left, String operator, Node right) {
        TokenType type = "and".equals(operator) || "or".equals(operator) ? TokenType.KEYWORD : TokenType.OP;
        ledger.consumeBetween(type, operator, left.location().endChar(), right.location().startChar());
        return new Binary(left, operator, right, span(left, right));
    }

    public Unary onUnary(Token operator, Node statement) {
        Lexeme op = take(operator);
        String value = op.value();
        return new Unary(value, statement, op.location().to(statement.location()));
    }

    public Not onNot(Token not, Node statement, boolean parentheses) {
        Lexeme kw = take(not);
        if (parentheses) {
            Lexeme rparen = ledger.consume(TokenType.RPAREN, null);
            ledger.consume(TokenType.LPAREN, null);
            return new Not(statement, true, kw.location().to(rparen.location()));
        }
        return new Not(statement, false, kw.location().to(statement.location()));
    }

    public Defined onDefined(Token keyword, Node value, boolean parentheses) {
        Lexeme kw = take(keyword);
        if (parentheses) {
            Lexeme rparen = ledger.consume(TokenType.RPAREN, null);
            ledger.consume(TokenType.LPAREN, null);
            return new Defined(value, kw.location().to(rparen.location()));
        }
        return new Defined(value, kw.location().to(value.location()));
    }

    public IfOp onIfOp(Node predicate, Node truthy, Node falsy) {
        ledger.consumeBetween(TokenType.OP, ":", truthy.location().endChar(), falsy.location().startChar());
        ledger.consumeBetween(TokenType.OP, "?", predicate.location().endChar(), truthy.location().startChar());
        return new IfOp(predicate, truthy, falsy, span(predicate, falsy));
    }

    public Paren onParen(Node contents) {
        Lexeme rparen = ledger.consume(TokenType.RPAREN, null);
        Lexeme lparen = ledger.consume(TokenType.LPAREN, null);
        Node bound = contents instanceof Statements statements
            ? statements.bind(state, lparen.location().endChar(), rparen.location().startChar())
            : contents;
        return new Paren(new LParen(lparen.value(), lparen.location()), bound, lparen.location().to(rparen.location()));
    }

    // ========================================================================
    // Calls
    // ========================================================================

    public CallNode onCall(Node receiver, Node operator, Node message, ArgParen arguments) {
        Node first = receiver != null ? receiver : message;
        Node last = arguments != null ? arguments : message != null ? message : operator;
        return new CallNode(receiver, operator, message, arguments, span(first, last));
    }

    public ARef onARef(Node collection, Args index) {
        Lexeme rbracket = ledger.consume(TokenType.RBRACKET, null);
        ledger.consume(TokenType.LBRACKET, null);
        return new ARef(collection, index, collection.location().to(rbracket.location()));
    }

    public Command onCommand(Node message, Args arguments, BlockNode block) {
        return new Command(message, arguments, block, span(message, block != null ? block : arguments));
    }

    public CommandCall onCommandCall(Node receiver, Node operator, Node message, Args arguments, BlockNode block) {
        Node last = block != null ? block : arguments;
        return new CommandCall(receiver, operator, message, arguments, block, span(receiver, last));
    }

    public MethodAddBlock onMethodAddBlock(Node call, BlockNode block) {
        return new MethodAddBlock(call, block, span(call, block));
    }

    public BlockNode onBraceBlock(BlockVar blockVar, Statements statements) {
        Lexeme rbrace = ledger.consume(TokenType.RBRACE, null);
        Lexeme lbrace = ledger.consume(TokenType.LBRACE, null);
        int start = blockVar != null ? blockVar.location().endChar() : lbrace.location().endChar();
        Statements bound = statements.bind(state, nextStatementStart(start), rbrace.location().startChar());
        return new BlockNode(
            new LBrace(lbrace.value(), lbrace.location()), blockVar, bound, lbrace.location().to(rbrace.location()));
    }

    public BlockNode onDoBlock(BlockVar blockVar, BodyStmt bodystmt) {
        Lexeme end = keyword("end");
        Lexeme doKeyword = keyword("do");
        int start = blockVar != null ? blockVar.location().endChar() : doKeyword.location().endChar();
        BodyStmt bound = bodystmt.bind(state, nextStatementStart(start), end.location().startChar());
        return new BlockNode(kw(doKeyword), blockVar, bound, doKeyword.location().to(end.location()));
    }

    public BlockVar onBlockVar(Params params, List<Ident> locals) {
        Lexeme closing = ledger.consume(TokenType.OP, null);
        if (closing.value().equals("||")) {
            return new BlockVar(params, locals, closing.location());
        }
        Lexeme opening = ledger.consume(TokenType.OP, "|");
        return new BlockVar(params, locals, opening.location().to(closing.location()));
    }

    public Params onParams(
        List<Node> requireds,
        List<Params.OptionalParam> optionals,
        Node rest,
        List<Node> posts,
        List<Params.KeywordParam> keywords,
        Node keywordRest,
        BlockArg block,
        Location empty
    ) {
        List<Node> parts = Nodes.of(requireds, optionals, rest, posts, keywords, keywordRest, block);
        Location location = empty;
        if (!parts.isEmpty()) {
            Location first = parts.get(0).location();
            Location last = parts.get(parts.size() - 1).location();
            for (Node part : parts) {
                if (part.location().startChar() < first.startChar()) {
                    first = part.location();
                }
                if (part.location().endChar() > last.endChar()) {
                    last = part.location();
                }
            }
            location = first.to(last);
        }
        for (Params.OptionalParam optional : optionals) {
            ledger.consumeBetween(TokenType.OP, "=",
                optional.name().location().endChar(), optional.value().location().startChar());
        }
        return new Params(requireds, optionals, rest, posts, keywords, keywordRest, block, location);
    }

    /**
     * Parameters in parentheses, as in {@code def foo(a, b)}.
     */
    public Paren onParenParams(Node params) {
        Lexeme rparen = ledger.consume(TokenType.RPAREN, null);
        Lexeme lparen = ledger.consume(TokenType.LPAREN, null);
        return new Paren(new LParen(lparen.value(), lparen.location()), params, lparen.location().to(rparen.location()));
    }

    public RestParam onRestParam(Token star, Ident name) {
        Lexeme op = take(star);
        return new RestParam(name, name == null ? op.location() : op.location().to(name.location()));
    }

    public KwRestParam onKwRestParam(Token dstar, Node name) {
        Lexeme op = take(dstar);
        return new KwRestParam(name, name == null ? op.location() : op.location().to(name.location()));
    }

    public BlockArg onBlockArg(Token amper, Ident name) {
        Lexeme op = take(amper);
        return new BlockArg(name, name == null ? op.location() : op.location().to(name.location()));
    }

    public LambdaVar onLambdaVar(Params params, List<Ident> locals) {
        Location location = params.location();
        if (!locals.isEmpty()) {
            location = location.to(locals.get(locals.size() - 1).location());
        }
        return new LambdaVar(params, locals, location);
    }

    public Lambda onLambda(Node params, Node body, boolean braces) {
        Node bound;
        Lexeme closing;
        if (braces) {
            closing = ledger.consume(TokenType.RBRACE, null);
            Lexeme opening = ledger.consume(TokenType.TLAMBEG, null);
            bound = ((Statements) body).bind(
                state, nextStatementStart(opening.location().endChar()), closing.location().startChar());
        } else {
            closing = keyword("end");
            Lexeme opening = keyword("do");
            bound = ((BodyStmt) body).bind(
                state, nextStatementStart(opening.location().endChar()), closing.location().startChar());
        }
        Lexeme arrow = ledger.consume(TokenType.TLAMBDA, null);
        return new Lambda(params, bound, arrow.location().to(closing.location()));
    }

    // ========================================================================
    // Definitions
    // ========================================================================

    public DefNode onDef(Node target, Node operator, Node name, Node params, Node body) {
        Lexeme def = keyword("def");
        Node header = params != null && !(params instanceof Params p && p.isEmpty()) ? params : name;
        if (body instanceof BodyStmt bodystmt) {
            Lexeme end = keyword("end");
            BodyStmt bound = bodystmt.bind(
                state, nextStatementStart(header.location().endChar()), end.location().startChar());
            return new DefNode(target, operator, name, params, bound, def.location().to(end.location()));
        }
        ledger.consumeBetween(TokenType.OP, "=", header.location().endChar(), body.location().startChar());
        return new DefNode(target, operator, name, params, body, def.location().to(body.location()));
    }

    public ClassDeclaration onClass(Node constant, Node superclass, BodyStmt bodystmt) {
        Lexeme end = keyword("end");
        if (superclass != null) {
            ledger.consumeBetween(TokenType.OP, "<", constant.location().endChar(), superclass.location().startChar());
        }
        Lexeme kw = keyword("class");
        Node header = superclass != null ? superclass : constant;
        BodyStmt bound = bodystmt.bind(
            state, nextStatementStart(header.location().endChar()), end.location().startChar());
        return new ClassDeclaration(constant, superclass, bound, kw.location().to(end.location()));
    }

    public ModuleDeclaration onModule(Node constant, BodyStmt bodystmt) {
        Lexeme end = keyword("end");
        Lexeme kw = keyword("module");
        BodyStmt bound = bodystmt.bind(
            state, nextStatementStart(constant.location().endChar()), end.location().startChar());
        return new ModuleDeclaration(constant, bound, kw.location().to(end.location()));
    }

    public SClass onSClass(Node target, BodyStmt bodystmt) {
        Lexeme end = keyword("end");
        ledger.consume(TokenType.OP, "<<");
        Lexeme kw = keyword("class");
        BodyStmt bound = bodystmt.bind(
            state, nextStatementStart(target.location().endChar()), end.location().startChar());
        return new SClass(target, bound, kw.location().to(end.location()));
    }

    public AliasNode onAlias(Node left, Node right) {
        Lexeme kw = keyword("alias");
        return new AliasNode(left, right, kw.location().to(right.location()));
    }

    public Undef onUndef(List<Node> symbols) {
        Lexeme kw = keyword("undef");
        return new Undef(symbols, kw.location().to(symbols.get(symbols.size() - 1).location()));
    }

    public BEGINBlock onBEGIN(Statements statements) {
        Lexeme rbrace = ledger.consume(TokenType.RBRACE, null);
        Lexeme lbrace = ledger.consume(TokenType.LBRACE, null);
        Lexeme kw = keyword("BEGIN");
        Statements bound = statements.bind(
            state, nextStatementStart(lbrace.location().endChar()), rbrace.location().startChar());
        return new BEGINBlock(new LBrace(lbrace.value(), lbrace.location()), bound, kw.location().to(rbrace.location()));
    }

    public ENDBlock onEND(Statements statements) {
        Lexeme rbrace = ledger.consume(TokenType.RBRACE, null);
        Lexeme lbrace = ledger.consume(TokenType.LBRACE, null);
        Lexeme kw = keyword("END");
        Statements bound = statements.bind(
            state, nextStatementStart(lbrace.location().endChar()), rbrace.location().startChar());
        return new ENDBlock(new LBrace(lbrace.value(), lbrace.location()), bound, kw.location().to(rbrace.location()));
    }

    // ========================================================================
    // Control flow
    // ========================================================================

    public YieldNode onYield(Token keyword, Node arguments) {
        Lexeme kw = take(keyword);
        return new YieldNode(arguments, arguments == null ? kw.location() : kw.location().to(arguments.location()));
    }

    public Super onSuper(Token keyword, Node arguments) {
        Lexeme kw = take(keyword);
        return new Super(arguments, kw.location().to(arguments.location()));
    }

    public ZSuper onZSuper(Token keyword) {
        return new ZSuper(take(keyword).location());
    }

    public Node onJump(Token keyword, Args arguments) {
        Lexeme kw = take(keyword);
        Location location = arguments == null ? kw.location() : kw.location().to(arguments.location());
        return switch (kw.value()) {
            case "return" -> new ReturnNode(arguments, location);
            case "break" -> new Break(arguments, location);
            case "next" -> new Next(arguments, location);
            default -> throw new IllegalArgumentException("Not a jump keyword: " + kw.value());
        };
    }

    public Node onRedoOrRetry(Token keyword) {
        Lexeme kw = take(keyword);
        return kw.value().equals("redo") ? new Redo(kw.location()) : new Retry(kw.location());
    }

    public Begin onBegin(BodyStmt bodystmt) {
        Lexeme end = keyword("end");
        Lexeme kw = keyword("begin");
        BodyStmt bound = bodystmt.bind(
            state, nextStatementStart(kw.location().endChar()), end.location().startChar());
        return new Begin(bound, kw.location().to(end.location()));
    }

    public BodyStmt onBodyStmt(Statements statements, Rescue rescue, Statements elseClause, Ensure ensure) {
        Kw elseKeyword = elseClause != null ? kw(keyword("else")) : null;
        Location location = statements.location();
        for (Node node : new Node[] {rescue, elseClause, ensure}) {
            if (node != null) {
                location = location.to(node.location());
            }
        }
        return new BodyStmt(statements, rescue, elseKeyword, elseClause, ensure, location);
    }

    public RescueEx onRescueEx(Node exceptions, Node variable) {
        if (variable == null) {
            return new RescueEx(exceptions, null, exceptions.location());
        }
        if (exceptions == null) {
            Lexeme arrow = ledger.consume(TokenType.OP, "=>");
            return new RescueEx(null, variable, arrow.location().to(variable.location()));
        }
        ledger.consumeBetween(TokenType.OP, "=>", exceptions.location().endChar(), variable.location().startChar());
        return new RescueEx(exceptions, variable, span(exceptions, variable));
    }

    /**
     * One rescue clause. Clauses are built last to first so each finds its own
     * keyword as the rightmost unclaimed {@code rescue}.
     */
    public Rescue onRescue(RescueEx exception, Statements statements, Rescue consequent) {
        Lexeme kw = keyword("rescue");
        int headerEnd = exception != null ? exception.location().endChar() : kw.location().endChar();
        int end = consequent != null ? consequent.location().startChar() : statements.location().endChar();
        Lexeme then = ledger.consumeBetween(TokenType.KEYWORD, "then", headerEnd, end);
        if (then != null) {
            headerEnd = then.location().endChar();
        }
        int start = nextStatementStart(headerEnd);
        Statements bound = statements.bind(state, start, Math.max(start, end));
        Location location = consequent != null
            ? kw.location().to(consequent.location())
            : kw.location().to(bound.location());
        return new Rescue(kw(kw), exception, bound, consequent, location);
    }

    public RescueMod onRescueMod(Node statement, Node value) {
        ledger.consumeBetween(TokenType.KEYWORD, "rescue", statement.location().endChar(), value.location().startChar());
        return new RescueMod(statement, value, span(statement, value));
    }

    public Ensure onEnsure(Statements statements) {
        Lexeme kw = keyword("ensure");
        Lexeme end = ledger.find(TokenType.KEYWORD, "end");
        Statements bound = statements.bind(
            state, nextStatementStart(kw.location().endChar()), end.location().startChar());
        Location location = state.range(kw.location().startChar(), end.location().startChar());
        return new Ensure(kw(kw), bound, location);
    }

    /**
     * The else clause of a conditional or case. It claims the {@code end} keyword
     * that closes the whole construct.
     */
    public Else onElse(Statements statements) {
        Lexeme end = keyword("end");
        Lexeme kw = keyword("else");
        Statements bound = statements.bind(
            state, nextStatementStart(kw.location().endChar()), end.location().startChar());
        return new Else(kw(kw), bound, kw.location().to(end.location()));
    }

    public Elsif onElsif(Node predicate, Statements statements, Node consequent) {
        Location ending = consequent != null ? consequent.location() : keyword("end").location();
        Lexeme kw = keyword("elsif");
        Statements bound = bindClause(predicate, statements, ending);
        return new Elsif(predicate, bound, consequent, kw.location().to(ending));
    }

    public IfNode onIf(Node predicate, Statements statements, Node consequent) {
        Location ending = consequent != null ? consequent.location() : keyword("end").location();
        Lexeme kw = keyword("if");
        Statements bound = bindClause(predicate, statements, ending);
        return new IfNode(predicate, bound, consequent, kw.location().to(ending));
    }

    public UnlessNode onUnless(Node predicate, Statements statements, Node consequent) {
        Location ending = consequent != null ? consequent.location() : keyword("end").location();
        Lexeme kw = keyword("unless");
        Statements bound = bindClause(predicate, statements, ending);
        return new UnlessNode(predicate, bound, consequent, kw.location().to(ending));
    }

    private Statements bindClause(Node header, Statements statements, Location ending) {
        int headerEnd = header.location().endChar();
        Lexeme then = ledger.consumeBetween(TokenType.KEYWORD, "then", headerEnd, ending.startChar());
        if (then != null) {
            headerEnd = then.location().endChar();
        }
        return statements.bind(state, nextStatementStart(headerEnd), ending.startChar());
    }

    public IfNode onIfMod(Node predicate, Node statement) {
        modifier("if", statement, predicate);
        return new IfNode(predicate, single(statement), null, span(statement, predicate));
    }

    public UnlessNode onUnlessMod(Node predicate, Node statement) {
        modifier("unless", statement, predicate);
        return new UnlessNode(predicate, single(statement), null, span(statement, predicate));
    }

    public WhileNode onWhileMod(Node predicate, Node statement) {
        modifier("while", statement, predicate);
        return new WhileNode(predicate, single(statement), span(statement, predicate));
    }

    public UntilNode onUntilMod(Node predicate, Node statement) {
        modifier("until", statement, predicate);
        return new UntilNode(predicate, single(statement), span(statement, predicate));
    }

    private void modifier(String keyword, Node statement, Node predicate) {
        ledger.consumeBetween(TokenType.KEYWORD, keyword,
            statement.location().endChar(), predicate.location().startChar());
    }

    public WhileNode onWhile(Node predicate, Statements statements) {
        Lexeme end = keyword("end");
        Statements bound = bindLoop(predicate, statements, end);
        Lexeme kw = keyword("while");
        return new WhileNode(predicate, bound, kw.location().to(end.location()));
    }

    public UntilNode onUntil(Node predicate, Statements statements) {
        Lexeme end = keyword("end");
        Statements bound = bindLoop(predicate, statements, end);
        Lexeme kw = keyword("until");
        return new UntilNode(predicate, bound, kw.location().to(end.location()));
    }

    public For onFor(Node index, Node collection, Statements statements) {
        Lexeme end = keyword("end");
        Statements bound = bindLoop(collection, statements, end);
        ledger.consumeBetween(TokenType.KEYWORD, "in", index.location().endChar(), collection.location().startChar());
        Lexeme kw = keyword("for");
        return new For(index, collection, bound, kw.location().to(end.location()));
    }

    private Statements bindLoop(Node header, Statements statements, Lexeme end) {
        int headerEnd = header.location().endChar();
        Lexeme doKeyword = ledger.consumeBetween(TokenType.KEYWORD, "do", headerEnd, end.location().startChar());
        if (doKeyword != null) {
            headerEnd = doKeyword.location().endChar();
        }
        return statements.bind(state, nextStatementStart(headerEnd), end.location().startChar());
    }

    public Case onCase(Node value, Node consequent) {
        Lexeme kw = keyword("case");
        return new Case(kw(kw), value, consequent, kw.location().to(consequent.location()));
    }

    public When onWhen(Args arguments, Statements statements, Node consequent) {
        Location ending = consequent != null ? consequent.location() : keyword("end").location();
        Lexeme kw = keyword("when");
        Statements bound = bindClause(arguments, statements, ending);
        return new When(arguments, bound, consequent, kw.location().to(ending));
    }

    public In onIn(Node pattern, Statements statements, Node consequent) {
        Location ending = consequent != null ? consequent.location() : keyword("end").location();
        Statements bound = bindClause(pattern, statements, ending);
        Lexeme kw = keyword("in");
        return new In(pattern, bound, consequent, kw.location().to(ending));
    }

    public RAssign onRAssign(Node value, Node operator, Node pattern) {
        return new RAssign(value, operator, pattern, span(value, pattern));
    }

    // ========================================================================
    // Patterns
    // ========================================================================

    public AryPtn onAryPtn(Node constant, List<Node> requireds, VarField rest, List<Node> posts, TokenType closing) {
        Location location = patternLocation(constant, closing, Nodes.of(requireds, rest, posts));
        return new AryPtn(constant, requireds, rest, posts, location);
    }

    public FndPtn onFndPtn(Node constant, VarField left, List<Node> values, VarField right, TokenType closing) {
        Location location = patternLocation(constant, closing, Nodes.of(left, values, right));
        return new FndPtn(constant, left, values, right, location);
    }

    public HshPtn onHshPtn(Node constant, List<HshPtn.Entry> keys, Node keywordRest, TokenType closing) {
        List<Node> parts = new ArrayList<>();
        for (HshPtn.Entry entry : keys) {
            parts.add(entry.key());
            if (entry.value() != null) {
                parts.add(entry.value());
            }
        }
        if (keywordRest != null) {
            parts.add(keywordRest);
        }
        return new HshPtn(constant, keys, keywordRest, patternLocation(constant, closing, parts));
    }

    private Location patternLocation(Node constant, TokenType closing, List<Node> parts) {
        if (closing != null) {
            TokenType opening = switch (closing) {
                case RPAREN -> TokenType.LPAREN;
                case RBRACKET -> TokenType.LBRACKET;
                default -> TokenType.LBRACE;
            };
            Lexeme close = ledger.consume(closing, null);
            Lexeme open = ledger.consume(opening, null);
            return (constant != null ? constant.location() : open.location()).to(close.location());
        }
        Location location = parts.get(0).location();
        for (Node part : parts) {
            location = location.to(part.location());
        }
        return constant != null ? constant.location().to(location) : location;
    }
}
