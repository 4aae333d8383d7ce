package com.rbparser;

import com.rbparser.ast.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class Parser {
    // ========================================================================
    // Binding Power Constants for Pratt Parser
    // ========================================================================
    // Higher binding power = tighter binding (higher precedence)
    private static final int BP_NONE = 0;           // Lowest - used as minimum for top-level
    private static final int BP_ASSIGNMENT = 2;     // Assignment (=, +=, ||=, etc.) - right-associative
    private static final int BP_TERNARY = 3;        // Conditional (? :) - right-associative
    private static final int BP_RANGE = 4;          // Ranges (.., ...)
    private static final int BP_OR = 5;             // Logical OR (||)
    private static final int BP_AND = 6;            // Logical AND (&&)
    private static final int BP_EQUALITY = 8;       // <=>, ==, ===, !=, =~, !~
    private static final int BP_COMPARISON = 9;     // <, <=, >, >=
    private static final int BP_BIT_OR = 10;        // |, ^
    private static final int BP_BIT_AND = 11;       // &
    private static final int BP_SHIFT = 12;         // <<, >>
    private static final int BP_ADDITIVE = 13;      // +, -
    private static final int BP_MULTIPLICATIVE = 14;// *, /, %
    private static final int BP_UNARY_MINUS = 15;   // -x binds looser than **
    private static final int BP_EXPONENT = 16;      // ** - right-associative
    private static final int BP_UNARY = 17;         // !, ~, unary +

    private static final Set<String> STATEMENT_ENDS = Set.of(
        "end", "else", "elsif", "when", "in", "rescue", "ensure");

    private static final Set<String> ASSIGNMENT_OPERATORS = Set.of(
        "=", "+=", "-=", "*=", "/=", "%=", "**=", "&=", "|=", "^=", "<<=", ">>=", "&&=", "||=");

    private static final Set<String> VALUE_KEYWORDS = Set.of(
        "nil", "true", "false", "self", "__FILE__", "__LINE__", "__ENCODING__");

    // Keywords that may open an expression used as a value
    private static final Set<String> EXPRESSION_KEYWORDS = Set.of(
        "nil", "true", "false", "self", "__FILE__", "__LINE__", "__ENCODING__", "not", "defined?",
        "super", "yield", "case", "begin", "def", "class", "module", "for", "return", "break", "next",
        "redo", "retry");

    // Keywords that may open the first argument of a command
    private static final Set<String> COMMAND_ARG_KEYWORDS = Set.of(
        "nil", "true", "false", "self", "__FILE__", "__LINE__", "__ENCODING__", "not", "defined?",
        "super", "yield", "case", "begin", "def", "lambda");

    private enum ParamsContext { DEF_PAREN, DEF_BARE, BLOCK, LAMBDA_PAREN, LAMBDA_BARE }

    // Local variable scope. Blocks see the names of their enclosing scopes;
    // def, class and module bodies start fresh.
    private static final class Scope {
        final Set<String> names = new HashSet<>();
        final boolean hard;

        Scope(boolean hard) {
            this.hard = hard;
        }
    }

    private record Flags(boolean noDo, boolean commandArgs, boolean noPipe, boolean inArguments) {}

    private record PendingRescue(RescueEx exception, Statements statements) {}

    private final ParserState state;
    private final TreeBuilder builder;
    private final Lexer lexer;
    private final List<Token> lookahead = new ArrayList<>();
    private final Deque<Scope> scopes = new ArrayDeque<>();
    private Token previous;

    private boolean noDo;          // `do` belongs to an enclosing while, until or for header
    private boolean commandArgs;   // inside unparenthesized command arguments, `do` belongs to the command
    private boolean noPipe;        // inside a pattern or block parameters, `|` is not an operator
    private boolean inArguments;   // inside an argument list, `a = 1, 2` is not a multiple right-hand side

    public Parser(String source) {
        this.state = new ParserState(source);
        this.builder = new TreeBuilder(state);
        this.lexer = new Lexer(source, this::isLocal);
        scopes.push(new Scope(true));
    }

    public Program parse() {
        Statements statements = parseStatements();
        if (!check(TokenType.EOF)) {
            throw unexpected("Unexpected token");
        }
        Program program = builder.onProgram(statements);
        builder.attachComments(program);
        return program;
    }

    // ========================================================================
    // Statements
    // ========================================================================

    private Statements parseStatements() {
        List<Node> body = new ArrayList<>();
        skipTerms();
        while (!atStatementsEnd()) {
            body.add(parseStatement());
            if (atStatementsEnd()) {
                break;
            }
            if (!check(TokenType.NEWLINE) && !check(TokenType.SEMICOLON)) {
                throw unexpected("Expected end of statement");
            }
            skipTerms();
        }
        if (body.isEmpty()) {
            body.add(builder.onVoidStmt(here()));
        }
        return builder.onStatements(body);
    }

    private boolean atStatementsEnd() {
        Token token = peek();
        return switch (token.type()) {
            case EOF, RPAREN, RBRACE, EMBEXPR_END -> true;
            case KEYWORD -> STATEMENT_ENDS.contains(token.value());
            default -> false;
        };
    }

    private Node parseStatement() {
        Node node = parseExpressionStatement();
        while (true) {
            Token token = peek();
            if (token.type() != TokenType.KEYWORD) {
                return node;
            }
            switch (token.value()) {
                case "if" -> {
                    advance();
                    node = builder.onIfMod(parseExpressionStatement(), node);
                }
                case "unless" -> {
                    advance();
                    node = builder.onUnlessMod(parseExpressionStatement(), node);
                }
                case "while" -> {
                    advance();
                    node = builder.onWhileMod(parseExpressionStatement(), node);
                }
                case "until" -> {
                    advance();
                    node = builder.onUntilMod(parseExpressionStatement(), node);
                }
                case "rescue" -> {
                    advance();
                    node = builder.onRescueMod(node, parseExpressionStatement());
                }
                default -> {
                    return node;
                }
            }
        }
    }

    private Node parseExpressionStatement() {
        Token token = peek();
        if (token.isKeyword("alias")) {
            return parseAlias();
        }
        if (token.isKeyword("undef")) {
            return parseUndef();
        }
        if ((token.isKeyword("BEGIN") || token.isKeyword("END"))
                && (peekAt(1).type() == TokenType.LBRACE || peekAt(1).type() == TokenType.LBRACE_BLOCK)) {
            return parseBeginEndBlock();
        }
        if (token.type() == TokenType.STAR) {
            return parseMultipleAssignment(null);
        }
        Node node = parseExpr();
        if (check(TokenType.COMMA) && isAssignable(node)) {
            return parseMultipleAssignment(node);
        }
        return node;
    }

    private Node parseExpr() {
        Node left = parseNotExpr();
        while (checkKeyword("and") || checkKeyword("or")) {
            String operator = advance().value();
            skipNewlines();
            Node right = parseNotExpr();
            left = builder.onBinary(left, operator, right);
        }
        return left;
    }

    private Node parseNotExpr() {
        if (checkKeyword("not")) {
            return parseNot();
        }
        Node node = parseArg(BP_NONE, true);
        if (isCommand(node)) {
            return node;
        }
        // Rightward assignment and one-line pattern matching
        if (checkOp("=>")) {
            Token operator = advance();
            Op op = builder.operator(operator);
            return builder.onRAssign(node, op, parsePatternTop());
        }
        if (checkKeyword("in")) {
            Token keyword = advance();
            Kw kw = builder.keyword(keyword);
            return builder.onRAssign(node, kw, parsePatternTop());
        }
        return node;
    }

    private Node parseNot() {
        Token not = advance();
        if (check(TokenType.LPAREN_CALL)) {
            advance();
            Flags saved = resetFlags();
            skipNewlines();
            Node statement = check(TokenType.RPAREN) ? null : parseExpr();
            skipNewlines();
            consume(TokenType.RPAREN, "Expected ')'");
            restoreFlags(saved);
            return builder.onNot(not, statement, true);
        }
        Node statement = parseNotExpr();
        return builder.onNot(not, statement, false);
    }

    // ========================================================================
    // Multiple assignment
    // ========================================================================

    private Node parseMultipleAssignment(Node first) {
        List<Node> parts = new ArrayList<>();
        parts.add(first != null ? toTarget(first) : parseMlhsItem());
        boolean comma = false;
        Token trailing = null;
        while (check(TokenType.COMMA)) {
            Token separator = advance();
            if (checkOp("=")) {
                comma = true;
                trailing = separator;
                break;
            }
            parts.add(parseMlhsItem());
        }
        MLHS target = builder.onMLHS(parts, comma, trailing);
        consumeOp("=", "Expected '=' in multiple assignment");
        skipNewlines();
        Node value;
        if (check(TokenType.STAR)) {
            value = parseMrhs(null);
        } else {
            value = parseArg(BP_NONE, true);
            if (!isCommand(value) && check(TokenType.COMMA)) {
                value = parseMrhs(value);
            }
        }
        return builder.onMAssign(target, value);
    }

    private Node parseMlhsItem() {
        if (check(TokenType.STAR)) {
            Token star = advance();
            Node value = canStartExpression(peek()) ? toTarget(parseMlhsPrimary()) : null;
            return builder.onArgStar(star, value);
        }
        if (check(TokenType.LPAREN)) {
            return parseMlhsParen();
        }
        return toTarget(parseMlhsPrimary());
    }

    private Node parseMlhsPrimary() {
        return parsePostfix(parsePrimary(false), false);
    }

    private Node parseMlhsParen() {
        advance();
        List<Node> parts = new ArrayList<>();
        parts.add(parseMlhsItem());
        boolean comma = false;
        Token trailing = null;
        while (check(TokenType.COMMA)) {
            Token separator = advance();
            if (check(TokenType.RPAREN)) {
                comma = true;
                trailing = separator;
                break;
            }
            parts.add(parseMlhsItem());
        }
        consume(TokenType.RPAREN, "Expected ')'");
        return builder.onMLHSParen(builder.onMLHS(parts, comma, trailing));
    }

    private Node parseMrhs(Node first) {
        List<Node> parts = new ArrayList<>();
        parts.add(first != null ? first : parseSplat());
        while (check(TokenType.COMMA)) {
            advance();
            skipNewlines();
            parts.add(check(TokenType.STAR) ? parseSplat() : parseArg(BP_NONE, false));
        }
        return builder.onMRHS(parts);
    }

    private Node parseSplat() {
        Token star = advance();
        Node value = canStartExpression(peek()) ? parseArg(BP_NONE, false) : null;
        return builder.onArgStar(star, value);
    }

    private boolean isAssignable(Node node) {
        if (node instanceof VCall || node instanceof ARef
                || node instanceof ConstPathRef || node instanceof TopConstRef) {
            return true;
        }
        if (node instanceof VarRef ref) {
            return !(ref.value() instanceof Kw);
        }
        if (node instanceof CallNode call) {
            return call.receiver() != null && call.arguments() == null
                && (call.message() instanceof Ident || call.message() instanceof Const);
        }
        return false;
    }

    /**
     * Converts an expression on the left of an assignment into its target form
     * and declares the local variables it introduces.
     */
    private Node toTarget(Node node) {
        if (node instanceof ArgStar || node instanceof MLHSParen) {
            return node;
        }
        if (!isAssignable(node)) {
            throw new ParseException("Cannot assign to " + node.type().tag(),
                node.location().startLine(), state.lineIndex().column(node.location().startChar()));
        }
        if (node instanceof VCall vcall) {
            declare(vcall.value().value());
            return builder.onVarField(vcall.value());
        }
        if (node instanceof VarRef ref) {
            if (ref.value() instanceof Ident ident) {
                declare(ident.value());
            }
            return builder.onVarField(ref.value());
        }
        if (node instanceof CallNode call) {
            return builder.onField(call.receiver(), call.operator(), call.message());
        }
        if (node instanceof ARef aref) {
            return builder.onARefField(aref);
        }
        if (node instanceof ConstPathRef ref) {
            return builder.onConstPathField(ref);
        }
        return builder.onTopConstField((TopConstRef) node);
    }

    // ========================================================================
    // Expressions (Pratt)
    // ========================================================================

    private Node parseArg(int minBp, boolean allowCommand) {
        Node left = parseUnary(allowCommand);
        if (isCommand(left)) {
            return left;
        }
        while (true) {
            Token token = peek();
            if (token.type() != TokenType.OP) {
                return left;
            }
            String op = token.value();

            if (ASSIGNMENT_OPERATORS.contains(op)) {
                if (minBp > BP_ASSIGNMENT || !isAssignable(left)) {
                    return left;
                }
                return parseAssignment(left, allowCommand);
            }

            if (op.equals("?")) {
                if (minBp > BP_TERNARY) {
                    return left;
                }
                advance();
                skipNewlines();
                Node truthy = parseArg(BP_TERNARY, false);
                skipNewlines();
                consumeOp(":", "Expected ':' in conditional expression");
                skipNewlines();
                Node falsy = parseArg(BP_TERNARY, false);
                left = builder.onIfOp(left, truthy, falsy);
                continue;
            }

            if (op.equals("..") || op.equals("...")) {
                if (minBp > BP_RANGE) {
                    return left;
                }
                Token operator = advance();
                Node right = canStartExpression(peek()) ? parseArg(BP_RANGE + 1, false) : null;
                left = builder.onRange(left, builder.operator(operator), right);
                continue;
            }

            int bp = binaryPower(op);
            if (bp < 0 || bp < minBp) {
                return left;
            }
            advance();
            skipNewlines();
            Node right = parseArg(op.equals("**") ? bp : bp + 1, false);
            left = builder.onBinary(left, op, right);
        }
    }

    private int binaryPower(String op) {
        return switch (op) {
            case "||" -> BP_OR;
            case "&&" -> BP_AND;
            case "<=>", "==", "===", "!=", "=~", "!~" -> BP_EQUALITY;
            case "<", "<=", ">", ">=" -> BP_COMPARISON;
            case "|" -> noPipe ? -1 : BP_BIT_OR;
            case "^" -> BP_BIT_OR;
            case "&" -> BP_BIT_AND;
            case "<<", ">>" -> BP_SHIFT;
            case "+", "-" -> BP_ADDITIVE;
            case "*", "/", "%" -> BP_MULTIPLICATIVE;
            case "**" -> BP_EXPONENT;
            default -> -1;
        };
    }

    private Node parseAssignment(Node left, boolean allowCommand) {
        Token operator = advance();
        Node target = toTarget(left);
        skipNewlines();
        boolean plain = operator.value().equals("=");
        Node value;
        if (plain && check(TokenType.STAR) && !inArguments) {
            value = parseMrhs(null);
        } else {
            value = parseArg(BP_ASSIGNMENT, allowCommand);
            if (allowCommand && !isCommand(value) && checkKeyword("rescue")) {
                advance();
                Node rescue = parseArg(BP_ASSIGNMENT, false);
                value = builder.onRescueMod(value, rescue);
            } else if (plain && allowCommand && !inArguments && !isCommand(value) && check(TokenType.COMMA)) {
                value = parseMrhs(value);
            }
        }
        if (plain) {
            return builder.onAssign(target, value);
        }
        return builder.onOpAssign(target, builder.operator(operator), value);
    }

    private Node parseUnary(boolean allowCommand) {
        Token token = peek();
        switch (token.type()) {
            case UMINUS -> {
                advance();
                Node operand = parseArg(BP_UNARY_MINUS, false);
                return builder.onUnary(token, operand);
            }
            case UPLUS -> {
                advance();
                Node operand = parseArg(BP_UNARY, false);
                return builder.onUnary(token, operand);
            }
            case OP -> {
                switch (token.value()) {
                    case "!" -> {
                        advance();
                        Node operand = parseArg(BP_UNARY, allowCommand);
                        return builder.onUnary(token, operand);
                    }
                    case "~" -> {
                        advance();
                        Node operand = parseArg(BP_UNARY, false);
                        return builder.onUnary(token, operand);
                    }
                    case "..", "..." -> {
                        advance();
                        Node right = parseArg(BP_RANGE + 1, false);
                        return builder.onRange(null, builder.operator(token), right);
                    }
                    default -> {
                        // fall through to primary, which reports the error
                    }
                }
            }
            case KEYWORD -> {
                if (token.value().equals("defined?")) {
                    return parsePostfix(parseDefined(), allowCommand);
                }
                if (token.value().equals("not")) {
                    return parseNot();
                }
            }
            default -> {
                // primary
            }
        }
        return parsePostfix(parsePrimary(allowCommand), allowCommand);
    }

    private Node parseDefined() {
        Token keyword = advance();
        if (check(TokenType.LPAREN_CALL)) {
            advance();
            Flags saved = resetFlags();
            skipNewlines();
            Node value = parseExpr();
            skipNewlines();
            consume(TokenType.RPAREN, "Expected ')'");
            restoreFlags(saved);
            return builder.onDefined(keyword, value, true);
        }
        Node value = parseArg(BP_TERNARY, false);
        return builder.onDefined(keyword, value, false);
    }

    private static boolean isCommand(Node node) {
        if (node instanceof Command || node instanceof CommandCall
                || node instanceof ReturnNode || node instanceof Break || node instanceof Next) {
            return true;
        }
        if (node instanceof YieldNode yield) {
            return yield.arguments() instanceof Args;
        }
        if (node instanceof Super sup) {
            return sup.arguments() instanceof Args;
        }
        return false;
    }

    // ========================================================================
    // Postfix: calls, indexing, blocks
    // ========================================================================

    private Node parsePostfix(Node node, boolean allowCommand) {
        while (true) {
            Token token = peek();
            switch (token.type()) {
                case PERIOD -> node = parseMethodCall(node, allowCommand);
                case COLON2 -> node = parseScopedName(node, allowCommand);
                case LBRACKET_INDEX -> node = parseIndex(node);
                case LBRACE_BLOCK -> {
                    if (!acceptsBlock(node)) {
                        return node;
                    }
                    Node call = asCall(node);
                    node = builder.onMethodAddBlock(call, parseBraceBlock());
                }
                case KEYWORD -> {
                    if (!token.value().equals("do") || noDo || commandArgs || !acceptsBlock(node)) {
                        return node;
                    }
                    Node call = asCall(node);
                    node = builder.onMethodAddBlock(call, parseDoBlock());
                }
                default -> {
                    return node;
                }
            }
            if (isCommand(node)) {
                return node;
            }
        }
    }

    private static boolean acceptsBlock(Node node) {
        return node instanceof CallNode || node instanceof VCall || node instanceof Super || node instanceof ZSuper;
    }

    private Node asCall(Node node) {
        if (node instanceof VCall vcall) {
            return builder.onCall(null, null, vcall.value(), null);
        }
        return node;
    }

    private Node parseMethodCall(Node receiver, boolean allowCommand) {
        Token dot = advance();
        Node operator = builder.period(dot);
        if (check(TokenType.LPAREN_CALL)) {
            return builder.onCall(receiver, operator, null, parseParenArgs());
        }
        Node message = methodName(advance());
        return parseCallRest(receiver, operator, message, allowCommand);
    }

    private Node parseScopedName(Node parent, boolean allowCommand) {
        Token colons = peek();
        Token name = peekAt(1);
        if (name.type() == TokenType.CONSTANT && peekAt(2).type() != TokenType.LPAREN_CALL) {
            advance();
            advance();
            return builder.onConstPathRef(parent, (Const) builder.leaf(name), colons);
        }
        advance();
        Node operator = builder.period(colons);
        Node message = methodName(advance());
        return parseCallRest(parent, operator, message, allowCommand);
    }

    private Node parseCallRest(Node receiver, Node operator, Node message, boolean allowCommand) {
        if (check(TokenType.LPAREN_CALL)) {
            return builder.onCall(receiver, operator, message, parseParenArgs());
        }
        if (allowCommand && canStartCommandArgs(peek())) {
            Args arguments = parseCommandArgs();
            BlockNode block = parseCommandBlock();
            return builder.onCommandCall(receiver, operator, message, arguments, block);
        }
        return builder.onCall(receiver, operator, message, null);
    }

    private Node parseIndex(Node collection) {
        advance();
        Flags saved = resetFlags();
        skipNewlines();
        Args index = check(TokenType.RBRACKET) ? null : parseArgList(TokenType.RBRACKET, true);
        skipNewlines();
        consume(TokenType.RBRACKET, "Expected ']'");
        restoreFlags(saved);
        return builder.onARef(collection, index);
    }

    private Node methodName(Token token) {
        return switch (token.type()) {
            case IDENTIFIER, CONSTANT, BACKTICK -> builder.leaf(token);
            case KEYWORD -> builder.keyword(token);
            case OP, STAR, DSTAR, AMPER, UMINUS, UPLUS -> builder.operator(token);
            default -> throw new ExpectedTokenException("Expected method name", token, columnOf(token));
        };
    }

    // ========================================================================
    // Commands and arguments
    // ========================================================================

    private Node parseCommand(Node message) {
        Args arguments = parseCommandArgs();
        BlockNode block = parseCommandBlock();
        return builder.onCommand(message, arguments, block);
    }

    private Args parseCommandArgs() {
        boolean outer = commandArgs;
        commandArgs = true;
        Args arguments = parseArgList(null, true);
        commandArgs = outer;
        return arguments;
    }

    private BlockNode parseCommandBlock() {
        if (!noDo && !commandArgs && checkKeyword("do")) {
            return parseDoBlock();
        }
        return null;
    }

    /**
     * Whether a token after a method name opens its unparenthesized arguments.
     * The lexer has already decided the ambiguous cases from the whitespace.
     */
    private boolean canStartCommandArgs(Token token) {
        if (!token.spaceBefore()) {
            return false;
        }
        return switch (token.type()) {
            case IDENTIFIER, CONSTANT, IVAR, CVAR, GVAR, BACKREF, INTEGER, FLOAT, RATIONAL, IMAGINARY, CHAR,
                 LABEL, TSTRING_BEG, XSTRING_BEG, SYMBEG, REGEXP_BEG, QWORDS_BEG, WORDS_BEG, QSYMBOLS_BEG,
                 SYMBOLS_BEG, HEREDOC_BEG, LBRACKET, LPAREN_ARG, STAR, DSTAR, AMPER, UMINUS, UPLUS, COLON3,
                 TLAMBDA -> true;
            case OP -> token.value().equals("!") || token.value().equals("~");
            case KEYWORD -> COMMAND_ARG_KEYWORDS.contains(token.value());
            default -> false;
        };
    }

    /**
     * Whether a token can open an expression that continues the current one,
     * such as the end of a range or the value of a label.
     */
    private boolean canStartExpression(Token token) {
        return switch (token.type()) {
            case IDENTIFIER, CONSTANT, IVAR, CVAR, GVAR, BACKREF, INTEGER, FLOAT, RATIONAL, IMAGINARY, CHAR,
                 LABEL, TSTRING_BEG, XSTRING_BEG, SYMBEG, REGEXP_BEG, QWORDS_BEG, WORDS_BEG, QSYMBOLS_BEG,
                 SYMBOLS_BEG, HEREDOC_BEG, LBRACKET, LBRACE, LPAREN, LPAREN_ARG, STAR, DSTAR, AMPER, UMINUS,
                 UPLUS, COLON3, TLAMBDA -> true;
            case OP -> token.value().equals("!") || token.value().equals("~")
                || token.value().equals("..") || token.value().equals("...");
            case KEYWORD -> EXPRESSION_KEYWORDS.contains(token.value());
            default -> false;
        };
    }

    private ArgParen parseParenArgs() {
        advance();
        Flags saved = resetFlags();
        skipNewlines();
        Node arguments = check(TokenType.RPAREN) ? null : parseArgList(TokenType.RPAREN, true);
        skipNewlines();
        consume(TokenType.RPAREN, "Expected ')'");
        restoreFlags(saved);
        return builder.onArgParen(arguments);
    }

    /**
     * Parses a comma separated argument list. Keyword arguments are gathered into
     * one bare hash at the position of the first of them. The first argument may
     * itself be a command, in which case it is the only one.
     */
    private Args parseArgList(TokenType closing, boolean allowAssocs) {
        boolean outerArguments = inArguments;
        inArguments = true;
        List<Node> parts = new ArrayList<>();
        List<Node> assocs = null;
        int assocIndex = -1;
        boolean first = true;
        while (true) {
            if (closing != null) {
                skipNewlines();
                if (check(closing)) {
                    break;
                }
            }
            Token token = peek();
            Node part = null;
            Node assoc = null;
            switch (token.type()) {
                case AMPER -> {
                    advance();
                    Node value = canStartExpression(peek()) ? parseArg(BP_NONE, false) : null;
                    part = builder.onArgBlock(token, value);
                }
                case STAR -> part = parseSplat();
                case DSTAR -> {
                    advance();
                    Node value = canStartExpression(peek()) ? parseArg(BP_NONE, false) : null;
                    assoc = builder.onAssocSplat(token, value);
                }
                case LABEL -> {
                    advance();
                    Node key = builder.leaf(token);
                    Node value = canStartExpression(peek()) ? parseArg(BP_NONE, false) : null;
                    assoc = builder.onAssoc(key, value);
                }
                default -> {
                    if (token.isOp("...") && closing == TokenType.RPAREN && peekAt(1).type() == TokenType.RPAREN) {
                        part = builder.onArgsForward(advance());
                        break;
                    }
                    Node value = parseArg(BP_NONE, first);
                    if (value instanceof DynaSymbol && previous.type() == TokenType.LABEL_END) {
                        Node labelValue = canStartExpression(peek()) ? parseArg(BP_NONE, false) : null;
                        assoc = builder.onAssoc(value, labelValue);
                    } else if (allowAssocs && checkOp("=>")) {
                        advance();
                        skipNewlines();
                        assoc = builder.onAssoc(value, parseArg(BP_NONE, false));
                    } else {
                        part = value;
                    }
                }
            }
            if (assoc != null) {
                if (assocs == null) {
                    assocs = new ArrayList<>();
                    assocIndex = parts.size();
                }
                assocs.add(assoc);
            } else {
                parts.add(part);
                if (isCommand(part)) {
                    break;
                }
            }
            first = false;
            if (!check(TokenType.COMMA)) {
                break;
            }
            advance();
        }
        if (assocs != null) {
            parts.add(assocIndex, builder.onBareAssocHash(assocs));
        }
        inArguments = outerArguments;
        return builder.onArgs(parts, here());
    }

    // ========================================================================
    // Primaries
    // ========================================================================

    private Node parsePrimary(boolean allowCommand) {
        Token token = peek();
        return switch (token.type()) {
            case INTEGER, FLOAT, RATIONAL, IMAGINARY, CHAR -> builder.leaf(advance());
            case IVAR, CVAR, GVAR, BACKREF -> builder.onVarRef(builder.leaf(advance()));
            case IDENTIFIER -> parseIdentifier(allowCommand);
            case CONSTANT -> parseConstant(allowCommand);
            case COLON3 -> {
                advance();
                Token name = consume(TokenType.CONSTANT, "Expected constant after '::'");
                yield builder.onTopConstRef(token, (Const) builder.leaf(name));
            }
            case TSTRING_BEG -> parseStringConcat();
            case XSTRING_BEG -> parseXString();
            case SYMBEG -> parseSymbol();
            case REGEXP_BEG -> parseRegexp();
            case QWORDS_BEG, QSYMBOLS_BEG -> parseQWords();
            case WORDS_BEG, SYMBOLS_BEG -> parseWords();
            case HEREDOC_BEG -> parseHeredoc();
            case LBRACKET -> parseArrayLiteral();
            case LBRACE -> parseHashLiteral();
            case LPAREN, LPAREN_ARG, LPAREN_CALL -> parseParen();
            case TLAMBDA -> parseLambda();
            case KEYWORD -> parseKeyword(token, allowCommand);
            default -> throw unexpected("Unexpected token");
        };
    }

    private Node parseIdentifier(boolean allowCommand) {
        Token token = advance();
        Ident ident = builder.ident(token);
        if (check(TokenType.LPAREN_CALL)) {
            return builder.onCall(null, null, ident, parseParenArgs());
        }
        if (isLocal(token.value())) {
            return builder.onVarRef(ident);
        }
        if (allowCommand && canStartCommandArgs(peek())) {
            return parseCommand(ident);
        }
        return builder.onVCall(ident);
    }

    private Node parseConstant(boolean allowCommand) {
        Token token = advance();
        Const constant = (Const) builder.leaf(token);
        if (check(TokenType.LPAREN_CALL)) {
            return builder.onCall(null, null, constant, parseParenArgs());
        }
        if (allowCommand && canStartCommandArgs(peek())) {
            return parseCommand(constant);
        }
        return builder.onVarRef(constant);
    }

    private Node parseKeyword(Token token, boolean allowCommand) {
        String keyword = token.value();
        if (VALUE_KEYWORDS.contains(keyword)) {
            advance();
            return builder.onVarRef(builder.keyword(token));
        }
        return switch (keyword) {
            case "if" -> parseIf(false);
            case "unless" -> parseIf(true);
            case "while", "until" -> parseWhile();
            case "for" -> parseFor();
            case "case" -> parseCase();
            case "begin" -> parseBegin();
            case "def" -> parseDef();
            case "class" -> parseClass();
            case "module" -> parseModule();
            case "return", "break", "next" -> parseJump();
            case "redo", "retry" -> builder.onRedoOrRetry(advance());
            case "yield" -> parseYield(allowCommand);
            case "super" -> parseSuper(allowCommand);
            case "defined?" -> parseDefined();
            case "not" -> parseNot();
            case "alias" -> parseAlias();
            case "undef" -> parseUndef();
            case "BEGIN", "END" -> parseBeginEndBlock();
            default -> throw unexpected("Unexpected keyword");
        };
    }

    private Node parseParen() {
        advance();
        Flags saved = resetFlags();
        Statements statements = parseStatements();
        consume(TokenType.RPAREN, "Expected ')'");
        restoreFlags(saved);
        return builder.onParen(statements);
    }

    private Node parseArrayLiteral() {
        advance();
        Flags saved = resetFlags();
        skipNewlines();
        Args contents = check(TokenType.RBRACKET) ? null : parseArgList(TokenType.RBRACKET, true);
        skipNewlines();
        consume(TokenType.RBRACKET, "Expected ']'");
        restoreFlags(saved);
        return builder.onArray(contents);
    }

    private Node parseHashLiteral() {
        advance();
        Flags saved = resetFlags();
        skipNewlines();
        List<Node> assocs = new ArrayList<>();
        while (!check(TokenType.RBRACE)) {
            assocs.add(parseAssoc());
            skipNewlines();
            if (!check(TokenType.COMMA)) {
                break;
            }
            advance();
            skipNewlines();
        }
        consume(TokenType.RBRACE, "Expected '}'");
        restoreFlags(saved);
        return builder.onHash(assocs);
    }

    private Node parseAssoc() {
        Token token = peek();
        if (token.type() == TokenType.DSTAR) {
            advance();
            return builder.onAssocSplat(token, parseArg(BP_NONE, false));
        }
        if (token.type() == TokenType.LABEL) {
            advance();
            Node key = builder.leaf(token);
            Node value = canStartExpression(peek()) ? parseArg(BP_NONE, false) : null;
            return builder.onAssoc(key, value);
        }
        Node key = parseArg(BP_NONE, false);
        if (key instanceof DynaSymbol && previous.type() == TokenType.LABEL_END) {
            Node value = canStartExpression(peek()) ? parseArg(BP_NONE, false) : null;
            return builder.onAssoc(key, value);
        }
        consumeOp("=>", "Expected '=>' in hash");
        skipNewlines();
        return builder.onAssoc(key, parseArg(BP_NONE, false));
    }

    // ========================================================================
    // Strings, symbols, regexps, word lists
    // ========================================================================

    private Node parseStringConcat() {
        Node node = parseString();
        while (check(TokenType.TSTRING_BEG) && !(node instanceof DynaSymbol)) {
            Node right = parseString();
            if (right instanceof DynaSymbol) {
                throw new ParseException("Unexpected label",
                    right.location().startLine(), state.lineIndex().column(right.location().startChar()));
            }
            node = builder.onStringConcat(node, right);
        }
        return node;
    }

    private Node parseString() {
        advance();
        List<Node> parts = parseStringParts();
        Token end = advance();
        if (end.type() == TokenType.LABEL_END) {
            return builder.onLabelSymbol(parts);
        }
        return builder.onStringLiteral(parts);
    }

    private List<Node> parseStringParts() {
        List<Node> parts = new ArrayList<>();
        while (true) {
            Token token = peek();
            switch (token.type()) {
                case TSTRING_CONTENT -> parts.add(builder.leaf(advance()));
                case EMBEXPR_BEG -> parts.add(parseEmbExpr());
                case EMBVAR -> parts.add(parseEmbVar());
                case TSTRING_END, LABEL_END, REGEXP_END, HEREDOC_END -> {
                    return parts;
                }
                default -> throw unexpected("Unterminated string");
            }
        }
    }

    private Node parseEmbExpr() {
        advance();
        Flags saved = resetFlags();
        Statements statements = parseStatements();
        consume(TokenType.EMBEXPR_END, "Expected '}'");
        restoreFlags(saved);
        return builder.onStringEmbExpr(statements);
    }

    private Node parseEmbVar() {
        advance();
        Token variable = advance();
        return builder.onStringDVar(builder.onVarRef(builder.leaf(variable)));
    }

    private Node parseHeredoc() {
        Token opening = advance();
        List<Node> parts = parseStringParts();
        consume(TokenType.HEREDOC_END, "Expected heredoc terminator");
        return opening.value().contains("`") ? builder.onXStringLiteral(parts) : builder.onStringLiteral(parts);
    }

    private Node parseXString() {
        advance();
        List<Node> parts = parseStringParts();
        consume(TokenType.TSTRING_END, "Expected end of command string");
        return builder.onXStringLiteral(parts);
    }

    private Node parseSymbol() {
        Token symbeg = advance();
        if (!symbeg.value().equals(":")) {
            List<Node> parts = parseStringParts();
            consume(TokenType.TSTRING_END, "Expected end of symbol");
            return builder.onDynaSymbol(parts);
        }
        Token name = advance();
        Node value = switch (name.type()) {
            case IDENTIFIER, CONSTANT, IVAR, CVAR, GVAR, BACKREF, BACKTICK -> builder.leaf(name);
            case KEYWORD -> builder.keyword(name);
            case OP, STAR, DSTAR, AMPER, UMINUS, UPLUS -> builder.operator(name);
            default -> throw new ExpectedTokenException("Expected symbol name", name, columnOf(name));
        };
        return builder.onSymbol(symbeg, value);
    }

    private Node parseRegexp() {
        advance();
        List<Node> parts = parseStringParts();
        consume(TokenType.REGEXP_END, "Expected end of regular expression");
        return builder.onRegexp(parts);
    }

    private Node parseQWords() {
        Token opening = advance();
        List<TStringContent> elements = new ArrayList<>();
        while (!check(TokenType.TSTRING_END)) {
            Token token = advance();
            if (token.type() == TokenType.TSTRING_CONTENT) {
                elements.add((TStringContent) builder.leaf(token));
            } else if (token.type() != TokenType.WORDS_SEP) {
                throw new ExpectedTokenException("Unterminated word list", token, columnOf(token));
            }
        }
        advance();
        return opening.type() == TokenType.QWORDS_BEG ? builder.onQWords(elements) : builder.onQSymbols(elements);
    }

    private Node parseWords() {
        Token opening = advance();
        List<Word> words = new ArrayList<>();
        List<Node> current = new ArrayList<>();
        while (!check(TokenType.TSTRING_END)) {
            Token token = peek();
            switch (token.type()) {
                case WORDS_SEP -> {
                    advance();
                    if (!current.isEmpty()) {
                        words.add(builder.onWord(current));
                        current = new ArrayList<>();
                    }
                }
                case TSTRING_CONTENT -> current.add(builder.leaf(advance()));
                case EMBEXPR_BEG -> current.add(parseEmbExpr());
                case EMBVAR -> current.add(parseEmbVar());
                default -> throw unexpected("Unterminated word list");
            }
        }
        if (!current.isEmpty()) {
            words.add(builder.onWord(current));
        }
        advance();
        return opening.type() == TokenType.WORDS_BEG ? builder.onWords(words) : builder.onSymbols(words);
    }

    // ========================================================================
    // Blocks and lambdas
    // ========================================================================

    private BlockNode parseBraceBlock() {
        advance();
        pushScope(false);
        Flags saved = resetFlags();
        BlockVar blockVar = checkBlockVar() ? parseBlockVar() : null;
        Statements statements = parseStatements();
        consume(TokenType.RBRACE, "Expected '}'");
        restoreFlags(saved);
        popScope();
        return builder.onBraceBlock(blockVar, statements);
    }

    private BlockNode parseDoBlock() {
        advance();
        pushScope(false);
        Flags saved = resetFlags();
        skipNewlines();
        BlockVar blockVar = checkBlockVar() ? parseBlockVar() : null;
        BodyStmt bodystmt = parseBodyStmt();
        consumeKeyword("end");
        restoreFlags(saved);
        popScope();
        return builder.onDoBlock(blockVar, bodystmt);
    }

    private boolean checkBlockVar() {
        return checkOp("|") || checkOp("||");
    }

    private BlockVar parseBlockVar() {
        Token opening = advance();
        if (opening.value().equals("||")) {
            return builder.onBlockVar(emptyParams(), List.of());
        }
        boolean outer = noPipe;
        noPipe = true;
        Params params = parseParams(ParamsContext.BLOCK);
        noPipe = outer;
        List<Ident> locals = parseBlockLocals();
        consumeOp("|", "Expected '|'");
        return builder.onBlockVar(params, locals);
    }

    private List<Ident> parseBlockLocals() {
        List<Ident> locals = new ArrayList<>();
        if (check(TokenType.SEMICOLON)) {
            advance();
            do {
                Token name = consume(TokenType.IDENTIFIER, "Expected block local variable");
                declare(name.value());
                locals.add(builder.ident(name));
            } while (match(TokenType.COMMA));
        }
        return locals;
    }

    private Node parseLambda() {
        advance();
        pushScope(false);
        Node params = null;
        if (check(TokenType.LPAREN_CALL) || check(TokenType.LPAREN) || check(TokenType.LPAREN_ARG)) {
            advance();
            skipNewlines();
            Params inner = parseParams(ParamsContext.LAMBDA_PAREN);
            List<Ident> locals = parseBlockLocals();
            skipNewlines();
            consume(TokenType.RPAREN, "Expected ')'");
            params = builder.onParenParams(locals.isEmpty() ? inner : builder.onLambdaVar(inner, locals));
        } else if (!check(TokenType.TLAMBEG) && !checkKeyword("do")) {
            params = parseParams(ParamsContext.LAMBDA_BARE);
        }
        Flags saved = resetFlags();
        Node lambda;
        if (check(TokenType.TLAMBEG)) {
            advance();
            Statements statements = parseStatements();
            consume(TokenType.RBRACE, "Expected '}'");
            lambda = builder.onLambda(params, statements, true);
        } else {
            consumeKeyword("do");
            BodyStmt bodystmt = parseBodyStmt();
            consumeKeyword("end");
            lambda = builder.onLambda(params, bodystmt, false);
        }
        restoreFlags(saved);
        popScope();
        return lambda;
    }

    // ========================================================================
    // Parameters
    // ========================================================================

    private Params emptyParams() {
        return builder.onParams(List.of(), List.of(), null, List.of(), List.of(), null, null, here());
    }

    private Params parseParams(ParamsContext context) {
        List<Node> requireds = new ArrayList<>();
        List<Params.OptionalParam> optionals = new ArrayList<>();
        Node rest = null;
        List<Node> posts = new ArrayList<>();
        List<Params.KeywordParam> keywords = new ArrayList<>();
        Node keywordRest = null;
        BlockArg block = null;

        while (true) {
            if (context == ParamsContext.DEF_PAREN || context == ParamsContext.LAMBDA_PAREN) {
                skipNewlines();
            }
            if (atParamsEnd(context)) {
                break;
            }
            Token token = peek();
            switch (token.type()) {
                case IDENTIFIER -> {
                    advance();
                    declare(token.value());
                    Ident name = builder.ident(token);
                    if (checkOp("=")) {
                        advance();
                        optionals.add(new Params.OptionalParam(name, parseArg(BP_TERNARY, false)));
                    } else if (rest != null || !optionals.isEmpty()) {
                        posts.add(name);
                    } else {
                        requireds.add(name);
                    }
                }
                case LPAREN, LPAREN_ARG, LPAREN_CALL -> {
                    Node destructure = parseMlhsParen();
                    if (rest != null || !optionals.isEmpty()) {
                        posts.add(destructure);
                    } else {
                        requireds.add(destructure);
                    }
                }
                case STAR -> {
                    advance();
                    Ident name = null;
                    if (check(TokenType.IDENTIFIER)) {
                        Token id = advance();
                        declare(id.value());
                        name = builder.ident(id);
                    }
                    rest = builder.onRestParam(token, name);
                }
                case DSTAR -> {
                    advance();
                    Node name = null;
                    if (check(TokenType.IDENTIFIER)) {
                        Token id = advance();
                        declare(id.value());
                        name = builder.ident(id);
                    } else if (checkKeyword("nil")) {
                        name = builder.keyword(advance());
                    }
                    keywordRest = builder.onKwRestParam(token, name);
                }
                case AMPER -> {
                    advance();
                    Ident name = null;
                    if (check(TokenType.IDENTIFIER)) {
                        Token id = advance();
                        declare(id.value());
                        name = builder.ident(id);
                    }
                    block = builder.onBlockArg(token, name);
                }
                case LABEL -> {
                    advance();
                    declare(token.value().substring(0, token.value().length() - 1));
                    Label name = (Label) builder.leaf(token);
                    Node value = canStartExpression(peek()) && !atParamsEnd(context)
                        ? parseArg(BP_TERNARY, false)
                        : null;
                    keywords.add(new Params.KeywordParam(name, value));
                }
                default -> {
                    if (token.isOp("...")) {
                        rest = builder.onArgsForward(advance());
                    } else {
                        throw unexpected("Unexpected token in parameters");
                    }
                }
            }
            if (!check(TokenType.COMMA)) {
                break;
            }
            Token comma = advance();
            if (context == ParamsContext.BLOCK && checkOp("|")) {
                rest = builder.onExcessedComma(comma);
                break;
            }
        }
        return builder.onParams(requireds, optionals, rest, posts, keywords, keywordRest, block, here());
    }

    private boolean atParamsEnd(ParamsContext context) {
        Token token = peek();
        return switch (context) {
            case DEF_PAREN, LAMBDA_PAREN -> token.type() == TokenType.RPAREN || token.type() == TokenType.SEMICOLON;
            case DEF_BARE -> token.type() == TokenType.NEWLINE || token.type() == TokenType.SEMICOLON
                || token.type() == TokenType.EOF || token.isOp("=");
            case BLOCK -> token.isOp("|") || token.type() == TokenType.SEMICOLON;
            case LAMBDA_BARE -> token.type() == TokenType.TLAMBEG || token.isKeyword("do");
        };
    }

    // ========================================================================
    // Definitions
    // ========================================================================

    private Node parseDef() {
        advance();
        Token first = advance();
        Node target = null;
        Node operator = null;
        Node name;
        if (check(TokenType.PERIOD)) {
            target = switch (first.type()) {
                case KEYWORD -> builder.onVarRef(builder.keyword(first));
                case IDENTIFIER, CONSTANT, IVAR, CVAR, GVAR -> builder.onVarRef(builder.leaf(first));
                default -> throw new ExpectedTokenException("Expected method receiver", first, columnOf(first));
            };
            operator = builder.period(advance());
            name = methodName(advance());
        } else {
            name = methodName(first);
        }

        pushScope(true);
        Node params = null;
        if (check(TokenType.LPAREN_CALL) || check(TokenType.LPAREN_ARG) || check(TokenType.LPAREN)) {
            advance();
            Params inner = parseParams(ParamsContext.DEF_PAREN);
            skipNewlines();
            consume(TokenType.RPAREN, "Expected ')'");
            params = builder.onParenParams(inner);
        } else if (!atParamsEnd(ParamsContext.DEF_BARE)) {
            params = parseParams(ParamsContext.DEF_BARE);
        }

        Node def;
        if (checkOp("=")) {
            advance();
            skipNewlines();
            Node body = parseArg(BP_NONE, true);
            if (!isCommand(body) && checkKeyword("rescue")) {
                advance();
                body = builder.onRescueMod(body, parseArg(BP_NONE, false));
            }
            def = builder.onDef(target, operator, name, params, body);
        } else {
            BodyStmt bodystmt = parseBodyStmt();
            consumeKeyword("end");
            def = builder.onDef(target, operator, name, params, bodystmt);
        }
        popScope();
        return def;
    }

    private Node parseClass() {
        advance();
        if (checkOp("<<")) {
            advance();
            Node target = parseExpr();
            requireTerm();
            pushScope(true);
            BodyStmt bodystmt = parseBodyStmt();
            consumeKeyword("end");
            popScope();
            return builder.onSClass(target, bodystmt);
        }
        Node constant = parseConstantPath();
        Node superclass = null;
        if (checkOp("<")) {
            advance();
            superclass = parseExpr();
        }
        requireTerm();
        pushScope(true);
        BodyStmt bodystmt = parseBodyStmt();
        consumeKeyword("end");
        popScope();
        return builder.onClass(constant, superclass, bodystmt);
    }

    private Node parseModule() {
        advance();
        Node constant = parseConstantPath();
        requireTerm();
        pushScope(true);
        BodyStmt bodystmt = parseBodyStmt();
        consumeKeyword("end");
        popScope();
        return builder.onModule(constant, bodystmt);
    }

    private Node parseConstantPath() {
        Token token = advance();
        Node node;
        if (token.type() == TokenType.COLON3) {
            Token name = consume(TokenType.CONSTANT, "Expected constant after '::'");
            node = builder.onTopConstRef(token, (Const) builder.leaf(name));
        } else if (token.type() == TokenType.CONSTANT) {
            Const constant = (Const) builder.leaf(token);
            node = check(TokenType.COLON2) ? builder.onVarRef(constant) : builder.onConstRef(constant);
        } else {
            throw new ExpectedTokenException("Expected constant name", token, columnOf(token));
        }
        while (check(TokenType.COLON2)) {
            Token colons = advance();
            Token name = consume(TokenType.CONSTANT, "Expected constant after '::'");
            node = builder.onConstPathRef(node, (Const) builder.leaf(name), colons);
        }
        return node;
    }

    private Node parseAlias() {
        advance();
        Node left = parseAliasName();
        Node right = parseAliasName();
        return builder.onAlias(left, right);
    }

    private Node parseUndef() {
        advance();
        List<Node> symbols = new ArrayList<>();
        do {
            symbols.add(parseAliasName());
        } while (match(TokenType.COMMA));
        return builder.onUndef(symbols);
    }

    private Node parseAliasName() {
        Token token = peek();
        if (token.type() == TokenType.SYMBEG) {
            return parseSymbol();
        }
        advance();
        if (token.type() == TokenType.GVAR || token.type() == TokenType.BACKREF) {
            return builder.leaf(token);
        }
        return builder.onBareSymbol(methodName(token));
    }

    private Node parseBeginEndBlock() {
        Token keyword = advance();
        if (!check(TokenType.LBRACE) && !check(TokenType.LBRACE_BLOCK)) {
            throw unexpected("Expected '{'");
        }
        advance();
        Flags saved = resetFlags();
        Statements statements = parseStatements();
        consume(TokenType.RBRACE, "Expected '}'");
        restoreFlags(saved);
        return keyword.value().equals("BEGIN") ? builder.onBEGIN(statements) : builder.onEND(statements);
    }

    // ========================================================================
    // Control flow
    // ========================================================================

    private Node parseIf(boolean unless) {
        advance();
        Node predicate = parseExpr();
        parseThen();
        Statements statements = parseStatements();
        Node consequent;
        if (unless) {
            consequent = checkKeyword("else") ? parseElse() : null;
        } else {
            consequent = parseIfTail();
        }
        if (!checkKeyword("end")) {
            throw unexpected("Expected 'end'");
        }
        Node node = unless
            ? builder.onUnless(predicate, statements, consequent)
            : builder.onIf(predicate, statements, consequent);
        advance();
        return node;
    }

    private Node parseIfTail() {
        if (checkKeyword("elsif")) {
            advance();
            Node predicate = parseExpr();
            parseThen();
            Statements statements = parseStatements();
            Node consequent = parseIfTail();
            if (!checkKeyword("end")) {
                throw unexpected("Expected 'end'");
            }
            return builder.onElsif(predicate, statements, consequent);
        }
        if (checkKeyword("else")) {
            return parseElse();
        }
        return null;
    }

    private Node parseElse() {
        advance();
        Statements statements = parseStatements();
        if (!checkKeyword("end")) {
            throw unexpected("Expected 'end'");
        }
        return builder.onElse(statements);
    }

    private void parseThen() {
        if (checkKeyword("then")) {
            advance();
            return;
        }
        requireTerm();
        if (checkKeyword("then")) {
            advance();
        }
    }

    private void requireTerm() {
        if (!check(TokenType.NEWLINE) && !check(TokenType.SEMICOLON)) {
            throw unexpected("Expected newline or ';'");
        }
        skipTerms();
    }

    private Node parseWhile() {
        Token keyword = advance();
        boolean outer = noDo;
        noDo = true;
        Node predicate = parseExpr();
        noDo = outer;
        if (checkKeyword("do")) {
            advance();
        } else {
            requireTerm();
        }
        Statements statements = parseStatements();
        consumeKeyword("end");
        return keyword.value().equals("while")
            ? builder.onWhile(predicate, statements)
            : builder.onUntil(predicate, statements);
    }

    private Node parseFor() {
        advance();
        Node index = parseMlhsItem();
        if (check(TokenType.COMMA)) {
            List<Node> parts = new ArrayList<>();
            parts.add(index);
            while (match(TokenType.COMMA)) {
                parts.add(parseMlhsItem());
            }
            index = builder.onMLHS(parts, false, null);
        }
        consumeKeyword("in");
        boolean outer = noDo;
        noDo = true;
        Node collection = parseExpr();
        noDo = outer;
        if (checkKeyword("do")) {
            advance();
        } else {
            requireTerm();
        }
        Statements statements = parseStatements();
        consumeKeyword("end");
        return builder.onFor(index, collection, statements);
    }

    private Node parseCase() {
        advance();
        boolean subjectless = check(TokenType.NEWLINE) || check(TokenType.SEMICOLON)
            || checkKeyword("when") || checkKeyword("in");
        Node value = subjectless ? null : parseExpr();
        skipTerms();
        Node consequent;
        if (checkKeyword("when")) {
            consequent = parseWhen();
        } else if (checkKeyword("in")) {
            consequent = parseIn();
        } else {
            throw unexpected("Expected 'when' or 'in'");
        }
        consumeKeyword("end");
        return builder.onCase(value, consequent);
    }

    private Node parseWhen() {
        advance();
        Args arguments = parseArgList(null, false);
        parseThen();
        Statements statements = parseStatements();
        Node consequent = null;
        if (checkKeyword("when")) {
            consequent = parseWhen();
        } else if (checkKeyword("else")) {
            consequent = parseElse();
        } else if (!checkKeyword("end")) {
            throw unexpected("Expected 'end'");
        }
        return builder.onWhen(arguments, statements, consequent);
    }

    private Node parseIn() {
        advance();
        Node pattern = parsePatternTop();
        if (checkKeyword("if")) {
            advance();
            pattern = builder.onIfMod(parseExpr(), pattern);
        } else if (checkKeyword("unless")) {
            advance();
            pattern = builder.onUnlessMod(parseExpr(), pattern);
        }
        parseThen();
        Statements statements = parseStatements();
        Node consequent = null;
        if (checkKeyword("in")) {
            consequent = parseIn();
        } else if (checkKeyword("else")) {
            consequent = parseElse();
        } else if (!checkKeyword("end")) {
            throw unexpected("Expected 'end'");
        }
        return builder.onIn(pattern, statements, consequent);
    }

    private Node parseBegin() {
        advance();
        BodyStmt bodystmt = parseBodyStmt();
        consumeKeyword("end");
        return builder.onBegin(bodystmt);
    }

    private BodyStmt parseBodyStmt() {
        Statements statements = parseStatements();

        List<PendingRescue> rescues = new ArrayList<>();
        while (checkKeyword("rescue")) {
            advance();
            Node exceptions = null;
            if (!check(TokenType.NEWLINE) && !check(TokenType.SEMICOLON) && !checkKeyword("then") && !checkOp("=>")) {
                List<Node> parts = parseArgList(null, false).parts();
                exceptions = parts.size() == 1 && !(parts.get(0) instanceof ArgStar)
                    ? parts.get(0)
                    : builder.onMRHS(parts);
            }
            Node variable = null;
            if (checkOp("=>")) {
                advance();
                variable = toTarget(parseMlhsPrimary());
            }
            RescueEx exception = exceptions != null || variable != null
                ? builder.onRescueEx(exceptions, variable)
                : null;
            if (checkKeyword("then")) {
                advance();
            }
            rescues.add(new PendingRescue(exception, parseStatements()));
        }
        Rescue rescue = null;
        for (int i = rescues.size() - 1; i >= 0; i--) {
            rescue = builder.onRescue(rescues.get(i).exception(), rescues.get(i).statements(), rescue);
        }

        Statements elseClause = null;
        if (checkKeyword("else")) {
            advance();
            elseClause = parseStatements();
        }
        Ensure ensure = null;
        if (checkKeyword("ensure")) {
            advance();
            Statements ensureStatements = parseStatements();
            if (!checkKeyword("end")) {
                throw unexpected("Expected 'end'");
            }
            ensure = builder.onEnsure(ensureStatements);
        }
        return builder.onBodyStmt(statements, rescue, elseClause, ensure);
    }

    private Node parseJump() {
        Token keyword = advance();
        Args arguments = canStartExpression(peek()) ? parseArgList(null, true) : null;
        return builder.onJump(keyword, arguments);
    }

    private Node parseYield(boolean allowCommand) {
        Token keyword = advance();
        if (check(TokenType.LPAREN_CALL)) {
            return builder.onYield(keyword, parseParenArgs());
        }
        if (allowCommand && canStartCommandArgs(peek())) {
            return builder.onYield(keyword, parseCommandArgs());
        }
        return builder.onYield(keyword, null);
    }

    private Node parseSuper(boolean allowCommand) {
        Token keyword = advance();
        if (check(TokenType.LPAREN_CALL)) {
            return builder.onSuper(keyword, parseParenArgs());
        }
        if (allowCommand && canStartCommandArgs(peek())) {
            Node node = builder.onSuper(keyword, parseCommandArgs());
            BlockNode block = parseCommandBlock();
            return block == null ? node : builder.onMethodAddBlock(node, block);
        }
        return builder.onZSuper(keyword);
    }

    // ========================================================================
    // Patterns
    // ========================================================================

    private Node parsePatternTop() {
        boolean outer = noPipe;
        noPipe = true;
        Node pattern;
        Token token = peek();
        if (token.type() == TokenType.LABEL || token.type() == TokenType.DSTAR) {
            pattern = parseHashPatternBody(null, null);
        } else {
            List<Node> items = new ArrayList<>();
            List<Integer> splats = new ArrayList<>();
            addPatternItem(items, splats);
            if (check(TokenType.COMMA) || !splats.isEmpty()) {
                while (check(TokenType.COMMA)) {
                    advance();
                    if (!isPatternValueStart(peek())) {
                        break;
                    }
                    addPatternItem(items, splats);
                }
                pattern = buildArrayPattern(null, items, splats, null);
            } else {
                pattern = items.get(0);
            }
        }
        noPipe = outer;
        return pattern;
    }

    private void addPatternItem(List<Node> items, List<Integer> splats) {
        if (check(TokenType.STAR)) {
            splats.add(items.size());
            items.add(parsePatternSplat());
        } else {
            items.add(parsePattern());
        }
    }

    private Node parsePattern() {
        Node left = parsePatternPrimary();
        while (checkOp("|")) {
            advance();
            skipNewlines();
            Node right = parsePatternPrimary();
            left = builder.onBinary(left, "|", right);
        }
        if (checkOp("=>")) {
            advance();
            Token name = consume(TokenType.IDENTIFIER, "Expected binding name");
            declare(name.value());
            left = builder.onBinary(left, "=>", builder.onVarField(builder.ident(name)));
        }
        return left;
    }

    private Node parsePatternPrimary() {
        Token token = peek();
        switch (token.type()) {
            case LBRACKET -> {
                advance();
                return parseArrayPatternBody(null, TokenType.RBRACKET);
            }
            case LBRACE -> {
                advance();
                return parseHashPatternBody(null, TokenType.RBRACE);
            }
            case LPAREN -> {
                advance();
                skipNewlines();
                Node inner = parsePattern();
                skipNewlines();
                consume(TokenType.RPAREN, "Expected ')'");
                return builder.onParen(inner);
            }
            case IDENTIFIER -> {
                advance();
                declare(token.value());
                return builder.onVarField(builder.ident(token));
            }
            case CONSTANT, COLON3 -> {
                Node constant = parsePatternConstant();
                if (check(TokenType.LPAREN_CALL)) {
                    advance();
                    return parseConstantPattern(constant, TokenType.RPAREN);
                }
                if (check(TokenType.LBRACKET_INDEX)) {
                    advance();
                    return parseConstantPattern(constant, TokenType.RBRACKET);
                }
                if (checkOp("..") || checkOp("...")) {
                    Token operator = advance();
                    Node right = canStartExpression(peek()) ? parseArg(BP_RANGE + 1, false) : null;
                    return builder.onRange(constant, builder.operator(operator), right);
                }
                return constant;
            }
            case OP -> {
                if (token.value().equals("^")) {
                    return parsePin();
                }
            }
            default -> {
                // value pattern
            }
        }
        return parseArg(BP_RANGE, false);
    }

    private Node parsePin() {
        Token caret = advance();
        if (check(TokenType.LPAREN)) {
            advance();
            Flags saved = resetFlags();
            Node statement = parseExpr();
            consume(TokenType.RPAREN, "Expected ')'");
            restoreFlags(saved);
            return builder.onPinnedBegin(caret, statement);
        }
        Token variable = advance();
        return switch (variable.type()) {
            case IDENTIFIER, IVAR, CVAR, GVAR -> builder.onPinnedVarRef(caret, builder.onVarRef(builder.leaf(variable)));
            default -> throw new ExpectedTokenException("Expected variable after '^'", variable, columnOf(variable));
        };
    }

    private Node parsePatternConstant() {
        Token token = advance();
        Node node;
        if (token.type() == TokenType.COLON3) {
            Token name = consume(TokenType.CONSTANT, "Expected constant after '::'");
            node = builder.onTopConstRef(token, (Const) builder.leaf(name));
        } else {
            node = builder.onVarRef(builder.leaf(token));
        }
        while (check(TokenType.COLON2)) {
            Token colons = advance();
            Token name = consume(TokenType.CONSTANT, "Expected constant after '::'");
            node = builder.onConstPathRef(node, (Const) builder.leaf(name), colons);
        }
        return node;
    }

    private Node parseConstantPattern(Node constant, TokenType closing) {
        skipNewlines();
        if (check(TokenType.LABEL) || check(TokenType.DSTAR)) {
            return parseHashPatternBody(constant, closing);
        }
        return parseArrayPatternBody(constant, closing);
    }

    private Node parsePatternSplat() {
        Token star = advance();
        Node name = null;
        if (check(TokenType.IDENTIFIER)) {
            Token id = advance();
            declare(id.value());
            name = builder.ident(id);
        }
        return builder.onSplatField(star, name);
    }

    private Node parseArrayPatternBody(Node constant, TokenType closing) {
        List<Node> items = new ArrayList<>();
        List<Integer> splats = new ArrayList<>();
        while (true) {
            skipNewlines();
            if (check(closing)) {
                break;
            }
            addPatternItem(items, splats);
            skipNewlines();
            if (!match(TokenType.COMMA)) {
                break;
            }
        }
        skipNewlines();
        consume(closing, closing == TokenType.RPAREN ? "Expected ')'" : "Expected ']'");
        return buildArrayPattern(constant, items, splats, closing);
    }

    private Node buildArrayPattern(Node constant, List<Node> items, List<Integer> splats, TokenType closing) {
        if (splats.size() >= 2) {
            int first = splats.get(0);
            int last = splats.get(splats.size() - 1);
            return builder.onFndPtn(constant, (VarField) items.get(first),
                new ArrayList<>(items.subList(first + 1, last)), (VarField) items.get(last), closing);
        }
        if (splats.size() == 1) {
            int index = splats.get(0);
            return builder.onAryPtn(constant, new ArrayList<>(items.subList(0, index)), (VarField) items.get(index),
                new ArrayList<>(items.subList(index + 1, items.size())), closing);
        }
        return builder.onAryPtn(constant, items, null, new ArrayList<>(), closing);
    }

    private Node parseHashPatternBody(Node constant, TokenType closing) {
        List<HshPtn.Entry> keys = new ArrayList<>();
        Node keywordRest = null;
        while (true) {
            if (closing != null) {
                skipNewlines();
                if (check(closing)) {
                    break;
                }
            }
            Token token = peek();
            if (token.type() == TokenType.DSTAR) {
                advance();
                Node name = null;
                if (check(TokenType.IDENTIFIER)) {
                    Token id = advance();
                    declare(id.value());
                    name = builder.ident(id);
                } else if (checkKeyword("nil")) {
                    name = builder.keyword(advance());
                }
                keywordRest = builder.onSplatField(token, name);
            } else if (token.type() == TokenType.LABEL || token.type() == TokenType.TSTRING_BEG) {
                Node key;
                if (token.type() == TokenType.LABEL) {
                    advance();
                    key = builder.leaf(token);
                } else {
                    key = parseString();
                }
                Node value = null;
                if (isPatternValueStart(peek())) {
                    value = parsePattern();
                } else if (key instanceof Label label) {
                    declare(label.value().substring(0, label.value().length() - 1));
                }
                keys.add(new HshPtn.Entry(key, value));
            } else {
                throw unexpected("Expected hash pattern key");
            }
            if (!check(TokenType.COMMA)) {
                break;
            }
            advance();
        }
        if (closing != null) {
            skipNewlines();
            consume(closing, closing == TokenType.RBRACE ? "Expected '}'" : "Expected ')'");
        }
        return builder.onHshPtn(constant, keys, keywordRest, closing);
    }

    private boolean isPatternValueStart(Token token) {
        return switch (token.type()) {
            case COMMA, NEWLINE, SEMICOLON, RPAREN, RBRACKET, RBRACE, EOF -> false;
            case KEYWORD -> !Set.of("then", "if", "unless", "and", "or").contains(token.value());
            case OP -> !token.value().equals("|") && !token.value().equals("=>");
            default -> true;
        };
    }

    // ========================================================================
    // Local variables
    // ========================================================================

    private boolean isLocal(String name) {
        for (Scope scope : scopes) {
            if (scope.names.contains(name)) {
                return true;
            }
            if (scope.hard) {
                return false;
            }
        }
        return false;
    }

    private void declare(String name) {
        scopes.peek().names.add(name);
    }

    private void pushScope(boolean hard) {
        scopes.push(new Scope(hard));
    }

    private void popScope() {
        scopes.pop();
    }

    private Flags resetFlags() {
        Flags saved = new Flags(noDo, commandArgs, noPipe, inArguments);
        noDo = false;
        commandArgs = false;
        noPipe = false;
        inArguments = false;
        return saved;
    }

    private void restoreFlags(Flags saved) {
        noDo = saved.noDo();
        commandArgs = saved.commandArgs();
        noPipe = saved.noPipe();
        inArguments = saved.inArguments();
    }

    // ========================================================================
    // Token helpers
    // ========================================================================

    private Token peek() {
        return peekAt(0);
    }

    private Token peekAt(int offset) {
        while (lookahead.size() <= offset) {
            Token token = lexer.next();
            if (builder.onToken(token)) {
                lookahead.add(token);
            }
        }
        return lookahead.get(offset);
    }

    private Token advance() {
        Token token = peek();
        if (token.type() != TokenType.EOF) {
            lookahead.remove(0);
        }
        previous = token;
        return token;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean checkKeyword(String keyword) {
        return peek().isKeyword(keyword);
    }

    private boolean checkOp(String op) {
        return peek().isOp(op);
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw unexpected(message);
    }

    private Token consumeKeyword(String keyword) {
        if (checkKeyword(keyword)) {
            return advance();
        }
        throw unexpected("Expected '" + keyword + "'");
    }

    private Token consumeOp(String op, String message) {
        if (checkOp(op)) {
            return advance();
        }
        throw unexpected(message);
    }

    private void skipNewlines() {
        while (check(TokenType.NEWLINE)) {
            advance();
        }
    }

    private void skipTerms() {
        while (check(TokenType.NEWLINE) || check(TokenType.SEMICOLON)) {
            advance();
        }
    }

    private Location here() {
        return previous == null ? Location.fixed(1, 0) : builder.endOf(previous);
    }

    private int columnOf(Token token) {
        return state.lineIndex().column(builder.locationOf(token).startChar());
    }

    private ParseException unexpected(String message) {
        Token token = peek();
        return new ExpectedTokenException(message, token, columnOf(token));
    }
}
