package com.rbparser;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Ruby tokenizer over the UTF-8 bytes of the source. Tracks enough of Ruby's
 * lexer state to tell apart the meanings of ambiguous characters (unary or
 * binary operators, regexp or division, array or index, hash or block braces,
 * labels, symbols and ternaries, heredocs or shifts).
 *
 * <p>Heredoc bodies are lexed as soon as their opener is seen. Lexing then
 * resumes right after the opener and skips the consumed body when it reaches
 * the end of the opener's line.
 */
public class Lexer {

    private enum State {
        BEG,    // beginning of an expression
        MID,    // after return, break, next, rescue: an expression may follow, newline ends it
        END,    // after a complete operand
        ARG,    // after a method name: the next token may start an argument
        ENDFN,  // after a method name in a definition
        FNAME,  // where a method name is expected
        DOT,    // after a call operator
        CLASS   // after the class keyword
    }

    private enum Kind {
        STRING, XSTRING, SYMBOL, REGEXP, WORDS, QWORDS, SYMBOLS, QSYMBOLS;

        boolean words() {
            return this == WORDS || this == QWORDS || this == SYMBOLS || this == QSYMBOLS;
        }
    }

    private abstract static class Mode {
        boolean embVar;
    }

    private static final class Interpolation extends Mode {
        int braces;
    }

    private static final class StringMode extends Mode {
        final Kind kind;
        final int open;
        final int close;
        final boolean interpolate;
        final boolean labelable;
        int nesting;

        StringMode(Kind kind, int open, int close, boolean interpolate, boolean labelable) {
            this.kind = kind;
            this.open = open;
            this.close = close;
            this.interpolate = interpolate;
            this.labelable = labelable;
        }
    }

    private static final class HeredocMode extends Mode {
        final byte[] id;
        final boolean indented;
        final boolean interpolate;
        final int resume;
        boolean lineStart = true;

        HeredocMode(byte[] id, boolean indented, boolean interpolate, int resume) {
            this.id = id;
            this.indented = indented;
            this.interpolate = interpolate;
            this.resume = resume;
        }
    }

    private static final Set<String> KEYWORDS = Set.of(
        "BEGIN", "END", "alias", "and", "begin", "break", "case", "class", "def", "defined?", "do",
        "else", "elsif", "end", "ensure", "false", "for", "if", "in", "module", "next", "nil", "not",
        "or", "redo", "rescue", "retry", "return", "self", "super", "then", "true", "undef", "unless",
        "until", "when", "while", "yield", "__FILE__", "__LINE__", "__ENCODING__");

    // Operator method names, longest first
    private static final String[] METHOD_OPERATORS = {
        "[]=", "===", "<=>", "[]", "==", "=~", "!~", "!=", "**", "<=", ">=", "<<", ">>",
        "+@", "-@", "!@", "~@", "+", "-", "*", "/", "%", "<", ">", "!", "~", "&", "|", "^"
    };

    private final byte[] src;
    private final int length;
    private final int[] lineStarts;
    private final Predicate<String> locals;

    private int pos;
    private State state = State.BEG;
    private boolean labelOk;
    private boolean spaceSeen;
    private int parenDepth;
    private final Deque<Integer> lambdaDepths = new ArrayDeque<>();
    private final Deque<Mode> modes = new ArrayDeque<>();
    private int heredocResume = -1;
    private int fnameCount;
    private boolean undefList;
    private boolean defNamePending;
    private boolean afterDefName;

    public Lexer(String source, Predicate<String> locals) {
        this.src = source.getBytes(StandardCharsets.UTF_8);
        this.length = src.length;
        this.locals = locals;
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < length; i++) {
            if (src[i] == '\n') {
                starts.add(i + 1);
            }
        }
        this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
    }

    public Lexer(String source) {
        this(source, name -> false);
    }

    /**
     * Tokenizes a whole source without local variable knowledge.
     */
    public static List<Token> tokenize(String source) {
        Lexer lexer = new Lexer(source);
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = lexer.next();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        return tokens;
    }

    public Token next() {
        Mode mode = modes.peek();
        if (mode instanceof HeredocMode heredoc) {
            return heredoc(heredoc);
        }
        if (mode instanceof StringMode string) {
            return string(string);
        }
        return code();
    }

    // ========================================================================
    // Code
    // ========================================================================

    private Token code() {
        spaceSeen = false;
        while (true) {
            if (pos >= length) {
                return eof();
            }
            int c = at(pos);
            switch (c) {
                case ' ', '\t', '\f', '\r', 0x0b -> {
                    pos++;
                    spaceSeen = true;
                }
                case '\\' -> {
                    int next = at(pos + 1) == '\r' ? at(pos + 2) : at(pos + 1);
                    if (next != '\n') {
                        throw error("unexpected backslash", pos);
                    }
                    pos = indexOf('\n', pos) + 1;
                    skipHeredocBodies();
                    spaceSeen = true;
                }
                case '\n' -> {
                    Token newline = newline();
                    if (newline != null) {
                        return newline;
                    }
                }
                case '#' -> {
                    return comment();
                }
                default -> {
                    if (atLineStart() && startsWith(pos, "=begin") && isBlankOrEnd(at(pos + 6))) {
                        return embdoc();
                    }
                    if (atLineStart() && modes.isEmpty() && startsWith(pos, "__END__")
                            && (pos + 7 == length || at(pos + 7) == '\n' || at(pos + 7) == '\r')) {
                        Token token = token(TokenType.END_CONTENT, pos, length);
                        pos = length;
                        return token;
                    }
                    return codeToken();
                }
            }
        }
    }

    private Token eof() {
        if (!modes.isEmpty()) {
            throw error(modes.peek() instanceof Interpolation
                ? "unterminated interpolation meets end of file"
                : "unterminated string meets end of file", length);
        }
        return token(TokenType.EOF, "", length);
    }

    private Token newline() {
        int start = pos;
        pos++;
        skipHeredocBodies();
        if (state == State.BEG || state == State.FNAME || state == State.DOT || state == State.CLASS
                || continuesOnNextLine()) {
            spaceSeen = true;
            return null;
        }
        Token token = token(TokenType.NEWLINE, "\n", start);
        state = State.BEG;
        labelOk = false;
        undefList = false;
        fnameCount = 0;
        return token;
    }

    private void skipHeredocBodies() {
        if (heredocResume >= 0) {
            pos = heredocResume;
            heredocResume = -1;
        }
    }

    /**
     * A line that starts with {@code .method} or {@code &.method} continues the
     * expression on the previous line. Comment lines may sit in between.
     */
    private boolean continuesOnNextLine() {
        int p = pos;
        while (p < length) {
            int c = at(p);
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
                p++;
            } else if (c == '#') {
                int newline = indexOf('\n', p);
                p = newline < 0 ? length : newline;
            } else {
                break;
            }
        }
        return (at(p) == '.' && at(p + 1) != '.') || (at(p) == '&' && at(p + 1) == '.');
    }

    private Token comment() {
        int start = pos;
        int end = indexOf('\n', pos);
        if (end < 0) {
            end = length;
        }
        pos = end;
        if (end > start && at(end - 1) == '\r') {
            end--;
        }
        return token(TokenType.COMMENT, start, end);
    }

    private Token embdoc() {
        int start = pos;
        int p = pos;
        while (true) {
            int newline = indexOf('\n', p);
            if (newline < 0) {
                throw error("embedded document meets end of file", start);
            }
            p = newline + 1;
            if (startsWith(p, "=end") && isBlankOrEnd(at(p + 4))) {
                int end = indexOf('\n', p);
                if (end < 0) {
                    end = length;
                }
                pos = end;
                if (at(end - 1) == '\r') {
                    end--;
                }
                return token(TokenType.EMBDOC, start, end);
            }
        }
    }

    private Token codeToken() {
        boolean defTarget = afterDefName;
        afterDefName = false;
        if (defNamePending) {
            defNamePending = false;
            afterDefName = true;
        }

        int start = pos;
        int c = at(pos);

        if (state == State.FNAME && "[]=<>!~+-*/%&|^".indexOf(c) >= 0) {
            for (String operator : METHOD_OPERATORS) {
                if (startsWith(pos, operator)) {
                    pos += operator.length();
                    return methodName(TokenType.OP, start);
                }
            }
        }
        if (isIdentStart(c)) {
            return identifier();
        }
        if (isDigit(c)) {
            return number(start);
        }

        switch (c) {
            case '"' -> {
                return beginString(TokenType.TSTRING_BEG, Kind.STRING, 1, '"', true, true);
            }
            case '\'' -> {
                return beginString(TokenType.TSTRING_BEG, Kind.STRING, 1, '\'', false, true);
            }
            case '`' -> {
                if (state == State.FNAME || state == State.DOT) {
                    pos++;
                    return methodName(TokenType.BACKTICK, start);
                }
                return beginString(TokenType.XSTRING_BEG, Kind.XSTRING, 1, '`', true, false);
            }
            case '@' -> {
                return instanceVariable();
            }
            case '$' -> {
                return globalVariable();
            }
            case '(' -> {
                TokenType type;
                if (beginning()) {
                    type = TokenType.LPAREN;
                } else if (state == State.ARG && spaceSeen) {
                    type = TokenType.LPAREN_ARG;
                } else {
                    type = TokenType.LPAREN_CALL;
                }
                pos++;
                parenDepth++;
                return after(token(type, start, pos), State.BEG, true);
            }
            case ')' -> {
                pos++;
                parenDepth--;
                return after(token(TokenType.RPAREN, start, pos), State.END, false);
            }
            case '[' -> {
                TokenType type = beginning() || (state == State.ARG && spaceSeen)
                    ? TokenType.LBRACKET
                    : TokenType.LBRACKET_INDEX;
                pos++;
                parenDepth++;
                return after(token(type, start, pos), State.BEG, true);
            }
            case ']' -> {
                pos++;
                parenDepth--;
                return after(token(TokenType.RBRACKET, start, pos), State.END, false);
            }
            case '{' -> {
                return leftBrace(start);
            }
            case '}' -> {
                return rightBrace(start);
            }
            case ',' -> {
                pos++;
                Token token = after(token(TokenType.COMMA, start, pos), State.BEG, true);
                if (undefList) {
                    state = State.FNAME;
                    fnameCount = 1;
                }
                return token;
            }
            case ';' -> {
                pos++;
                undefList = false;
                fnameCount = 0;
                return after(token(TokenType.SEMICOLON, start, pos), State.BEG, false);
            }
            case '.' -> {
                if (at(pos + 1) == '.') {
                    pos += at(pos + 2) == '.' ? 3 : 2;
                    return after(token(TokenType.OP, start, pos), State.BEG, false);
                }
                pos++;
                return after(token(TokenType.PERIOD, start, pos), defTarget ? State.FNAME : State.DOT, false);
            }
            case ':' -> {
                return colon(start);
            }
            case '?' -> {
                return questionMark(start);
            }
            case '&' -> {
                if (startsWith(pos, "&&=")) {
                    return operator(start, 3);
                }
                if (startsWith(pos, "&&")) {
                    return operator(start, 2);
                }
                if (startsWith(pos, "&=")) {
                    return operator(start, 2);
                }
                if (startsWith(pos, "&.")) {
                    pos += 2;
                    return after(token(TokenType.PERIOD, start, pos), State.DOT, false);
                }
                TokenType type = prefixPosition(1) ? TokenType.AMPER : TokenType.OP;
                pos++;
                return after(token(type, start, pos), State.BEG, false);
            }
            case '*' -> {
                if (startsWith(pos, "**=")) {
                    return operator(start, 3);
                }
                if (startsWith(pos, "**")) {
                    TokenType type = prefixPosition(2) ? TokenType.DSTAR : TokenType.OP;
                    pos += 2;
                    return after(token(type, start, pos), State.BEG, false);
                }
                if (startsWith(pos, "*=")) {
                    return operator(start, 2);
                }
                TokenType type = prefixPosition(1) ? TokenType.STAR : TokenType.OP;
                pos++;
                return after(token(type, start, pos), State.BEG, false);
            }
            case '-' -> {
                if (at(pos + 1) == '>') {
                    pos += 2;
                    lambdaDepths.push(parenDepth);
                    return after(token(TokenType.TLAMBDA, start, pos), State.ENDFN, false);
                }
                if (at(pos + 1) == '=') {
                    return operator(start, 2);
                }
                if (prefixPosition(1)) {
                    pos++;
                    if (isDigit(at(pos))) {
                        return number(start);
                    }
                    return after(token(TokenType.UMINUS, start, pos), State.BEG, false);
                }
                return operator(start, 1);
            }
            case '+' -> {
                if (at(pos + 1) == '=') {
                    return operator(start, 2);
                }
                if (prefixPosition(1)) {
                    pos++;
                    if (isDigit(at(pos))) {
                        return number(start);
                    }
                    return after(token(TokenType.UPLUS, start, pos), State.BEG, false);
                }
                return operator(start, 1);
            }
            case '!' -> {
                return operator(start, at(pos + 1) == '=' || at(pos + 1) == '~' ? 2 : 1);
            }
            case '~' -> {
                return operator(start, 1);
            }
            case '=' -> {
                if (startsWith(pos, "===")) {
                    return operator(start, 3);
                }
                if (startsWith(pos, "==") || startsWith(pos, "=~") || startsWith(pos, "=>")) {
                    return operator(start, 2);
                }
                return operator(start, 1);
            }
            case '<' -> {
                if (at(pos + 1) == '<' && heredocPosition()) {
                    Token heredoc = heredocBegin(start);
                    if (heredoc != null) {
                        return heredoc;
                    }
                }
                if (startsWith(pos, "<=>") || startsWith(pos, "<<=")) {
                    return operator(start, 3);
                }
                if (startsWith(pos, "<=") || startsWith(pos, "<<")) {
                    return operator(start, 2);
                }
                return operator(start, 1);
            }
            case '>' -> {
                if (startsWith(pos, ">>=")) {
                    return operator(start, 3);
                }
                if (startsWith(pos, ">=") || startsWith(pos, ">>")) {
                    return operator(start, 2);
                }
                return operator(start, 1);
            }
            case '|' -> {
                int size = startsWith(pos, "||=") ? 3 : startsWith(pos, "||") || startsWith(pos, "|=") ? 2 : 1;
                pos += size;
                return after(token(TokenType.OP, start, pos), State.BEG, true);
            }
            case '^' -> {
                return operator(start, at(pos + 1) == '=' ? 2 : 1);
            }
            case '/' -> {
                if (regexpPosition()) {
                    return beginString(TokenType.REGEXP_BEG, Kind.REGEXP, 1, '/', true, false);
                }
                return operator(start, at(pos + 1) == '=' ? 2 : 1);
            }
            case '%' -> {
                Token literal = percentLiteral(start);
                if (literal != null) {
                    return literal;
                }
                return operator(start, at(pos + 1) == '=' ? 2 : 1);
            }
            default -> throw error("unexpected character '" + (char) c + "'", pos);
        }
    }

    private Token operator(int start, int size) {
        pos += size;
        if (state == State.FNAME || state == State.DOT) {
            return methodName(TokenType.OP, start);
        }
        return after(token(TokenType.OP, start, pos), State.BEG, false);
    }

    private Token methodName(TokenType type, int start) {
        Token token = token(type, start, pos);
        State next = state == State.DOT ? State.ARG : State.ENDFN;
        after(token, next, false);
        countName();
        return token;
    }

    private void countName() {
        if (fnameCount > 0) {
            fnameCount--;
            if (fnameCount > 0) {
                state = State.FNAME;
            }
        }
    }

    private Token after(Token token, State next, boolean label) {
        state = next;
        labelOk = label;
        return token;
    }

    private boolean beginning() {
        return state == State.BEG || state == State.MID || state == State.CLASS;
    }

    /**
     * Whether an operator character here starts an operand (splat, block pass,
     * unary minus) rather than being a binary operator: at the start of an
     * expression, or after a method name, separated from it by a space but not
     * followed by one.
     */
    private boolean prefixPosition(int size) {
        return beginning() || (state == State.ARG && spaceSeen && !isSpace(at(pos + size)));
    }

    private boolean regexpPosition() {
        if (beginning()) {
            return true;
        }
        return state == State.ARG && spaceSeen && !isSpace(at(pos + 1)) && at(pos + 1) != '=';
    }

    private boolean heredocPosition() {
        if (state == State.END || state == State.ENDFN || state == State.CLASS
                || state == State.DOT || state == State.FNAME) {
            return false;
        }
        return state != State.ARG || spaceSeen;
    }

    // ========================================================================
    // Braces
    // ========================================================================

    private Token leftBrace(int start) {
        pos++;
        if (modes.peek() instanceof Interpolation interpolation) {
            interpolation.braces++;
        }
        TokenType type;
        if (!lambdaDepths.isEmpty() && lambdaDepths.peek() == parenDepth) {
            lambdaDepths.pop();
            type = TokenType.TLAMBEG;
        } else if (state == State.ARG || state == State.END || state == State.ENDFN) {
            type = TokenType.LBRACE_BLOCK;
        } else {
            type = TokenType.LBRACE;
        }
        parenDepth++;
        return after(token(type, start, pos), State.BEG, type == TokenType.LBRACE);
    }

    private Token rightBrace(int start) {
        pos++;
        if (modes.peek() instanceof Interpolation interpolation) {
            if (interpolation.braces == 0) {
                modes.pop();
                return after(token(TokenType.EMBEXPR_END, start, pos), State.END, false);
            }
            interpolation.braces--;
        }
        parenDepth--;
        return after(token(TokenType.RBRACE, start, pos), State.END, false);
    }

    // ========================================================================
    // Names and numbers
    // ========================================================================

    private Token identifier() {
        int start = pos;
        while (pos < length && isIdentChar(at(pos))) {
            pos++;
        }
        int c = at(pos);
        if ((c == '?' || c == '!') && (at(pos + 1) != '=' || at(pos + 2) == '=' || at(pos + 2) == '~')
                && !(c == '?' && state != State.DOT && isLocal(text(start, pos)))) {
            pos++;
        } else if (state == State.FNAME && c == '=' && at(pos + 1) != '=' && at(pos + 1) != '~'
                && at(pos + 1) != '>') {
            pos++;
        }
        String name = text(start, pos);

        // Labels: name: (but not name::)
        if (labelOk && state != State.DOT && state != State.FNAME
                && at(pos) == ':' && at(pos + 1) != ':') {
            pos++;
            return after(token(TokenType.LABEL, start, pos), State.BEG, false);
        }

        if (state == State.FNAME) {
            TokenType type = KEYWORDS.contains(name) ? TokenType.KEYWORD
                : isConstant(name) ? TokenType.CONSTANT : TokenType.IDENTIFIER;
            Token token = after(token(type, start, pos), State.ENDFN, false);
            countName();
            return token;
        }
        if (state == State.DOT) {
            TokenType type = isConstant(name) ? TokenType.CONSTANT : TokenType.IDENTIFIER;
            return after(token(type, start, pos), State.ARG, true);
        }
        if (KEYWORDS.contains(name)) {
            return keyword(name, start);
        }
        if (isConstant(name)) {
            return after(token(TokenType.CONSTANT, start, pos), State.ARG, true);
        }
        if (isLocal(name)) {
            return after(token(TokenType.IDENTIFIER, start, pos), State.END, false);
        }
        return after(token(TokenType.IDENTIFIER, start, pos), State.ARG, true);
    }

    private boolean isLocal(String name) {
        return locals.test(name);
    }

    private Token keyword(String name, int start) {
        Token token = token(TokenType.KEYWORD, start, pos);
        switch (name) {
            case "def" -> {
                defNamePending = true;
                return after(token, State.FNAME, false);
            }
            case "alias" -> {
                fnameCount = 2;
                return after(token, State.FNAME, false);
            }
            case "undef" -> {
                fnameCount = 1;
                undefList = true;
                return after(token, State.FNAME, false);
            }
            case "class" -> {
                return after(token, State.CLASS, false);
            }
            case "self", "nil", "true", "false", "__FILE__", "__LINE__", "__ENCODING__", "end", "redo", "retry" -> {
                return after(token, State.END, false);
            }
            case "return", "break", "next" -> {
                return after(token, State.MID, true);
            }
            case "rescue" -> {
                return after(token, State.MID, false);
            }
            case "defined?", "not", "super", "yield" -> {
                return after(token, State.ARG, true);
            }
            case "do" -> {
                if (!lambdaDepths.isEmpty() && lambdaDepths.peek() == parenDepth) {
                    lambdaDepths.pop();
                }
                return after(token, State.BEG, false);
            }
            case "in" -> {
                return after(token, State.BEG, true);
            }
            default -> {
                return after(token, State.BEG, false);
            }
        }
    }

    private Token instanceVariable() {
        int start = pos;
        pos += at(pos + 1) == '@' ? 2 : 1;
        if (!isIdentStart(at(pos))) {
            throw error("'@' without identifiers is not allowed as an instance variable name", start);
        }
        while (pos < length && isIdentChar(at(pos))) {
            pos++;
        }
        TokenType type = at(start + 1) == '@' ? TokenType.CVAR : TokenType.IVAR;
        Token token = after(token(type, start, pos), State.END, false);
        countName();
        return token;
    }

    private Token globalVariable() {
        int start = pos;
        pos++;
        int c = at(pos);
        TokenType type = TokenType.GVAR;
        if (isIdentStart(c)) {
            while (pos < length && isIdentChar(at(pos))) {
                pos++;
            }
        } else if (c == '0') {
            pos++;
        } else if (isDigit(c)) {
            while (isDigit(at(pos))) {
                pos++;
            }
            type = TokenType.BACKREF;
        } else if (c == '&' || c == '`' || c == '\'' || c == '+') {
            pos++;
            type = TokenType.BACKREF;
        } else if (c == '-' && isIdentChar(at(pos + 1))) {
            pos += 2;
        } else if (c >= 0 && "~*$?!@/\\;,.=:<>\"".indexOf(c) >= 0) {
            pos++;
        } else {
            throw error("'$' without identifiers is not allowed as a global variable name", start);
        }
        Token token = after(token(type, start, pos), State.END, false);
        countName();
        return token;
    }

    private Token number(int start) {
        TokenType type = TokenType.INTEGER;
        if (at(pos) == '0' && at(pos + 1) > 0 && "xXbBoOdD".indexOf(at(pos + 1)) >= 0) {
            pos += 2;
            while (isHexDigit(at(pos)) || at(pos) == '_') {
                pos++;
            }
        } else {
            skipDigits();
            if (at(pos) == '.' && isDigit(at(pos + 1))) {
                type = TokenType.FLOAT;
                pos++;
                skipDigits();
            }
            if ((at(pos) == 'e' || at(pos) == 'E')
                    && (isDigit(at(pos + 1)) || ((at(pos + 1) == '-' || at(pos + 1) == '+') && isDigit(at(pos + 2))))) {
                type = TokenType.FLOAT;
                pos += 2;
                skipDigits();
            }
        }
        if (at(pos) == 'r' && !isIdentChar(at(pos + 1))) {
            pos++;
            type = TokenType.RATIONAL;
        } else if (at(pos) == 'r' && at(pos + 1) == 'i' && !isIdentChar(at(pos + 2))) {
            pos += 2;
            type = TokenType.IMAGINARY;
        }
        if (at(pos) == 'i' && !isIdentChar(at(pos + 1))) {
            pos++;
            type = TokenType.IMAGINARY;
        }
        return after(token(type, start, pos), State.END, false);
    }

    private void skipDigits() {
        while (isDigit(at(pos)) || (at(pos) == '_' && isDigit(at(pos + 1)))) {
            pos++;
        }
    }

    // ========================================================================
    // Colons and question marks
    // ========================================================================

    private Token colon(int start) {
        if (at(pos + 1) == ':') {
            pos += 2;
            if (beginning() || (state == State.ARG && spaceSeen && !isSpace(at(pos)))) {
                return after(token(TokenType.COLON3, start, pos), State.BEG, false);
            }
            return after(token(TokenType.COLON2, start, pos), State.DOT, false);
        }
        int next = at(pos + 1);
        if (state == State.END || state == State.ENDFN || next < 0 || isSpace(next) || next == '#') {
            pos++;
            return after(token(TokenType.OP, start, pos), State.BEG, false);
        }
        if (next == '"' || next == '\'') {
            pos += 2;
            modes.push(new StringMode(Kind.SYMBOL, 0, next, next == '"', false));
            return token(TokenType.SYMBEG, start, pos);
        }
        pos++;
        return after(token(TokenType.SYMBEG, start, pos), State.FNAME, false);
    }

    private Token questionMark(int start) {
        int next = at(pos + 1);
        boolean ternary = state == State.END || state == State.ENDFN || next < 0 || isSpace(next);
        if (!ternary && isIdentChar(next)) {
            int size = next < 0x80 ? 1 : utf8Length(next);
            ternary = isIdentChar(at(pos + 1 + size));
        }
        if (ternary) {
            pos++;
            return after(token(TokenType.OP, start, pos), State.BEG, false);
        }

        pos++;
        if (at(pos) == '\\') {
            pos++;
            int escaped = at(pos);
            if (escaped == 'u') {
                pos++;
                if (at(pos) == '{') {
                    int close = indexOf('}', pos);
                    pos = close < 0 ? length : close + 1;
                } else {
                    for (int i = 0; i < 4 && isHexDigit(at(pos)); i++) {
                        pos++;
                    }
                }
            } else if (escaped == 'x') {
                pos++;
                for (int i = 0; i < 2 && isHexDigit(at(pos)); i++) {
                    pos++;
                }
            } else if (escaped >= '0' && escaped <= '7') {
                for (int i = 0; i < 3 && at(pos) >= '0' && at(pos) <= '7'; i++) {
                    pos++;
                }
            } else if ((escaped == 'C' || escaped == 'M') && at(pos + 1) == '-') {
                pos += 2;
                pos += at(pos) == '\\' ? 2 : utf8Length(at(pos));
            } else if (escaped == 'c') {
                pos++;
                pos += at(pos) == '\\' ? 2 : utf8Length(at(pos));
            } else {
                pos += utf8Length(escaped);
            }
        } else {
            pos += utf8Length(at(pos));
        }
        return after(token(TokenType.CHAR, start, pos), State.END, false);
    }

    // ========================================================================
    // Strings
    // ========================================================================

    private Token beginString(TokenType type, Kind kind, int size, int close, boolean interpolate, boolean labelable) {
        int start = pos;
        pos += size;
        boolean label = labelable && labelOk && state != State.END;
        modes.push(new StringMode(kind, 0, close, interpolate, label));
        return token(type, start, pos);
    }

    private Token percentLiteral(int start) {
        if (state == State.FNAME || state == State.DOT) {
            return null;
        }
        int next = at(pos + 1);
        boolean literal = beginning() || (state == State.ARG && spaceSeen && !isSpace(next) && next != '=');
        if (!literal || next < 0) {
            return null;
        }

        int type = 'Q';
        int delimiter = next;
        int size = 2;
        if (isAsciiLetter(next)) {
            if ("qQwWiIrsx".indexOf(next) < 0 || at(pos + 2) < 0 || isAlnum(at(pos + 2)) || isSpace(at(pos + 2))) {
                return null;
            }
            type = next;
            delimiter = at(pos + 2);
            size = 3;
        } else if (isDigit(next) || isSpace(next)) {
            return null;
        }

        int close = switch (delimiter) {
            case '(' -> ')';
            case '[' -> ']';
            case '{' -> '}';
            case '<' -> '>';
            default -> delimiter;
        };
        int open = close == delimiter ? 0 : delimiter;

        TokenType tokenType;
        Kind kind;
        boolean interpolate = true;
        switch (type) {
            case 'q' -> {
                tokenType = TokenType.TSTRING_BEG;
                kind = Kind.STRING;
                interpolate = false;
            }
            case 'w' -> {
                tokenType = TokenType.QWORDS_BEG;
                kind = Kind.QWORDS;
                interpolate = false;
            }
            case 'W' -> {
                tokenType = TokenType.WORDS_BEG;
                kind = Kind.WORDS;
            }
            case 'i' -> {
                tokenType = TokenType.QSYMBOLS_BEG;
                kind = Kind.QSYMBOLS;
                interpolate = false;
            }
            case 'I' -> {
                tokenType = TokenType.SYMBOLS_BEG;
                kind = Kind.SYMBOLS;
            }
            case 'r' -> {
                tokenType = TokenType.REGEXP_BEG;
                kind = Kind.REGEXP;
            }
            case 's' -> {
                tokenType = TokenType.SYMBEG;
                kind = Kind.SYMBOL;
                interpolate = false;
            }
            case 'x' -> {
                tokenType = TokenType.XSTRING_BEG;
                kind = Kind.XSTRING;
            }
            default -> {
                tokenType = TokenType.TSTRING_BEG;
                kind = Kind.STRING;
            }
        }
        pos += size;
        modes.push(new StringMode(kind, open, close, interpolate, false));
        return token(tokenType, start, pos);
    }

    private Token string(StringMode mode) {
        if (pos >= length) {
            throw error("unterminated string meets end of file", pos);
        }
        if (mode.embVar) {
            mode.embVar = false;
            return at(pos) == '@' ? instanceVariable() : globalVariable();
        }

        int start = pos;
        int c = at(pos);
        if (mode.kind.words() && isSpace(c)) {
            while (pos < length && isSpace(at(pos))) {
                if (at(pos) == '\n') {
                    pos++;
                    skipHeredocBodies();
                } else {
                    pos++;
                }
            }
            return token(TokenType.WORDS_SEP, start, pos);
        }
        if (c == mode.close && mode.nesting == 0) {
            return endString(mode, start);
        }
        if (mode.interpolate && c == '#') {
            Token interpolation = interpolation(mode, start);
            if (interpolation != null) {
                return interpolation;
            }
        }

        while (pos < length) {
            c = at(pos);
            if (c == '\\') {
                pos += at(pos + 1) < 0 ? 1 : 1 + utf8Length(at(pos + 1));
                continue;
            }
            if (mode.open != 0 && c == mode.open) {
                mode.nesting++;
            } else if (c == mode.close) {
                if (mode.nesting == 0) {
                    break;
                }
                mode.nesting--;
            } else if (mode.interpolate && c == '#' && interpolates(pos)) {
                break;
            } else if (mode.kind.words() && isSpace(c)) {
                break;
            } else if (c == '\n' && heredocResume >= 0) {
                Token token = token(TokenType.TSTRING_CONTENT, start, pos + 1);
                pos++;
                skipHeredocBodies();
                return token;
            }
            pos++;
        }
        if (pos >= length) {
            throw error("unterminated string meets end of file", start);
        }
        return token(TokenType.TSTRING_CONTENT, start, pos);
    }

    private Token endString(StringMode mode, int start) {
        modes.pop();
        pos++;
        if (mode.kind == Kind.REGEXP) {
            while (isAsciiLetter(at(pos))) {
                pos++;
            }
            return after(token(TokenType.REGEXP_END, start, pos), State.END, false);
        }
        if (mode.labelable && at(pos) == ':' && at(pos + 1) != ':') {
            pos++;
            return after(token(TokenType.LABEL_END, start, pos), State.BEG, false);
        }
        return after(token(TokenType.TSTRING_END, start, pos), State.END, false);
    }

    private boolean interpolates(int p) {
        int next = at(p + 1);
        if (next == '{') {
            return true;
        }
        if (next == '@') {
            return isIdentStart(at(p + 2)) || (at(p + 2) == '@' && isIdentStart(at(p + 3)));
        }
        if (next == '$') {
            int c = at(p + 2);
            return isIdentStart(c) || (c >= 0 && "~*$?!@/\\;,.=:<>\"&`'+0123456789".indexOf(c) >= 0);
        }
        return false;
    }

    private Token interpolation(Mode mode, int start) {
        if (!interpolates(pos)) {
            return null;
        }
        if (at(pos + 1) == '{') {
            pos += 2;
            modes.push(new Interpolation());
            return after(token(TokenType.EMBEXPR_BEG, start, pos), State.BEG, false);
        }
        pos++;
        mode.embVar = true;
        return token(TokenType.EMBVAR, start, pos);
    }

    // ========================================================================
    // Heredocs
    // ========================================================================

    private Token heredocBegin(int start) {
        int p = pos + 2;
        boolean indented = false;
        if (at(p) == '~' || at(p) == '-') {
            indented = true;
            p++;
        }
        int quote = at(p);
        int idStart;
        int idEnd;
        int end;
        if (quote == '\'' || quote == '"' || quote == '`') {
            idStart = p + 1;
            int close = idStart;
            while (close < length && at(close) != quote && at(close) != '\n') {
                close++;
            }
            if (at(close) != quote || close == idStart) {
                return null;
            }
            idEnd = close;
            end = close + 1;
        } else {
            if (!isIdentChar(quote)) {
                return null;
            }
            idStart = p;
            idEnd = p;
            while (idEnd < length && isIdentChar(at(idEnd))) {
                idEnd++;
            }
            end = idEnd;
        }

        byte[] id = new byte[idEnd - idStart];
        System.arraycopy(src, idStart, id, 0, id.length);
        pos = end;
        Token token = token(TokenType.HEREDOC_BEG, start, end);

        int bodyStart;
        if (heredocResume >= 0) {
            bodyStart = heredocResume;
        } else {
            int newline = indexOf('\n', pos);
            bodyStart = newline < 0 ? length : newline + 1;
        }
        modes.push(new HeredocMode(id, indented, quote != '\'', end));
        pos = bodyStart;
        heredocResume = -1;
        state = State.END;
        labelOk = false;
        return token;
    }

    private Token heredoc(HeredocMode mode) {
        if (pos >= length) {
            throw error("can't find string \"" + new String(mode.id, StandardCharsets.UTF_8)
                + "\" anywhere before EOF", length);
        }
        if (mode.embVar) {
            mode.embVar = false;
            return at(pos) == '@' ? instanceVariable() : globalVariable();
        }

        int start = pos;
        if (mode.lineStart) {
            int p = pos;
            if (mode.indented) {
                while (at(p) == ' ' || at(p) == '\t') {
                    p++;
                }
            }
            if (matches(p, mode.id)) {
                int idEnd = p + mode.id.length;
                int after = idEnd;
                if (at(after) == '\r') {
                    after++;
                }
                if (after == length || at(after) == '\n') {
                    modes.pop();
                    Token token = token(TokenType.HEREDOC_END, start, idEnd);
                    heredocResume = after == length ? length : after + 1;
                    pos = mode.resume;
                    state = State.END;
                    return token;
                }
            }
        }

        if (mode.interpolate && at(pos) == '#') {
            Token interpolation = interpolation(mode, start);
            if (interpolation != null) {
                mode.lineStart = false;
                return interpolation;
            }
        }

        while (pos < length) {
            int c = at(pos);
            if (c == '\\' && mode.interpolate && at(pos + 1) != '\n') {
                pos += at(pos + 1) < 0 ? 1 : 1 + utf8Length(at(pos + 1));
                continue;
            }
            if (mode.interpolate && c == '#' && interpolates(pos)) {
                break;
            }
            pos++;
            if (c == '\n') {
                break;
            }
        }
        mode.lineStart = at(pos - 1) == '\n';
        Token token = token(TokenType.TSTRING_CONTENT, start, pos);
        if (mode.lineStart) {
            skipHeredocBodies();
        }
        return token;
    }

    private boolean matches(int p, byte[] id) {
        if (p + id.length > length) {
            return false;
        }
        for (int i = 0; i < id.length; i++) {
            if (src[p + i] != id[i]) {
                return false;
            }
        }
        return true;
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private int at(int p) {
        return p >= 0 && p < length ? src[p] & 0xff : -1;
    }

    private boolean startsWith(int p, String text) {
        if (p + text.length() > length) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            if (src[p + i] != text.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    private int indexOf(int c, int from) {
        for (int i = from; i < length; i++) {
            if (src[i] == c) {
                return i;
            }
        }
        return -1;
    }

    private boolean atLineStart() {
        return pos == 0 || src[pos - 1] == '\n';
    }

    private String text(int start, int end) {
        return new String(src, start, end - start, StandardCharsets.UTF_8);
    }

    private int lineOf(int p) {
        int low = 0;
        int high = lineStarts.length - 1;
        while (low < high) {
            int middle = (low + high + 1) / 2;
            if (lineStarts[middle] <= p) {
                low = middle;
            } else {
                high = middle - 1;
            }
        }
        return low + 1;
    }

    private Token token(TokenType type, int start, int end) {
        return token(type, text(start, end), start);
    }

    private Token token(TokenType type, String value, int start) {
        int line = lineOf(start);
        return new Token(type, value, line, start - lineStarts[line - 1], spaceSeen);
    }

    private ParseException error(String message, int p) {
        int line = lineOf(Math.min(p, length));
        int lineStart = lineStarts[line - 1];
        int column = text(lineStart, Math.min(p, length)).length();
        return new ParseException(message, line, column);
    }

    private static boolean isSpace(int c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f' || c == 0x0b;
    }

    private static boolean isBlankOrEnd(int c) {
        return c < 0 || isSpace(c);
    }

    private static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(int c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isAsciiLetter(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isAlnum(int c) {
        return isAsciiLetter(c) || isDigit(c);
    }

    private static boolean isIdentStart(int c) {
        return isAsciiLetter(c) || c == '_' || c >= 0x80;
    }

    private static boolean isIdentChar(int c) {
        return isIdentStart(c) || isDigit(c);
    }

    private static boolean isConstant(String name) {
        char first = name.charAt(0);
        return first >= 'A' && first <= 'Z';
    }

    private static int utf8Length(int lead) {
        if (lead < 0) {
            return 0;
        }
        if (lead < 0x80) {
            return 1;
        }
        if (lead >= 0xf0) {
            return 4;
        }
        if (lead >= 0xe0) {
            return 3;
        }
        return 2;
    }
}
