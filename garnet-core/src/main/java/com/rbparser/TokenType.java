package com.rbparser;

public enum TokenType {
    // Leaves: become nodes directly, never recorded in the ledger
    IDENTIFIER,
    CONSTANT,
    IVAR,
    CVAR,
    GVAR,
    BACKREF,
    INTEGER,
    FLOAT,
    RATIONAL,
    IMAGINARY,
    CHAR,
    LABEL,
    TSTRING_CONTENT,

    KEYWORD,

    // Operators. The lexer resolves ambiguous characters into distinct types
    OP,
    STAR,           // splat: *args
    DSTAR,          // double splat: **opts
    AMPER,          // block pass: &block
    UMINUS,         // unary minus on a non-literal: -x
    UPLUS,          // unary plus on a non-literal: +x
    TLAMBDA,        // ->

    // Punctuation
    COMMA,
    SEMICOLON,
    NEWLINE,
    PERIOD,         // . and &.
    COLON2,         // Foo::Bar
    COLON3,         // ::Foo
    LPAREN,         // grouping: (a + b)
    LPAREN_ARG,     // first argument of a command: foo (a)
    LPAREN_CALL,    // call arguments: foo(a)
    RPAREN,
    LBRACKET,       // array literal
    LBRACKET_INDEX, // element reference: foo[0]
    RBRACKET,
    LBRACE,         // hash literal
    LBRACE_BLOCK,   // block
    TLAMBEG,        // lambda body
    RBRACE,

    // String-like literals
    TSTRING_BEG,
    TSTRING_END,
    LABEL_END,      // closing quote of "key": value
    XSTRING_BEG,
    SYMBEG,
    REGEXP_BEG,
    REGEXP_END,
    QWORDS_BEG,
    WORDS_BEG,
    QSYMBOLS_BEG,
    SYMBOLS_BEG,
    WORDS_SEP,
    EMBEXPR_BEG,
    EMBEXPR_END,
    EMBVAR,
    HEREDOC_BEG,
    HEREDOC_END,
    BACKTICK,       // ` as a method name

    COMMENT,
    EMBDOC,
    END_CONTENT,
    EOF;

    /**
     * The type under which a token is recorded in the ledger. Variants that the
     * lexer only splits to steer the grammar collapse back to one kind.
     */
    public TokenType ledgerType() {
        return switch (this) {
            case STAR, DSTAR, AMPER, UMINUS, UPLUS -> OP;
            case LPAREN_ARG, LPAREN_CALL -> LPAREN;
            case LBRACKET_INDEX -> LBRACKET;
            case LBRACE_BLOCK -> LBRACE;
            case COLON3 -> COLON2;
            default -> this;
        };
    }

    public boolean isLeaf() {
        return ordinal() <= TSTRING_CONTENT.ordinal();
    }
}
