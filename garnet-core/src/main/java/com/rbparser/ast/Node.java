package com.rbparser.ast;

import java.util.List;

/**
 * Base interface for all syntax tree nodes
 */
public sealed interface Node permits
    ARef,
    ARefField,
    AliasNode,
    ArgBlock,
    ArgParen,
    ArgStar,
    Args,
    ArgsForward,
    ArrayLiteral,
    AryPtn,
    Assign,
    Assoc,
    AssocSplat,
    BEGINBlock,
    Backref,
    Backtick,
    BareAssocHash,
    Begin,
    Binary,
    BlockArg,
    BlockNode,
    BlockVar,
    BodyStmt,
    Break,
    CVar,
    CallNode,
    Case,
    CharLiteral,
    ClassDeclaration,
    Command,
    CommandCall,
    Comment,
    Const,
    ConstPathField,
    ConstPathRef,
    ConstRef,
    DefNode,
    Defined,
    DynaSymbol,
    ENDBlock,
    Else,
    Elsif,
    EndContent,
    Ensure,
    ExcessedComma,
    Field,
    FloatLiteral,
    FndPtn,
    For,
    GVar,
    HashLiteral,
    Heredoc,
    HeredocBeg,
    HeredocEnd,
    HshPtn,
    IVar,
    Ident,
    IfNode,
    IfOp,
    Imaginary,
    In,
    Int,
    Kw,
    KwRestParam,
    LBrace,
    LBracket,
    LParen,
    Label,
    Lambda,
    LambdaVar,
    MAssign,
    MLHS,
    MLHSParen,
    MRHS,
    MethodAddBlock,
    ModuleDeclaration,
    Next,
    Not,
    Op,
    OpAssign,
    Params,
    Paren,
    Period,
    PinnedBegin,
    PinnedVarRef,
    Program,
    QSymbols,
    QWords,
    RAssign,
    RangeNode,
    RationalLiteral,
    Redo,
    RegexpLiteral,
    Rescue,
    RescueEx,
    RescueMod,
    RestParam,
    Retry,
    ReturnNode,
    SClass,
    Statements,
    StringConcat,
    StringDVar,
    StringEmbExpr,
    StringLiteral,
    Super,
    SymbolLiteral,
    Symbols,
    TStringContent,
    TopConstField,
    TopConstRef,
    Unary,
    Undef,
    UnlessNode,
    UntilNode,
    VCall,
    VarField,
    VarRef,
    VoidStmt,
    When,
    WhileNode,
    Word,
    Words,
    XStringLiteral,
    YieldNode,
    ZSuper {

    NodeType type();

    Location location();

    /**
     * Comments attached to this node. Filled in once, after the whole tree is built.
     */
    List<Comment> comments();

    List<Node> childNodes();

    <R> R accept(Visitor<R> visitor);
}
