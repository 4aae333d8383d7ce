package com.rbparser.ast;

/**
 * Tag of every node variant; {@link #tag()} is the name used by the S-expression
 * and JSON dumps.
 */
public enum NodeType {
    ALIAS_NODE("alias"),
    AREF("aref"),
    AREF_FIELD("aref_field"),
    ARGS("args"),
    ARGS_FORWARD("args_forward"),
    ARG_BLOCK("arg_block"),
    ARG_PAREN("arg_paren"),
    ARG_STAR("arg_star"),
    ARRAY_LITERAL("array"),
    ARY_PTN("aryptn"),
    ASSIGN("assign"),
    ASSOC("assoc"),
    ASSOC_SPLAT("assoc_splat"),
    BACKREF("backref"),
    BACKTICK("backtick"),
    BARE_ASSOC_HASH("bare_assoc_hash"),
    BEGIN("begin"),
    BEGIN_BLOCK("BEGIN"),
    BINARY("binary"),
    BLOCK_ARG("blockarg"),
    BLOCK_NODE("block"),
    BLOCK_VAR("block_var"),
    BODYSTMT("bodystmt"),
    BREAK("break"),
    CALL_NODE("call"),
    CASE("case"),
    CHAR_LITERAL("CHAR"),
    CLASS_DECLARATION("class"),
    COMMAND("command"),
    COMMAND_CALL("command_call"),
    COMMENT("comment"),
    CONST("const"),
    CONST_PATH_FIELD("const_path_field"),
    CONST_PATH_REF("const_path_ref"),
    CONST_REF("const_ref"),
    CVAR("cvar"),
    DEFINED("defined"),
    DEF_NODE("def"),
    DYNA_SYMBOL("dyna_symbol"),
    ELSE("else"),
    ELSIF("elsif"),
    EMB_DOC("embdoc"),
    END_BLOCK("END"),
    END_CONTENT("__end__"),
    ENSURE("ensure"),
    EXCESSED_COMMA("excessed_comma"),
    FIELD("field"),
    FLOAT_LITERAL("float"),
    FND_PTN("fndptn"),
    FOR("for"),
    GVAR("gvar"),
    HASH_LITERAL("hash"),
    HEREDOC("heredoc"),
    HEREDOC_BEG("heredoc_beg"),
    HEREDOC_END("heredoc_end"),
    HSHPTN("hshptn"),
    IDENT("ident"),
    IFOP("ifop"),
    IF_NODE("if"),
    IMAGINARY("imaginary"),
    IN("in"),
    INT("int"),
    IVAR("ivar"),
    KW("kw"),
    KWREST_PARAM("kwrest_param"),
    LABEL("label"),
    LAMBDA("lambda"),
    LAMBDA_VAR("lambda_var"),
    LBRACE("lbrace"),
    LBRACKET("lbracket"),
    LPAREN("lparen"),
    MASSIGN("massign"),
    METHOD_ADD_BLOCK("method_add_block"),
    MLHS("mlhs"),
    MLHS_PAREN("mlhs_paren"),
    MODULE_DECLARATION("module"),
    MRHS("mrhs"),
    NEXT("next"),
    NOT("not"),
    OP("op"),
    OP_ASSIGN("opassign"),
    PARAMS("params"),
    PAREN("paren"),
    PERIOD("period"),
    PINNED_BEGIN("pinned_begin"),
    PINNED_VAR_REF("pinned_var_ref"),
    PROGRAM("program"),
    QSYMBOLS("qsymbols"),
    QWORDS("qwords"),
    RANGE_NODE("range"),
    RASSIGN("rassign"),
    RATIONAL_LITERAL("rational"),
    REDO("redo"),
    REGEXP_LITERAL("regexp_literal"),
    RESCUE("rescue"),
    RESCUE_EX("rescue_ex"),
    RESCUE_MOD("rescue_mod"),
    REST_PARAM("rest_param"),
    RETRY("retry"),
    RETURN_NODE("return"),
    SCLASS("sclass"),
    STATEMENTS("statements"),
    STRING_CONCAT("string_concat"),
    STRING_DVAR("string_dvar"),
    STRING_EMBEXPR("string_embexpr"),
    STRING_LITERAL("string_literal"),
    SUPER("super"),
    SYMBOLS("symbols"),
    SYMBOL_LITERAL("symbol_literal"),
    TOP_CONST_FIELD("top_const_field"),
    TOP_CONST_REF("top_const_ref"),
    TSTRING_CONTENT("tstring_content"),
    UNARY("unary"),
    UNDEF("undef"),
    UNLESS_NODE("unless"),
    UNTIL_NODE("until"),
    VAR_FIELD("var_field"),
    VAR_REF("var_ref"),
    VCALL("vcall"),
    VOID_STMT("void_stmt"),
    WHEN("when"),
    WHILE_NODE("while"),
    WORD("word"),
    WORDS("words"),
    XSTRING_LITERAL("xstring_literal"),
    YIELD_NODE("yield"),
    ZSUPER("zsuper");

    private final String tag;

    NodeType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
