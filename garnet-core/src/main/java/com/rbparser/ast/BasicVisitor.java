package com.rbparser.ast;

/**
 * A visitor whose methods all descend into the children of the visited node.
 * Subclasses override the variants they care about.
 */
public abstract class BasicVisitor<R> implements Visitor<R> {

    protected R visitChildNodes(Node node) {
        for (Node child : node.childNodes()) {
            visit(child);
        }
        return null;
    }

    @Override
    public R visitARef(ARef node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitARefField(ARefField node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitAliasNode(AliasNode node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitArgBlock(ArgBlock node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitArgParen(ArgParen node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitArgStar(ArgStar node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitArgs(Args node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitArgsForward(ArgsForward node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitArrayLiteral(ArrayLiteral node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitAryPtn(AryPtn node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitAssign(Assign node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitAssoc(Assoc node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitAssocSplat(AssocSplat node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitBEGINBlock(BEGINBlock node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitBackref(Backref node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitBacktick(Backtick node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitBareAssocHash(BareAssocHash node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitBegin(Begin node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitBinary(Binary node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitBlockArg(BlockArg node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitBlockNode(BlockNode node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitBlockVar(BlockVar node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitBodyStmt(BodyStmt node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitBreak(Break node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitCVar(CVar node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitCallNode(CallNode node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitCase(Case node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitCharLiteral(CharLiteral node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitClassDeclaration(ClassDeclaration node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitCommand(Command node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitCommandCall(CommandCall node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitComment(Comment node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitConst(Const node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitConstPathField(ConstPathField node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitConstPathRef(ConstPathRef node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitConstRef(ConstRef node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitDefNode(DefNode node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitDefined(Defined node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitDynaSymbol(DynaSymbol node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitENDBlock(ENDBlock node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitElse(Else node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitElsif(Elsif node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitEndContent(EndContent node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitEnsure(Ensure node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitExcessedComma(ExcessedComma node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitField(Field node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitFloatLiteral(FloatLiteral node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitFndPtn(FndPtn node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitFor(For node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitGVar(GVar node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitHashLiteral(HashLiteral node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitHeredoc(Heredoc node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitHeredocBeg(HeredocBeg node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitHeredocEnd(HeredocEnd node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitHshPtn(HshPtn node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitIVar(IVar node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitIdent(Ident node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitIfNode(IfNode node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitIfOp(IfOp node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitImaginary(Imaginary node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitIn(In node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitInt(Int node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitKw(Kw node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitKwRestParam(KwRestParam node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitLBrace(LBrace node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitLBracket(LBracket node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitLParen(LParen node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitLabel(Label node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitLambda(Lambda node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitLambdaVar(LambdaVar node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitMAssign(MAssign node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitMLHS(MLHS node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitMLHSParen(MLHSParen node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitMRHS(MRHS node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitMethodAddBlock(MethodAddBlock node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitModuleDeclaration(ModuleDeclaration node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitNext(Next node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitNot(Not node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitOp(Op node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitOpAssign(OpAssign node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitParams(Params node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitParen(Paren node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitPeriod(Period node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitPinnedBegin(PinnedBegin node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitPinnedVarRef(PinnedVarRef node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitProgram(Program node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitQSymbols(QSymbols node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitQWords(QWords node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitRAssign(RAssign node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitRangeNode(RangeNode node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitRationalLiteral(RationalLiteral node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitRedo(Redo node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitRegexpLiteral(RegexpLiteral node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitRescue(Rescue node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitRescueEx(RescueEx node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitRescueMod(RescueMod node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitRestParam(RestParam node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitRetry(Retry node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitReturnNode(ReturnNode node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitSClass(SClass node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitStatements(Statements node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitStringConcat(StringConcat node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitStringDVar(StringDVar node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitStringEmbExpr(StringEmbExpr node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitStringLiteral(StringLiteral node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitSuper(Super node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitSymbolLiteral(SymbolLiteral node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitSymbols(Symbols node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitTStringContent(TStringContent node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitTopConstField(TopConstField node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitTopConstRef(TopConstRef node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitUnary(Unary node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitUndef(Undef node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitUnlessNode(UnlessNode node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitUntilNode(UntilNode node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitVCall(VCall node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitVarField(VarField node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitVarRef(VarRef node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitVoidStmt(VoidStmt node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitWhen(When node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitWhileNode(WhileNode node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitWord(Word node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitWords(Words node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitXStringLiteral(XStringLiteral node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitYieldNode(YieldNode node) {
        return visitChildNodes(node);
    }

    @Override
    public R visitZSuper(ZSuper node) {
        return visitChildNodes(node);
    }
}
