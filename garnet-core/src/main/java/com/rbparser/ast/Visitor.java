package com.rbparser.ast;

public interface Visitor<R> {

    default R visit(Node node) {
        return node == null ? null : node.accept(this);
    }

    R visitARef(ARef node);

    R visitARefField(ARefField node);

    R visitAliasNode(AliasNode node);

    R visitArgBlock(ArgBlock node);

    R visitArgParen(ArgParen node);

    R visitArgStar(ArgStar node);

    R visitArgs(Args node);

    R visitArgsForward(ArgsForward node);

    R visitArrayLiteral(ArrayLiteral node);

    R visitAryPtn(AryPtn node);

    R visitAssign(Assign node);

    R visitAssoc(Assoc node);

    R visitAssocSplat(AssocSplat node);

    R visitBEGINBlock(BEGINBlock node);

    R visitBackref(Backref node);

    R visitBacktick(Backtick node);

    R visitBareAssocHash(BareAssocHash node);

    R visitBegin(Begin node);

    R visitBinary(Binary node);

    R visitBlockArg(BlockArg node);

    R visitBlockNode(BlockNode node);

    R visitBlockVar(BlockVar node);

    R visitBodyStmt(BodyStmt node);

    R visitBreak(Break node);

    R visitCVar(CVar node);

    R visitCallNode(CallNode node);

    R visitCase(Case node);

    R visitCharLiteral(CharLiteral node);

    R visitClassDeclaration(ClassDeclaration node);

    R visitCommand(Command node);

    R visitCommandCall(CommandCall node);

    R visitComment(Comment node);

    R visitConst(Const node);

    R visitConstPathField(ConstPathField node);

    R visitConstPathRef(ConstPathRef node);

    R visitConstRef(ConstRef node);

    R visitDefNode(DefNode node);

    R visitDefined(Defined node);

    R visitDynaSymbol(DynaSymbol node);

    R visitENDBlock(ENDBlock node);

    R visitElse(Else node);

    R visitElsif(Elsif node);

    R visitEndContent(EndContent node);

    R visitEnsure(Ensure node);

    R visitExcessedComma(ExcessedComma node);

    R visitField(Field node);

    R visitFloatLiteral(FloatLiteral node);

    R visitFndPtn(FndPtn node);

    R visitFor(For node);

    R visitGVar(GVar node);

    R visitHashLiteral(HashLiteral node);

    R visitHeredoc(Heredoc node);

    R visitHeredocBeg(HeredocBeg node);

    R visitHeredocEnd(HeredocEnd node);

    R visitHshPtn(HshPtn node);

    R visitIVar(IVar node);

    R visitIdent(Ident node);

    R visitIfNode(IfNode node);

    R visitIfOp(IfOp node);

    R visitImaginary(Imaginary node);

    R visitIn(In node);

    R visitInt(Int node);

    R visitKw(Kw node);

    R visitKwRestParam(KwRestParam node);

    R visitLBrace(LBrace node);

    R visitLBracket(LBracket node);

    R visitLParen(LParen node);

    R visitLabel(Label node);

    R visitLambda(Lambda node);

    R visitLambdaVar(LambdaVar node);

    R visitMAssign(MAssign node);

    R visitMLHS(MLHS node);

    R visitMLHSParen(MLHSParen node);

    R visitMRHS(MRHS node);

    R visitMethodAddBlock(MethodAddBlock node);

    R visitModuleDeclaration(ModuleDeclaration node);

    R visitNext(Next node);

    R visitNot(Not node);

    R visitOp(Op node);

    R visitOpAssign(OpAssign node);

    R visitParams(Params node);

    R visitParen(Paren node);

    R visitPeriod(Period node);

    R visitPinnedBegin(PinnedBegin node);

    R visitPinnedVarRef(PinnedVarRef node);

    R visitProgram(Program node);

    R visitQSymbols(QSymbols node);

    R visitQWords(QWords node);

    R visitRAssign(RAssign node);

    R visitRangeNode(RangeNode node);

    R visitRationalLiteral(RationalLiteral node);

    R visitRedo(Redo node);

    R visitRegexpLiteral(RegexpLiteral node);

    R visitRescue(Rescue node);

    R visitRescueEx(RescueEx node);

    R visitRescueMod(RescueMod node);

    R visitRestParam(RestParam node);

    R visitRetry(Retry node);

    R visitReturnNode(ReturnNode node);

    R visitSClass(SClass node);

    R visitStatements(Statements node);

    R visitStringConcat(StringConcat node);

    R visitStringDVar(StringDVar node);

    R visitStringEmbExpr(StringEmbExpr node);

    R visitStringLiteral(StringLiteral node);

    R visitSuper(Super node);

    R visitSymbolLiteral(SymbolLiteral node);

    R visitSymbols(Symbols node);

    R visitTStringContent(TStringContent node);

    R visitTopConstField(TopConstField node);

    R visitTopConstRef(TopConstRef node);

    R visitUnary(Unary node);

    R visitUndef(Undef node);

    R visitUnlessNode(UnlessNode node);

    R visitUntilNode(UntilNode node);

    R visitVCall(VCall node);

    R visitVarField(VarField node);

    R visitVarRef(VarRef node);

    R visitVoidStmt(VoidStmt node);

    R visitWhen(When node);

    R visitWhileNode(WhileNode node);

    R visitWord(Word node);

    R visitWords(Words node);

    R visitXStringLiteral(XStringLiteral node);

    R visitYieldNode(YieldNode node);

    R visitZSuper(ZSuper node);
}
