package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.frontend.lexer.Token;
import org.llasm.compiler.frontend.lexer.TokenType;

import java.util.Arrays;
import java.util.List;

/**
 * Builds syntax trees for tests, standing in for the parser.
 * Tokens are placed on line 1 of {@value #FILE} unless a line is given.
 */
public final class Nodes {

    public static final String FILE = "test.ll";

    private Nodes() {}

    public static Token tok(TokenType type, String text) {
        return tok(type, text, 1);
    }

    public static Token tok(TokenType type, String text, int line) {
        return new Token(type, text, line, 1, FILE);
    }

    // Identifiers and literals.

    public static GlobalIdentNode global(String text) {
        return new GlobalIdentNode(tok(TokenType.GLOBAL_IDENT, text));
    }

    public static LocalIdentNode local(String text) {
        return new LocalIdentNode(tok(TokenType.LOCAL_IDENT, text));
    }

    public static LocalIdentNode local(String text, int line) {
        return new LocalIdentNode(tok(TokenType.LOCAL_IDENT, text, line));
    }

    public static LabelIdentNode label(String text) {
        return new LabelIdentNode(tok(TokenType.LABEL_IDENT, text));
    }

    public static ComdatNameNode comdat(String text) {
        return new ComdatNameNode(tok(TokenType.COMDAT_NAME, text));
    }

    public static KeywordNode kw(String text) {
        return new KeywordNode(tok(TokenType.KEYWORD, text));
    }

    public static List<KeywordNode> kws(String... texts) {
        return Arrays.stream(texts).map(Nodes::kw).toList();
    }

    public static UintLitNode uint(String text) {
        return new UintLitNode(tok(TokenType.INT_LIT, text));
    }

    public static IntLitNode intLit(String text) {
        return new IntLitNode(tok(TokenType.INT_LIT, text));
    }

    public static BoolLitNode bool(String text) {
        return new BoolLitNode(tok(TokenType.BOOL_LIT, text));
    }

    public static StringLitNode string(String text) {
        return new StringLitNode(tok(TokenType.STRING_LIT, text));
    }

    // Attributes.

    public static AddrSpaceNode addrSpace(String n) {
        return new AddrSpaceNode(tok(TokenType.KEYWORD, "addrspace"), uint(n));
    }

    public static AlignmentNode align(String n) {
        return new AlignmentNode(tok(TokenType.KEYWORD, "align"), uint(n));
    }

    public static ThreadLocalNode threadLocal(String model) {
        return new ThreadLocalNode(tok(TokenType.KEYWORD, "thread_local"), model != null ? kw(model) : null);
    }

    public static CallingConvNode cc(String keyword) {
        return new CallingConvKeywordNode(kw(keyword));
    }

    public static CallingConvNode ccNumber(String code) {
        return new CallingConvIntNode(tok(TokenType.KEYWORD, "cc"), uint(code));
    }

    // Types.

    public static TypeNode i(int bits) {
        return new IntTypeNode(tok(TokenType.KEYWORD, "i" + bits));
    }

    public static TypeNode intType(String text) {
        return new IntTypeNode(tok(TokenType.KEYWORD, text));
    }

    public static TypeNode floatType(String kind) {
        return new FloatTypeNode(kw(kind));
    }

    public static TypeNode voidType() {
        return new VoidTypeNode(tok(TokenType.KEYWORD, "void"));
    }

    public static TypeNode labelType() {
        return new LabelTypeNode(tok(TokenType.KEYWORD, "label"));
    }

    public static TypeNode ptr() {
        return new PointerTypeNode(tok(TokenType.KEYWORD, "ptr"), null);
    }

    public static TypeNode ptr(String addrSpace) {
        return new PointerTypeNode(tok(TokenType.KEYWORD, "ptr"), addrSpace(addrSpace));
    }

    public static TypedValueNode typed(TypeNode type, ValueNode value) {
        return new TypedValueNode(type, value);
    }

    // Instructions and terminators.

    public static Token opcode(String text) {
        return tok(TokenType.KEYWORD, text);
    }

    public static PhiInstNode phi(String name, TypeNode type, IncomingNode... incomings) {
        return new PhiInstNode(local(name), opcode("phi"), List.of(), type, List.of(incomings));
    }

    public static IncomingNode incoming(ValueNode x, String pred) {
        return new IncomingNode(x, local(pred));
    }

    public static AddInstNode add(String name, TypeNode type, ValueNode x, ValueNode y) {
        return new AddInstNode(name != null ? local(name) : null, opcode("add"), List.of(), type, x, y);
    }

    public static ICmpInstNode icmp(String name, String pred, TypeNode type, ValueNode x, ValueNode y) {
        return new ICmpInstNode(local(name), opcode("icmp"), kw(pred), type, x, y);
    }

    public static CallInstNode call(String name, TypeNode returnType, ValueNode callee, TypedValueNode... args) {
        return new CallInstNode(name != null ? local(name) : null, null, opcode("call"), null, returnType, callee, List.of(args));
    }

    public static RetTermNode ret(TypedValueNode value) {
        return new RetTermNode(opcode("ret"), value);
    }

    public static RetTermNode retVoid() {
        return new RetTermNode(opcode("ret"), null);
    }

    public static BrTermNode br(String target) {
        return new BrTermNode(opcode("br"), local(target));
    }

    public static CondBrTermNode condBr(ValueNode cond, String t, String f) {
        return new CondBrTermNode(opcode("br"), typed(i(1), cond), local(t), local(f));
    }

    public static SwitchTermNode switchOn(TypedValueNode x, String defaultTarget, CaseNode... cases) {
        return new SwitchTermNode(opcode("switch"), x, local(defaultTarget), List.of(cases));
    }

    public static CaseNode caseOf(TypedValueNode x, String target) {
        return new CaseNode(x, local(target));
    }

    public static BasicBlockNode block(String label, TerminatorNode terminator, InstructionNode... instructions) {
        return new BasicBlockNode(label != null ? label(label) : null, List.of(instructions), terminator);
    }

    // Top-level entities.

    public static ParamNode param(TypeNode type, String name) {
        return new ParamNode(type, name != null ? local(name) : null);
    }

    public static FunctionHeaderNode header(TypeNode returnType, String name, ParamNode... params) {
        return new FunctionHeaderNode(null, null, null, null, null, returnType, global(name), List.of(params),
                null, null, null, null, null);
    }

    public static FunctionNode define(FunctionHeaderNode header, BasicBlockNode... blocks) {
        return new FunctionNode(header, List.of(blocks));
    }

    public static FunctionNode declare(FunctionHeaderNode header) {
        return new FunctionNode(header, List.of());
    }

    public static GlobalVarNode globalVar(String name, TypeNode contentType, ValueNode init) {
        return new GlobalVarNode(global(name), null, null, null, null, null, null, null, null, kw("global"),
                contentType, init, null, null);
    }

    public static ComdatDefNode comdatDef(String name, String selectionKind) {
        return new ComdatDefNode(comdat(name), selectionKind != null ? kw(selectionKind) : null);
    }

    public static ModuleNode module(TopLevelEntityNode... entities) {
        return new ModuleNode(List.of(entities));
    }
}
