package com.astrallang.compiler.analysis;

import com.astrallang.compiler.ast.AstNode;
import com.astrallang.compiler.ast.AstVisitor;
import com.astrallang.compiler.ast.SourceLocation;
import com.astrallang.compiler.ast.decl.*;
import com.astrallang.compiler.ast.expr.*;
import com.astrallang.compiler.ast.stmt.*;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 所有权 / 借用检查器：按求值顺序遍历 AST，遇到第一个违规即终止。
 *
 * <p>规则概要：</p>
 * <ul>
 *   <li>值位置上的非 Copy 标识符读取即移动，之后再读取报 use of moved value</li>
 *   <li>{@code &x} 只增加借用计数，借用计数永不释放</li>
 *   <li>成员访问、索引、方法接收者的基础标识符是位置表达式，只检查存在且未移动</li>
 *   <li>赋值要求变量可变且未被借用</li>
 *   <li>break / continue 只能出现在 while / for 体内（函数边界会清除循环标志）</li>
 * </ul>
 *
 * <p>实例只能使用一次。</p>
 */
public final class OwnershipChecker implements AstVisitor<Void, Void> {

    private static final Logger LOG = Logger.getLogger(OwnershipChecker.class.getName());

    private final String fileName;
    private final ScopeStack scopes = new ScopeStack();
    private TypeInference inference;
    private boolean inLoop;
    private boolean used;

    public OwnershipChecker(String fileName) {
        this.fileName = fileName;
    }

    /** 分析入口 */
    public AnalysisResult analyze(Program program) {
        if (used) {
            throw new IllegalStateException("OwnershipChecker instances are single-use");
        }
        used = true;
        inference = new TypeInference(TypeRegistry.collect(program), scopes);

        LOG.fine("Checking ownership: " + fileName);
        try {
            program.accept(this, null);
        } catch (OwnershipException e) {
            Diagnostic diagnostic = e.getDiagnostic();
            LOG.fine("Ownership violation in " + fileName + ": " + diagnostic.header());
            return AnalysisResult.failure(diagnostic);
        }
        LOG.fine("Ownership check passed: " + fileName);
        return AnalysisResult.success();
    }

    /** 分析后仍保留的作用域栈（全局作用域永不弹出） */
    public ScopeStack getScopeStack() {
        return scopes;
    }

    // ============ 作用域管理 ============

    private void enterScope(Scope.ScopeKind kind) {
        scopes.pushScope(kind);
        if (LOG.isLoggable(Level.FINER)) {
            LOG.finer("enter " + kind + " scope (depth " + scopes.depth() + ")");
        }
    }

    private void exitScope() {
        Scope scope = scopes.popScope();
        if (LOG.isLoggable(Level.FINER)) {
            LOG.finer("exit " + scope + " (depth " + scopes.depth() + ")");
        }
    }

    private void declare(String name, String typeName, boolean mutable,
                         SourceLocation at, VariableKind kind) {
        VariableState state = new VariableState(name, typeName, mutable, at, kind);
        scopes.declare(state);
        if (LOG.isLoggable(Level.FINER)) {
            LOG.finer("declare " + state + " at line " + at.getLine());
        }
    }

    // ============ 检查辅助 ============

    private boolean isCopy(VariableState state) {
        return CopyTypes.isCopy(state.getTypeName());
    }

    private VariableState requireVariable(String name, SourceLocation at) {
        VariableState state = scopes.lookup(name);
        if (state == null) {
            throw error(ErrorKind.UNDEFINED_VARIABLE, at,
                    "cannot find value '" + name + "' in this scope", null, null);
        }
        return state;
    }

    private void requireNotMoved(VariableState state, SourceLocation at) {
        if (!isCopy(state) && state.isConsumed()) {
            String name = state.getName();
            throw error(ErrorKind.USE_OF_MOVED_VALUE, at,
                    "use of moved value '" + name + "'",
                    "value declared at line " + state.getDeclaredAt().getLine()
                            + " was moved at line " + state.getMovedAt().getLine()
                            + ", cannot be used again",
                    "consider borrowing '&" + name + "' to keep ownership in the current scope");
        }
    }

    /** 值位置读取：非 Copy 变量被移动 */
    private void moveOut(String name, SourceLocation at) {
        VariableState state = requireVariable(name, at);
        if (isCopy(state)) {
            return;
        }
        requireNotMoved(state, at);
        if (state.isBorrowed()) {
            throw error(ErrorKind.MOVE_WHILE_BORROWED, at,
                    "cannot move '" + name + "' while borrowed",
                    state.getBorrowCount() + " active borrow(s) exist",
                    "borrow with '&" + name + "' instead of moving");
        }
        state.consume(at);
    }

    /** 赋值目标检查：存在、未移动、可变、未被借用 */
    private void checkAssignable(String name, SourceLocation at) {
        VariableState state = requireVariable(name, at);
        requireNotMoved(state, at);
        if (!state.isMutable()) {
            throw error(ErrorKind.ASSIGN_TO_IMMUTABLE, at,
                    "cannot assign to immutable variable '" + name + "'",
                    "'" + name + "' declared at line " + state.getDeclaredAt().getLine(),
                    mutabilityHelp(state));
        }
        if (state.isBorrowed()) {
            throw error(ErrorKind.MUTATE_WHILE_BORROWED, at,
                    "cannot assign to '" + name + "' while borrowed",
                    state.getBorrowCount() + " active borrow(s) exist", null);
        }
    }

    private String mutabilityHelp(VariableState state) {
        switch (state.getKind()) {
            case LOCAL:
                return "consider declaring with 'let mut " + state.getName() + "'";
            case PARAMETER:
                return "consider declaring the parameter as 'mut " + state.getName() + "'";
            default:
                // 循环变量和模式绑定没有可变写法
                return null;
        }
    }

    /**
     * 位置表达式（p.x / a[i] / s.len() 的接收者）：基础标识符只检查存在且未移动
     */
    private void visitPlace(Expression target) {
        if (target instanceof Identifier) {
            Identifier id = (Identifier) target;
            requireNotMoved(requireVariable(id.getName(), id.getLocation()), id.getLocation());
        } else if (target instanceof MemberExpr) {
            visitPlace(((MemberExpr) target).getTarget());
        } else if (target instanceof IndexExpr) {
            IndexExpr index = (IndexExpr) target;
            visitPlace(index.getTarget());
            index.getIndex().accept(this, null);
        } else {
            target.accept(this, null);
        }
    }

    private void visitAll(Iterable<? extends AstNode> nodes) {
        for (AstNode node : nodes) {
            node.accept(this, null);
        }
    }

    private OwnershipException error(ErrorKind kind, SourceLocation at,
                                     String message, String note, String help) {
        return new OwnershipException(new Diagnostic(kind, fileName, at, message, note, help));
    }

    // ============ 声明 ============

    @Override
    public Void visitProgram(Program node, Void ctx) {
        visitAll(node.getItems());
        return null;
    }

    @Override
    public Void visitFunDecl(FunDecl node, Void ctx) {
        LOG.finer("check fn " + node.getName());
        boolean savedInLoop = inLoop;
        inLoop = false;
        enterScope(Scope.ScopeKind.FUNCTION);
        visitAll(node.getParams());
        node.getBody().accept(this, null);
        exitScope();
        inLoop = savedInLoop;
        return null;
    }

    @Override
    public Void visitParameter(Parameter node, Void ctx) {
        declare(node.getName(), parameterType(node), node.isMutable(), node.getLocation(),
                VariableKind.PARAMETER);
        return null;
    }

    // 与 TypeInference 对 &x / &mut x 的写法一致
    static String parameterType(Parameter param) {
        if (!param.isReference()) {
            return param.getType();
        }
        return (param.isMutable() ? "&mut " : "&") + param.getType();
    }

    @Override
    public Void visitStructDecl(StructDecl node, Void ctx) {
        // 仅供 TypeRegistry 使用
        return null;
    }

    @Override
    public Void visitEnumDecl(EnumDecl node, Void ctx) {
        return null;
    }

    // ============ 语句 ============

    @Override
    public Void visitBlock(Block node, Void ctx) {
        enterScope(Scope.ScopeKind.BLOCK);
        visitAll(node.getStatements());
        exitScope();
        return null;
    }

    @Override
    public Void visitLetStmt(LetStmt node, Void ctx) {
        String type = node.hasTypeAnnotation()
                ? node.getTypeAnnotation()
                : inference.infer(node.getInitializer());
        node.getInitializer().accept(this, null);
        declare(node.getName(), type, node.isMutable(), node.getLocation(), VariableKind.LOCAL);
        return null;
    }

    @Override
    public Void visitAssignStmt(AssignStmt node, Void ctx) {
        checkAssignable(node.getName(), node.getLocation());
        node.getValue().accept(this, null);
        return null;
    }

    @Override
    public Void visitIndexAssignStmt(IndexAssignStmt node, Void ctx) {
        checkAssignable(node.getArrayName(), node.getLocation());
        node.getIndex().accept(this, null);
        node.getValue().accept(this, null);
        return null;
    }

    @Override
    public Void visitExpressionStmt(ExpressionStmt node, Void ctx) {
        node.getExpression().accept(this, null);
        return null;
    }

    @Override
    public Void visitIfStmt(IfStmt node, Void ctx) {
        node.getCondition().accept(this, null);
        node.getThenBranch().accept(this, null);
        if (node.hasElse()) {
            node.getElseBranch().accept(this, null);
        }
        return null;
    }

    @Override
    public Void visitWhileStmt(WhileStmt node, Void ctx) {
        node.getCondition().accept(this, null);
        boolean savedInLoop = inLoop;
        inLoop = true;
        node.getBody().accept(this, null);
        inLoop = savedInLoop;
        return null;
    }

    @Override
    public Void visitForStmt(ForStmt node, Void ctx) {
        String iterableType = inference.infer(node.getIterable());
        node.getIterable().accept(this, null);

        enterScope(Scope.ScopeKind.LOOP);
        declare(node.getVariable(), loopVariableType(iterableType), false,
                node.getVariableLocation(), VariableKind.LOOP_VARIABLE);
        boolean savedInLoop = inLoop;
        inLoop = true;
        node.getBody().accept(this, null);
        inLoop = savedInLoop;
        exitScope();
        return null;
    }

    // [T; N] → T，&[T; N] → &T，其余（范围等）→ int
    private static String loopVariableType(String iterableType) {
        String element = TypeInference.elementTypeOf(iterableType);
        if (element != null) {
            return element;
        }
        if (iterableType.startsWith("&")) {
            element = TypeInference.elementTypeOf(TypeInference.stripReference(iterableType));
            if (element != null) {
                return "&" + element;
            }
        }
        return "int";
    }

    @Override
    public Void visitMatchStmt(MatchStmt node, Void ctx) {
        String scrutineeType = inference.infer(node.getScrutinee());
        node.getScrutinee().accept(this, null);

        for (MatchArm arm : node.getArms()) {
            enterScope(Scope.ScopeKind.MATCH_ARM);
            Pattern pattern = arm.getPattern();
            switch (pattern.getKind()) {
                case BINDING:
                    declare(pattern.getBinding(), scrutineeType, false,
                            pattern.getLocation(), VariableKind.PATTERN_BINDING);
                    break;
                case ENUM_VARIANT:
                    if (pattern.hasBinding()) {
                        String payload = inference.payloadTypeOf(pattern.getEnumName(), pattern.getVariant());
                        declare(pattern.getBinding(), payload, false,
                                pattern.getLocation(), VariableKind.PATTERN_BINDING);
                    }
                    break;
                case WILDCARD:
                default:
                    break;
            }
            arm.getBody().accept(this, null);
            exitScope();
        }
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, Void ctx) {
        if (node.hasValue()) {
            node.getValue().accept(this, null);
        }
        return null;
    }

    @Override
    public Void visitBreakStmt(BreakStmt node, Void ctx) {
        if (!inLoop) {
            throw error(ErrorKind.BREAK_OUTSIDE_LOOP, node.getLocation(),
                    "'break' outside of loop", null, null);
        }
        return null;
    }

    @Override
    public Void visitContinueStmt(ContinueStmt node, Void ctx) {
        if (!inLoop) {
            throw error(ErrorKind.CONTINUE_OUTSIDE_LOOP, node.getLocation(),
                    "'continue' outside of loop", null, null);
        }
        return null;
    }

    // ============ 表达式 ============

    @Override
    public Void visitLiteral(Literal node, Void ctx) {
        return null;
    }

    @Override
    public Void visitIdentifier(Identifier node, Void ctx) {
        moveOut(node.getName(), node.getLocation());
        return null;
    }

    @Override
    public Void visitBinaryExpr(BinaryExpr node, Void ctx) {
        node.getLeft().accept(this, null);
        node.getRight().accept(this, null);
        return null;
    }

    @Override
    public Void visitUnaryExpr(UnaryExpr node, Void ctx) {
        node.getOperand().accept(this, null);
        return null;
    }

    @Override
    public Void visitReferenceExpr(ReferenceExpr node, Void ctx) {
        Expression operand = node.getOperand();
        if (operand instanceof Identifier) {
            Identifier id = (Identifier) operand;
            VariableState state = requireVariable(id.getName(), id.getLocation());
            requireNotMoved(state, id.getLocation());
            state.borrow();
            if (LOG.isLoggable(Level.FINER)) {
                LOG.finer("borrow " + state);
            }
        } else if (operand instanceof MemberExpr || operand instanceof IndexExpr) {
            visitPlace(operand);
        } else {
            operand.accept(this, null);
        }
        return null;
    }

    @Override
    public Void visitCallExpr(CallExpr node, Void ctx) {
        visitAll(node.getArgs());
        return null;
    }

    @Override
    public Void visitMethodCallExpr(MethodCallExpr node, Void ctx) {
        visitPlace(node.getReceiver());
        visitAll(node.getArgs());
        return null;
    }

    @Override
    public Void visitMemberExpr(MemberExpr node, Void ctx) {
        visitPlace(node.getTarget());
        return null;
    }

    @Override
    public Void visitIndexExpr(IndexExpr node, Void ctx) {
        visitPlace(node.getTarget());
        node.getIndex().accept(this, null);
        return null;
    }

    @Override
    public Void visitArrayLiteral(ArrayLiteral node, Void ctx) {
        visitAll(node.getElements());
        return null;
    }

    @Override
    public Void visitStructInitExpr(StructInitExpr node, Void ctx) {
        for (StructInitExpr.FieldInit field : node.getFields()) {
            field.getValue().accept(this, null);
        }
        return null;
    }

    @Override
    public Void visitEnumValueExpr(EnumValueExpr node, Void ctx) {
        if (node.hasPayload()) {
            node.getPayload().accept(this, null);
        }
        return null;
    }

    @Override
    public Void visitRangeExpr(RangeExpr node, Void ctx) {
        node.getStart().accept(this, null);
        node.getEnd().accept(this, null);
        return null;
    }
}
