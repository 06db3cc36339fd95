package org.e2immu.analyzer.controlflow.common.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/*
Creates types, members and syntax elements, and holds the predefined types of the language.
One factory per program: the predefined types are shared by all elements built with it.
 */
public class Factory {
    private final TypeInfo objectType = new TypeInfo("object", null);
    private final TypeInfo voidType = new TypeInfo("void", null);
    private final TypeInfo boolType = new TypeInfo("bool", objectType);
    private final TypeInfo intType = new TypeInfo("int", objectType, true);
    private final TypeInfo stringType = new TypeInfo("string", objectType);
    private final TypeInfo delegateType = new TypeInfo("Delegate", objectType);
    private final TypeInfo arrayType = new TypeInfo("Array", objectType);

    private final TypeInfo exceptionType = new TypeInfo("Exception", objectType);
    private final TypeInfo systemExceptionType = new TypeInfo("SystemException", exceptionType);
    private final TypeInfo invalidCastExceptionType = new TypeInfo("InvalidCastException", systemExceptionType);
    private final TypeInfo divideByZeroExceptionType = new TypeInfo("DivideByZeroException", systemExceptionType);
    private final TypeInfo indexOutOfRangeExceptionType = new TypeInfo("IndexOutOfRangeException",
            systemExceptionType);
    private final TypeInfo nullReferenceExceptionType = new TypeInfo("NullReferenceException", systemExceptionType);
    private final TypeInfo invalidOperationExceptionType = new TypeInfo("InvalidOperationException",
            systemExceptionType);

    private final Map<Callable, Integer> lambdaCounters = new HashMap<>();
    private final Map<TypeInfo, MethodInfo> defaultConstructors = new HashMap<>();

    public TypeInfo objectType() {
        return objectType;
    }

    public TypeInfo voidType() {
        return voidType;
    }

    public TypeInfo boolType() {
        return boolType;
    }

    public TypeInfo intType() {
        return intType;
    }

    public TypeInfo stringType() {
        return stringType;
    }

    public TypeInfo delegateType() {
        return delegateType;
    }

    public TypeInfo arrayType() {
        return arrayType;
    }

    public TypeInfo exceptionType() {
        return exceptionType;
    }

    public TypeInfo systemExceptionType() {
        return systemExceptionType;
    }

    public TypeInfo invalidCastExceptionType() {
        return invalidCastExceptionType;
    }

    public TypeInfo divideByZeroExceptionType() {
        return divideByZeroExceptionType;
    }

    public TypeInfo indexOutOfRangeExceptionType() {
        return indexOutOfRangeExceptionType;
    }

    public TypeInfo nullReferenceExceptionType() {
        return nullReferenceExceptionType;
    }

    public TypeInfo invalidOperationExceptionType() {
        return invalidOperationExceptionType;
    }

    // types and members

    public TypeInfo newType(String name) {
        return new TypeInfo(name, objectType);
    }

    public TypeInfo newType(String name, TypeInfo parent) {
        return new TypeInfo(name, parent);
    }

    public FieldInfo newField(TypeInfo owner, String name, TypeInfo type) {
        return new FieldInfo(owner, name, type, false, false);
    }

    public FieldInfo newField(TypeInfo owner, String name, TypeInfo type, boolean isStatic, boolean isVolatile) {
        return new FieldInfo(owner, name, type, isStatic, isVolatile);
    }

    /*
    creates the property together with its getter and setter. Accessors of an auto-implemented property have no
    body; otherwise, the bodies are to be set on getter() and setter().
     */
    public PropertyInfo newProperty(TypeInfo owner, String name, TypeInfo type, boolean isStatic,
                                    boolean overridable, boolean autoImplemented) {
        PropertyInfo propertyInfo = new PropertyInfo(owner, name, type, isStatic, overridable, autoImplemented);
        propertyInfo.setGetter(new MethodInfo(propertyInfo, MethodInfo.Kind.GETTER, List.of(), type));
        ParameterInfo value = new ParameterInfo("value", type, 0, ParameterMode.VALUE);
        propertyInfo.setSetter(new MethodInfo(propertyInfo, MethodInfo.Kind.SETTER, List.of(value), voidType));
        return propertyInfo;
    }

    public PropertyInfo newAutoProperty(TypeInfo owner, String name, TypeInfo type) {
        return newProperty(owner, name, type, false, false, true);
    }

    public ParameterInfo newParameter(int index, String name, TypeInfo type) {
        return new ParameterInfo(name, type, index, ParameterMode.VALUE);
    }

    public ParameterInfo newParameter(int index, String name, TypeInfo type, ParameterMode mode) {
        return new ParameterInfo(name, type, index, mode);
    }

    public MethodInfo newMethod(TypeInfo owner, String name, TypeInfo returnType, boolean isStatic,
                                boolean isVirtual, MethodInfo overrides, List<ParameterInfo> parameters) {
        return new MethodInfo(owner, name, MethodInfo.Kind.METHOD, returnType, isStatic, isVirtual, parameters,
                overrides);
    }

    /*
    instance method, not virtual, returning void
     */
    public MethodInfo newMethod(TypeInfo owner, String name, ParameterInfo... parameters) {
        return newMethod(owner, name, voidType, false, false, null, Arrays.asList(parameters));
    }

    public MethodInfo newStaticMethod(TypeInfo owner, String name, ParameterInfo... parameters) {
        return newMethod(owner, name, voidType, true, false, null, Arrays.asList(parameters));
    }

    public MethodInfo newConstructor(TypeInfo owner, ParameterInfo... parameters) {
        return new MethodInfo(owner, "<init>", MethodInfo.Kind.CONSTRUCTOR, owner, false, false,
                Arrays.asList(parameters), null);
    }

    public MethodInfo defaultConstructor(TypeInfo typeInfo) {
        return defaultConstructors.computeIfAbsent(typeInfo, t -> newConstructor(t));
    }

    public LocalVariable newLocalVariable(String name, TypeInfo type) {
        return new LocalVariable(name, type);
    }

    public LambdaInfo newLambdaInfo(Callable enclosing, ParameterInfo... parameters) {
        int index = lambdaCounters.merge(enclosing, 1, Integer::sum) - 1;
        return new LambdaInfo(enclosing, index, Arrays.asList(parameters));
    }

    // expressions

    public Literal intLiteral(int i) {
        return new Literal(i, intType);
    }

    public Literal boolLiteral(boolean b) {
        return new Literal(b, boolType);
    }

    public Literal stringLiteral(String s) {
        return new Literal(s, stringType);
    }

    public Literal nullLiteral() {
        return new Literal(null, objectType);
    }

    public VariableAccess access(LocalVariable localVariable) {
        return new VariableAccess(localVariable);
    }

    public ThisAccess thisAccess(TypeInfo typeInfo) {
        return new ThisAccess(typeInfo);
    }

    public TypeAccess typeAccess(TypeInfo typeInfo) {
        return new TypeAccess(typeInfo);
    }

    /*
    member access with implicit qualifier
     */
    public MemberAccess access(Member member) {
        return new MemberAccess(null, member);
    }

    public MemberAccess access(Expression qualifier, Member member) {
        return new MemberAccess(qualifier, member);
    }

    public ArrayAccess arrayAccess(Expression array, Expression index) {
        return new ArrayAccess(array, index, objectType);
    }

    public Assignment assign(Expression target, Expression value) {
        return new Assignment(target, null, value);
    }

    public Assignment assign(Expression target, BinaryOperation.Operator operator, Expression value) {
        return new Assignment(target, operator, value);
    }

    public Assignment increment(Expression target) {
        return new Assignment(target, BinaryOperation.Operator.ADD, intLiteral(1));
    }

    public BinaryOperation binary(Expression lhs, BinaryOperation.Operator operator, Expression rhs) {
        TypeInfo type = switch (operator) {
            case EQUALS, NOT_EQUALS, LESS, LESS_EQUALS, GREATER, GREATER_EQUALS -> boolType;
            default -> lhs.type();
        };
        return new BinaryOperation(lhs, operator, rhs, type);
    }

    public Expression and(Expression lhs, Expression rhs) {
        return new LogicalAnd(lhs, rhs, boolType);
    }

    public Expression or(Expression lhs, Expression rhs) {
        return new LogicalOr(lhs, rhs, boolType);
    }

    public Expression not(Expression operand) {
        return new LogicalNot(operand);
    }

    public MethodCall call(Expression qualifier, MethodInfo methodInfo, Expression... arguments) {
        return new MethodCall(qualifier, methodInfo, Arrays.asList(arguments));
    }

    public MethodCall call(MethodInfo methodInfo, Expression... arguments) {
        return new MethodCall(null, methodInfo, Arrays.asList(arguments));
    }

    public DelegateCall delegateCall(Expression delegate, Expression... arguments) {
        return new DelegateCall(delegate, Arrays.asList(arguments), objectType);
    }

    public ObjectCreation newObject(MethodInfo constructor, Expression... arguments) {
        return new ObjectCreation(constructor, Arrays.asList(arguments), List.of());
    }

    public ObjectCreation newException(TypeInfo exceptionType) {
        assert exceptionType.isSubtypeOf(this.exceptionType);
        return new ObjectCreation(defaultConstructor(exceptionType), List.of(), List.of());
    }

    public Lambda lambda(LambdaInfo lambdaInfo) {
        return new Lambda(lambdaInfo, delegateType);
    }

    public LocalVariableDeclaration declaration(LocalVariable localVariable, Expression initializer) {
        return new LocalVariableDeclaration(localVariable, initializer);
    }

    // statements

    public Block block(Statement... statements) {
        return new Block(Arrays.asList(statements));
    }

    public ExpressionStatement statement(Expression expression) {
        return new ExpressionStatement(expression);
    }

    public LocalDeclarationStatement declare(LocalVariable localVariable, Expression initializer) {
        return new LocalDeclarationStatement(List.of(new LocalVariableDeclaration(localVariable, initializer)));
    }

    public IfStatement ifStatement(Expression condition, Statement thenStatement) {
        return new IfStatement(condition, thenStatement, null);
    }

    public IfStatement ifStatement(Expression condition, Statement thenStatement, Statement elseStatement) {
        return new IfStatement(condition, thenStatement, elseStatement);
    }

    public WhileStatement whileStatement(Expression condition, Statement body) {
        return new WhileStatement(condition, body);
    }

    public ReturnStatement returnStatement(Expression expression) {
        return new ReturnStatement(expression);
    }

    public ThrowStatement throwStatement(TypeInfo exceptionType) {
        return new ThrowStatement(newException(exceptionType));
    }

    public TryStatement tryStatement(Block block, Block finallyBlock, CatchClause... catchClauses) {
        return new TryStatement(block, new ArrayList<>(Arrays.asList(catchClauses)), finallyBlock);
    }

    public CatchClause catchClause(TypeInfo exceptionType, Statement... statements) {
        return new CatchClause(exceptionType, null, null, block(statements));
    }
}
