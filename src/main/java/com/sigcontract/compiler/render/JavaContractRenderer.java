package com.sigcontract.compiler.render;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.comments.LineComment;
import com.github.javaparser.ast.expr.*;
import com.github.javaparser.ast.stmt.*;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.ast.type.VoidType;
import com.sigcontract.compiler.contract.Check;
import com.sigcontract.compiler.contract.ContractCode;
import com.sigcontract.compiler.contract.EmissionProfile;
import com.sigcontract.compiler.exception.ContractViolationException.Phase;
import com.sigcontract.compiler.model.Expr;
import com.sigcontract.compiler.model.Signature;
import com.sigcontract.compiler.model.Subject;
import com.sigcontract.compiler.model.TypeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Renders {@link ContractCode} as Java source: a {@code <Name>Contracts}
 * class whose static methods check the preconditions, postconditions and
 * record invariants of one function. Every check is also documented as a
 * {@code @Requires}, {@code @Ensures} or {@code @Invariant} annotation.
 *
 * Records are rendered as {@code Map<String, Object>}, sequences as
 * {@code List}, and optionals as nullable references or {@code Optional}
 * depending on the emission profile.
 */
public class JavaContractRenderer {

    private static final Logger logger = LoggerFactory.getLogger(JavaContractRenderer.class);

    public static final String DEFAULT_PACKAGE = "generated.contracts";

    private static final String ANNOTATIONS = "com.sigcontract.compiler.annotations.";
    private static final String VIOLATION = "ContractViolationException";
    private static final String FAILURES = "failures";

    // Types of rendered expressions that do not come from the signature's arena
    private static final int INT = -1;
    private static final int BOOL = -2;
    private static final int DOUBLE = -3;

    private enum Shape {
        INTEGRAL, DOUBLE, BOOLEAN, TEXT, OBJECT, SEQUENCE, OPTIONAL, RECORD
    }

    /** How a failed check is reported. */
    private enum Sink {
        THROW, COLLECT
    }

    private record Typed(String code, int type, boolean boxed) {
    }

    private final JavaParser javaParser;
    private final String packageName;

    public JavaContractRenderer() {
        this(DEFAULT_PACKAGE);
    }

    public JavaContractRenderer(String packageName) {
        ParserConfiguration parserConfig = new ParserConfiguration();
        parserConfig.setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        this.javaParser = new JavaParser(parserConfig);
        this.packageName = packageName;
    }

    /**
     * @param signature the signature the contract was synthesized from; it
     *                  supplies the Java types of parameters and record fields
     */
    public CompilationUnit render(ContractCode code, Signature signature) {
        if (!code.getSourceName().equals(signature.getName())) {
            throw new IllegalArgumentException("Contract " + code.getSourceName() + " does not belong to " + signature.getName());
        }
        CompilationUnit cu = new Rendering(code, signature).compilationUnit();
        logger.info("Rendered {} for {}", className(code), code.getSourceName());
        return cu;
    }

    public static String className(ContractCode code) {
        StringBuilder name = new StringBuilder();
        for (String word : code.getSourceName().split("[_']+")) {
            if (!word.isEmpty()) {
                name.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
            }
        }
        return name + "Contracts";
    }

    private final class Rendering {
        private final ContractCode code;
        private final Signature signature;
        private final boolean tagged;
        private final Map<String, Integer> variableTypes = new HashMap<>();
        private final Set<String> boxedVariables = new HashSet<>();
        private final Map<ContractCode.RecordInvariant, String> invariantMethods = new LinkedHashMap<>();
        private int loopVariables;
        private boolean unchecked;

        Rendering(ContractCode code, Signature signature) {
            this.code = code;
            this.signature = signature;
            this.tagged = code.getProfile().getOptionalRepresentation() == EmissionProfile.OptionalRepresentation.TAGGED;
            for (Map.Entry<String, String> parameter : code.getParameterNames().entrySet()) {
                variableTypes.put(parameter.getValue(), parameterType(parameter.getKey()));
            }
            Set<String> used = new HashSet<>();
            for (ContractCode.RecordInvariant invariant : code.getInvariants()) {
                String base = "check" + (invariant.recordName() != null ? capitalize(invariant.recordName()) : "Record")
                        + "Invariant";
                String name = base;
                for (int i = 2; !used.add(name); i++) {
                    name = base + i;
                }
                invariantMethods.put(invariant, name);
            }
        }

        CompilationUnit compilationUnit() {
            CompilationUnit cu = new CompilationUnit(packageName);
            ClassOrInterfaceDeclaration type = cu.addClass(className(code), Modifier.Keyword.PUBLIC, Modifier.Keyword.FINAL);
            type.setJavadocComment("Runtime contract of {@code " + signature.render() + "}.");
            type.addConstructor(Modifier.Keyword.PRIVATE);

            type.addMember(preconditionMethod());
            if (!code.getPostconditions().isEmpty() || code.getInvariants().stream().anyMatch(ContractCode.RecordInvariant::onResult)) {
                type.addMember(postconditionMethod());
            }
            for (Map.Entry<ContractCode.RecordInvariant, String> entry : invariantMethods.entrySet()) {
                type.addMember(invariantMethod(entry.getKey(), entry.getValue()));
                for (Check.Guard guard : guards(entry.getKey().checks())) {
                    type.addAnnotation(invariantAnnotation(entry.getKey(), guard));
                }
            }
            if (unchecked) {
                type.addSingleMemberAnnotation(SuppressWarnings.class, new StringLiteralExpr("unchecked"));
            }

            cu.addImport("java.util.ArrayList");
            cu.addImport("java.util.List");
            cu.addImport("java.util.Map");
            cu.addImport("java.util.Objects");
            if (tagged) {
                cu.addImport("java.util.Optional");
            }
            cu.addImport("com.sigcontract.compiler.exception." + VIOLATION);
            cu.addImport("com.sigcontract.compiler.exception.UnreachableCaseException");
            if (returnsResult()) {
                cu.addImport("com.sigcontract.compiler.contract.ContractResult");
            }
            return cu;
        }

        private boolean returnsResult() {
            return code.getProfile().getAssertionStyle() == EmissionProfile.AssertionStyle.RETURN_RESULT;
        }

        // ==================== Methods ====================

        private MethodDeclaration preconditionMethod() {
            MethodDeclaration method = new MethodDeclaration();
            method.setName("checkPreconditions");
            method.setModifiers(Modifier.Keyword.PUBLIC, Modifier.Keyword.STATIC);
            method.setParameters(parameters(false));
            method.setJavadocComment("Checks the arguments of {@code " + code.getFunctionName()
                    + "}, stopping at the first violation.");

            BlockStmt checks = new BlockStmt();
            for (ContractCode.EntryStep step : code.entrySteps()) {
                checks.addStatement(step.invariant() != null
                        ? invariantCall(step.invariant(), Sink.THROW)
                        : statement(step.precondition(), Sink.THROW));
            }
            for (Check.Guard guard : guards(code.getPreconditions())) {
                method.addAnnotation(contractAnnotation("Requires", guard));
            }

            if (returnsResult()) {
                method.setType(classType("ContractResult"));
                CatchClause handler = new CatchClause(new Parameter(classType(VIOLATION), "e"),
                        new BlockStmt(NodeList.nodeList(new ReturnStmt(call("ContractResult", "violation", new NameExpr("e"))))));
                BlockStmt body = new BlockStmt();
                body.addStatement(new TryStmt(checks, NodeList.nodeList(handler), null));
                body.addStatement(new ReturnStmt(call("ContractResult", "success", new NullLiteralExpr())));
                method.setBody(body);
            } else {
                method.setType(new VoidType());
                method.setBody(checks);
            }
            return method;
        }

        private MethodDeclaration postconditionMethod() {
            MethodDeclaration method = new MethodDeclaration();
            method.setName("checkPostconditions");
            method.setModifiers(Modifier.Keyword.PUBLIC, Modifier.Keyword.STATIC);
            method.setParameters(parameters(true));
            method.setJavadocComment("Checks the value returned by {@code " + code.getFunctionName()
                    + "}; every failed check is reported.");

            BlockStmt body = new BlockStmt();
            body.addStatement(parseStatement("List<" + VIOLATION + "> " + FAILURES + " = new ArrayList<>();"));
            for (ContractCode.RecordInvariant invariant : code.getInvariants()) {
                if (invariant.onResult()) {
                    body.addStatement(invariantCall(invariant, Sink.COLLECT));
                }
            }
            for (Check check : code.getPostconditions()) {
                body.addStatement(statement(check, Sink.COLLECT));
            }
            for (Check.Guard guard : guards(code.getPostconditions())) {
                method.addAnnotation(contractAnnotation("Ensures", guard));
            }

            Expression aggregate = call(VIOLATION, "aggregate", new NameExpr(FAILURES));
            Expression anyFailed = new UnaryExpr(new MethodCallExpr(new NameExpr(FAILURES), "isEmpty"),
                    UnaryExpr.Operator.LOGICAL_COMPLEMENT);
            if (returnsResult()) {
                method.setType(classType("ContractResult"));
                body.addStatement(new IfStmt(anyFailed,
                        block(new ReturnStmt(call("ContractResult", "violation", aggregate))), null));
                body.addStatement(new ReturnStmt(call("ContractResult", "success", new NameExpr(code.getResultName()))));
            } else {
                method.setType(new VoidType());
                body.addStatement(new IfStmt(anyFailed, block(new ThrowStmt(aggregate)), null));
            }
            method.setBody(body);
            return method;
        }

        private MethodDeclaration invariantMethod(ContractCode.RecordInvariant invariant, String name) {
            int siteType = siteType(invariant.site());
            variableTypes.put(ContractCode.RecordInvariant.SELF, siteType);

            MethodDeclaration method = new MethodDeclaration();
            method.setName(name);
            method.setModifiers(Modifier.Keyword.PUBLIC, Modifier.Keyword.STATIC);
            method.setType(new VoidType());
            method.addParameter(type(javaType(siteType, false)), ContractCode.RecordInvariant.SELF);
            for (String outer : invariant.outerVariables()) {
                method.addParameter(type(javaType(outerType(outer), false)), outer);
            }
            BlockStmt body = new BlockStmt();
            for (Check check : invariant.checks()) {
                body.addStatement(statement(check, Sink.THROW));
            }
            method.setBody(body);
            for (Check.Guard guard : guards(invariant.checks())) {
                method.addAnnotation(invariantAnnotation(invariant, guard));
            }

            variableTypes.remove(ContractCode.RecordInvariant.SELF);
            return method;
        }

        private int outerType(String variable) {
            if (variable.equals(code.getResultName())) {
                return signature.getReturnType();
            }
            Integer type = variableTypes.get(variable);
            if (type == null) {
                throw new IllegalStateException("Invariant reads unknown variable " + variable);
            }
            return type;
        }

        private NodeList<Parameter> parameters(boolean withResult) {
            NodeList<Parameter> parameters = new NodeList<>();
            for (Map.Entry<String, String> parameter : code.getParameterNames().entrySet()) {
                parameters.add(new Parameter(type(javaType(parameterType(parameter.getKey()), false)), parameter.getValue()));
            }
            if (withResult) {
                variableTypes.put(code.getResultName(), signature.getReturnType());
                parameters.add(new Parameter(type(javaType(signature.getReturnType(), false)), code.getResultName()));
            }
            return parameters;
        }

        // ==================== Statements ====================

        private Statement statement(Check check, Sink sink) {
            if (check instanceof Check.Guard guard) {
                return guard(guard, sink);
            }
            return branch((Check.Branch) check, sink);
        }

        private Statement guard(Check.Guard guard, Sink sink) {
            Expression condition = parseExpression(expression(guard.condition()).code());
            Expression violation = new ObjectCreationExpr(null, classType(VIOLATION), NodeList.nodeList(
                    literal(guard.constraintId()), phase(guard.phase()), literal(guard.failureMessage())));
            Statement onFailure = sink == Sink.THROW
                    ? new ThrowStmt(violation)
                    : new ExpressionStmt(new MethodCallExpr(new NameExpr(FAILURES), "add", NodeList.nodeList(violation)));
            return new IfStmt(new UnaryExpr(new EnclosedExpr(condition), UnaryExpr.Operator.LOGICAL_COMPLEMENT),
                    block(onFailure), null);
        }

        private Statement branch(Check.Branch branch, Sink sink) {
            Typed scrutinee = expression(branch.scrutinee());
            Expression value = parseExpression(scrutinee.code());
            Expression absent = tagged
                    ? new MethodCallExpr(value, "isEmpty")
                    : new BinaryExpr(value, new NullLiteralExpr(), BinaryExpr.Operator.EQUALS);
            Expression present = tagged
                    ? new MethodCallExpr(value.clone(), "isPresent")
                    : new BinaryExpr(value.clone(), new NullLiteralExpr(), BinaryExpr.Operator.NOT_EQUALS);

            BlockStmt absentBlock = caseBlock(branch, Check.Tag.ABSENT, sink);
            BlockStmt presentBlock = caseBlock(branch, Check.Tag.PRESENT, sink);
            if (branch.fallback() == null) {
                return new IfStmt(absent, absentBlock, presentBlock);
            }
            Statement unreachable = new ThrowStmt(new ObjectCreationExpr(null, classType("UnreachableCaseException"),
                    NodeList.nodeList(literal(branch.constraintId()), literal(branch.fallback()))));
            return new IfStmt(absent, absentBlock, new IfStmt(present, presentBlock, block(unreachable)));
        }

        private BlockStmt caseBlock(Check.Branch branch, Check.Tag tag, Sink sink) {
            BlockStmt block = new BlockStmt();
            Check.BranchCase branchCase = branch.caseFor(tag);
            if (branchCase == null || branchCase.checks().isEmpty()) {
                block.addOrphanComment(new LineComment(" " + tag.name().toLowerCase() + ": nothing to check"));
                return block;
            }
            for (Check check : branchCase.checks()) {
                block.addStatement(statement(check, sink));
            }
            return block;
        }

        private Statement invariantCall(ContractCode.RecordInvariant invariant, Sink sink) {
            String methodName = invariantMethods.get(invariant);
            loopVariables = 0;
            String callText = visitSite(invariant.site(), value -> {
                String invocation = methodName + "(" + value.code()
                        + invariant.outerVariables().stream().map(outer -> ", " + outer).collect(Collectors.joining())
                        + ");";
                return sink == Sink.THROW
                        ? invocation
                        : "try { " + invocation + " } catch (" + VIOLATION + " e) { " + FAILURES + ".add(e); }";
            });
            return parseStatement(callText);
        }

        /**
         * Source text that applies {@code body} to every value a site denotes.
         */
        private String visitSite(Subject site, Function<Typed, String> body) {
            if (site instanceof Subject.Param param) {
                String name = code.getParameterNames().get(param.name());
                return body.apply(new Typed(name, parameterType(param.name()), false));
            }
            if (site instanceof Subject.Result) {
                return body.apply(new Typed(code.getResultName(), signature.getReturnType(), false));
            }
            if (site instanceof Subject.FieldOf field) {
                return visitSite(field.owner(), owner -> {
                    int fieldType = fieldType(owner.type(), field.field());
                    return body.apply(new Typed(fieldRead(owner.code(), field.field(), fieldType), fieldType, false));
                });
            }
            if (site instanceof Subject.ElementOf element) {
                return visitSite(element.owner(), owner -> {
                    int elementType = elementType(owner.type());
                    String variable = "element" + (loopVariables++ == 0 ? "" : String.valueOf(loopVariables));
                    return "for (" + javaType(elementType, true) + " " + variable + " : " + owner.code() + ") { "
                            + body.apply(new Typed(variable, elementType, true)) + " }";
                });
            }
            Subject.PresentOf present = (Subject.PresentOf) site;
            return visitSite(present.owner(), owner -> {
                int inner = innerType(owner.type());
                return tagged
                        ? "if (" + owner.code() + ".isPresent()) { " + body.apply(new Typed(owner.code() + ".get()", inner, true)) + " }"
                        : "if (" + owner.code() + " != null) { " + body.apply(new Typed(owner.code(), inner, true)) + " }";
            });
        }

        // ==================== Expressions ====================

        private Typed expression(Expr expr) {
            if (expr instanceof Expr.IntLit lit) {
                return new Typed(lit.value() + "L", INT, false);
            }
            if (expr instanceof Expr.BoolLit lit) {
                return new Typed(Boolean.toString(lit.value()), BOOL, false);
            }
            if (expr instanceof Expr.Var variable) {
                Integer type = variableTypes.get(variable.name());
                if (type == null) {
                    throw new IllegalArgumentException("Unknown variable " + variable.name() + " in " + code.getSourceName());
                }
                return new Typed(variable.name(), type, boxedVariables.contains(variable.name()));
            }
            if (expr instanceof Expr.Length length) {
                Typed target = expression(length.target());
                require(target, Shape.SEQUENCE, expr);
                return new Typed(target.code() + ".size()", INT, false);
            }
            if (expr instanceof Expr.Field field) {
                Typed target = expression(field.target());
                require(target, Shape.RECORD, expr);
                int fieldType = fieldType(target.type(), field.name());
                return new Typed(fieldRead(target.code(), field.name(), fieldType), fieldType, false);
            }
            if (expr instanceof Expr.Unwrap unwrap) {
                Typed target = expression(unwrap.target());
                require(target, Shape.OPTIONAL, expr);
                int inner = innerType(target.type());
                return new Typed(tagged ? target.code() + ".get()" : target.code(), inner, true);
            }
            if (expr instanceof Expr.Arith arith) {
                Typed left = expression(arith.left());
                Typed right = expression(arith.right());
                int type = shape(left.type()) == Shape.DOUBLE || shape(right.type()) == Shape.DOUBLE ? DOUBLE : INT;
                return new Typed("(" + scalar(left) + " " + arith.op().symbol() + " " + scalar(right) + ")", type, false);
            }
            if (expr instanceof Expr.Compare compare) {
                return new Typed(comparison(compare), BOOL, false);
            }
            if (expr instanceof Expr.Logic logic) {
                return new Typed("(" + scalar(expression(logic.left())) + " " + logic.op().symbol() + " "
                        + scalar(expression(logic.right())) + ")", BOOL, false);
            }
            if (expr instanceof Expr.Not not) {
                return new Typed("!(" + scalar(expression(not.operand())) + ")", BOOL, false);
            }
            if (expr instanceof Expr.ForAll forAll) {
                Typed collection = expression(forAll.collection());
                require(collection, Shape.SEQUENCE, expr);
                variableTypes.put(forAll.binder(), elementType(collection.type()));
                boxedVariables.add(forAll.binder());
                Typed body = expression(forAll.body());
                variableTypes.remove(forAll.binder());
                boxedVariables.remove(forAll.binder());
                return new Typed(collection.code() + ".stream().allMatch(" + forAll.binder() + " -> " + scalar(body) + ")",
                        BOOL, false);
            }
            throw new IllegalArgumentException("Cannot render " + expr.render() + " as Java");
        }

        private String comparison(Expr.Compare compare) {
            Typed left = expression(compare.left());
            Typed right = expression(compare.right());
            Expr.CompareOp op = compare.op();
            if (shape(left.type()) == Shape.TEXT || shape(right.type()) == Shape.TEXT) {
                if (op == Expr.CompareOp.EQ) {
                    return "Objects.equals(" + left.code() + ", " + right.code() + ")";
                }
                if (op == Expr.CompareOp.NE) {
                    return "!Objects.equals(" + left.code() + ", " + right.code() + ")";
                }
                return left.code() + ".compareTo(" + right.code() + ") " + op.symbol() + " 0";
            }
            return scalar(left) + " " + op.symbol() + " " + scalar(right);
        }

        /**
         * Code of a value as a primitive, so comparisons never compare boxes by identity.
         */
        private String scalar(Typed value) {
            if (!value.boxed()) {
                return value.code();
            }
            switch (shape(value.type())) {
                case INTEGRAL:
                    return value.code() + ".longValue()";
                case DOUBLE:
                    return value.code() + ".doubleValue()";
                case BOOLEAN:
                    return value.code() + ".booleanValue()";
                default:
                    return value.code();
            }
        }

        private String fieldRead(String owner, String field, int fieldType) {
            String read = owner + ".get(\"" + field + "\")";
            switch (shape(fieldType)) {
                case INTEGRAL:
                    return "((Number) " + read + ").longValue()";
                case DOUBLE:
                    return "((Number) " + read + ").doubleValue()";
                default:
                    String javaType = javaType(fieldType, true);
                    if (javaType.contains("<")) {
                        unchecked = true;
                    }
                    return "((" + javaType + ") " + read + ")";
            }
        }

        private void require(Typed value, Shape expected, Expr context) {
            if (shape(value.type()) != expected) {
                throw new IllegalArgumentException("Expected a " + expected.name().toLowerCase() + " in "
                        + context.render() + " but found " + value.code());
            }
        }

        // ==================== Types ====================

        private int parameterType(String sourceName) {
            return signature.getParameter(sourceName)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown parameter " + sourceName))
                    .type();
        }

        private int siteType(Subject site) {
            if (site instanceof Subject.Param param) {
                return parameterType(param.name());
            }
            if (site instanceof Subject.Result) {
                return signature.getReturnType();
            }
            int owner = siteType(site.owner());
            if (site instanceof Subject.FieldOf field) {
                return fieldType(owner, field.field());
            }
            return site instanceof Subject.ElementOf ? elementType(owner) : innerType(owner);
        }

        private Shape shape(int type) {
            if (type == INT) return Shape.INTEGRAL;
            if (type == BOOL) return Shape.BOOLEAN;
            if (type == DOUBLE) return Shape.DOUBLE;
            TypeNode node = signature.stripRefinements(type);
            if (node instanceof TypeNode.SizedSequence) return Shape.SEQUENCE;
            if (node instanceof TypeNode.OptionalType) return Shape.OPTIONAL;
            if (node instanceof TypeNode.RecordType) return Shape.RECORD;
            if (node instanceof TypeNode.Primitive primitive) {
                switch (primitive.kind()) {
                    case BOOLEAN:
                        return Shape.BOOLEAN;
                    case TEXT:
                        return Shape.TEXT;
                    case DOUBLE:
                        return Shape.DOUBLE;
                    case TYPE_VARIABLE:
                        return Shape.OBJECT;
                    default:
                        return Shape.INTEGRAL;
                }
            }
            return Shape.INTEGRAL;
        }

        private String javaType(int type, boolean boxed) {
            TypeNode node = signature.stripRefinements(type);
            if (node instanceof TypeNode.SizedSequence sequence) {
                return "List<" + javaType(sequence.element(), true) + ">";
            }
            if (node instanceof TypeNode.OptionalType optional) {
                return tagged ? "Optional<" + javaType(optional.inner(), true) + ">" : javaType(optional.inner(), true);
            }
            if (node instanceof TypeNode.RecordType) {
                return "Map<String, Object>";
            }
            switch (shape(type)) {
                case BOOLEAN:
                    return boxed ? "Boolean" : "boolean";
                case DOUBLE:
                    return boxed ? "Double" : "double";
                case TEXT:
                    return "String";
                case OBJECT:
                    return "Object";
                default:
                    return boxed ? "Long" : "long";
            }
        }

        private int fieldType(int recordType, String field) {
            TypeNode node = signature.stripRefinements(recordType);
            if (node instanceof TypeNode.RecordType recordNode) {
                for (TypeNode.RecordField candidate : recordNode.fields()) {
                    if (candidate.name().equals(field)) {
                        return candidate.type();
                    }
                }
            }
            throw new IllegalArgumentException("No field " + field + " in " + signature.getArena().render(recordType));
        }

        private int elementType(int sequenceType) {
            TypeNode node = signature.stripRefinements(sequenceType);
            if (node instanceof TypeNode.SizedSequence sequence) {
                return sequence.element();
            }
            throw new IllegalArgumentException("Not a sequence: " + signature.getArena().render(sequenceType));
        }

        private int innerType(int optionalType) {
            TypeNode node = signature.stripRefinements(optionalType);
            if (node instanceof TypeNode.OptionalType optional) {
                return optional.inner();
            }
            throw new IllegalArgumentException("Not an optional: " + signature.getArena().render(optionalType));
        }

        // ==================== AST helpers ====================

        private AnnotationExpr contractAnnotation(String annotation, Check.Guard guard) {
            return new NormalAnnotationExpr(new Name(ANNOTATIONS + annotation), NodeList.nodeList(
                    new MemberValuePair("value", literal(restatement(guard))),
                    new MemberValuePair("constraint", literal(guard.constraintId()))));
        }

        private AnnotationExpr invariantAnnotation(ContractCode.RecordInvariant invariant, Check.Guard guard) {
            NodeList<MemberValuePair> pairs = NodeList.nodeList(new MemberValuePair("value", literal(restatement(guard))));
            if (invariant.recordName() != null) {
                pairs.add(new MemberValuePair("record", literal(invariant.recordName())));
            }
            pairs.add(new MemberValuePair("constraint", literal(guard.constraintId())));
            return new NormalAnnotationExpr(new Name(ANNOTATIONS + "Invariant"), pairs);
        }

        private Expression phase(Phase phase) {
            return new FieldAccessExpr(new FieldAccessExpr(new NameExpr(VIOLATION), "Phase"), phase.name());
        }

        private Expression call(String owner, String method, Expression argument) {
            return new MethodCallExpr(new NameExpr(owner), method, NodeList.nodeList(argument));
        }

        private Expression parseExpression(String text) {
            return parsed(javaParser.parseExpression(text), text);
        }

        private Statement parseStatement(String text) {
            return parsed(javaParser.parseStatement(text), text);
        }

        private Type type(String text) {
            return parsed(javaParser.parseType(text), text);
        }

        private ClassOrInterfaceType classType(String name) {
            return parsed(javaParser.parseClassOrInterfaceType(name), name);
        }

        private <T extends Node> T parsed(ParseResult<T> result, String text) {
            return result.getResult()
                    .filter(node -> result.isSuccessful())
                    .orElseThrow(() -> new IllegalStateException("Rendered invalid Java: " + text + " " + result.getProblems()));
        }
    }

    /**
     * Every guard in a check list, including those nested in branches.
     */
    private static List<Check.Guard> guards(List<Check> checks) {
        List<Check.Guard> guards = new ArrayList<>();
        for (Check check : checks) {
            if (check instanceof Check.Guard guard) {
                guards.add(guard);
            } else if (check instanceof Check.Branch branch) {
                branch.cases().forEach(c -> guards.addAll(guards(c.checks())));
            }
        }
        return guards;
    }

    /**
     * The restated constraint of a failure message, without its
     * {@code phase violated [id Kind]:} prefix.
     */
    static String restatement(Check.Guard guard) {
        String message = guard.failureMessage();
        int start = message.indexOf("]: ");
        return start >= 0 ? message.substring(start + 3) : message;
    }

    private static BlockStmt block(Statement statement) {
        return new BlockStmt(NodeList.nodeList(statement));
    }

    private static StringLiteralExpr literal(String value) {
        // Escape quotes and backslashes in the value
        return new StringLiteralExpr(value.replace("\\", "\\\\").replace("\"", "\\\""));
    }

    private static String capitalize(String word) {
        return word.isEmpty() ? word : Character.toUpperCase(word.charAt(0)) + word.substring(1);
    }
}
