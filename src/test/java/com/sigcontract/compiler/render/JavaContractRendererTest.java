package com.sigcontract.compiler.render;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.MemberValuePair;
import com.github.javaparser.ast.expr.NormalAnnotationExpr;
import com.sigcontract.compiler.analysis.ConstraintExtractor;
import com.sigcontract.compiler.contract.ContractCode;
import com.sigcontract.compiler.contract.ContractSynthesizer;
import com.sigcontract.compiler.contract.EmissionProfile;
import com.sigcontract.compiler.model.Signature;
import com.sigcontract.compiler.parser.SignatureParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class JavaContractRendererTest {

    private static final String TAKE = "take(n: Nat, xs: SizedSequence(T, n + m)) -> SizedSequence(T, n)";
    private static final String LOOKUP = "lookup(i: Maybe(Fin(n)), xs: SizedSequence(Int, n)) -> Int";

    private final JavaContractRenderer renderer = new JavaContractRenderer();

    private static Signature signature(String text) {
        return new SignatureParser().parse(text);
    }

    private static ContractCode contract(Signature signature, EmissionProfile profile) {
        return new ContractSynthesizer().synthesize(new ConstraintExtractor().extract(signature), profile);
    }

    private CompilationUnit render(String text, EmissionProfile profile) {
        Signature signature = signature(text);
        return renderer.render(contract(signature, profile), signature);
    }

    private static MethodDeclaration method(CompilationUnit cu, String className, String name) {
        ClassOrInterfaceDeclaration type = cu.getClassByName(className).orElseThrow();
        List<MethodDeclaration> methods = type.getMethodsByName(name);
        assertThat(methods).hasSize(1);
        return methods.get(0);
    }

    private static List<String> constraintIds(MethodDeclaration method, String annotation) {
        return method.getAnnotations().stream()
                .filter(a -> a.getNameAsString().endsWith("." + annotation))
                .map(AnnotationExpr::asNormalAnnotationExpr)
                .map(NormalAnnotationExpr::getPairs)
                .flatMap(List::stream)
                .filter(pair -> pair.getNameAsString().equals("constraint"))
                .map(MemberValuePair::getValue)
                .map(value -> value.asStringLiteralExpr().getValue())
                .toList();
    }

    // ==================== Class layout ====================

    @Test
    void rendersOneContractsClassPerFunction() {
        CompilationUnit cu = render(TAKE, EmissionProfile.defaults());

        assertThat(cu.getPackageDeclaration()).hasValueSatisfying(
                p -> assertThat(p.getNameAsString()).isEqualTo(JavaContractRenderer.DEFAULT_PACKAGE));
        ClassOrInterfaceDeclaration type = cu.getClassByName("TakeContracts").orElseThrow();
        assertThat(type.isFinal()).isTrue();
        assertThat(type.getJavadocComment()).isPresent();
        assertThat(new JavaParser().parse(cu.toString()).isSuccessful()).isTrue();
    }

    @Test
    void snakeCaseNamesBecomePascalCaseClasses() {
        Signature signature = signature("get_item(i: Fin(n), xs: SizedSequence(Int, n)) -> Int");

        assertThat(JavaContractRenderer.className(contract(signature, EmissionProfile.defaults())))
                .isEqualTo("GetItemContracts");
    }

    @Test
    void customPackageIsUsed() {
        Signature signature = signature(TAKE);
        CompilationUnit cu = new JavaContractRenderer("org.example.checks")
                .render(contract(signature, EmissionProfile.defaults()), signature);

        assertThat(cu.getPackageDeclaration().orElseThrow().getNameAsString()).isEqualTo("org.example.checks");
    }

    // ==================== Checks ====================

    @Test
    void preconditionsAndPostconditionsCarryTheirConstraintIds() {
        CompilationUnit cu = render(TAKE, EmissionProfile.defaults());

        MethodDeclaration pre = method(cu, "TakeContracts", "checkPreconditions");
        assertThat(pre.isStatic()).isTrue();
        assertThat(pre.getType().isVoidType()).isTrue();
        assertThat(pre.getParameters()).extracting(p -> p.getNameAsString()).containsExactly("n", "xs");
        assertThat(constraintIds(pre, "Requires")).containsExactly("take.c1", "take.c2");

        MethodDeclaration post = method(cu, "TakeContracts", "checkPostconditions");
        assertThat(post.getParameters()).extracting(p -> p.getNameAsString()).containsExactly("n", "xs", "result");
        assertThat(constraintIds(post, "Ensures")).containsExactly("take.c3");
        assertThat(post.toString()).contains("ContractViolationException.aggregate(failures)");
    }

    @Test
    void failureMessagesAreEmbeddedVerbatim() {
        String source = render(TAKE, EmissionProfile.defaults()).toString();

        assertThat(source).contains(
                "\"precondition violated [take.c2 LengthAtLeast]: length of xs must be at least n\"");
        assertThat(source).contains("xs.size()");
    }

    @Test
    void unconstrainedResultHasNoPostconditionMethod() {
        CompilationUnit cu = render("sum(xs: SizedSequence(Int, n)) -> Int", EmissionProfile.defaults());

        assertThat(cu.getClassByName("SumContracts").orElseThrow().getMethodsByName("checkPostconditions")).isEmpty();
    }

    @Test
    void recordInvariantsGetTheirOwnMethod() {
        CompilationUnit cu = render("area(r: Record { w: Nat, h: Nat }) -> Nat", EmissionProfile.defaults());

        ClassOrInterfaceDeclaration type = cu.getClassByName("AreaContracts").orElseThrow();
        List<MethodDeclaration> invariants = type.getMethods().stream()
                .filter(m -> m.getNameAsString().endsWith("Invariant"))
                .toList();
        assertThat(invariants).hasSize(1);
        assertThat(constraintIds(invariants.get(0), "Invariant")).containsExactly("area.c1", "area.c2");
        assertThat(method(cu, "AreaContracts", "checkPreconditions").toString())
                .contains(invariants.get(0).getNameAsString() + "(r)");
    }

    @Test
    void invariantsReadingParametersAreCalledAfterTheirGuards() {
        CompilationUnit cu = render("f(n: Nat, r: Record P { xs: Vect(n, Int) }) -> Int", EmissionProfile.defaults());

        MethodDeclaration invariant = method(cu, "FContracts", "checkPInvariant");
        assertThat(invariant.getParameters()).extracting(p -> p.getNameAsString()).containsExactly("self", "n");
        String pre = method(cu, "FContracts", "checkPreconditions").getBody().orElseThrow().toString();
        assertThat(pre).contains("checkPInvariant(r, n)");
        assertThat(pre.indexOf("[f.c1 Nonnegative]")).isNotNegative().isLessThan(pre.indexOf("checkPInvariant(r, n)"));
        assertThat(new JavaParser().parse(cu.toString()).isSuccessful()).isTrue();
    }

    // ==================== Profiles ====================

    @Test
    void returnResultStyleReturnsContractResult() {
        CompilationUnit cu = render(TAKE, EmissionProfile.defaults()
                .withAssertionStyle(EmissionProfile.AssertionStyle.RETURN_RESULT));

        MethodDeclaration pre = method(cu, "TakeContracts", "checkPreconditions");
        assertThat(pre.getType().asString()).isEqualTo("ContractResult");
        assertThat(pre.toString()).contains("ContractResult.violation(e)");
        assertThat(cu.getImports()).anyMatch(i -> i.getNameAsString().endsWith(".ContractResult"));
    }

    @Test
    void taggedOptionalsRenderAsOptional() {
        CompilationUnit cu = render(LOOKUP, EmissionProfile.defaults()
                .withOptionalRepresentation(EmissionProfile.OptionalRepresentation.TAGGED));

        MethodDeclaration pre = method(cu, "LookupContracts", "checkPreconditions");
        assertThat(pre.getParameter(0).getType().asString()).startsWith("Optional<");
        assertThat(pre.toString()).contains("UnreachableCaseException");
        assertThat(cu.getImports()).anyMatch(i -> i.getNameAsString().equals("java.util.Optional"));
    }

    @Test
    void nullableOptionalsAreCheckedAgainstNull() {
        CompilationUnit cu = render(LOOKUP, EmissionProfile.defaults());

        MethodDeclaration pre = method(cu, "LookupContracts", "checkPreconditions");
        assertThat(pre.toString()).contains("i == null");
        assertThat(cu.getImports()).noneMatch(i -> i.getNameAsString().equals("java.util.Optional"));
    }

    // ==================== Errors ====================

    @Test
    void contractMustBelongToTheSignature() {
        Signature take = signature(TAKE);
        Signature sum = signature("sum(xs: SizedSequence(Int, n)) -> Int");

        assertThatThrownBy(() -> renderer.render(contract(take, EmissionProfile.defaults()), sum))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("take");
    }
}
