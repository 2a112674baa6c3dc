package com.sigcontract.compiler.parser;

import com.sigcontract.compiler.exception.SignatureParseException;
import com.sigcontract.compiler.exception.UnsupportedTypeException;
import com.sigcontract.compiler.model.Signature;
import com.sigcontract.compiler.model.TypeNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class SignatureParserTest {

    private final SignatureParser parser = new SignatureParser();

    // ==================== Well-formed signatures ====================

    @Test
    void parsesParametersInDeclarationOrder() {
        Signature signature = parser.parse("take(n: Nat, xs: SizedSequence(T, n + m)) -> SizedSequence(T, n)");

        assertThat(signature.getName()).isEqualTo("take");
        assertThat(signature.getParameters()).extracting(Signature.Parameter::name).containsExactly("n", "xs");
        assertThat(signature.typeOf(signature.getParameters().get(0).type())).isInstanceOf(TypeNode.NonNegativeInt.class);
        assertThat(signature.typeOf(signature.getReturnType())).isInstanceOf(TypeNode.SizedSequence.class);
    }

    @Test
    void rendersCanonicalForm() {
        String text = "take(n: Nat, xs: SizedSequence(T, n + m)) -> SizedSequence(T, n)";

        assertThat(parser.parse(text).render()).isEqualTo(text);
    }

    @Test
    void vectIsAnAliasForSizedSequence() {
        Signature signature = parser.parse("head(xs: Vect(n + 1, Int)) -> Int");

        assertThat(signature.render()).isEqualTo("head(xs: SizedSequence(Int, n + 1)) -> Int");
    }

    @Test
    void identicalTypesShareOneArenaEntry() {
        Signature signature = parser.parse("add(a: Nat, b: Nat) -> Nat");

        assertThat(signature.getParameters().get(0).type())
                .isEqualTo(signature.getParameters().get(1).type())
                .isEqualTo(signature.getReturnType());
    }

    @Test
    void readsVisibilityAndTotalityModifiers() {
        Signature signature = parser.parse("private partial lookup(i: Fin(n), xs: SizedSequence(Int, n)) -> Int");

        assertThat(signature.getVisibility()).isEqualTo(Signature.Visibility.PRIVATE);
        assertThat(signature.getTotality()).isEqualTo(Signature.Totality.POSSIBLY_PARTIAL);
        assertThat(signature.getName()).isEqualTo("lookup");
    }

    @Test
    void modifierFollowedByParenthesisIsTheFunctionName() {
        Signature signature = parser.parse("total(xs: SizedSequence(Int, n)) -> Int");

        assertThat(signature.getName()).isEqualTo("total");
        assertThat(signature.getTotality()).isEqualTo(Signature.Totality.TOTAL);
    }

    @Test
    void parsesRefinementBinderSyntax() {
        Signature signature = parser.parse("positive(x: {v: Int | v > 0}) -> Int");

        assertThat(signature.typeOf(signature.getParameters().get(0).type())).isInstanceOf(TypeNode.Refinement.class);
    }

    @Test
    void parsesNamedRecord() {
        Signature signature = parser.parse("area(r: Record Rect { w: Nat, h: Nat }) -> Nat");

        TypeNode node = signature.typeOf(signature.getParameters().get(0).type());
        assertThat(node).isInstanceOf(TypeNode.RecordType.class);
        TypeNode.RecordType recordType = (TypeNode.RecordType) node;
        assertThat(recordType.name()).isEqualTo("Rect");
        assertThat(recordType.fields()).extracting(TypeNode.RecordField::name).containsExactly("w", "h");
    }

    @Test
    void parsesNestedOptional() {
        Signature signature = parser.parse("first(xs: SizedSequence(Int, n)) -> Maybe(Fin(n))");

        assertThat(signature.typeOf(signature.getReturnType())).isInstanceOf(TypeNode.OptionalType.class);
        assertThat(signature.render()).isEqualTo("first(xs: SizedSequence(Int, n)) -> Optional(Fin(n))");
    }

    @Test
    void keepsSourceText() {
        String text = "  id(x: Int) -> Int  ";

        assertThat(parser.parse(text).getSourceText()).isEqualTo(text);
    }

    // ==================== Errors ====================

    @Test
    void rejectsDuplicateParameterNames() {
        assertThatThrownBy(() -> parser.parse("f(x: Int, x: Int) -> Int"))
                .isInstanceOf(SignatureParseException.class);
    }

    @Test
    void rejectsParameterNamedResult() {
        assertThatThrownBy(() -> parser.parse("f(result: Int) -> Int"))
                .isInstanceOf(SignatureParseException.class);
    }

    @Test
    void rejectsMissingArrow() {
        assertThatThrownBy(() -> parser.parse("f(x: Int) Int"))
                .isInstanceOf(SignatureParseException.class)
                .satisfies(e -> assertThat(((SignatureParseException) e).category()).isEqualTo("parse"));
    }

    @Test
    void rejectsTrailingInput() {
        assertThatThrownBy(() -> parser.parse("f(x: Int) -> Int Int"))
                .isInstanceOf(SignatureParseException.class);
    }

    @Test
    void rejectsDuplicateRecordFields() {
        assertThatThrownBy(() -> parser.parse("f(r: Record { a: Int, a: Int }) -> Int"))
                .isInstanceOf(SignatureParseException.class);
    }

    @Test
    void unknownTypeIsUnsupported() {
        assertThatThrownBy(() -> parser.parse("lookup(m: HashMap(Int, Int)) -> Int"))
                .isInstanceOf(UnsupportedTypeException.class)
                .satisfies(e -> {
                    UnsupportedTypeException unsupported = (UnsupportedTypeException) e;
                    assertThat(unsupported.category()).isEqualTo("unsupported-type");
                    assertThat(unsupported.getRawText()).startsWith("HashMap");
                });
    }
}
