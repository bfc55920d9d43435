package org.modal.formula;

import org.junit.Test;

import static org.junit.Assert.*;

public class FormulaParserTest {

    private static final Formula P = Formula.atom("p");
    private static final Formula Q = Formula.atom("q");
    private static final Formula R = Formula.atom("r");

    //region PRECEDENZE E ASSOCIATIVITÀ

    @Test
    public void conjunctionBindsTighterThanDisjunction() {
        assertEquals(Formula.or(Formula.and(P, Q), R), FormulaParser.parse("p & q | r"));
        assertEquals(Formula.or(P, Formula.and(Q, R)), FormulaParser.parse("p | q & r"));
    }

    @Test
    public void disjunctionBindsTighterThanImplication() {
        assertEquals(Formula.implies(Formula.or(P, Q), R), FormulaParser.parse("p | q -> r"));
    }

    @Test
    public void implicationIsRightAssociative() {
        assertEquals(Formula.implies(P, Formula.implies(Q, R)), FormulaParser.parse("p -> q -> r"));
    }

    @Test
    public void conjunctionAndDisjunctionAreLeftAssociative() {
        assertEquals(Formula.and(Formula.and(P, Q), R), FormulaParser.parse("p & q & r"));
        assertEquals(Formula.or(Formula.or(P, Q), R), FormulaParser.parse("p | q | r"));
    }

    @Test
    public void unaryOperatorsBindTightest() {
        assertEquals(Formula.and(Formula.not(P), Q), FormulaParser.parse("~p & q"));
        assertEquals(Formula.not(Formula.box(P)), FormulaParser.parse("~[]p"));
        assertEquals(Formula.implies(Formula.box(P), Formula.diamond(P)), FormulaParser.parse("[]p -> <>p"));
        assertEquals(Formula.box(Formula.diamond(Formula.not(P))), FormulaParser.parse("[]<>~p"));
    }

    @Test
    public void parenthesesOverridePrecedence() {
        assertEquals(Formula.and(P, Formula.or(Q, R)), FormulaParser.parse("p & (q | r)"));
        assertEquals(Formula.box(Formula.implies(P, Q)), FormulaParser.parse("[](p -> q)"));
        assertEquals(Formula.implies(Formula.implies(P, Q), R), FormulaParser.parse("(p -> q) -> r"));
    }

    @Test
    public void whitespaceIsInsignificant() {
        assertEquals(FormulaParser.parse("[]p->p"), FormulaParser.parse("  [] p  ->\tp \n"));
    }

    //endregion

    //region SIMBOLI ALTERNATIVI E BIIMPLICAZIONE

    @Test
    public void unicodeGlyphsMatchAsciiOperators() {
        assertEquals(FormulaParser.parse("~p & q | r -> []p"), FormulaParser.parse("¬p ∧ q ∨ r → □p"));
        assertEquals(FormulaParser.parse("<>p"), FormulaParser.parse("◇p"));
        assertEquals(FormulaParser.parse("<>p"), FormulaParser.parse("♢p"));
    }

    @Test
    public void biconditionalIsDesugaredIntoTwoImplications() {
        Formula expected = Formula.and(Formula.implies(P, Q), Formula.implies(Q, P));
        assertEquals(expected, FormulaParser.parse("p <-> q"));
        assertEquals(expected, FormulaParser.parse("p ↔ q"));
    }

    @Test
    public void biconditionalChainIsConjunctionOfAdjacentPairs() {
        Formula pq = Formula.and(Formula.implies(P, Q), Formula.implies(Q, P));
        Formula qr = Formula.and(Formula.implies(Q, R), Formula.implies(R, Q));
        assertEquals(Formula.and(pq, qr), FormulaParser.parse("p <-> q <-> r"));
    }

    @Test
    public void parenthesizedBiconditionalsKeepAssociativeReading() {
        Formula pq = Formula.and(Formula.implies(P, Q), Formula.implies(Q, P));
        Formula leftNested = Formula.and(Formula.implies(pq, R), Formula.implies(R, pq));

        assertEquals(leftNested, FormulaParser.parse("(p <-> q) <-> r"));
        assertNotEquals(FormulaParser.parse("p <-> q <-> r"), FormulaParser.parse("(p <-> q) <-> r"));
        assertNotEquals(FormulaParser.parse("p <-> q <-> r"), FormulaParser.parse("p <-> (q <-> r)"));
    }

    @Test
    public void printedFormulaParsesBackToItself() {
        String[] inputs = {"[]p -> <>p", "p & q | ~r", "[](p -> q) -> ([]p -> []q)", "<><>p & [][]~p", "stato_1 | x2"};
        for (String input : inputs) {
            Formula formula = FormulaParser.parse(input);
            assertEquals(input, formula, FormulaParser.parse(formula.toString()));
        }
    }

    //endregion

    //region ERRORI

    @Test(expected = FormulaSyntaxException.class)
    public void emptyInputIsRejected() {
        FormulaParser.parse("");
    }

    @Test(expected = FormulaSyntaxException.class)
    public void blankInputIsRejected() {
        FormulaParser.parse("   ");
    }

    @Test(expected = FormulaSyntaxException.class)
    public void unbalancedParenthesisIsRejected() {
        FormulaParser.parse("(p & q");
    }

    @Test(expected = FormulaSyntaxException.class)
    public void danglingOperatorIsRejected() {
        FormulaParser.parse("p &");
    }

    @Test(expected = FormulaSyntaxException.class)
    public void uppercaseAtomIsRejected() {
        FormulaParser.parse("P & q");
    }

    @Test(expected = FormulaSyntaxException.class)
    public void atomStartingWithDigitIsRejected() {
        FormulaParser.parse("1p");
    }

    @Test(expected = FormulaSyntaxException.class)
    public void trailingTokensAreRejected() {
        FormulaParser.parse("p q");
    }

    @Test(expected = FormulaSyntaxException.class)
    public void trailingParenthesisIsRejected() {
        FormulaParser.parse("p )");
    }

    @Test
    public void syntaxErrorReportsPosition() {
        try {
            FormulaParser.parse("p & & q");
            fail("Attesa FormulaSyntaxException");
        } catch (FormulaSyntaxException e) {
            assertEquals(1, e.getLine());
            assertEquals(4, e.getColumn());
            assertEquals("&", e.getOffendingText());
        }
    }

    //endregion
}
