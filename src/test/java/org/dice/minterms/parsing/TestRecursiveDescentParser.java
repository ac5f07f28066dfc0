package org.dice.minterms.parsing;

import org.dice.minterms.MintermErrors;
import org.dice.minterms.MintermException;
import org.dice.minterms.parsing.ast.Expression;
import org.dice.minterms.parsing.ast.Operator;
import org.dice.minterms.parsing.ast.operators.BinaryOperator;
import org.junit.Test;

import static junit.framework.TestCase.assertEquals;
import static org.junit.Assert.assertThrows;

public class TestRecursiveDescentParser {

    @Test
    public void parsesVariables() {
        assertEquals("A", parse("a"));
        assertEquals("NOT A", parse("a'"));
        assertEquals("NOT A", parse("a!"));
        assertEquals("[A]", parse("a''"));
        assertEquals("NOT A", parse("a'''"));
    }

    @Test
    public void splitsAtFirstOr() {
        assertEquals("(A OR B)", parse("a+b"));
        assertEquals("(A OR (B OR C))", parse("a+b+c"));
        assertEquals("((A AND B) OR C)", parse("ab+c"));
        assertEquals("(A OR (B AND C))", parse("a+bc"));
    }

    @Test
    public void splitsAtFirstAnd() {
        assertEquals("(A AND B)", parse("a*b"));
        assertEquals("(A AND (B AND C))", parse("abc"));
        assertEquals("(NOT A AND NOT B)", parse("a'b'"));
    }

    @Test
    public void unwrapsParenthesizedGroups() {
        assertEquals("[(A OR B)]", parse("(a+b)"));
        assertEquals("[[A]]", parse("((a))"));
        assertEquals("NOT (A OR B)", parse("(a+b)'"));
        assertEquals("NOT NOT A", parse("(a')'"));
    }

    @Test
    public void splitsAroundGroups() {
        assertEquals("([(A OR B)] AND C)", parse("(a+b)c"));
        assertEquals("(NOT (A OR B) AND C)", parse("(a+b)'c"));
        assertEquals("(A AND [(B OR C)])", parse("a(b+c)"));
        assertEquals("([A] OR [B])", parse("(a)+(b)"));
        assertEquals("((NOT A AND B) OR NOT (C AND D))", parse("A!B + (C*D)'"));
    }

    @Test
    public void splitsJustBeforeTheFirstGroup() {
        assertEquals("((A OR B) AND [C])", parse("a+b(c)"));
    }

    @Test
    public void buildsBinaryNodesWithBothChildren() {
        Expression root = new RecursiveDescentParser("A+B").parse();
        assertEquals(Operator.OR, root.getOperator());
        assertEquals(Operator.INPUT, ((BinaryOperator) root).getLeft().getOperator());
        assertEquals(Operator.INPUT, ((BinaryOperator) root).getRight().getOperator());
    }

    @Test
    public void rejectsLeadingOperatorInSubExpressions() {
        assertError(MintermErrors.LeadingOperator, "*A");
        assertError(MintermErrors.LeadingOperator, "+A");
        assertError(MintermErrors.LeadingOperator, "'A");
        assertError(MintermErrors.LeadingOperator, "!A");
        assertError(MintermErrors.LeadingOperator, "A+*B");
        assertError(MintermErrors.LeadingOperator, "A*'B");
        assertError(MintermErrors.LeadingOperator, "(+A)");
        assertError(MintermErrors.LeadingOperator, "B*(A+'C)");
    }

    @Test
    public void rejectsUnmatchedParenthesis() {
        assertError(MintermErrors.UnmatchedParenthesis, "(A+B");
        assertError(MintermErrors.UnmatchedParenthesis, "(A+B))");
        assertError(MintermErrors.UnmatchedParenthesis, "A+B)");
        assertError(MintermErrors.UnmatchedParenthesis, "A*((B)");
    }

    @Test
    public void rejectsClosingParenthesisBeforeOpening() {
        assertError(MintermErrors.InvalidParenthesis, "A)+(B");
        assertError(MintermErrors.InvalidParenthesis, "A+B)*(C");
    }

    @Test
    public void rejectsUnknownOperatorAtSplitPoint() {
        assertError(MintermErrors.UnsupportedOperator, "(A)(B)");
        assertError(MintermErrors.UnsupportedOperator, "(A)''");
        assertError(MintermErrors.UnsupportedOperator, "(A)&B");
    }

    @Test
    public void rejectsMissingOperand() {
        assertError(MintermErrors.MissingOperand, "A+");
        assertError(MintermErrors.MissingOperand, "A*");
        assertError(MintermErrors.MissingOperand, "(A)+");
        assertError(MintermErrors.MissingOperand, "()");
    }

    @Test
    public void rejectsInvalidVariables() {
        assertError(MintermErrors.InvalidVariable, "A1");
        assertError(MintermErrors.InvalidVariable, "1");
        assertError(MintermErrors.InvalidVariable, "A&B");
        assertError(MintermErrors.InvalidVariable, "AB");
    }

    @Test
    public void rejectsEmptyExpression() {
        assertError(MintermErrors.EmptyExpression, "");
        assertError(MintermErrors.EmptyExpression, null);
    }

    private String parse(String input) {
        return new RecursiveDescentParser(ExpressionNormalizer.normalize(input)).parse().toString();
    }

    private void assertError(MintermErrors expected, String normalizedInput) {
        RecursiveDescentParser parser = new RecursiveDescentParser(normalizedInput);
        MintermException ex = assertThrows(MintermException.class, parser::parse);
        assertEquals(expected, ex.getError());
    }
}
