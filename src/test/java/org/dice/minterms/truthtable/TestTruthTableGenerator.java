package org.dice.minterms.truthtable;

import org.dice.minterms.parsing.ExpressionNormalizer;
import org.dice.minterms.parsing.RecursiveDescentParser;
import org.dice.minterms.parsing.ast.Expression;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;

public class TestTruthTableGenerator {

    @Test
    public void countsWithFirstPositionMostSignificant() {
        Assert.assertArrayEquals(new int[]{0, 0, 0}, TruthTableGenerator.canonicalInputs(0, 3));
        Assert.assertArrayEquals(new int[]{0, 0, 1}, TruthTableGenerator.canonicalInputs(1, 3));
        Assert.assertArrayEquals(new int[]{0, 1, 0}, TruthTableGenerator.canonicalInputs(2, 3));
        Assert.assertArrayEquals(new int[]{1, 0, 0}, TruthTableGenerator.canonicalInputs(4, 3));
        Assert.assertArrayEquals(new int[]{1, 1, 0}, TruthTableGenerator.canonicalInputs(6, 3));
        Assert.assertArrayEquals(new int[]{}, TruthTableGenerator.canonicalInputs(0, 0));
    }

    @Test
    public void generatesOneRowPerAssignment() {
        TruthTable table = generate("A+B");

        assertEquals(Arrays.asList('B', 'A'), table.getSymbols());
        assertEquals(4, table.size());
        assertRow(table, 0, new int[]{0, 0}, 0);
        assertRow(table, 1, new int[]{0, 1}, 1);
        assertRow(table, 2, new int[]{1, 0}, 1);
        assertRow(table, 3, new int[]{1, 1}, 1);
    }

    @Test
    public void pairsFirstColumnWithFirstSymbol() {
        // only true for B=0, A=1
        TruthTable table = generate("AB'");

        assertRow(table, 0, new int[]{0, 0}, 0);
        assertRow(table, 1, new int[]{0, 1}, 1);
        assertRow(table, 2, new int[]{1, 0}, 0);
        assertRow(table, 3, new int[]{1, 1}, 0);
    }

    @Test
    public void enumeratesRowsInCanonicalOrder() {
        TruthTable table = generate("ab + cd'");

        assertEquals(16, table.size());
        for(int i = 0; i < table.size(); i++){
            Assert.assertArrayEquals(TruthTableGenerator.canonicalInputs(i, 4), table.getRow(i).getInputs());
        }
    }

    private TruthTable generate(String input) {
        String expression = ExpressionNormalizer.normalize(input);
        Expression root = new RecursiveDescentParser(expression).parse();
        List<Character> symbols = VariableSet.fromExpression(expression);
        return TruthTableGenerator.generate(root, symbols);
    }

    private void assertRow(TruthTable table, int index, int[] inputs, int output) {
        Assert.assertArrayEquals(inputs, table.getRow(index).getInputs());
        assertEquals(output, table.getRow(index).getOutput());
    }
}
