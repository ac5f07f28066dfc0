package org.dice.minterms.truthtable;

import org.dice.minterms.parsing.ast.Expression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Evaluates an expression tree for every assignment of its input variables.
 */
public final class TruthTableGenerator {

    private static final Logger log = LoggerFactory.getLogger(TruthTableGenerator.class);

    // the row index is packed into an int
    public static final int MAX_INPUTS = 30;

    private TruthTableGenerator() {
    }

    public static TruthTable generate(Expression root, List<Character> symbols) {
        int n = symbols.size();
        checkArgument(n <= MAX_INPUTS, "at most %s input variables are supported, got %s", MAX_INPUTS, n);

        int rowCount = 1 << n;
        List<TruthTable.Row> rows = new ArrayList<TruthTable.Row>(rowCount);
        Map<Character, Boolean> inputs = new HashMap<Character, Boolean>();
        for(int r = 0; r < rowCount; r++){
            int[] bits = canonicalInputs(r, n);
            for(int i = 0; i < n; i++){
                inputs.put(symbols.get(i), bits[i] == 1);
            }
            rows.add(new TruthTable.Row(bits, root.evaluate(inputs) ? 1 : 0));
        }

        log.debug("Generated truth table for {} inputs {} with {} rows", n, symbols, rowCount);
        return new TruthTable(symbols, rows);
    }

    /**
     * Input bits of the given row in canonical order: binary counting with the first position most significant.
     */
    public static int[] canonicalInputs(int row, int inputCount) {
        int[] bits = new int[inputCount];
        for(int i = 0; i < inputCount; i++){
            bits[i] = (row >> (inputCount - 1 - i)) & 1;
        }
        return bits;
    }
}
