package org.dice.minterms.canonical;

import com.google.common.base.Joiner;
import org.dice.minterms.truthtable.TruthTable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static org.dice.minterms.parsing.ExpressionNormalizer.COMPLEMENT;

/**
 * Builds the canonical sum of minterms of a truth table, one product term per true row,
 * e.g. {@code BA + BA' + B'A} for {@code A+B}.
 *
 * The terms are listed last row first. An identically false table has no terms.
 */
public final class MintermBuilder {

    public static final String FUNCTION_PREFIX = "F = ";

    private static final Joiner SUM = Joiner.on(" + ");

    private MintermBuilder() {
    }

    public static String sumOfMinterms(TruthTable table) {
        return FUNCTION_PREFIX + build(table);
    }

    public static String build(TruthTable table) {
        return build(table, table.getSymbols());
    }

    public static String build(TruthTable table, List<Character> symbols) {
        checkArgument(symbols.size() == table.getInputCount(),
                "%s symbols given for a table with %s inputs", symbols.size(), table.getInputCount());

        List<String> terms = new ArrayList<String>();
        for(TruthTable.Row row : table.getRows()){
            if(!row.isTrue()){
                continue;
            }
            StringBuilder term = new StringBuilder();
            for(int i = 0; i < row.getInputCount(); i++){
                term.append(symbols.get(i));
                if(row.getInput(i) == 0){
                    term.append(COMPLEMENT);
                }
            }
            terms.add(term.toString());
        }

        Collections.reverse(terms);
        return SUM.join(terms);
    }
}
