package org.dice.minterms.truthtable;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.primitives.Ints;

import java.util.ArrayList;
import java.util.List;

/**
 * Lays out a truth table for the console, one tab separated column per input and the output after a bar.
 */
public final class TruthTableFormatter {

    private static final Joiner TAB = Joiner.on('\t');
    private static final String COLUMN_RULE = "--------";
    private static final String OUTPUT_HEADER = "\t | F";
    private static final String OUTPUT_SEPARATOR = "\t | ";

    private TruthTableFormatter() {
    }

    public static String format(TruthTable table) {
        List<String> lines = new ArrayList<String>(table.size() + 2);
        lines.add(TAB.join(table.getSymbols()) + OUTPUT_HEADER);
        lines.add(Strings.repeat(COLUMN_RULE, table.getInputCount() + 1));
        for(TruthTable.Row row : table.getRows()){
            lines.add(TAB.join(Ints.asList(row.getInputs())) + OUTPUT_SEPARATOR + row.getOutput());
        }
        return Joiner.on('\n').join(lines);
    }
}
