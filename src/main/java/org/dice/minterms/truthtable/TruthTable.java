package org.dice.minterms.truthtable;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;

import java.util.Arrays;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * All 2^N rows of a boolean function, in canonical enumeration order (first column most significant).
 */
public class TruthTable {

    private final List<Character> symbols;
    private final List<Row> rows;

    public TruthTable(List<Character> symbols, List<Row> rows) {
        int inputs = symbols.size();
        checkArgument(rows.size() == 1L << inputs,
                "expected %s rows for %s inputs, got %s", 1L << inputs, inputs, rows.size());
        for(Row row : rows){
            checkArgument(row.getInputCount() == inputs, "row %s does not have %s inputs", row, inputs);
        }
        this.symbols = ImmutableList.copyOf(symbols);
        this.rows = ImmutableList.copyOf(rows);
    }

    public List<Character> getSymbols() {
        return symbols;
    }

    public List<Row> getRows() {
        return rows;
    }

    public Row getRow(int index) {
        return rows.get(index);
    }

    public int getInputCount() {
        return symbols.size();
    }

    public int size() {
        return rows.size();
    }

    @Override
    public boolean equals(Object o) {
        if(this == o){
            return true;
        }
        if(!(o instanceof TruthTable)){
            return false;
        }
        TruthTable other = (TruthTable) o;
        return symbols.equals(other.symbols) && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return 31 * symbols.hashCode() + rows.hashCode();
    }

    @Override
    public String toString() {
        return String.format("%s %s", symbols, rows);
    }

    public static class Row {
        private final int[] inputs;
        private final int output;

        public Row(int[] inputs, int output) {
            this.inputs = inputs.clone();
            this.output = output;
        }

        public int getInput(int index) {
            return inputs[index];
        }

        public int[] getInputs() {
            return inputs.clone();
        }

        public int getInputCount() {
            return inputs.length;
        }

        public int getOutput() {
            return output;
        }

        public boolean isTrue() {
            return output == 1;
        }

        @Override
        public boolean equals(Object o) {
            if(this == o){
                return true;
            }
            if(!(o instanceof Row)){
                return false;
            }
            Row other = (Row) o;
            return output == other.output && Arrays.equals(inputs, other.inputs);
        }

        @Override
        public int hashCode() {
            return 31 * Arrays.hashCode(inputs) + output;
        }

        @Override
        public String toString() {
            return String.format("%s -> %d", Ints.join(" ", inputs), output);
        }
    }
}
