package org.dice.minterms.truthtable;

import org.apache.commons.lang.StringUtils;
import org.dice.minterms.MintermErrors;
import org.dice.minterms.MintermException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads a truth table given as text, one row per line: N input bits followed by the output bit,
 * separated by whitespace. N is taken from the first line. Rows must be complete and in canonical order.
 *
 * <pre>
 * 0 0 1
 * 0 1 0
 * 1 0 0
 * 1 1 1
 * </pre>
 */
public final class TruthTableReader {

    private static final Logger log = LoggerFactory.getLogger(TruthTableReader.class);

    private TruthTableReader() {
    }

    public static TruthTable load(Path path) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            TruthTable table = read(reader);
            log.debug("Loaded truth table with {} inputs from {}", table.getInputCount(), path);
            return table;
        }
    }

    public static TruthTable read(BufferedReader reader) throws IOException {
        List<String> lines = new ArrayList<String>();
        String line;
        while ((line = reader.readLine()) != null){
            lines.add(line);
        }
        return fromLines(lines);
    }

    public static TruthTable fromLines(List<String> lines) {
        if(lines.isEmpty()){
            throw new MintermException(MintermErrors.IncompleteTable, "Table incomplete, no rows found!");
        }

        TruthTable.Row first = parseLine(lines.get(0), 1);
        int inputCount = first.getInputCount();
        List<Character> symbols = VariableSet.fallback(inputCount);

        long expected = 1L << inputCount;
        if(lines.size() < expected){
            throw new MintermException(MintermErrors.IncompleteTable,
                    String.format("Table incomplete, expected %d rows for %d inputs but found %d!",
                            expected, inputCount, lines.size()));
        }
        if(lines.size() > expected){
            throw new MintermException(MintermErrors.OverdefinedTable,
                    String.format("Table overdefined, expected %d rows for %d inputs but found %d!",
                            expected, inputCount, lines.size()));
        }

        List<TruthTable.Row> rows = new ArrayList<TruthTable.Row>(lines.size());
        rows.add(first);
        for(int i = 1; i < lines.size(); i++){
            rows.add(parseLine(lines.get(i), i + 1));
        }

        checkOrder(rows, inputCount);
        return new TruthTable(symbols, rows);
    }

    static void checkOrder(List<TruthTable.Row> rows, int inputCount) {
        for(int i = 0; i < rows.size(); i++){
            int[] expected = TruthTableGenerator.canonicalInputs(i, inputCount);
            if(!Arrays.equals(expected, rows.get(i).getInputs())){
                throw new MintermException(MintermErrors.InconsistentRow,
                        String.format("Truth table has wrong input values in line %d!", i + 1));
            }
        }
    }

    private static TruthTable.Row parseLine(String line, int lineNumber) {
        String[] values = StringUtils.split(line);
        if(values == null || values.length == 0){
            throw new MintermException(MintermErrors.MalformedRow,
                    String.format("Truth table has an empty line %d!", lineNumber));
        }

        int[] numbers = new int[values.length];
        for(int i = 0; i < values.length; i++){
            try {
                numbers[i] = Integer.parseInt(values[i]);
            } catch (NumberFormatException e) {
                throw new MintermException(MintermErrors.MalformedRow,
                        String.format("Truth table has a non-numeric value '%s' in line %d!", values[i], lineNumber), e);
            }
        }

        int output = numbers[numbers.length - 1];
        if(output != 0 && output != 1){
            throw new MintermException(MintermErrors.MalformedRow,
                    String.format("Truth table has an output other than 0 or 1 in line %d!", lineNumber));
        }
        return new TruthTable.Row(Arrays.copyOf(numbers, numbers.length - 1), output);
    }
}
