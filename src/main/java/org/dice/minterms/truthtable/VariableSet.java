package org.dice.minterms.truthtable;

import com.google.common.collect.ImmutableList;
import org.dice.minterms.MintermErrors;
import org.dice.minterms.MintermException;

import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * Input variables in canonical order: descending alphabetically. The first symbol is the most
 * significant bit of a truth table row and the first column when printed.
 */
public final class VariableSet {

    public static final int MAX_FALLBACK_SYMBOLS = 26;

    private VariableSet() {
    }

    public static List<Character> fromExpression(String expression) {
        TreeSet<Character> symbols = new TreeSet<Character>(Collections.reverseOrder());
        for(char c : expression.toCharArray()){
            if(Character.isLetter(c)){
                symbols.add(c);
            }
        }
        return ImmutableList.copyOf(symbols);
    }

    /**
     * Symbols used when a table does not come with its own, e.g. C, B, A for three inputs.
     */
    public static List<Character> fallback(int inputCount) {
        if(inputCount > MAX_FALLBACK_SYMBOLS){
            throw new MintermException(MintermErrors.TooManyInputs,
                    String.format("Tables with more than %d inputs are not supported, found %d!",
                            MAX_FALLBACK_SYMBOLS, inputCount));
        }
        ImmutableList.Builder<Character> symbols = ImmutableList.builder();
        for(int i = inputCount - 1; i >= 0; i--){
            symbols.add((char) ('A' + i));
        }
        return symbols.build();
    }
}
