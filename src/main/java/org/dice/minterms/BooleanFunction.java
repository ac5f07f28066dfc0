package org.dice.minterms;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import org.dice.minterms.canonical.MintermBuilder;
import org.dice.minterms.parsing.ExpressionNormalizer;
import org.dice.minterms.parsing.RecursiveDescentParser;
import org.dice.minterms.parsing.ast.Expression;
import org.dice.minterms.truthtable.TruthTable;
import org.dice.minterms.truthtable.TruthTableGenerator;
import org.dice.minterms.truthtable.VariableSet;

import java.util.List;
import java.util.Map;

/**
 * A boolean function given as an expression such as {@code A!B + (C*D)'}.
 *
 * Parsing happens on construction, so a malformed expression fails immediately. The truth table
 * is generated on first use and kept.
 */
public class BooleanFunction {

    private final String rawExpression;
    private final String expression;
    private final Expression root;
    private final List<Character> symbols;
    private final Supplier<TruthTable> truthTable;

    public BooleanFunction(String rawExpression) {
        this.rawExpression = rawExpression == null ? "" : rawExpression.trim();
        this.expression = ExpressionNormalizer.normalize(this.rawExpression);
        this.root = new RecursiveDescentParser(expression).parse();
        this.symbols = VariableSet.fromExpression(expression);
        this.truthTable = Suppliers.memoize(new Supplier<TruthTable>() {
            @Override
            public TruthTable get() {
                return TruthTableGenerator.generate(root, symbols);
            }
        });
    }

    public boolean evaluate(Map<Character, Boolean> inputs) {
        return root.evaluate(inputs);
    }

    public TruthTable getTruthTable() {
        return truthTable.get();
    }

    public String sumOfMinterms() {
        return MintermBuilder.sumOfMinterms(getTruthTable());
    }

    public String getRawExpression() {
        return rawExpression;
    }

    /**
     * The expression after normalization, e.g. {@code A'*B+C} for {@code a!b + c}.
     */
    public String getExpression() {
        return expression;
    }

    public Expression getRoot() {
        return root;
    }

    public List<Character> getSymbols() {
        return symbols;
    }

    @Override
    public String toString() {
        return expression;
    }
}
