package org.dice.minterms.parsing.ast.operators;

import org.dice.minterms.parsing.ast.Expression;
import org.dice.minterms.parsing.ast.Operator;

import java.util.Map;

/**
 * Wraps a fully parenthesized group, or a variable with an even number of complement marks.
 */
public class PassThrough extends UnaryOperator {
	public PassThrough(Expression child){
		super(child);
	}

	public boolean evaluate(Map<Character, Boolean> inputs) {
		return child.evaluate(inputs);
	}

	public Operator getOperator() {
		return Operator.PASS_THROUGH;
	}

	@Override
	public String toString(){
		return String.format("[%s]", child);
	}
}
