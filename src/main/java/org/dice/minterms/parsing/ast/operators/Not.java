package org.dice.minterms.parsing.ast.operators;

import org.dice.minterms.parsing.ast.Expression;
import org.dice.minterms.parsing.ast.Operator;

import java.util.Map;

public class Not extends UnaryOperator {
	public Not(Expression child){
		super(child);
	}

	public boolean evaluate(Map<Character, Boolean> inputs) {
		return !child.evaluate(inputs);
	}

	public Operator getOperator() {
		return Operator.NOT;
	}

	@Override
	public String toString(){
		return String.format("NOT %s", child);
	}
}
