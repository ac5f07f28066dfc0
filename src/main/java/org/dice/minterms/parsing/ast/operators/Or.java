package org.dice.minterms.parsing.ast.operators;

import org.dice.minterms.parsing.ast.Expression;
import org.dice.minterms.parsing.ast.Operator;

import java.util.Map;

public class Or extends BinaryOperator {

	public Or(Expression left, Expression right){
		super(left, right);
	}

	public boolean evaluate(Map<Character, Boolean> inputs) {
		boolean l = left.evaluate(inputs);
		boolean r = right.evaluate(inputs);
		return l || r;
	}

	public Operator getOperator() {
		return Operator.OR;
	}

	@Override
	public String toString(){
		return String.format("(%s OR %s)", left, right);
	}
}
