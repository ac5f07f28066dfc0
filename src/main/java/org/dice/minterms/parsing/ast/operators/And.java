package org.dice.minterms.parsing.ast.operators;

import org.dice.minterms.parsing.ast.Expression;
import org.dice.minterms.parsing.ast.Operator;

import java.util.Map;

public class And extends BinaryOperator {
	public And(Expression left, Expression right){
		super(left, right);
	}

	public boolean evaluate(Map<Character, Boolean> inputs) {
		// both sides are always visited so a missing variable is reported regardless of order
		boolean l = left.evaluate(inputs);
		boolean r = right.evaluate(inputs);
		return l && r;
	}

	public Operator getOperator() {
		return Operator.AND;
	}

	@Override
	public String toString(){
		return String.format("(%s AND %s)", left, right);
	}
}
