package org.dice.minterms.parsing.ast.operands;

import org.dice.minterms.MintermErrors;
import org.dice.minterms.MintermException;
import org.dice.minterms.parsing.ast.Expression;
import org.dice.minterms.parsing.ast.Operator;

import java.util.Map;

public class InputVariable implements Expression {
	protected final char symbol;

	public InputVariable(char symbol) {
		this.symbol = symbol;
	}

	public boolean evaluate(Map<Character, Boolean> inputs) {
		Boolean value = inputs.get(symbol);
		if(value == null){
			throw new MintermException(MintermErrors.MissingVariable,
					String.format("No value assigned to input variable %s!", symbol));
		}
		return value;
	}

	public Operator getOperator() {
		return Operator.INPUT;
	}

	public char getSymbol() {
		return symbol;
	}

	@Override
	public String toString(){
		return String.valueOf(symbol);
	}
}
