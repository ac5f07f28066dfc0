package org.dice.minterms.parsing.ast;

import java.util.Map;

/**
 * <expression>::=<product>{<or><product>}
 * <product>::=<factor>{<and><factor>}
 * <factor>::=<variable>{<complement>}|(<expression>)[<complement>]
 * <variable>::= A|B|...|Z
 * <or>::='+'
 * <and>::='*' | adjacency
 * <complement>::=''' | '!'
 */
public interface Expression {

	/**
	 * Computes the output bit of this node for one assignment of its input variables.
	 * Nothing is cached between calls.
	 */
	public boolean evaluate(Map<Character, Boolean> inputs);

	public Operator getOperator();
}
