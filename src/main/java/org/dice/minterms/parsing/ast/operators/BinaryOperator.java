package org.dice.minterms.parsing.ast.operators;

import org.dice.minterms.parsing.ast.Expression;

public abstract class BinaryOperator implements Expression {
	protected final Expression left, right;

    BinaryOperator(Expression left, Expression right){
        this.left = left;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }
}
