package org.dice.minterms.parsing.ast.operators;

import org.dice.minterms.parsing.ast.Expression;

public abstract class UnaryOperator implements Expression {
    protected final Expression child;

    UnaryOperator(Expression child){
        this.child = child;
    }

    public Expression getChild() {
        return child;
    }
}
