package org.dice.minterms;

public enum MintermErrors {
    LeadingOperator(1),
    UnmatchedParenthesis(2),
    InvalidParenthesis(3),
    UnsupportedOperator(4),
    MissingOperand(5),
    InvalidVariable(6),
    EmptyExpression(7),
    MissingVariable(8),
    IncompleteTable(9),
    OverdefinedTable(10),
    InconsistentRow(11),
    MalformedRow(12),
    TooManyInputs(13);

    public int value;
    MintermErrors(int value){
        this.value = value;
    }
}
