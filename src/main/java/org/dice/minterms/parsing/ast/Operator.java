package org.dice.minterms.parsing.ast;

public enum Operator {
    AND,
    OR,
    NOT,
    PASS_THROUGH,
    INPUT
}
