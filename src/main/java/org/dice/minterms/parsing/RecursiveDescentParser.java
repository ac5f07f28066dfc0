package org.dice.minterms.parsing;

import org.apache.commons.lang.StringUtils;
import org.dice.minterms.MintermErrors;
import org.dice.minterms.MintermException;
import org.dice.minterms.parsing.ast.Expression;
import org.dice.minterms.parsing.ast.operands.InputVariable;
import org.dice.minterms.parsing.ast.operators.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.dice.minterms.parsing.ExpressionNormalizer.*;

/**
 * Builds an expression tree from a normalized expression (see {@link ExpressionNormalizer}).
 *
 * There is no precedence table: each call splits its sub-expression at the outermost parenthesized
 * group if there is one, otherwise at the first OR, otherwise at the first AND, and recurses on both
 * halves. Complement marks only ever trail a variable or a group.
 */
public class RecursiveDescentParser {

    private static final Logger log = LoggerFactory.getLogger(RecursiveDescentParser.class);

    private final String expression;

    public RecursiveDescentParser(String normalizedExpression) {
        this.expression = normalizedExpression == null ? "" : normalizedExpression;
    }

    public Expression parse() {
        if(StringUtils.isEmpty(expression)){
            throw new MintermException(MintermErrors.EmptyExpression, "Expression is empty!");
        }
        Expression root = expression(expression);
        log.debug("Parsed {} as {}", expression, root);
        return root;
    }

    private Expression expression(String expr) {
        if(isOperator(expr.charAt(0))){
            throw new MintermException(MintermErrors.LeadingOperator,
                    String.format("Expression or sub-expression cannot start with an operator: %s!", expr));
        }

        int opened = StringUtils.countMatches(expr, String.valueOf(LEFT));
        int closed = StringUtils.countMatches(expr, String.valueOf(RIGHT));
        if(opened != closed){
            throw new MintermException(MintermErrors.UnmatchedParenthesis,
                    String.format("Unmatched parenthesis in %s!", expr));
        }

        if(opened > 0){
            return groupExpression(expr);
        }

        int or = expr.indexOf(OR);
        if(or >= 0){
            return new Or(operand(expr, 0, or), operand(expr, or + 1, expr.length()));
        }

        int and = expr.indexOf(AND);
        if(and >= 0){
            return new And(operand(expr, 0, and), operand(expr, and + 1, expr.length()));
        }

        return variable(expr);
    }

    private Expression groupExpression(String expr) {
        int[] span = outerParenthesis(expr);
        int open = span[0];
        int close = span[1];
        int length = expr.length();

        if(open == 0 && close == length - 2 && isComplement(expr.charAt(length - 1))){
            return new Not(operand(expr, 1, length - 2));
        }
        if(open == 0 && close == length - 1){
            return new PassThrough(operand(expr, 1, length - 1));
        }

        // the group is only part of the expression: the top level operator sits just before
        // the opening parenthesis, or just after the closing one (and its complement mark)
        int splitAt = open > 0 ? open - 2 : close;
        if(splitAt + 1 < length && isComplement(expr.charAt(splitAt + 1))){
            splitAt++;
        }

        char operator = expr.charAt(splitAt + 1);
        switch (operator){
            case AND:
                return new And(operand(expr, 0, splitAt + 1), operand(expr, splitAt + 2, length));
            case OR:
                return new Or(operand(expr, 0, splitAt + 1), operand(expr, splitAt + 2, length));
            default:
                throw new MintermException(MintermErrors.UnsupportedOperator,
                        String.format("Unknown operator '%s' encountered in %s!", operator, expr));
        }
    }

    private Expression operand(String expr, int start, int end) {
        if(start >= end){
            throw new MintermException(MintermErrors.MissingOperand,
                    String.format("Missing operand in %s!", expr));
        }
        return expression(expr.substring(start, end));
    }

    private Expression variable(String expr) {
        char symbol = expr.charAt(0);
        int complements = 0;
        for(int i = 1; i < expr.length(); i++){
            if(!isComplement(expr.charAt(i))){
                throw new MintermException(MintermErrors.InvalidVariable,
                        String.format("Input variables must be single letters: %s!", expr));
            }
            complements++;
        }
        if(!Character.isLetter(symbol)){
            throw new MintermException(MintermErrors.InvalidVariable,
                    String.format("Input variables must be single letters: %s!", expr));
        }

        InputVariable input = new InputVariable(symbol);
        if(complements == 0){
            return input;
        }
        return complements % 2 != 0 ? new Not(input) : new PassThrough(input);
    }

    /**
     * Returns the positions of the first top level opening parenthesis and of its matching closing one.
     */
    static int[] outerParenthesis(String expr) {
        int open = -1;
        int close = -1;
        int depth = 0;
        for(int i = 0; i < expr.length(); i++){
            char c = expr.charAt(i);
            if(c == LEFT){
                if(depth == 0){
                    open = i;
                }
                depth++;
            }
            else if(c == RIGHT){
                if(depth == 0){
                    throw new MintermException(MintermErrors.InvalidParenthesis,
                            String.format("Closing parenthesis without an opening one in %s!", expr));
                }
                depth--;
                if(depth == 0){
                    close = i;
                    break;
                }
            }
        }
        return new int[]{open, close};
    }
}
