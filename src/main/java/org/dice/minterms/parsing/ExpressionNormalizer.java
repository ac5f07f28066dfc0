package org.dice.minterms.parsing;

import org.apache.commons.lang.StringUtils;
import org.dice.minterms.MintermErrors;
import org.dice.minterms.MintermException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Cleans up a boolean expression as typed by the user and makes every AND explicit,
 * e.g. {@code a!b + c} becomes {@code A'*B+C}.
 */
public class ExpressionNormalizer {

    public static final char AND        = '*';
    public static final char OR         = '+';
    public static final char COMPLEMENT = '\'';
    public static final char NOT        = '!';
    public static final char LEFT       = '(';
    public static final char RIGHT      = ')';

    private static final char ESCAPE = '\\';

    private ExpressionNormalizer() {
    }

    public static String normalize(String expression) {
        if(expression == null){
            return "";
        }

        // order matters: strip the boundary operators only once the complement marks are in place
        String cleaned = StringUtils.deleteWhitespace(expression.toUpperCase(Locale.ROOT));
        cleaned = StringUtils.remove(cleaned, ESCAPE);
        cleaned = cleaned.replace(NOT, COMPLEMENT);
        cleaned = stripOnce(cleaned, AND);
        cleaned = stripOnce(cleaned, OR);

        String normalized = insertImplicitAnd(cleaned);
        if(normalized.length() > 0 && isOperator(normalized.charAt(0))){
            throw new MintermException(MintermErrors.LeadingOperator,
                    String.format("Expression or sub-expression cannot start with an operator: %s!", expression));
        }
        return normalized;
    }

    public static boolean isOperator(char c) {
        return c == AND || c == OR || c == COMPLEMENT || c == NOT;
    }

    public static boolean isComplement(char c) {
        return c == COMPLEMENT || c == NOT;
    }

    static String insertImplicitAnd(String expression) {
        List<Integer> positions = new ArrayList<Integer>();
        for(int i = 0; i < expression.length() - 1; i++){
            char current = expression.charAt(i);
            char next = expression.charAt(i + 1);

            if((Character.isLetter(current) || current == COMPLEMENT) && (Character.isLetter(next) || next == LEFT)){
                positions.add(i);
            }
            else if(current == RIGHT && Character.isLetter(next)){
                positions.add(i);
            }
        }

        // insert right to left so the positions found above stay valid
        StringBuilder sb = new StringBuilder(expression);
        for(int i = positions.size() - 1; i >= 0; i--){
            sb.insert(positions.get(i) + 1, AND);
        }
        return sb.toString();
    }

    private static String stripOnce(String expression, char operator) {
        String op = String.valueOf(operator);
        return StringUtils.removeEnd(StringUtils.removeStart(expression, op), op);
    }
}
