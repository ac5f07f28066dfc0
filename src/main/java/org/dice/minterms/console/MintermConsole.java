package org.dice.minterms.console;

import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;
import org.apache.commons.lang.StringUtils;
import org.dice.minterms.BooleanFunction;
import org.dice.minterms.MintermException;
import org.dice.minterms.canonical.MintermBuilder;
import org.dice.minterms.truthtable.TruthTable;
import org.dice.minterms.truthtable.TruthTableFormatter;
import org.dice.minterms.truthtable.TruthTableReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.InvalidPathException;
import java.nio.file.Paths;

import static org.dice.minterms.console.ConsoleParams.*;

/**
 * Command line entry point.
 *
 * <pre>
 * -F, --function EXPR     print the canonical sum of minterms of a boolean expression
 * -r, --read-table FILE   print the canonical sum of minterms of a truth table file
 * -t, --table             also print the truth table
 * </pre>
 *
 * Without -F or -r, expressions are read interactively until a blank line or "exit".
 */
public class MintermConsole {

    private static final Logger log = LoggerFactory.getLogger(MintermConsole.class);

    private static final String PROMPT = "Please enter a boolean expression to parse:";

    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;

    public MintermConsole(InputStream in, PrintStream out, PrintStream err) {
        this.in = in;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new MintermConsole(System.in, System.out, System.err).run(args));
    }

    static ArgumentParser buildParser() {
        // help is declared here so it is printed to the console's own stream
        ArgumentParser parser = ArgumentParsers
                .newFor(PROG).addHelp(false).build()
                .description("Canonical sum-of-minterms form of a boolean function");
        parser.addArgument(HELP, HELP_LONG).dest(HELP_DEST).action(Arguments.storeTrue())
                .help("Show this help message and exit");
        parser.addArgument(FUNCTION, FUNCTION_LONG).dest(FUNCTION_DEST).metavar("EXPR")
                .help("Boolean function or expression");
        parser.addArgument(TABLE, TABLE_LONG).dest(TABLE_DEST).action(Arguments.storeTrue())
                .help("Print truth table for boolean function");
        parser.addArgument(READ_TABLE, READ_TABLE_LONG).dest(READ_TABLE_DEST).metavar("FILE")
                .help("Read truth table from file and print sum of minterms");
        return parser;
    }

    public int run(String... args) {
        ArgumentParser parser = buildParser();
        Namespace namespace;
        try {
            namespace = parser.parseArgs(args);
        }
        catch (ArgumentParserException ex){
            PrintWriter writer = new PrintWriter(err, true);
            writer.println(ex.getMessage());
            parser.printUsage(writer);
            writer.flush();
            return EXIT_USAGE;
        }

        if(namespace.getBoolean(HELP_DEST)){
            PrintWriter writer = new PrintWriter(out, true);
            parser.printHelp(writer);
            writer.flush();
            return EXIT_OK;
        }

        String function = namespace.getString(FUNCTION_DEST);
        String tableFile = namespace.getString(READ_TABLE_DEST);
        boolean printTable = namespace.getBoolean(TABLE_DEST);

        try {
            if(function != null){
                printFunction(function, printTable);
            }
            else if(tableFile != null){
                printTableFile(tableFile, printTable);
            }
            else{
                interactive();
            }
            return EXIT_OK;
        }
        catch (MintermException ex){
            log.warn("Failed with {}", ex.getError());
            err.println(ex.getMessage());
            return EXIT_ERROR;
        }
        catch (InvalidPathException ex){
            log.warn("Invalid table file name", ex);
            err.println("Invalid table file name: " + ex.getMessage());
            return EXIT_ERROR;
        }
        catch (IOException ex){
            log.warn("Failed to read input", ex);
            err.println("Unable to read input: " + ex.getMessage());
            return EXIT_ERROR;
        }
    }

    private void printFunction(String rawExpression, boolean printTable) {
        BooleanFunction function = new BooleanFunction(rawExpression);
        out.println("Boolean function raw input: F = " + function.getRawExpression());
        out.println("Boolean function normalized: F = " + function.getExpression());
        out.println("Canonical form of F in sum-of-minterms notation:");
        out.println(function.sumOfMinterms());

        if(printTable){
            out.println("Truth Table:");
            out.println(TruthTableFormatter.format(function.getTruthTable()));
        }
    }

    private void printTableFile(String fileName, boolean printTable) throws IOException {
        out.println("Reading truth table...");
        TruthTable table = TruthTableReader.load(Paths.get(fileName));
        out.println("Canonical form of F in sum-of-minterms notation:");
        out.println(MintermBuilder.sumOfMinterms(table));

        if(printTable){
            out.println("Truth Table:");
            out.println(TruthTableFormatter.format(table));
        }
    }

    private void interactive() throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        out.println(PROMPT);
        String input = reader.readLine();
        while (input != null && !StringUtils.isBlank(input) && !EXIT.equalsIgnoreCase(input.trim())){
            try {
                BooleanFunction function = new BooleanFunction(input);
                out.println("Normalized: F = " + function.getExpression());
                out.println(function.sumOfMinterms());
            }
            catch (MintermException ex){
                out.println("Parsing Error:\n" + ex.getMessage());
            }

            out.println();
            out.println(PROMPT);
            input = reader.readLine();
        }
    }
}
