package org.dice.minterms.console;

public interface ConsoleParams {

    String PROG = "minterms";

    String FUNCTION       = "-F";
    String FUNCTION_LONG  = "--function";
    String FUNCTION_DEST  = "function";

    // also print the truth table
    String TABLE          = "-t";
    String TABLE_LONG     = "--table";
    String TABLE_DEST     = "table";

    String READ_TABLE      = "-r";
    String READ_TABLE_LONG = "--read-table";
    String READ_TABLE_DEST = "read_table";

    String HELP      = "-h";
    String HELP_LONG = "--help";
    String HELP_DEST = "help";

    // ends the interactive loop
    String EXIT = "exit";

    int EXIT_OK    = 0;
    int EXIT_ERROR = 1;
    int EXIT_USAGE = 2;
}
