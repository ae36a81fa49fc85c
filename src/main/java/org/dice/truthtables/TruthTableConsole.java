package org.dice.truthtables;

import org.dice.parsing.exceptions.LogicException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;

/**
 * Command line front end. With arguments, prints the table of each argument. Without, prompts for
 * statements until the user declines to run again.
 */
public class TruthTableConsole {

    private static final Logger log = LoggerFactory.getLogger( TruthTableConsole.class );

    static final String BANNER = "Logic Statement Truth Table Generator";
    static final String OPERATORS = "Operators: ~ (NOT), & (AND), | (OR), -> (IMPLIES), <-> (IFF)";
    static final String PROMPT = "Enter logic statement: ";
    static final String RUN_AGAIN = "Press R to run again or any other key to exit. ";
    static final String EXITING = "Exiting...";

    private final StatementEvaluator evaluator;
    private final BufferedReader in;
    private final PrintStream out;

    public TruthTableConsole(StatementEvaluator evaluator, BufferedReader in, PrintStream out) {
        this.evaluator = evaluator;
        this.in = in;
        this.out = out;
    }

    public static void main(String[] args) throws IOException {
        TruthTableConfig config = TruthTableConfig.load();
        log.debug("Loaded configuration: " + config);

        TruthTableConsole console = new TruthTableConsole(new StatementEvaluator(config),
                new BufferedReader(new InputStreamReader(System.in)), System.out);
        if (args.length > 0) {
            boolean ok = true;
            for (String statement : args) {
                ok &= console.print(statement);
            }
            if (!ok) {
                System.exit(1);
            }
            return;
        }
        console.run();
    }

    public void run() throws IOException {
        out.println(BANNER);
        out.println(OPERATORS);

        while (true) {
            out.print(PROMPT);
            out.flush();
            String statement = in.readLine();
            if (statement == null) {
                break;
            }
            print(statement);

            out.println(RUN_AGAIN);
            String answer = in.readLine();
            if (answer == null || !answer.trim().equalsIgnoreCase("r")) {
                break;
            }
        }
        out.println(EXITING);
    }

    /**
     * @return false if the statement could not be tabulated
     */
    public boolean print(String statement) {
        try {
            TruthTable table = evaluator.evaluate(statement);
            out.print(TruthTableFormatter.format(table));
            return true;
        }
        catch (LogicException ex) {
            log.debug(String.format("Failed to tabulate '%s'", statement), ex);
            out.println("Error: " + ex.getMessage());
            return false;
        }
    }
}
