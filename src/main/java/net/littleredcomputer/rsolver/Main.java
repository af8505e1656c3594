package net.littleredcomputer.rsolver;

import com.google.common.base.Joiner;
import com.google.common.base.Stopwatch;
import com.google.common.io.CharStreams;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.format.DateTimeParseException;

public class Main {
    private static final Logger log = LogManager.getFormatterLogger(Main.class);
    private static Joiner spaceJoiner = Joiner.on(' ');

    private static final String description = "\n"
            + "A toy SAT (boolean SATisfiability) solver\n"
            + "https://en.wikipedia.org/wiki/Satisfiability\n"
            + "\n"
            + "You can put the logic expression on the command line (in quotes) or send it via stdin\n"
            + "\n"
            + "Example expressions:\n"
            + "a & ~b\n"
            + "x & ~x\n"
            + "mike & sally & ~peter\n"
            + "~(mike & sally) & ~peter\n"
            + "\n"
            + "The following are supported: &=and, |=or, ~=not, ()=brackets, letters=literals\n"
            + "The search is exhaustive; there is no attempt at optimization\n\n";

    private static Options options() {
        return new Options()
                .addOption("?", "help", false, "print this message")
                .addOption("input", true, "file containing the expression, or - for stdin")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format")
                .addOption("quiet", false, "print only the result line");
    }

    private static void usage(PrintStream err) {
        PrintWriter w = new PrintWriter(new OutputStreamWriter(err, StandardCharsets.UTF_8));
        new HelpFormatter().printHelp(w, HelpFormatter.DEFAULT_WIDTH, "rsolver [options] '<logic-expression>'",
                description, options(), HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
        w.flush();
    }

    /**
     * Read a whole stream, dropping carriage returns and turning newlines into
     * spaces so that a formula may span lines.
     */
    static String slurp(Reader r) throws IOException {
        return CharStreams.toString(r).replace("\r", "").replace('\n', ' ');
    }

    private static String input(CommandLine cmd, InputStream stdin) throws IOException {
        if (!cmd.getArgList().isEmpty()) return spaceJoiner.join(cmd.getArgList());
        String p = cmd.getOptionValue("input", "-");
        try (Reader r = new BufferedReader(p.equals("-")
                ? new InputStreamReader(stdin, StandardCharsets.UTF_8)
                : Files.newBufferedReader(Paths.get(p), StandardCharsets.UTF_8))) {
            return slurp(r);
        }
    }

    private static Duration logInterval(CommandLine cmd) {
        return Duration.parse(cmd.getOptionValue("loginterval", "PT1S"));
    }

    /**
     * Run the solver as a command would, without exiting.
     *
     * @return the process exit status
     */
    static ExitCode run(String[] args, InputStream stdin, PrintStream out, PrintStream err) {
        final CommandLine cmd;
        final Duration interval;
        try {
            cmd = new DefaultParser().parse(options(), args);
            interval = logInterval(cmd);
        } catch (ParseException | DateTimeParseException e) {
            err.println(e.getMessage());
            usage(err);
            return ExitCode.COMMAND_LINE_FAIL;
        }
        if (cmd.hasOption("?")) {
            usage(err);
            return ExitCode.COMMAND_LINE_FAIL;
        }
        final boolean quiet = cmd.hasOption("quiet");

        final String text;
        try {
            text = input(cmd, stdin);
        } catch (IOException e) {
            err.println("Cannot read input -- " + e.getMessage());
            return ExitCode.CANNOT_READ_INPUT;
        }
        if (text.isEmpty()) {
            err.println("Contents is empty -- cannot solve");
            return ExitCode.CANNOT_PARSE_INPUT;
        }
        Formula f = Formula.parse(text);
        if (f.tokens().isEmpty()) {
            err.println("No tokens found -- cannot solve");
            return ExitCode.CANNOT_PARSE_INPUT;
        }
        if (!quiet) {
            out.println("Parsed Input: " + f);
            if (!f.literals().isEmpty()) out.println("Unique Literals: " + f.literals());
        }

        Stopwatch sw = Stopwatch.createStarted();
        BacktrackingSolver s = new BacktrackingSolver(f).setLogInterval(interval);
        SearchResult result = s.solve();
        sw.stop();
        log.info("%s in %s", result.outcome(), sw);
        if (result.isError()) {
            err.println(result);
            return ExitCode.of(result);
        }
        out.println(result);
        if (!quiet) {
            SearchStatistics stats = s.statistics();
            out.println("Number of Evals: " + stats.evaluations());
            out.println("Number of Lookups: " + stats.lookups());
            out.println("Max Depth: " + stats.maxDepth());
        }
        return ExitCode.of(result);
    }

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err).status());
    }
}
