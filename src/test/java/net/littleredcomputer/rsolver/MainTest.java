package net.littleredcomputer.rsolver;

import com.google.common.base.Splitter;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Stream;

import static java.util.stream.Collectors.toSet;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class MainTest {
    private static final Splitter lines = Splitter.onPattern("\r?\n").omitEmptyStrings();
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private ExitCode run(String stdin, String... args) {
        return Main.run(args,
                new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(out, true),
                new PrintStream(err, true));
    }

    private List<String> out() { return lines.splitToList(new String(out.toByteArray(), StandardCharsets.UTF_8)); }

    private List<String> err() { return lines.splitToList(new String(err.toByteArray(), StandardCharsets.UTF_8)); }

    private static String resourcePath(String name) throws URISyntaxException {
        return Paths.get(MainTest.class.getClassLoader().getResource(name).toURI()).toString();
    }

    @Test
    public void satisfiableFromArguments() {
        assertThat(run("", "a", "&", "~b"), is(ExitCode.SATISFIABLE));
        assertThat(out(), contains(
                "Parsed Input: a & ~ b",
                "Unique Literals: a b",
                "Satisfied with a=True b=False",
                "Number of Evals: 3",
                "Number of Lookups: 6",
                "Max Depth: 1"));
        assertThat(err(), is(empty()));
    }

    @Test
    public void unsatisfiable() {
        assertThat(run("", "-quiet", "x & ~x"), is(ExitCode.UNSATISFIABLE));
        assertThat(out(), contains("Unstatisfied"));
    }

    @Test
    public void fromStdin() {
        assertThat(run("x |\r\n~x\n", "-quiet"), is(ExitCode.SATISFIABLE));
        assertThat(out(), contains("Satisfied with x=False"));
    }

    @Test
    public void fromFile() throws URISyntaxException {
        assertThat(run("", "-quiet", "-input", resourcePath("pigeonhole3.txt")), is(ExitCode.UNSATISFIABLE));
        assertThat(run("", "-quiet", "-input", resourcePath("crlf.txt")), is(ExitCode.SATISFIABLE));
    }

    @Test
    public void dashMeansStdin() {
        assertThat(run("a", "-quiet", "-input", "-"), is(ExitCode.SATISFIABLE));
        assertThat(out(), contains("Satisfied with a=True"));
    }

    @Test
    public void syntaxError() {
        assertThat(run("", "a & b &"), is(ExitCode.CANNOT_PARSE_INPUT));
        assertThat(err(), contains("Formula has invalid syntax -- Expected something after an and/or"));
        assertThat(out(), not(hasItem(startsWith("Satisfied"))));
    }

    @Test
    public void emptyInput() {
        assertThat(run(""), is(ExitCode.CANNOT_PARSE_INPUT));
        assertThat(err(), contains("Contents is empty -- cannot solve"));
    }

    @Test
    public void blankInput() {
        assertThat(run(" \n\t"), is(ExitCode.CANNOT_PARSE_INPUT));
        assertThat(err(), contains("No tokens found -- cannot solve"));
    }

    @Test
    public void noLiterals() {
        assertThat(run("", "-quiet", "~"), is(ExitCode.CANNOT_PARSE_INPUT));
        assertThat(err(), contains("There are no literals -- nothing to solve"));
    }

    @Test
    public void noLiteralsListedWhenThereAreNone() {
        assertThat(run("", "~"), is(ExitCode.CANNOT_PARSE_INPUT));
        assertThat(out(), contains("Parsed Input: ~"));
        assertThat(err(), contains("There are no literals -- nothing to solve"));
    }

    @Test
    public void unreadableFile() {
        assertThat(run("", "-input", "/nonexistent/formula.txt"), is(ExitCode.CANNOT_READ_INPUT));
        assertThat(err().get(0), startsWith("Cannot read input -- "));
    }

    @Test
    public void help() {
        assertThat(run("", "-?"), is(ExitCode.COMMAND_LINE_FAIL));
        assertThat(err(), hasItem(startsWith("usage: rsolver")));
        assertThat(out(), is(empty()));
    }

    @Test
    public void badOption() {
        assertThat(run("", "-bogus", "a"), is(ExitCode.COMMAND_LINE_FAIL));
    }

    @Test
    public void badLogInterval() {
        assertThat(run("", "-loginterval", "soon", "a"), is(ExitCode.COMMAND_LINE_FAIL));
        assertThat(run("", "-loginterval", "PT0.5S", "-quiet", "a"), is(ExitCode.SATISFIABLE));
    }

    @Test
    public void exitStatusesAreDistinct() {
        assertThat(Stream.of(ExitCode.values()).map(ExitCode::status).collect(toSet()), hasSize(ExitCode.values().length));
        assertThat(ExitCode.SATISFIABLE.status(), is(0));
        assertThat(ExitCode.UNSATISFIABLE.status(), is(20));
        assertThat(ExitCode.CANNOT_PARSE_INPUT.status(), is(3));
    }
}
