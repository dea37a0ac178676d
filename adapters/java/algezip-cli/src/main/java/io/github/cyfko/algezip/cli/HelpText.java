package io.github.cyfko.algezip.cli;

import java.io.PrintStream;
import java.util.List;

/**
 * Text printed by the {@code help} command.
 */
final class HelpText {

    static final List<String> LINES = List.of(
            "Focus:",
            "'^' under the current expression denotes the subexpression currently under focus",
            "Use '^', '.', '<', '>' to move focus around (more info under Commands)",
            "Transformations are always applied to the current subexpression under focus",
            "",
            "Boolean expression syntax (for giving arguments to 'r!' and 'x'):",
            "F - False, T - True",
            "Single lowercase letters - variables",
            "(!a) - not a, (a & b) - a and b, (a | b) - a or b",
            "No operator precedence -- operations must be explicitly written in brackets",
            "Allowed bracket types (interchangeable, but must be paired correctly): (), [], {}",
            "",
            "Commands:",
            "r! a - replace current subexpression under focus with a",
            "^ - move focus to the parent of the current subexpression under focus",
            ". - move focus from (!a) to its only argument a",
            "< - move focus from (a & b) or (a | b) to the left argument a",
            "> - move focus from (a & b) or (a | b) to the right argument b",
            "c - [c]ommutativity -- (a | b) -> (b | a), (a & b) -> (b & a)",
            "i - [i]dentity -- (a | F) -> a, (a & T) -> a",
            "|F - expand via identity -- a -> (a | F)",
            "&T - expand via identity -- a -> (a & T)",
            "d - [d]istributivity -- (a | [b & c]) -> ([a | b] & [a | c]), (a & [b | c]) -> ([a & b] | [a & c])",
            "f - [f]actoring -- ([a | b] & [a | c]) -> (a | [b & c]), ([a & b] | [a & c]) -> (a & [b | c])",
            "v - complements/in[v]erses -- (a | [!a]) -> T, (a & [!a]) -> F",
            "x a - e[x]pand into complements -- T -> (a | [!a]), F -> (a & [!a])",
            "help - print help",
            "q! - quit"
    );

    static final String USAGE = "usage: algezip [-h]";

    static final List<String> DESCRIPTION = List.of(
            "AlgeZip - a program that allows you to manipulate boolean expressions",
            "by applying boolean algebra axioms to transform them into equivalent expressions.",
            "Uses a \"focusing\" navigation system to allow for the manipulation of subexpressions,",
            "implemented via the functional programming concept of zippers (hence the name AlgeZip).",
            "",
            "options:",
            "  -h, --help  show this help message and exit"
    );

    private HelpText() {}

    /** Prints a blank separator line followed by the help lines. */
    static void print(PrintStream out) {
        out.println();
        LINES.forEach(out::println);
    }

    static void printUsage(PrintStream out) {
        out.println(USAGE);
        out.println();
        DESCRIPTION.forEach(out::println);
    }
}
