package dumb.argue;

import dumb.argue.LogicParser.ParseException;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.fail;

abstract class AbstractTest {

    static final String WEATHER = """
            sunny, stay_home.
            ~happy :- sunny, stay_home.
            ~work_well :- stay_home.
            happy :- stay_home.
            work_well :- happy.
            """;

    static KnowledgeBase kb(String program) {
        return kb(program, new Configuration());
    }

    static KnowledgeBase kb(String program, Configuration config) {
        try {
            return KnowledgeBase.of(Source.text(program), config);
        } catch (ParseException e) {
            fail("Failed to parse program:\n" + formatParseException(e, program));
            return null;
        }
    }

    static List<Statement> parse(String program) {
        try {
            return LogicParser.parse(program);
        } catch (ParseException e) {
            fail("Failed to parse program:\n" + formatParseException(e, program));
            return Collections.emptyList();
        }
    }

    /** Evidence sets of {@code key}, each rendered as the sorted statements it contains. */
    static List<Set<String>> supports(KnowledgeBase kb, String key) {
        return kb.evidence().supports(key).map(AbstractTest::render).collect(Collectors.toList());
    }

    static Set<String> render(Set<Statement> support) {
        return support.stream().map(Statement::toString).collect(Collectors.toCollection(TreeSet::new));
    }

    static Set<String> set(String... statements) {
        return new TreeSet<>(List.of(statements));
    }

    private static String formatParseException(ParseException e, String program) {
        var sb = new StringBuilder(e.getMessage());
        if (e.line() > 0) {
            var lines = program.split("\n", -1);
            if (e.line() <= lines.length) {
                sb.append('\n').append(lines[e.line() - 1]).append('\n');
                sb.append(" ".repeat(Math.max(0, e.col() - 1))).append('^');
            }
        }
        return sb.toString();
    }
}
