package dumb.argue;

import dumb.argue.LogicParser.ParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LogicParserTests extends AbstractTest {

    @Test
    void clausesAndRules() {
        var statements = parse(WEATHER);
        assertEquals(5, statements.size());
        assertEquals(new Clause(Literal.of("sunny"), Literal.of("stay_home")), statements.get(0));
        assertEquals(new Rule(Literal.not("happy"), Literal.of("sunny"), Literal.of("stay_home")), statements.get(1));
        assertEquals(new Rule(Literal.of("work_well"), Literal.of("happy")), statements.get(4));
    }

    @Test
    void singleLiteralClause() {
        assertEquals(List.of(new Clause(Literal.not("raining"))), parse("~raining."));
    }

    @Test
    void whitespaceIsInsignificant() {
        assertEquals(parse("a,~b.c:-a,~b."), parse("  a ,\n ~ b .\n\tc :-\n a , ~b\n."));
    }

    @Test
    void commentsRunToEndOfLine() {
        var statements = parse("""
                % facts
                a. % trailing
                b :- a. %% rule
                """);
        assertEquals(List.of(new Clause(Literal.of("a")), new Rule(Literal.of("b"), Literal.of("a"))), statements);
    }

    @Test
    void emptyProgram() {
        assertTrue(parse("").isEmpty());
        assertTrue(parse("  \n % nothing here\n").isEmpty());
    }

    @Test
    void duplicateLiteralsCollapse() {
        var statements = parse("a, a, ~a. b :- a, a.");
        assertEquals(2, ((Clause) statements.get(0)).literals().size());
        assertEquals(1, ((Rule) statements.get(1)).body().size());
    }

    @Test
    void parsedLiteralsAreNotInterned() {
        var statements = parse("a. b :- a.");
        var fromClause = ((Clause) statements.get(0)).literals().iterator().next();
        var fromRule = ((Rule) statements.get(1)).body().iterator().next();
        assertEquals(fromClause, fromRule);
        assertNotSame(fromClause, fromRule);
        assertTrue(fromClause.caseView().isEmpty());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "a",              // no terminator
            "a :- b",         // no terminator
            "a, b",           // no terminator
            ".",              // empty statement
            "a. .",           // empty statement
            "a :- .",         // rule without body
            "a :- ",          // rule without body or terminator
            ":- a.",          // rule without head
            "a, .",           // empty member
            "1a.",            // invalid token
            "a b.",           // missing separator
            "a :- b, 2c.",    // invalid token in body
            "a :- b :- c.",   // nested inference
            "a ; b.",         // invalid separator
            "a :b."           // malformed inference marker
    })
    void malformedProgramsAreRejected(String program) {
        assertThrows(ParseException.class, () -> LogicParser.parse(program));
    }

    @Test
    void errorsCarryLocation() {
        var e = assertThrows(ParseException.class, () -> LogicParser.parse("a.\nb :- c, 9d."));
        assertEquals(2, e.line());
        assertTrue(e.getMessage().contains("at line 2"), e.getMessage());
        assertTrue(e.getMessage().contains("found '9'"), e.getMessage());
    }

    @Test
    void unterminatedStatementIsReported() {
        var e = assertThrows(ParseException.class, () -> LogicParser.parse("a :- b"));
        assertTrue(e.getMessage().startsWith("Unterminated statement"), e.getMessage());
    }

    @Test
    void ruleWithoutBodyIsReported() {
        var e = assertThrows(ParseException.class, () -> LogicParser.parse("a :- ."));
        assertTrue(e.getMessage().contains("no body"), e.getMessage());
    }
}
