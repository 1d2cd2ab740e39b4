package dumb.argue;

import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A modus ponens rule {@code head :- b1, b2.}: the head follows from the conjunction of the body.
 * A head that also appears in its own body is accepted here; evidence enumeration deals with the cycle.
 */
public record Rule(Literal head, Set<Literal> body) implements Statement {
    public Rule {
        if (head == null) throw new StructuralException("Rule requires a head literal");
        body = Clause.members(body, "Rule body");
    }

    public Rule(Literal head, Literal... body) {
        this(head, body == null ? null : new LinkedHashSet<Literal>(Arrays.asList(body)));
    }

    public Rule(Literal head, Collection<Literal> body) {
        this(head, body == null ? null : new LinkedHashSet<Literal>(body));
    }

    public boolean isSelfReferential() {
        return body.contains(head);
    }

    @Override
    public Set<Literal> literals() {
        var all = new HashSet<Literal>(body);
        all.add(head);
        return Set.copyOf(all);
    }

    @Override
    public String toString() {
        return head.key() + INFERENCE + Statement.join(body) + TERMINATOR;
    }
}
