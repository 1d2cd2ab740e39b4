package dumb.argue;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * An unconditional conjunction of literals, e.g. {@code sunny, ~raining.}
 */
public record Clause(Set<Literal> literals) implements Statement {
    public Clause {
        literals = members(literals, "Clause");
    }

    public Clause(Literal... literals) {
        this(Arrays.asList(requireNonNull(literals)));
    }

    public Clause(Collection<Literal> literals) {
        this(new LinkedHashSet<Literal>(requireNonNull(literals)));
    }

    static Set<Literal> members(Set<Literal> literals, String what) {
        if (literals == null || literals.isEmpty())
            throw new StructuralException(what + " requires at least one literal");
        if (literals.stream().anyMatch(Objects::isNull))
            throw new StructuralException(what + " contains a null literal");
        return Set.copyOf(literals);
    }

    public boolean asserts(Literal literal) {
        return literal != null && literals.contains(literal);
    }

    @Override
    public String toString() {
        return Statement.join(literals) + TERMINATOR;
    }
}
