package dumb.argue;

import java.util.Collection;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A clause or a rule: the unit a knowledge base is built from and the unit an
 * argument's support is made of.
 */
public sealed interface Statement permits Clause, Rule {
    String TERMINATOR = ".";
    String SEPARATOR = ", ";
    String INFERENCE = " :- ";

    /** Every literal this statement references. */
    Set<Literal> literals();

    /** This statement in program syntax, terminator included. */
    String toString();

    static String join(Collection<Literal> literals) {
        return literals.stream().sorted().map(Literal::key).collect(Collectors.joining(SEPARATOR));
    }

    /** Malformed statement objects: empty clauses or bodies, null members, invalid atoms. */
    class StructuralException extends IllegalArgumentException {
        public StructuralException(String message) {
            super(message);
        }
    }
}
