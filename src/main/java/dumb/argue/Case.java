package dumb.argue;

import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * An interned literal's view onto the clauses that assert it and the rules that conclude it.
 */
public final class Case {
    private final Literal claim;
    private final Set<Clause> assertingClauses;
    private final Set<Rule> assertingRules;
    private final Evidence evidence;
    private volatile Set<Rule> supportingRulesCache;

    Case(Literal claim, Set<Clause> assertingClauses, Set<Rule> assertingRules, Evidence evidence) {
        this.claim = claim;
        this.assertingClauses = Set.copyOf(assertingClauses);
        this.assertingRules = Set.copyOf(assertingRules);
        this.evidence = evidence;
    }

    public Literal claim() {
        return claim;
    }

    public Set<Clause> assertingClauses() {
        return assertingClauses;
    }

    public Set<Rule> assertingRules() {
        return assertingRules;
    }

    public Status status() {
        if (!assertingClauses.isEmpty()) return Status.CONTAINED;
        return assertingRules.isEmpty() ? Status.UNSUPPORTED : Status.ENTAILED;
    }

    public boolean isContained() {
        return status() == Status.CONTAINED;
    }

    public boolean isEntailed() {
        return status() == Status.ENTAILED;
    }

    public boolean isUnsupported() {
        return status() == Status.UNSUPPORTED;
    }

    /** Asserting rules that contribute at least one evidence set. */
    public Set<Rule> supportingRules() {
        if (supportingRulesCache == null)
            supportingRulesCache = assertingRules.stream()
                    .filter(r -> evidence.supports(r).findAny().isPresent())
                    .collect(Collectors.toUnmodifiableSet());
        return supportingRulesCache;
    }

    /** Whether at least one argument concludes this literal. */
    public boolean isSupported() {
        return !assertingClauses.isEmpty() || !supportingRules().isEmpty();
    }

    public Stream<Set<Statement>> supports() {
        return evidence.supports(claim);
    }

    public Stream<Argument> arguments() {
        return evidence.arguments(claim);
    }

    @Override
    public String toString() {
        return "Case[" + claim.key() + ", " + status() + ", clauses=" + assertingClauses + ", rules=" + assertingRules + ']';
    }

    public enum Status {
        /** Asserted by at least one clause. */
        CONTAINED,
        /** Concluded by rules only. */
        ENTAILED,
        /** Neither asserted nor concluded. */
        UNSUPPORTED
    }
}
