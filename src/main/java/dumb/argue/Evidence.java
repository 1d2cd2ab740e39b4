package dumb.argue;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Enumerates the evidence sets of a literal by backward chaining over its knowledge base.
 * <p>
 * A clause asserting the literal is one evidence set on its own. A rule concluding it contributes
 * one evidence set per combination of evidence sets of its distinct body literals, united and extended
 * by the rule. Results are pulled one at a time, unordered, and recomputed on every call.
 * <p>
 * Each call carries the literals being expanded on its own path; reaching one of them again contributes
 * nothing, so mutually dependent rules terminate and never support each other.
 */
public class Evidence {
    private final KnowledgeBase kb;
    private final boolean distinct;

    Evidence(KnowledgeBase kb, boolean distinct) {
        this.kb = kb;
        this.distinct = distinct;
    }

    private static Set<Literal> extend(Set<Literal> path, Literal literal) {
        var next = new HashSet<Literal>(path);
        next.add(literal);
        return Collections.unmodifiableSet(next);
    }

    private static Set<Statement> union(Set<Statement> a, Set<Statement> b) {
        if (a.isEmpty()) return b;
        var u = new LinkedHashSet<Statement>(a);
        u.addAll(b);
        return Collections.unmodifiableSet(u);
    }

    private static Set<Statement> with(Set<Statement> support, Rule rule) {
        var s = new LinkedHashSet<Statement>(support);
        s.add(rule);
        return Collections.unmodifiableSet(s);
    }

    /**
     * Evidence sets for {@code literal}.
     *
     * @throws KnowledgeBase.NotFoundException if the literal is not in the knowledge base
     */
    public Stream<Set<Statement>> supports(Literal literal) {
        return stream(new LiteralSupports(kb.require(literal), Set.of()));
    }

    public Stream<Set<Statement>> supports(String key) {
        return supports(kb.require(key));
    }

    /**
     * Evidence sets that {@code rule} contributes to its head, each including the rule itself.
     *
     * @throws KnowledgeBase.NotFoundException if the rule is not in the knowledge base
     */
    public Stream<Set<Statement>> supports(Rule rule) {
        var head = kb.require(rule.head());
        var interned = kb.caseOf(head).assertingRules().stream()
                .filter(rule::equals)
                .findFirst()
                .orElseThrow(() -> new KnowledgeBase.NotFoundException("Rule " + rule + " is not in the knowledge base"));
        return stream(new RuleSupports(interned, Set.of(head)));
    }

    public Stream<Argument> arguments(Literal literal) {
        var claim = kb.require(literal);
        return supports(claim).map(support -> new Argument(support, claim));
    }

    public Stream<Argument> arguments(String key) {
        return arguments(kb.require(key));
    }

    /** Arguments for every literal of the knowledge base. */
    public Stream<Argument> arguments() {
        return kb.literals().stream().flatMap(this::arguments);
    }

    public long count(Literal literal) {
        return supports(literal).count();
    }

    private Stream<Set<Statement>> stream(Iterator<Set<Statement>> supports) {
        var s = StreamSupport.stream(Spliterators.spliteratorUnknownSize(supports, Spliterator.NONNULL), false);
        return distinct ? s.distinct() : s;
    }

    private abstract static class Supports implements Iterator<Set<Statement>> {
        private @Nullable Set<Statement> next;
        private boolean exhausted;

        /** The next evidence set, or null when there are no more. */
        protected abstract @Nullable Set<Statement> advance();

        @Override
        public boolean hasNext() {
            if (next == null && !exhausted) {
                next = advance();
                exhausted = next == null;
            }
            return next != null;
        }

        @Override
        public Set<Statement> next() {
            if (!hasNext()) throw new NoSuchElementException();
            var n = next;
            next = null;
            return n;
        }
    }

    /** Asserting clauses first, then every asserting rule in turn. */
    private final class LiteralSupports extends Supports {
        private final Iterator<Clause> clauses;
        private final Iterator<Rule> rules;
        private final Set<Literal> path;
        private Iterator<Set<Statement>> current = Collections.emptyIterator();

        LiteralSupports(Literal claim, Set<Literal> path) {
            if (path.contains(claim)) {
                this.clauses = Collections.emptyIterator();
                this.rules = Collections.emptyIterator();
                this.path = path;
            } else {
                var c = claim.caseView().orElseThrow(() -> new IllegalStateException("Literal " + claim.key() + " is not interned"));
                this.clauses = c.assertingClauses().iterator();
                this.rules = c.assertingRules().iterator();
                this.path = extend(path, claim);
            }
        }

        @Override
        protected @Nullable Set<Statement> advance() {
            if (clauses.hasNext()) return Set.<Statement>of(clauses.next());
            while (!current.hasNext()) {
                if (!rules.hasNext()) return null;
                current = new RuleSupports(rules.next(), path);
            }
            return current.next();
        }
    }

    /**
     * Cartesian product over the rule's body, walked depth first with one iterator per body literal.
     * {@code partial[i]} is the union of the sets chosen at levels 0..i.
     */
    private final class RuleSupports extends Supports {
        private final Rule rule;
        private final List<Literal> body;
        private final Set<Literal> path;
        private final List<Iterator<Set<Statement>>> levels;
        private final List<Set<Statement>> partial;
        private int level;

        RuleSupports(Rule rule, Set<Literal> path) {
            this.rule = rule;
            this.body = new ArrayList<>(rule.body());
            this.path = path;
            this.levels = new ArrayList<>(Collections.<Iterator<Set<Statement>>>nCopies(body.size(), Collections.emptyIterator()));
            this.partial = new ArrayList<>(Collections.<Set<Statement>>nCopies(body.size(), Set.of()));
            levels.set(0, new LiteralSupports(body.get(0), path));
        }

        @Override
        protected @Nullable Set<Statement> advance() {
            var last = body.size() - 1;
            while (level >= 0) {
                var it = levels.get(level);
                if (!it.hasNext()) {
                    level--;
                    continue;
                }
                var chosen = union(level == 0 ? Set.<Statement>of() : partial.get(level - 1), it.next());
                partial.set(level, chosen);
                if (level == last) return with(chosen, rule);
                level++;
                levels.set(level, new LiteralSupports(body.get(level), path));
            }
            return null;
        }
    }
}
