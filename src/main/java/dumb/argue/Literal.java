package dumb.argue;

import org.jetbrains.annotations.Nullable;

import java.util.Optional;
import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * An atom asserted positively ({@code a}) or negatively ({@code ~a}).
 * <p>
 * Equality is structural over (atom, polarity). Inside a {@link KnowledgeBase} each
 * (atom, polarity) pair is backed by exactly one interned instance, which is also
 * the only kind of literal bound to a {@link Case}.
 */
public final class Literal implements Comparable<Literal> {
    public static final String NEGATION = "~";
    static final Pattern ATOM_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9_]*$");

    private final String atom;
    private final boolean positive;
    private volatile @Nullable Case caseView;

    public Literal(String atom, boolean positive) {
        requireNonNull(atom, "atom");
        if (!ATOM_PATTERN.matcher(atom).matches())
            throw new Statement.StructuralException("Invalid atom '" + atom + "': expected a letter followed by letters, digits or '_'");
        this.atom = atom;
        this.positive = positive;
    }

    public static Literal of(String atom) {
        return new Literal(atom, true);
    }

    public static Literal not(String atom) {
        return new Literal(atom, false);
    }

    /** Reads {@code a} or {@code ~a}. */
    public static Literal parse(String key) {
        requireNonNull(key, "key");
        var k = key.strip();
        return k.startsWith(NEGATION) ? not(k.substring(NEGATION.length()).strip()) : of(k);
    }

    public String atom() {
        return atom;
    }

    public boolean positive() {
        return positive;
    }

    /** The rendered form, also the key of this literal in a knowledge base's pool. */
    public String key() {
        return positive ? atom : NEGATION + atom;
    }

    public boolean isNegationOf(Literal other) {
        return other != null && atom.equals(other.atom) && positive != other.positive;
    }

    /** The complementary literal. Never interned. */
    public Literal negate() {
        return new Literal(atom, !positive);
    }

    /** The case this literal is bound to, present only for literals interned by a knowledge base. */
    public Optional<Case> caseView() {
        return Optional.ofNullable(caseView);
    }

    synchronized void bind(Case c) {
        requireNonNull(c);
        if (caseView != null)
            throw new IllegalStateException("Literal " + key() + " is already bound to a case");
        if (c.claim() != this)
            throw new IllegalStateException("Case for " + c.claim().key() + " cannot be bound to " + key());
        caseView = c;
    }

    @Override
    public int compareTo(Literal o) {
        var cmp = atom.compareTo(o.atom);
        return cmp != 0 ? cmp : Boolean.compare(!positive, !o.positive);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Literal l && positive == l.positive && atom.equals(l.atom));
    }

    @Override
    public int hashCode() {
        return 31 * atom.hashCode() + (positive ? 1 : 0);
    }

    @Override
    public String toString() {
        return key();
    }
}
