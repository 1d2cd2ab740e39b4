package dumb.argue;

import com.fasterxml.jackson.databind.JsonNode;
import dumb.argue.util.Json;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static dumb.argue.util.Log.debug;
import static dumb.argue.util.Log.message;
import static java.util.Objects.requireNonNull;
import static java.util.Optional.ofNullable;

/**
 * A consolidated, read-only set of clauses and rules over one pool of interned literals.
 * <p>
 * Consolidation rebuilds every input statement so that each (atom, polarity) pair is represented by a
 * single {@link Literal} instance, bound to its {@link Case}. Statements supplied by the caller are never
 * kept by reference.
 */
public class KnowledgeBase {
    private static final int MAX_PROGRAM_PREVIEW = 50;

    private final Map<String, Literal> pool;
    private final Set<Clause> clauses;
    private final Set<Rule> rules;
    private final Configuration config;
    private final Evidence evidence;

    private KnowledgeBase(List<Statement> input, Configuration config) {
        this.config = requireNonNull(config);
        var pool = new LinkedHashMap<String, Literal>();
        var clauses = new LinkedHashSet<Clause>();
        var rules = new LinkedHashSet<Rule>();
        var assertingClauses = new HashMap<Literal, Set<Clause>>();
        var assertingRules = new HashMap<Literal, Set<Rule>>();

        for (var s : input) {
            if (s instanceof Clause c) {
                var rebuilt = new Clause(intern(pool, c.literals()));
                if (clauses.add(rebuilt))
                    rebuilt.literals().forEach(l -> assertingClauses.computeIfAbsent(l, k -> new LinkedHashSet<>()).add(rebuilt));
            } else if (s instanceof Rule r) {
                var rebuilt = new Rule(intern(pool, r.head()), intern(pool, r.body()));
                if (rules.add(rebuilt))
                    assertingRules.computeIfAbsent(rebuilt.head(), k -> new LinkedHashSet<>()).add(rebuilt);
            } else {
                throw new Statement.StructuralException("Expected a Clause or Rule but found " + s);
            }
        }

        this.pool = Collections.unmodifiableMap(pool);
        this.clauses = Collections.unmodifiableSet(clauses);
        this.rules = Collections.unmodifiableSet(rules);
        this.evidence = new Evidence(this, config.distinctSupports());

        pool.values().forEach(l -> l.bind(new Case(l,
                ofNullable(assertingClauses.get(l)).orElse(Set.of()),
                ofNullable(assertingRules.get(l)).orElse(Set.of()),
                evidence)));

        debug(String.format("Consolidated %d statements into %d literals, %d clauses, %d rules", input.size(), pool.size(), clauses.size(), rules.size()));
    }

    private static Literal intern(Map<String, Literal> pool, Literal literal) {
        return pool.computeIfAbsent(literal.key(), k -> new Literal(literal.atom(), literal.positive()));
    }

    private static Set<Literal> intern(Map<String, Literal> pool, Set<Literal> literals) {
        var interned = new LinkedHashSet<Literal>();
        literals.forEach(l -> interned.add(intern(pool, l)));
        return interned;
    }

    public static KnowledgeBase of(Source source) throws LogicParser.ParseException {
        return of(source, Configuration.load());
    }

    public static KnowledgeBase of(Source source, Configuration config) throws LogicParser.ParseException {
        requireNonNull(source, "source");
        requireNonNull(config, "config");
        if (source instanceof Source.Statements s) return new KnowledgeBase(s.statements(), config);
        if (source instanceof Source.Text t) return new KnowledgeBase(LogicParser.parse(t.program()), config);
        if (source instanceof Source.File f) return new KnowledgeBase(LogicParser.parse(read(f.path(), config)), config);
        throw new IllegalStateException("Unknown source " + source);
    }

    /** Builds from Clause and Rule objects; anything else is a {@link Statement.StructuralException}. */
    public static KnowledgeBase of(Collection<?> statements) {
        return of(statements, Configuration.load());
    }

    public static KnowledgeBase of(Collection<?> statements, Configuration config) {
        return new KnowledgeBase(Source.of(statements).statements(), requireNonNull(config, "config"));
    }

    public static KnowledgeBase of(Statement... statements) {
        return of(List.of(statements));
    }

    public static KnowledgeBase parse(String program) throws LogicParser.ParseException {
        return of(Source.text(program));
    }

    public static KnowledgeBase read(Path path) throws LogicParser.ParseException {
        return of(Source.file(path));
    }

    /**
     * Reads {@code pathOrProgram} as a file when one exists at that path, otherwise as program text.
     * Text that is neither an existing path nor a valid program is reported as not found, with the
     * parse failure as cause.
     *
     * @see Source#guess(String)
     */
    public static KnowledgeBase load(String pathOrProgram) throws LogicParser.ParseException {
        var source = Source.guess(pathOrProgram);
        if (source instanceof Source.Text t) {
            try {
                return of(t);
            } catch (LogicParser.ParseException e) {
                throw new NotFoundException("No file at '" + preview(pathOrProgram) + "' and it is not a valid program: " + e.getMessage(), e);
            }
        }
        return of(source);
    }

    private static String read(Path path, Configuration config) {
        if (!Files.isRegularFile(path)) throw new NotFoundException("Program file not found: " + path);
        try {
            message("Loading program from " + path);
            return Files.readString(path, config.encoding());
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read program file " + path, e);
        }
    }

    private static String preview(String s) {
        return s.length() <= MAX_PROGRAM_PREVIEW ? s : s.substring(0, MAX_PROGRAM_PREVIEW) + "...";
    }

    public Collection<Literal> literals() {
        return pool.values();
    }

    public Optional<Literal> literal(String key) {
        return ofNullable(pool.get(requireNonNull(key).strip()));
    }

    public Optional<Literal> literal(String atom, boolean positive) {
        return literal(positive ? atom : Literal.NEGATION + atom);
    }

    /** The interned instance equal to {@code literal}. */
    public Literal require(Literal literal) {
        requireNonNull(literal, "literal");
        var interned = pool.get(literal.key());
        if (interned == null) throw new NotFoundException("Literal " + literal.key() + " is not in the knowledge base");
        return interned;
    }

    public Literal require(String key) {
        return literal(key).orElseThrow(() -> new NotFoundException("Literal " + key + " is not in the knowledge base"));
    }

    public Case caseOf(Literal literal) {
        var interned = require(literal);
        return interned.caseView().orElseThrow(() -> new IllegalStateException("Interned literal " + interned.key() + " has no case"));
    }

    public Case caseOf(String key) {
        return caseOf(require(key));
    }

    public Stream<Case> cases() {
        return pool.values().stream().map(this::caseOf);
    }

    public List<Literal> contained() {
        return withStatus(Case.Status.CONTAINED);
    }

    public List<Literal> entailed() {
        return withStatus(Case.Status.ENTAILED);
    }

    public List<Literal> unsupported() {
        return withStatus(Case.Status.UNSUPPORTED);
    }

    private List<Literal> withStatus(Case.Status status) {
        return cases().filter(c -> c.status() == status).map(Case::claim).toList();
    }

    public Set<Clause> clauses() {
        return clauses;
    }

    public Set<Rule> rules() {
        return rules;
    }

    public List<Statement> statements() {
        var all = new ArrayList<Statement>(clauses.size() + rules.size());
        all.addAll(clauses);
        all.addAll(rules);
        return Collections.unmodifiableList(all);
    }

    public Evidence evidence() {
        return evidence;
    }

    public Configuration config() {
        return config;
    }

    public JsonNode toJson() {
        var json = Json.node();
        var literals = json.putArray("literals");
        cases().sorted(Comparator.comparing(Case::claim)).forEach(c -> literals.addObject()
                .put("literal", c.claim().key())
                .put("status", c.status().name()));
        var clauseArray = json.putArray("clauses");
        clauses.stream().map(Clause::toString).sorted().forEach(clauseArray::add);
        var ruleArray = json.putArray("rules");
        rules.stream().map(Rule::toString).sorted().forEach(ruleArray::add);
        return json;
    }

    /** The program, one statement per line: clauses first, then rules. */
    @Override
    public String toString() {
        return Stream.concat(
                        clauses.stream().map(Clause::toString).sorted(),
                        rules.stream().map(Rule::toString).sorted())
                .collect(Collectors.joining("\n"));
    }

    /** A path that does not resolve, or a literal absent from the knowledge base. */
    public static class NotFoundException extends RuntimeException {
        public NotFoundException(String message) {
            super(message);
        }

        public NotFoundException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
