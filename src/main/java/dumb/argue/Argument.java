package dumb.argue;

import com.fasterxml.jackson.databind.JsonNode;
import dumb.argue.util.Json;

import java.util.Set;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * A claim together with one complete collection of clauses and rules supporting it.
 */
public record Argument(Set<Statement> support, Literal claim) {
    public Argument {
        requireNonNull(claim);
        support = Set.copyOf(requireNonNull(support));
        if (support.isEmpty()) throw new IllegalArgumentException("Argument for " + claim.key() + " has no support");
    }

    public boolean uses(Statement statement) {
        return statement != null && support.contains(statement);
    }

    public JsonNode toJson() {
        var json = Json.node().put("claim", claim.key());
        var statements = json.putArray("support");
        support.stream().map(Statement::toString).sorted().forEach(statements::add);
        return json;
    }

    @Override
    public String toString() {
        return support.stream().map(Statement::toString).sorted()
                .collect(Collectors.joining(" ", "({", "}, " + claim.key() + ")"));
    }
}
