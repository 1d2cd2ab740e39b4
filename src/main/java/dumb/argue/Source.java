package dumb.argue;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import static dumb.argue.util.Log.debug;
import static java.util.Objects.requireNonNull;

/**
 * What a {@link KnowledgeBase} is built from: statement objects, program text, or a file of program text.
 */
public sealed interface Source permits Source.Statements, Source.Text, Source.File {

    static Statements of(Collection<?> objects) {
        requireNonNull(objects, "objects");
        var statements = new ArrayList<Statement>(objects.size());
        for (var o : objects) {
            if (o instanceof Statement s) statements.add(s);
            else
                throw new Statement.StructuralException("Expected a Clause or Rule but found " + (o == null ? "null" : o.getClass().getSimpleName() + " " + o));
        }
        return new Statements(statements);
    }

    static Statements of(Statement... statements) {
        return of(List.of(statements));
    }

    static Text text(String program) {
        return new Text(program);
    }

    static File file(Path path) {
        return new File(path);
    }

    /**
     * Legacy single-string dispatch: a string naming an existing regular file is read as that file,
     * anything else is taken as program text. Program text that happens to name an existing file is
     * therefore read as a path.
     */
    static Source guess(String pathOrProgram) {
        requireNonNull(pathOrProgram, "pathOrProgram");
        try {
            var path = Path.of(pathOrProgram);
            if (!pathOrProgram.isBlank() && Files.isRegularFile(path)) return new File(path);
        } catch (InvalidPathException e) {
            debug("Not a path, reading as program text: " + e.getMessage());
        }
        return new Text(pathOrProgram);
    }

    record Statements(List<Statement> statements) implements Source {
        public Statements {
            statements = List.copyOf(requireNonNull(statements));
        }
    }

    record Text(String program) implements Source {
        public Text {
            requireNonNull(program);
        }
    }

    record File(Path path) implements Source {
        public File {
            requireNonNull(path);
        }
    }
}
