package modernizer.syntax;

import java.util.List;

public record PyModule(List<PyStmt> body, PyGrammar grammar) {
}
