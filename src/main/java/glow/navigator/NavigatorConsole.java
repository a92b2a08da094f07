package glow.navigator;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import glow.navigator.graph.Graph;
import glow.navigator.graph.GraphDiagnostics;
import glow.navigator.io.ConsoleFormatter;
import glow.navigator.model.Edge;
import glow.navigator.query.GraphWalker;
import glow.navigator.query.NavigatorSession;
import glow.navigator.query.NodeSelector;
import glow.navigator.query.PatternException;
import glow.navigator.query.QueryDirectives;
import glow.navigator.query.WalkStep;

/**
 * Read-eval loop: a regex lists matching nodes, a number from the last
 * listing shows that node's parents and children, a {@code $$} line is a
 * directive. End of input quits.
 */
final class NavigatorConsole {

    static final String SEARCH_PROMPT = "Enter regex for selecting nodes: ";
    static final String NAVIGATE_PROMPT = "Enter number to navigate or another regex to search again: ";
    static final String RULE = "-".repeat(120);

    private final NavigatorSession session;
    private final ConsoleFormatter formatter;
    private final BufferedReader in;
    private final PrintStream out;

    NavigatorConsole(NavigatorSession session, ConsoleFormatter formatter, BufferedReader in, PrintStream out) {
        this.session = Objects.requireNonNull(session, "session");
        this.formatter = Objects.requireNonNull(formatter, "formatter");
        this.in = Objects.requireNonNull(in, "in");
        this.out = Objects.requireNonNull(out, "out");
    }

    void run() throws IOException {
        List<NodeSelector.Selection> listing = List.of();
        String prompt = SEARCH_PROMPT;
        while (true) {
            out.println();
            out.print(prompt);
            out.flush();
            final String line = in.readLine();
            if (line == null) {
                break;
            }
            final String query = line.trim();
            if (query.isEmpty()) {
                continue;
            }

            if (!listing.isEmpty() && isNumber(query)) {
                final int index = Integer.parseInt(query);
                if (index >= 0 && index < listing.size()) {
                    printNode(listing.get(index));
                }
                continue;
            }

            if (QueryDirectives.isDirective(query)) {
                final QueryDirectives.Result result = QueryDirectives.apply(query, session);
                out.println();
                out.println((result.ok() ? "-> " : "-> Error: ") + result.message());
                if (result.action() == QueryDirectives.Action.MISSING) {
                    printMissing(session.current().graph());
                }
                listing = List.of();
                prompt = SEARCH_PROMPT;
                continue;
            }

            try {
                listing = NodeSelector.select(session.current().graph(), query, session.options());
            } catch (PatternException ex) {
                out.println();
                out.println("--> " + ex.getMessage() + "!");
                listing = List.of();
                prompt = SEARCH_PROMPT;
                continue;
            }
            out.println();
            for (int i = 0; i < listing.size(); i++) {
                out.println(String.format("%3d %s", i, formatter.format(listing.get(i).data())));
            }
            prompt = listing.isEmpty() ? SEARCH_PROMPT : NAVIGATE_PROMPT;
        }
        out.println();
        out.println("Thanks for using the Glow Navigator");
    }

    void printNode(NodeSelector.Selection selection) {
        final Graph graph = session.current().graph();
        out.println();
        out.println(RULE);
        out.println();
        out.println(ConsoleFormatter.indent(formatter.format(selection.data()), 0));
        out.println();
        out.println("These are the parents (predecessors):");
        printWalk(GraphWalker.walk(graph, selection.key(), GraphWalker.Direction.PREDECESSORS, session.options()));
        out.println();
        out.println("These are the children (successors):");
        printWalk(GraphWalker.walk(graph, selection.key(), GraphWalker.Direction.SUCCESSORS, session.options()));
    }

    void printWalk(List<WalkStep> steps) {
        for (WalkStep step : steps) {
            out.println();
            if (step.outcome() == WalkStep.Outcome.UNDEFINED) {
                out.println(ConsoleFormatter.indent(step.key() + " is an undefined reference!", step.level()));
                continue;
            }
            final String colour = step.outcome() == WalkStep.Outcome.REVISITED ? ConsoleFormatter.DEFAULT_COLOUR : null;
            out.println(ConsoleFormatter.indent(formatter.format(step.data(), colour), step.level()));
            for (Edge edge : step.edges()) {
                out.println(ConsoleFormatter.indent(formatter.format(edge.attributes()), step.level()));
            }
        }
    }

    void printMissing(Graph graph) {
        out.println();
        out.println("These nodes have no data:");
        for (GraphDiagnostics.MissingNode missing : GraphDiagnostics.missingData(graph)) {
            out.println();
            out.println(missing.key());
            for (GraphDiagnostics.Caller caller : missing.callers()) {
                out.println();
                out.println("-> from : " + caller.attributes());
                for (Map<String, Object> via : caller.via()) {
                    out.println("    via : " + via);
                }
            }
        }
    }

    private static boolean isNumber(String text) {
        if (text.length() > 9) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            if (!Character.isDigit(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
