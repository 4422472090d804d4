package org.example.mjcf;

import org.example.mjcf.graph.Edge;
import org.example.mjcf.graph.Graph;
import org.example.mjcf.graph.KinematicAnalysis;
import org.example.mjcf.graph.Node;
import org.example.mjcf.graph.RootedTree;
import org.example.mjcf.model.Assembly;
import org.example.mjcf.model.AssemblyReader;
import org.json.JSONArray;
import org.json.JSONObject;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Displays the kinematic tree an export would produce, without writing a
 * model.
 *
 * The tree lists every part under its parent together with the joint that
 * connects them and the MJCF joint type it maps to. Joints left out of the
 * tree are listed separately as loops, with the constraint they turn into.
 *
 * Usage:
 *   tree <path>                  -- ASCII tree + loops (default)
 *   tree <path> -f json          -- JSON output
 *   tree <path> --root <part>    -- root the tree at a specific part
 */
@Command(
    name = "tree",
    mixinStandardHelpOptions = true,
    description = "Display the kinematic tree and loop joints of assembly file(s) as ASCII tree or JSON"
)
public class TreeCommand implements Callable<Integer> {

    @Parameters(
        paramLabel = "<path>",
        description = "One or more assembly .json files or directories to scan recursively",
        arity = "1..*"
    )
    private List<Path> inputs;

    @Option(
        names = {"-f", "--format"},
        defaultValue = "text",
        description = "Output format: text (default) or json",
        paramLabel = "<fmt>"
    )
    private String format;

    @Option(names = {"--root"}, description = "Part to use as root instead of the grounded part",
        paramLabel = "<part>")
    private String rootPart;

    private PrintStream out = System.out;

    TreeCommand withOutput(PrintStream stream) {
        this.out = stream;
        return this;
    }

    // ── Entry point ──────────────────────────────────────────────────────────

    @Override
    public Integer call() {
        String fmt = format.toLowerCase();
        if (!fmt.equals("text") && !fmt.equals("json")) {
            Logger.error("--format must be: text or json");
            return 2;
        }

        InputFiles input = InputFiles.expand(inputs);
        if (input.isEmpty()) {
            return input.missing() > 0 ? 1 : 0;
        }

        int errors = input.missing();
        JSONArray jsonResults = new JSONArray();
        for (Path file : input.files()) {
            try {
                Assembly assembly = AssemblyReader.read(file);
                KinematicAnalysis analysis = KinematicAnalysis.of(assembly, Optional.ofNullable(rootPart));
                if ("json".equals(fmt)) {
                    jsonResults.put(toJson(assembly, analysis));
                } else {
                    printAscii(assembly, analysis);
                }
            } catch (ExportException e) {
                System.err.printf("  [x]  %s: %s error: %s%n", file, e.kind(), e.getMessage());
                errors++;
            }
        }

        if ("json".equals(fmt)) {
            out.println(jsonResults.length() == 1
                ? jsonResults.getJSONObject(0).toString(2)
                : jsonResults.toString(2));
        }
        return errors > 0 ? 1 : 0;
    }

    // ── ASCII rendering ──────────────────────────────────────────────────────

    private void printAscii(Assembly assembly, KinematicAnalysis analysis) {
        RootedTree tree = analysis.rootedTree();
        out.println(assembly.name());
        renderAscii(tree, tree.root(), null, "", true);

        List<Graph.Link> loops = analysis.spanningTree().unusedEdges();
        if (!loops.isEmpty()) {
            out.println();
            out.println("Loops:");
            for (Graph.Link link : loops) {
                out.printf("  %-20s -[%-24s]- %-20s => %s%n",
                    link.from().key(), edgeLabel(link.edge()), link.to().key(),
                    link.edge().kind().isRigid() ? "weld" : "unsupported");
            }
        }
        out.println();
    }

    /**
     * Recursively renders one body as an ASCII tree node.
     *
     * @param incoming joint from the parent, {@code null} for the root
     * @param prefix   indentation prefix built by the caller
     * @param isLast   whether this is the last sibling (selects └── vs ├──)
     */
    private void renderAscii(RootedTree tree, Node node, Edge incoming, String prefix, boolean isLast) {
        String connector = isLast ? "└── " : "├── ";
        String label = incoming == null
            ? node.key() + "  (root)"
            : node.key() + "  <" + edgeLabel(incoming) + ">";
        out.println(prefix + connector + label);

        String childPrefix = prefix + (isLast ? "    " : "│   ");
        List<Node> children = tree.children(node);
        for (int i = 0; i < children.size(); i++) {
            Node child = children.get(i);
            Edge edge = tree.graph().edge(node, child).orElseThrow(() -> new ConsistencyException(
                "No edge from '" + node.key() + "' to '" + child.key() + "'"));
            renderAscii(tree, child, edge, childPrefix, i == children.size() - 1);
        }
    }

    /** Returns {@code "Joint001 REVOLUTE->hinge"} or {@code "Joint002 FIXED"} for rigid joints. */
    private static String edgeLabel(Edge edge) {
        return edge.name() + " " + edge.kind() + edge.kind().mjcfType().map(t -> "->" + t).orElse("");
    }

    // ── JSON rendering ───────────────────────────────────────────────────────

    private JSONObject toJson(Assembly assembly, KinematicAnalysis analysis) {
        RootedTree tree = analysis.rootedTree();
        JSONObject obj = new JSONObject();
        obj.put("assembly", assembly.name());
        obj.put("root", tree.root().key());
        obj.put("tree", buildJsonNode(tree, tree.root(), null));

        JSONArray loops = new JSONArray();
        for (Graph.Link link : analysis.spanningTree().unusedEdges()) {
            JSONObject loop = new JSONObject();
            loop.put("joint", link.edge().name());
            loop.put("kind", link.edge().kind().name());
            loop.put("from", link.from().key());
            loop.put("to", link.to().key());
            loop.put("constraint", link.edge().kind().isRigid() ? "weld" : JSONObject.NULL);
            loops.put(loop);
        }
        obj.put("loops", loops);
        return obj;
    }

    private JSONObject buildJsonNode(RootedTree tree, Node node, Edge incoming) {
        JSONObject obj = new JSONObject();
        obj.put("part", node.key());
        if (incoming != null) {
            obj.put("joint", incoming.name());
            obj.put("kind", incoming.kind().name());
            incoming.kind().mjcfType().ifPresent(t -> obj.put("type", t));
        }

        JSONArray children = new JSONArray();
        for (Node child : tree.children(node)) {
            Edge edge = tree.graph().edge(node, child).orElseThrow(() -> new ConsistencyException(
                "No edge from '" + node.key() + "' to '" + child.key() + "'"));
            children.put(buildJsonNode(tree, child, edge));
        }
        if (children.length() > 0) obj.put("children", children);
        return obj;
    }
}
