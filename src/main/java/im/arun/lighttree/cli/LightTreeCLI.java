package im.arun.lighttree.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.lighttree.config.ConfigLoader;
import im.arun.lighttree.config.LightTreeConfig;
import im.arun.lighttree.exception.NotFoundNodeException;
import im.arun.lighttree.json.JsonTree;
import im.arun.lighttree.json.TreeSerializer;
import im.arun.lighttree.tree.ShowOptions;
import im.arun.lighttree.tree.Tree;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line viewer: loads a JSON document as a tree and prints it.
 */
@Command(
    name = "lighttree",
    description = "Display a JSON document as a tree",
    mixinStandardHelpOptions = true,
    version = "LightTree 1.0"
)
public class LightTreeCLI implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(names = {"--json-path"}, description = "Path to JSON file", required = true)
    private String jsonPath;

    @Option(names = {"--path"}, description = "Only display the subtree at this key path (e.g. a.b.0)")
    private String nodePath;

    @Option(names = {"--config"}, description = "Path to a lighttree.yaml file")
    private String configPath;

    @Option(names = {"--line-type"}, description = "Line style: ascii, ascii-ex, ascii-exr, ascii-em, ascii-emv, ascii-emh")
    private String lineType;

    @Option(names = {"--limit"}, description = "Maximum number of lines displayed")
    private Integer limit;

    @Option(names = {"--line-max-length"}, description = "Maximum line length")
    private Integer lineMaxLength;

    @Option(names = {"--serialized"}, description = "Print the identifier based serialized form instead")
    private boolean serialized;

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Path jsonFilePath = Paths.get(jsonPath);
        if (!Files.exists(jsonFilePath)) {
            err.println("Error: JSON file not found: " + jsonPath);
            return 1;
        }

        Map<String, Object> overrides = new HashMap<>();
        if (lineType != null) overrides.put("lineType", lineType);
        if (limit != null) overrides.put("limit", limit);
        if (lineMaxLength != null) overrides.put("lineMaxLength", lineMaxLength);
        LightTreeConfig config = new ConfigLoader(configPath).load(overrides);

        JsonNode document = new ObjectMapper().readTree(jsonFilePath.toFile());
        Tree tree = new JsonTree(document, config.getPathSeparator());

        if (nodePath != null) {
            try {
                tree = tree.subtree(tree.getNodeIdByPath(nodePath)).getTree();
            } catch (NotFoundNodeException e) {
                err.println("Error: " + e.getMessage());
                return 1;
            }
        }

        if (serialized) {
            out.println(new TreeSerializer().toJson(tree));
        } else {
            ShowOptions options = config.showOptions().build();
            out.print(tree.show(options));
        }
        out.flush();
        return 0;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new LightTreeCLI()).execute(args);
        System.exit(exitCode);
    }
}
