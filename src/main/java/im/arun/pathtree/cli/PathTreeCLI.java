package im.arun.pathtree.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.pathtree.config.ConfigLoader;
import im.arun.pathtree.config.PathTreeConfig;
import im.arun.pathtree.service.PathTreeService;
import im.arun.pathtree.util.PathComponents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
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
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface for scanning a directory into a compact path tree using Picocli.
 */
@Command(
    name = "pathtree",
    description = "Scan a directory into a compact path tree and report its size",
    mixinStandardHelpOptions = true,
    version = "PathTree 1.0"
)
public class PathTreeCLI implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(PathTreeCLI.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"--root"}, description = "Directory to scan (default: user home)")
    private String root;

    @Option(names = {"--config"}, description = "YAML configuration file")
    private String configPath;

    @Option(names = {"--separator"}, description = "Component separator for the encoded form")
    private String separator;

    @Option(names = {"--follow-links"}, description = "Follow symbolic links to directories")
    private Boolean followLinks;

    @Option(names = {"--skip-hidden"}, description = "Skip entries whose name starts with '.'")
    private Boolean skipHidden;

    @Option(names = {"--list"}, description = "Print every path stored in the tree")
    private boolean list;

    @Option(names = {"--encoded"}, description = "Print the encoded token sequence")
    private boolean encoded;

    @Option(names = {"--verify"}, description = "Check that every stored path still exists")
    private boolean verify;

    @Option(names = {"--output"}, description = "Write the JSON summary to this file")
    private String outputPath;

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Path rootPath = Paths.get(root != null ? root : System.getProperty("user.home"));
        if (!Files.isDirectory(rootPath)) {
            err.println("Error: not a directory: " + rootPath);
            return 1;
        }

        PathTreeConfig config;
        try {
            config = new ConfigLoader(configPath).load(userOptions());
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        PathTreeService service = new PathTreeService(config);
        PathTreeService.ScanResult result;
        try {
            result = service.scan(rootPath);
        } catch (Exception e) {
            logger.error("Scan of {} failed", rootPath, e);
            err.println("Error scanning directory: " + e.getMessage());
            return 1;
        }

        char sep = config.separatorChar();
        if (list) {
            result.getScannedTree().getTree().forEach(
                (List<String> path) -> out.println(PathComponents.join(path, sep)));
        }
        if (encoded) {
            out.println(result.getScannedTree().getTree().encode(sep));
        }
        if (verify) {
            int missing = service.verify(result);
            if (missing > 0) {
                err.println("Warning: " + missing + " stored paths are missing from the file system");
            }
        }

        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        String jsonOutput = mapper.writeValueAsString(result.getSummary());

        if (outputPath != null) {
            Files.writeString(Paths.get(outputPath), jsonOutput);
            out.println("Summary written to: " + outputPath);
        } else {
            out.println(jsonOutput);
        }
        out.flush();
        return 0;
    }

    private Map<String, Object> userOptions() {
        Map<String, Object> options = new HashMap<>();
        if (separator != null) options.put("separator", separator);
        if (followLinks != null) options.put("followLinks", followLinks);
        if (skipHidden != null) options.put("skipHidden", skipHidden);
        return options;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new PathTreeCLI()).execute(args);
        System.exit(exitCode);
    }
}
