package org.example.mjcf;

import org.example.mjcf.export.AssemblyExporter;
import org.example.mjcf.export.ExportResult;
import org.example.mjcf.export.ExportSettings;
import org.example.mjcf.export.ShapeReferenceMeshProvider;
import org.example.mjcf.model.Assembly;
import org.example.mjcf.model.AssemblyReader;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.Callable;

/**
 * Exports assembly descriptions to MJCF models.
 *
 * Accepts one or more files or directories; directories are scanned
 * recursively for *.json assembly files. Every assembly is exported on its
 * own into {@code <output>/<name>.xml}. A failing assembly is reported and
 * skipped; its model file is not written, since the document is built
 * completely in memory before anything touches the disk. An input whose
 * model file was already written by an earlier input of the same run is
 * reported as failed instead of overwriting it.
 *
 * Settings are resolved in three layers: built-in defaults, then the
 * {@code --settings} properties file, then individual options.
 *
 * Exit codes: 0 = all exported, 1 = at least one export failed or a path was
 * missing, 2 = invalid settings.
 */
@Command(
    name = "export",
    mixinStandardHelpOptions = true,
    description = "Export assembly description(s) to MuJoCo MJCF model files"
)
public class ExportCommand implements Callable<Integer> {

    @Parameters(
        paramLabel = "<path>",
        description = "One or more assembly .json files or directories to scan recursively",
        arity = "1..*"
    )
    private List<Path> inputs;

    @Option(names = {"--output", "-o"}, description = "Output directory (default: .)",
        paramLabel = "<dir>", defaultValue = ".")
    private Path outputDir;

    @Option(names = {"--settings"}, description = "Properties file with export settings", paramLabel = "<file>")
    private Path settingsFile;

    @Option(names = {"--root"}, description = "Part to use as root body instead of the grounded part",
        paramLabel = "<part>")
    private String rootPart;

    @Option(names = {"--integrator"}, description = "Euler, RK4, implicit or implicitfast", paramLabel = "<name>")
    private String integrator;

    @Option(names = {"--timestep"}, description = "Simulation timestep in seconds", paramLabel = "<s>")
    private Double timestep;

    @Option(names = {"--solver"}, description = "PGS, CG or Newton", paramLabel = "<name>")
    private String solver;

    @Option(names = {"--damping"}, description = "Default joint damping", paramLabel = "<value>")
    private Double damping;

    @Option(names = {"--armature"}, description = "Default joint armature", paramLabel = "<value>")
    private Double armature;

    @Option(names = {"--length-scale"}, description = "CAD length unit to meters (default: 0.001)",
        paramLabel = "<factor>")
    private Double lengthScale;

    @Option(names = {"--meshdir"}, description = "Mesh directory referenced by the model", paramLabel = "<dir>")
    private String meshDir;

    @Override
    public Integer call() {
        ExportSettings settings;
        try {
            settings = resolveSettings();
        } catch (ConfigurationException e) {
            Logger.error("%s", e.getMessage());
            return 2;
        }

        InputFiles input = InputFiles.expand(inputs);
        if (input.isEmpty()) {
            return input.missing() > 0 ? 1 : 0;
        }

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            Logger.error("Cannot create %s: %s", outputDir, e.getMessage());
            return 2;
        }

        AssemblyExporter exporter = new AssemblyExporter(
            settings, new ShapeReferenceMeshProvider(), Optional.ofNullable(rootPart));

        int failures = input.missing();
        Map<Path, Path> writtenBy = new HashMap<>();
        for (Path file : input.files()) {
            if (!exportOne(exporter, file, writtenBy)) failures++;
        }

        if (input.files().size() > 1) {
            System.out.printf("%nExported %d of %d assembly file(s).%n",
                input.files().size() - (failures - input.missing()), input.files().size());
        }
        return failures > 0 ? 1 : 0;
    }

    private boolean exportOne(AssemblyExporter exporter, Path file, Map<Path, Path> writtenBy) {
        Path target = outputDir.resolve(FileUtils.baseName(file) + ".xml");
        Path previous = writtenBy.get(target.toAbsolutePath().normalize());
        if (previous != null) {
            System.err.printf("  [x]  %s: configuration error: output '%s' was already written from '%s'%n",
                file, target, previous);
            return false;
        }
        try {
            Assembly assembly = AssemblyReader.read(file);
            ExportResult result = exporter.export(assembly);
            Files.writeString(target, result.toXml(), StandardCharsets.UTF_8);
            writtenBy.put(target.toAbsolutePath().normalize(), file);
            System.out.printf("  [ok] %s -> %s (%d loop constraint(s))%n",
                file, target, result.analysis().spanningTree().unusedEdges().size());
            return true;
        } catch (ExportException e) {
            System.err.printf("  [x]  %s: %s error: %s%n", file, e.kind(), e.getMessage());
            Logger.debug("Export of %s failed: %s", file, e);
            return false;
        } catch (IOException e) {
            Logger.error("Cannot write '%s': %s", target, e.getMessage());
            return false;
        }
    }

    ExportSettings resolveSettings() {
        Properties props = settingsFile != null ? ExportSettings.loadProperties(settingsFile) : new Properties();
        override(props, ExportSettings.INTEGRATOR, integrator);
        override(props, ExportSettings.TIMESTEP, timestep);
        override(props, ExportSettings.SOLVER, solver);
        override(props, ExportSettings.JOINT_DAMPING, damping);
        override(props, ExportSettings.JOINT_ARMATURE, armature);
        override(props, ExportSettings.LENGTH_SCALE, lengthScale);
        override(props, ExportSettings.MESH_DIR, meshDir);
        return ExportSettings.fromProperties(props);
    }

    private static void override(Properties props, String key, Object value) {
        if (value != null) props.setProperty(key, value.toString());
    }
}
