package org.example.mjcf;

import java.io.InputStream;
import java.util.Properties;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.IVersionProvider;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
    name = "assembly2mjcf",
    versionProvider = Assembly2Mjcf.VersionProvider.class,
    description = "Convert CAD assemblies into MuJoCo (MJCF) kinematic trees."
)
public class Assembly2Mjcf implements Runnable {

    static class VersionProvider implements IVersionProvider {
        @Override
        public String[] getVersion() throws Exception {
            Properties props = new Properties();
            try (InputStream is = Assembly2Mjcf.class.getResourceAsStream("/META-INF/assembly2mjcf-version.properties")) {
                if (is != null) {
                    props.load(is);
                    return new String[]{ props.getProperty("version", "unknown") };
                }
            }
            return new String[]{ "unknown" };
        }
    }

    @Spec
    CommandSpec spec;

    @Option(names = {"-v", "--version"}, versionHelp = true, description = "Print version information and exit")
    private boolean version;

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    static CommandLine commandLine() {
        CommandLine cmd = new CommandLine(new Assembly2Mjcf());
        cmd.addSubcommand("export", new ExportCommand());
        cmd.addSubcommand("tree", new TreeCommand());
        cmd.addSubcommand("help", new CommandLine.HelpCommand());
        return cmd;
    }

    @Override
    public void run() {
        // No subcommand given: print usage including all registered subcommands
        spec.commandLine().usage(System.out);
    }
}
