package work.lcod.foundation.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.foundation.config.Config;
import work.lcod.foundation.config.ConfigTree;
import work.lcod.foundation.config.ConfigValues;
import work.lcod.foundation.config.ReferenceResolver;
import work.lcod.foundation.config.source.EnvSource;
import work.lcod.foundation.config.source.OverrideSource;

@CommandLine.Command(
    name = "lcod-config",
    description = "Merge configuration files, environment variables and overrides, resolve cross-references and print the result.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class ConfigCommand implements Callable<Integer> {
    private static final ObjectMapper JSON = configure(new ObjectMapper());
    private static final ObjectMapper YAML = configure(new ObjectMapper(new YAMLFactory()));

    enum OutputFormat { JSON, YAML }

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-f", "--file"},
        paramLabel = "PATH",
        description = "Required configuration file (TOML, YAML or JSON). Repeatable; later files win."
    )
    private List<String> files = new ArrayList<>();

    @CommandLine.Option(
        names = {"-o", "--optional-file"},
        paramLabel = "PATH",
        description = "Configuration file merged after the required ones, skipped when missing. Repeatable."
    )
    private List<String> optionalFiles = new ArrayList<>();

    @CommandLine.Option(
        names = "--env-prefix",
        paramLabel = "PREFIX",
        description = "Merge environment variables named PREFIX<sep>SECTION<sep>KEY.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String envPrefix;

    @CommandLine.Option(
        names = "--env-separator",
        paramLabel = "SEP",
        description = "Separator between environment variable path segments.",
        defaultValue = "__"
    )
    private String envSeparator;

    @CommandLine.Option(
        names = {"-s", "--set"},
        paramLabel = "KEY=VALUE",
        description = "Override a dotted key (applied last). Repeatable."
    )
    private List<String> overrides = new ArrayList<>();

    @CommandLine.Option(
        names = "--no-resolve",
        description = "Print the merged tree without resolving cross-references."
    )
    private boolean noResolve;

    @CommandLine.Option(
        names = "--get",
        paramLabel = "DOTTED.PATH",
        description = "Print a single value instead of the whole tree.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String getPath;

    @CommandLine.Option(
        names = "--output",
        paramLabel = "FORMAT",
        description = "Output format: ${COMPLETION-CANDIDATES}.",
        defaultValue = "JSON"
    )
    private OutputFormat output;

    @Override
    public Integer call() throws Exception {
        if (files.isEmpty() && optionalFiles.isEmpty() && envPrefix == null && overrides.isEmpty()) {
            throw new CommandLine.ParameterException(
                spec.commandLine(),
                "Nothing to load: pass --file, --optional-file, --env-prefix or --set."
            );
        }

        var builder = Config.builder().resolveReferences(!noResolve);
        for (String file : files) {
            builder.withFile(toPath(file), true);
        }
        for (String file : optionalFiles) {
            builder.withFile(toPath(file), false);
        }
        if (envPrefix != null) {
            builder.withSource(new EnvSource(envPrefix, envSeparator));
        }
        if (!overrides.isEmpty()) {
            builder.withSource(new OverrideSource(overrides));
        }

        ConfigTree tree = builder.toConfig().load();
        Object selected = getPath == null ? tree.root() : ReferenceResolver.lookupPath(tree, getPath);
        spec.commandLine().getOut().println(render(selected));
        spec.commandLine().getOut().flush();
        return 0;
    }

    private String render(Object value) throws JsonProcessingException {
        if (getPath != null && ConfigValues.isScalar(value)) {
            return ConfigValues.toDisplayString(value);
        }
        if (output == OutputFormat.YAML) {
            return YAML.writeValueAsString(value).stripTrailing();
        }
        return JSON.writerWithDefaultPrettyPrinter().writeValueAsString(value);
    }

    private static Path toPath(String raw) {
        return Paths.get(raw).toAbsolutePath().normalize();
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        return mapper
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
