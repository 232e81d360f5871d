package work.lcod.orbital.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.orbital.api.LogLevel;
import work.lcod.orbital.api.RunConfiguration;
import work.lcod.orbital.api.RunResult;
import work.lcod.orbital.api.ScenarioRunner;
import work.lcod.orbital.behavior.BehaviorCategory;
import work.lcod.orbital.behavior.BehaviorLoader;
import work.lcod.orbital.behavior.BehaviorValidator;
import work.lcod.orbital.registry.BehaviorMetadata;
import work.lcod.orbital.registry.BehaviorRegistry;
import work.lcod.orbital.shared.DurationParser;

@CommandLine.Command(
    name = "orbital-run",
    description = "Run behavior scenarios and inspect the standard behavior library.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class OrbitalRunCommand implements Callable<Integer> {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectWriter JSON_WRITER = JSON.writerWithDefaultPrettyPrinter();
    static final String LOG_LEVEL_ENV = "ORBITAL_LOG_LEVEL";

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-s", "--scenario"},
        description = "Scenario file (YAML or JSON) to run.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String scenario;

    @CommandLine.Option(
        names = "--settings",
        description = "Engine settings TOML file.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String settings;

    @CommandLine.Option(
        names = "--log-level",
        description = "Runtime log threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Option(
        names = "--timeout",
        description = "Scenario timeout (e.g. 500ms, 30s, 2m).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String timeoutRaw;

    @CommandLine.Option(
        names = "--list",
        description = "List the standard behaviors."
    )
    private boolean list;

    @CommandLine.Option(
        names = "--category",
        description = "Restrict --list to one category (e.g. async, game-core).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String category;

    @CommandLine.Option(
        names = "--describe",
        paramLabel = "NAME",
        description = "Print the metadata of one standard behavior.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String describe;

    @CommandLine.Option(
        names = "--validate",
        paramLabel = "PATH",
        description = "Validate a behavior definition file.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String validate;

    @Override
    public Integer call() throws Exception {
        LogLevel logLevel = resolveLogLevel();
        logLevel.apply();
        var out = spec.commandLine().getOut();

        if (list) {
            out.println(JSON_WRITER.writeValueAsString(listBehaviors()));
            return 0;
        }
        if (describe != null && !describe.isBlank()) {
            var behavior = BehaviorRegistry.standard().require(describe.trim());
            out.println(JSON_WRITER.writeValueAsString(BehaviorMetadata.of(behavior).toMap()));
            return 0;
        }
        if (validate != null && !validate.isBlank()) {
            return validateDefinition(Paths.get(validate).toAbsolutePath().normalize());
        }
        if (scenario == null || scenario.isBlank()) {
            throw new CommandLine.ParameterException(
                spec.commandLine(), "One of --scenario, --list, --describe or --validate is required.");
        }

        Path scenarioPath = Paths.get(scenario).toAbsolutePath().normalize();
        if (!Files.isRegularFile(scenarioPath)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Cannot read scenario file: " + scenarioPath);
        }
        Optional<Duration> timeout = DurationParser.parse(timeoutRaw);
        Optional<Path> settingsPath = Optional.ofNullable(settings)
            .filter(value -> !value.isBlank())
            .map(value -> Paths.get(value).toAbsolutePath().normalize());

        RunConfiguration configuration = RunConfiguration.builder()
            .scenario(scenarioPath)
            .settingsFile(settingsPath)
            .timeout(timeout)
            .logLevel(logLevel)
            .build();
        RunResult result = new ScenarioRunner().run(configuration);
        out.println(result.toPrettyJson());
        return result.status().exitCode();
    }

    private List<Object> listBehaviors() {
        var registry = BehaviorRegistry.standard();
        var behaviors = category == null || category.isBlank()
            ? registry.all()
            : registry.byCategory(BehaviorCategory.from(category).orElseThrow(
                () -> new CommandLine.ParameterException(spec.commandLine(), "Unknown category: " + category)));
        var entries = new ArrayList<Object>();
        for (var behavior : behaviors) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("name", behavior.name());
            entry.put("category", behavior.category());
            entry.put("description", behavior.description());
            entries.add(entry);
        }
        return entries;
    }

    private int validateDefinition(Path path) throws Exception {
        var behavior = BehaviorLoader.load(path);
        var errors = BehaviorValidator.validate(behavior);
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("behavior", behavior.name());
        report.put("valid", errors.isEmpty());
        report.put("errors", errors);
        spec.commandLine().getOut().println(JSON_WRITER.writeValueAsString(report));
        return errors.isEmpty() ? 0 : 1;
    }

    private LogLevel resolveLogLevel() {
        String candidate = logLevelRaw;
        if (candidate == null || candidate.isBlank()) {
            candidate = System.getenv(LOG_LEVEL_ENV);
        }
        if (candidate == null || candidate.isBlank()) {
            candidate = "fatal";
        }
        return LogLevel.from(candidate);
    }
}
