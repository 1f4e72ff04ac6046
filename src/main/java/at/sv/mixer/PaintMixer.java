package at.sv.mixer;

import at.sv.mixer.catalog.CatalogLoadException;
import at.sv.mixer.catalog.CsvPigmentCatalog;
import at.sv.mixer.catalog.JsonPresetCatalog;
import at.sv.mixer.catalog.PigmentCatalog;
import at.sv.mixer.catalog.Preset;
import at.sv.mixer.catalog.PresetCatalog;
import at.sv.mixer.color.ColorTriple;
import at.sv.mixer.color.DeltaEMethod;
import at.sv.mixer.color.TargetColorParser;
import at.sv.mixer.mixing.MixingModel;
import at.sv.mixer.optimizer.EmptyCatalogException;
import at.sv.mixer.optimizer.InvalidConstraintsException;
import at.sv.mixer.optimizer.MixConstraints;
import at.sv.mixer.recipe.RecipeResult;
import at.sv.mixer.recipe.RecipeTextRenderer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

@Command(name = "PaintMixer", version = "0.1.0", mixinStandardHelpOptions = true, sortOptions = false,
        subcommands = CalibrateGammaCommand.class,
        description = "Finds a mixing recipe for a target color from a catalog of hobby paints.")
public final class PaintMixer implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(PaintMixer.class);
    static final int MAX_DILUTION_PERCENT = 50;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Parameters(
            index = "0",
            arity = "0..1",
            paramLabel = "CATALOG_FILE",
            defaultValue = "${env:CATALOG_FILE}",
            description = "The CSV file with the available paints. Columns: code,name,manufacturer,category,L,a,b")
    Path catalogFile;
    @Parameters(
            index = "1",
            arity = "0..1",
            paramLabel = "TARGET",
            description = "The target color. Examples: #808080, rgb(128 128 128), lab(53.6 0 0), " +
                          "or the name of a preset from the --presets file.")
    String target;
    @Option(names = "--presets", paramLabel = "<file>",
            defaultValue = "${env:PRESETS_FILE}",
            description = "The optional JSON file with named preset colors.")
    Path presetsFile;
    @Option(names = "--max-pigments", paramLabel = "<count>",
            defaultValue = "${env:MAX_PIGMENTS:-3}",
            description = "The maximum number of paints in the recipe [1..5]. " +
                          "Only combinations of up to 3 paints are searched. Default: ${DEFAULT-VALUE}")
    int maxPigments;
    @Option(names = "--exclude-category", paramLabel = "<category>", split = ",",
            description = "Paint categories not to use, e.g. metallic, clear, character.")
    List<String> excludedCategories;
    @Option(names = "--exclude-code", paramLabel = "<code>", split = ",",
            description = "Paint codes not to use.")
    List<String> excludedCodes;
    @Option(names = "--exclude-metallic",
            defaultValue = "${env:EXCLUDE_METALLIC:-false}",
            description = "Do not use metallic paints. Default: ${DEFAULT-VALUE}")
    boolean excludeMetallic;
    @Option(names = "--exclude-white-black",
            defaultValue = "${env:EXCLUDE_WHITE_BLACK:-false}",
            description = "Do not use white, black and silver paints. Default: ${DEFAULT-VALUE}")
    boolean excludeWhiteBlack;
    @Option(names = "--manufacturer", paramLabel = "<name>", split = ",",
            description = "Only use paints of the given manufacturers. Default: all manufacturers")
    List<String> manufacturers;
    @Option(names = "--dilution", paramLabel = "<percent>",
            defaultValue = "${env:DILUTION:-0}",
            description = "The share of thinner in the mix in percent [0..50]. Default: ${DEFAULT-VALUE}")
    double dilutionPercent;
    @Option(names = "--gamma",
            defaultValue = "${env:KM_GAMMA:-2.2}",
            description = "The gamma used to derive reflectance from lightness in the Kubelka-Munk model. " +
                          "See the 'calibrate' command. Default: ${DEFAULT-VALUE}")
    double gamma;
    @Option(names = "--mixing-model",
            defaultValue = "${env:MIXING_MODEL:-KUBELKA_MUNK}",
            description = "The mixing model used to predict mixed colors: ${COMPLETION-CANDIDATES}. Default: ${DEFAULT-VALUE}")
    MixingModel mixingModel;
    @Option(names = "--metric",
            defaultValue = "${env:METRIC:-DE00}",
            description = "The color difference reported for the final recipe: ${COMPLETION-CANDIDATES}. " +
                          "The search itself always uses DE76. Default: ${DEFAULT-VALUE}")
    DeltaEMethod reportMetric;
    @Option(names = "--candidate-pool-size", paramLabel = "<count>",
            defaultValue = "${env:CANDIDATE_POOL_SIZE:-15}",
            description = "The number of paints closest to the target that are combined. Default: ${DEFAULT-VALUE}")
    int candidatePoolSize;
    @Option(names = "--batch-mass", paramLabel = "<grams>",
            defaultValue = "${env:BATCH_MASS:-10.0}",
            description = "The total mass of paint to mix in grams. Default: ${DEFAULT-VALUE}")
    double batchMassGrams;
    @Option(names = "--threads",
            defaultValue = "${env:THREADS:-0}",
            description = "The number of worker threads for the search, 0 uses one per available processor. " +
                          "Default: ${DEFAULT-VALUE}")
    int threads;
    @Option(names = "--json",
            description = "Print the result as JSON instead of text.")
    boolean json;
    @Option(names = "--verbose",
            description = "Print the stack trace of errors.")
    boolean verbose;

    private final Function<Path, PigmentCatalog> catalogLoader;
    private final Function<Path, PresetCatalog> presetLoader;

    public PaintMixer() {
        this(CsvPigmentCatalog::load, JsonPresetCatalog::load);
    }

    public PaintMixer(Function<Path, PigmentCatalog> catalogLoader, Function<Path, PresetCatalog> presetLoader) {
        this.catalogLoader = catalogLoader;
        this.presetLoader = presetLoader;
    }

    public static void main(String[] args) {
        int execute = createCommandLine(new PaintMixer()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    public static CommandLine createCommandLine(PaintMixer paintMixer) {
        CommandLine commandLine = new CommandLine(paintMixer);
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setExecutionExceptionHandler(PaintMixer::handleExecutionException);
        return commandLine;
    }

    private static int handleExecutionException(Exception e, CommandLine commandLine, CommandLine.ParseResult parseResult) {
        if (e instanceof EmptyCatalogException || e instanceof InvalidConstraintsException
            || e instanceof CatalogLoadException || e instanceof IllegalArgumentException) {
            commandLine.getErr().println(commandLine.getColorScheme().errorText(e.getMessage()));
            if (commandLine.getCommand() instanceof PaintMixer paintMixer && paintMixer.verbose) {
                e.printStackTrace(commandLine.getErr());
            }
            return 1;
        }
        LOG.error("Unexpected error: {}", e.getLocalizedMessage(), e);
        return 2;
    }

    @Override
    public void run() {
        MDC.put("context", "init");
        if (catalogFile == null) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Missing CATALOG_FILE. Pass it as first parameter or set the CATALOG_FILE environment variable.");
        }
        if (target == null) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Missing TARGET color.");
        }
        PigmentCatalog catalog = catalogLoader.apply(catalogFile);
        ColorTriple targetColor = resolveTarget();
        MixConstraints constraints = createConstraints();
        LOG.info("Target: {}, {} pigments in catalog, {}", targetColor, catalog.getPigments().size(), constraints);

        MDC.put("context", "optimize");
        ExecutorService executor = Executors.newFixedThreadPool(getThreadCount());
        RecipeResult result;
        try {
            result = new PaintMixingEngine(executor).optimizeRecipe(targetColor, catalog.getPigments(), constraints);
        } finally {
            executor.shutdownNow();
        }
        print(result);
    }

    private ColorTriple resolveTarget() {
        if (TargetColorParser.isColorLiteral(target)) {
            return TargetColorParser.parse(target);
        }
        PresetCatalog presets = loadPresets();
        if (presets == null) {
            throw new IllegalArgumentException("Unknown target color '" + target + "'. Use #RRGGBB, rgb(r g b), " +
                                               "lab(L a b), or pass a --presets file to look up named colors.");
        }
        Preset preset = presets.findByName(target)
                               .orElseThrow(() -> new IllegalArgumentException("Preset '" + target + "' not found in '" + presetsFile + "'"));
        LOG.info("Using preset '{}' ({})", preset.name(), preset.category());
        return preset.color();
    }

    private @Nullable PresetCatalog loadPresets() {
        if (presetsFile == null) {
            return null;
        }
        return presetLoader.apply(presetsFile);
    }

    MixConstraints createConstraints() {
        Set<String> categories = toSet(excludedCategories);
        if (excludeMetallic) {
            categories.add("metallic");
        }
        Set<String> codes = toSet(excludedCodes);
        if (excludeWhiteBlack) {
            codes.addAll(MixConstraints.WHITE_BLACK_SILVER_CODES);
        }
        if (!(dilutionPercent >= 0 && dilutionPercent <= MAX_DILUTION_PERCENT)) {
            throw new InvalidConstraintsException("Invalid dilution '" + dilutionPercent + "'. Allowed range: 0-" +
                                                  MAX_DILUTION_PERCENT + " percent");
        }
        return MixConstraints.builder()
                             .maxPigments(maxPigments)
                             .excludedCategories(Set.copyOf(categories))
                             .excludedCodes(Set.copyOf(codes))
                             .manufacturers(Set.copyOf(toSet(manufacturers)))
                             .dilutionFraction(dilutionPercent / 100.0)
                             .gamma(gamma)
                             .mixingModel(mixingModel)
                             .reportMetric(reportMetric)
                             .candidatePoolSize(candidatePoolSize)
                             .batchMassGrams(batchMassGrams)
                             .build();
    }

    private static Set<String> toSet(@Nullable List<String> values) {
        if (values == null) {
            return new HashSet<>();
        }
        return new HashSet<>(values);
    }

    private int getThreadCount() {
        if (threads > 0) {
            return threads;
        }
        return Runtime.getRuntime().availableProcessors();
    }

    private void print(RecipeResult result) {
        PrintWriter out = spec.commandLine().getOut();
        if (json) {
            out.println(toJson(result));
        } else {
            out.println(RecipeTextRenderer.render(result));
        }
        out.flush();
    }

    private static String toJson(RecipeResult result) {
        try {
            return new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT).writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
