package com.keystone.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.keystone.core.blueprint.BlueprintBuilder;
import com.keystone.core.blueprint.BlueprintSerializer;
import com.keystone.core.blueprint.ConstraintValidator;
import com.keystone.core.blueprint.ValidationResult;
import com.keystone.core.config.KeystoneProperties;
import com.keystone.core.guidance.GuidanceDocument;
import com.keystone.core.interview.AnswerCollector;
import com.keystone.core.interview.AnswerSet;
import com.keystone.core.interview.AnswerSource;
import com.keystone.core.interview.SuppliedAnswerSource;
import com.keystone.core.logging.MdcContext;
import com.keystone.core.model.Blueprint;
import com.keystone.core.pack.PackNotFoundException;
import com.keystone.core.pack.PackRegistry;
import com.keystone.core.pack.TemplatePack;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: keystone new [dir]
 * <p>
 * Runs the pack's interview, builds and validates the blueprint, then writes the
 * blueprint file and the guidance document. Nothing is written when the blueprint is
 * rejected. An existing guidance document is merged, not replaced.
 */
@Command(name = "new", mixinStandardHelpOptions = true, description = "Create a blueprint and guidance document")
@Component
public class NewCommand implements Callable<Integer> {

    @Option(names = {"--pack", "-p"}, description = "Template pack id", defaultValue = "python-api")
    private String packId;

    @Option(names = {"--language", "-l"}, description = "Pick the first pack for this language instead of --pack")
    private String language;

    @Option(names = "--framework", description = "Narrow --language to packs for this framework")
    private String framework;

    @Parameters(index = "0", arity = "0..1", description = "Output directory", defaultValue = ".")
    private Path outputDir;

    @Option(names = {"--answers", "-a"}, description = "JSON file of answers keyed by question id")
    private Path answersFile;

    @Option(names = "--set", description = "Answer a question, e.g. --set project_name=billing")
    private Map<String, String> overrides = new LinkedHashMap<>();

    @Option(names = {"--non-interactive", "-y"}, description = "Never prompt; fail on missing required answers")
    private boolean nonInteractive;

    @Option(names = "--force", description = "Overwrite an existing blueprint file")
    private boolean force;

    private final PackRegistry packRegistry;
    private final AnswerCollector answerCollector;
    private final BlueprintBuilder blueprintBuilder;
    private final ConstraintValidator constraintValidator;
    private final BlueprintSerializer serializer;
    private final GuidanceDocument guidanceDocument;
    private final KeystoneProperties properties;

    private final ObjectMapper mapper = new ObjectMapper();

    public NewCommand(PackRegistry packRegistry,
                      AnswerCollector answerCollector,
                      BlueprintBuilder blueprintBuilder,
                      ConstraintValidator constraintValidator,
                      BlueprintSerializer serializer,
                      GuidanceDocument guidanceDocument,
                      KeystoneProperties properties) {
        this.packRegistry = packRegistry;
        this.answerCollector = answerCollector;
        this.blueprintBuilder = blueprintBuilder;
        this.constraintValidator = constraintValidator;
        this.serializer = serializer;
        this.guidanceDocument = guidanceDocument;
        this.properties = properties;
    }

    @Override
    public Integer call() throws IOException {
        ConsoleOutput.printBanner();

        TemplatePack pack = language == null
                ? packRegistry.getPack(packId)
                : packRegistry.findByLanguage(language, framework)
                        .orElseThrow(() -> new PackNotFoundException(
                                framework == null ? language : language + "/" + framework));
        MdcContext.setPack(pack.id());
        try {
            ConsoleOutput.info("Pack: " + pack.metadata().name() + " (" + pack.id() + "@" + pack.version() + ")");

            Map<String, Object> supplied = new LinkedHashMap<>();
            if (answersFile != null) {
                try {
                    supplied.putAll(mapper.readValue(answersFile.toFile(), new TypeReference<Map<String, Object>>() {}));
                } catch (JsonProcessingException e) {
                    ConsoleOutput.error("Cannot parse answers file " + answersFile + ": " + e.getOriginalMessage());
                    return ExitCodes.INVALID_ANSWERS;
                }
            }
            supplied.putAll(overrides);

            AnswerSource source = supplied.isEmpty() && !nonInteractive
                    ? ConsoleAnswerSource.system()
                    : new SuppliedAnswerSource(supplied);
            AnswerSet answers = answerCollector.collect(pack.questions(), source);

            Blueprint blueprint = blueprintBuilder.build(answers, pack, outputDir.toString());
            MdcContext.setProject(pack.id(), blueprint.project().name());

            ValidationResult result = constraintValidator.validate(blueprint);
            if (!result.isOk()) {
                ConsoleOutput.violations(result.violations());
                return ExitCodes.VIOLATIONS;
            }

            Path blueprintFile = outputDir.resolve(properties.getBlueprintFile());
            Path guideFile = outputDir.resolve(properties.getGuideFile());
            if (Files.exists(blueprintFile) && !force) {
                ConsoleOutput.error(blueprintFile + " already exists (use --force to overwrite)");
                return ExitCodes.FAILURE;
            }

            // render before writing anything so a malformed existing guide leaves both files untouched
            boolean guideExists = Files.exists(guideFile);
            String guide = guideExists
                    ? guidanceDocument.update(Files.readString(guideFile, StandardCharsets.UTF_8), blueprint, pack).text()
                    : guidanceDocument.create(blueprint, pack);

            serializer.write(blueprint, blueprintFile);
            ConsoleOutput.fileChange("created", blueprintFile.toString());
            Files.writeString(guideFile, guide, StandardCharsets.UTF_8);
            ConsoleOutput.fileChange(guideExists ? "updated" : "created", guideFile.toString());

            ConsoleOutput.success("Project '" + blueprint.project().name() + "' is ready");
            return ExitCodes.OK;
        } finally {
            MdcContext.clear();
        }
    }
}
