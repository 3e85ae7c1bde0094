package com.keystone.dispatch.cli;

import com.keystone.core.blueprint.BlueprintSerializer;
import com.keystone.core.blueprint.ConstraintValidator;
import com.keystone.core.blueprint.ValidationResult;
import com.keystone.core.config.KeystoneProperties;
import com.keystone.core.document.MergeResult;
import com.keystone.core.guidance.GuidanceDocument;
import com.keystone.core.logging.MdcContext;
import com.keystone.core.model.Blueprint;
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
import java.util.concurrent.Callable;

/**
 * CLI command: keystone update-guide [dir]
 * <p>
 * Re-derives the managed regions from the persisted blueprint and merges them into the
 * guidance document. Text outside the markers is never touched; a document with broken
 * markers is left as it is.
 */
@Command(name = "update-guide", mixinStandardHelpOptions = true,
        description = "Regenerate the managed regions of the guidance document")
@Component
public class UpdateGuideCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", description = "Project directory", defaultValue = ".")
    private Path dir;

    @Option(names = "--dry-run", description = "Report what would change without writing")
    private boolean dryRun;

    private final PackRegistry packRegistry;
    private final ConstraintValidator constraintValidator;
    private final BlueprintSerializer serializer;
    private final GuidanceDocument guidanceDocument;
    private final KeystoneProperties properties;

    public UpdateGuideCommand(PackRegistry packRegistry,
                              ConstraintValidator constraintValidator,
                              BlueprintSerializer serializer,
                              GuidanceDocument guidanceDocument,
                              KeystoneProperties properties) {
        this.packRegistry = packRegistry;
        this.constraintValidator = constraintValidator;
        this.serializer = serializer;
        this.guidanceDocument = guidanceDocument;
        this.properties = properties;
    }

    @Override
    public Integer call() throws IOException {
        ConsoleOutput.printBanner();

        Path blueprintFile = dir.resolve(properties.getBlueprintFile());
        if (!Files.exists(blueprintFile)) {
            ConsoleOutput.error("No blueprint at " + blueprintFile + "; run 'keystone new' first");
            return ExitCodes.FAILURE;
        }
        Blueprint blueprint = serializer.read(blueprintFile);

        ValidationResult result = constraintValidator.validate(blueprint);
        if (!result.isOk()) {
            ConsoleOutput.violations(result.violations());
            return ExitCodes.VIOLATIONS;
        }

        TemplatePack pack = packRegistry.getPack(blueprint.meta().packId());
        MdcContext.setProject(pack.id(), blueprint.project().name());
        try {
            if (!pack.version().equals(blueprint.meta().packVersion())) {
                ConsoleOutput.warn("Blueprint was generated with " + pack.id() + "@" + blueprint.meta().packVersion()
                        + ", regenerating with " + pack.version());
            }

            Path guideFile = dir.resolve(properties.getGuideFile());
            boolean guideExists = Files.exists(guideFile);
            String existing = guideExists ? Files.readString(guideFile, StandardCharsets.UTF_8) : "";
            MergeResult merge = guideExists ? guidanceDocument.update(existing, blueprint, pack) : null;
            String text = merge != null ? merge.text() : guidanceDocument.create(blueprint, pack);

            if (text.equals(existing)) {
                ConsoleOutput.info(guideFile + " is up to date");
                return ExitCodes.OK;
            }
            if (merge != null) {
                ConsoleOutput.regions("replaced", merge.replaced());
                ConsoleOutput.regions("appended", merge.appended());
                ConsoleOutput.regions("kept", merge.preserved());
            }
            if (dryRun) {
                ConsoleOutput.info("Dry run: " + guideFile + " would be " + (merge != null ? "updated" : "created"));
                return ExitCodes.OK;
            }

            Files.writeString(guideFile, text, StandardCharsets.UTF_8);
            ConsoleOutput.fileChange(merge != null ? "updated" : "created", guideFile.toString());
            return ExitCodes.OK;
        } finally {
            MdcContext.clear();
        }
    }
}
