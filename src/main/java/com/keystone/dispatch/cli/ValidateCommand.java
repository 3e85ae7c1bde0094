package com.keystone.dispatch.cli;

import com.keystone.core.blueprint.BlueprintSerializer;
import com.keystone.core.blueprint.ConstraintValidator;
import com.keystone.core.blueprint.ValidationResult;
import com.keystone.core.config.KeystoneProperties;
import com.keystone.core.model.Blueprint;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: keystone validate [dir|file]
 * <p>
 * Re-checks a persisted blueprint against every constraint rule, typically after it was
 * edited by hand.
 */
@Command(name = "validate", mixinStandardHelpOptions = true, description = "Check a blueprint file against all constraint rules")
@Component
public class ValidateCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", defaultValue = ".",
            description = "Blueprint file, or a project directory containing one")
    private Path target;

    private final ConstraintValidator constraintValidator;
    private final BlueprintSerializer serializer;
    private final KeystoneProperties properties;

    public ValidateCommand(ConstraintValidator constraintValidator,
                           BlueprintSerializer serializer,
                           KeystoneProperties properties) {
        this.constraintValidator = constraintValidator;
        this.serializer = serializer;
        this.properties = properties;
    }

    @Override
    public Integer call() throws IOException {
        Path blueprintFile = Files.isDirectory(target) ? target.resolve(properties.getBlueprintFile()) : target;
        if (!Files.exists(blueprintFile)) {
            ConsoleOutput.error("No blueprint at " + blueprintFile);
            return ExitCodes.FAILURE;
        }

        Blueprint blueprint = serializer.read(blueprintFile);
        ValidationResult result = constraintValidator.validate(blueprint);
        if (!result.isOk()) {
            ConsoleOutput.violations(result.violations());
            return ExitCodes.VIOLATIONS;
        }
        ConsoleOutput.success(blueprintFile + " satisfies all " + constraintValidator.ruleNames().size() + " rules");
        return ExitCodes.OK;
    }
}
