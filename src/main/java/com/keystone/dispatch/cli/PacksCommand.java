package com.keystone.dispatch.cli;

import com.keystone.core.pack.PackMetadata;
import com.keystone.core.pack.PackRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: keystone packs
 * <p>
 * Lists the template packs found on the classpath and in the configured packs directory.
 */
@Command(name = "packs", mixinStandardHelpOptions = true, description = "List available template packs")
@Component
public class PacksCommand implements Callable<Integer> {

    private final PackRegistry packRegistry;

    public PacksCommand(PackRegistry packRegistry) {
        this.packRegistry = packRegistry;
    }

    @Override
    public Integer call() {
        List<PackMetadata> packs = packRegistry.listPacks();
        if (packs.isEmpty()) {
            ConsoleOutput.info("No template packs found.");
            return ExitCodes.OK;
        }
        ConsoleOutput.info("Template packs (" + packs.size() + "):");
        System.out.println();
        ConsoleOutput.packTable(packs);
        return ExitCodes.OK;
    }
}
