package io.clustermanager.configuration;

import io.clustermanager.config.ClusterManagerConfig;
import io.clustermanager.exceptions.ConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static io.clustermanager.config.Constants.ANSIBLE_PLAYBOOK_COMMAND;

/**
 * Configuration engine that runs Ansible playbooks against a generated inventory.
 */
@Slf4j
public class AnsibleConfigurationEngine implements ConfigurationEngine {

    /**
     * Starts the playbook process. Replaced in tests.
     */
    @FunctionalInterface
    public interface ProcessLauncher {
        Process start(List<String> command) throws IOException;
    }

    private final String playbookLocation;
    private final String configurePlaybook;
    private final String cleanupPlaybook;
    private final String user;
    private final String privateKeyFile;
    private final String defaultExtraVars;
    private final ProcessLauncher launcher;

    public AnsibleConfigurationEngine(ClusterManagerConfig config) {
        this(config, command -> new ProcessBuilder(command).redirectErrorStream(true).start());
    }

    public AnsibleConfigurationEngine(ClusterManagerConfig config, ProcessLauncher launcher) {
        this.playbookLocation = config.getAnsiblePlaybookLocation();
        this.configurePlaybook = config.getAnsibleConfigurePlaybook();
        this.cleanupPlaybook = config.getAnsibleCleanupPlaybook();
        this.user = config.getAnsibleUser();
        this.privateKeyFile = config.getAnsiblePrivateKeyFile();
        this.defaultExtraVars = config.getAnsibleExtraVars();
        this.launcher = launcher;
    }

    @Override
    public ConfigurationRun configure(List<? extends HostConfiguration> hosts, String extraVars) {
        return runPlaybook(configurePlaybook, hosts, extraVars);
    }

    @Override
    public ConfigurationRun cleanup(List<? extends HostConfiguration> hosts, String extraVars) {
        return runPlaybook(cleanupPlaybook, hosts, extraVars);
    }

    private ConfigurationRun runPlaybook(String playbook, List<? extends HostConfiguration> hosts, String extraVars) {
        Path inventoryFile;
        try {
            inventoryFile = Files.createTempFile("ansible-inventory-", ".ini");
            Files.writeString(inventoryFile, AnsibleInventory.render(hosts), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to write inventory for playbook {}: {}", playbook, e.getMessage());
            return failedRun(new ConfigurationException("failed to write ansible inventory: " + e.getMessage(), e));
        }

        List<String> command = buildCommand(playbook, inventoryFile, extraVars);
        log.info("Running playbook {} on {} host(s)", playbook, hosts.size());
        log.debug("Playbook command: {}", String.join(" ", command));

        Process process;
        try {
            process = launcher.start(command);
        } catch (IOException e) {
            log.error("Failed to start playbook {}: {}", playbook, e.getMessage());
            deleteQuietly(inventoryFile);
            return failedRun(new ConfigurationException("failed to start " + ANSIBLE_PLAYBOOK_COMMAND + ": " + e.getMessage(), e));
        }

        CompletableFuture<Void> result = process.onExit().thenAccept(p -> {
            deleteQuietly(inventoryFile);
            int exitCode = p.exitValue();
            if (exitCode != 0) {
                log.warn("Playbook {} exited with code {}", playbook, exitCode);
                throw new CompletionException(new ConfigurationException(
                    String.format("playbook %s exited with code %d", playbook, exitCode)));
            }
            log.info("Playbook {} finished successfully", playbook);
        });

        Runnable cancel = () -> {
            log.info("Stopping playbook {} (pid {})", playbook, process.pid());
            process.descendants().forEach(ProcessHandle::destroy);
            process.destroy();
        };

        return new ConfigurationRun(process.getInputStream(), cancel, result);
    }

    List<String> buildCommand(String playbook, Path inventoryFile, String extraVars) {
        List<String> command = new ArrayList<>();
        command.add(ANSIBLE_PLAYBOOK_COMMAND);
        command.add("-i");
        command.add(inventoryFile.toString());
        command.add("--user");
        command.add(user);
        command.add("--private-key");
        command.add(privateKeyFile);
        command.add("--extra-vars");
        command.add(extraVars == null || extraVars.isBlank() ? defaultExtraVars : extraVars);
        command.add(Paths.get(playbookLocation, playbook).toString());
        return command;
    }

    private static ConfigurationRun failedRun(ConfigurationException error) {
        return new ConfigurationRun(new ByteArrayInputStream(new byte[0]), () -> { }, CompletableFuture.failedFuture(error));
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete inventory file {}: {}", file, e.getMessage());
        }
    }
}
