package com.cbd.cli;

import com.cbd.config.SystemConfigJson;
import com.cbd.manifest.load.LoadedManifest;
import com.cbd.manifest.load.ManifestException;
import com.cbd.manifest.load.ManifestLoader;
import com.cbd.manifest.load.ManifestValidationException;
import com.cbd.manifest.schema.FieldError;
import com.cbd.resolver.BaseConfigLoader;
import com.cbd.resolver.ConfigurationResolver;
import com.cbd.resolver.Resolution;
import com.cbd.resolver.ResolverSettings;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Deployment configuration CLI.
 *
 * <pre>
 * cbd resolve [--dir D] [--base F] [--manifest M] [--output O]
 * cbd validate [--dir D] [--manifest M]
 * </pre>
 *
 * Exit codes: 0 success, 1 validation failure (or, for {@code validate}, no manifest found),
 * 2 unreadable or malformed input.
 */
@Command(name = "cbd",
         mixinStandardHelpOptions = true,
         version = "cbd 1.0.0",
         description = "Resolves the deployment configuration from the base document and the deployment manifest",
         subcommands = {
                 CbdCli.ResolveCommand.class,
                 CbdCli.ValidateCommand.class
         })
public class CbdCli implements Runnable {

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID = 1;
    static final int EXIT_UNREADABLE = 2;

    private final Map<String, String> environment;

    @Spec
    private CommandSpec spec;

    public CbdCli(Map<String, String> environment) {
        this.environment = environment;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CbdCli(System.getenv())).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    /** Environment settings with command-line options applied on top. */
    ResolverSettings settings(Path dir, String base, String manifest) {
        ResolverSettings.Builder builder = ResolverSettings.fromEnvironment(environment).toBuilder();
        if (dir != null) builder.workingDir(dir);
        if (base != null) builder.baseConfig(base);
        if (manifest != null) builder.manifest(manifest);
        return builder.build();
    }

    static void reportValidationFailure(PrintWriter err, ManifestValidationException e) {
        err.println("Deployment manifest validation failed: " + e.getPath());
        for (FieldError error : e.getValidationResult().getErrors()) {
            err.println(error.format());
        }
    }

    // ===== Subcommands =====

    @Command(name = "resolve", description = "Print the resolved configuration and the overrides applied")
    static class ResolveCommand implements Callable<Integer> {
        @ParentCommand
        private CbdCli parent;

        @Spec
        private CommandSpec spec;

        @Option(names = {"-d", "--dir"}, description = "Working directory (default: CBD_WORKING_DIR or current)")
        private Path dir;

        @Option(names = {"-b", "--base"}, description = "Base configuration document (default: CBD_BASE_CONFIG or bin/config.json)")
        private String base;

        @Option(names = {"-m", "--manifest"}, description = "Deployment manifest (default: DEPLOYMENT_MANIFEST or deployment-manifest.yaml/.yml)")
        private String manifest;

        @Option(names = {"-o", "--output"}, description = "Write the resolved configuration here instead of standard output")
        private Path output;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            PrintWriter err = spec.commandLine().getErr();
            ResolverSettings settings = parent.settings(dir, base, manifest);
            Resolution resolution;
            try {
                resolution = ConfigurationResolver.fromSettings(settings)
                        .resolve(new BaseConfigLoader(settings.getBaseConfigFile())::load);
            } catch (ManifestValidationException e) {
                reportValidationFailure(err, e);
                return EXIT_INVALID;
            } catch (ManifestException | UncheckedIOException e) {
                err.println(e.getMessage());
                return EXIT_UNREADABLE;
            }

            String json = SystemConfigJson.toJsonPretty(resolution.config());
            PrintWriter report = output != null ? out : err;
            if (output != null) {
                try {
                    Files.writeString(output, json + System.lineSeparator(), StandardCharsets.UTF_8);
                } catch (IOException e) {
                    err.println("Failed to write " + output + ": " + e.getMessage());
                    return EXIT_UNREADABLE;
                }
                out.println("Resolved configuration written to " + output);
            } else {
                out.println(json);
            }
            if (resolution.manifest().isPresent()) {
                report.println("Overrides from " + resolution.manifest().get() + " (" + resolution.changes().size() + "):");
                if (!resolution.changes().isEmpty()) {
                    report.println(resolution.formatChanges());
                }
            }
            return EXIT_OK;
        }
    }

    @Command(name = "validate", description = "Validate the deployment manifest and print it with defaults applied")
    static class ValidateCommand implements Callable<Integer> {
        @ParentCommand
        private CbdCli parent;

        @Spec
        private CommandSpec spec;

        @Option(names = {"-d", "--dir"}, description = "Working directory (default: CBD_WORKING_DIR or current)")
        private Path dir;

        @Option(names = {"-m", "--manifest"}, description = "Deployment manifest (default: DEPLOYMENT_MANIFEST or deployment-manifest.yaml/.yml)")
        private String manifest;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            PrintWriter err = spec.commandLine().getErr();
            ManifestLoader loader = new ManifestLoader(parent.settings(dir, null, manifest).manifestLocator());
            LoadedManifest loaded;
            try {
                Optional<LoadedManifest> found = loader.load();
                if (found.isEmpty()) {
                    err.println("No deployment manifest found");
                    return EXIT_INVALID;
                }
                loaded = found.get();
            } catch (ManifestValidationException e) {
                reportValidationFailure(err, e);
                return EXIT_INVALID;
            } catch (ManifestException e) {
                err.println(e.getMessage());
                return EXIT_UNREADABLE;
            }
            out.println("Deployment manifest is valid: " + loaded.path());
            out.println(SystemConfigJson.prettyPrint(loaded.manifest().getDocument()));
            return EXIT_OK;
        }
    }
}
