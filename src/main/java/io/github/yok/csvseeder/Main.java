package io.github.yok.csvseeder;

import io.github.yok.csvseeder.config.ConnectionConfig;
import io.github.yok.csvseeder.config.DbUnitConfigProperties;
import io.github.yok.csvseeder.config.PathsConfig;
import io.github.yok.csvseeder.config.SeedProperties;
import io.github.yok.csvseeder.core.RunResult;
import io.github.yok.csvseeder.core.SeedExecutor;
import io.github.yok.csvseeder.util.ErrorHandler;
import io.github.yok.csvseeder.util.Slf4jSeedReporter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Provides the application entry point.
 *
 * <p>
 * Parses the command-line option {@code --seed}/{@code -s} and runs the selected seeds through
 * {@link SeedExecutor}.
 * </p>
 *
 * <p>
 * Argument specification:
 * </p>
 * <ul>
 * <li>{@code --seed [id1,id2,…]} or {@code -s [id1,id2,…]} selects the seeds to run by id. If
 * omitted, every seed in {@code application.yml} runs.</li>
 * </ul>
 *
 * <p>
 * A seed that is rejected (bad configuration, missing file or table) is reported and the
 * remaining seeds still run. A seed that is aborted by a write or read failure is handed to
 * {@link ErrorHandler} and the process ends with a non-zero status after all seeds have run.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see PathsConfig
 * @see ConnectionConfig
 * @see DbUnitConfigProperties
 * @see SeedProperties
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({PathsConfig.class, ConnectionConfig.class,
        DbUnitConfigProperties.class, SeedProperties.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    // Process exit status when a seed is aborted or a fatal error occurs
    static final int EXIT_FAILURE = 1;

    private final PathsConfig pathsConfig;
    private final ConnectionConfig connectionConfig;
    private final DbUnitConfigProperties dbUnitConfigProperties;
    private final SeedProperties seedProperties;

    private int exitCode;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        ConfigurableApplicationContext context = app.run(args);
        if (context != null) {
            System.exit(SpringApplication.exit(context));
        }
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        // Parse CLI arguments
        List<String> seedIds = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--seed":
                case "-s":
                    if (i + 1 < args.length) {
                        seedIds = Arrays.stream(args[++i].split(",")).map(String::trim)
                                .filter(s -> !s.isEmpty()).collect(Collectors.toList());
                    }
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }

        if (seedProperties.getSeeds() == null || seedProperties.getSeeds().isEmpty()) {
            exitCode = EXIT_FAILURE;
            ErrorHandler.errorAndExit("No seeds are configured under seeder.seeds.");
            return;
        }
        log.info("Target seeds: {}", seedIds.isEmpty() ? "(all)" : seedIds);

        // Execute
        List<RunResult> results;
        try {
            results = new SeedExecutor(connectionConfig, pathsConfig, dbUnitConfigProperties,
                    seedProperties, new Slf4jSeedReporter()).execute(seedIds);
        } catch (Exception e) {
            log.error("Fatal error occurred: {}", e.getMessage(), e);
            exitCode = EXIT_FAILURE;
            ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
            return;
        }

        if (results.isEmpty()) {
            log.warn("No seed matched {}", seedIds);
        }
        for (RunResult result : results) {
            if (result.getStatus() == RunResult.Status.ABORTED) {
                exitCode = EXIT_FAILURE;
                ErrorHandler.errorAndExit(result.getMessage(), result.getFailure());
                return;
            }
        }
        log.info("Seeding completed.");
    }

    /**
     * Returns the process exit status: {@code 0}, or {@link #EXIT_FAILURE} after an aborted seed
     * or a fatal error.
     *
     * @return exit status
     */
    @Override
    public int getExitCode() {
        return exitCode;
    }
}
