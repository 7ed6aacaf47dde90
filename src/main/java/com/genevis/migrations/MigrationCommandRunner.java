package com.genevis.migrations;

import com.genevis.migrations.enrichment.EnrichmentMigrationResult;
import com.genevis.migrations.enrichment.EnrichmentMigrationService;
import com.genevis.migrations.enrichment.EnrichmentOptions;
import com.genevis.migrations.rnaseq.RnaSeqConstants;
import com.genevis.migrations.rnaseq.RnaSeqMigrationResult;
import com.genevis.migrations.rnaseq.RnaSeqMigrationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the single migration command named on the command line and records the process exit code.
 */
@Component
public class MigrationCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(MigrationCommandRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    static final String COMMAND_ENRICHMENT = "enrichment";
    static final String COMMAND_RNA_SEQ = "rna-seq";

    private static final String OPTION_DRY_RUN = "dry-run";
    private static final String OPTION_VERBOSE = "verbose";
    private static final String OPTION_CLEAR = "clear";
    private static final String OPTION_ALL = "all";
    private static final String SHORT_VERBOSE = "-v";
    private static final String APPLICATION_LOGGER = "com.genevis.migrations";

    private final EnrichmentMigrationService enrichmentMigrationService;
    private final RnaSeqMigrationService rnaSeqMigrationService;
    private final LoggingSystem loggingSystem;

    private int exitCode = EXIT_OK;

    public MigrationCommandRunner(EnrichmentMigrationService enrichmentMigrationService,
                                  RnaSeqMigrationService rnaSeqMigrationService,
                                  LoggingSystem loggingSystem) {
        this.enrichmentMigrationService = enrichmentMigrationService;
        this.rnaSeqMigrationService = rnaSeqMigrationService;
        this.loggingSystem = loggingSystem;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs().stream()
                .filter(arg -> !SHORT_VERBOSE.equals(arg))
                .toList();
        if (args.containsOption(OPTION_VERBOSE) || args.getNonOptionArgs().contains(SHORT_VERBOSE)) {
            loggingSystem.setLogLevel(APPLICATION_LOGGER, LogLevel.DEBUG);
        }

        if (positional.isEmpty()) {
            exitCode = usage("No command given");
            return;
        }

        String command = positional.get(0);
        AtomicBoolean completed = new AtomicBoolean(false);
        Thread interruptHook = new Thread(() -> {
            if (!completed.get()) {
                log.warn("Migration interrupted by user");
            }
        }, "migration-interrupt");
        Runtime.getRuntime().addShutdownHook(interruptHook);
        try {
            exitCode = switch (command) {
                case COMMAND_ENRICHMENT -> positional.size() == 1
                        ? runEnrichment(args)
                        : usage("Unexpected arguments: " + positional.subList(1, positional.size()));
                case COMMAND_RNA_SEQ -> positional.size() <= 2
                        ? runRnaSeq(args, positional.size() == 2 ? positional.get(1) : null)
                        : usage("Unexpected arguments: " + positional.subList(2, positional.size()));
                default -> usage("Unknown command: " + command);
            };
        } catch (RuntimeException ex) {
            log.error("Migration failed: {}", ex.getMessage(), ex);
            exitCode = EXIT_FAILURE;
        } finally {
            completed.set(true);
            try {
                Runtime.getRuntime().removeShutdownHook(interruptHook);
            } catch (IllegalStateException ex) {
                log.debug("Shutdown already in progress; interrupt hook left registered");
            }
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private int runEnrichment(ApplicationArguments args) {
        EnrichmentOptions options = new EnrichmentOptions(
                args.containsOption(OPTION_DRY_RUN),
                args.containsOption(OPTION_CLEAR)
        );
        EnrichmentMigrationResult result = enrichmentMigrationService.migrate(options);
        return result.producedOutput() ? EXIT_OK : EXIT_FAILURE;
    }

    private int runRnaSeq(ApplicationArguments args, String comparison) {
        boolean dryRun = args.containsOption(OPTION_DRY_RUN);
        if (args.containsOption(OPTION_ALL)) {
            if (comparison != null) {
                return usage("A comparison name cannot be combined with --" + OPTION_ALL);
            }
            List<RnaSeqMigrationResult> results = rnaSeqMigrationService.migrateAll(dryRun);
            return results.stream().anyMatch(RnaSeqMigrationResult::success) ? EXIT_OK : EXIT_FAILURE;
        }

        if (comparison == null) {
            List<String> available = rnaSeqMigrationService.listAvailableComparisons();
            if (available.isEmpty()) {
                log.error(RnaSeqConstants.MSG_NO_COMPARISONS.formatted(rnaSeqMigrationService.sourceDir().toAbsolutePath()));
                return EXIT_FAILURE;
            }
            log.info("Available comparisons:");
            available.forEach(name -> log.info("   {}", name));
            comparison = available.get(0);
            log.info("No comparison given; migrating the first one: {}", comparison);
        }

        RnaSeqMigrationResult result = rnaSeqMigrationService.migrateComparison(comparison, dryRun);
        return result.success() ? EXIT_OK : EXIT_FAILURE;
    }

    private int usage(String problem) {
        log.error(problem);
        log.info("Usage: <command> [options]");
        log.info("  {} [--dry-run] [--verbose|-v] [--clear]", COMMAND_ENRICHMENT);
        log.info("  {} [comparison] [--all] [--dry-run] [--verbose|-v]", COMMAND_RNA_SEQ);
        log.info("Connection: --db.host --db.port --db.name --db.username --db.password --db.sslmode"
                + " (or DB_HOST, DB_PORT, DB_NAME, DB_USERNAME, DB_PASSWORD, DB_SSLMODE)");
        return EXIT_USAGE;
    }
}
