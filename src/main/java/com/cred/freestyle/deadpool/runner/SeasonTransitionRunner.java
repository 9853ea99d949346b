package com.cred.freestyle.deadpool.runner;

import com.cred.freestyle.deadpool.config.DeadpoolProperties;
import com.cred.freestyle.deadpool.service.transition.PlayerTransitionResult;
import com.cred.freestyle.deadpool.service.transition.SeasonTransitionService;
import com.cred.freestyle.deadpool.service.transition.StageResult;
import com.cred.freestyle.deadpool.service.transition.TransitionFailure;
import com.cred.freestyle.deadpool.service.transition.TransitionReport;
import com.cred.freestyle.deadpool.service.transition.ValidationIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Runs one season transition at startup, logs a summary and exits.
 *
 * Exit codes: 0 on a clean transition, 1 when validation issues or per-player failures
 * were found, 2 when the transition could not run at all.
 *
 * @author Deadpool Team
 */
@Component
@ConditionalOnProperty(name = "deadpool.transition.run.enabled", havingValue = "true")
public class SeasonTransitionRunner implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(SeasonTransitionRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ISSUES = 1;
    static final int EXIT_ERROR = 2;

    private final SeasonTransitionService transitionService;
    private final DeadpoolProperties.Run config;
    private final ConfigurableApplicationContext context;

    public SeasonTransitionRunner(SeasonTransitionService transitionService,
                                  DeadpoolProperties properties,
                                  ConfigurableApplicationContext context) {
        this.transitionService = transitionService;
        this.config = properties.getTransition().getRun();
        this.context = context;
    }

    @Override
    public void run(ApplicationArguments args) {
        int exitCode = execute();
        System.exit(SpringApplication.exit(context, () -> exitCode));
    }

    /**
     * Run the configured transition and log its summary.
     *
     * @return process exit code
     */
    int execute() {
        if (config.getFromYear() == null) {
            logger.error("deadpool.transition.run.from-year is required");
            return EXIT_ERROR;
        }
        int fromYear = config.getFromYear();
        int toYear = config.getToYear() != null ? config.getToYear() : fromYear + 1;

        TransitionReport report;
        try {
            report = transitionService.runTransition(fromYear, toYear, config.isDryRun(), config.isVerbose());
        } catch (RuntimeException e) {
            logger.error("Season transition {} -> {} could not run: {}", fromYear, toYear, e.getMessage(), e);
            return EXIT_ERROR;
        }

        logSummary(report);
        return report.isSuccessful() ? EXIT_OK : EXIT_ISSUES;
    }

    private void logSummary(TransitionReport report) {
        logger.info("==== Season transition {} -> {}{} ====", report.getFromYear(), report.getToYear(),
                report.isDryRun() ? " (DRY RUN)" : "");
        for (StageResult stage : report.getStages()) {
            logger.info("  {} {}ms items={}{}", stage.getStage(), stage.getDurationMs(), stage.getItemsProcessed(),
                    stage.isWritesSkipped() ? " (writes skipped)" : "");
        }
        for (PlayerTransitionResult player : report.getPlayers()) {
            logger.info("  player {} carried={} removed={} active={} available={}", player.getPlayerId(),
                    player.getCarriedCandidateIds().size(), player.getRemovedCandidateIds().size(),
                    player.getActivePickCount(), player.getAvailableSlots());
        }
        for (ValidationIssue issue : report.getValidationIssues()) {
            logger.warn("  issue [{}] {}: {}", issue.getCheck(), issue.getPlayerId(), issue.getMessage());
        }
        for (TransitionFailure failure : report.getFailures()) {
            logger.warn("  failure [{}] {}: {}", failure.getStage(), failure.getPlayerId(), failure.getMessage());
        }
        logger.info("Status {}: {} picks carried, {} removed", report.getStatus(),
                report.getPicksCarried(), report.getPicksRemoved());
    }
}
