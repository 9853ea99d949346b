package com.cred.freestyle.deadpool.runner;

import com.cred.freestyle.deadpool.config.DeadpoolProperties;
import com.cred.freestyle.deadpool.exception.ResourceNotFoundException;
import com.cred.freestyle.deadpool.service.transition.SeasonTransitionService;
import com.cred.freestyle.deadpool.service.transition.TransitionFailure;
import com.cred.freestyle.deadpool.service.transition.TransitionReport;
import com.cred.freestyle.deadpool.service.transition.TransitionStage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for SeasonTransitionRunner exit codes.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("SeasonTransitionRunner Unit Tests")
class SeasonTransitionRunnerTest {

    @Mock
    private SeasonTransitionService transitionService;

    @Mock
    private ConfigurableApplicationContext context;

    private DeadpoolProperties properties;
    private SeasonTransitionRunner runner;

    @BeforeEach
    void setUp() {
        properties = new DeadpoolProperties();
        properties.getTransition().getRun().setEnabled(true);
        properties.getTransition().getRun().setFromYear(2024);
        runner = new SeasonTransitionRunner(transitionService, properties, context);
    }

    @Test
    @DisplayName("Clean transition exits 0; target year defaults to the next year")
    void execute_Clean() {
        when(transitionService.runTransition(2024, 2025, false, false))
                .thenReturn(TransitionReport.builder().fromYear(2024).toYear(2025).build());

        assertThat(runner.execute()).isEqualTo(SeasonTransitionRunner.EXIT_OK);
        verify(transitionService).runTransition(2024, 2025, false, false);
    }

    @Test
    @DisplayName("Per-player failures exit 1")
    void execute_WithFailures() {
        properties.getTransition().getRun().setDryRun(true);
        TransitionReport report = TransitionReport.builder().fromYear(2024).toYear(2025).dryRun(true).build();
        report.setFailures(List.of(new TransitionFailure("bob", TransitionStage.CARRY_FORWARD_PICKS, "held")));
        when(transitionService.runTransition(2024, 2025, true, false)).thenReturn(report);

        assertThat(runner.execute()).isEqualTo(SeasonTransitionRunner.EXIT_ISSUES);
    }

    @Test
    @DisplayName("A transition that cannot start exits 2")
    void execute_Error() {
        when(transitionService.runTransition(anyInt(), anyInt(), anyBoolean(), anyBoolean()))
                .thenThrow(new ResourceNotFoundException("Draft order", "2024"));

        assertThat(runner.execute()).isEqualTo(SeasonTransitionRunner.EXIT_ERROR);
    }

    @Test
    @DisplayName("Missing source year exits 2 without running")
    void execute_MissingYear() {
        properties.getTransition().getRun().setFromYear(null);

        assertThat(runner.execute()).isEqualTo(SeasonTransitionRunner.EXIT_ERROR);
        verifyNoInteractions(transitionService);
    }
}
