package com.flowpulse.test.domain;

import com.flowpulse.domain.state.model.entity.WorkflowStateEntity;
import com.flowpulse.domain.state.model.valobj.TransitionCommand;
import com.flowpulse.domain.state.model.valobj.TransitionResult;
import com.flowpulse.domain.state.service.StateTransitionDomainService;
import com.flowpulse.domain.state.service.StateTransitionPolicy;
import com.flowpulse.types.enums.ResponseCode;
import com.flowpulse.types.enums.TransitionTypeEnum;
import com.flowpulse.types.enums.WorkflowStateEnum;
import com.flowpulse.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Map;
import java.util.stream.Stream;

public class StateTransitionDomainServiceTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2026, 10, 1, 12, 0, 0);

    private final StateTransitionDomainService service = new StateTransitionDomainService();

    @Test
    public void shouldCreateStateFromIdleOnFirstTransition() {
        TransitionResult result = service.apply(null, command("wf-1", "running", "start"), T0, false);

        Assertions.assertTrue(result.created());
        Assertions.assertEquals("created", result.operation());
        WorkflowStateEntity state = result.state();
        Assertions.assertEquals("wf-1", state.getWorkflowId());
        Assertions.assertEquals(WorkflowStateEnum.RUNNING, state.getCurrentState());
        Assertions.assertEquals(WorkflowStateEnum.IDLE, state.getPreviousState());
        Assertions.assertEquals(T0, state.getStartedAt());
        Assertions.assertEquals(0, state.getProgressPercentage());
        Assertions.assertEquals(0, state.getVersion());
        Assertions.assertEquals(WorkflowStateEnum.IDLE, result.transition().getFromState());
        Assertions.assertEquals(WorkflowStateEnum.RUNNING, result.transition().getToState());
        Assertions.assertEquals(TransitionTypeEnum.START, result.transition().getTransitionType());
        Assertions.assertEquals(0L, result.transition().getDurationInPreviousState());
    }

    @ParameterizedTest(name = "{0} via {1}")
    @MethodSource("allStateAndTransitionPairs")
    public void shouldStartEveryNewWorkflowFromIdle(WorkflowStateEnum target, TransitionTypeEnum type) {
        TransitionResult result = service.apply(null, command("wf-new", target.getCode(), type.getCode()), T0, false);

        Assertions.assertTrue(result.created());
        Assertions.assertEquals(target, result.state().getCurrentState());
        Assertions.assertEquals(WorkflowStateEnum.IDLE, result.state().getPreviousState());
        Assertions.assertEquals(WorkflowStateEnum.IDLE, result.transition().getFromState());
        Assertions.assertEquals(type, result.transition().getTransitionType());
    }

    static Stream<Arguments> allStateAndTransitionPairs() {
        return Arrays.stream(WorkflowStateEnum.values())
                .flatMap(state -> Arrays.stream(TransitionTypeEnum.values())
                        .map(type -> Arguments.of(state, type)));
    }

    @Test
    public void shouldComputeDurationsWhenCompleting() {
        WorkflowStateEntity state = service.apply(null, command("wf-1", "running", "start"), T0, false).state();

        TransitionCommand complete = command("wf-1", "completed", "complete");
        complete.setProgress(100);
        TransitionResult result = service.apply(state, complete, T0.plusSeconds(5), false);

        Assertions.assertFalse(result.created());
        Assertions.assertEquals(WorkflowStateEnum.COMPLETED, result.state().getCurrentState());
        Assertions.assertEquals(WorkflowStateEnum.RUNNING, result.state().getPreviousState());
        Assertions.assertEquals(T0.plusSeconds(5), result.state().getCompletedAt());
        Assertions.assertEquals(5000L, result.state().getDuration());
        Assertions.assertEquals(100, result.state().getProgressPercentage());
        Assertions.assertEquals(5000L, result.transition().getDurationInPreviousState());
    }

    @Test
    public void shouldKeepFirstStartedAtAcrossPauseAndResume() {
        WorkflowStateEntity state = service.apply(null, command("wf-1", "running", "start"), T0, false).state();
        state = service.apply(state, command("wf-1", "paused", "pause"), T0.plusSeconds(1), false).state();
        state = service.apply(state, command("wf-1", "running", "resume"), T0.plusSeconds(3), false).state();

        Assertions.assertEquals(T0, state.getStartedAt());
    }

    @Test
    public void shouldRecordZeroDurationWhenTerminalWithoutStart() {
        WorkflowStateEntity state = service.apply(null, command("wf-1", "pending", "schedule"), T0, false).state();

        TransitionResult result = service.apply(state, command("wf-1", "cancelled", "cancel"), T0.plusSeconds(2), false);

        Assertions.assertNull(result.state().getStartedAt());
        Assertions.assertEquals(0L, result.state().getDuration());
        Assertions.assertNotNull(result.state().getCompletedAt());
    }

    @Test
    public void shouldMergeMetadataShallowly() {
        TransitionCommand first = command("wf-1", "running", "start");
        first.setMetadata(Map.of("a", 1, "b", 2));
        WorkflowStateEntity state = service.apply(null, first, T0, false).state();

        TransitionCommand second = command("wf-1", "paused", "pause");
        second.setMetadata(Map.of("b", 3, "c", 4));
        state = service.apply(state, second, T0.plusSeconds(1), false).state();

        Assertions.assertEquals(Map.of("a", 1, "b", 3, "c", 4), state.getMetadata());
    }

    @Test
    public void shouldRejectInvalidCommands() {
        assertIllegal(command(" ", "running", "start"));
        assertIllegal(command("wf-1", "bogus", "start"));
        assertIllegal(command("wf-1", "running", "teleport"));
        TransitionCommand progress = command("wf-1", "running", "start");
        progress.setProgress(101);
        assertIllegal(progress);
    }

    @Test
    public void shouldAllowAnyTransitionWhenNotStrict() {
        WorkflowStateEntity state = service.apply(null, command("wf-1", "completed", "complete"), T0, false).state();

        TransitionResult result = service.apply(state, command("wf-1", "running", "retry"), T0.plusSeconds(1), false);

        Assertions.assertEquals(WorkflowStateEnum.RUNNING, result.state().getCurrentState());
    }

    @Test
    public void shouldRejectDisallowedTransitionWhenStrict() {
        WorkflowStateEntity state = service.apply(null, command("wf-1", "completed", "complete"), T0, false).state();

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> service.apply(state, command("wf-1", "running", "retry"), T0.plusSeconds(1), true));

        Assertions.assertEquals(ResponseCode.INVALID_TRANSITION.getCode(), ex.getCode());
    }

    @Test
    public void shouldExposeTransitionPolicyTable() {
        Assertions.assertTrue(StateTransitionPolicy.isAllowed(WorkflowStateEnum.IDLE, WorkflowStateEnum.RUNNING));
        Assertions.assertTrue(StateTransitionPolicy.isAllowed(WorkflowStateEnum.FAILED, WorkflowStateEnum.RETRYING));
        Assertions.assertFalse(StateTransitionPolicy.isAllowed(WorkflowStateEnum.COMPLETED, WorkflowStateEnum.RUNNING));
        Assertions.assertFalse(StateTransitionPolicy.isAllowed(null, WorkflowStateEnum.RUNNING));
        Assertions.assertTrue(StateTransitionPolicy.allowedTargets(WorkflowStateEnum.RUNNING).contains(WorkflowStateEnum.PAUSED));
    }

    private void assertIllegal(TransitionCommand command) {
        AppException ex = Assertions.assertThrows(AppException.class, () -> service.apply(null, command, T0, false));
        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), ex.getCode());
    }

    private TransitionCommand command(String workflowId, String newState, String transitionType) {
        return TransitionCommand.builder()
                .workflowId(workflowId)
                .newState(newState)
                .transitionType(transitionType)
                .build();
    }
}
