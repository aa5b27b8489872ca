package com.flowpulse.test.domain;

import com.flowpulse.domain.state.model.entity.StateTransitionEntity;
import com.flowpulse.domain.state.model.valobj.WorkflowAggregate;
import com.flowpulse.domain.state.service.WorkflowAggregateDomainService;
import com.flowpulse.types.enums.TransitionTypeEnum;
import com.flowpulse.types.enums.WorkflowStateEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class WorkflowAggregateDomainServiceTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2026, 10, 1, 12, 0, 0);

    private final WorkflowAggregateDomainService service = new WorkflowAggregateDomainService();

    @Test
    public void shouldAggregateExecutionsFromTransitionLog() {
        List<StateTransitionEntity> transitions = new ArrayList<>();
        transitions.add(transition(1L, WorkflowStateEnum.IDLE, WorkflowStateEnum.RUNNING, T0, 0L));
        transitions.add(transition(2L, WorkflowStateEnum.RUNNING, WorkflowStateEnum.COMPLETED, T0.plusSeconds(4), 4000L));
        transitions.add(transition(3L, WorkflowStateEnum.COMPLETED, WorkflowStateEnum.RUNNING, T0.plusSeconds(10), 6000L));
        transitions.add(transition(4L, WorkflowStateEnum.RUNNING, WorkflowStateEnum.FAILED, T0.plusSeconds(12), 2000L));
        Collections.shuffle(transitions);

        WorkflowAggregate aggregate = service.aggregate("wf-1", transitions);

        Assertions.assertEquals(4L, aggregate.getTotalTransitions());
        Assertions.assertEquals(2L, aggregate.getStateCounts().get("running"));
        Assertions.assertEquals(2L, aggregate.getTotalExecutions());
        Assertions.assertEquals(1L, aggregate.getSuccessfulExecutions());
        Assertions.assertEquals(1L, aggregate.getFailedExecutions());
        Assertions.assertEquals(50.0D, aggregate.getSuccessRate());
        Assertions.assertEquals(3000.0D, aggregate.getAverageDuration());
        Assertions.assertEquals(6000L, aggregate.getTimeInStateMs().get("running"));
        Assertions.assertEquals(T0.plusSeconds(12), aggregate.getLastTransitionAt());
    }

    @Test
    public void shouldReturnEmptyAggregateWithoutTransitions() {
        WorkflowAggregate aggregate = service.aggregate("wf-1", Collections.emptyList());

        Assertions.assertEquals("wf-1", aggregate.getWorkflowId());
        Assertions.assertEquals(0L, aggregate.getTotalExecutions());
        Assertions.assertEquals(0D, aggregate.getSuccessRate());
        Assertions.assertNull(aggregate.getAverageDuration());
    }

    private StateTransitionEntity transition(Long id, WorkflowStateEnum from, WorkflowStateEnum to,
                                             LocalDateTime timestamp, Long durationInPrevious) {
        StateTransitionEntity transition = new StateTransitionEntity();
        transition.setId(id);
        transition.setWorkflowId("wf-1");
        transition.setFromState(from);
        transition.setToState(to);
        transition.setTransitionType(TransitionTypeEnum.START);
        transition.setTimestamp(timestamp);
        transition.setDurationInPreviousState(durationInPrevious);
        return transition;
    }
}
