package com.flowpulse.trigger.event;

import com.flowpulse.domain.state.model.valobj.WorkflowStateChangedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;

/**
 * 工作流状态变更的进程内发布器。
 * <p>
 * 在快照与迁移记录提交后调用；单个订阅者失败不影响其它订阅者，也不回滚已提交的迁移。
 * </p>
 */
@Slf4j
@Component
public class WorkflowStateEventPublisher {

    private final ConcurrentMap<String, Consumer<WorkflowStateChangedEvent>> subscribers = new ConcurrentHashMap<>();

    public void subscribe(String subscriberId, Consumer<WorkflowStateChangedEvent> consumer) {
        if (subscriberId == null || consumer == null) {
            return;
        }
        subscribers.put(subscriberId, consumer);
    }

    public void unsubscribe(String subscriberId) {
        if (subscriberId != null) {
            subscribers.remove(subscriberId);
        }
    }

    public void publish(WorkflowStateChangedEvent event) {
        if (event == null || event.state() == null) {
            return;
        }
        for (Map.Entry<String, Consumer<WorkflowStateChangedEvent>> entry : subscribers.entrySet()) {
            try {
                entry.getValue().accept(event);
            } catch (Exception ex) {
                log.debug("Workflow state event dispatch failed. workflowId={}, subscriberId={}, error={}",
                        event.state().getWorkflowId(), entry.getKey(), ex.getMessage());
            }
        }
    }

    public int subscriberCount() {
        return subscribers.size();
    }
}
