package io.agentmesh.server.events;

import static io.agentmesh.util.Assert.checkNotNullParam;

import io.agentmesh.server.tasks.TaskUpdateListener;
import io.agentmesh.spec.Event;
import io.agentmesh.spec.Task;
import io.agentmesh.spec.TaskState;
import org.jspecify.annotations.Nullable;

/**
 * Announces task changes on the broker as {@code task.created} and {@code task.updated}, with the
 * task snapshot as payload and the owning agent (or {@code system}) as source.
 */
public class TaskLifecycleEvents implements TaskUpdateListener {

    private final MessageBroker broker;

    public TaskLifecycleEvents(MessageBroker broker) {
        this.broker = checkNotNullParam("broker", broker);
    }

    @Override
    public void onTaskUpdate(@Nullable TaskState previousStatus, Task task) {
        String source = task.agent() != null ? task.agent() : Event.SYSTEM_SOURCE;
        broker.publish(previousStatus == null ? Event.TASK_CREATED : Event.TASK_UPDATED, task, source);
    }
}
