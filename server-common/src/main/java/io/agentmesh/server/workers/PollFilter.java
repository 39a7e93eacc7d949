package io.agentmesh.server.workers;

import io.agentmesh.spec.Task;
import org.jspecify.annotations.Nullable;

/**
 * Restricts which pending tasks a poll may receive.
 *
 * @param codebaseId only tasks of this codebase; {@code null} accepts any task
 */
public record PollFilter(@Nullable String codebaseId) {

    public static final PollFilter ANY = new PollFilter(null);

    public boolean accepts(@Nullable String taskCodebaseId) {
        return codebaseId == null || codebaseId.equals(taskCodebaseId);
    }

    public boolean accepts(Task task) {
        return accepts(task.codebaseId());
    }
}
