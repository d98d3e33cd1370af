package agenthub.orchestrator.model;

import java.util.List;

/**
 * One page of a task listing plus the total number of matches.
 */
public record TaskPage(List<Task> tasks, int total) {
}
