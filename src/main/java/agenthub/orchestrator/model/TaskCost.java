package agenthub.orchestrator.model;

/**
 * Accumulated usage cost of a task. Charges are only ever added.
 */
public record TaskCost(long tokensInput, long tokensOutput, long estimatedCostCents) {

    public static final TaskCost ZERO = new TaskCost(0, 0, 0);

    public TaskCost {
        if (tokensInput < 0 || tokensOutput < 0 || estimatedCostCents < 0) {
            throw new IllegalArgumentException("cost components must not be negative");
        }
    }

    public TaskCost plus(TaskCost other) {
        if (other == null) {
            return this;
        }
        return new TaskCost(
                tokensInput + other.tokensInput,
                tokensOutput + other.tokensOutput,
                estimatedCostCents + other.estimatedCostCents);
    }

    public boolean isZero() {
        return tokensInput == 0 && tokensOutput == 0 && estimatedCostCents == 0;
    }
}
