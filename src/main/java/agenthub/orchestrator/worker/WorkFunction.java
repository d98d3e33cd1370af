package agenthub.orchestrator.worker;

/**
 * The external work run for one agent type.
 * <p>
 * Implementations should poll {@link WorkContext#checkCancelled()} between steps.
 * Throw {@link agenthub.orchestrator.error.WorkExecutionException} to control
 * retryability explicitly; any other exception is classified by its message.
 */
@FunctionalInterface
public interface WorkFunction {

    WorkResult execute(WorkContext ctx) throws Exception;
}
