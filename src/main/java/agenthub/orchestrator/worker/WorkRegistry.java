package agenthub.orchestrator.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Work functions by agent type.
 */
public class WorkRegistry {

    private static final Logger log = LoggerFactory.getLogger(WorkRegistry.class);

    private final Map<String, WorkFunction> functions = new ConcurrentHashMap<>();

    /**
     * Registry with the built-in {@code echo} function.
     */
    public static WorkRegistry withDefaults() {
        return new WorkRegistry().register(EchoWorkFunction.AGENT_TYPE, new EchoWorkFunction());
    }

    public WorkRegistry register(String agentType, WorkFunction function) {
        if (agentType == null || agentType.isBlank()) {
            throw new IllegalArgumentException("agentType is required");
        }
        if (function == null) {
            throw new IllegalArgumentException("function is required");
        }
        WorkFunction previous = functions.put(agentType, function);
        if (previous != null) {
            log.info("Replaced work function for agent type '{}'", agentType);
        } else {
            log.debug("Registered work function for agent type '{}'", agentType);
        }
        return this;
    }

    public Optional<WorkFunction> find(String agentType) {
        return agentType == null ? Optional.empty() : Optional.ofNullable(functions.get(agentType));
    }

    public boolean contains(String agentType) {
        return agentType != null && functions.containsKey(agentType);
    }

    public Set<String> agentTypes() {
        return new TreeSet<>(functions.keySet());
    }
}
