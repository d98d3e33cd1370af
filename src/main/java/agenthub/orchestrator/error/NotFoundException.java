package agenthub.orchestrator.error;

/**
 * Unknown task or dead letter id.
 */
public class NotFoundException extends OrchestratorException {

    private final String resource;
    private final String id;

    public NotFoundException(String resource, String id) {
        super(resource + " not found: " + id);
        this.resource = resource;
        this.id = id;
    }

    public String resource() {
        return resource;
    }

    public String id() {
        return id;
    }

    @Override
    public String code() {
        return "NOT_FOUND";
    }
}
