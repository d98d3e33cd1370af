package agenthub.orchestrator.events;

/**
 * Receiver of stream messages, usually an HTTP connection.
 */
public interface StreamSink {

    /**
     * Deliver one message.
     *
     * @return false if the receiver is gone and the stream should stop
     */
    boolean send(StreamMessage message);

    /** Called once, after the last message */
    void close();
}
