package quest.gekko.churnguard.exception;

public class PipelineBusyException extends RuntimeException {
    public PipelineBusyException(String operation) {
        super("Another pipeline operation is running; rejected " + operation);
    }
}
