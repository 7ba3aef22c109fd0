package agentpool.dispatcher.model;

/**
 * What the caller knows about the task it wants to dispatch.
 */
public record RequestHints(String taskType, Priority priority, Complexity complexity) {

    public RequestHints {
        priority = priority == null ? Priority.NORMAL : priority;
        complexity = complexity == null ? Complexity.MODERATE : complexity;
    }

    public static RequestHints defaults() {
        return new RequestHints(null, Priority.NORMAL, Complexity.MODERATE);
    }

    public static RequestHints of(Priority priority, Complexity complexity) {
        return new RequestHints(null, priority, complexity);
    }
}
