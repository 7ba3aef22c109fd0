package agentpool.dispatcher.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Answer to a selection request. Running out of capacity is a normal
 * outcome, not an exception.
 */
public record SelectionResult(SelectionOutcome outcome, String agentType, AgentInstance selected) {

    public SelectionResult {
        Objects.requireNonNull(outcome, "outcome is required");
        if (outcome == SelectionOutcome.SELECTED && selected == null) {
            throw new IllegalArgumentException("selected instance is required");
        }
    }

    public static SelectionResult selected(String agentType, AgentInstance instance) {
        return new SelectionResult(SelectionOutcome.SELECTED, agentType, instance);
    }

    public static SelectionResult noneRegistered(String agentType) {
        return new SelectionResult(SelectionOutcome.NO_INSTANCES_REGISTERED, agentType, null);
    }

    public static SelectionResult noneAvailable(String agentType) {
        return new SelectionResult(SelectionOutcome.NONE_AVAILABLE, agentType, null);
    }

    public boolean isSelected() {
        return outcome == SelectionOutcome.SELECTED;
    }

    public Optional<AgentInstance> instance() {
        return Optional.ofNullable(selected);
    }
}
