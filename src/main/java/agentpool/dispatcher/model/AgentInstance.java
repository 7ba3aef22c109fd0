package agentpool.dispatcher.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable view of one worker instance serving an agent type.
 * The registry hands out fresh copies whenever state changes.
 */
public final class AgentInstance {
    private final String id;
    private final String agentType;
    private final String endpoint;
    private final int capacity;
    private final int currentLoad;
    private final HealthSnapshot health;
    private final Instant lastHealthCheck;
    private final PerformanceMetrics performance;

    private AgentInstance(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.agentType = Objects.requireNonNull(builder.agentType, "agentType is required");
        this.endpoint = builder.endpoint;
        if (builder.capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = builder.capacity;
        this.currentLoad = Math.max(0, Math.min(builder.currentLoad, builder.capacity));
        this.lastHealthCheck = builder.lastHealthCheck;
        this.health = builder.health != null ? builder.health : HealthSnapshot.unknown(builder.lastHealthCheck);
        this.performance = builder.performance != null ? builder.performance : PerformanceMetrics.initial();
    }

    // Getters
    public String id() {
        return id;
    }

    public String agentType() {
        return agentType;
    }

    public String endpoint() {
        return endpoint;
    }

    public int capacity() {
        return capacity;
    }

    public int currentLoad() {
        return currentLoad;
    }

    public HealthSnapshot health() {
        return health;
    }

    public HealthStatus status() {
        return health.status();
    }

    public Instant lastHealthCheck() {
        return lastHealthCheck;
    }

    public PerformanceMetrics performance() {
        return performance;
    }

    /** Healthy and below capacity. Circuit state is checked by the dispatcher. */
    public boolean hasHeadroom() {
        return health.isHealthy() && currentLoad < capacity;
    }

    /** Create a builder from this instance (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .agentType(agentType)
                .endpoint(endpoint)
                .capacity(capacity)
                .currentLoad(currentLoad)
                .health(health)
                .lastHealthCheck(lastHealthCheck)
                .performance(performance);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String agentType;
        private String endpoint;
        private int capacity = 1;
        private int currentLoad;
        private HealthSnapshot health;
        private Instant lastHealthCheck;
        private PerformanceMetrics performance;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder agentType(String agentType) {
            this.agentType = agentType;
            return this;
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder capacity(int capacity) {
            this.capacity = capacity;
            return this;
        }

        public Builder currentLoad(int currentLoad) {
            this.currentLoad = currentLoad;
            return this;
        }

        public Builder health(HealthSnapshot health) {
            this.health = health;
            return this;
        }

        public Builder lastHealthCheck(Instant lastHealthCheck) {
            this.lastHealthCheck = lastHealthCheck;
            return this;
        }

        public Builder performance(PerformanceMetrics performance) {
            this.performance = performance;
            return this;
        }

        public AgentInstance build() {
            return new AgentInstance(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AgentInstance other))
            return false;
        return Objects.equals(id, other.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "AgentInstance{id='" + id + "', agentType='" + agentType + "', status=" + health.status()
                + ", load=" + currentLoad + "/" + capacity + "}";
    }
}
