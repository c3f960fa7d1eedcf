package io.hearthwarrio.actionspace.core.resolution;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * No strategy narrowed a node down to one element. Local to that node: the rest of the action space stays usable.
 */
public final class ResolutionFailure {

    private final String nodeId;
    private final String role;
    private final String name;
    private final String reason;
    private final Map<String, StrategyOutcome> attempts;

    public ResolutionFailure(
            String nodeId,
            String role,
            String name,
            String reason,
            Map<String, StrategyOutcome> attempts
    ) {
        this.nodeId = Objects.requireNonNull(nodeId, "nodeId must not be null");
        this.role = role == null ? "" : role;
        this.name = name == null ? "" : name;
        this.reason = reason == null ? "" : reason;
        this.attempts = attempts == null ? Map.of() : new LinkedHashMap<>(attempts);
    }

    public String getNodeId() {
        return nodeId;
    }

    public String getRole() {
        return role;
    }

    public String getName() {
        return name;
    }

    public String getReason() {
        return reason;
    }

    /**
     * Outcome per strategy ID, in the order the strategies ran.
     */
    public Map<String, StrategyOutcome> getAttempts() {
        return Collections.unmodifiableMap(attempts);
    }

    /**
     * Multi-line report for logs and exception messages.
     */
    public String report() {
        StringBuilder sb = new StringBuilder();
        sb.append("Could not resolve ").append(nodeId)
                .append(" (role '").append(role).append("', name '").append(name).append("')");
        if (!reason.isEmpty()) {
            sb.append(": ").append(reason);
        }
        for (Map.Entry<String, StrategyOutcome> e : attempts.entrySet()) {
            sb.append("\n  ").append(e.getKey()).append(" -> ").append(e.getValue());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "ResolutionFailure{" +
                "nodeId='" + nodeId + '\'' +
                ", role='" + role + '\'' +
                ", name='" + name + '\'' +
                ", reason='" + reason + '\'' +
                ", attempts=" + attempts +
                '}';
    }
}
