package com.linlay.agentteam.team;

import com.linlay.agentteam.engine.AgentRuntime;
import com.linlay.agentteam.engine.DelegatorRuntime;
import com.linlay.agentteam.hierarchy.model.TeamKey;

import java.time.Instant;
import java.util.List;

/**
 * An assembled team. Immutable and shared by every conversation of its instance; the session
 * of a turn travels with the run call instead of living here.
 */
public record RuntimeTeam(
        TeamKey key,
        DelegatorRuntime delegator,
        Instant configUpdatedAt,
        Instant assembledAt
) {
    public List<AgentRuntime> members() {
        return delegator.members();
    }
}
