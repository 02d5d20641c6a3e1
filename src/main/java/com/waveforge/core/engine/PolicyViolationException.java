package com.waveforge.core.engine;

import com.waveforge.collab.PolicyViolation;

import java.util.List;

/**
 * Files changed by a wave broke project rules; the checkpoint commit was not attempted.
 */
public class PolicyViolationException extends WaveHaltException {

    private final List<String> waveTaskIds;
    private final List<PolicyViolation> violations;

    public PolicyViolationException(int waveId, List<String> waveTaskIds, List<PolicyViolation> violations) {
        super(waveId, "Wave %d checkpoint blocked by %d policy violation(s)".formatted(waveId, violations.size()));
        this.waveTaskIds = List.copyOf(waveTaskIds);
        this.violations = List.copyOf(violations);
    }

    public List<PolicyViolation> violations() {
        return violations;
    }

    @Override
    public List<String> taskIds() {
        return waveTaskIds;
    }
}
