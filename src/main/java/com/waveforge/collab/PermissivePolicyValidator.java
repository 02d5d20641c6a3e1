package com.waveforge.collab;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Used when no policy command is configured: accepts everything.
 */
public class PermissivePolicyValidator implements PolicyValidator {

    private static final Logger log = LoggerFactory.getLogger(PermissivePolicyValidator.class);

    @Override
    public List<PolicyViolation> validate(List<String> files) {
        log.warn("No policy validator configured, skipping validation of {} file(s)", files.size());
        return List.of();
    }
}
