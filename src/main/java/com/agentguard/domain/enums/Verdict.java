package com.agentguard.domain.enums;

/**
 * Outcome of a single rule pipeline run.
 *
 * <ul>
 *   <li>APPROVED -- every rule passed</li>
 *   <li>DENIED -- a rule failed; terminal, recorded immediately</li>
 *   <li>ESCALATED -- blocked pending a human reviewer; no audit entry until resolved</li>
 * </ul>
 */
public enum Verdict {
    APPROVED,
    DENIED,
    ESCALATED
}
