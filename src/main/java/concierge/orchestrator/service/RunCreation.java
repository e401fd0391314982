package concierge.orchestrator.service;

import concierge.orchestrator.model.Run;

/**
 * Outcome of a create call: the run and whether this call created it.
 */
public record RunCreation(Run run, boolean created) {
}
