package concierge.orchestrator.model;

/**
 * Result of reporting a commis outcome.
 */
public enum CommisReportResult {
    /** Outcome recorded, barrier still waiting on siblings */
    RECORDED,

    /** Outcome recorded and it was the last one: the run resumed */
    RELEASED,

    /** Commis already terminal - duplicate report, nothing recorded */
    ALREADY_TERMINAL,

    /** No commis with that id */
    NOT_FOUND
}
