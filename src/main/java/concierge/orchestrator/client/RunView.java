package concierge.orchestrator.client;

import concierge.orchestrator.model.RunStatus;

/**
 * Consumer-side view of a run.
 *
 * @param runId         run id
 * @param correlationId correlation id carried by the events
 * @param status        latest lifecycle status seen
 * @param statusSeq     sequence of the event that set the status
 * @param contiguousSeq highest sequence with no gap below it
 * @param highestSeq    highest sequence seen
 * @param result        final result, if succeeded
 * @param error         final error, if failed
 */
public record RunView(
        String runId,
        String correlationId,
        RunStatus status,
        long statusSeq,
        long contiguousSeq,
        long highestSeq,
        String result,
        String error) {

    public boolean hasGap() {
        return highestSeq > contiguousSeq;
    }
}
