package concierge.orchestrator.service;

import concierge.orchestrator.model.CommisReportResult;
import concierge.orchestrator.model.CommisResult;
import concierge.orchestrator.model.Run;

import java.util.List;

/**
 * What happened when a commis outcome was reported.
 *
 * @param outcome recorded, released, duplicate or unknown commis
 * @param run     run snapshot after the report, null when the commis is unknown
 * @param results wave results in spawn order, only when the barrier released
 */
public record CommisReport(CommisReportResult outcome, Run run, List<CommisResult> results) {

    public static CommisReport notFound() {
        return new CommisReport(CommisReportResult.NOT_FOUND, null, List.of());
    }

    public boolean released() {
        return outcome == CommisReportResult.RELEASED;
    }
}
