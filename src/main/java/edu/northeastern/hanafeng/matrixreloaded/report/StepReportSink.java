package edu.northeastern.hanafeng.matrixreloaded.report;

/**
 * Destination of finished step reports. Publishing is best effort: implementations
 * log their failures instead of throwing, so a lost report never stops the run.
 */
public interface StepReportSink {

    void publish(StepReport report);
}
