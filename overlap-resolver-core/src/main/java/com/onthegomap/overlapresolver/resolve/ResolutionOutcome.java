package com.onthegomap.overlapresolver.resolve;

import java.util.List;

/**
 * The terminal result of a resolution run.
 *
 * @param status   how the run ended
 * @param features the resolved output, empty unless the run completed
 * @param results  the resolution of every group that completed before the run ended
 * @param errors   problems encountered along the way
 * @param reason   why the run failed or was cancelled, null when it completed
 */
public record ResolutionOutcome(
  Status status,
  ResolvedFeatureSet features,
  List<ResolutionResult> results,
  List<ResolutionError> errors,
  String reason
) {

  public ResolutionOutcome {
    results = List.copyOf(results);
    errors = List.copyOf(errors);
  }

  public enum Status {
    COMPLETED,
    CANCELLED,
    FAILED
  }

  public static ResolutionOutcome completed(ResolvedFeatureSet features, List<ResolutionResult> results,
    List<ResolutionError> errors) {
    return new ResolutionOutcome(Status.COMPLETED, features, results, errors, null);
  }

  public static ResolutionOutcome cancelled(ResolvedFeatureSet empty, List<ResolutionResult> results,
    List<ResolutionError> errors) {
    return new ResolutionOutcome(Status.CANCELLED, empty, results, errors, "Cancelled after " + results.size() +
      " groups");
  }

  public static ResolutionOutcome failed(ResolvedFeatureSet empty, List<ResolutionError> errors, String reason) {
    return new ResolutionOutcome(Status.FAILED, empty, List.of(), errors, reason);
  }

  public boolean isCompleted() {
    return status == Status.COMPLETED;
  }

  /** Returns the errors of {@code kind}. */
  public List<ResolutionError> errors(ResolutionError.Kind kind) {
    return errors.stream().filter(error -> error.kind() == kind).toList();
  }
}
