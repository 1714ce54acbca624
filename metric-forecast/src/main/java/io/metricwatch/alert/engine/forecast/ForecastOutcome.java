package io.metricwatch.alert.engine.forecast;

import com.google.common.base.Preconditions;
import java.util.Optional;

/**
 * Either a {@link ForecastResult} or a {@link ForecastError}. Exactly one of the two is present.
 */
public final class ForecastOutcome {
  private final ForecastResult result;
  private final ForecastError error;

  private ForecastOutcome(ForecastResult result, ForecastError error) {
    this.result = result;
    this.error = error;
  }

  public static ForecastOutcome success(ForecastResult result) {
    Preconditions.checkNotNull(result, "result");
    return new ForecastOutcome(result, null);
  }

  public static ForecastOutcome failure(ForecastErrorCode code, String message) {
    return new ForecastOutcome(null, new ForecastError(code, message));
  }

  public boolean isSuccess() {
    return result != null;
  }

  public Optional<ForecastResult> getResult() {
    return Optional.ofNullable(result);
  }

  public Optional<ForecastError> getError() {
    return Optional.ofNullable(error);
  }

  /**
   * Returns the result, or throws {@link InsufficientDataException} or {@link
   * IllegalArgumentException} depending on the error code.
   */
  public ForecastResult orElseThrow() {
    if (result == null) {
      throw error.toException();
    }
    return result;
  }

  @Override
  public String toString() {
    return isSuccess() ? "ForecastOutcome(" + result + ")" : "ForecastOutcome(" + error + ")";
  }
}
