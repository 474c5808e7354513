package grove.outline;

import java.util.Objects;

public class OutlineOptions {

  public enum InvalidDropPolicy {
    // leave the order unchanged and report false
    IGNORE,
    // rethrow InvalidOperationException to the caller
    PROPAGATE
  }

  public static final int DEFAULT_HISTORY_LIMIT = 256;

  private static final OutlineOptions DEFAULTS = new OutlineOptions(DEFAULT_HISTORY_LIMIT, InvalidDropPolicy.IGNORE);

  public final int historyLimit;
  public final InvalidDropPolicy invalidDropPolicy;

  public OutlineOptions(int historyLimit, InvalidDropPolicy invalidDropPolicy) {
    if (historyLimit <= 0) {
      throw new IllegalArgumentException("historyLimit: " + historyLimit);
    }
    this.historyLimit = historyLimit;
    this.invalidDropPolicy = Objects.requireNonNull(invalidDropPolicy, "invalidDropPolicy");
  }

  public static OutlineOptions defaults() {
    return DEFAULTS;
  }

  public OutlineOptions withHistoryLimit(int historyLimit) {
    return new OutlineOptions(historyLimit, this.invalidDropPolicy);
  }

  public OutlineOptions withInvalidDropPolicy(InvalidDropPolicy invalidDropPolicy) {
    return new OutlineOptions(this.historyLimit, invalidDropPolicy);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    OutlineOptions options = (OutlineOptions)o;
    return historyLimit == options.historyLimit &&
           invalidDropPolicy == options.invalidDropPolicy;
  }

  @Override
  public int hashCode() {
    return Objects.hash(historyLimit, invalidDropPolicy);
  }

  @Override
  public String toString() {
    return "OutlineOptions{" +
           "historyLimit=" + historyLimit +
           ", invalidDropPolicy=" + invalidDropPolicy +
           '}';
  }
}
