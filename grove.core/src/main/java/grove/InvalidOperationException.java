package grove;

/*
 * Caller contract violation: the requested edit has no meaning for the given forest.
 * Distinct from structural absence, which is reported as null.
 * */
public class InvalidOperationException extends IllegalArgumentException {

  public enum Reason {
    EMPTY_FOREST,
    TARGET_NOT_FOUND,
    TARGET_INSIDE_FOCUS
  }

  public final Reason reason;

  public InvalidOperationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  static InvalidOperationException emptyForest() {
    return new InvalidOperationException(Reason.EMPTY_FOREST, "forest has no roots");
  }

  static InvalidOperationException targetNotFound(Object target) {
    return new InvalidOperationException(Reason.TARGET_NOT_FOUND, "no node with key " + target);
  }

  static InvalidOperationException targetInsideFocus(Object target, Object focus) {
    return new InvalidOperationException(Reason.TARGET_INSIDE_FOCUS,
                                         "target " + target + " is inside the subtree of " + focus);
  }
}
