package grove.outline;

public enum Op {
  MOVE_UP,
  MOVE_DOWN,
  DROP_AFTER,
  DROP_AS_FIRST_CHILD,
  DROP_AS_LAST_CHILD,
  DROP_AS_FIRST_ROOT
}
