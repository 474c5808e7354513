package grove;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.function.Function;

/*
 * Outcome of the row classifiers in Steps: which relocation realizes a one-row move,
 * and against which anchor. FIRST_ROOT carries no anchor.
 * */
public class Relocation<V> {

  public enum Kind {
    FIRST_ROOT,
    FIRST_CHILD_OF,
    AFTER
  }

  public final Kind kind;
  @Nullable
  public final V anchor;

  private Relocation(Kind kind, @Nullable V anchor) {
    this.kind = kind;
    this.anchor = anchor;
  }

  public static <V> Relocation<V> firstRoot() {
    return new Relocation<>(Kind.FIRST_ROOT, null);
  }

  public static <V> Relocation<V> firstChildOf(@NotNull V anchor) {
    return new Relocation<>(Kind.FIRST_CHILD_OF, Objects.requireNonNull(anchor, "anchor"));
  }

  public static <V> Relocation<V> after(@NotNull V anchor) {
    return new Relocation<>(Kind.AFTER, Objects.requireNonNull(anchor, "anchor"));
  }

  /*
   * runs the primitive matching this outcome, the anchor is addressed by its key
   * */
  public <K> Cursor<V> apply(@NotNull Function<? super V, ? extends K> keyOf, @NotNull Cursor<V> cursor) {
    switch (kind) {
      case FIRST_ROOT:
        return Moves.moveToFirstRootPosition(cursor);
      case FIRST_CHILD_OF:
        return Moves.moveToFirstChildOf(keyOf.apply(anchor), keyOf, cursor);
      case AFTER:
        return Moves.moveToAfter(keyOf.apply(anchor), keyOf, cursor);
      default:
        throw new AssertionError(kind);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Relocation<?> that = (Relocation<?>)o;
    return kind == that.kind &&
           Objects.equals(anchor, that.anchor);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, anchor);
  }

  @Override
  public String toString() {
    switch (kind) {
      case FIRST_ROOT:
        return "FirstRoot";
      case FIRST_CHILD_OF:
        return "FirstChildOf(" + anchor + ")";
      default:
        return "After(" + anchor + ")";
    }
  }
}
