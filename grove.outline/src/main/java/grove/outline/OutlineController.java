package grove.outline;

import grove.Cursor;
import grove.Forest;
import grove.InvalidOperationException;
import grove.Moves;
import grove.Relocation;
import grove.Steps;
import org.jetbrains.annotations.NotNull;

/*
 * Reordering requests coming from the outline UI.
 * Every operation returns a new outline, or the same instance when nothing moved.
 * */
public class OutlineController {
  private OutlineController() {}

  public static <V, K> Outline<V, K> moveUp(@NotNull Outline<V, K> outline, @NotNull K key) {
    Cursor<V> cursor = focus(outline, key);
    Relocation<V> step = Steps.goUp(cursor);
    if (step == null) {
      return outline;
    }
    return commit(outline, step.apply(outline.keyOf, cursor), Op.MOVE_UP, key, anchorKey(outline, step));
  }

  public static <V, K> Outline<V, K> moveDown(@NotNull Outline<V, K> outline, @NotNull K key) {
    Cursor<V> cursor = focus(outline, key);
    Relocation<V> step = Steps.goDown(cursor);
    if (step == null) {
      return outline;
    }
    return commit(outline, step.apply(outline.keyOf, cursor), Op.MOVE_DOWN, key, anchorKey(outline, step));
  }

  public static <V, K> Outline<V, K> dropAfter(@NotNull Outline<V, K> outline, @NotNull K key, @NotNull K target) {
    Cursor<V> moved = Moves.moveToAfter(target, outline.keyOf, focus(outline, key));
    return commit(outline, moved, Op.DROP_AFTER, key, target);
  }

  public static <V, K> Outline<V, K> dropAsFirstChild(@NotNull Outline<V, K> outline, @NotNull K key, @NotNull K target) {
    Cursor<V> moved = Moves.moveToFirstChildOf(target, outline.keyOf, focus(outline, key));
    return commit(outline, moved, Op.DROP_AS_FIRST_CHILD, key, target);
  }

  public static <V, K> Outline<V, K> dropAsLastChild(@NotNull Outline<V, K> outline, @NotNull K key, @NotNull K target) {
    Cursor<V> moved = Moves.moveToLastChildOf(target, outline.keyOf, focus(outline, key));
    return commit(outline, moved, Op.DROP_AS_LAST_CHILD, key, target);
  }

  public static <V, K> Outline<V, K> dropAsFirstRoot(@NotNull Outline<V, K> outline, @NotNull K key) {
    Cursor<V> moved = Moves.moveToFirstRootPosition(focus(outline, key));
    return commit(outline, moved, Op.DROP_AS_FIRST_ROOT, key, null);
  }

  private static <V, K> Cursor<V> focus(Outline<V, K> outline, K key) {
    Cursor<V> cursor = outline.cursorAt(key);
    if (cursor == null) {
      throw new InvalidOperationException(InvalidOperationException.Reason.TARGET_NOT_FOUND, "no node with key " + key);
    }
    return cursor;
  }

  private static <V, K> K anchorKey(Outline<V, K> outline, Relocation<V> step) {
    return step.anchor == null ? null : outline.keyOf(step.anchor);
  }

  private static <V, K> Outline<V, K> commit(Outline<V, K> outline, Cursor<V> moved, Op op, K key, K target) {
    Forest<V> forest = moved.toForest();
    if (forest.equals(outline.forest)) {
      return outline;
    }
    return outline.withForest(forest).log(op, key, target);
  }
}
