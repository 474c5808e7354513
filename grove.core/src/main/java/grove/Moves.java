package grove;

import org.jetbrains.annotations.NotNull;

import java.util.function.Function;
import java.util.function.Predicate;

/*
 * Relocation primitives. Each one detaches the focused subtree as a unit and reattaches it
 * next to the node whose key equals `target`, returning a cursor focused on the moved node.
 *
 * The target is the first node with a matching key in pre-order.
 * Throws InvalidOperationException (TARGET_NOT_FOUND, TARGET_INSIDE_FOCUS) when the target is missing
 * or lies inside the moved subtree; the input cursor stays valid in that case.
 * */
public class Moves {
  private Moves() {}

  /*
   * moved node becomes the next sibling of the target, at the target's level
   * */
  public static <V, K> Cursor<V> moveToAfter(@NotNull K target,
                                             @NotNull Function<? super V, ? extends K> keyOf,
                                             @NotNull Cursor<V> cursor) {
    return resolveAnchor(target, keyOf, cursor).insertAfter(cursor.tree());
  }

  /*
   * moved node becomes the target's first child, existing children shift right
   * */
  public static <V, K> Cursor<V> moveToFirstChildOf(@NotNull K target,
                                                    @NotNull Function<? super V, ? extends K> keyOf,
                                                    @NotNull Cursor<V> cursor) {
    return resolveAnchor(target, keyOf, cursor).insertFirstChild(cursor.tree());
  }

  /*
   * moved node becomes the target's last child
   * */
  public static <V, K> Cursor<V> moveToLastChildOf(@NotNull K target,
                                                   @NotNull Function<? super V, ? extends K> keyOf,
                                                   @NotNull Cursor<V> cursor) {
    return resolveAnchor(target, keyOf, cursor).insertLastChild(cursor.tree());
  }

  /*
   * moved node becomes the first root, never fails
   * */
  public static <V> Cursor<V> moveToFirstRootPosition(@NotNull Cursor<V> cursor) {
    if (cursor.isFirstRoot()) {
      return cursor;
    }
    Forest<V> rest = cursor.removeSubtree();
    return Cursor.fromForest(new Forest<>(rest.roots.addFirst(cursor.tree())));
  }

  /*
   * returns a cursor on the target in the forest that no longer holds the focused subtree
   * */
  private static <V, K> Cursor<V> resolveAnchor(K target, Function<? super V, ? extends K> keyOf, Cursor<V> cursor) {
    Predicate<V> isTarget = Forests.byKey(target, keyOf);
    Cursor<V> resolved = Forests.findCursorInForest(isTarget, cursor.toForest());
    if (resolved == null) {
      throw InvalidOperationException.targetNotFound(target);
    }
    if (isWithin(resolved.address(), cursor.address())) {
      throw InvalidOperationException.targetInsideFocus(target, cursor.label());
    }
    // removal keeps the pre-order of the remaining nodes, so the first match stays the same node
    Cursor<V> anchor = Forests.findCursorInForest(isTarget, cursor.removeSubtree());
    assert anchor != null;
    return anchor;
  }

  /*
   * whether `address` points at `subtree` or one of its descendants
   * */
  static boolean isWithin(long[] address, long[] subtree) {
    if (address.length < subtree.length) {
      return false;
    }
    for (int i = 0; i < subtree.length; i++) {
      if (address[i] != subtree[i]) {
        return false;
      }
    }
    return true;
  }
}
