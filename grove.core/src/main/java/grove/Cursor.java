package grove;

import grove.impl.CursorImpl;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/*
 * Zipper over a forest: one focused node plus the context needed to rebuild the whole forest.
 * Cursors are persistent, every step returns a new cursor.
 * Steps return null when they hit a structural boundary (no parent, no sibling, end of forest).
 * */
public interface Cursor<V> {

  /*
   * focuses the first root, throws InvalidOperationException for an empty forest
   * */
  static <V> Cursor<V> fromForest(@NotNull Forest<V> forest) {
    if (forest.isEmpty()) {
      throw InvalidOperationException.emptyForest();
    }
    return CursorImpl.create(forest);
  }

  /*
   * same as fromForest, but an empty forest yields null
   * */
  @Nullable
  static <V> Cursor<V> fromFlatForest(@NotNull Forest<V> forest) {
    return forest.isEmpty() ? null : CursorImpl.create(forest);
  }

  V label();

  Tree<V> tree();

  @Nullable
  Cursor<V> parent();

  @Nullable
  Cursor<V> firstChild();

  @Nullable
  Cursor<V> lastChild();

  @Nullable
  Cursor<V> nextSibling();

  @Nullable
  Cursor<V> previousSibling();

  /*
   * the node drawn in the row below, null at the end of the forest
   * */
  @Nullable
  Cursor<V> nextInPreOrder();

  /*
   * the node drawn in the row above, null on the first root
   * */
  @Nullable
  Cursor<V> previousInPreOrder();

  Cursor<V> root();

  Cursor<V> firstRoot();

  /*
   * follows the last child chain down to a childless node, returns this cursor for a leaf
   * */
  Cursor<V> lastDescendant();

  /*
   * number of ancestors, 0 for roots
   * */
  int depth();

  /*
   * position among siblings (among roots for a root)
   * */
  long index();

  /*
   * sibling indices from the root level down to the focus
   * */
  long[] address();

  boolean isRoot();

  boolean isFirstRoot();

  boolean hasChildren();

  /*
   * values of the ancestors, immediate parent first
   * */
  java.util.List<V> ancestors();

  Forest<V> toForest();

  Cursor<V> replaceLabel(@NotNull V value);

  Cursor<V> insertAfter(@NotNull Tree<V> tree);

  Cursor<V> insertFirstChild(@NotNull Tree<V> tree);

  Cursor<V> insertLastChild(@NotNull Tree<V> tree);

  /*
   * the forest without the focused subtree, might be empty
   * */
  Forest<V> removeSubtree();
}
