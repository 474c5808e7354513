package grove;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/*
 * Row classifiers for keyboard reordering of a pre-order flattened forest.
 * They only decide which relocation to run, callers apply it with Relocation.apply.
 * Both look at local structure only: siblings, parent, grandparent and one rightmost chain.
 * */
public class Steps {
  private Steps() {}

  /*
   * null when the focus already is the first row
   *
   * with a previous sibling S the focus indents into the last visible descendant of S,
   * otherwise it crosses its parent P and lands right before it:
   * after P's previous sibling, as the grandparent's first child, or as the first root
   * */
  @Nullable
  public static <V> Relocation<V> goUp(@NotNull Cursor<V> cursor) {
    Cursor<V> previous = cursor.previousSibling();
    if (previous != null) {
      return Relocation.firstChildOf(previous.lastDescendant().label());
    }
    Cursor<V> parent = cursor.parent();
    if (parent == null) {
      return null;
    }
    // checked before the grandparent, otherwise G[A, P[N]] would carry N above the whole of A
    Cursor<V> beforeParent = parent.previousSibling();
    if (beforeParent != null) {
      return Relocation.after(beforeParent.label());
    }
    Cursor<V> grandparent = parent.parent();
    if (grandparent != null) {
      return Relocation.firstChildOf(grandparent.label());
    }
    return Relocation.firstRoot();
  }

  /*
   * null when the focus is the last root
   *
   * with a next sibling S the focus crosses S and becomes its first child,
   * the last child of P outdents to become P's next sibling
   * */
  @Nullable
  public static <V> Relocation<V> goDown(@NotNull Cursor<V> cursor) {
    Cursor<V> next = cursor.nextSibling();
    if (next != null) {
      return Relocation.firstChildOf(next.label());
    }
    Cursor<V> parent = cursor.parent();
    if (parent == null) {
      return null;
    }
    return Relocation.after(parent.label());
  }
}
