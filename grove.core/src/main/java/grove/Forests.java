package grove;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/*
 * Search, ancestry and flattening over forests and cursors.
 * Searches visit nodes in pre-order: roots left to right, each subtree fully before its next sibling.
 * */
public class Forests {
  private Forests() {}

  @Nullable
  public static <V> V findInForest(@NotNull Predicate<? super V> predicate, @NotNull Forest<V> forest) {
    for (Tree<V> root : forest.roots) {
      V found = findInTree(predicate, root);
      if (found != null) {
        return found;
      }
    }
    return null;
  }

  @Nullable
  private static <V> V findInTree(Predicate<? super V> predicate, Tree<V> tree) {
    if (predicate.test(tree.value)) {
      return tree.value;
    }
    for (Tree<V> child : tree.children) {
      V found = findInTree(predicate, child);
      if (found != null) {
        return found;
      }
    }
    return null;
  }

  @Nullable
  public static <V> Cursor<V> findCursorInForest(@NotNull Predicate<? super V> predicate, @NotNull Forest<V> forest) {
    Cursor<V> loc = Cursor.fromFlatForest(forest);
    return loc == null ? null : scan(predicate, loc);
  }

  /*
   * first match at or after the cursor in pre-order
   * */
  @Nullable
  public static <V> Cursor<V> scan(@NotNull Predicate<? super V> predicate, @NotNull Cursor<V> cursor) {
    Cursor<V> loc = cursor;
    while (loc != null) {
      if (predicate.test(loc.label())) {
        return loc;
      }
      loc = loc.nextInPreOrder();
    }
    return null;
  }

  @Nullable
  public static <V, K> Cursor<V> findCursorByKey(@NotNull K target,
                                                 @NotNull Function<? super V, ? extends K> keyOf,
                                                 @NotNull Forest<V> forest) {
    return findCursorInForest(byKey(target, keyOf), forest);
  }

  public static <V, K> Predicate<V> byKey(@NotNull K target, @NotNull Function<? super V, ? extends K> keyOf) {
    Objects.requireNonNull(target, "target");
    return v -> target.equals(keyOf.apply(v));
  }

  /*
   * whether the focused subtree, focus included, has a matching value
   * */
  public static <V> boolean contains(@NotNull Cursor<V> cursor, @NotNull Predicate<? super V> predicate) {
    return findInTree(predicate, cursor.tree()) != null;
  }

  public static <V> List<V> ancestorsOf(@NotNull Cursor<V> cursor) {
    return cursor.ancestors();
  }

  public static <V> Forest<V> toFlatForest(@NotNull Cursor<V> cursor) {
    return cursor.toForest();
  }

  @Nullable
  public static <V> Cursor<V> fromFlatForest(@NotNull Forest<V> forest) {
    return Cursor.fromFlatForest(forest);
  }
}
