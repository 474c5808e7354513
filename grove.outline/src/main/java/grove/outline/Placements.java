package grove.outline;

import grove.Forest;
import grove.Tree;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

public class Placements {
  private Placements() {}

  /*
   * placements of all nodes in pre-order
   * */
  public static <V, K> List<Placement<K>> of(@NotNull Forest<V> forest, @NotNull Function<? super V, ? extends K> keyOf) {
    ArrayList<Placement<K>> result = new ArrayList<>();
    long index = 0;
    for (Tree<V> root : forest.roots) {
      collect(root, null, index++, keyOf, result);
    }
    return result;
  }

  private static <V, K> void collect(Tree<V> tree,
                                     K parent,
                                     long index,
                                     Function<? super V, ? extends K> keyOf,
                                     ArrayList<Placement<K>> result) {
    K key = keyOf.apply(tree.value);
    result.add(new Placement<>(key, parent, index));
    long childIndex = 0;
    for (Tree<V> child : tree.children) {
      collect(child, key, childIndex++, keyOf, result);
    }
  }

  /*
   * placements of `after` that differ from `before`, keys are expected to be unique
   * */
  public static <K> List<Placement<K>> changed(@NotNull List<Placement<K>> before, @NotNull List<Placement<K>> after) {
    Map<K, Placement<K>> previous = new HashMap<>();
    for (Placement<K> placement : before) {
      previous.put(placement.key, placement);
    }
    ArrayList<Placement<K>> result = new ArrayList<>();
    for (Placement<K> placement : after) {
      if (!placement.equals(previous.get(placement.key))) {
        result.add(placement);
      }
    }
    return result;
  }
}
