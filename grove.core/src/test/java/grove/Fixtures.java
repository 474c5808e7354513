package grove;

import java.util.function.Function;

import static grove.Tree.leaf;
import static grove.Tree.tree;
import static org.junit.jupiter.api.Assertions.assertNotNull;

final class Fixtures {
  private Fixtures() {}

  static final Function<Integer, Integer> ID = Function.identity();

  /*
   * [0[-1[-10 -20] 1[10 20]], 100[-100[-110 -120] 101[110 120]]]
   * */
  static Forest<Integer> twoTrees() {
    return Forest.of(
      tree(0,
           tree(-1, leaf(-10), leaf(-20)),
           tree(1, leaf(10), leaf(20))),
      tree(100,
           tree(-100, leaf(-110), leaf(-120)),
           tree(101, leaf(110), leaf(120))));
  }

  static Cursor<Integer> at(Forest<Integer> forest, int value) {
    Cursor<Integer> cursor = Forests.findCursorInForest(v -> v == value, forest);
    assertNotNull(cursor, "no node " + value + " in " + forest);
    return cursor;
  }

  static java.util.List<Integer> sorted(Forest<Integer> forest) {
    java.util.List<Integer> values = forest.values();
    values.sort(Integer::compare);
    return values;
  }
}
