package grove.impl;

import grove.Cursor;
import grove.Forest;
import grove.Tree;
import io.lacuna.bifurcan.List;
import io.lacuna.bifurcan.Lists;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Objects;

public class CursorImpl<V> implements Cursor<V> {
  final Tree<V> focus;
  final List<Tree<V>> left;
  final List<Tree<V>> right;
  // immediate parent first
  final List<Frame<V>> parents;

  public CursorImpl(Tree<V> focus, List<Tree<V>> left, List<Tree<V>> right, List<Frame<V>> parents) {
    this.focus = focus;
    this.left = left;
    this.right = right;
    this.parents = parents;
  }

  public static <V> CursorImpl<V> create(Forest<V> forest) {
    if (forest.isEmpty()) {
      throw new IllegalArgumentException("Will accept only non-empty forests");
    }
    return new CursorImpl<>(forest.roots.nth(0), new List<>(), forest.roots.removeFirst(), new List<>());
  }

  @Override
  public V label() {
    return focus.value;
  }

  @Override
  public Tree<V> tree() {
    return focus;
  }

  @Override
  public CursorImpl<V> parent() {
    if (parents.size() == 0) {
      return null;
    }
    Frame<V> frame = parents.nth(0);
    Tree<V> node = new Tree<>(frame.value, Frame.join(left, focus, right));
    return new CursorImpl<>(node, frame.left, frame.right, parents.removeFirst());
  }

  @Override
  public CursorImpl<V> firstChild() {
    List<Tree<V>> children = focus.children;
    if (children.size() == 0) {
      return null;
    }
    return new CursorImpl<>(children.nth(0), new List<>(), children.removeFirst(), parents.addFirst(frame()));
  }

  @Override
  public CursorImpl<V> lastChild() {
    List<Tree<V>> children = focus.children;
    if (children.size() == 0) {
      return null;
    }
    return new CursorImpl<>(children.nth(children.size() - 1), children.removeLast(), new List<>(), parents.addFirst(frame()));
  }

  @Override
  public CursorImpl<V> nextSibling() {
    if (right.size() == 0) {
      return null;
    }
    return new CursorImpl<>(right.nth(0), left.addLast(focus), right.removeFirst(), parents);
  }

  @Override
  public CursorImpl<V> previousSibling() {
    if (left.size() == 0) {
      return null;
    }
    return new CursorImpl<>(left.nth(left.size() - 1), left.removeLast(), right.addFirst(focus), parents);
  }

  @Override
  public CursorImpl<V> nextInPreOrder() {
    CursorImpl<V> child = firstChild();
    if (child != null) {
      return child;
    }
    CursorImpl<V> loc = this;
    while (loc != null) {
      CursorImpl<V> next = loc.nextSibling();
      if (next != null) {
        return next;
      }
      loc = loc.parent();
    }
    return null;
  }

  @Override
  public CursorImpl<V> previousInPreOrder() {
    CursorImpl<V> prev = previousSibling();
    if (prev != null) {
      return prev.lastDescendant();
    }
    return parent();
  }

  @Override
  public CursorImpl<V> root() {
    CursorImpl<V> loc = this;
    CursorImpl<V> up = loc.parent();
    while (up != null) {
      loc = up;
      up = loc.parent();
    }
    return loc;
  }

  @Override
  public CursorImpl<V> firstRoot() {
    CursorImpl<V> root = root();
    if (root.left.size() == 0) {
      return root;
    }
    return new CursorImpl<>(root.left.nth(0), new List<>(), Frame.join(root.left.removeFirst(), root.focus, root.right), root.parents);
  }

  @Override
  public CursorImpl<V> lastDescendant() {
    CursorImpl<V> loc = this;
    CursorImpl<V> down = loc.lastChild();
    while (down != null) {
      loc = down;
      down = loc.lastChild();
    }
    return loc;
  }

  @Override
  public int depth() {
    return (int)parents.size();
  }

  @Override
  public long index() {
    return left.size();
  }

  @Override
  public long[] address() {
    int depth = depth();
    long[] address = new long[depth + 1];
    for (int i = 0; i < depth; i++) {
      address[depth - 1 - i] = parents.nth(i).left.size();
    }
    address[depth] = left.size();
    return address;
  }

  @Override
  public boolean isRoot() {
    return parents.size() == 0;
  }

  @Override
  public boolean isFirstRoot() {
    return isRoot() && left.size() == 0;
  }

  @Override
  public boolean hasChildren() {
    return focus.children.size() > 0;
  }

  @Override
  public java.util.List<V> ancestors() {
    ArrayList<V> result = new ArrayList<>((int)parents.size());
    for (Frame<V> frame : parents) {
      result.add(frame.value);
    }
    return result;
  }

  @Override
  public Forest<V> toForest() {
    CursorImpl<V> root = root();
    return new Forest<>(Frame.join(root.left, root.focus, root.right));
  }

  @Override
  public CursorImpl<V> replaceLabel(@NotNull V value) {
    return new CursorImpl<>(focus.withValue(value), left, right, parents);
  }

  @Override
  public CursorImpl<V> insertAfter(@NotNull Tree<V> tree) {
    return new CursorImpl<>(Objects.requireNonNull(tree), left.addLast(focus), right, parents);
  }

  @Override
  public CursorImpl<V> insertFirstChild(@NotNull Tree<V> tree) {
    return new CursorImpl<>(Objects.requireNonNull(tree), new List<>(), focus.children, parents.addFirst(frame()));
  }

  @Override
  public CursorImpl<V> insertLastChild(@NotNull Tree<V> tree) {
    return new CursorImpl<>(Objects.requireNonNull(tree), focus.children, new List<>(), parents.addFirst(frame()));
  }

  @Override
  public Forest<V> removeSubtree() {
    List<Tree<V>> siblings = Frame.join(left, right);
    if (parents.size() == 0) {
      return new Forest<>(siblings);
    }
    Frame<V> frame = parents.nth(0);
    Tree<V> parent = new Tree<>(frame.value, siblings);
    return new CursorImpl<>(parent, frame.left, frame.right, parents.removeFirst()).toForest();
  }

  private Frame<V> frame() {
    return new Frame<>(left, focus.value, right);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    CursorImpl<?> cursor = (CursorImpl<?>)o;
    return focus.equals(cursor.focus) &&
           left.equals(cursor.left) &&
           right.equals(cursor.right) &&
           parents.equals(cursor.parents);
  }

  @Override
  public int hashCode() {
    return Objects.hash(focus, Lists.hash(left), Lists.hash(right), Lists.hash(parents));
  }

  @Override
  public String toString() {
    return "Cursor{" +
           "label=" + focus.value +
           ", depth=" + parents.size() +
           ", index=" + left.size() +
           '}';
  }
}
