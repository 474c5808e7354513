package grove.outline;

import grove.Forest;

import java.util.Objects;

import static grove.Tree.leaf;
import static grove.Tree.tree;

final class Category {
  final int id;
  final String name;

  Category(int id, String name) {
    this.id = id;
    this.name = name;
  }

  static Category c(int id, String name) {
    return new Category(id, name);
  }

  /*
   * [Work[Email Meetings[Standup]] Home[Garden]]
   * */
  static Forest<Category> sample() {
    return Forest.of(
      tree(c(1, "Work"),
           leaf(c(2, "Email")),
           tree(c(3, "Meetings"), leaf(c(4, "Standup")))),
      tree(c(5, "Home"),
           leaf(c(6, "Garden"))));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Category category = (Category)o;
    return id == category.id &&
           name.equals(category.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, name);
  }

  @Override
  public String toString() {
    return name;
  }
}
