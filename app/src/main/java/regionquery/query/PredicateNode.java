package regionquery.query;

import java.util.List;
import java.util.Objects;
import regionquery.model.CropFilter;

/**
 * Parsed region query. The operator set is closed: a node is a {@link Crop} leaf, or an {@link
 * And} / {@link Or} over an ordered, non-empty list of children.
 */
public sealed interface PredicateNode {

  /** Number of nodes in this subtree, including this one. */
  int nodeCount();

  static Crop crop(CropFilter filter) {
    return new Crop(filter);
  }

  static And and(PredicateNode... children) {
    return new And(List.of(children));
  }

  static Or or(PredicateNode... children) {
    return new Or(List.of(children));
  }

  record Crop(CropFilter filter) implements PredicateNode {
    public Crop {
      Objects.requireNonNull(filter, "filter");
    }

    @Override
    public int nodeCount() {
      return 1;
    }

    @Override
    public String toString() {
      return filter.toString();
    }
  }

  record And(List<PredicateNode> children) implements PredicateNode {
    public And {
      children = requireChildren(children, "and");
    }

    @Override
    public int nodeCount() {
      return 1 + countChildren(children);
    }

    @Override
    public String toString() {
      return "and" + children;
    }
  }

  record Or(List<PredicateNode> children) implements PredicateNode {
    public Or {
      children = requireChildren(children, "or");
    }

    @Override
    public int nodeCount() {
      return 1 + countChildren(children);
    }

    @Override
    public String toString() {
      return "or" + children;
    }
  }

  private static List<PredicateNode> requireChildren(List<PredicateNode> children, String op) {
    Objects.requireNonNull(children, op + " children");
    if (children.isEmpty()) {
      throw new IllegalArgumentException("'" + op + "' requires at least one operand");
    }
    return List.copyOf(children);
  }

  private static int countChildren(List<PredicateNode> children) {
    int total = 0;
    for (PredicateNode child : children) {
      total += child.nodeCount();
    }
    return total;
  }
}
