package regionquery.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Leaf filter of a region query.
 *
 * <p>An empty {@link #category()} places no restriction on category, and an empty {@link
 * #oneOfGroups()} places no restriction on group membership. When {@link #proper()} is set, a
 * group only contributes points if every one of its members lies inside {@link #box()}.
 */
public record CropFilter(Box box, OptionalInt category, Set<Long> oneOfGroups, boolean proper) {

  public CropFilter {
    Objects.requireNonNull(box, "box");
    category = category == null ? OptionalInt.empty() : category;
    // keep the caller's order so diagnostics print groups as written
    oneOfGroups =
        oneOfGroups == null || oneOfGroups.isEmpty()
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(oneOfGroups));
  }

  public static CropFilter box(Box box) {
    return new CropFilter(box, OptionalInt.empty(), Set.of(), false);
  }

  public CropFilter withCategory(int category) {
    return new CropFilter(box, OptionalInt.of(category), oneOfGroups, proper);
  }

  public CropFilter withGroups(Set<Long> groups) {
    return new CropFilter(box, category, groups, proper);
  }

  public CropFilter asProper() {
    return new CropFilter(box, category, oneOfGroups, true);
  }

  public boolean restrictsGroups() {
    return !oneOfGroups.isEmpty();
  }

  /** Attribute test applied by stores that scan points themselves. */
  public boolean matches(Point point) {
    if (!point.within(box)) {
      return false;
    }
    if (category.isPresent() && point.category() != category.getAsInt()) {
      return false;
    }
    return !restrictsGroups() || oneOfGroups.contains(point.groupId());
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("crop ").append(box);
    category.ifPresent(c -> sb.append(" category=").append(c));
    if (restrictsGroups()) {
      sb.append(" groups=").append(oneOfGroups);
    }
    if (proper) {
      sb.append(" proper");
    }
    return sb.toString();
  }
}
