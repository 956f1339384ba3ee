package io.b2mash.b2b.deliverytracker.workitem;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Computes work-breakdown paths ("1", "1.2", "1.2.3") from parent links and sibling order. A path
 * is a pure function of the ancestors' paths and the item's rank among its siblings, so it is
 * recomputed after every insert, move, reorder, delete or restore.
 */
public final class WbsCalculator {

  /** Minimal structural view of an item: identity, parent and sibling position. */
  public record Node(UUID id, UUID parentId, int position) {}

  /**
   * Assigns paths to every node reachable from a root (a node with a null parent). Nodes whose
   * parent is not among {@code nodes} are not reachable and get no path.
   *
   * @return id to path, in no particular order
   */
  public static Map<UUID, String> compute(List<Node> nodes) {
    Map<UUID, List<Node>> childrenByParent = new HashMap<>();
    List<Node> roots = new ArrayList<>();
    for (Node node : nodes) {
      if (node.parentId() == null) {
        roots.add(node);
      } else {
        childrenByParent.computeIfAbsent(node.parentId(), k -> new ArrayList<>()).add(node);
      }
    }

    Map<UUID, String> paths = new HashMap<>();
    assign(roots, "", childrenByParent, paths);
    return paths;
  }

  private static void assign(
      List<Node> siblings,
      String prefix,
      Map<UUID, List<Node>> childrenByParent,
      Map<UUID, String> paths) {
    List<Node> ordered = new ArrayList<>(siblings);
    ordered.sort(Comparator.comparingInt(Node::position));
    for (int i = 0; i < ordered.size(); i++) {
      Node node = ordered.get(i);
      String path = prefix + (i + 1);
      paths.put(node.id(), path);
      List<Node> children = childrenByParent.get(node.id());
      if (children != null) {
        assign(children, path + ".", childrenByParent, paths);
      }
    }
  }

  private WbsCalculator() {}
}
