package igcse.transform;

import igcse.ast.Node;

import java.util.HashSet;
import java.util.Set;

/**
 * Structural identities of the nodes currently being converted, root to leaf.
 *
 * Entries are removed on exit, so identical sibling subtrees never see each other.
 */
final class ActivePath {
	private final Set<String> active = new HashSet<>();

	static String identity(Node node) {
		return node.kind() + ":" + node.span().startOffset() + ":" + node.span().endOffset();
	}

	/**
	 * @return false when the node is already on the path
	 */
	boolean mark(Node node) {
		return active.add(identity(node));
	}

	void unmark(Node node) {
		active.remove(identity(node));
	}
}
