package arisbe.model.egi;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The context containment tree of one graph, with the ancestor chains computed so far cached. Meant to live for
 * one pass over a graph (one parse, one generation); it does not notice later versions of the graph.
 */
public class ContextAncestry {
	private final RelationalGraph graph;
	private final Map<String, List<String>> chains;

	public ContextAncestry(RelationalGraph graph) {
		this.graph = graph;
		this.chains = new HashMap<>();
	}

	/**
	 * @return the context itself, its parent, and so on up to and including the sheet
	 */
	public List<String> ancestors(String contextId) {
		List<String> chain = chains.get(contextId);
		if (chain != null) {
			return chain;
		}
		if (!graph.isContext(contextId)) {
			throw new UnknownContextIssue(contextId);
		}
		List<String> result = new ArrayList<>();
		result.add(contextId);
		if (!contextId.equals(graph.getSheet())) {
			result.addAll(ancestors(graph.getParentContext(contextId)));
		}
		chain = Collections.unmodifiableList(result);
		chains.put(contextId, chain);
		return chain;
	}

	public boolean isAncestorOrSelf(String ancestorId, String contextId) {
		return ancestors(contextId).contains(ancestorId);
	}

	/**
	 * @return the innermost context enclosing (or equal to) every given context; the sheet if none are given
	 */
	public String leastCommonAncestor(Collection<String> contextIds) {
		Iterator<String> it = contextIds.iterator();
		if (!it.hasNext()) {
			return graph.getSheet();
		}
		List<String> first = ancestors(it.next());
		Set<String> common = new LinkedHashSet<>(first);
		while (it.hasNext()) {
			common.retainAll(ancestors(it.next()));
		}
		for (String candidate : first) {
			if (common.contains(candidate)) {
				return candidate;
			}
		}
		return graph.getSheet();
	}
}
