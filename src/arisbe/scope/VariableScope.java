package arisbe.scope;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 *
 * Variable names in EGIF text, one shadow stack per name. A defining occurrence pushes a binding; closing the
 * context it was made in pops it again, uncovering whatever binding of the same name the context was hiding.
 *
 * Names are not checked here: whether a definition is a duplicate or a reference is in scope is for the caller
 * to decide, using {@link #isDefinedInArea}, {@link #lookup} and {@link #lookupClosed}.
 *
 */
public class VariableScope {
	private final Map<String, Deque<Binding>> stacks;
	private final Map<String, Set<String>> namesByContext;
	private final Map<String, Binding> closed;

	public VariableScope() {
		this.stacks = new HashMap<>();
		this.namesByContext = new HashMap<>();
		this.closed = new HashMap<>();
	}

	public boolean isDefinedInArea(String name, String contextId) {
		return namesByContext.getOrDefault(contextId, Collections.emptySet()).contains(name);
	}

	public Binding define(String name, String contextId, String vertexId) {
		Binding binding = new Binding(name, contextId, vertexId);
		stacks.computeIfAbsent(name, ignored -> new ArrayDeque<>()).push(binding);
		namesByContext.computeIfAbsent(contextId, ignored -> new LinkedHashSet<>()).add(name);
		return binding;
	}

	/**
	 * @return the innermost binding of the name that is still open, or null
	 */
	public Binding lookup(String name) {
		Deque<Binding> stack = stacks.get(name);
		if (stack == null) {
			return null;
		}
		return stack.peek();
	}

	/**
	 * @return the most recent binding of the name that was popped by {@link #close}, or null
	 */
	public Binding lookupClosed(String name) {
		return closed.get(name);
	}

	/**
	 * Pops every binding made in the context. Called once, when the context ends.
	 */
	public void close(String contextId) {
		Set<String> names = namesByContext.remove(contextId);
		if (names == null) {
			return;
		}
		for (String name : names) {
			Deque<Binding> stack = stacks.get(name);
			while (!stack.isEmpty() && stack.peek().getContextId().equals(contextId)) {
				closed.put(name, stack.pop());
			}
			if (stack.isEmpty()) {
				stacks.remove(name);
			}
		}
	}
}
