package arisbe.transform;

/**
 * Peirce's transformation rules for existential graphs, in the form Dau gives them for relational graphs with
 * cuts. Each rule knows the name it goes by on the command line and how many positions it takes there.
 */
public enum TransformationRule {
	ERASURE("erase", 1, 1),
	INSERTION("insert", 1, 1),
	ITERATION("iterate", 2, 2),
	DEITERATION("deiterate", 1, 1),
	DOUBLE_CUT_ADDITION("add-double-cut", 1, Integer.MAX_VALUE),
	DOUBLE_CUT_REMOVAL("remove-double-cut", 1, 1),
	ISOLATED_VERTEX_ADDITION("add-vertex", 1, 1),
	ISOLATED_VERTEX_REMOVAL("remove-vertex", 1, 1);

	private final String commandName;
	private final int minTargets;
	private final int maxTargets;

	TransformationRule(String commandName, int minTargets, int maxTargets) {
		this.commandName = commandName;
		this.minTargets = minTargets;
		this.maxTargets = maxTargets;
	}

	public String getCommandName() {
		return commandName;
	}

	public int getMinTargets() {
		return minTargets;
	}

	public int getMaxTargets() {
		return maxTargets;
	}

	/**
	 * @return the rule's name for messages, such as "double cut addition"
	 */
	public String getDescription() {
		return name().toLowerCase().replace('_', ' ');
	}

	/**
	 * @return the rule with this command name, or null if there is none
	 */
	public static TransformationRule fromCommandName(String commandName) {
		for (TransformationRule rule : values()) {
			if (rule.commandName.equals(commandName)) {
				return rule;
			}
		}
		return null;
	}
}
