package arisbe;

import org.json.JSONException;
import org.json.JSONObject;

// Output settings read from the "output" section of the JSON configuration file.
// Every field is optional; command line flags override whatever is set here.
public class ArisbeOutputOptions {
	public static final String OUTPUT_FIELD = "output";
	public static final String CANONICAL_FIELD = "canonical";
	public static final String SUMMARY_FIELD = "summary";
	public static final String DEST_FILE_FIELD = "dest_file";

	public enum SummaryFormat {
		NONE("none"),
		TEXT("text"),
		JSON("json");

		private final String configName;

		SummaryFormat(String configName) {
			this.configName = configName;
		}

		public String getConfigName() {
			return configName;
		}

		public static SummaryFormat fromConfigName(String name) throws ArisbeOptionException {
			for (SummaryFormat format : values()) {
				if (format.configName.equals(name)) {
					return format;
				}
			}
			throw new ArisbeOptionException("unknown summary format \"" + name + "\" (expected none, text or json)");
		}
	}

	// print the canonical EGIF text of every graph read
	private boolean canonical;
	private SummaryFormat summary;
	private String destFile;

	public ArisbeOutputOptions() {
		this.canonical = true;
		this.summary = SummaryFormat.NONE;
		this.destFile = null;
	}

	public ArisbeOutputOptions(JSONObject config) throws ArisbeOptionException {
		this();
		if (!config.has(OUTPUT_FIELD)) {
			return;
		}
		try {
			JSONObject output = config.getJSONObject(OUTPUT_FIELD);
			if (output.has(CANONICAL_FIELD)) {
				canonical = output.getBoolean(CANONICAL_FIELD);
			}
			if (output.has(SUMMARY_FIELD)) {
				summary = SummaryFormat.fromConfigName(output.getString(SUMMARY_FIELD));
			}
			if (output.has(DEST_FILE_FIELD)) {
				destFile = output.getString(DEST_FILE_FIELD);
			}
		} catch (JSONException e) {
			throw new ArisbeOptionException("invalid \"" + OUTPUT_FIELD + "\" section: " + e.getMessage());
		}
	}

	public boolean isCanonical() {
		return canonical;
	}

	public SummaryFormat getSummary() {
		return summary;
	}

	public void setSummary(SummaryFormat summary) {
		this.summary = summary;
	}

	/**
	 * @return the file canonical output goes to, or null for standard output
	 */
	public String getDestFile() {
		return destFile;
	}

	public void setDestFile(String destFile) {
		this.destFile = destFile;
	}
}
