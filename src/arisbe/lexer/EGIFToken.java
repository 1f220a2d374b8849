package arisbe.lexer;

import arisbe.util.SourceLocation;

import java.util.Objects;

public class EGIFToken {

	private final String value;
	private final EGIFTokenType type;
	private final SourceLocation location;

	public EGIFToken(String value, EGIFTokenType type, SourceLocation location) {
		this.value = value;
		this.type = type;
		this.location = location;
	}

	public SourceLocation getLocation() {
		return location;
	}

	public String getValue() {
		return value;
	}

	public EGIFTokenType getType() {
		return type;
	}

	@Override
	public String toString() {
		return "EGIFToken [value=" + value + ", type=" + type + ", offset=" + location.getStartOffset() + "]";
	}

	@Override
	public int hashCode() {
		return Objects.hash(value, type, location);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		EGIFToken other = (EGIFToken) obj;
		return type == other.type && Objects.equals(value, other.value) && Objects.equals(location, other.location);
	}

}
