package zedtex.lexer;

import zedtex.util.SourceLocatable;
import zedtex.util.SourceLocation;

public class ZToken extends SourceLocatable {

	private final String value;
	private final ZTokenType type;
	private final SourceLocation location;
	private final boolean spaceBefore;

	public ZToken(String value, ZTokenType type, SourceLocation location, boolean spaceBefore) {
		this.value = value;
		this.type = type;
		this.location = location;
		this.spaceBefore = spaceBefore;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	public String getValue() {
		return value;
	}

	public ZTokenType getType() {
		return type;
	}

	/**
	 * @return whether whitespace or the start of the line separates this token from the one before it
	 */
	public boolean hasSpaceBefore() {
		return spaceBefore;
	}

	public int getLine() {
		return location.getStartLine();
	}

	public int getColumn() {
		return location.getStartColumn();
	}

	/**
	 * @return the 1-based column just past the last character of the token
	 */
	public int getEndColumn() {
		return location.getEndColumn();
	}

	public boolean is(ZTokenType type, String value) {
		return this.type == type && this.value.equals(value);
	}

	/**
	 * @return a short description for error messages
	 */
	public String describe() {
		switch(type) {
			case EOF:
				return "end of input";
			case NEWLINE:
				return "end of line";
			case TEXT:
				return "text '" + value + "'";
			default:
				return "'" + value + "'";
		}
	}

	@Override
	public String toString() {
		return "ZToken [value=" + value + ", type=" + type + ", location=" + location + "]";
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((location == null) ? 0 : location.hashCode());
		result = prime * result + ((type == null) ? 0 : type.hashCode());
		result = prime * result + ((value == null) ? 0 : value.hashCode());
		result = prime * result + (spaceBefore ? 1231 : 1237);
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ZToken other = (ZToken) obj;
		if (location == null) {
			if (other.location != null)
				return false;
		} else if (!location.equals(other.location))
			return false;
		if (type != other.type)
			return false;
		if (spaceBefore != other.spaceBefore)
			return false;
		if (value == null) {
			return other.value == null;
		} else return value.equals(other.value);
	}

}
