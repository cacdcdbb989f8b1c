package typespec.util;

import java.util.Comparator;
import java.util.Objects;

/**
 * A span of a spec document. Lines and columns are 1-based, offsets are 0-based character
 * offsets into the whole document text, with the end offset exclusive.
 *
 * The unknown location has every field set to -1, sorts before every known location, and is the
 * identity of {@link #combine(SourceLocation)}.
 */
public class SourceLocation implements Comparable<SourceLocation> {

	private static final Comparator<SourceLocation> KNOWN_ORDER = Comparator
			.comparingInt(SourceLocation::getStartLine)
			.thenComparingInt(SourceLocation::getStartColumn)
			.thenComparingInt(SourceLocation::getStartOffset)
			.thenComparingInt(SourceLocation::getEndOffset);

	private static final SourceLocation UNKNOWN = new SourceLocation(-1, -1, -1, -1, -1, -1);

	private final int startOffset;
	private final int endOffset;
	private final int startLine;
	private final int endLine;
	private final int startColumn;
	private final int endColumn;

	public SourceLocation(int startOffset, int endOffset, int startLine, int endLine, int startColumn,
	                      int endColumn) {
		this.startOffset = startOffset;
		this.endOffset = endOffset;
		this.startLine = startLine;
		this.endLine = endLine;
		this.startColumn = startColumn;
		this.endColumn = endColumn;
	}

	public static SourceLocation unknown() {
		return UNKNOWN;
	}

	public boolean isUnknown() {
		return startLine < 0;
	}

	/**
	 * @return "line:column" of the start, or "?:?" when unknown
	 */
	public String prettyString() {
		return isUnknown() ? "?:?" : startLine + ":" + startColumn;
	}

	/**
	 * @return the smallest span covering both locations
	 */
	public SourceLocation combine(SourceLocation other) {
		if (isUnknown()) {
			return other;
		}
		if (other.isUnknown()) {
			return this;
		}
		SourceLocation first = startLine < other.startLine ||
				(startLine == other.startLine && startColumn <= other.startColumn) ? this : other;
		SourceLocation last = endLine > other.endLine ||
				(endLine == other.endLine && endColumn >= other.endColumn) ? this : other;
		return new SourceLocation(
				Math.min(startOffset, other.startOffset),
				Math.max(endOffset, other.endOffset),
				first.startLine,
				last.endLine,
				first.startColumn,
				last.endColumn);
	}

	public int getStartOffset() {
		return startOffset;
	}

	public int getEndOffset() {
		return endOffset;
	}

	public int getStartLine() {
		return startLine;
	}

	public int getEndLine() {
		return endLine;
	}

	public int getStartColumn() {
		return startColumn;
	}

	public int getEndColumn() {
		return endColumn;
	}

	@Override
	public int hashCode() {
		return Objects.hash(startOffset, endOffset, startLine, endLine, startColumn, endColumn);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		SourceLocation other = (SourceLocation) obj;
		return startOffset == other.startOffset && endOffset == other.endOffset &&
				startLine == other.startLine && endLine == other.endLine &&
				startColumn == other.startColumn && endColumn == other.endColumn;
	}

	@Override
	public String toString() {
		if (isUnknown()) {
			return "SourceLocation [UNKNOWN]";
		}
		return "SourceLocation [" + startLine + ":" + startColumn + "-" + endLine + ":" + endColumn +
				", offsets " + startOffset + "-" + endOffset + "]";
	}

	@Override
	public int compareTo(SourceLocation o) {
		if (isUnknown() || o.isUnknown()) {
			return Boolean.compare(!isUnknown(), !o.isUnknown());
		}
		return KNOWN_ORDER.compare(this, o);
	}
}
