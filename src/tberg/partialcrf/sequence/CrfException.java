package tberg.partialcrf.sequence;

/**
 * Raised when inputs to the chain engine violate its contract. None of these
 * conditions are transient; the caller has to fix the inputs.
 */
public class CrfException extends RuntimeException {
	
	private static final long serialVersionUID = 1L;

	public static enum Kind {
		SHAPE_MISMATCH,
		ZERO_LENGTH_SEQUENCE,
		NON_CONTIGUOUS_MASK,
		EMPTY_CANDIDATE_SET,
		NUMERIC_OVERFLOW
	}
	
	private final Kind kind;
	
	public CrfException(Kind kind, String message) {
		super(message);
		this.kind = kind;
	}
	
	public Kind getKind() {
		return kind;
	}
	
	static CrfException shapeMismatch(String where, String format, Object... args) {
		return new CrfException(Kind.SHAPE_MISMATCH, "[" + where + "] " + String.format(format, args));
	}
	
}
