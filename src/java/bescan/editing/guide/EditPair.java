package bescan.editing.guide;

import bescan.core.error.InvalidEditPairException;
import bescan.core.sequence.SequenceUtils;

/**
 * Single base substitution made by a base editor, e.g. C to T for a cytosine base editor
 */
public final class EditPair {

	private final char from;
	private final char to;

	private EditPair(char from, char to) {
		this.from = from;
		this.to = to;
	}

	/**
	 * @param from The base to be replaced
	 * @param to The base to replace it with
	 * @return The edit, bases in upper case
	 * @throws InvalidEditPairException if either string is not a single base
	 */
	public static EditPair of(String from, String to) {
		if(!SequenceUtils.isSingleBase(from)) {
			throw new InvalidEditPairException("Edit from must be one of A, C, G, T. Is " + from);
		}
		if(!SequenceUtils.isSingleBase(to)) {
			throw new InvalidEditPairException("Edit to must be one of A, C, G, T. Is " + to);
		}
		return new EditPair(Character.toUpperCase(from.charAt(0)), Character.toUpperCase(to.charAt(0)));
	}

	public char getFrom() {
		return from;
	}

	public char getTo() {
		return to;
	}

	@Override
	public boolean equals(Object o) {
		if(!(o instanceof EditPair)) return false;
		EditPair e = (EditPair)o;
		return from == e.from && to == e.to;
	}

	@Override
	public int hashCode() {
		return 31 * from + to;
	}

	@Override
	public String toString() {
		return from + ">" + to;
	}

}
