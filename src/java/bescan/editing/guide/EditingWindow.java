package bescan.editing.guide;

import bescan.core.error.InvalidWindowException;

/**
 * Inclusive range of 0-based guide positions where the base editor is active
 */
public final class EditingWindow {

	/**
	 * Fourth to eighth guide base
	 */
	public static final EditingWindow DEFAULT = new EditingWindow(4, 8);

	private final int first;
	private final int last;

	/**
	 * @param first First editable guide position
	 * @param last Last editable guide position
	 * @throws InvalidWindowException if first is negative or last is before first
	 */
	public EditingWindow(int first, int last) {
		if(first < 0) {
			throw new InvalidWindowException("Editing window start must not be negative. Is " + first);
		}
		if(last < first) {
			throw new InvalidWindowException("Editing window end " + last + " is before start " + first);
		}
		this.first = first;
		this.last = last;
	}

	/**
	 * @param guideLength Guide length
	 * @throws InvalidWindowException if the window does not fit in the guide
	 */
	public void validateFits(int guideLength) {
		if(last >= guideLength) {
			throw new InvalidWindowException("Editing window (" + first + ", " + last + ") does not fit in a guide of length " + guideLength);
		}
	}

	public int getFirst() {
		return first;
	}

	public int getLast() {
		return last;
	}

	public int size() {
		return last - first + 1;
	}

	@Override
	public boolean equals(Object o) {
		if(!(o instanceof EditingWindow)) return false;
		EditingWindow w = (EditingWindow)o;
		return first == w.first && last == w.last;
	}

	@Override
	public int hashCode() {
		return 31 * first + last;
	}

	@Override
	public String toString() {
		return "(" + first + ", " + last + ")";
	}

}
