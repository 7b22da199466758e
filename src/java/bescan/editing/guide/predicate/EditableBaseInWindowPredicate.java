package bescan.editing.guide.predicate;

import bescan.editing.gene.GuideCandidate;
import bescan.editing.guide.EditPair;
import bescan.editing.guide.EditingWindow;

/**
 * Accepts guides with at least one exonic copy of the edited base inside the editing window.
 * Bases are compared on the guide strand. Intronic bases are never counted as targets.
 */
public class EditableBaseInWindowPredicate implements GuideCandidatePredicate {

	private EditPair edit;
	private EditingWindow window;
	public String name = "EditInWindow";

	public EditableBaseInWindowPredicate(EditPair edit, EditingWindow window) {
		this.edit = edit;
		this.window = window;
	}

	@Override
	public boolean evaluate(GuideCandidate g) {
		String seq = g.getSequence();
		int last = Math.min(window.getLast(), seq.length() - 1);
		for(int i = window.getFirst(); i <= last; i++) {
			if(g.isExonic(i) && Character.toUpperCase(seq.charAt(i)) == edit.getFrom()) {
				return true;
			}
		}
		return false;
	}

	@Override
	public String getPredicateName() {
		return name;
	}

	@Override
	public String getShortFailureMessage(GuideCandidate g) {
		return "no_exonic_" + edit.getFrom() + "_in_window_" + window.getFirst() + "_" + window.getLast();
	}

}
