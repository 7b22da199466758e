package bescan.editing.guide;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.collections15.Predicate;
import org.apache.commons.collections15.iterators.FilterIterator;
import org.apache.log4j.Logger;

import bescan.core.sequence.PamPattern;
import bescan.editing.gene.GuideCandidate;
import bescan.editing.guide.predicate.EditableBaseInWindowPredicate;
import bescan.editing.guide.predicate.GuideCandidatePredicate;
import bescan.editing.guide.predicate.PamMatchPredicate;

/**
 * Filters applied to candidate guides before annotation
 */
public final class GuideFilters {

	static Logger logger = Logger.getLogger(GuideFilters.class.getName());

	private GuideFilters() {}

	/**
	 * @param candidate Candidate guide
	 * @param pamMatcher Compiled PAM
	 * @param pamSpec PAM string the matcher was compiled from, used in debug output
	 * @param edit Base edit
	 * @param window Editing window
	 * @return True iff the PAM site matches and the window holds an exonic copy of the edited base
	 */
	public static boolean filterGuide(GuideCandidate candidate, PamPattern pamMatcher, String pamSpec, EditPair edit, EditingWindow window) {
		if(candidate.getPamSite().length() != pamMatcher.length()) {
			logger.debug(candidate.toString() + "	no_room_for_" + pamSpec.trim());
			return false;
		}
		return new PamMatchPredicate(pamMatcher).evaluate(candidate) && new EditableBaseInWindowPredicate(edit, window).evaluate(candidate);
	}

	/**
	 * @param pamMatcher Compiled PAM
	 * @param edit Base edit
	 * @param window Editing window
	 * @return The predicates a guide must pass, PAM first
	 */
	public static List<GuideCandidatePredicate> defaultPredicates(PamPattern pamMatcher, EditPair edit, EditingWindow window) {
		List<GuideCandidatePredicate> rtrn = new ArrayList<GuideCandidatePredicate>();
		rtrn.add(new PamMatchPredicate(pamMatcher));
		rtrn.add(new EditableBaseInWindowPredicate(edit, window));
		return rtrn;
	}

	/**
	 * Lazily apply predicates to candidates and keep the survivors
	 * @param candidates Candidate guides of one strand
	 * @param predicates All must evaluate to true
	 * @return Surviving guides in candidate order
	 */
	public static List<GuideCandidate> filter(Iterable<GuideCandidate> candidates, final Collection<GuideCandidatePredicate> predicates) {
		Predicate<GuideCandidate> all = new Predicate<GuideCandidate>() {
			@Override
			public boolean evaluate(GuideCandidate g) {
				for(GuideCandidatePredicate p : predicates) {
					if(!p.evaluate(g)) {
						if(logger.isDebugEnabled()) {
							logger.debug(g.toString() + "\t" + p.getShortFailureMessage(g));
						}
						return false;
					}
				}
				return true;
			}
		};
		List<GuideCandidate> rtrn = new ArrayList<GuideCandidate>();
		Iterator<GuideCandidate> iter = new FilterIterator<GuideCandidate>(candidates.iterator(), all);
		while(iter.hasNext()) {
			rtrn.add(iter.next());
		}
		return rtrn;
	}

	/**
	 * Remove repeated guides from one strand's collection.
	 * Two guides are repeats if they share sequence and anchor.
	 * @param candidates Guides of one strand
	 * @return Guides with repeats removed, first occurrence kept in order
	 */
	public static List<GuideCandidate> filterRepeats(List<GuideCandidate> candidates) {
		Set<String> seen = new LinkedHashSet<String>();
		List<GuideCandidate> rtrn = new ArrayList<GuideCandidate>();
		for(GuideCandidate g : candidates) {
			if(seen.add(g.getSequence() + ":" + g.getAnchor())) {
				rtrn.add(g);
			}
		}
		if(rtrn.size() < candidates.size()) {
			logger.debug("Removed " + (candidates.size() - rtrn.size()) + " repeated guides");
		}
		return rtrn;
	}

}
