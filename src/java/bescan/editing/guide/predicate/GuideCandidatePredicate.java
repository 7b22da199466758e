package bescan.editing.guide.predicate;

import org.apache.commons.collections15.Predicate;

import bescan.editing.gene.GuideCandidate;

public interface GuideCandidatePredicate extends Predicate<GuideCandidate> {

	/**
	 * Get the name of this predicate
	 * @return Predicate name
	 */
	public String getPredicateName();

	/**
	 * Get a short explanation (no spaces) of why the predicate evaluates to false
	 * @param g The guide
	 * @return Short string explanation of false value
	 */
	public String getShortFailureMessage(GuideCandidate g);

}
