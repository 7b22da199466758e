package bescan.editing.guide.predicate;

import bescan.core.sequence.PamPattern;
import bescan.editing.gene.GuideCandidate;

/**
 * Accepts guides whose 3' flanking bases on the guide strand match the PAM
 */
public class PamMatchPredicate implements GuideCandidatePredicate {

	private PamPattern pam;
	public String name = "PAM";

	public PamMatchPredicate(PamPattern pam) {
		this.pam = pam;
	}

	@Override
	public boolean evaluate(GuideCandidate g) {
		return pam.matches(g.getPamSite());
	}

	@Override
	public String getPredicateName() {
		return name;
	}

	@Override
	public String getShortFailureMessage(GuideCandidate g) {
		if(g.getPamSite().length() < pam.length()) {
			return "no_room_for_" + pam.getPam();
		}
		return g.getPamSite().toUpperCase() + "_is_not_" + pam.getPam();
	}

}
