package bescan.editing.guide;

import bescan.core.sequence.SequenceUtils;
import bescan.core.sequence.Strand;
import bescan.editing.gene.GuideCandidate;

/**
 * Turns a filtered candidate into a complete table row in one step
 */
public class GuideAnnotator {

	private final String geneName;
	private final Strand geneStrand;
	private final EditingWindow window;

	public GuideAnnotator(String geneName, Strand geneStrand, EditingWindow window) {
		this.geneName = geneName;
		this.geneStrand = geneStrand;
		this.window = window;
	}

	/**
	 * @param g Filtered candidate
	 * @return The annotated guide
	 */
	public AnnotatedGuide annotate(GuideCandidate g) {
		String coding = g.isSense() ? g.getSequence() : SequenceUtils.reverseComplement(g.getSequence());
		// Genomic positions of the window ends; antisense windows run from high to low and are kept that way
		int windowStart = g.isSense() ? g.getGenomicPosition() + window.getFirst() : g.getGenomicPosition() - window.getFirst();
		int windowEnd = g.isSense() ? g.getGenomicPosition() + window.getLast() : g.getGenomicPosition() - window.getLast();
		WindowOverlap overlap = g.isExonic(window.getFirst(), window.getLast()) ? WindowOverlap.EXON : WindowOverlap.EXON_INTRON;
		return new AnnotatedGuide(g.getSequence(), g.getStartingFrame(), g.getGenomicPosition(), g.getAnchor(), coding, g.getExonNumber(),
				g.getStrand(), geneStrand, windowStart, windowEnd, geneName, overlap);
	}

}
