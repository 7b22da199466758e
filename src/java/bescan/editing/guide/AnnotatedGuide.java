package bescan.editing.guide;

import bescan.core.sequence.Strand;
import bescan.editing.gene.GuideStrand;

/**
 * One row of the guide table
 */
public final class AnnotatedGuide {

	private final String sgRNASequence;
	private final int startingFrame;
	private final int chrPosition;
	private final int genePosition;
	private final String codingSequence;
	private final int exon;
	private final GuideStrand guideStrand;
	private final Strand geneStrand;
	private final int windowStart;
	private final int windowEnd;
	private final String geneName;
	private final WindowOverlap windowOverlap;

	/**
	 * @param sgRNASequence Guide sequence on the guide strand
	 * @param startingFrame Frame of the anchor base
	 * @param chrPosition Genomic position of the anchor
	 * @param genePosition Gene position of the anchor
	 * @param codingSequence Guide bases on the sense strand
	 * @param exon Exon number at the anchor
	 * @param guideStrand Guide strand
	 * @param geneStrand Gene strand
	 * @param windowStart Genomic position of the first editing window base
	 * @param windowEnd Genomic position of the last editing window base
	 * @param geneName Gene name
	 * @param windowOverlap Editing window overlap with the gene structure
	 */
	public AnnotatedGuide(String sgRNASequence, int startingFrame, int chrPosition, int genePosition, String codingSequence, int exon,
			GuideStrand guideStrand, Strand geneStrand, int windowStart, int windowEnd, String geneName, WindowOverlap windowOverlap) {
		this.sgRNASequence = sgRNASequence;
		this.startingFrame = startingFrame;
		this.chrPosition = chrPosition;
		this.genePosition = genePosition;
		this.codingSequence = codingSequence;
		this.exon = exon;
		this.guideStrand = guideStrand;
		this.geneStrand = geneStrand;
		this.windowStart = windowStart;
		this.windowEnd = windowEnd;
		this.geneName = geneName;
		this.windowOverlap = windowOverlap;
	}

	public String getSgRNASequence() {
		return sgRNASequence;
	}

	public int getStartingFrame() {
		return startingFrame;
	}

	public int getChrPosition() {
		return chrPosition;
	}

	public int getGenePosition() {
		return genePosition;
	}

	public String getCodingSequence() {
		return codingSequence;
	}

	public int getExon() {
		return exon;
	}

	public GuideStrand getGuideStrand() {
		return guideStrand;
	}

	public Strand getGeneStrand() {
		return geneStrand;
	}

	/**
	 * Genomic position of guide position w0, counted from chr_pos. For antisense guides this is the higher end of the window.
	 */
	public int getWindowStart() {
		return windowStart;
	}

	/**
	 * Genomic position of guide position w1, counted from chr_pos. For antisense guides this is the lower end of the window.
	 */
	public int getWindowEnd() {
		return windowEnd;
	}

	public String getEditingWindowString() {
		return "(" + windowStart + ", " + windowEnd + ")";
	}

	public String getGeneName() {
		return geneName;
	}

	public WindowOverlap getWindowOverlap() {
		return windowOverlap;
	}

	@Override
	public String toString() {
		return sgRNASequence + "\t" + startingFrame + "\t" + chrPosition + "\t" + genePosition + "\t" + codingSequence + "\t" + exon + "\t"
				+ guideStrand + "\t" + geneStrand + "\t" + getEditingWindowString() + "\t" + geneName + "\t" + windowOverlap;
	}

}
