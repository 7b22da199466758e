package bescan.editing.gene;

import java.util.Arrays;

/**
 * A fixed length window of a gene considered as a base editing guide.
 * The sequence is read 5' to 3' on the guide's own strand, so for antisense guides it is
 * the reverse complement of the gene window. The anchor is the first gene position of a
 * sense guide and the last gene position of an antisense guide, i.e. always the gene position
 * of the guide's 5' base.
 */
public final class GuideCandidate {

	private final String sequence;
	private final String pamSite;
	private final GuideStrand strand;
	private final int startingFrame;
	private final int anchor;
	private final int genomicPosition;
	private final int exonNumber;
	private final boolean[] exonic;

	/**
	 * @param sequence Guide bases in guide orientation, case preserved
	 * @param pamSite Bases 3' of the guide on the guide strand, shorter than the PAM at the gene ends
	 * @param strand Guide strand
	 * @param startingFrame Coding frame of the anchor base, {@link TargetGene#NO_FRAME} if intronic
	 * @param anchor Gene position of the guide's 5' base
	 * @param genomicPosition Genomic position of the anchor
	 * @param exonNumber Exon number at the anchor
	 * @param exonic Exon membership of each guide position, in guide orientation
	 */
	public GuideCandidate(String sequence, String pamSite, GuideStrand strand, int startingFrame, int anchor, int genomicPosition, int exonNumber, boolean[] exonic) {
		if(exonic.length != sequence.length()) {
			throw new IllegalArgumentException("Need one exon flag per guide base");
		}
		this.sequence = sequence;
		this.pamSite = pamSite;
		this.strand = strand;
		this.startingFrame = startingFrame;
		this.anchor = anchor;
		this.genomicPosition = genomicPosition;
		this.exonNumber = exonNumber;
		this.exonic = Arrays.copyOf(exonic, exonic.length);
	}

	public String getSequence() {
		return sequence;
	}

	public int length() {
		return sequence.length();
	}

	public String getPamSite() {
		return pamSite;
	}

	public GuideStrand getStrand() {
		return strand;
	}

	public boolean isSense() {
		return strand == GuideStrand.SENSE;
	}

	public int getStartingFrame() {
		return startingFrame;
	}

	public int getAnchor() {
		return anchor;
	}

	public int getGenomicPosition() {
		return genomicPosition;
	}

	public int getExonNumber() {
		return exonNumber;
	}

	/**
	 * @param guidePosition 0-based position in the guide
	 * @return Whether the gene base under this guide position is exonic
	 */
	public boolean isExonic(int guidePosition) {
		return exonic[guidePosition];
	}

	/**
	 * @param first First guide position, inclusive
	 * @param last Last guide position, inclusive
	 * @return True iff every base in the range is exonic
	 */
	public boolean isExonic(int first, int last) {
		for(int i = first; i <= last; i++) {
			if(!exonic[i]) return false;
		}
		return true;
	}

	/**
	 * @param guidePosition 0-based position in the guide
	 * @return The gene position under this guide position
	 */
	public int getGenePosition(int guidePosition) {
		return isSense() ? anchor + guidePosition : anchor - guidePosition;
	}

	@Override
	public boolean equals(Object o) {
		if(!(o instanceof GuideCandidate)) return false;
		GuideCandidate g = (GuideCandidate)o;
		return sequence.equals(g.sequence) && anchor == g.anchor && strand == g.strand;
	}

	@Override
	public int hashCode() {
		return (sequence + ":" + anchor + ":" + strand).hashCode();
	}

	@Override
	public String toString() {
		return sequence + "\t" + pamSite + "\t" + strand.getLabel() + "\t" + startingFrame + "\t" + anchor + "\t" + exonNumber;
	}

}
