package bescan.editing.gene;

/**
 * A maximal run of exonic or intronic bases of a gene.
 * Positions are gene positions; start is inclusive and end is exclusive.
 */
public final class GeneSegment {

	private final SegmentKind kind;
	private final int start;
	private final int end;
	private final int exonNumber;
	private final String bases;

	/**
	 * @param kind Exon or intron
	 * @param start First gene position
	 * @param end Position after the last gene position
	 * @param exonNumber Number of this exon, or of the preceding exon for an intron (0 before the first exon)
	 * @param bases Bases of the segment as they appear in the gene record
	 */
	public GeneSegment(SegmentKind kind, int start, int end, int exonNumber, String bases) {
		if(end <= start) {
			throw new IllegalArgumentException("Segment end " + end + " must be after start " + start);
		}
		if(bases.length() != end - start) {
			throw new IllegalArgumentException("Segment bases must have length " + (end - start));
		}
		this.kind = kind;
		this.start = start;
		this.end = end;
		this.exonNumber = exonNumber;
		this.bases = bases;
	}

	public SegmentKind getKind() {
		return kind;
	}

	public boolean isExon() {
		return kind == SegmentKind.EXON;
	}

	public int getStart() {
		return start;
	}

	public int getEnd() {
		return end;
	}

	public int length() {
		return end - start;
	}

	public int getExonNumber() {
		return exonNumber;
	}

	public String getBases() {
		return bases;
	}

	public boolean contains(int genePosition) {
		return genePosition >= start && genePosition < end;
	}

	@Override
	public String toString() {
		return kind + "\t" + start + "\t" + end + "\t" + exonNumber;
	}

}
