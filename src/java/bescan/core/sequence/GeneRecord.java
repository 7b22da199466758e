package bescan.core.sequence;

/**
 * A gene sequence as loaded from a FASTA file: exons in upper case, introns in lower case,
 * oriented 5' to 3' along the gene.
 * The genomic range, when known, is 1-based and inclusive as in UCSC "Get DNA" headers.
 */
public class GeneRecord {

	private final String name;
	private final String bases;
	private final Strand strand;
	private final String chromosome;
	private final int rangeStart;
	private final int rangeEnd;
	private final int offset;

	/**
	 * Gene record without a genomic range. Genomic positions are gene positions plus the offset.
	 * @param name Gene name
	 * @param bases Case encoded bases
	 * @param strand Gene strand
	 * @param offset Added to gene positions to obtain genomic positions
	 */
	public GeneRecord(String name, String bases, Strand strand, int offset) {
		this(name, bases, strand, null, -1, -1, offset);
	}

	/**
	 * @param name Gene name
	 * @param bases Case encoded bases
	 * @param strand Gene strand
	 * @param chromosome Chromosome or null if the range is unknown
	 * @param rangeStart First genomic position, -1 if unknown
	 * @param rangeEnd Last genomic position, -1 if unknown
	 * @param offset Used only when the range is unknown
	 */
	public GeneRecord(String name, String bases, Strand strand, String chromosome, int rangeStart, int rangeEnd, int offset) {
		if(rangeStart > rangeEnd) {
			throw new IllegalArgumentException("Range start " + rangeStart + " is after range end " + rangeEnd);
		}
		this.name = name;
		this.bases = bases;
		this.strand = strand;
		this.chromosome = chromosome;
		this.rangeStart = rangeStart;
		this.rangeEnd = rangeEnd;
		this.offset = offset;
	}

	public String getName() {
		return name;
	}

	public String getBases() {
		return bases;
	}

	public int length() {
		return bases.length();
	}

	public Strand getStrand() {
		return strand;
	}

	public String getChromosome() {
		return chromosome;
	}

	public boolean hasRange() {
		return chromosome != null && rangeStart >= 0;
	}

	public int getRangeStart() {
		return rangeStart;
	}

	public int getRangeEnd() {
		return rangeEnd;
	}

	public int getOffset() {
		return offset;
	}

	@Override
	public String toString() {
		String location = hasRange() ? chromosome + ":" + rangeStart + "-" + rangeEnd : "offset=" + offset;
		return name + "\t" + location + "\t" + strand.getLabel() + "\t" + bases.length() + "bp";
	}

}
