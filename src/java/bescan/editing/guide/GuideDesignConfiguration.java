package bescan.editing.guide;

/**
 * Settings of one guide design run, as given by the user.
 * Values are not checked here; {@link BaseEditorGuideDesigner} validates them before touching the gene.
 */
public final class GuideDesignConfiguration {

	/**
	 * Protospacer length of the supported Cas9 variants
	 */
	public static final int DEFAULT_GUIDE_LENGTH = 20;

	private final String geneName;
	private final String casType;
	private final String pam;
	private final String editFrom;
	private final String editTo;
	private final int windowStart;
	private final int windowEnd;
	private final int guideLength;
	private final int genomicOffset;

	/**
	 * Configuration with the default window and guide length
	 * @param geneName Gene name written to every row, or null to use the FASTA record id
	 * @param casType Cas type, used when pam is null
	 * @param pam Explicit PAM or null
	 * @param editFrom Base to be replaced
	 * @param editTo Replacement base
	 */
	public GuideDesignConfiguration(String geneName, String casType, String pam, String editFrom, String editTo) {
		this(geneName, casType, pam, editFrom, editTo, EditingWindow.DEFAULT.getFirst(), EditingWindow.DEFAULT.getLast(), DEFAULT_GUIDE_LENGTH, 0);
	}

	/**
	 * @param geneName Gene name written to every row, or null to use the FASTA record id
	 * @param casType Cas type, used when pam is null
	 * @param pam Explicit PAM or null
	 * @param editFrom Base to be replaced
	 * @param editTo Replacement base
	 * @param windowStart First editable guide position, 0-based
	 * @param windowEnd Last editable guide position, inclusive
	 * @param guideLength Guide length
	 * @param genomicOffset Offset from gene to genomic positions when the gene record has no range
	 */
	public GuideDesignConfiguration(String geneName, String casType, String pam, String editFrom, String editTo, int windowStart, int windowEnd, int guideLength, int genomicOffset) {
		this.geneName = geneName;
		this.casType = casType;
		this.pam = pam;
		this.editFrom = editFrom;
		this.editTo = editTo;
		this.windowStart = windowStart;
		this.windowEnd = windowEnd;
		this.guideLength = guideLength;
		this.genomicOffset = genomicOffset;
	}

	public String getGeneName() {
		return geneName;
	}

	public String getCasType() {
		return casType;
	}

	public String getPam() {
		return pam;
	}

	public String getEditFrom() {
		return editFrom;
	}

	public String getEditTo() {
		return editTo;
	}

	public int getWindowStart() {
		return windowStart;
	}

	public int getWindowEnd() {
		return windowEnd;
	}

	public int getGuideLength() {
		return guideLength;
	}

	public int getGenomicOffset() {
		return genomicOffset;
	}

	@Override
	public String toString() {
		return "gene=" + geneName + " cas_type=" + casType + " PAM=" + pam + " edit=" + editFrom + ">" + editTo
				+ " window=(" + windowStart + ", " + windowEnd + ") guide_length=" + guideLength;
	}

}
