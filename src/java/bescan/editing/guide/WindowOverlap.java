package bescan.editing.guide;

/**
 * Where the editing window of a guide sits relative to the gene structure
 */
public enum WindowOverlap {

	EXON("Exon"),
	EXON_INTRON("Exon/Intron");

	private final String label;

	private WindowOverlap(String label) {
		this.label = label;
	}

	public String getLabel() {
		return label;
	}

	@Override
	public String toString() {
		return label;
	}

}
