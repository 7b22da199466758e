package bescan.editing.gene;

/**
 * Strand of a guide relative to the gene: sense guides read along the gene, antisense guides against it
 */
public enum GuideStrand {

	SENSE("sense"),
	ANTISENSE("antisense");

	private final String label;

	private GuideStrand(String label) {
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
