package bescan.editing.guide;

/**
 * Stages of guide generation, in the only order in which they can be reached
 */
public enum PipelineState {

	INIT,
	GENE_PARSED,
	GUIDES_ENUMERATED,
	GUIDES_FILTERED,
	DEDUPLICATED,
	EXPORTED;

	/**
	 * @return The state that must follow this one
	 */
	public PipelineState next() {
		if(this == EXPORTED) {
			throw new IllegalStateException("No state after " + EXPORTED);
		}
		return values()[ordinal() + 1];
	}

}
