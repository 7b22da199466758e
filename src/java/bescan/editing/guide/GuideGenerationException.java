package bescan.editing.guide;

/**
 * Guide generation was aborted. The cause holds the typed failure
 * and the state tells how far the run got.
 */
public class GuideGenerationException extends Exception {

	private static final long serialVersionUID = -6268133091958452917L;

	private final PipelineState state;

	public GuideGenerationException(PipelineState state, Throwable cause) {
		super("Guide generation failed in state " + state + ": " + cause.getMessage(), cause);
		this.state = state;
	}

	/**
	 * @return The state the pipeline was in when it failed
	 */
	public PipelineState getState() {
		return state;
	}

}
