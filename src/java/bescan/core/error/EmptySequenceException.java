package bescan.core.error;

/**
 * The gene sequence is empty
 */
public class EmptySequenceException extends BaseEditingException {

	private static final long serialVersionUID = 935222531140L;

	public EmptySequenceException(String message) {
		super(message);
	}

}
