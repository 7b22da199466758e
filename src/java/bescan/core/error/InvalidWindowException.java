package bescan.core.error;

/**
 * Editing window bounds are negative, out of order or longer than the guide
 */
public class InvalidWindowException extends BaseEditingException {

	private static final long serialVersionUID = 56362940591L;

	public InvalidWindowException(String message) {
		super(message);
	}

}
