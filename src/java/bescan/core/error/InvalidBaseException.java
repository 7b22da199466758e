package bescan.core.error;

/**
 * A character outside A, C, G, T was found in sequence data
 */
public class InvalidBaseException extends BaseEditingException {

	private static final long serialVersionUID = 623637030800L;

	public InvalidBaseException(String message) {
		super(message);
	}

}
