package bescan.core.error;

/**
 * The edited base or the replacement base is not one of A, C, G, T
 */
public class InvalidEditPairException extends BaseEditingException {

	private static final long serialVersionUID = 133256328653L;

	public InvalidEditPairException(String message) {
		super(message);
	}

}
