package bescan.core.error;

/**
 * The Cas type is not in the PAM table and no explicit PAM was given
 */
public class UnknownCasTypeException extends BaseEditingException {

	private static final long serialVersionUID = 708113155592L;

	public UnknownCasTypeException(String message) {
		super(message);
	}

}
