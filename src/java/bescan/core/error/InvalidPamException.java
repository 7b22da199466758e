package bescan.core.error;

/**
 * A PAM specification is empty or contains a character outside the IUPAC alphabet
 */
public class InvalidPamException extends BaseEditingException {

	private static final long serialVersionUID = 1008270462089L;

	public InvalidPamException(String message) {
		super(message);
	}

}
