package bescan.core.error;

/**
 * Base class of the validation failures raised while designing base editing guides.
 * Failures are deterministic and never retried.
 */
public class BaseEditingException extends RuntimeException {

	private static final long serialVersionUID = 3917205613740862631L;

	public BaseEditingException(String message) {
		super(message);
	}

}
