package bescan.analysis;

/**
 * A named treatment versus control comparison, computed as treatment - control
 */
public final class ConditionComparison {

	private final String name;
	private final String treatment;
	private final String control;

	public ConditionComparison(String name, String treatment, String control) {
		this.name = name;
		this.treatment = treatment;
		this.control = control;
	}

	public String getName() {
		return name;
	}

	public String getTreatment() {
		return treatment;
	}

	public String getControl() {
		return control;
	}

	@Override
	public String toString() {
		return name + " = " + treatment + " - " + control;
	}

}
