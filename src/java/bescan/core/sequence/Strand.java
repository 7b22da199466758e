package bescan.core.sequence;

/**
 * Genomic strand of a gene, written as plus or minus in output tables
 */
public enum Strand {

	PLUS("plus", '+'),
	MINUS("minus", '-');

	private final String label;
	private final char symbol;

	private Strand(String label, char symbol) {
		this.label = label;
		this.symbol = symbol;
	}

	public String getLabel() {
		return label;
	}

	public char getSymbol() {
		return symbol;
	}

	/**
	 * @param s One of +, -, plus, minus (case insensitive)
	 * @return The strand
	 */
	public static Strand fromString(String s) {
		String t = s.trim();
		if(t.equals("+") || t.equalsIgnoreCase(PLUS.label)) return PLUS;
		if(t.equals("-") || t.equalsIgnoreCase(MINUS.label)) return MINUS;
		throw new IllegalArgumentException("Strand must be +, -, plus or minus. Is " + s);
	}

	@Override
	public String toString() {
		return label;
	}

}
