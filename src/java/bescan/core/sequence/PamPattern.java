package bescan.core.sequence;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Pattern;

import bescan.core.error.InvalidPamException;

/**
 * A protospacer adjacent motif compiled from an IUPAC string into a regular expression.
 * The pattern is matched against the bases immediately 3' of a guide on the guide's own strand.
 */
public final class PamPattern {

	private static final Map<Character, String> IUPAC_CODES;
	static {
		Map<Character, String> codes = new HashMap<Character, String>();
		codes.put(Character.valueOf('A'), "A");
		codes.put(Character.valueOf('C'), "C");
		codes.put(Character.valueOf('G'), "G");
		codes.put(Character.valueOf('T'), "T");
		codes.put(Character.valueOf('N'), "[ACGT]");
		codes.put(Character.valueOf('R'), "[AG]");
		codes.put(Character.valueOf('Y'), "[CT]");
		codes.put(Character.valueOf('S'), "[CG]");
		codes.put(Character.valueOf('W'), "[AT]");
		codes.put(Character.valueOf('K'), "[GT]");
		codes.put(Character.valueOf('M'), "[AC]");
		codes.put(Character.valueOf('B'), "[CGT]");
		codes.put(Character.valueOf('D'), "[AGT]");
		codes.put(Character.valueOf('H'), "[ACT]");
		codes.put(Character.valueOf('V'), "[ACG]");
		IUPAC_CODES = Collections.unmodifiableMap(codes);
	}

	private final String pam;
	private final Pattern pattern;

	private PamPattern(String pam, Pattern pattern) {
		this.pam = pam;
		this.pattern = pattern;
	}

	/**
	 * Compile a PAM specification
	 * @param pamSpec IUPAC string, e.g. NGG or NNGRRT, in either case
	 * @return The compiled PAM
	 * @throws InvalidPamException if the specification is null, empty or contains a non IUPAC character
	 */
	public static PamPattern compile(String pamSpec) {
		if(pamSpec == null || pamSpec.trim().isEmpty()) {
			throw new InvalidPamException("PAM must not be empty");
		}
		String pam = pamSpec.trim().toUpperCase();
		StringBuilder regex = new StringBuilder();
		for(int i = 0; i < pam.length(); i++) {
			String code = IUPAC_CODES.get(Character.valueOf(pam.charAt(i)));
			if(code == null) {
				throw new InvalidPamException("Invalid character '" + pamSpec.trim().charAt(i) + "' in PAM " + pamSpec);
			}
			regex.append(code);
		}
		return new PamPattern(pam, Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE));
	}

	/**
	 * @param pamSite Bases adjacent to a guide, on the guide strand
	 * @return True iff the site has the PAM's length and matches it
	 */
	public boolean matches(String pamSite) {
		if(pamSite == null || pamSite.length() != pam.length()) {
			return false;
		}
		return pattern.matcher(pamSite).matches();
	}

	public String getPam() {
		return pam;
	}

	public int length() {
		return pam.length();
	}

	public Pattern getPattern() {
		return pattern;
	}

	@Override
	public String toString() {
		return pam + "\t" + pattern.pattern();
	}

}
