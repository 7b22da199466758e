package bescan.core.sequence;

import bescan.core.error.InvalidBaseException;

/**
 * Static helpers for nucleotide sequences over A, C, G, T.
 * Case is meaningful in gene records (exon vs intron) and is preserved base by base.
 */
public final class SequenceUtils {

	/**
	 * The accepted bases in upper case
	 */
	public static final String BASES = "ACGT";

	private SequenceUtils() {}

	/**
	 * @param c A character
	 * @return True iff the character is one of A, C, G, T in either case
	 */
	public static boolean isBase(char c) {
		return BASES.indexOf(Character.toUpperCase(c)) >= 0;
	}

	/**
	 * @param s A string
	 * @return True iff the string is exactly one base in upper or lower case
	 */
	public static boolean isSingleBase(String s) {
		return s != null && s.length() == 1 && isBase(s.charAt(0));
	}

	/**
	 * Complement a single base, keeping its case
	 * @param c The base
	 * @return The complementary base
	 * @throws InvalidBaseException if the character is not a base
	 */
	public static char complement(char c) {
		switch(c) {
		case 'A': return 'T';
		case 'T': return 'A';
		case 'C': return 'G';
		case 'G': return 'C';
		case 'a': return 't';
		case 't': return 'a';
		case 'c': return 'g';
		case 'g': return 'c';
		default:
			throw new InvalidBaseException("Not a valid base: '" + c + "'");
		}
	}

	/**
	 * @param seq Sequence bases
	 * @return The reverse complement, case preserved per base
	 * @throws InvalidBaseException if any character is not a base
	 */
	public static String reverseComplement(String seq) {
		StringBuilder rtrn = new StringBuilder(seq.length());
		for(int i = seq.length() - 1; i >= 0; i--) {
			rtrn.append(complement(seq.charAt(i)));
		}
		return rtrn.toString();
	}

	/**
	 * Check that every character of the sequence is a base
	 * @param seq Sequence bases
	 * @throws InvalidBaseException naming the first offending position
	 */
	public static void validateBases(String seq) {
		for(int i = 0; i < seq.length(); i++) {
			if(!isBase(seq.charAt(i))) {
				throw new InvalidBaseException("Not a valid base at position " + i + ": '" + seq.charAt(i) + "'");
			}
		}
	}

}
