package bescan.core.sequence;

import bescan.core.error.InvalidPamException;
import junit.framework.TestCase;

public class PamPatternTest extends TestCase {

	public void testNGG() {
		PamPattern pam = PamPattern.compile("NGG");
		assertEquals(3, pam.length());
		assertTrue(pam.matches("AGG"));
		assertTrue(pam.matches("tgg"));
		assertTrue(pam.matches("cGg"));
		assertFalse(pam.matches("AGC"));
		assertFalse(pam.matches("GG"));
		assertFalse(pam.matches("AGGG"));
		assertFalse(pam.matches(null));
	}

	public void testAmbiguityCodes() {
		PamPattern pam = PamPattern.compile("NNGRRT");
		assertTrue(pam.matches("ACGAGT"));
		assertTrue(pam.matches("TTGGAT"));
		assertFalse(pam.matches("ACGCGT"));
		assertFalse(pam.matches("ACGAGA"));
	}

	public void testLowerCaseSpec() {
		PamPattern pam = PamPattern.compile("nga");
		assertEquals("NGA", pam.getPam());
		assertTrue(pam.matches("CGA"));
	}

	public void testMalformed() {
		String[] bad = {null, "", "  ", "NGX", "NG-G", "N GG"};
		for(String spec : bad) {
			try {
				PamPattern.compile(spec);
				fail("Accepted PAM " + spec);
			} catch(InvalidPamException e) {
				// expected
			}
		}
	}

}
