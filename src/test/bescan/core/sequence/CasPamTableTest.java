package bescan.core.sequence;

import bescan.core.error.UnknownCasTypeException;
import junit.framework.TestCase;

public class CasPamTableTest extends TestCase {

	public void testLookup() {
		assertEquals("NGG", CasPamTable.resolve("SpCas9", null));
		assertEquals("NGN", CasPamTable.resolve("SpG", null));
		assertEquals("NNN", CasPamTable.resolve("SpRY", ""));
	}

	public void testExplicitPamTakesPrecedence() {
		assertEquals("NGA", CasPamTable.resolve("SpG", "NGA"));
		assertEquals("NNGRRT", CasPamTable.resolve("NotACas", "NNGRRT"));
	}

	public void testUnknownCasType() {
		try {
			CasPamTable.resolve("Cas42", null);
			fail();
		} catch(UnknownCasTypeException e) {
			assertTrue(e.getMessage().contains("SpG"));
		}
		try {
			CasPamTable.resolve(null, null);
			fail();
		} catch(UnknownCasTypeException e) {
			// expected
		}
	}

	public void testTableIsImmutable() {
		try {
			CasPamTable.getCasTypes().remove("Sp");
			fail();
		} catch(UnsupportedOperationException e) {
			// expected
		}
		assertTrue(CasPamTable.isKnownCasType("Sp"));
	}

}
