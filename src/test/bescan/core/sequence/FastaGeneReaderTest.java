package bescan.core.sequence;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;

import bescan.core.error.EmptySequenceException;
import junit.framework.TestCase;

public class FastaGeneReaderTest extends TestCase {

	private File writeFasta(String content) throws IOException {
		File f = File.createTempFile("gene", ".fa");
		f.deleteOnExit();
		FileWriter w = new FileWriter(f);
		w.write(content);
		w.close();
		return f;
	}

	public void testUcscHeader() throws IOException {
		File f = writeFasta(">hg38_knownGene_X range=chr2:101-112 5'pad=0 3'pad=0 strand=- repeatMasking=none\nACGTac\ngtACGT\n");
		GeneRecord record = new FastaGeneReader().read(f, null);
		assertEquals("hg38_knownGene_X", record.getName());
		assertEquals("ACGTacgtACGT", record.getBases());
		assertEquals(Strand.MINUS, record.getStrand());
		assertTrue(record.hasRange());
		assertEquals("chr2", record.getChromosome());
		assertEquals(101, record.getRangeStart());
		assertEquals(112, record.getRangeEnd());
	}

	public void testPlainHeader() throws IOException {
		File f = writeFasta(">DNMT3A\nACGT\n\nacgt\n>second\nTTTT\n");
		GeneRecord record = new FastaGeneReader(50).read(f, "MyGene");
		assertEquals("MyGene", record.getName());
		assertEquals("ACGTacgt", record.getBases());
		assertEquals(Strand.PLUS, record.getStrand());
		assertFalse(record.hasRange());
		assertEquals(50, record.getOffset());
	}

	public void testNoSequence() throws IOException {
		File f = writeFasta(">empty\n\n");
		try {
			new FastaGeneReader().read(f, null);
			fail();
		} catch(EmptySequenceException e) {
			// expected
		}
	}

	public void testStrandWords() {
		assertEquals(Strand.MINUS, new FastaGeneReader().parseHeader("g strand=minus", null, "ACGT").getStrand());
		assertEquals(Strand.PLUS, new FastaGeneReader().parseHeader("g strand=+", null, "ACGT").getStrand());
	}

}
