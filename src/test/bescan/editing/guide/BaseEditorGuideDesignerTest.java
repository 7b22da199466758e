package bescan.editing.guide;

import java.io.File;
import java.io.IOException;
import java.util.List;

import org.apache.commons.io.FileUtils;

import bescan.core.error.EmptySequenceException;
import bescan.core.error.InvalidEditPairException;
import bescan.core.error.InvalidPamException;
import bescan.core.error.InvalidWindowException;
import bescan.core.error.UnknownCasTypeException;
import bescan.core.sequence.GeneRecord;
import bescan.core.sequence.Strand;
import bescan.editing.gene.GuideStrand;
import junit.framework.TestCase;

public class BaseEditorGuideDesignerTest extends TestCase {

	private File dir;

	@Override
	protected void setUp() throws IOException {
		dir = new File(FileUtils.getTempDirectory(), "be_designer_test_" + System.nanoTime());
		FileUtils.forceMkdir(dir);
	}

	@Override
	protected void tearDown() throws IOException {
		FileUtils.deleteDirectory(dir);
	}

	private static GuideDesignConfiguration config(String casType, String pam, int windowStart, int windowEnd) {
		return new GuideDesignConfiguration(null, casType, pam, "A", "G", windowStart, windowEnd, 4, 100);
	}

	private File fasta(String text) throws IOException {
		File f = new File(dir, "gene.fa");
		FileUtils.writeStringToFile(f, text, "UTF-8");
		return f;
	}

	public void testDesignAndExport() throws Exception {
		File gene = fasta(">GENE1 some description\nTATCAGGTTTCC\nATCATGACAGGTT\n");
		File out = new File(dir, "guides.csv");
		BaseEditorGuideDesigner designer = new BaseEditorGuideDesigner(config(null, "GG", 0, 3));
		GuideTable table = designer.designAndExport(gene, out);
		assertEquals(PipelineState.EXPORTED, designer.getState());
		assertEquals("GG", designer.getPam().getPam());

		assertEquals(1, table.size());
		AnnotatedGuide g = table.get(0);
		assertEquals("GACA", g.getSgRNASequence());
		assertEquals(2, g.getStartingFrame());
		assertEquals(117, g.getChrPosition());
		assertEquals(17, g.getGenePosition());
		assertEquals("GENE1", g.getGeneName());

		List<String> lines = FileUtils.readLines(out, "UTF-8");
		assertEquals(2, lines.size());
		assertEquals(GuideTable.COLUMNS.length, lines.get(0).split(",").length);
		assertEquals("GACA,2,117,17,GACA,1,sense,plus,\"(117, 120)\",GENE1,Exon", lines.get(1));
	}

	public void testDesignInMemory() throws Exception {
		GeneRecord record = new GeneRecord("g", "CATCAGGTTaccAGGCCTGAtg", Strand.PLUS, 0);
		BaseEditorGuideDesigner designer = new BaseEditorGuideDesigner(config(null, "GG", 0, 3));
		GuideTable table = designer.design(record);
		assertEquals(PipelineState.DEDUPLICATED, designer.getState());
		assertEquals(3, table.size());
		assertEquals("ATCA", table.get(0).getSgRNASequence());
		assertEquals("accA", table.get(1).getSgRNASequence());
		assertEquals(WindowOverlap.EXON_INTRON, table.get(1).getWindowOverlap());
		AnnotatedGuide reverse = table.get(2);
		assertEquals(GuideStrand.ANTISENSE, reverse.getGuideStrand());
		assertEquals("aTCA", reverse.getSgRNASequence());
		assertEquals("TGAt", reverse.getCodingSequence());
		assertEquals(2, reverse.getExon());
		assertEquals("(20, 17)", reverse.getEditingWindowString());
	}

	public void testCasTypeResolvesPam() throws Exception {
		GeneRecord record = new GeneRecord("g", "CATCAGGTTaccAGGCCTGAtg", Strand.PLUS, 0);
		BaseEditorGuideDesigner designer = new BaseEditorGuideDesigner(config("SpCas9", null, 0, 2));
		GuideTable table = designer.design(record);
		assertEquals("NGG", designer.getPam().getPam());
		assertEquals(1, table.size());
		assertEquals("CATC", table.get(0).getSgRNASequence());
		assertEquals("(0, 2)", table.get(0).getEditingWindowString());
		assertEquals(WindowOverlap.EXON, table.get(0).getWindowOverlap());
	}

	public void testSharedCodingSequenceDroppedOnBothStrands() throws Exception {
		File gene = fasta(">hg38_test range=chr7:1001-1017 5'pad=0 3'pad=0 strand=- repeatMasking=none\nTATCAGGTTTCCATCAT\n");
		BaseEditorGuideDesigner designer = new BaseEditorGuideDesigner(config(null, "GG", 0, 3));
		GuideTable table = designer.designAndExport(gene, new File(dir, "out.csv"));
		// The sense and antisense guides share coding sequence ATCA
		assertTrue(table.isEmpty());
	}

	public void testRangeGenomicPositions() throws Exception {
		GeneRecord plus = new GeneRecord("g", "CATCAGGTTaccAGGCCTGAtg", Strand.PLUS, "chr1", 1001, 1022, 0);
		GuideTable table = new BaseEditorGuideDesigner(config(null, "GG", 0, 3)).design(plus);
		assertEquals(3, table.size());
		assertEquals(1002, table.get(0).getChrPosition());
		assertEquals("(1002, 1005)", table.get(0).getEditingWindowString());
		assertEquals(1021, table.get(2).getChrPosition());
		assertEquals("(1021, 1018)", table.get(2).getEditingWindowString());

		File gene = fasta(">hg38_test range=chr7:1001-1025 strand=-\nTATCAGGTTTCCATCATGACAGGTT\n");
		File out = new File(dir, "minus.csv");
		table = new BaseEditorGuideDesigner(config(null, "GG", 0, 3)).designAndExport(gene, out);
		assertEquals(1, table.size());
		AnnotatedGuide g = table.get(0);
		assertEquals(Strand.MINUS, g.getGeneStrand());
		assertEquals(17, g.getGenePosition());
		assertEquals(1008, g.getChrPosition());
		assertEquals("(1008, 1011)", g.getEditingWindowString());
		assertEquals("GACA,2,1008,17,GACA,1,sense,minus,\"(1008, 1011)\",hg38_test,Exon", FileUtils.readLines(out, "UTF-8").get(1));
	}

	public void testUnknownCasTypeFailsBeforeReadingGene() {
		File out = new File(dir, "guides.csv");
		BaseEditorGuideDesigner designer = new BaseEditorGuideDesigner(config("NotACas", null, 0, 3));
		try {
			designer.designAndExport(new File(dir, "missing.fa"), out);
			fail();
		} catch(GuideGenerationException e) {
			assertEquals(PipelineState.INIT, e.getState());
			assertTrue(e.getCause() instanceof UnknownCasTypeException);
		}
		assertEquals(PipelineState.INIT, designer.getState());
		assertFalse(out.exists());
	}

	public void testInvalidConfigurations() throws IOException {
		File gene = fasta(">g\nTATCAGGTTTCCATCAT\n");
		Object[][] cases = {
				{config(null, "GG", 8, 4), InvalidWindowException.class},
				{config(null, "GG", 0, 4), InvalidWindowException.class},
				{config(null, "NGX", 0, 3), InvalidPamException.class},
				{new GuideDesignConfiguration(null, null, "GG", "A", "AG", 0, 3, 4, 0), InvalidEditPairException.class}
		};
		for(Object[] c : cases) {
			File out = new File(dir, "guides.csv");
			try {
				new BaseEditorGuideDesigner((GuideDesignConfiguration)c[0]).designAndExport(gene, out);
				fail(c[0].toString());
			} catch(GuideGenerationException e) {
				assertEquals(PipelineState.INIT, e.getState());
				assertEquals(c[1], e.getCause().getClass());
			}
			assertFalse(out.exists());
		}
	}

	public void testEmptyGene() throws IOException {
		File gene = fasta(">g\n\n");
		try {
			new BaseEditorGuideDesigner(config(null, "GG", 0, 3)).designAndExport(gene, new File(dir, "guides.csv"));
			fail();
		} catch(GuideGenerationException e) {
			assertEquals(PipelineState.INIT, e.getState());
			assertTrue(e.getCause() instanceof EmptySequenceException);
		}
	}

	public void testRunsOnce() throws Exception {
		GeneRecord record = new GeneRecord("g", "ACGTacgtACGT", Strand.PLUS, 0);
		BaseEditorGuideDesigner designer = new BaseEditorGuideDesigner(config(null, "GG", 0, 3));
		assertTrue(designer.design(record).isEmpty());
		try {
			designer.design(record);
			fail();
		} catch(IllegalStateException e) {
			// expected
		}
	}

}
