package bescan.editing.gene;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import bescan.core.error.EmptySequenceException;
import bescan.core.error.InvalidBaseException;
import bescan.core.sequence.GeneRecord;
import bescan.core.sequence.Strand;
import bescan.editing.gene.TargetGene.CandidateGuides;
import junit.framework.TestCase;

public class TargetGeneTest extends TestCase {

	private static TargetGene gene(String bases) {
		TargetGene g = new TargetGene(new GeneRecord("test", bases, Strand.PLUS, 0));
		g.parseExons();
		g.extractMetadata();
		return g;
	}

	private static List<GuideCandidate> toList(Iterable<GuideCandidate> guides) {
		List<GuideCandidate> rtrn = new ArrayList<GuideCandidate>();
		for(GuideCandidate g : guides) rtrn.add(g);
		return rtrn;
	}

	public void testParseExons() {
		TargetGene g = new TargetGene(new GeneRecord("test", "ACGTacgtACGT", Strand.PLUS, 0));
		List<GeneSegment> segments = g.parseExons();
		assertEquals(3, segments.size());
		assertEquals(SegmentKind.EXON, segments.get(0).getKind());
		assertEquals(0, segments.get(0).getStart());
		assertEquals(4, segments.get(0).getEnd());
		assertEquals(1, segments.get(0).getExonNumber());
		assertEquals(SegmentKind.INTRON, segments.get(1).getKind());
		assertEquals(1, segments.get(1).getExonNumber());
		assertEquals(SegmentKind.EXON, segments.get(2).getKind());
		assertEquals(8, segments.get(2).getStart());
		assertEquals(12, segments.get(2).getEnd());
		assertEquals(2, segments.get(2).getExonNumber());
	}

	public void testSegmentsReproduceSequence() {
		String[] genes = {"ACGTacgtACGT", "a", "T", "acGTTtgA", "CATCAGGTTaccAGGCCTGAtg", "ggggCCCC"};
		for(String bases : genes) {
			StringBuilder sb = new StringBuilder();
			for(GeneSegment s : new TargetGene(new GeneRecord("test", bases, Strand.PLUS, 0)).parseExons()) {
				sb.append(s.getBases());
			}
			assertEquals(bases, sb.toString());
		}
	}

	public void testLeadingIntronHasNoExonNumber() {
		TargetGene g = gene("acGTtt");
		assertEquals(0, g.getExonNumber(0));
		assertEquals(1, g.getExonNumber(2));
		assertEquals(1, g.getExonNumber(5));
		assertEquals(1, g.getNumExons());
	}

	public void testFramesSkipIntrons() {
		TargetGene g = gene("ACGTacgtACGT");
		int[] expected = {0, 1, 2, 0, -1, -1, -1, -1, 1, 2, 0, 1};
		for(int i = 0; i < expected.length; i++) {
			assertEquals("frame at " + i, expected[i], g.getFrame(i));
		}
		for(int i = 1; i < g.length(); i++) {
			assertTrue(g.getExonNumber(i) >= g.getExonNumber(i - 1));
		}
		assertFalse(g.isExonic(4));
		assertTrue(g.isExonic(8));
	}

	public void testGenomicPositions() {
		TargetGene offset = new TargetGene(new GeneRecord("test", "ACGTacgt", Strand.PLUS, 100));
		offset.extractMetadata();
		assertEquals(100, offset.getGenomicPosition(0));
		assertEquals(107, offset.getGenomicPosition(7));

		TargetGene plus = new TargetGene(new GeneRecord("test", "ACGTacgt", Strand.PLUS, "chr1", 1001, 1008, 0));
		plus.extractMetadata();
		assertEquals(1001, plus.getGenomicPosition(0));
		assertEquals(1008, plus.getGenomicPosition(7));

		TargetGene minus = new TargetGene(new GeneRecord("test", "ACGTacgt", Strand.MINUS, "chr1", 1001, 1008, 0));
		minus.extractMetadata();
		assertEquals(1008, minus.getGenomicPosition(0));
		assertEquals(1001, minus.getGenomicPosition(7));
	}

	public void testEmptyAndInvalid() {
		try {
			new TargetGene(new GeneRecord("test", "", Strand.PLUS, 0)).parseExons();
			fail();
		} catch(EmptySequenceException e) {
			// expected
		}
		try {
			new TargetGene(new GeneRecord("test", "ACGNNacgt", Strand.PLUS, 0)).parseExons();
			fail();
		} catch(InvalidBaseException e) {
			// expected
		}
	}

	public void testEnumerationNeedsMetadata() {
		TargetGene g = new TargetGene(new GeneRecord("test", "ACGTacgtACGT", Strand.PLUS, 0));
		g.parseExons();
		try {
			g.findAllGuides(4, 2);
			fail();
		} catch(IllegalStateException e) {
			// expected
		}
	}

	public void testForwardCandidates() {
		CandidateGuides c = gene("ACGTacgtACGT").findAllGuides(4, 2);
		List<GuideCandidate> fwd = toList(c.getForward());
		assertEquals(9, fwd.size());
		for(int i = 0; i < fwd.size(); i++) {
			assertEquals(4, fwd.get(i).length());
			assertEquals(i, fwd.get(i).getAnchor());
			assertEquals(GuideStrand.SENSE, fwd.get(i).getStrand());
		}
		GuideCandidate first = fwd.get(0);
		assertEquals("ACGT", first.getSequence());
		assertEquals("ac", first.getPamSite());
		assertEquals(0, first.getStartingFrame());
		assertEquals(1, first.getExonNumber());
		assertEquals("", fwd.get(8).getPamSite());
		assertEquals("T", fwd.get(7).getPamSite());
	}

	public void testReverseCandidates() {
		List<GuideCandidate> rev = toList(gene("ACGTacgtACGT").findAllGuides(4, 2).getReverse());
		assertEquals(9, rev.size());
		for(GuideCandidate g : rev) {
			assertEquals(4, g.length());
			assertEquals(GuideStrand.ANTISENSE, g.getStrand());
		}
		assertEquals(3, rev.get(0).getAnchor());
		assertEquals("", rev.get(0).getPamSite());

		GuideCandidate mixed = rev.get(2);
		assertEquals(5, mixed.getAnchor());
		assertEquals("gtAC", mixed.getSequence());
		assertEquals("GT", mixed.getPamSite());
		assertEquals(TargetGene.NO_FRAME, mixed.getStartingFrame());
		assertFalse(mixed.isExonic(0));
		assertFalse(mixed.isExonic(1));
		assertTrue(mixed.isExonic(2));
		assertTrue(mixed.isExonic(3));
		assertEquals(5, mixed.getGenePosition(0));
		assertEquals(2, mixed.getGenePosition(3));

		GuideCandidate intronic = rev.get(4);
		assertEquals(7, intronic.getAnchor());
		assertEquals("acgt", intronic.getSequence());
		assertEquals("AC", intronic.getPamSite());
		assertEquals(1, intronic.getExonNumber());
	}

	public void testEnumerationIsRestartable() {
		CandidateGuides c = gene("CATCAGGTTaccAGGCCTGAtg").findAllGuides(4, 3);
		assertEquals(toList(c.getForward()), toList(c.getForward()));
		assertEquals(19, toList(c.getReverse()).size());
		Iterator<GuideCandidate> iter = c.getReverse().iterator();
		iter.next();
		assertEquals(19, toList(c.getReverse()).size());
	}

	public void testGeneShorterThanGuide() {
		CandidateGuides c = gene("ACG").findAllGuides(4, 3);
		assertEquals(0, c.getNumWindows());
		assertFalse(c.getForward().iterator().hasNext());
		assertFalse(c.getReverse().iterator().hasNext());
	}

}
