package bescan.editing.gene;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.apache.log4j.Logger;

import bescan.core.error.EmptySequenceException;
import bescan.core.sequence.GeneRecord;
import bescan.core.sequence.SequenceUtils;
import bescan.core.sequence.Strand;

/**
 * A gene prepared for guide design.
 * The case encoding of the gene record is turned into an explicit segment list by {@link #parseExons()},
 * per position metadata is computed by {@link #extractMetadata()}, and candidate guides are then
 * enumerated lazily on both strands by {@link #findAllGuides(int, int)}.
 */
public class TargetGene {

	static Logger logger = Logger.getLogger(TargetGene.class.getName());

	/**
	 * Frame of intronic positions
	 */
	public static final int NO_FRAME = -1;

	private final GeneRecord record;
	private final String bases;
	private List<GeneSegment> segments;
	private int[] genomicPositions;
	private int[] frames;
	private int[] exonNumbers;
	private boolean[] exonic;

	public TargetGene(GeneRecord record) {
		this.record = record;
		this.bases = record.getBases();
	}

	/**
	 * Split the gene into maximal runs of upper case (exon) and lower case (intron) bases
	 * @return The segments in gene order
	 * @throws EmptySequenceException if the gene has no bases
	 * @throws bescan.core.error.InvalidBaseException if the gene has a character other than a base
	 */
	public List<GeneSegment> parseExons() {
		if(bases.isEmpty()) {
			throw new EmptySequenceException("Gene " + record.getName() + " has no sequence");
		}
		SequenceUtils.validateBases(bases);
		List<GeneSegment> rtrn = new ArrayList<GeneSegment>();
		int exonNumber = 0;
		int start = 0;
		while(start < bases.length()) {
			boolean upper = Character.isUpperCase(bases.charAt(start));
			int end = start + 1;
			while(end < bases.length() && Character.isUpperCase(bases.charAt(end)) == upper) {
				end++;
			}
			if(upper) {
				exonNumber++;
			}
			rtrn.add(new GeneSegment(upper ? SegmentKind.EXON : SegmentKind.INTRON, start, end, exonNumber, bases.substring(start, end)));
			start = end;
		}
		segments = Collections.unmodifiableList(rtrn);
		logger.debug("Gene " + record.getName() + " has " + segments.size() + " segments");
		return segments;
	}

	/**
	 * Compute genomic position, coding frame and exon number of every gene position.
	 * Frames cycle 0, 1, 2 over exonic bases only, continuing across introns.
	 */
	public void extractMetadata() {
		if(segments == null) {
			parseExons();
		}
		int n = bases.length();
		genomicPositions = new int[n];
		frames = new int[n];
		exonNumbers = new int[n];
		exonic = new boolean[n];
		int codingBases = 0;
		for(GeneSegment segment : segments) {
			for(int i = segment.getStart(); i < segment.getEnd(); i++) {
				genomicPositions[i] = toGenomicPosition(i);
				exonNumbers[i] = segment.getExonNumber();
				exonic[i] = segment.isExon();
				if(segment.isExon()) {
					frames[i] = codingBases % 3;
					codingBases++;
				} else {
					frames[i] = NO_FRAME;
				}
			}
		}
		logger.debug("Gene " + record.getName() + " has " + codingBases + " exonic bases");
	}

	private int toGenomicPosition(int genePosition) {
		if(!record.hasRange()) {
			return genePosition + record.getOffset();
		}
		return record.getStrand() == Strand.PLUS ? record.getRangeStart() + genePosition : record.getRangeEnd() - genePosition;
	}

	/**
	 * Enumerate every window of the given length on both strands.
	 * Nothing is materialized: the returned iterables can be traversed any number of times.
	 * @param guideLength Guide length
	 * @param pamLength Number of bases 3' of each guide to report as its PAM site
	 * @return Forward and reverse candidates
	 */
	public CandidateGuides findAllGuides(int guideLength, int pamLength) {
		if(exonic == null) {
			throw new IllegalStateException("Metadata must be extracted before enumerating guides");
		}
		if(guideLength < 1) {
			throw new IllegalArgumentException("Guide length must be positive. Is " + guideLength);
		}
		if(pamLength < 0) {
			throw new IllegalArgumentException("PAM length must not be negative. Is " + pamLength);
		}
		return new CandidateGuides(guideLength, pamLength);
	}

	/**
	 * Sense candidate starting at a gene position
	 */
	GuideCandidate forwardCandidate(int start, int guideLength, int pamLength) {
		int end = start + guideLength;
		boolean[] flags = new boolean[guideLength];
		for(int k = 0; k < guideLength; k++) {
			flags[k] = exonic[start + k];
		}
		String pamSite = bases.substring(end, Math.min(end + pamLength, bases.length()));
		return new GuideCandidate(bases.substring(start, end), pamSite, GuideStrand.SENSE, frames[start], start, genomicPositions[start], exonNumbers[start], flags);
	}

	/**
	 * Antisense candidate covering gene positions start to start + guideLength - 1.
	 * The anchor is the last of these positions.
	 */
	GuideCandidate reverseCandidate(int start, int guideLength, int pamLength) {
		int anchor = start + guideLength - 1;
		boolean[] flags = new boolean[guideLength];
		for(int k = 0; k < guideLength; k++) {
			flags[k] = exonic[anchor - k];
		}
		String sequence = SequenceUtils.reverseComplement(bases.substring(start, start + guideLength));
		String pamSite = SequenceUtils.reverseComplement(bases.substring(Math.max(0, start - pamLength), start));
		return new GuideCandidate(sequence, pamSite, GuideStrand.ANTISENSE, frames[anchor], anchor, genomicPositions[anchor], exonNumbers[anchor], flags);
	}

	public String getName() {
		return record.getName();
	}

	public Strand getStrand() {
		return record.getStrand();
	}

	public GeneRecord getRecord() {
		return record;
	}

	public String getBases() {
		return bases;
	}

	public int length() {
		return bases.length();
	}

	/**
	 * @return The segments, or null before {@link #parseExons()}
	 */
	public List<GeneSegment> getSegments() {
		return segments;
	}

	/**
	 * @return The exons in gene order
	 */
	public List<GeneSegment> getExons() {
		List<GeneSegment> rtrn = new ArrayList<GeneSegment>();
		for(GeneSegment segment : segments) {
			if(segment.isExon()) rtrn.add(segment);
		}
		return rtrn;
	}

	public int getNumExons() {
		return getExons().size();
	}

	public int getGenomicPosition(int genePosition) {
		return genomicPositions[genePosition];
	}

	public int getFrame(int genePosition) {
		return frames[genePosition];
	}

	public int getExonNumber(int genePosition) {
		return exonNumbers[genePosition];
	}

	public boolean isExonic(int genePosition) {
		return exonic[genePosition];
	}

	/**
	 * Forward and reverse candidates of one guide length
	 */
	public class CandidateGuides {

		private final int guideLength;
		private final int pamLength;

		CandidateGuides(int guideLength, int pamLength) {
			this.guideLength = guideLength;
			this.pamLength = pamLength;
		}

		public int getGuideLength() {
			return guideLength;
		}

		/**
		 * @return Number of candidates on each strand
		 */
		public int getNumWindows() {
			return Math.max(0, bases.length() - guideLength + 1);
		}

		/**
		 * @return Sense candidates in order of anchor
		 */
		public Iterable<GuideCandidate> getForward() {
			return new Iterable<GuideCandidate>() {
				@Override
				public Iterator<GuideCandidate> iterator() {
					return new CandidateIterator(GuideStrand.SENSE);
				}
			};
		}

		/**
		 * @return Antisense candidates in order of anchor
		 */
		public Iterable<GuideCandidate> getReverse() {
			return new Iterable<GuideCandidate>() {
				@Override
				public Iterator<GuideCandidate> iterator() {
					return new CandidateIterator(GuideStrand.ANTISENSE);
				}
			};
		}

		private class CandidateIterator implements Iterator<GuideCandidate> {

			private final GuideStrand strand;
			private int next = 0;

			CandidateIterator(GuideStrand strand) {
				this.strand = strand;
			}

			@Override
			public boolean hasNext() {
				return next < getNumWindows();
			}

			@Override
			public GuideCandidate next() {
				if(!hasNext()) {
					throw new NoSuchElementException();
				}
				int start = next++;
				return strand == GuideStrand.SENSE ? forwardCandidate(start, guideLength, pamLength) : reverseCandidate(start, guideLength, pamLength);
			}

			@Override
			public void remove() {
				throw new UnsupportedOperationException();
			}

		}

	}

}
