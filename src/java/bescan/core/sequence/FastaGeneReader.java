package bescan.core.sequence;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;

import org.apache.commons.io.LineIterator;
import org.apache.log4j.Logger;

import bescan.core.error.EmptySequenceException;

/**
 * Reads a single gene record from a FASTA file.
 * Headers in the UCSC "Get DNA" format are understood, e.g.
 * <pre>
 * &gt;hg38_knownGene_ENST00000264709.7 range=chr2:25227874-25342590 5'pad=0 3'pad=0 strand=- repeatMasking=none
 * </pre>
 * Only the first record of the file is read.
 */
public class FastaGeneReader {

	static Logger logger = Logger.getLogger(FastaGeneReader.class.getName());

	private static final String RANGE_TOKEN = "range=";
	private static final String STRAND_TOKEN = "strand=";

	private int offset;

	public FastaGeneReader() {
		this(0);
	}

	/**
	 * @param offset Genomic offset used when the header carries no range
	 */
	public FastaGeneReader(int offset) {
		this.offset = offset;
	}

	/**
	 * @param fastaFile FASTA file
	 * @param geneName Gene name, or null to use the record id
	 * @return The first record of the file
	 * @throws IOException
	 * @throws EmptySequenceException if the record has no bases
	 */
	public GeneRecord read(File fastaFile, String geneName) throws IOException {
		String header = null;
		StringBuilder bases = new StringBuilder();
		LineIterator iter = new LineIterator(new BufferedReader(new FileReader(fastaFile)));
		try {
			while(iter.hasNext()) {
				String line = iter.nextLine().trim();
				if(line.isEmpty()) {
					continue;
				}
				if(line.startsWith(">")) {
					if(header != null) {
						logger.warn("Only the first record of " + fastaFile + " is used");
						break;
					}
					header = line.substring(1).trim();
					continue;
				}
				bases.append(line.replaceAll("\\s", ""));
			}
		} finally {
			LineIterator.closeQuietly(iter);
		}
		if(bases.length() == 0) {
			throw new EmptySequenceException("No sequence found in " + fastaFile);
		}
		return parseHeader(header == null ? "" : header, geneName, bases.toString());
	}

	/**
	 * Build a record from a FASTA header line (without the leading &gt;) and its bases
	 * @param header Header text
	 * @param geneName Gene name, or null to use the first header token
	 * @param bases Case encoded bases
	 * @return The record
	 */
	public GeneRecord parseHeader(String header, String geneName, String bases) {
		String[] tokens = header.trim().isEmpty() ? new String[0] : header.trim().split("\\s+");
		String name = geneName != null ? geneName : (tokens.length > 0 ? tokens[0] : "gene");
		Strand strand = Strand.PLUS;
		String chr = null;
		int start = -1;
		int end = -1;
		for(String token : tokens) {
			if(token.startsWith(STRAND_TOKEN)) {
				strand = Strand.fromString(token.substring(STRAND_TOKEN.length()));
			} else if(token.startsWith(RANGE_TOKEN)) {
				String range = token.substring(RANGE_TOKEN.length());
				int colon = range.lastIndexOf(':');
				int dash = range.lastIndexOf('-');
				if(colon < 0 || dash < colon) {
					throw new IllegalArgumentException("Range must be chr:start-end. Is " + range);
				}
				chr = range.substring(0, colon);
				start = Integer.parseInt(range.substring(colon + 1, dash).replace(",", ""));
				end = Integer.parseInt(range.substring(dash + 1).replace(",", ""));
			}
		}
		if(chr != null && end - start + 1 != bases.length()) {
			logger.warn("Range " + chr + ":" + start + "-" + end + " spans " + (end - start + 1) + " bases but the sequence has " + bases.length());
		}
		GeneRecord rtrn = new GeneRecord(name, bases, strand, chr, start, end, offset);
		logger.debug("Read gene record " + rtrn.toString());
		return rtrn;
	}

}
