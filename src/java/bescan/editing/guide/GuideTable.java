package bescan.editing.guide;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Ordered, immutable collection of annotated guides
 */
public class GuideTable implements Iterable<AnnotatedGuide> {

	public static final String[] COLUMNS = {"sgRNA_seq", "starting_frame", "chr_pos", "gene_pos", "coding_seq", "exon",
		"sgRNA_strand", "gene_strand", "editing_window", "gene", "win_overlap"};

	private final List<AnnotatedGuide> rows;

	public GuideTable(List<AnnotatedGuide> rows) {
		this.rows = Collections.unmodifiableList(new ArrayList<AnnotatedGuide>(rows));
	}

	/**
	 * @param first Rows to put first
	 * @param second Rows to put after
	 * @return A table with the rows of both, in order
	 */
	public static GuideTable concatenate(List<AnnotatedGuide> first, List<AnnotatedGuide> second) {
		List<AnnotatedGuide> all = new ArrayList<AnnotatedGuide>(first);
		all.addAll(second);
		return new GuideTable(all);
	}

	/**
	 * Drop every row whose coding sequence occurs more than once, on either strand.
	 * No copy of an ambiguous guide is kept. Sequences are compared as written, so case counts.
	 * @return A new table without ambiguous guides
	 */
	public GuideTable removeAmbiguousGuides() {
		Map<String, Integer> counts = new HashMap<String, Integer>();
		for(AnnotatedGuide g : rows) {
			String key = g.getCodingSequence();
			Integer c = counts.get(key);
			counts.put(key, Integer.valueOf(c == null ? 1 : c.intValue() + 1));
		}
		List<AnnotatedGuide> kept = new ArrayList<AnnotatedGuide>();
		for(AnnotatedGuide g : rows) {
			if(counts.get(g.getCodingSequence()).intValue() == 1) {
				kept.add(g);
			}
		}
		return new GuideTable(kept);
	}

	public List<AnnotatedGuide> getRows() {
		return rows;
	}

	public AnnotatedGuide get(int i) {
		return rows.get(i);
	}

	public int size() {
		return rows.size();
	}

	public boolean isEmpty() {
		return rows.isEmpty();
	}

	@Override
	public Iterator<AnnotatedGuide> iterator() {
		return rows.iterator();
	}

}
