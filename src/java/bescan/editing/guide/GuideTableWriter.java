package bescan.editing.guide;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

/**
 * Writes a guide table as comma separated values with a header row.
 * The table goes to a temporary file next to the output, which is renamed only once complete.
 */
public class GuideTableWriter {

	static Logger logger = Logger.getLogger(GuideTableWriter.class.getName());

	/**
	 * @param table Guide table
	 * @param output Output file, replaced if it exists
	 * @throws IOException if the file cannot be written; no output file is left in that case
	 */
	public void write(GuideTable table, File output) throws IOException {
		File tmp = new File(output.getAbsoluteFile().getParentFile(), output.getName() + ".tmp");
		try {
			BufferedWriter w = new BufferedWriter(new FileWriter(tmp));
			try {
				w.write(StringUtils.join(GuideTable.COLUMNS, ","));
				w.newLine();
				for(AnnotatedGuide g : table) {
					w.write(toLine(g));
					w.newLine();
				}
			} finally {
				w.close();
			}
			if(!tmp.renameTo(output)) {
				// Some platforms do not rename over an existing file
				if(!output.delete() || !tmp.renameTo(output)) {
					throw new IOException("Could not rename " + tmp + " to " + output);
				}
			}
		} finally {
			if(tmp.exists() && !tmp.delete()) {
				logger.warn("Could not delete temporary file " + tmp);
			}
		}
		logger.info("Wrote " + table.size() + " guides to " + output);
	}

	/**
	 * @param g Guide
	 * @return The CSV line of the guide, without line terminator
	 */
	public static String toLine(AnnotatedGuide g) {
		String[] cells = {g.getSgRNASequence(), Integer.toString(g.getStartingFrame()), Integer.toString(g.getChrPosition()),
				Integer.toString(g.getGenePosition()), g.getCodingSequence(), Integer.toString(g.getExon()), g.getGuideStrand().getLabel(),
				g.getGeneStrand().getLabel(), "\"" + g.getEditingWindowString() + "\"", quote(g.getGeneName()), g.getWindowOverlap().getLabel()};
		return StringUtils.join(cells, ",");
	}

	private static String quote(String cell) {
		if(cell.contains(",") || cell.contains("\"")) {
			return "\"" + cell.replace("\"", "\"\"") + "\"";
		}
		return cell;
	}

}
