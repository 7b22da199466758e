package bescan.analysis;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import bescan.core.parser.CommandLineParser;

/**
 * Pairwise comparisons of screen conditions.
 * Each comparison adds a column to the score table holding treatment - control row by row.
 */
public class CompareConditions {

	static Logger logger = Logger.getLogger(CompareConditions.class.getName());

	/**
	 * Read comparisons from a CSV file with a header row and the columns name, treatment, control
	 * @param file Comparisons file
	 * @return The comparisons in file order
	 * @throws IOException
	 */
	public static List<ConditionComparison> readComparisons(File file) throws IOException {
		ScoreTable table = ScoreTable.read(file);
		if(table.getColumns().size() != 3) {
			throw new IllegalArgumentException("Comparisons file must have three columns: name, treatment, control. Has " + table.getColumns());
		}
		List<String> columns = table.getColumns();
		List<ConditionComparison> rtrn = new ArrayList<ConditionComparison>();
		for(int i = 0; i < table.getNumRows(); i++) {
			rtrn.add(new ConditionComparison(table.getString(i, columns.get(0)), table.getString(i, columns.get(1)), table.getString(i, columns.get(2))));
		}
		return rtrn;
	}

	/**
	 * Add one column per comparison to the table, in place
	 * @param table Condition scores
	 * @param comparisons Comparisons
	 * @return Names of the added columns
	 */
	public static List<String> compare(ScoreTable table, List<ConditionComparison> comparisons) {
		List<String> rtrn = new ArrayList<String>();
		for(ConditionComparison c : comparisons) {
			double[] treatment = table.getColumn(c.getTreatment());
			double[] control = table.getColumn(c.getControl());
			double[] diff = new double[treatment.length];
			for(int i = 0; i < diff.length; i++) {
				diff[i] = treatment[i] - control[i];
			}
			table.setColumn(c.getName(), diff);
			rtrn.add(c.getName());
			logger.debug("Added comparison " + c.toString());
		}
		logger.info("Compare conditions completed: " + rtrn.size() + " comparisons");
		return rtrn;
	}

	public static void main(String[] args) throws IOException {
		CommandLineParser p = new CommandLineParser();
		p.setProgramDescription("Compare screen conditions pairwise (treatment - control) and optionally normalize to negative controls.");
		p.addStringArg("-conditions", "CSV file of scores, one column per condition", true);
		p.addStringArg("-comparisons", "CSV file with columns name, treatment, control", true);
		p.addStringArg("-output", "Output CSV file", false, "agg_comps.csv");
		p.addStringArg("-control_column", "Column holding guide categories; normalize comparisons to negative controls when given", false);
		p.addStringArg("-control_category", "Category of negative control guides", false, NegativeControlNormalization.DEFAULT_CONTROL_CATEGORY);
		p.addBooleanArg("-debug", "Debug logging", false, Boolean.FALSE);
		try {
			p.parse(args);
		} catch(IllegalArgumentException e) {
			logger.error(e.getMessage());
			System.exit(1);
		}

		if(p.getBooleanArg("-debug")) {
			Logger.getLogger("bescan").setLevel(Level.DEBUG);
		}

		ScoreTable table = ScoreTable.read(new File(p.getStringArg("-conditions")));
		List<String> added = compare(table, readComparisons(new File(p.getStringArg("-comparisons"))));
		if(p.getStringArg("-control_column") != null) {
			new NegativeControlNormalization(p.getStringArg("-control_column"), p.getStringArg("-control_category")).normalize(table, added);
		}
		table.write(new File(p.getStringArg("-output")));
	}

}
