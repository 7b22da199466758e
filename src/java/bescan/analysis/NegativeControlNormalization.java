package bescan.analysis;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.math3.stat.descriptive.StatisticalSummary;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.apache.log4j.Logger;

/**
 * Normalizes score columns to negative control guides: the mean score of the rows
 * whose category is the negative control category is subtracted from every row.
 */
public class NegativeControlNormalization {

	static Logger logger = Logger.getLogger(NegativeControlNormalization.class.getName());

	/**
	 * Category of intergenic control guides in the usual annotation
	 */
	public static final String DEFAULT_CONTROL_CATEGORY = "NON-GENE";

	private String categoryColumn;
	private String controlCategory;

	/**
	 * @param categoryColumn Column holding the guide category
	 * @param controlCategory Category value of negative control guides
	 */
	public NegativeControlNormalization(String categoryColumn, String controlCategory) {
		this.categoryColumn = categoryColumn;
		this.controlCategory = controlCategory;
	}

	/**
	 * @param table Score table
	 * @param column Numeric column
	 * @return Summary of the column over negative control rows
	 * @throws IllegalArgumentException if the table has no negative control rows
	 */
	public StatisticalSummary controlStatistics(ScoreTable table, String column) {
		SummaryStatistics stats = new SummaryStatistics();
		for(int i = 0; i < table.getNumRows(); i++) {
			if(controlCategory.equals(table.getString(i, categoryColumn))) {
				stats.addValue(table.getDouble(i, column));
			}
		}
		if(stats.getN() == 0) {
			throw new IllegalArgumentException("No rows with " + categoryColumn + " = " + controlCategory);
		}
		return stats.getSummary();
	}

	/**
	 * Subtract the negative control mean from each column, in place
	 * @param table Score table
	 * @param columns Columns to normalize
	 * @return Negative control statistics of each column before normalization
	 */
	public Map<String, StatisticalSummary> normalize(ScoreTable table, Collection<String> columns) {
		Map<String, StatisticalSummary> rtrn = new LinkedHashMap<String, StatisticalSummary>();
		for(String column : columns) {
			StatisticalSummary stats = controlStatistics(table, column);
			double[] values = table.getColumn(column);
			for(int i = 0; i < values.length; i++) {
				values[i] -= stats.getMean();
			}
			table.setColumn(column, values);
			rtrn.put(column, stats);
			logger.info("Normalized " + column + " to " + stats.getN() + " negative controls: mean " + stats.getMean() + " sd " + stats.getStandardDeviation());
		}
		return rtrn;
	}

}
