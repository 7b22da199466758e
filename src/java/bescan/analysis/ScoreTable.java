package bescan.analysis;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileReader;
import java.io.FileWriter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.io.LineIterator;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.text.StrTokenizer;
import org.apache.log4j.Logger;

/**
 * A table of screen scores read from a comma separated file with a header row,
 * e.g. log fold changes per guide and condition.
 * Cells are kept as strings; numeric columns are read with {@link #getDouble(int, String)}.
 */
public class ScoreTable {

	static Logger logger = Logger.getLogger(ScoreTable.class.getName());

	private List<String> columns;
	private List<String[]> rows;

	/**
	 * @param columns Column names
	 */
	public ScoreTable(List<String> columns) {
		this.columns = new ArrayList<String>(columns);
		this.rows = new ArrayList<String[]>();
	}

	/**
	 * @param file CSV file with a header row
	 * @return The table
	 * @throws IOException
	 */
	public static ScoreTable read(File file) throws IOException {
		LineIterator iter = new LineIterator(new BufferedReader(new FileReader(file)));
		try {
			if(!iter.hasNext()) {
				throw new IllegalArgumentException("File " + file + " is empty");
			}
			ScoreTable rtrn = new ScoreTable(tokenize(iter.nextLine()));
			while(iter.hasNext()) {
				String line = iter.nextLine();
				if(StringUtils.isBlank(line)) continue;
				rtrn.addRow(tokenize(line));
			}
			logger.info("Read " + rtrn.getNumRows() + " rows and " + rtrn.getColumns().size() + " columns from " + file);
			return rtrn;
		} finally {
			LineIterator.closeQuietly(iter);
		}
	}

	private static List<String> tokenize(String line) {
		StrTokenizer tokenizer = StrTokenizer.getCSVInstance(line);
		tokenizer.setIgnoreEmptyTokens(false);
		return tokenizer.getTokenList();
	}

	/**
	 * @param file Output file
	 * @throws IOException
	 */
	public void write(File file) throws IOException {
		BufferedWriter w = new BufferedWriter(new FileWriter(file));
		try {
			w.write(toLine(columns.toArray(new String[columns.size()])));
			w.newLine();
			for(String[] row : rows) {
				w.write(toLine(row));
				w.newLine();
			}
		} finally {
			w.close();
		}
		logger.info("Wrote " + rows.size() + " rows to " + file);
	}

	private static String toLine(String[] cells) {
		String[] quoted = new String[cells.length];
		for(int i = 0; i < cells.length; i++) {
			String c = cells[i] == null ? "" : cells[i];
			quoted[i] = c.contains(",") || c.contains("\"") ? "\"" + c.replace("\"", "\"\"") + "\"" : c;
		}
		return StringUtils.join(quoted, ",");
	}

	/**
	 * @param cells One cell per column
	 */
	public void addRow(List<String> cells) {
		if(cells.size() != columns.size()) {
			throw new IllegalArgumentException("Row has " + cells.size() + " cells but the table has " + columns.size() + " columns: " + cells);
		}
		rows.add(cells.toArray(new String[cells.size()]));
	}

	/**
	 * Append a numeric column, replacing any column of the same name
	 * @param name Column name
	 * @param values One value per row
	 */
	public void setColumn(String name, double[] values) {
		if(values.length != rows.size()) {
			throw new IllegalArgumentException("Need " + rows.size() + " values for column " + name + ". Have " + values.length);
		}
		int c = columns.indexOf(name);
		if(c < 0) {
			columns.add(name);
			for(int i = 0; i < rows.size(); i++) {
				String[] row = rows.get(i);
				String[] extended = new String[row.length + 1];
				System.arraycopy(row, 0, extended, 0, row.length);
				extended[row.length] = Double.toString(values[i]);
				rows.set(i, extended);
			}
		} else {
			for(int i = 0; i < rows.size(); i++) {
				rows.get(i)[c] = Double.toString(values[i]);
			}
		}
	}

	public List<String> getColumns() {
		return Collections.unmodifiableList(columns);
	}

	public boolean hasColumn(String name) {
		return columns.contains(name);
	}

	public int getNumRows() {
		return rows.size();
	}

	/**
	 * @param row Row index
	 * @param column Column name
	 * @return The cell
	 */
	public String getString(int row, String column) {
		return rows.get(row)[columnIndex(column)];
	}

	/**
	 * @param row Row index
	 * @param column Column name
	 * @return The cell as a number
	 * @throws IllegalArgumentException if the cell is not a number
	 */
	public double getDouble(int row, String column) {
		String cell = getString(row, column);
		try {
			return Double.parseDouble(cell.trim());
		} catch(NumberFormatException e) {
			throw new IllegalArgumentException("Value in row " + row + " of column " + column + " is not a number: " + cell, e);
		}
	}

	/**
	 * @param column Column name
	 * @return All values of a numeric column
	 */
	public double[] getColumn(String column) {
		double[] rtrn = new double[rows.size()];
		for(int i = 0; i < rows.size(); i++) {
			rtrn[i] = getDouble(i, column);
		}
		return rtrn;
	}

	private int columnIndex(String column) {
		int c = columns.indexOf(column);
		if(c < 0) {
			throw new IllegalArgumentException("No column " + column + ". Columns are " + columns);
		}
		return c;
	}

}
