package bescan.core.parser;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Command line parser for flag / value pairs, e.g. -gene_file DNMT3A.fa -cas_type SpG
 * Arguments are typed, may be required, and may have a default.
 */
public final class CommandLineParser {

	private enum ArgType {
		STRING("String"),
		INT("int"),
		DOUBLE("double"),
		BOOLEAN("boolean");

		private final String display;

		private ArgType(String display) {
			this.display = display;
		}
	}

	private boolean isParsed;
	private List<String> programDescription;
	private Map<String, ArgType> argTypes;
	private Map<String, String> argDescriptions;
	private Map<String, Object> argDefaults;
	private Set<String> requiredArgs;
	private Map<String, String> commandLineValues;

	public CommandLineParser() {
		isParsed = false;
		programDescription = new ArrayList<String>();
		argTypes = new HashMap<String, ArgType>();
		argDescriptions = new HashMap<String, String>();
		argDefaults = new HashMap<String, Object>();
		requiredArgs = new HashSet<String>();
		commandLineValues = new HashMap<String, String>();
	}

	/**
	 * Sets program description to be printed as part of help menu
	 * @param description The program description
	 */
	public void setProgramDescription(String description) {
		programDescription.add(description);
	}

	/**
	 * @param flag the command line flag for the argument
	 * @param description the description of the argument
	 * @param required whether parameter is required
	 */
	public void addStringArg(String flag, String description, boolean required) {
		addArg(flag, description, required, ArgType.STRING, null);
	}

	/**
	 * @param flag the command line flag for the argument
	 * @param description the description of the argument
	 * @param required whether parameter is required
	 * @param def default value
	 */
	public void addStringArg(String flag, String description, boolean required, String def) {
		addArg(flag, description, required, ArgType.STRING, def);
	}

	public void addIntegerArg(String flag, String description, boolean required) {
		addArg(flag, description, required, ArgType.INT, null);
	}

	public void addIntegerArg(String flag, String description, boolean required, Integer def) {
		addArg(flag, description, required, ArgType.INT, def);
	}

	public void addDoubleArg(String flag, String description, boolean required, Double def) {
		addArg(flag, description, required, ArgType.DOUBLE, def);
	}

	public void addBooleanArg(String flag, String description, boolean required, Boolean def) {
		addArg(flag, description, required, ArgType.BOOLEAN, def);
	}

	private void addArg(String flag, String description, boolean required, ArgType type, Object def) {
		if(argTypes.containsKey(flag)) {
			throw new IllegalArgumentException("Flag " + flag + " has already been used.");
		}
		if(argDescriptions.containsValue(description)) {
			throw new IllegalArgumentException("Description " + description + " has already been used.");
		}
		argTypes.put(flag, type);
		argDescriptions.put(flag, description);
		if(def != null) argDefaults.put(flag, def);
		if(required) requiredArgs.add(flag);
	}

	/**
	 * Parse command arguments
	 * @param args the command line arguments passed to a main program
	 * @throws IllegalArgumentException if the command line is malformed or a required argument is missing;
	 * the message includes the help menu
	 */
	public void parse(String[] args) {
		isParsed = false;
		commandLineValues.clear();
		int i = 0;
		while(i < args.length) {
			// A flag shouldn't be the last item
			if(args.length == i + 1) {
				throw new IllegalArgumentException("Flag " + args[i] + " has no value\n" + getHelpMessage());
			}
			if(!argTypes.containsKey(args[i])) {
				throw new IllegalArgumentException("Unknown flag " + args[i] + "\n" + getHelpMessage());
			}
			if(commandLineValues.containsKey(args[i])) {
				throw new IllegalArgumentException("Flag " + args[i] + " given twice\n" + getHelpMessage());
			}
			if(argTypes.containsKey(args[i + 1])) {
				throw new IllegalArgumentException("Flag " + args[i] + " has no value\n" + getHelpMessage());
			}
			commandLineValues.put(args[i], args[i + 1]);
			i += 2;
		}
		for(String req : requiredArgs) {
			if(!commandLineValues.containsKey(req)) {
				throw new IllegalArgumentException("Invalid command line: argument " + req + " is required\n" + getHelpMessage());
			}
		}
		isParsed = true;
	}

	/**
	 * @param flag The command line flag for the argument
	 * @return Whether the flag was given on the command line
	 */
	public boolean isPresent(String flag) {
		checkParsed();
		return commandLineValues.containsKey(flag);
	}

	/**
	 * @param flag The command line flag for the argument
	 * @return String specified on command line, the default, or null
	 */
	public String getStringArg(String flag) {
		String value = getValue(flag, ArgType.STRING);
		if(value == null) return (String) argDefaults.get(flag);
		return value;
	}

	public int getIntArg(String flag) {
		String value = getValue(flag, ArgType.INT);
		if(value == null) return ((Integer) requireDefault(flag)).intValue();
		try {
			return Integer.parseInt(value);
		} catch(NumberFormatException e) {
			throw new IllegalArgumentException("Value of " + flag + " must be an integer. Is " + value, e);
		}
	}

	public double getDoubleArg(String flag) {
		String value = getValue(flag, ArgType.DOUBLE);
		if(value == null) return ((Double) requireDefault(flag)).doubleValue();
		try {
			return Double.parseDouble(value);
		} catch(NumberFormatException e) {
			throw new IllegalArgumentException("Value of " + flag + " must be a number. Is " + value, e);
		}
	}

	public boolean getBooleanArg(String flag) {
		String value = getValue(flag, ArgType.BOOLEAN);
		if(value == null) return ((Boolean) requireDefault(flag)).booleanValue();
		return Boolean.parseBoolean(value);
	}

	private String getValue(String flag, ArgType type) {
		checkParsed();
		if(argTypes.get(flag) != type) {
			throw new IllegalArgumentException("Trying to get " + type.display + " value for parameter " + flag + " of type " + (argTypes.containsKey(flag) ? argTypes.get(flag).display : "unknown"));
		}
		return commandLineValues.get(flag);
	}

	private Object requireDefault(String flag) {
		Object def = argDefaults.get(flag);
		if(def == null) {
			throw new IllegalArgumentException("No value or default for parameter " + flag);
		}
		return def;
	}

	private void checkParsed() {
		if(!isParsed) {
			throw new IllegalStateException("Cannot get parameter value without first calling method parse()");
		}
	}

	/**
	 * @return Program description plus argument flags and descriptions
	 */
	public String getHelpMessage() {
		StringBuilder sb = new StringBuilder("\n");
		for(String s : programDescription) {
			sb.append(s).append("\n\n");
		}
		TreeSet<String> args = new TreeSet<String>();
		for(String key : argTypes.keySet()) {
			String msg = key + " <" + argTypes.get(key).display + ">\t" + argDescriptions.get(key);
			if(requiredArgs.contains(key)) msg += " (required)";
			else msg += " (default=" + argDefaults.get(key) + ")";
			args.add(msg);
		}
		for(String s : args) {
			sb.append(s).append("\n");
		}
		return sb.toString();
	}

}
