package bescan.core.sequence;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;

import bescan.core.error.UnknownCasTypeException;

/**
 * Default PAM of each supported Cas variant
 */
public final class CasPamTable {

	private static final Map<String, String> PAM_BY_CAS_TYPE;
	static {
		Map<String, String> table = new LinkedHashMap<String, String>();
		table.put("Sp", "NGG");
		table.put("SpCas9", "NGG");
		table.put("SpG", "NGN");
		table.put("SpRY", "NNN");
		table.put("SpNG", "NG");
		table.put("VQR", "NGA");
		table.put("VRQR", "NGA");
		table.put("EQR", "NGAG");
		table.put("VRER", "NGCG");
		table.put("SaCas9", "NNGRRT");
		table.put("SaKKH", "NNNRRT");
		PAM_BY_CAS_TYPE = Collections.unmodifiableMap(table);
	}

	private CasPamTable() {}

	/**
	 * @return The known Cas types in table order
	 */
	public static Set<String> getCasTypes() {
		return PAM_BY_CAS_TYPE.keySet();
	}

	/**
	 * @param casType Cas type name
	 * @return True iff the Cas type is in the table
	 */
	public static boolean isKnownCasType(String casType) {
		return casType != null && PAM_BY_CAS_TYPE.containsKey(casType);
	}

	/**
	 * Resolve the PAM to use. An explicit PAM always takes precedence over the Cas type.
	 * @param casType Cas type name or null
	 * @param explicitPam PAM given by the user or null
	 * @return The PAM string
	 * @throws UnknownCasTypeException if there is no explicit PAM and the Cas type is not in the table
	 */
	public static String resolve(String casType, String explicitPam) {
		if(StringUtils.isNotBlank(explicitPam)) {
			return explicitPam.trim();
		}
		if(!isKnownCasType(casType)) {
			throw new UnknownCasTypeException("Improper cas type " + casType + ", the options are " + getCasTypes());
		}
		return PAM_BY_CAS_TYPE.get(casType);
	}

}
