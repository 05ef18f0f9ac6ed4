package com.entity.profiling.geo;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * US state and territory postal codes with their FIPS prefixes.
 * County unit ids are five-digit FIPS codes whose first two digits are the state FIPS.
 */
public final class StateCodes {

    private static final Map<String, String> FIPS_BY_STATE;

    static {
        Map<String, String> m = new TreeMap<>();
        m.put("AL", "01"); m.put("AK", "02"); m.put("AZ", "04"); m.put("AR", "05"); m.put("CA", "06");
        m.put("CO", "08"); m.put("CT", "09"); m.put("DE", "10"); m.put("DC", "11"); m.put("FL", "12");
        m.put("GA", "13"); m.put("HI", "15"); m.put("ID", "16"); m.put("IL", "17"); m.put("IN", "18");
        m.put("IA", "19"); m.put("KS", "20"); m.put("KY", "21"); m.put("LA", "22"); m.put("ME", "23");
        m.put("MD", "24"); m.put("MA", "25"); m.put("MI", "26"); m.put("MN", "27"); m.put("MS", "28");
        m.put("MO", "29"); m.put("MT", "30"); m.put("NE", "31"); m.put("NV", "32"); m.put("NH", "33");
        m.put("NJ", "34"); m.put("NM", "35"); m.put("NY", "36"); m.put("NC", "37"); m.put("ND", "38");
        m.put("OH", "39"); m.put("OK", "40"); m.put("OR", "41"); m.put("PA", "42"); m.put("RI", "44");
        m.put("SC", "45"); m.put("SD", "46"); m.put("TN", "47"); m.put("TX", "48"); m.put("UT", "49");
        m.put("VT", "50"); m.put("VA", "51"); m.put("WA", "53"); m.put("WV", "54"); m.put("WI", "55");
        m.put("WY", "56");
        // territories
        m.put("AS", "60"); m.put("GU", "66"); m.put("MP", "69"); m.put("PR", "72"); m.put("VI", "78");
        FIPS_BY_STATE = Collections.unmodifiableMap(m);
    }

    private StateCodes() {
        // Utility class
    }

    public static boolean isValid(String stateCode) {
        return stateCode != null && FIPS_BY_STATE.containsKey(stateCode.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Returns the two-digit FIPS prefix for a postal code.
     */
    public static Optional<String> fipsFor(String stateCode) {
        if (stateCode == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(FIPS_BY_STATE.get(stateCode.trim().toUpperCase(Locale.ROOT)));
    }

    /**
     * Returns the state FIPS prefix of a county or state unit id ("04005" gives "04").
     */
    public static String stateFipsOf(String unitId) {
        return unitId.length() >= 2 ? unitId.substring(0, 2) : unitId;
    }

    /**
     * Returns true if the unit id denotes a whole state rather than a county.
     */
    public static boolean isStateUnit(String unitId) {
        return unitId != null && unitId.length() == 2 && FIPS_BY_STATE.containsValue(unitId);
    }

    public static Set<String> codes() {
        return FIPS_BY_STATE.keySet();
    }
}
