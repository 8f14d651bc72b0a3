package com.techStack.geoAccess.util.validation;

import java.util.Locale;
import java.util.Set;

/**
 * ISO 3166-1 alpha-2 country codes as known to the JDK.
 */
public final class CountryCodes {

    private static final Set<String> ISO_COUNTRIES = Set.of(Locale.getISOCountries());

    private CountryCodes() {}

    public static boolean isValid(String code) {
        return code != null && ISO_COUNTRIES.contains(code.trim().toUpperCase(Locale.ROOT));
    }

    public static String normalize(String code) {
        return code != null ? code.trim().toUpperCase(Locale.ROOT) : null;
    }

    public static String displayName(String code) {
        if (!isValid(code)) {
            return code;
        }
        return new Locale("", normalize(code)).getDisplayCountry(Locale.ENGLISH);
    }
}
