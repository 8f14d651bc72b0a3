package com.techStack.geoAccess.util.validation;

import com.techStack.geoAccess.constants.GeoSecurityConstants;

import java.util.regex.Pattern;

/**
 * Masking and format checks for security logs and contact routing.
 */
public final class HelperUtils {

    private static final Pattern EMAIL_PATTERN =
            Pattern.compile("^[A-Za-z0-9._%+'-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}$");

    private HelperUtils() {}

    /**
     * Masks email for logging
     *
     * Examples:
     * john.doe@gmail.com → j*****e@gmail.com
     * a@test.com → a*****@test.com
     */
    public static String maskEmail(String email) {
        if (email == null || email.trim().isEmpty()) return "*****";

        String trimmedEmail = email.trim();
        int atIndex = trimmedEmail.indexOf('@');
        if (atIndex <= 0) return "*****";

        String localPart = trimmedEmail.substring(0, atIndex);
        String domain = trimmedEmail.substring(atIndex + 1);

        if (localPart.length() == 1) {
            return localPart + "*****@" + domain;
        }
        return localPart.charAt(0) + "*****" + localPart.charAt(localPart.length() - 1) + "@" + domain;
    }

    public static boolean isValidEmail(String email) {
        return email != null && EMAIL_PATTERN.matcher(email.trim()).matches();
    }

    /** Listing limit bounded to [1, MAX_LIST_LIMIT]; non-positive means the default. */
    public static int clampLimit(int limit) {
        if (limit <= 0) {
            return GeoSecurityConstants.DEFAULT_LIST_LIMIT;
        }
        return Math.min(limit, GeoSecurityConstants.MAX_LIST_LIMIT);
    }
}
