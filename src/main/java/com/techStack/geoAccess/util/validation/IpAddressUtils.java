package com.techStack.geoAccess.util.validation;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.regex.Pattern;

/**
 * Literal IP address checks. Never performs name resolution: only strings that already look
 * like an address literal are handed to {@link InetAddress}.
 */
public final class IpAddressUtils {

    private static final Pattern IPV4_PATTERN = Pattern.compile(
            "^((25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)\\.){3}(25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)$");
    private static final Pattern IPV6_CHARS = Pattern.compile("^[0-9a-fA-F:.]+$");

    private IpAddressUtils() {}

    public static String normalize(String ip) {
        if (ip == null) {
            return null;
        }
        String trimmed = ip.trim();
        if (trimmed.startsWith("[") && trimmed.endsWith("]")) {
            trimmed = trimmed.substring(1, trimmed.length() - 1);
        }
        int zone = trimmed.indexOf('%');
        return zone > 0 ? trimmed.substring(0, zone) : trimmed;
    }

    public static boolean isValid(String ip) {
        return parse(ip) != null;
    }

    /** Loopback, private, link-local and unspecified addresses. */
    public static boolean isLocal(String ip) {
        InetAddress address = parse(ip);
        return address != null && (address.isLoopbackAddress()
                || address.isSiteLocalAddress()
                || address.isLinkLocalAddress()
                || address.isAnyLocalAddress());
    }

    private static InetAddress parse(String ip) {
        if (ip == null || ip.isBlank()) {
            return null;
        }
        boolean ipv4 = IPV4_PATTERN.matcher(ip).matches();
        boolean ipv6 = ip.indexOf(':') >= 0 && IPV6_CHARS.matcher(ip).matches();
        if (!ipv4 && !ipv6) {
            return null;
        }
        try {
            return InetAddress.getByName(ip);
        } catch (UnknownHostException e) {
            return null;
        }
    }
}
