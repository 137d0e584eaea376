package me.go_gradually.ivrphone.infrastructure.sip;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.regex.Pattern;

/**
 * Turns the configured listen address into the IP the SIP stack binds to.
 * {@code lv4} and {@code lv6} are shorthands for the loopback addresses.
 */
public final class ListenAddressResolver {
    private static final Pattern IPV4 = Pattern.compile("\\d{1,3}(\\.\\d{1,3}){3}");
    private static final Pattern IPV6 = Pattern.compile("[0-9a-fA-F:.]+");

    private ListenAddressResolver() {
    }

    public static ListenAddress resolve(String configured) {
        if (configured == null || configured.isBlank()) {
            throw new IllegalArgumentException("ivrphone.sip.listen-address must not be blank");
        }
        String value = configured.trim();
        if ("lv4".equalsIgnoreCase(value)) {
            return new ListenAddress("127.0.0.1", "IPV4 localhost");
        }
        if ("lv6".equalsIgnoreCase(value)) {
            return new ListenAddress("::1", "IPV6 localhost");
        }
        if (!isIpLiteral(value)) {
            throw new IllegalArgumentException(
                    "Invalid listen address '" + value + "': expected lv4, lv6 or an IP address");
        }
        try {
            // literal only, so no name lookup happens here
            return new ListenAddress(InetAddress.getByName(value).getHostAddress(), "");
        } catch (UnknownHostException e) {
            throw new IllegalArgumentException("Invalid listen address '" + value + "'", e);
        }
    }

    private static boolean isIpLiteral(String value) {
        if (IPV4.matcher(value).matches()) {
            for (String octet : value.split("\\.")) {
                if (Integer.parseInt(octet) > 255) {
                    return false;
                }
            }
            return true;
        }
        return value.indexOf(':') >= 0 && IPV6.matcher(value).matches();
    }

    public record ListenAddress(String host, String label) {
        public boolean isIpv6() {
            return host.indexOf(':') >= 0;
        }

        /**
         * Host as it appears inside a SIP or SDP URI.
         */
        public String uriHost() {
            return isIpv6() ? "[" + host + "]" : host;
        }
    }
}
