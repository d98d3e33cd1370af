package agenthub.orchestrator.webhook;

import agenthub.orchestrator.error.ValidationException;

import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rejects webhook URLs that are not http(s) or point at internal hosts.
 * Only literal addresses and well-known internal names are checked; host names are
 * not resolved.
 */
public class WebhookUrlValidator {

    static final String FIELD = "webhook_url";
    static final int MAX_LENGTH = 2000;

    private static final Set<String> BLOCKED_HOSTS = Set.of(
            "localhost", "metadata.google.internal", "metadata");

    private static final Pattern IPV4 = Pattern.compile("^\\d{1,3}(\\.\\d{1,3}){3}$");

    private final boolean allowPrivateHosts;

    public WebhookUrlValidator(boolean allowPrivateHosts) {
        this.allowPrivateHosts = allowPrivateHosts;
    }

    /**
     * @throws ValidationException on field {@code webhook_url}
     */
    public void validate(String url) {
        if (url == null) {
            return;
        }
        if (url.isBlank()) {
            throw new ValidationException(FIELD, "must not be blank");
        }
        if (url.length() > MAX_LENGTH) {
            throw new ValidationException(FIELD, "must be at most " + MAX_LENGTH + " characters");
        }

        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new ValidationException(FIELD, "is not a valid URL");
        }

        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new ValidationException(FIELD, "must use http or https");
        }

        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            throw new ValidationException(FIELD, "must include a host");
        }

        if (!allowPrivateHosts && isInternal(host)) {
            throw new ValidationException(FIELD, "must not point at a private or internal host");
        }
    }

    static boolean isInternal(String rawHost) {
        String host = rawHost.toLowerCase(Locale.ROOT);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        if (BLOCKED_HOSTS.contains(host) || host.endsWith(".localhost") || host.endsWith(".internal")) {
            return true;
        }
        if (!IPV4.matcher(host).matches() && !host.contains(":")) {
            return false;
        }

        InetAddress address;
        try {
            // Literal addresses are parsed without a lookup
            address = InetAddress.getByName(host);
        } catch (UnknownHostException e) {
            return true;
        }
        if (address.isLoopbackAddress() || address.isAnyLocalAddress() || address.isLinkLocalAddress()
                || address.isSiteLocalAddress() || address.isMulticastAddress()) {
            return true;
        }
        byte[] bytes = address.getAddress();
        // IPv6 unique local fc00::/7
        return bytes.length == 16 && (bytes[0] & 0xfe) == 0xfc;
    }
}
