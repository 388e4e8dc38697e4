package io.depkit.sdk.auth;

import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * Produces OAuth 1.0a {@code Authorization} headers (HMAC-SHA1, RFC 5849) for the DEP session endpoint.
 */
public final class OAuth1Signer {

    static final String REALM = "ADM";
    static final String SIGNATURE_METHOD = "HMAC-SHA1";
    private static final String HMAC_ALGORITHM = "HmacSHA1";

    private static final SecureRandom RANDOM = new SecureRandom();

    private final Clock clock;
    private final Supplier<String> nonces;

    public OAuth1Signer() {
        this(Clock.systemUTC(), OAuth1Signer::randomNonce);
    }

    OAuth1Signer(Clock clock, Supplier<String> nonces) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.nonces = Objects.requireNonNull(nonces, "nonces");
    }

    /**
     * Builds the header value for a request. Query parameters of {@code uri} take part in the signature base string.
     *
     * @throws IllegalArgumentException when the credentials are incomplete.
     */
    public String authorizationHeader(Credentials credentials, String method, URI uri) {
        Objects.requireNonNull(credentials, "credentials");
        if (!credentials.isComplete()) {
            throw new IllegalArgumentException("credentials are missing consumer or access secrets");
        }

        Map<String, String> oauth = new LinkedHashMap<>();
        oauth.put("oauth_consumer_key", credentials.consumerKey());
        oauth.put("oauth_token", credentials.accessToken());
        oauth.put("oauth_signature_method", SIGNATURE_METHOD);
        oauth.put("oauth_timestamp", Long.toString(clock.instant().getEpochSecond()));
        oauth.put("oauth_nonce", nonces.get());
        oauth.put("oauth_version", "1.0");

        String baseString = signatureBaseString(method, uri, oauth);
        String signingKey = percentEncode(credentials.consumerSecret()) + "&" + percentEncode(credentials.accessSecret());
        oauth.put("oauth_signature", hmacSha1(signingKey, baseString));

        return "OAuth realm=\"" + REALM + "\", " + oauth.entrySet().stream()
            .map(e -> percentEncode(e.getKey()) + "=\"" + percentEncode(e.getValue()) + "\"")
            .collect(Collectors.joining(", "));
    }

    static String signatureBaseString(String method, URI uri, Map<String, String> oauthParams) {
        List<String[]> params = new ArrayList<>();
        oauthParams.forEach((key, value) -> params.add(new String[] {percentEncode(key), percentEncode(value)}));
        String rawQuery = uri.getRawQuery();
        if (rawQuery != null && !rawQuery.isEmpty()) {
            for (String pair : rawQuery.split("&")) {
                if (pair.isEmpty()) {
                    continue;
                }
                String[] pieces = pair.split("=", 2);
                String key = URLDecoder.decode(pieces[0], StandardCharsets.UTF_8);
                String value = pieces.length > 1 ? URLDecoder.decode(pieces[1], StandardCharsets.UTF_8) : "";
                params.add(new String[] {percentEncode(key), percentEncode(value)});
            }
        }
        params.sort((a, b) -> {
            int byKey = a[0].compareTo(b[0]);
            return byKey != 0 ? byKey : a[1].compareTo(b[1]);
        });
        String normalized = params.stream()
            .map(p -> p[0] + "=" + p[1])
            .collect(Collectors.joining("&"));

        return method.toUpperCase(Locale.ROOT)
            + "&" + percentEncode(baseUri(uri))
            + "&" + percentEncode(normalized);
    }

    static String baseUri(URI uri) {
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        boolean defaultPort = port == -1
            || ("http".equals(scheme) && port == 80)
            || ("https".equals(scheme) && port == 443);
        String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        return scheme + "://" + host + (defaultPort ? "" : ":" + port) + path;
    }

    /**
     * RFC 3986 percent-encoding as required by OAuth 1.0a (unreserved characters left as-is, space as %20).
     */
    static String percentEncode(String value) {
        if (value == null) {
            return "";
        }
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
            .replace("+", "%20")
            .replace("*", "%2A")
            .replace("%7E", "~");
    }

    private static String hmacSha1(String key, String data) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(key.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return Base64.getEncoder().encodeToString(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException ex) {
            // every JRE ships HmacSHA1
            throw new IllegalStateException("HMAC-SHA1 unavailable", ex);
        }
    }

    private static String randomNonce() {
        byte[] bytes = new byte[16];
        RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
