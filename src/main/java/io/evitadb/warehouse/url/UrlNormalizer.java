package io.evitadb.warehouse.url;

import io.evitadb.warehouse.config.WarehouseConfig;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.ByteArrayOutputStream;
import java.net.IDN;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The single URL normalization routine shared by collectors and by any downstream fetcher or renderer.
 * Every component judging a URL must call this class so that all of them reach the same verdict.
 *
 * Algorithm:
 * 1. strip surrounding whitespace
 * 2. reject ASCII control characters (0x00-0x1F, 0x7F)
 * 3. reject protocol-relative references (`//host`, including backslash variants)
 * 4. percent-decode exactly once and repeat checks 2 and 3 on the decoded form
 * 5. lower-case the scheme; for URLs with an authority lower-case the host and convert it to punycode
 * 6. check the scheme against the allowlist; relative references are allowed unless configured otherwise
 *
 * Instances are immutable and the result depends on the input only.
 */
public final class UrlNormalizer {

	/**
	 * Normalizer with the default allowlist (`http`, `https`, `mailto`, `tel`) that allows relative references.
	 */
	public static final UrlNormalizer DEFAULT = new UrlNormalizer(WarehouseConfig.DEFAULT_ALLOWED_SCHEMES, true);

	private static final Pattern SCHEME_PATTERN = Pattern.compile("^([A-Za-z][A-Za-z0-9+.\\-]*):");
	private static final Pattern HOST_PATTERN = Pattern.compile("[a-z0-9._~!$&'()*+,;=\\-]+");

	@Nonnull
	private final Set<String> allowedSchemes;
	private final boolean allowRelative;

	/**
	 * Creates a normalizer.
	 *
	 * @param allowedSchemes schemes considered safe (compared case-insensitively)
	 * @param allowRelative  whether URLs without a scheme are considered safe
	 */
	public UrlNormalizer(@Nonnull Set<String> allowedSchemes, boolean allowRelative) {
		Objects.requireNonNull(allowedSchemes, "allowedSchemes must not be null");
		final Set<String> schemes = new TreeSet<>();
		for (final String scheme : allowedSchemes) {
			schemes.add(scheme.toLowerCase(Locale.ROOT));
		}
		this.allowedSchemes = Set.copyOf(schemes);
		this.allowRelative = allowRelative;
	}

	/**
	 * Creates a normalizer matching the URL policy of the configuration.
	 *
	 * @param config warehouse configuration
	 * @return normalizer
	 */
	@Nonnull
	public static UrlNormalizer fromConfig(@Nonnull WarehouseConfig config) {
		Objects.requireNonNull(config, "config must not be null");
		return new UrlNormalizer(config.allowedSchemes(), config.allowRelativeUrls());
	}

	/**
	 * Normalizes a URL with the default policy.
	 *
	 * @param raw raw URL
	 * @return canonical answer
	 * @throws InvalidUrlException when the URL cannot be parsed or is rejected outright
	 */
	@Nonnull
	public static NormalizedUrl normalizeUrl(@Nullable String raw) throws InvalidUrlException {
		return DEFAULT.normalize(raw);
	}

	/**
	 * Normalizes a URL.
	 *
	 * @param raw raw URL
	 * @return canonical answer
	 * @throws InvalidUrlException when the URL cannot be parsed or is rejected outright
	 */
	@Nonnull
	public NormalizedUrl normalize(@Nullable String raw) throws InvalidUrlException {
		if (raw == null) {
			throw new InvalidUrlException("URL is missing", "");
		}
		final String stripped = raw.strip();
		if (stripped.isEmpty()) {
			throw new InvalidUrlException("URL is empty", raw);
		}
		rejectControlCharacters(stripped, raw);
		rejectProtocolRelative(stripped, raw);

		final String decoded = percentDecodeOnce(stripped);
		rejectControlCharacters(decoded, raw);
		rejectProtocolRelative(decoded, raw);

		final Matcher matcher = SCHEME_PATTERN.matcher(decoded);
		if (matcher.find()) {
			final String scheme = matcher.group(1).toLowerCase(Locale.ROOT);
			final String rest = decoded.substring(matcher.end());
			final String normalizedRest = rest.startsWith("//") ? normalizeAuthority(rest, raw) : rest;
			return new NormalizedUrl(scheme, scheme + ":" + normalizedRest, this.allowedSchemes.contains(scheme));
		}

		// without a valid scheme, a colon in the first path segment makes the reference ambiguous
		final int colon = decoded.indexOf(':');
		if (colon >= 0 && colon < firstDelimiter(decoded, 0)) {
			throw new InvalidUrlException("Malformed scheme or relative reference with a colon in its first segment", raw);
		}
		return new NormalizedUrl(null, decoded, this.allowRelative);
	}

	/**
	 * Returns true when the URL normalizes successfully and is allowed. Invalid URLs are never allowed.
	 *
	 * @param raw raw URL
	 * @return verdict of the normalizer
	 */
	public boolean isAllowed(@Nullable String raw) {
		try {
			return normalize(raw).allowed();
		} catch (InvalidUrlException e) {
			return false;
		}
	}

	/**
	 * Returns the allowed schemes.
	 *
	 * @return lower-case schemes
	 */
	@Nonnull
	public Set<String> getAllowedSchemes() {
		return this.allowedSchemes;
	}

	public boolean isAllowRelative() {
		return this.allowRelative;
	}

	@Nonnull
	private static String normalizeAuthority(@Nonnull String rest, @Nonnull String raw) throws InvalidUrlException {
		final int authorityEnd = firstDelimiter(rest, 2);
		final String authority = rest.substring(2, authorityEnd);
		final String remainder = rest.substring(authorityEnd);

		final int at = authority.lastIndexOf('@');
		final String userInfo = at >= 0 ? authority.substring(0, at) : null;
		final String hostPort = at >= 0 ? authority.substring(at + 1) : authority;

		final String host;
		String port = null;
		if (hostPort.startsWith("[")) {
			final int close = hostPort.indexOf(']');
			if (close < 0) {
				throw new InvalidUrlException("Unterminated IPv6 literal", raw);
			}
			host = hostPort.substring(0, close + 1).toLowerCase(Locale.ROOT);
			final String afterHost = hostPort.substring(close + 1);
			if (!afterHost.isEmpty()) {
				if (!afterHost.startsWith(":")) {
					throw new InvalidUrlException("Unexpected characters after IPv6 literal", raw);
				}
				port = afterHost.substring(1);
			}
		} else {
			final int colon = hostPort.lastIndexOf(':');
			final String rawHost = colon >= 0 ? hostPort.substring(0, colon) : hostPort;
			if (colon >= 0) {
				port = hostPort.substring(colon + 1);
			}
			host = toAsciiHost(rawHost, raw);
		}
		if (port != null && !port.chars().allMatch(Character::isDigit)) {
			throw new InvalidUrlException("Invalid port '" + port + "'", raw);
		}

		final StringBuilder sb = new StringBuilder(rest.length() + 8);
		sb.append("//");
		if (userInfo != null) {
			sb.append(userInfo).append('@');
		}
		sb.append(host);
		if (port != null && !port.isEmpty()) {
			sb.append(':').append(port);
		}
		sb.append(remainder);
		return sb.toString();
	}

	@Nonnull
	private static String toAsciiHost(@Nonnull String rawHost, @Nonnull String raw) throws InvalidUrlException {
		if (rawHost.isEmpty()) {
			throw new InvalidUrlException("URL has an empty host", raw);
		}
		final String ascii;
		try {
			ascii = IDN.toASCII(rawHost.toLowerCase(Locale.ROOT), IDN.ALLOW_UNASSIGNED).toLowerCase(Locale.ROOT);
		} catch (IllegalArgumentException e) {
			throw new InvalidUrlException("Host '" + rawHost + "' is not a valid internationalized domain name", raw, e);
		}
		if (ascii.isEmpty() || !HOST_PATTERN.matcher(ascii).matches()) {
			throw new InvalidUrlException("Host '" + rawHost + "' contains forbidden characters", raw);
		}
		return ascii;
	}

	/**
	 * Decodes `%XX` escapes exactly once. Malformed escapes are kept literally; the decoded bytes are read as UTF-8.
	 *
	 * @param value value to decode
	 * @return decoded value
	 */
	@Nonnull
	static String percentDecodeOnce(@Nonnull String value) {
		if (value.indexOf('%') < 0) {
			return value;
		}
		final ByteArrayOutputStream bytes = new ByteArrayOutputStream(value.length());
		int i = 0;
		while (i < value.length()) {
			final char c = value.charAt(i);
			if (c == '%' && i + 2 < value.length() && isHex(value.charAt(i + 1)) && isHex(value.charAt(i + 2))) {
				bytes.write(Character.digit(value.charAt(i + 1), 16) << 4 | Character.digit(value.charAt(i + 2), 16));
				i += 3;
			} else {
				final int codePoint = value.codePointAt(i);
				final byte[] encoded = new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8);
				bytes.write(encoded, 0, encoded.length);
				i += Character.charCount(codePoint);
			}
		}
		return bytes.toString(StandardCharsets.UTF_8);
	}

	private static boolean isHex(char c) {
		return Character.digit(c, 16) >= 0 && c < 0x80;
	}

	private static void rejectControlCharacters(@Nonnull String value, @Nonnull String raw) throws InvalidUrlException {
		for (int i = 0; i < value.length(); i++) {
			final char c = value.charAt(i);
			if (c <= 0x1F || c == 0x7F) {
				throw new InvalidUrlException(String.format("URL contains control character 0x%02X", (int) c), raw);
			}
		}
	}

	private static void rejectProtocolRelative(@Nonnull String value, @Nonnull String raw) throws InvalidUrlException {
		if (value.length() >= 2 && isSlash(value.charAt(0)) && isSlash(value.charAt(1))) {
			throw new InvalidUrlException("Protocol-relative URLs are not allowed", raw);
		}
	}

	private static boolean isSlash(char c) {
		return c == '/' || c == '\\';
	}

	private static int firstDelimiter(@Nonnull String value, int from) {
		for (int i = from; i < value.length(); i++) {
			final char c = value.charAt(i);
			if (c == '/' || c == '\\' || c == '?' || c == '#') {
				return i;
			}
		}
		return value.length();
	}
}
