package io.evitadb.warehouse.markdown;

import javax.annotation.Nonnull;
import java.text.Normalizer;
import java.util.Objects;

/**
 * Brings markdown text into the form all line numbers refer to: Unicode NFC and `\n` line endings.
 * Tokens and line text must come from the same normalized text, so normalization happens before parsing.
 */
public final class TextNormalizer {

	private TextNormalizer() {
		// utility class
	}

	/**
	 * Normalizes the text to NFC and converts `\r\n` and lone `\r` to `\n`.
	 *
	 * @param text raw text
	 * @return normalized text
	 */
	@Nonnull
	public static String normalize(@Nonnull String text) {
		Objects.requireNonNull(text, "text must not be null");
		final String composed = Normalizer.isNormalized(text, Normalizer.Form.NFC)
			? text
			: Normalizer.normalize(text, Normalizer.Form.NFC);
		if (composed.indexOf('\r') < 0) {
			return composed;
		}
		return composed.replace("\r\n", "\n").replace('\r', '\n');
	}
}
