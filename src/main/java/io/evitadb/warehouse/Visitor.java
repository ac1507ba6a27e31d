package io.evitadb.warehouse;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Visitor that processes the matched file content.
 */
public interface Visitor {

	/**
	 * Called for each file that matches the configured pattern.
	 *
	 * @param file    path to the file that matched
	 * @param content full textual contents of the file
	 * @throws IOException when processing needs I/O that fails
	 */
	void visit(@Nonnull Path file, @Nonnull String content) throws IOException;

	/**
	 * Called instead of {@link #visit} for matched files larger than the traverser's size limit.
	 * Such files are never read.
	 *
	 * @param file path to the file
	 * @param size file size in bytes
	 */
	default void oversized(@Nonnull Path file, long size) {
		// skipped silently unless the visitor cares
	}
}
