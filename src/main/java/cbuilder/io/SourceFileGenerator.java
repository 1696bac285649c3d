package cbuilder.io;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import cbuilder.CompilationUnit;

/**
 * Writes rendered compilation units below an output folder.
 *
 * Files whose content did not change are left untouched, so build tools do
 * not see them as modified. {@link #removeOldFiles()} deletes everything in
 * the folder that was not produced by this generator.
 */
public class SourceFileGenerator {

	private static final Logger logger = LoggerFactory.getLogger(SourceFileGenerator.class);

	private final Path outputFolder;
	private final Set<Path> createdFiles = Sets.newLinkedHashSet();

	public SourceFileGenerator(Path outputFolder) {
		this.outputFolder = Preconditions.checkNotNull(outputFolder).toAbsolutePath().normalize();
	}

	public Path getOutputFolder() {
		return outputFolder;
	}

	public List<Path> getCreatedFiles() {
		return Collections.unmodifiableList(Lists.newArrayList(createdFiles));
	}

	/**
	 * Renders {@code unit} and writes it to {@code relativeName} below the
	 * output folder.
	 *
	 * @return the path of the file
	 */
	public Path createFile(String relativeName, CompilationUnit unit) {
		Path target = outputFolder.resolve(relativeName).normalize();
		Preconditions.checkArgument(target.startsWith(outputFolder),
				"File %s is outside of the output folder %s", relativeName, outputFolder);
		Preconditions.checkArgument(!target.equals(outputFolder),
				"File name '%s' denotes the output folder itself", relativeName);
		String content = unit.render();
		try {
			Files.createDirectories(target.getParent());
			if (Files.isRegularFile(target)
					&& new String(Files.readAllBytes(target), StandardCharsets.UTF_8).equals(content)) {
				logger.debug("Unchanged: {}", target);
			} else {
				Files.write(target, content.getBytes(StandardCharsets.UTF_8));
				logger.debug("Wrote {} ({} chars)", target, content.length());
			}
		} catch (IOException e) {
			throw new UncheckedIOException("Could not write " + target, e);
		}
		createdFiles.add(target);
		return target;
	}

	/**
	 * Deletes the regular files in the output folder that were not created by
	 * this generator.
	 *
	 * @return the deleted files
	 */
	public List<Path> removeOldFiles() {
		if (!Files.isDirectory(outputFolder)) {
			return Collections.emptyList();
		}
		List<Path> old;
		try (Stream<Path> files = Files.walk(outputFolder)) {
			old = files.filter(Files::isRegularFile)
					.filter(p -> !createdFiles.contains(p))
					.collect(Collectors.toList());
		} catch (IOException e) {
			throw new UncheckedIOException("Could not list " + outputFolder, e);
		}
		for (Path p : old) {
			try {
				Files.delete(p);
				logger.debug("Removed old file {}", p);
			} catch (IOException e) {
				throw new UncheckedIOException("Could not delete " + p, e);
			}
		}
		logger.info("{} files generated in {}, {} old files removed", createdFiles.size(), outputFolder, old.size());
		return old;
	}
}
