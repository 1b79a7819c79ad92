package io.stationkeeper.command;

import io.stationkeeper.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Requests are {@code command_*.txt} files dropped into a folder; the file
 * name is the command id and the content the command text. At most one such
 * file may be present at a time.
 *
 * <p>The name of the last consumed file is kept in {@code previous.txt}, so a
 * file dropped again under the same name is not run twice, restarts included.
 * Results are written next to it as {@code <name>.result.json}.
 */
public final class FileDropCommandChannel implements CommandChannel {
    public static final String MARKER = "previous.txt";
    public static final String REQUEST_PREFIX = "command_";
    public static final String REQUEST_SUFFIX = ".txt";
    public static final String RESULT_SUFFIX = ".result.json";

    private static final Logger LOG = LoggerFactory.getLogger(FileDropCommandChannel.class);

    private final Path folder;

    public FileDropCommandChannel(Path folder) {
        this.folder = folder;
    }

    public Path folder() {
        return folder;
    }

    public static boolean isRequestFile(String filename) {
        return filename.startsWith(REQUEST_PREFIX) && filename.endsWith(REQUEST_SUFFIX);
    }

    /**
     * {@code previous} is not used: the consumed file name is kept in {@code previous.txt}.
     */
    @Override
    public Optional<CommandRequest> poll(CommandRequest previous) {
        ensureFolder();
        List<Path> requests = requestFiles();
        if (requests.isEmpty()) {
            return Optional.empty();
        }
        if (requests.size() > 1) {
            throw new CommandException("found more than one command file ('command_*.txt') in " + folder);
        }
        Path file = requests.get(0);
        String name = file.getFileName().toString();
        if (previous().filter(name::equals).isPresent()) {
            LOG.info("command file {} was already executed, deleting it", name);
            delete(file);
            return Optional.empty();
        }
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CommandException("failed to read command file " + file + ": " + e.getMessage(), e);
        }
        writeAtomically(folder.resolve(MARKER), name);
        delete(file);
        return Optional.of(new CommandRequest(name, text, null));
    }

    @Override
    public void report(CommandResult result) {
        writeAtomically(folder.resolve(result.commandId() + RESULT_SUFFIX), Jsons.toJson(result.toWire()));
    }

    @Override
    public void probe() {
        ensureFolder();
        if (!Files.isWritable(folder)) {
            throw new CommandException("command folder " + folder + " is not writable");
        }
    }

    @Override
    public String describe() {
        return "folder " + folder;
    }

    /**
     * Name of the last consumed request file.
     */
    public Optional<String> previous() {
        Path marker = folder.resolve(MARKER);
        if (!Files.isRegularFile(marker)) {
            return Optional.empty();
        }
        try {
            String value = Files.readString(marker, StandardCharsets.UTF_8).strip();
            return value.isEmpty() ? Optional.empty() : Optional.of(value);
        } catch (IOException e) {
            throw new CommandException("failed to read " + marker + ": " + e.getMessage(), e);
        }
    }

    private List<Path> requestFiles() {
        List<Path> out = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(folder)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path) && isRequestFile(path.getFileName().toString())) {
                    out.add(path);
                }
            }
        } catch (IOException e) {
            throw new CommandException("failed to list " + folder + ": " + e.getMessage(), e);
        }
        out.sort(Path::compareTo);
        return out;
    }

    private void ensureFolder() {
        try {
            Files.createDirectories(folder);
        } catch (IOException e) {
            throw new CommandException("command folder " + folder + " could not be created: " + e.getMessage(), e);
        }
    }

    private void writeAtomically(Path target, String content) {
        Path tmp = target.resolveSibling("." + target.getFileName() + ".tmp");
        try {
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new CommandException("failed to write " + target + ": " + e.getMessage(), e);
        }
    }

    private static void delete(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warn("failed to delete command file {}: {}", file, e.getMessage());
        }
    }
}
