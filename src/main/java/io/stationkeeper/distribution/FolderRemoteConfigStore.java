package io.stationkeeper.distribution;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Remote store backed by a mounted folder (network share, USB drop).
 */
public final class FolderRemoteConfigStore implements RemoteConfigStore {
    private final Path folder;

    public FolderRemoteConfigStore(Path folder) {
        this.folder = folder;
    }

    @Override
    public List<String> listFiles() {
        if (!Files.isDirectory(folder)) {
            throw new DistributionException("remote configuration folder " + folder + " not found");
        }
        List<String> out = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(folder)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path)) {
                    out.add(path.getFileName().toString());
                }
            }
        } catch (IOException e) {
            throw new DistributionException("failed to list " + folder + ": " + e.getMessage(), e);
        }
        out.sort(String::compareTo);
        return out;
    }

    @Override
    public void download(String filename, Path target) {
        Path source = folder.resolve(filename);
        try {
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new DistributionException("failed to copy " + source + " to " + target + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String location() {
        return folder.toString();
    }
}
