package com.xilinx.rapidwright.rapidflowmap.utils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class DirectoryManager {

    private final Path rootDir;

    public DirectoryManager(Path rootDir) {
        this.rootDir = rootDir;
        createDirectories(rootDir);
    }

    public Path getRootDir() {
        return rootDir;
    }

    private static void createDirectories(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Fail to create directory: " + dir, e);
        }
    }
}
