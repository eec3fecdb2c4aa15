package com.xilinx.rapidwright.rapidflowmap.utils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class TestDirectoryManager {

    @Test
    public void testCreateNestedRootDir(@TempDir Path tempDir) {
        Path rootDir = tempDir.resolve("work").resolve("design");
        DirectoryManager dirManager = new DirectoryManager(rootDir);
        Assertions.assertEquals(rootDir, dirManager.getRootDir());
        Assertions.assertTrue(Files.isDirectory(rootDir));
    }

    @Test
    public void testExistingRootDir(@TempDir Path tempDir) throws IOException {
        Path marker = Files.writeString(tempDir.resolve("keep.txt"), "keep");
        DirectoryManager dirManager = new DirectoryManager(tempDir);
        Assertions.assertEquals(tempDir, dirManager.getRootDir());
        Assertions.assertEquals("keep", Files.readString(marker));
    }
}
