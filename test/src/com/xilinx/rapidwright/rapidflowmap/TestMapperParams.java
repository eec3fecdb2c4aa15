package com.xilinx.rapidwright.rapidflowmap;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.xilinx.rapidwright.rapidflowmap.mapper.TechnologyMapper;
import com.xilinx.rapidwright.rapidflowmap.network.RandomNetworkFactory;

public class TestMapperParams {

    @Test
    public void testReadFixture() {
        Path paramsPath = RandomNetworkFactory.getResourcePath("/params/mux4.json");
        MapperParams params = new MapperParams(paramsPath);

        Assertions.assertEquals("mux4", params.getDesignName());
        Assertions.assertEquals(3, params.getLutSize());
        Assertions.assertEquals(2, params.getThreadNum());
        Assertions.assertTrue(params.isAreaRecovery());
        Assertions.assertEquals(RandomNetworkFactory.getResourcePath("/networks/mux4.json"), params.getNetworkPath());
        Assertions.assertEquals(paramsPath.getParent().resolve("work").resolve("mux4"), params.getWorkDir());

        TechnologyMapper.Config config = params.getMapperConfig();
        Assertions.assertEquals(3, config.lutSize);
        Assertions.assertEquals(2, config.threadNum);
        Assertions.assertEquals(32, config.maxCutsPerNode);
    }

    @Test
    public void testDefaults(@TempDir Path tempDir) throws IOException {
        Path paramsPath = tempDir.resolve("params.json");
        Files.writeString(paramsPath, "{\"designName\": \"d\", \"networkPath\": \"n.json\", \"workDir\": \"out\", \"lutSize\": 4}");
        MapperParams params = new MapperParams(paramsPath);

        Assertions.assertTrue(params.isAreaRecovery());
        Assertions.assertEquals(10, params.getAreaRecoveryIterations());
        Assertions.assertEquals(32, params.getMaxCutsPerNode());
        Assertions.assertEquals(1, params.getThreadNum());
        Assertions.assertTrue(params.isVerifyEquivalence());
        Assertions.assertEquals(16, params.getMaxVerifyInputs());
        Assertions.assertFalse(params.isVerbose());
        Assertions.assertEquals(tempDir.resolve("n.json"), params.getNetworkPath());
    }

    @Test
    public void testInvalidValues(@TempDir Path tempDir) throws IOException {
        Path noLutSize = tempDir.resolve("noLutSize.json");
        Files.writeString(noLutSize, "{\"designName\": \"d\", \"networkPath\": \"n.json\", \"workDir\": \"out\"}");
        Assertions.assertThrows(InvalidParameterException.class, () -> new MapperParams(noLutSize));

        Path zeroLutSize = tempDir.resolve("zeroLutSize.json");
        Files.writeString(zeroLutSize, "{\"designName\": \"d\", \"networkPath\": \"n.json\", \"workDir\": \"out\", \"lutSize\": 0}");
        Assertions.assertThrows(InvalidParameterException.class, () -> new MapperParams(zeroLutSize));

        Path noName = tempDir.resolve("noName.json");
        Files.writeString(noName, "{\"networkPath\": \"n.json\", \"workDir\": \"out\", \"lutSize\": 4}");
        Assertions.assertThrows(InvalidParameterException.class, () -> new MapperParams(noName));

        Path badThreads = tempDir.resolve("badThreads.json");
        Files.writeString(badThreads, "{\"designName\": \"d\", \"networkPath\": \"n.json\", \"workDir\": \"out\", \"lutSize\": 4, \"threadNum\": 0}");
        Assertions.assertThrows(InvalidParameterException.class, () -> new MapperParams(badThreads));

        Path broken = tempDir.resolve("broken.json");
        Files.writeString(broken, "{\"designName\": [1, 2]}");
        Assertions.assertThrows(InvalidParameterException.class, () -> new MapperParams(broken));

        Assertions.assertThrows(UncheckedIOException.class, () -> new MapperParams(tempDir.resolve("missing.json")));
    }
}
