package com.xilinx.rapidwright.rapidflowmap;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;

import com.xilinx.rapidwright.rapidflowmap.network.Network;
import com.xilinx.rapidwright.rapidflowmap.network.NetworkJson;
import com.xilinx.rapidwright.rapidflowmap.utils.DirectoryManager;
import com.xilinx.rapidwright.rapidflowmap.utils.HierarchicalLogger;


public class AbstractApplication {
    protected MapperParams mapperParams;
    protected DirectoryManager dirManager;
    protected HierarchicalLogger logger;

    protected Network inputNetwork;
    protected Map<String, Long> step2ElapsedNanos;

    public AbstractApplication(String jsonFilePath, boolean enableLogger) {
        // read mapper parameters from json file
        Path jsonPath = Path.of(jsonFilePath).toAbsolutePath();
        mapperParams = new MapperParams(jsonPath);

        // setup directory manager
        dirManager = new DirectoryManager(mapperParams.getWorkDir());

        // setup logger
        setupLogger(enableLogger);

        step2ElapsedNanos = new LinkedHashMap<>();
    }

    protected void setupLogger(boolean enableLogger) {
        Path logFilePath = dirManager.getRootDir().resolve("rapidFlowMap.log");

        if (enableLogger) {
            Level logLevel = mapperParams.isVerbose() ? Level.FINE : Level.INFO;
            logger = HierarchicalLogger.createLogger("application", logFilePath, true, logLevel);
        } else {
            logger = HierarchicalLogger.createPseduoLogger("application");
        }

        logger.info("Setup hierarchical logger for RapidFlowMap successfully");
    }

    protected void readInputNetwork() {
        logger.infoHeader("Read Network");
        logger.info("Reading network description: " + mapperParams.getNetworkPath().toString());

        inputNetwork = NetworkJson.read(mapperParams.getNetworkPath());
        inputNetwork.printNetworkInfo(logger);

        logger.info("Read network description successfully");
    }

    protected void runTimed(String stepName, Runnable step) {
        long startTime = System.nanoTime();
        step.run();
        long elapsed = System.nanoTime() - startTime;
        step2ElapsedNanos.merge(stepName, elapsed, Long::sum);
        logger.info(String.format("Elapsed time of %s: %.3fs", stepName, elapsed / 1e9));
    }

    protected String getRuntimeReport() {
        StringBuilder builder = new StringBuilder("Runtime Summary:");
        long total = 0;
        for (Map.Entry<String, Long> entry : step2ElapsedNanos.entrySet()) {
            builder.append(String.format("\n  %-16s %.3fs", entry.getKey(), entry.getValue() / 1e9));
            total += entry.getValue();
        }
        builder.append(String.format("\n  %-16s %.3fs", "Total", total / 1e9));
        return builder.toString();
    }
}
