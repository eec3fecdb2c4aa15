package com.xilinx.rapidwright.rapidflowmap.mapper;

import com.xilinx.rapidwright.rapidflowmap.InvalidParameterException;
import com.xilinx.rapidwright.rapidflowmap.network.Network;
import com.xilinx.rapidwright.rapidflowmap.utils.HierarchicalLogger;

/**
 * Entry point of the mapping engine: FlowMap labeling, depth-optimal emission and optional FlowMap-r.
 */
public class TechnologyMapper {
    public static class Config {
        public int lutSize;
        public boolean areaRecovery;
        public int areaRecoveryIterations;
        public int maxCutsPerNode;
        public int threadNum;

        public Config(int lutSize) {
            this.lutSize = lutSize;
            this.areaRecovery = true;
            this.areaRecoveryIterations = 10;
            this.maxCutsPerNode = 32;
            this.threadNum = 1;
        }

        public Config() {
            this(6);
        }

        @Override
        public String toString() {
            return String.format("Mapper Config: K=%d AreaRecovery=%b Iterations=%d MaxCuts=%d Threads=%d",
                lutSize, areaRecovery, areaRecoveryIterations, maxCutsPerNode, threadNum);
        }
    }

    private final HierarchicalLogger logger;
    private final Config config;

    public TechnologyMapper(HierarchicalLogger logger, Config config) {
        if (config.lutSize < 1) {
            throw new InvalidParameterException("LUT size must be at least 1, got " + config.lutSize);
        }
        if (config.areaRecoveryIterations < 1) {
            throw new InvalidParameterException("areaRecoveryIterations must be at least 1, got " + config.areaRecoveryIterations);
        }
        if (config.maxCutsPerNode < 1) {
            throw new InvalidParameterException("maxCutsPerNode must be at least 1, got " + config.maxCutsPerNode);
        }
        if (config.threadNum < 1) {
            throw new InvalidParameterException("threadNum must be at least 1, got " + config.threadNum);
        }
        this.logger = logger;
        this.config = config;
    }

    public Config getConfig() {
        return config;
    }

    public MappingState label(Network network) {
        return new LabelingEngine(logger, config.lutSize, config.threadNum).run(network);
    }

    public MappedNetwork mapForDepth(MappingState state) {
        return new MappingEmitter(logger).emit(state);
    }

    public MappedNetwork recoverArea(MappingState state, MappedNetwork depthOptimalCover) {
        return new AreaRecovery(logger, config.areaRecoveryIterations, config.maxCutsPerNode).run(state, depthOptimalCover);
    }

    public MappedNetwork run(Network network) {
        logger.info(config.toString());
        MappingState state = label(network);
        MappedNetwork mappedNetwork = mapForDepth(state);
        if (config.areaRecovery) {
            mappedNetwork = recoverArea(state, mappedNetwork);
        }
        return mappedNetwork;
    }
}
