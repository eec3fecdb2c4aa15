package com.xilinx.rapidwright.rapidflowmap;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import com.xilinx.rapidwright.rapidflowmap.mapper.TechnologyMapper;

public class MapperParams {
    private String designName;
    private Path networkPath;
    private Path workDir;

    // Mapper Parameters
    private Integer lutSize;
    private Boolean areaRecovery = true;
    private Integer areaRecoveryIterations = 10;
    private Integer maxCutsPerNode = 32;
    private Integer threadNum = 1;

    // Verification Parameters
    private Boolean verifyEquivalence = true;
    private Integer maxVerifyInputs = 16;

    private Boolean verbose = false;

    private static class ParamsJson {
        public String designName;
        public String networkPath;
        public String workDir;

        public Integer lutSize;
        public Boolean areaRecovery;
        public Integer areaRecoveryIterations;
        public Integer maxCutsPerNode;
        public Integer threadNum;

        public Boolean verifyEquivalence;
        public Integer maxVerifyInputs;

        public Boolean verbose;
    }

    public MapperParams(Path jsonFilePath) {
        Gson gson = new GsonBuilder().create();
        ParamsJson params;
        try (Reader reader = Files.newBufferedReader(jsonFilePath)) {
            params = gson.fromJson(reader, ParamsJson.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Fail to read parameter file: " + jsonFilePath, e);
        } catch (JsonParseException e) {
            throw new InvalidParameterException("Invalid parameter file " + jsonFilePath + ": " + e.getMessage());
        }
        if (params == null) {
            throw new InvalidParameterException("Empty parameter file: " + jsonFilePath);
        }

        // relative paths are resolved against the directory of the parameter file
        Path baseDir = jsonFilePath.toAbsolutePath().getParent();

        designName = require(params.designName, "designName");
        networkPath = baseDir.resolve(require(params.networkPath, "networkPath")).normalize();
        workDir = baseDir.resolve(require(params.workDir, "workDir")).normalize().resolve(designName);

        lutSize = require(params.lutSize, "lutSize");
        checkPositive(lutSize, "lutSize");

        if (params.areaRecovery != null) {
            this.areaRecovery = params.areaRecovery;
        }
        if (params.areaRecoveryIterations != null) {
            checkPositive(params.areaRecoveryIterations, "areaRecoveryIterations");
            this.areaRecoveryIterations = params.areaRecoveryIterations;
        }
        if (params.maxCutsPerNode != null) {
            checkPositive(params.maxCutsPerNode, "maxCutsPerNode");
            this.maxCutsPerNode = params.maxCutsPerNode;
        }
        if (params.threadNum != null) {
            checkPositive(params.threadNum, "threadNum");
            this.threadNum = params.threadNum;
        }

        if (params.verifyEquivalence != null) {
            this.verifyEquivalence = params.verifyEquivalence;
        }
        if (params.maxVerifyInputs != null) {
            if (params.maxVerifyInputs < 0) {
                throw new InvalidParameterException("maxVerifyInputs must not be negative, got " + params.maxVerifyInputs);
            }
            this.maxVerifyInputs = params.maxVerifyInputs;
        }

        if (params.verbose != null) {
            this.verbose = params.verbose;
        }
    }

    private static <T> T require(T value, String fieldName) {
        if (value == null) {
            throw new InvalidParameterException(fieldName + " not found in parameter file");
        }
        return value;
    }

    private static void checkPositive(int value, String fieldName) {
        if (value < 1) {
            throw new InvalidParameterException(fieldName + " must be at least 1, got " + value);
        }
    }

    public TechnologyMapper.Config getMapperConfig() {
        TechnologyMapper.Config config = new TechnologyMapper.Config(lutSize);
        config.areaRecovery = areaRecovery;
        config.areaRecoveryIterations = areaRecoveryIterations;
        config.maxCutsPerNode = maxCutsPerNode;
        config.threadNum = threadNum;
        return config;
    }

    // getters
    public String getDesignName() {
        return designName;
    }

    public Path getNetworkPath() {
        return networkPath;
    }

    public Path getWorkDir() {
        return workDir;
    }

    public int getLutSize() {
        return lutSize;
    }

    public boolean isAreaRecovery() {
        return areaRecovery;
    }

    public int getAreaRecoveryIterations() {
        return areaRecoveryIterations;
    }

    public int getMaxCutsPerNode() {
        return maxCutsPerNode;
    }

    public int getThreadNum() {
        return threadNum;
    }

    public boolean isVerifyEquivalence() {
        return verifyEquivalence;
    }

    public int getMaxVerifyInputs() {
        return maxVerifyInputs;
    }

    public boolean isVerbose() {
        return verbose;
    }

    // setters
    public void setLutSize(int lutSize) {
        checkPositive(lutSize, "lutSize");
        this.lutSize = lutSize;
    }

    public void setAreaRecovery(boolean areaRecovery) {
        this.areaRecovery = areaRecovery;
    }
}
